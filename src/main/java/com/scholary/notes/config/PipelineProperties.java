package com.scholary.notes.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job processing.
 *
 * <p>Controls temp storage, worker pool sizing, input limits and per-plan quotas.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String tempDir,
    @Positive int workerThreads,
    @Positive int workerQueueSize,
    @Positive int pipelineThreads,
    boolean cleanupTempFiles,
    @Positive long maxInputBytes,
    @Valid @NotNull QuotaProperties quota) {

  /**
   * Media duration limits per plan.
   *
   * @param defaultPlan plan for owners without an assignment
   * @param plans plan name to maximum media duration in minutes
   * @param assignments owner to plan name
   */
  public record QuotaProperties(
      @NotBlank String defaultPlan,
      @NotNull Map<String, Integer> plans,
      Map<String, String> assignments) {

    public String planOf(String owner) {
      if (assignments == null || owner == null) {
        return defaultPlan;
      }
      return assignments.getOrDefault(owner, defaultPlan);
    }

    /** Limit in minutes for the owner's plan, falling back to the default plan's limit. */
    public Integer limitMinutesOf(String owner) {
      Integer limit = plans.get(planOf(owner));
      return limit != null ? limit : plans.get(defaultPlan);
    }
  }
}
