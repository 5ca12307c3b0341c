package com.scholary.notes.job;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job registry journal.
 *
 * <p>The journal is compacted once it holds more than {@code compactionFactor} records per live
 * job and at least {@code compactionMinRecords} records overall.
 */
@ConfigurationProperties(prefix = "registry")
@Validated
public record RegistryProperties(
    @NotBlank String journalPath,
    @Positive int compactionFactor,
    @Positive int compactionMinRecords) {}
