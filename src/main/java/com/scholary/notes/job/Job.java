package com.scholary.notes.job;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a job's state.
 *
 * <p>The registry replaces the snapshot on every mutation, so callers can hold on to one without
 * seeing it change underneath them. The same record is the unit written to the journal.
 *
 * @param jobId opaque job id
 * @param status lifecycle status
 * @param progress human-readable progress text
 * @param stage current pipeline stage, or null before processing starts
 * @param owner identity that submitted the job, or null when anonymous or unknown
 * @param actionType what the job was submitted for, may be null
 * @param creditsDeducted whether usage was charged for this job
 * @param recovered true when the entry was rebuilt from artifacts after losing its record
 * @param createdAt creation time
 * @param updatedAt time of the last mutation
 * @param result stage outputs, merged as the job progresses
 * @param error error text for failed jobs
 */
public record Job(
    String jobId,
    JobStatus status,
    String progress,
    String stage,
    String owner,
    ActionType actionType,
    boolean creditsDeducted,
    boolean recovered,
    Instant createdAt,
    Instant updatedAt,
    Map<String, Object> result,
    String error) {

  public Job {
    result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
  }

  static Job created(String jobId, String owner, ActionType actionType, Instant now) {
    return new Job(
        jobId,
        JobStatus.CREATED,
        "Job created...",
        null,
        owner,
        actionType,
        false,
        false,
        now,
        now,
        Map.of(),
        null);
  }

  /** Moving to ERROR clears {@code creditsDeducted}, as {@link #withError} does. */
  Job withStatus(JobStatus newStatus, String newProgress, Instant now) {
    return new Job(
        jobId,
        newStatus,
        newProgress != null ? newProgress : progress,
        stage,
        owner,
        actionType,
        newStatus != JobStatus.ERROR && creditsDeducted,
        recovered,
        createdAt,
        now,
        result,
        error);
  }

  Job withStage(String newStage, String newProgress, Instant now) {
    return new Job(
        jobId,
        JobStatus.PROCESSING,
        newProgress != null ? newProgress : progress,
        newStage,
        owner,
        actionType,
        creditsDeducted,
        recovered,
        createdAt,
        now,
        result,
        error);
  }

  Job withProgress(String newProgress, Instant now) {
    return withStatus(status, newProgress, now);
  }

  Job withResultFields(Map<String, Object> fields, Instant now) {
    Map<String, Object> merged = new LinkedHashMap<>(result);
    merged.putAll(fields);
    return new Job(
        jobId,
        status,
        progress,
        stage,
        owner,
        actionType,
        creditsDeducted,
        recovered,
        createdAt,
        now,
        merged,
        error);
  }

  Job withCreditsDeducted(boolean deducted, Instant now) {
    return new Job(
        jobId,
        status,
        progress,
        stage,
        owner,
        actionType,
        deducted && status != JobStatus.ERROR,
        recovered,
        createdAt,
        now,
        result,
        error);
  }

  /** Failed jobs are never charged: billing is the last step before completion. */
  Job withError(String errorText, Instant now) {
    return new Job(
        jobId,
        JobStatus.ERROR,
        "Processing failed",
        stage,
        owner,
        actionType,
        false,
        recovered,
        createdAt,
        now,
        result,
        errorText);
  }
}
