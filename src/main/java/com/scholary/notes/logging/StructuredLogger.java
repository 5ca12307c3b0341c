package com.scholary.notes.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Job context ({@code jobId}, {@code owner}, {@code action}, {@code stage}) is set on whichever
 * thread runs a stage and cleared when the stage ends. Event methods add their own fields only for
 * the duration of one log call.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage) {
    try {
      MDC.put("event_type", "stage_started");
      logger.info("Stage started: stage={}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String stage, long durationMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("durationMs", String.valueOf(durationMs));
      logger.info("Stage finished: stage={}, duration={}ms", stage, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /**
   * Log stage failed event.
   *
   * <p>Fatal failures are logged at ERROR, soft ones at WARN since the job carries on.
   */
  public void logStageFailed(String stage, boolean fatal, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("fatal", String.valueOf(fatal));
      MDC.put("errorType", errorType);
      if (fatal) {
        logger.error("Stage failed: stage={}, error={}, message={}", stage, errorType, message);
      } else {
        logger.warn("Stage degraded: stage={}, error={}, message={}", stage, errorType, message);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log job completed event. */
  public void logJobCompleted(
      String jobId,
      long durationMs,
      boolean hasNotes,
      boolean hasTimestampedNotes,
      boolean creditsDeducted) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("durationMs", String.valueOf(durationMs));
      logger.info(
          "Job completed: jobId={}, duration={}ms, hasNotes={}, hasTimestampedNotes={},"
              + " creditsDeducted={}",
          jobId,
          durationMs,
          hasNotes,
          hasTimestampedNotes,
          creditsDeducted);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failed event. */
  public void logJobFailed(String jobId, long durationMs, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("durationMs", String.valueOf(durationMs));
      MDC.put("errorType", errorType);
      logger.error(
          "Job failed: jobId={}, duration={}ms, error={}, message={}",
          jobId,
          durationMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String owner, String action) {
    MDC.put("jobId", jobId);
    putOrRemove("owner", owner);
    putOrRemove("action", action);
  }

  /** Set the current stage in MDC. */
  public static void setStage(String stage) {
    MDC.put("stage", stage);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("owner");
    MDC.remove("action");
    MDC.remove("stage");
  }

  private static void putOrRemove(String key, String value) {
    if (value == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, value);
    }
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("durationMs");
    MDC.remove("fatal");
    MDC.remove("errorType");
  }
}
