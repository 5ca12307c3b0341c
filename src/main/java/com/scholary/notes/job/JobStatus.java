package com.scholary.notes.job;

/**
 * Lifecycle status of a job.
 *
 * <p>Transitions are monotonic: {@code CREATED -> PROCESSING -> COMPLETED | ERROR}. A job never
 * leaves a terminal status and never returns to {@code CREATED}.
 */
public enum JobStatus {
  CREATED,
  PROCESSING,
  COMPLETED,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  /**
   * Check whether moving from this status to {@code next} keeps the lifecycle monotonic.
   *
   * @param next the requested status
   * @return true if the transition is allowed
   */
  public boolean canTransitionTo(JobStatus next) {
    if (isTerminal()) {
      return false;
    }
    return next != CREATED || this == CREATED;
  }
}
