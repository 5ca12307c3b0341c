package com.scholary.notes.api;

import com.scholary.notes.job.JobStatus;
import com.scholary.notes.job.JobStatusView;
import java.util.Map;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a job and, once it completed, the result summary.
 */
public record JobStatusResponse(
    String jobId,
    JobStatus status,
    String progress,
    String stage,
    Map<String, Object> result,
    String error,
    boolean creditsDeducted,
    boolean recovered) {

  static JobStatusResponse from(JobStatusView view) {
    return new JobStatusResponse(
        view.jobId(),
        view.status(),
        view.progress(),
        view.stage(),
        view.result(),
        view.error(),
        view.creditsDeducted(),
        view.recovered());
  }
}
