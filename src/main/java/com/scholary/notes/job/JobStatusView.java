package com.scholary.notes.job;

import java.util.Map;

/** Read-only view of a job for status polling. */
public record JobStatusView(
    String jobId,
    JobStatus status,
    String progress,
    String stage,
    Map<String, Object> result,
    String error,
    boolean creditsDeducted,
    boolean recovered) {

  static JobStatusView of(Job job) {
    return new JobStatusView(
        job.jobId(),
        job.status(),
        job.progress(),
        job.stage(),
        job.result(),
        job.error(),
        job.creditsDeducted(),
        job.recovered());
  }
}
