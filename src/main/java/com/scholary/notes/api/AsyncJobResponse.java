package com.scholary.notes.api;

/**
 * Response for a submitted job.
 *
 * <p>Returns the job ID and the URL to poll for its status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
