package com.scholary.notes.job;

import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/** Status read API over the registry. */
@Service
public class JobStatusService {

  private final JobRegistry registry;

  public JobStatusService(JobRegistry registry) {
    this.registry = registry;
  }

  public Optional<JobStatusView> status(String jobId) {
    return registry.get(jobId).map(JobStatusView::of);
  }

  public List<JobStatusView> jobsOf(String owner) {
    return registry.findByOwner(owner).stream().map(JobStatusView::of).toList();
  }
}
