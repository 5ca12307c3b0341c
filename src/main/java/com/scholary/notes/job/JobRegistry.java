package com.scholary.notes.job;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Durable registry of job state.
 *
 * <p>Jobs live in a {@link ConcurrentHashMap} of immutable {@link Job} snapshots. Each mutation
 * runs inside {@code computeIfPresent}, so mutations of one job are serialized, and appends the
 * new snapshot to the {@link JobJournal} before it becomes visible. On startup the journal is
 * replayed, so a job created before a restart is still known after it.
 *
 * <p>Unknown ids and status regressions are logged and ignored: the orchestrator must never fail
 * a job because a status write raced with another one.
 *
 * <p>Lookups of unknown ids fall back to {@link ArtifactReconciler}, which may rebuild a reduced
 * entry from stored artifacts.
 */
@Repository
public class JobRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRegistry.class);

  private final Map<String, Job> jobs = new ConcurrentHashMap<>();
  private final JobJournal journal;
  private final ArtifactReconciler reconciler;
  private final RegistryProperties properties;
  private final Clock clock;

  // mutations share the read lock, compaction takes the write lock for a consistent snapshot
  private final ReadWriteLock compactionLock = new ReentrantReadWriteLock();

  public JobRegistry(
      JobJournal journal,
      ArtifactReconciler reconciler,
      RegistryProperties properties,
      Clock clock) {
    this.journal = journal;
    this.reconciler = reconciler;
    this.properties = properties;
    this.clock = clock;

    jobs.putAll(journal.replay());
    LOGGER.info("Job registry loaded {} jobs", jobs.size());
  }

  /**
   * Create a job in CREATED status.
   *
   * @param owner submitting identity, null for anonymous
   * @param actionType what the job is for, may be null
   * @return the new job id
   */
  public String create(String owner, ActionType actionType) {
    String jobId = UUID.randomUUID().toString();
    Job job = Job.created(jobId, owner, actionType, clock.instant());

    compactionLock.readLock().lock();
    try {
      jobs.compute(
          jobId,
          (id, existing) -> {
            journal.append(job);
            return job;
          });
    } finally {
      compactionLock.readLock().unlock();
    }

    LOGGER.info("Created job: jobId={}, owner={}, actionType={}", jobId, owner, actionType);
    maybeCompact();
    return jobId;
  }

  public void updateStatus(String jobId, JobStatus status, String progress) {
    updateStatus(jobId, status, progress, Map.of());
  }

  /**
   * Move a job to a new status and merge result fields.
   *
   * @param jobId the job
   * @param status the target status
   * @param progress new progress text, or null to keep the current one
   * @param fields result fields to merge
   */
  public void updateStatus(
      String jobId, JobStatus status, String progress, Map<String, Object> fields) {
    Objects.requireNonNull(status, "status");
    mutate(
        jobId,
        "updateStatus",
        current -> {
          if (!current.status().canTransitionTo(status)) {
            LOGGER.warn(
                "Ignoring status regression: jobId={}, {} -> {}", jobId, current.status(), status);
            return current;
          }
          Job next = current.withStatus(status, progress, clock.instant());
          return fields.isEmpty() ? next : next.withResultFields(fields, clock.instant());
        });
  }

  /** Record the stage a job is entering; moves the job to PROCESSING. */
  public void updateStage(String jobId, String stage, String progress) {
    mutate(
        jobId,
        "updateStage",
        current -> {
          if (!current.status().canTransitionTo(JobStatus.PROCESSING)) {
            LOGGER.warn(
                "Ignoring stage update on finished job: jobId={}, status={}, stage={}",
                jobId,
                current.status(),
                stage);
            return current;
          }
          return current.withStage(stage, progress, clock.instant());
        });
  }

  public void updateProgress(String jobId, String message) {
    mutate(jobId, "updateProgress", current -> current.withProgress(message, clock.instant()));
  }

  public void markCreditsDeducted(String jobId, boolean deducted) {
    mutate(
        jobId,
        "markCreditsDeducted",
        current -> current.withCreditsDeducted(deducted, clock.instant()));
  }

  /** Terminal success; merges the result map into the job's result. */
  public void complete(String jobId, Map<String, Object> result) {
    updateStatus(jobId, JobStatus.COMPLETED, "Processing completed!", result);
  }

  /** Terminal failure. */
  public void fail(String jobId, String error) {
    mutate(
        jobId,
        "fail",
        current -> {
          if (current.status().isTerminal()) {
            LOGGER.warn(
                "Ignoring failure on finished job: jobId={}, status={}, error={}",
                jobId,
                current.status(),
                error);
            return current;
          }
          return current.withError(error, clock.instant());
        });
  }

  /**
   * Look up a job, reconciling from artifacts when the registry has no record.
   *
   * @param jobId the job id
   * @return the current snapshot, if known or recoverable
   */
  public Optional<Job> get(String jobId) {
    if (jobId == null) {
      return Optional.empty();
    }
    Job job = jobs.get(jobId);
    if (job != null) {
      return Optional.of(job);
    }
    return reconcile(jobId);
  }

  public boolean exists(String jobId) {
    return get(jobId).isPresent();
  }

  /** Jobs submitted by an owner, newest first. */
  public List<Job> findByOwner(String owner) {
    if (owner == null) {
      return List.of();
    }
    List<Job> owned = new ArrayList<>();
    for (Job job : jobs.values()) {
      if (owner.equals(job.owner())) {
        owned.add(job);
      }
    }
    owned.sort(Comparator.comparing(Job::createdAt).reversed());
    return Collections.unmodifiableList(owned);
  }

  public int size() {
    return jobs.size();
  }

  private Optional<Job> reconcile(String jobId) {
    Optional<Job> recovered = reconciler.reconcile(jobId);
    if (recovered.isEmpty()) {
      return Optional.empty();
    }

    Job stored;
    compactionLock.readLock().lock();
    try {
      stored =
          jobs.computeIfAbsent(
              jobId,
              id -> {
                journal.append(recovered.get());
                return recovered.get();
              });
    } finally {
      compactionLock.readLock().unlock();
    }
    maybeCompact();
    return Optional.of(stored);
  }

  private void mutate(String jobId, String operation, UnaryOperator<Job> change) {
    Job updated;
    compactionLock.readLock().lock();
    try {
      updated =
          jobs.computeIfPresent(
              jobId,
              (id, current) -> {
                Job next = change.apply(current);
                if (next != current) {
                  journal.append(next);
                }
                return next;
              });
    } finally {
      compactionLock.readLock().unlock();
    }

    if (updated == null) {
      LOGGER.warn("{} on unknown job ignored: jobId={}", operation, jobId);
      return;
    }
    maybeCompact();
  }

  private void maybeCompact() {
    int threshold =
        Math.max(properties.compactionMinRecords(), properties.compactionFactor() * jobs.size());
    if (journal.recordCount() <= threshold) {
      return;
    }

    compactionLock.writeLock().lock();
    try {
      // re-check, another thread may have compacted while we waited
      if (journal.recordCount() > threshold) {
        journal.compact(new ArrayList<>(jobs.values()));
      }
    } finally {
      compactionLock.writeLock().unlock();
    }
  }
}
