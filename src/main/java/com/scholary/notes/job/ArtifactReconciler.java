package com.scholary.notes.job;

import com.scholary.notes.artifact.ArtifactStore;
import com.scholary.notes.artifact.ArtifactType;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rebuilds a job entry from its artifacts when the registry has no record of it.
 *
 * <p>The rebuilt entry has reduced fidelity: the owner is unknown, the job is assumed to have been
 * charged, and the only result fields are whether notes and timestamped notes exist. It is flagged
 * {@code recovered=true} so callers can tell it apart from a first-hand record.
 */
@Component
public class ArtifactReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactReconciler.class);

  private static final Pattern JOB_ID =
      Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  private final ArtifactStore artifactStore;
  private final Clock clock;

  public ArtifactReconciler(ArtifactStore artifactStore, Clock clock) {
    this.artifactStore = artifactStore;
    this.clock = clock;
  }

  /**
   * Probe the artifact store for a job.
   *
   * @param jobId the id the registry doesn't know
   * @return a recovered COMPLETED entry, or empty when no artifact exists or the store can't be
   *     probed
   */
  public Optional<Job> reconcile(String jobId) {
    if (jobId == null || !JOB_ID.matcher(jobId).matches()) {
      return Optional.empty();
    }

    try {
      if (!artifactStore.existsAny(jobId)) {
        return Optional.empty();
      }

      boolean hasNotes = artifactStore.exists(jobId, ArtifactType.NOTES_MARKDOWN);
      boolean hasTimestampedNotes = artifactStore.exists(jobId, ArtifactType.TIMESTAMPED_JSON);

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("hasNotes", hasNotes);
      result.put("hasTimestampedNotes", hasTimestampedNotes);

      Instant now = clock.instant();
      Job recovered =
          new Job(
              jobId,
              JobStatus.COMPLETED,
              "Recovered from stored artifacts",
              null,
              null,
              null,
              true,
              true,
              now,
              now,
              result,
              null);

      LOGGER.info(
          "Reconciled job from artifacts: jobId={}, hasNotes={}, hasTimestampedNotes={}",
          jobId,
          hasNotes,
          hasTimestampedNotes);
      return Optional.of(recovered);

    } catch (RuntimeException e) {
      LOGGER.warn("Artifact probe failed for jobId={}: {}", jobId, e.getMessage());
      return Optional.empty();
    }
  }
}
