package com.scholary.notes.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only journal of job snapshots.
 *
 * <p>Every registry mutation appends one JSON line holding the full snapshot of the mutated job.
 * Replaying the file keeps the last record per job id. Appends and compaction share one lock, so
 * concurrent writers never interleave partial lines.
 *
 * <p>Format (one record per line):
 *
 * <pre>
 * {"jobId":"...","status":"PROCESSING","progress":"Transcribing audio...", ...}
 * {"jobId":"...","status":"COMPLETED", ...}
 * </pre>
 */
public class JobJournal {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobJournal.class);

  private final Path journalFile;
  private final ObjectWriter writer;
  private final ObjectReader reader;
  private final Object lock = new Object();

  private int recordCount;

  public JobJournal(Path journalFile, ObjectMapper objectMapper) {
    this.journalFile = journalFile;
    this.writer = objectMapper.writerFor(Job.class).without(SerializationFeature.INDENT_OUTPUT);
    this.reader = objectMapper.readerFor(Job.class);
  }

  /**
   * Replay the journal into a map of the latest snapshot per job id.
   *
   * <p>Corrupt lines are skipped. If the file can't be read at all the registry starts empty
   * rather than failing startup.
   *
   * @return latest snapshot per job id, in first-seen order
   */
  public Map<String, Job> replay() {
    Map<String, Job> jobs = new LinkedHashMap<>();
    synchronized (lock) {
      recordCount = 0;
      if (!Files.exists(journalFile)) {
        LOGGER.info("No job journal at {}, starting with an empty registry", journalFile);
        return jobs;
      }

      List<String> lines;
      try {
        lines = Files.readAllLines(journalFile, StandardCharsets.UTF_8);
      } catch (IOException e) {
        LOGGER.error("Failed to read job journal {}, starting with an empty registry", journalFile, e);
        return jobs;
      }

      int skipped = 0;
      for (String line : lines) {
        if (line.isBlank()) {
          continue;
        }
        try {
          Job job = reader.readValue(line);
          if (job == null || job.jobId() == null || job.status() == null) {
            skipped++;
            continue;
          }
          jobs.put(job.jobId(), job);
          recordCount++;
        } catch (IOException e) {
          skipped++;
        }
      }

      if (skipped > 0) {
        LOGGER.warn("Skipped {} unreadable journal records in {}", skipped, journalFile);
      }
      LOGGER.info(
          "Replayed job journal: {} records, {} jobs, file={}", recordCount, jobs.size(), journalFile);
    }
    return jobs;
  }

  /**
   * Append one snapshot.
   *
   * @param job the snapshot to persist
   * @throws UncheckedIOException if the write fails
   */
  public void append(Job job) {
    synchronized (lock) {
      try {
        ensureParentDirectory();
        String line = writer.writeValueAsString(job) + System.lineSeparator();
        Files.writeString(
            journalFile,
            line,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND,
            StandardOpenOption.WRITE);
        recordCount++;
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to append to job journal " + journalFile, e);
      }
    }
  }

  /**
   * Rewrite the journal with exactly one record per live job.
   *
   * <p>The new content goes to a sibling temp file which then replaces the journal atomically.
   *
   * @param jobs the live snapshots
   */
  public void compact(Collection<Job> jobs) {
    synchronized (lock) {
      Path tempFile = journalFile.resolveSibling(journalFile.getFileName() + ".compacting");
      try {
        ensureParentDirectory();
        try (BufferedWriter out = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
          for (Job job : jobs) {
            out.write(writer.writeValueAsString(job));
            out.newLine();
          }
        }
        Files.move(
            tempFile,
            journalFile,
            StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
        LOGGER.info("Compacted job journal: {} -> {} records", recordCount, jobs.size());
        recordCount = jobs.size();
      } catch (IOException e) {
        LOGGER.error("Failed to compact job journal {}", journalFile, e);
      }
    }
  }

  public int recordCount() {
    synchronized (lock) {
      return recordCount;
    }
  }

  private void ensureParentDirectory() throws IOException {
    Path parent = journalFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
