package com.scholary.notes.pipeline;

import com.scholary.notes.alignment.TimestampMapping;
import com.scholary.notes.job.ActionType;
import com.scholary.notes.transcription.TranscriptionResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working state of one job as it moves through the stages.
 *
 * <p>Stages of one job run strictly one after another, each handing over to the next through the
 * future chain, so the fields need no locking.
 */
public class JobContext {

  private final String jobId;
  private final String owner;
  private final ActionType actionType;
  private final PipelineInput input;
  private final long startedNanos = System.nanoTime();
  private final List<Path> tempFiles = new ArrayList<>();

  private Path sourceFile;
  private Path audioFile;
  private TranscriptionResult transcription;
  private String documentText;
  private String notes;
  private TimestampMapping mapping;
  private boolean creditsDeducted;

  public JobContext(String jobId, String owner, ActionType actionType, PipelineInput input) {
    this.jobId = jobId;
    this.owner = owner;
    this.actionType = actionType;
    this.input = input;
  }

  public String jobId() {
    return jobId;
  }

  public String owner() {
    return owner;
  }

  public ActionType actionType() {
    return actionType;
  }

  public PipelineInput input() {
    return input;
  }

  public InputKind kind() {
    return input.kind();
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }

  public List<Path> tempFiles() {
    return Collections.unmodifiableList(tempFiles);
  }

  public void addTempFile(Path file) {
    tempFiles.add(file);
  }

  public Path sourceFile() {
    return sourceFile;
  }

  public void setSourceFile(Path sourceFile) {
    this.sourceFile = sourceFile;
  }

  public Path audioFile() {
    return audioFile;
  }

  public void setAudioFile(Path audioFile) {
    this.audioFile = audioFile;
  }

  public TranscriptionResult transcription() {
    return transcription;
  }

  public void setTranscription(TranscriptionResult transcription) {
    this.transcription = transcription;
  }

  public String documentText() {
    return documentText;
  }

  public void setDocumentText(String documentText) {
    this.documentText = documentText;
  }

  public String notes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public boolean hasNotes() {
    return notes != null && !notes.isBlank();
  }

  public TimestampMapping mapping() {
    return mapping;
  }

  public void setMapping(TimestampMapping mapping) {
    this.mapping = mapping;
  }

  public boolean hasTimestampedNotes() {
    return mapping != null && mapping.totalSections() > 0;
  }

  public boolean creditsDeducted() {
    return creditsDeducted;
  }

  public void setCreditsDeducted(boolean creditsDeducted) {
    this.creditsDeducted = creditsDeducted;
  }

  /** Text the notes are generated from: the transcript, or the document's text. */
  public String sourceText() {
    if (kind().isMedia()) {
      return transcription != null ? transcription.text() : null;
    }
    return documentText;
  }
}
