package com.scholary.notes.pipeline;

import com.scholary.notes.alignment.TimestampAlignmentEngine;
import com.scholary.notes.alignment.TimestampMapping;
import com.scholary.notes.config.PipelineProperties;
import com.scholary.notes.credit.CreditDecision;
import com.scholary.notes.credit.CreditLedger;
import com.scholary.notes.credit.LedgerException;
import com.scholary.notes.job.ActionType;
import com.scholary.notes.job.Job;
import com.scholary.notes.job.JobRegistry;
import com.scholary.notes.logging.StructuredLogger;
import com.scholary.notes.media.TempFileCleaner;
import com.scholary.notes.notes.NotesGenerator;
import com.scholary.notes.transcription.TranscriptionResult;
import com.scholary.notes.transcription.TranscriptionService;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs a job through its stages.
 *
 * <p>Each job is one {@code CompletableFuture} chain. The heavy stages (extraction, transcription,
 * note generation, alignment) run on the bounded stage pool; acquisition, persistence, billing
 * and completion run on the pipeline executor. No thread blocks waiting for another stage.
 *
 * <p>Fatal stage failures skip the rest of the chain and are recorded once, at the end, as the
 * job's error. Soft failures (notes unavailable, alignment, billing) are logged and the job
 * completes without that stage's output. Billing happens only after notes were generated, so a
 * failed or note-less job is never charged.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final int TRANSCRIPT_EXCERPT_CHARS = 500;
  private static final int NOTES_PREVIEW_CHARS = 200;

  private final JobRegistry registry;
  private final InputAcquirer inputAcquirer;
  private final QuotaValidator quotaValidator;
  private final ContentExtractor contentExtractor;
  private final TranscriptionService transcriptionService;
  private final NotesGenerator notesGenerator;
  private final TimestampAlignmentEngine alignmentEngine;
  private final ArtifactWriter artifactWriter;
  private final CreditLedger creditLedger;
  private final Executor stageExecutor;
  private final Executor pipelineExecutor;
  private final boolean cleanupTempFiles;

  public PipelineOrchestrator(
      JobRegistry registry,
      InputAcquirer inputAcquirer,
      QuotaValidator quotaValidator,
      ContentExtractor contentExtractor,
      TranscriptionService transcriptionService,
      NotesGenerator notesGenerator,
      TimestampAlignmentEngine alignmentEngine,
      ArtifactWriter artifactWriter,
      CreditLedger creditLedger,
      @Qualifier("stageExecutor") Executor stageExecutor,
      @Qualifier("pipelineExecutor") Executor pipelineExecutor,
      PipelineProperties properties) {
    this.registry = registry;
    this.inputAcquirer = inputAcquirer;
    this.quotaValidator = quotaValidator;
    this.contentExtractor = contentExtractor;
    this.transcriptionService = transcriptionService;
    this.notesGenerator = notesGenerator;
    this.alignmentEngine = alignmentEngine;
    this.artifactWriter = artifactWriter;
    this.creditLedger = creditLedger;
    this.stageExecutor = stageExecutor;
    this.pipelineExecutor = pipelineExecutor;
    this.cleanupTempFiles = properties.cleanupTempFiles();
  }

  /**
   * Create a job and start processing it in the background.
   *
   * @param owner submitting identity, null for anonymous
   * @param actionType billed action, null to derive it from the input kind
   * @param input where the input comes from
   * @return the new job id
   */
  public String submit(String owner, ActionType actionType, PipelineInput input) {
    ActionType action = actionType != null ? actionType : input.kind().defaultActionType();
    String jobId = registry.create(owner, action);
    LOGGER.info("Submitted job: jobId={}, input={}", jobId, input);
    process(jobId, input);
    return jobId;
  }

  /**
   * Process an existing job.
   *
   * <p>The returned future completes normally once the job reached COMPLETED or ERROR and its
   * temporary files were cleaned up.
   *
   * @param jobId a job created in the registry
   * @param input the job's input
   * @return completion of the whole chain
   * @throws IllegalArgumentException if the registry doesn't know the job
   */
  public CompletableFuture<Void> process(String jobId, PipelineInput input) {
    Job job =
        registry
            .get(jobId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId));
    JobContext context = new JobContext(jobId, job.owner(), job.actionType(), input);

    CompletableFuture<Void> chain;
    try {
      chain =
          CompletableFuture.runAsync(() -> acquire(context), pipelineExecutor)
              .thenRunAsync(() -> extract(context), stageExecutor)
              .thenRunAsync(() -> transcribe(context), stageExecutor)
              .thenRunAsync(() -> generateNotes(context), stageExecutor)
              .thenRunAsync(() -> align(context), stageExecutor)
              .thenRunAsync(() -> persist(context), pipelineExecutor)
              .thenRunAsync(() -> charge(context), pipelineExecutor)
              .thenRunAsync(() -> complete(context), pipelineExecutor);
    } catch (RejectedExecutionException e) {
      chain = CompletableFuture.failedFuture(e);
    }

    return chain.handle(
        (ignored, error) -> {
          if (error != null) {
            recordFailure(context, unwrap(error));
          }
          cleanup(context);
          return null;
        });
  }

  private void acquire(JobContext context) {
    runStage(
        context,
        Stage.ACQUIRE,
        () -> {
          inputAcquirer.acquire(context);
          quotaValidator.validate(context);
        });
  }

  private void extract(JobContext context) {
    runStage(context, Stage.EXTRACT, () -> contentExtractor.extract(context));
  }

  private void transcribe(JobContext context) {
    if (!context.kind().isMedia()) {
      return;
    }
    runStage(
        context,
        Stage.TRANSCRIBE,
        () -> {
          TranscriptionResult result = transcriptionService.transcribe(context.audioFile());
          context.setTranscription(result);
          LOGGER.info(
              "Transcribed: language={}, segments={}, chars={}",
              result.language(),
              result.segments().size(),
              result.text().length());
        });
  }

  private void generateNotes(JobContext context) {
    runStage(
        context,
        Stage.GENERATE_NOTES,
        () -> {
          String source = context.sourceText();
          if (source == null || source.isBlank()) {
            throw new GenerationUnavailableException("No text to generate notes from");
          }
          Optional<String> notes;
          try {
            notes = notesGenerator.generateNotes(source, context.kind().contentType());
          } catch (RuntimeException e) {
            throw new GenerationUnavailableException(
                "Notes generation failed: " + e.getMessage(), e);
          }
          if (notes.isEmpty() || notes.get().isBlank()) {
            throw new GenerationUnavailableException("Notes generation returned no content");
          }
          context.setNotes(notes.get());
        });
  }

  private void align(JobContext context) {
    TranscriptionResult transcription = context.transcription();
    if (!context.hasNotes() || transcription == null || !transcription.hasSegments()) {
      return;
    }
    runStage(
        context,
        Stage.ALIGN,
        () -> {
          TimestampMapping mapping;
          try {
            mapping = alignmentEngine.align(context.notes(), transcription.segments());
          } catch (RuntimeException e) {
            throw new AlignmentException("Timestamp alignment failed: " + e.getMessage(), e);
          }
          if (mapping.totalSections() == 0) {
            throw new AlignmentException("No note sections found to align");
          }
          context.setMapping(mapping);
          LOGGER.info(
              "Aligned notes: mapped {}/{} sections, coverage {}%",
              mapping.mappedSections(),
              mapping.totalSections(),
              String.format("%.1f", mapping.coveragePercentage()));
        });
  }

  private void persist(JobContext context) {
    runStage(context, Stage.PERSIST, () -> artifactWriter.writeAll(context));
  }

  private void charge(JobContext context) {
    if (context.owner() == null) {
      LOGGER.info("Anonymous job, no credits charged: jobId={}", context.jobId());
      return;
    }
    if (!context.hasNotes()) {
      LOGGER.info("No notes generated, no credits charged: jobId={}", context.jobId());
      return;
    }
    ActionType action =
        context.actionType() != null ? context.actionType() : context.kind().defaultActionType();
    runStage(
        context,
        Stage.CHARGE,
        () -> {
          try {
            CreditDecision check = creditLedger.check(context.owner(), action);
            if (!check.allowed()) {
              throw new LedgerException(check.message());
            }
            CreditDecision deduction = creditLedger.deduct(context.owner(), action);
            if (!deduction.allowed()) {
              throw new LedgerException(deduction.message());
            }
            context.setCreditsDeducted(true);
            LOGGER.info(
                "Charged {} credits, balance now {}", deduction.cost(), deduction.balance());
          } catch (LedgerException e) {
            throw e;
          } catch (RuntimeException e) {
            throw new LedgerException("Credit ledger unavailable: " + e.getMessage(), e);
          }
          try {
            registry.markCreditsDeducted(context.jobId(), true);
          } catch (RuntimeException e) {
            LOGGER.error(
                "Credits deducted but not recorded on the job: jobId={}, owner={}, action={}",
                context.jobId(),
                context.owner(),
                action,
                e);
          }
        });
  }

  private void complete(JobContext context) {
    long elapsed = context.elapsedMillis();
    Map<String, Object> result = buildResult(context, elapsed);
    registry.complete(context.jobId(), result);

    enterJobContext(context);
    try {
      structuredLogger.logJobCompleted(
          context.jobId(),
          elapsed,
          context.hasNotes(),
          context.hasTimestampedNotes(),
          context.creditsDeducted());
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Run one stage with MDC context, progress update and stage events.
   *
   * <p>Soft pipeline exceptions end here; everything else propagates and fails the job.
   */
  private void runStage(JobContext context, Stage stage, Runnable work) {
    enterJobContext(context);
    StructuredLogger.setStage(stage.name());
    long start = System.currentTimeMillis();
    try {
      registry.updateStage(context.jobId(), stage.name(), stage.progressFor(context.kind()));
      structuredLogger.logStageStarted(stage.name());
      work.run();
      structuredLogger.logStageFinished(stage.name(), System.currentTimeMillis() - start);
    } catch (PipelineException e) {
      structuredLogger.logStageFailed(
          stage.name(), e.isFatal(), e.getClass().getSimpleName(), e.getMessage());
      if (e.isFatal()) {
        throw e;
      }
    } catch (RuntimeException e) {
      structuredLogger.logStageFailed(
          stage.name(), true, e.getClass().getSimpleName(), e.getMessage());
      throw e;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void recordFailure(JobContext context, Throwable cause) {
    String message = failureMessage(cause);
    enterJobContext(context);
    try {
      if (context.creditsDeducted()) {
        LOGGER.error(
            "Job failed after charging, refund needed: jobId={}, owner={}, action={}",
            context.jobId(),
            context.owner(),
            context.actionType());
      }
      try {
        registry.fail(context.jobId(), message);
      } catch (RuntimeException e) {
        LOGGER.error("Failed to record job failure: jobId={}", context.jobId(), e);
      }
      structuredLogger.logJobFailed(
          context.jobId(), context.elapsedMillis(), cause.getClass().getSimpleName(), message);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void cleanup(JobContext context) {
    if (!cleanupTempFiles) {
      LOGGER.debug("Keeping {} temp files of job {}", context.tempFiles().size(), context.jobId());
      return;
    }
    int deleted = TempFileCleaner.deleteAll(context.tempFiles());
    LOGGER.debug("Deleted {} temp files of job {}", deleted, context.jobId());
  }

  static Map<String, Object> buildResult(JobContext context, long elapsedMillis) {
    Map<String, Object> result = new LinkedHashMap<>();
    TranscriptionResult transcription = context.transcription();
    if (transcription != null) {
      result.put("transcript", excerpt(transcription.text(), TRANSCRIPT_EXCERPT_CHARS));
      result.put("language", transcription.language());
      result.put("segmentCount", transcription.segments().size());
    } else if (context.documentText() != null) {
      result.put("extractedText", excerpt(context.documentText(), TRANSCRIPT_EXCERPT_CHARS));
      result.put("textLength", context.documentText().length());
    }

    result.put("hasNotes", context.hasNotes());
    if (context.hasNotes()) {
      result.put("notesPreview", excerpt(context.notes(), NOTES_PREVIEW_CHARS));
    }

    result.put("hasTimestampedNotes", context.hasTimestampedNotes());
    if (context.hasTimestampedNotes()) {
      result.put("timestampCoverage", context.mapping().coveragePercentage());
      result.put("mappedSections", context.mapping().mappedSections());
    }
    result.put("processingTimeMs", elapsedMillis);
    return result;
  }

  static String excerpt(String text, int maxChars) {
    return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
  }

  private static void enterJobContext(JobContext context) {
    ActionType action = context.actionType();
    StructuredLogger.setJobContext(
        context.jobId(), context.owner(), action != null ? action.name() : null);
  }

  private static String failureMessage(Throwable cause) {
    if (cause instanceof RejectedExecutionException) {
      return "Too many jobs in progress, please try again later";
    }
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }

  private static Throwable unwrap(Throwable error) {
    Throwable cause = error;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }
}
