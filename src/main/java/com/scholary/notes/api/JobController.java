package com.scholary.notes.api;

import com.scholary.notes.artifact.ArtifactStore;
import com.scholary.notes.artifact.ArtifactType;
import com.scholary.notes.job.JobStatusService;
import com.scholary.notes.pipeline.PipelineInput;
import com.scholary.notes.pipeline.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for notes jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a stored video, audio or PDF for processing
 *   <li>Polling a job's status and listing an owner's jobs
 *   <li>Downloading a finished job's artifacts
 * </ul>
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Lecture notes generation jobs")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final PipelineOrchestrator orchestrator;
  private final JobStatusService statusService;
  private final ArtifactStore artifactStore;

  public JobController(
      PipelineOrchestrator orchestrator,
      JobStatusService statusService,
      ArtifactStore artifactStore) {
    this.orchestrator = orchestrator;
    this.statusService = statusService;
    this.artifactStore = artifactStore;
  }

  @PostMapping
  @Operation(
      summary = "Submit a job",
      description =
          "Start processing an object from the store and return the job ID for status polling")
  public ResponseEntity<AsyncJobResponse> submit(@Valid @RequestBody JobSubmissionRequest request) {
    LOGGER.info(
        "Job request: kind={}, bucket={}, key={}, owner={}",
        request.kind(),
        request.bucket(),
        request.key(),
        request.owner());
    PipelineInput input =
        PipelineInput.storedObject(request.kind(), request.bucket(), request.key());
    String jobId = orchestrator.submit(request.owner(), request.actionType(), input);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a job")
  public ResponseEntity<JobStatusResponse> status(@PathVariable String id) {
    return statusService
        .status(id)
        .map(view -> ResponseEntity.ok(JobStatusResponse.from(view)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping
  @Operation(summary = "List jobs", description = "Jobs submitted by an owner, newest first")
  public List<JobStatusResponse> list(@RequestParam String owner) {
    return statusService.jobsOf(owner).stream().map(JobStatusResponse::from).toList();
  }

  @GetMapping("/{id}/artifacts/{type}")
  @Operation(
      summary = "Download an artifact",
      description =
          "Fetch one output of a job: transcript, extracted_text, notes_markdown, notes_text,"
              + " timestamped_json, timestamped_markdown, notes_srt or notes_vtt")
  public ResponseEntity<String> artifact(@PathVariable String id, @PathVariable String type) {
    Optional<ArtifactType> artifactType = ArtifactType.fromName(type);
    if (artifactType.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    ArtifactType resolved = artifactType.get();
    return artifactStore
        .read(id, resolved)
        .map(
            content ->
                ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(resolved.contentType()))
                    .header(
                        "Content-Disposition",
                        "attachment; filename=\"" + resolved.fileName(id) + "\"")
                    .body(content))
        .orElse(ResponseEntity.notFound().build());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
  }
}
