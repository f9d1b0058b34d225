package com.scholary.audiobook.api;

import com.scholary.audiobook.config.SynthesisProperties;
import com.scholary.audiobook.events.BufferedEventSink;
import com.scholary.audiobook.job.JobRepository;
import com.scholary.audiobook.job.SynthesisJob;
import com.scholary.audiobook.service.SynthesisJobRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for audiobook synthesis.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous synthesis (returns job ID immediately)
 *   <li>Job status polling
 *   <li>Event stream polling by offset
 * </ul>
 */
@RestController
@Validated
@Tag(name = "Synthesis", description = "Audiobook text-to-speech API")
public class SynthesisController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SynthesisController.class);

  private final SynthesisJobRunner jobRunner;
  private final JobRepository jobRepository;
  private final SynthesisProperties properties;

  public SynthesisController(
      SynthesisJobRunner jobRunner, JobRepository jobRepository, SynthesisProperties properties) {
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
    this.properties = properties;
  }

  /** Start an asynchronous synthesis job. */
  @PostMapping("/api/audiobooks")
  @Operation(
      summary = "Start synthesis",
      description = "Start an asynchronous synthesis job and return the job ID for polling")
  public ResponseEntity<AsyncJobResponse> synthesize(
      @Valid @RequestBody SynthesisRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Synthesis request: output={}, chapters={}, probeOnly={}",
        request.outputPath(),
        request.chapters().size(),
        request.probeOnly());

    SynthesisJob job = new SynthesisJob(jobId, request, properties.eventBufferSize());
    jobRepository.save(job);
    jobRunner.run(job);

    LOGGER.info("Created async synthesis job: {}", jobId);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  /** Get job status. */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a synthesis job")
  public JobStatusResponse getJobStatus(@PathVariable String id) {
    SynthesisJob job = jobRepository.getById(id);
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getProgress(),
        job.getPhase(),
        job.getResult(),
        job.getProbe(),
        job.getFailureKind(),
        job.getError(),
        "/api/jobs/" + id + "/events");
  }

  /**
   * Get job events from an offset.
   *
   * <p>Lines use the job's event format. Poll again from {@code nextOffset} until {@code
   * finished}.
   */
  @GetMapping("/api/jobs/{id}/events")
  @Operation(summary = "Get job events", description = "Read a job's event lines from an offset")
  public JobEventsResponse getJobEvents(
      @PathVariable String id, @RequestParam(defaultValue = "0") @Min(0) long from) {
    SynthesisJob job = jobRepository.getById(id);
    boolean finished = job.isFinished();
    BufferedEventSink.Page page = job.getEvents().linesFrom(from);
    return new JobEventsResponse(id, page.lines(), page.nextOffset(), finished);
  }
}
