package com.scholary.audiobook.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.api.JobStatusResponse.Status;
import com.scholary.audiobook.api.SynthesisRequest;
import com.scholary.audiobook.checkpoint.ProbeResult;
import com.scholary.audiobook.config.SynthesisProperties;
import com.scholary.audiobook.events.EventEmitter;
import com.scholary.audiobook.events.EventFormat;
import com.scholary.audiobook.events.EventSink;
import com.scholary.audiobook.events.FileEventSink;
import com.scholary.audiobook.events.LoggingEventSink;
import com.scholary.audiobook.job.JobProgressSink;
import com.scholary.audiobook.job.JobRepository;
import com.scholary.audiobook.job.SynthesisJob;
import com.scholary.audiobook.logging.StructuredLogger;
import com.scholary.audiobook.pipeline.RunResult;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs synthesis jobs on the async executor and records their outcome.
 *
 * <p>Lives in its own bean so the {@link Async} proxy applies when the controller calls it.
 */
@Component
public class SynthesisJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SynthesisJobRunner.class);

  private final SynthesisService synthesisService;
  private final JobRepository jobRepository;
  private final ObjectMapper objectMapper;
  private final SynthesisProperties properties;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public SynthesisJobRunner(
      SynthesisService synthesisService,
      JobRepository jobRepository,
      ObjectMapper objectMapper,
      SynthesisProperties properties) {
    this.synthesisService = synthesisService;
    this.jobRepository = jobRepository;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>The job status is updated as processing progresses. Events stay pollable after the job
   * finishes until the job expires from the repository.
   */
  @Async("taskExecutor")
  public void run(SynthesisJob job) {
    SynthesisRequest request = job.getRequest();
    StructuredLogger.setJobContext(job.getJobId(), request.outputPath());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    job.setStatus(Status.PROCESSING);
    jobRepository.save(job);

    EventEmitter events = openEvents(job);
    Status outcome = Status.FAILED;
    try {
      if (request.probeOnly()) {
        ProbeResult probe = synthesisService.probe(request, events);
        job.setProbe(probe);
        outcome = Status.COMPLETED;
      } else {
        RunResult result = synthesisService.synthesize(request, events);
        job.setResult(result);
        if (result.success()) {
          outcome = Status.COMPLETED;
        } else {
          job.setFailureKind(result.failureKind());
          job.setError(result.message());
        }
      }
    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      events.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
      job.setError(e.getMessage());
    } finally {
      // a finished job must already have its full event stream
      events.close();
      if (outcome == Status.COMPLETED) {
        job.setProgress(100);
      }
      job.setStatus(outcome);
      jobRepository.save(job);
      structuredLogger.logJobProgress(
          job.getJobId(), job.getProgress(), 100, job.getProgress(), outcome.name());
      LOGGER.info("Finished async processing for job: {} ({})", job.getJobId(), outcome);
      StructuredLogger.clearJobContext();
    }
  }

  private EventEmitter openEvents(SynthesisJob job) {
    List<EventSink> sinks = new ArrayList<>();
    sinks.add(job.getEvents());
    sinks.add(new JobProgressSink(job));
    sinks.add(new LoggingEventSink());
    if (properties.eventLogDir() != null && !properties.eventLogDir().isBlank()) {
      try {
        sinks.add(
            new FileEventSink(Paths.get(properties.eventLogDir(), job.getJobId() + ".log")));
      } catch (IOException e) {
        LOGGER.warn("Event log unavailable for job {}: {}", job.getJobId(), e.getMessage());
      }
    }
    EventFormat format =
        job.getRequest().eventFormat() != null ? job.getRequest().eventFormat() : EventFormat.TEXT;
    return new EventEmitter(format, job.getJobId(), sinks, objectMapper);
  }
}
