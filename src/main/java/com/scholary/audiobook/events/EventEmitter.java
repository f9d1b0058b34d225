package com.scholary.audiobook.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes run state transitions into an external event stream.
 *
 * <p>Lines are encoded on the calling thread and handed to a single writer thread through an
 * unbounded queue, so emitting never waits on a slow sink. Order is preserved. {@link #close()}
 * drains everything queued before returning.
 *
 * <p>Text grammar:
 *
 * <pre>
 * PHASE:INFERENCE
 * METADATA:backend_resolved:mlx
 * TIMING:3:1840
 * HEARTBEAT:1704067200000
 * WORKER:0:INFER:Chunk 4/25
 * PROGRESS:4/25 chunks
 * CHECKPOINT:SAVED:3
 * DONE
 * </pre>
 *
 * <p>JSON is one object per line with {@code type}, {@code ts_ms} and {@code job_id} followed by
 * the event's own fields.
 */
public class EventEmitter implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventEmitter.class);

  private static final long DRAIN_TIMEOUT_SECONDS = 10;

  private final EventFormat format;
  private final String jobId;
  private final List<EventSink> sinks;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ExecutorService writer;

  public EventEmitter(
      EventFormat format, String jobId, List<EventSink> sinks, ObjectMapper objectMapper) {
    this(format, jobId, sinks, objectMapper, Clock.systemUTC());
  }

  EventEmitter(
      EventFormat format,
      String jobId,
      List<EventSink> sinks,
      ObjectMapper objectMapper,
      Clock clock) {
    this.format = format;
    this.jobId = jobId;
    this.sinks = List.copyOf(sinks);
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.writer =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "events-" + jobId);
              thread.setDaemon(true);
              return thread;
            });
  }

  public void phase(Phase phase) {
    emit("phase", "PHASE:" + phase.name(), false, fields("phase", phase.name()));
  }

  public void metadata(String key, Object value) {
    emit(
        "metadata",
        "METADATA:" + key + ":" + value,
        false,
        fields("key", key, "value", value));
  }

  public void timing(int chunkIndex, long millis) {
    emit(
        "timing",
        "TIMING:" + chunkIndex + ":" + millis,
        false,
        fields("chunk_idx", chunkIndex, "chunk_timing_ms", millis, "stage", "infer"));
  }

  public void heartbeat(long epochMillis) {
    emit(
        "heartbeat",
        "HEARTBEAT:" + epochMillis,
        false,
        fields("heartbeat_ts", epochMillis));
  }

  public void worker(int workerId, WorkerState state, String detail) {
    emit(
        "worker",
        "WORKER:" + workerId + ":" + state.name() + ":" + detail,
        false,
        fields("id", workerId, "status", state.name(), "details", detail));
  }

  public void progress(int current, int total) {
    emit(
        "progress",
        "PROGRESS:" + current + "/" + total + " chunks",
        false,
        fields("current_chunk", current, "total_chunks", total));
  }

  public void checkpoint(CheckpointCode code) {
    emit("checkpoint", "CHECKPOINT:" + code.name(), false, fields("code", code.name()));
  }

  public void checkpoint(CheckpointCode code, Object detail) {
    emit(
        "checkpoint",
        "CHECKPOINT:" + code.name() + ":" + detail,
        false,
        fields("code", code.name(), "detail", detail));
  }

  public void done(String output, int chunks) {
    emit("done", "DONE", false, fields("output", output, "chunks", chunks));
  }

  public void info(String message) {
    emit("log", message, false, fields("level", "info", "message", message));
  }

  public void warn(String message) {
    emit("log", "WARN: " + message, true, fields("level", "warning", "message", message));
  }

  public void error(String message) {
    emit("error", message, true, fields("message", message));
  }

  /** Drain queued events, then close every sink. */
  @Override
  public void close() {
    writer.shutdown();
    try {
      if (!writer.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Event writer for job {} did not drain in time", jobId);
        writer.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      writer.shutdownNow();
    }
    for (EventSink sink : sinks) {
      sink.close();
    }
  }

  private void emit(String type, String text, boolean errorChannel, Map<String, Object> payload) {
    String encoded = format == EventFormat.JSON ? toJson(type, payload) : text;
    EventLine line = new EventLine(type, encoded, errorChannel, payload);
    try {
      writer.execute(() -> dispatch(line));
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Dropping event after close: {}", line.text());
    }
  }

  private void dispatch(EventLine line) {
    for (EventSink sink : sinks) {
      try {
        sink.accept(line);
      } catch (RuntimeException e) {
        LOGGER.warn("Event sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage());
      }
    }
  }

  private String toJson(String type, Map<String, Object> payload) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("type", type);
    body.put("ts_ms", clock.millis());
    body.put("job_id", jobId);
    body.putAll(payload);
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Event payload is not serializable: " + type, e);
    }
  }

  private static Map<String, Object> fields(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }
}
