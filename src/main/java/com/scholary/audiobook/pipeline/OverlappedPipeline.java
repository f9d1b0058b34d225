package com.scholary.audiobook.pipeline;

import com.scholary.audiobook.audio.PcmConverter;
import com.scholary.audiobook.backend.SynthesisBackend;
import com.scholary.audiobook.backend.SynthesizedAudio;
import com.scholary.audiobook.chunking.Chunk;
import com.scholary.audiobook.events.EventEmitter;
import com.scholary.audiobook.events.WorkerState;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Three-stage pipeline: inference, conversion and the caller's encoder feed.
 *
 * <pre>
 * tts-infer --[prefetchChunks]--> tts-convert --[pcmQueueSize]--> caller thread --> encoder
 * </pre>
 *
 * <p>The backend is only touched by the inference thread. Both queues are bounded, so a slow
 * encoder eventually blocks inference; nothing is ever dropped. The first failure in any stage,
 * including an {@link Error}, stops both workers and is rethrown from {@link #run}. {@link #run}
 * returns only after both workers have exited, so the backend is free once it does.
 */
class OverlappedPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlappedPipeline.class);

  private static final long POLL_MILLIS = 250;
  private static final long SHUTDOWN_WAIT_SECONDS = 2;

  /** Receives converted chunks on the calling thread, strictly in index order. */
  @FunctionalInterface
  interface ChunkConsumer {
    void accept(int index, short[] samples, long inferMillis) throws IOException;
  }

  private record RawChunk(int index, SynthesizedAudio audio, long inferMillis) {}

  private record PcmChunk(int index, short[] samples, long inferMillis) {}

  private static final RawChunk RAW_END = new RawChunk(-1, null, 0);
  private static final PcmChunk PCM_END = new PcmChunk(-1, null, 0);

  private final SynthesisBackend backend;
  private final List<Chunk> chunks;
  private final int prefetchChunks;
  private final int pcmQueueSize;
  private final EventEmitter events;

  OverlappedPipeline(
      SynthesisBackend backend,
      List<Chunk> chunks,
      int prefetchChunks,
      int pcmQueueSize,
      EventEmitter events) {
    this.backend = backend;
    this.chunks = chunks;
    this.prefetchChunks = prefetchChunks;
    this.pcmQueueSize = pcmQueueSize;
    this.events = events;
  }

  /**
   * Run every chunk through the pipeline.
   *
   * @param consumer receives each chunk's PCM in index order
   * @throws IOException if the consumer fails to write
   * @throws RuntimeException the first failure raised by a worker; errors arrive wrapped in an
   *     {@link IllegalStateException}
   */
  void run(ChunkConsumer consumer) throws IOException {
    BlockingQueue<RawChunk> rawQueue = new ArrayBlockingQueue<>(prefetchChunks);
    BlockingQueue<PcmChunk> pcmQueue = new ArrayBlockingQueue<>(pcmQueueSize);
    AtomicReference<Throwable> failure = new AtomicReference<>();

    ExecutorService workers = Executors.newFixedThreadPool(2, namedThreads());
    Map<String, String> context = MDC.getCopyOfContextMap();
    workers.execute(withContext(context, () -> infer(rawQueue, failure)));
    workers.execute(withContext(context, () -> convert(rawQueue, pcmQueue, failure)));

    int expected = 0;
    try {
      while (true) {
        rethrowIfFailed(failure);
        PcmChunk next;
        try {
          next = pcmQueue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while waiting for audio", e);
        }
        if (next == null) {
          continue;
        }
        if (next == PCM_END) {
          break;
        }
        if (next.index() != expected) {
          throw new IllegalStateException(
              String.format("Pipeline produced chunk %d, expected %d", next.index(), expected));
        }
        consumer.accept(next.index(), next.samples(), next.inferMillis());
        expected++;
      }
      rethrowIfFailed(failure);
    } finally {
      stopWorkers(workers);
    }
  }

  /** Returns only once no worker can still be inside the backend. */
  private static void stopWorkers(ExecutorService workers) {
    workers.shutdownNow();
    boolean interrupted = false;
    while (true) {
      try {
        if (workers.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          break;
        }
        LOGGER.warn("Pipeline workers still running after {}s, waiting", SHUTDOWN_WAIT_SECONDS);
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void infer(BlockingQueue<RawChunk> rawQueue, AtomicReference<Throwable> failure) {
    try {
      for (Chunk chunk : chunks) {
        events.worker(
            0,
            WorkerState.INFER,
            String.format("Chunk %d/%d", chunk.index() + 1, chunks.size()));
        long start = System.nanoTime();
        SynthesizedAudio audio = backend.generate(chunk.text());
        long inferMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        rawQueue.put(new RawChunk(chunk.index(), audio, inferMillis));
      }
      rawQueue.put(RAW_END);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Throwable e) {
      failure.compareAndSet(null, e);
    }
  }

  private void convert(
      BlockingQueue<RawChunk> rawQueue,
      BlockingQueue<PcmChunk> pcmQueue,
      AtomicReference<Throwable> failure) {
    try {
      while (true) {
        RawChunk raw = rawQueue.take();
        if (raw == RAW_END) {
          pcmQueue.put(PCM_END);
          return;
        }
        short[] samples = PcmConverter.toPcm16(raw.audio().samples());
        pcmQueue.put(new PcmChunk(raw.index(), samples, raw.inferMillis()));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Throwable e) {
      failure.compareAndSet(null, e);
    }
  }

  private static void rethrowIfFailed(AtomicReference<Throwable> failure) {
    Throwable cause = failure.get();
    if (cause == null) {
      return;
    }
    if (cause instanceof RuntimeException runtime) {
      throw runtime;
    }
    throw new IllegalStateException("Pipeline worker failed", cause);
  }

  private static Runnable withContext(Map<String, String> context, Runnable task) {
    return () -> {
      if (context != null) {
        MDC.setContextMap(context);
      }
      try {
        task.run();
      } finally {
        MDC.clear();
      }
    };
  }

  private static ThreadFactory namedThreads() {
    String[] names = {"tts-infer", "tts-convert"};
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, names[counter.getAndIncrement() % names.length]);
      thread.setDaemon(true);
      return thread;
    };
  }
}
