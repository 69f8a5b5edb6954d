/*
 * Copyright 2025 The Randomart Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.randomart.render;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;
import org.randomart.util.StringUtil;

/**
 * Renders the frames of an animation on a pool of worker threads and hands them to the consumer in
 * frame order.
 *
 * <p>A dispatcher thread puts frame indices on a bounded job queue; each worker takes an index,
 * renders the whole frame, and puts the result on a bounded result queue. Results arrive in
 * whatever order the workers finish, so the consumer (the thread calling {@link #next}) keeps
 * results that arrive early in a heap ordered by frame index until their turn comes. Full queues
 * block the dispatcher or the workers, so a slow consumer limits how far ahead rendering gets.
 *
 * <p>The pipeline is {@link State#RUNNING RUNNING} until it is cancelled, fails, is closed, or has
 * returned its last frame. It is then {@link State#DRAINING DRAINING}: queued jobs are abandoned
 * and workers exit as soon as they finish the frame they are rendering (a frame is never
 * interrupted part way through). It becomes {@link State#STOPPED STOPPED} when {@link #close} has
 * seen every thread exit.
 */
final class FramePipeline implements FrameSequence {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  enum State {
    RUNNING,
    DRAINING,
    STOPPED
  }

  /** Put on the job queue, once per worker, after the last frame. */
  private static final int STOP = -1;

  /** Each queue has room for this many entries per worker. */
  private static final int QUEUE_SLOTS_PER_WORKER = 10;

  /** How often the consumer checks for cancellation while waiting for a result. */
  private static final long POLL_MILLIS = 20;

  private final String id = StringUtil.id(this);
  private final FrameRenderer renderer;
  private final int frames;
  private final int workers;
  private final ProgressListener progress;

  /** Cancelled when the pipeline is closed or when the Cancellation it was created with is. */
  private final Cancellation cancellation;

  private final BlockingQueue<Integer> jobs;
  private final BlockingQueue<FrameResult> results;
  private final ExecutorService executor;

  /** The number of workers that have not yet exited. */
  private final AtomicInteger liveWorkers;

  @GuardedBy("this")
  private State state = State.RUNNING;

  // The remaining fields are only used by the consumer.

  /** Results that arrived before their turn. */
  private final PriorityQueue<FrameResult> early =
      new PriorityQueue<>(Comparator.comparingInt(FrameResult::frame));

  private final List<Duration> elapsed = new ArrayList<>();

  /** The index of the next frame to return. */
  private int nextFrame;

  /** The outcome of rendering one frame; exactly one of image and error is non-null. */
  record FrameResult(
      int frame, @Nullable BufferedImage image, Duration elapsed, @Nullable Throwable error) {}

  FramePipeline(
      FrameRenderer renderer,
      int frames,
      int workers,
      ProgressListener progress,
      Cancellation parent) {
    Preconditions.checkArgument(frames > 0, "frames must be positive (was %s)", frames);
    Preconditions.checkArgument(workers > 0, "workers must be positive (was %s)", workers);
    this.renderer = renderer;
    this.frames = frames;
    this.workers = workers;
    this.progress = progress;
    this.jobs = new ArrayBlockingQueue<>(workers * QUEUE_SLOTS_PER_WORKER);
    this.results = new ArrayBlockingQueue<>(workers * QUEUE_SLOTS_PER_WORKER);
    this.liveWorkers = new AtomicInteger(workers);
    this.executor =
        Executors.newFixedThreadPool(
            workers + 1,
            new ThreadFactoryBuilder()
                .setNameFormat("randomart-" + id + "-%d")
                .setDaemon(true)
                .build());
    logger.atFine().log("Pipeline %s rendering %d frames with %d workers", id, frames, workers);
    for (int i = 0; i < workers; i++) {
      executor.execute(this::work);
    }
    executor.execute(this::dispatch);
    // Registered last, since if parent is already cancelled stopWorkers() will run immediately.
    this.cancellation = parent.child();
    cancellation.onCancel(this::stopWorkers);
  }

  /** Feeds every frame index to the workers, followed by one STOP for each worker. */
  private void dispatch() {
    try {
      for (int frame = 0; frame < frames; frame++) {
        jobs.put(frame);
      }
      for (int i = 0; i < workers; i++) {
        jobs.put(STOP);
      }
    } catch (InterruptedException e) {
      // Cancelled; the workers are being interrupted too.
      Thread.currentThread().interrupt();
    }
  }

  /** The body of each worker thread. */
  private void work() {
    try {
      for (; ; ) {
        int frame = jobs.take();
        if (frame == STOP) {
          return;
        }
        results.put(renderFrame(frame));
      }
    } catch (InterruptedException e) {
      // Cancelled; any jobs left in the queue are abandoned.
      Thread.currentThread().interrupt();
    } finally {
      liveWorkers.decrementAndGet();
    }
  }

  private FrameResult renderFrame(int frame) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      BufferedImage image = renderer.render(frame);
      return new FrameResult(frame, image, stopwatch.elapsed(), null);
    } catch (Throwable e) {
      // Handed to the consumer, which will rethrow it; that includes Errors such as
      // OutOfMemoryError.
      return new FrameResult(frame, null, stopwatch.elapsed(), e);
    }
  }

  /** Called (on any thread) when the pipeline's Cancellation is cancelled. */
  private void stopWorkers() {
    synchronized (this) {
      if (state == State.RUNNING) {
        state = State.DRAINING;
      }
    }
    executor.shutdownNow();
  }

  @VisibleForTesting
  synchronized State state() {
    return state;
  }

  @Override
  public boolean hasNext() {
    return state() != State.STOPPED && nextFrame < frames;
  }

  @Override
  public Frame next() throws RenderException {
    if (nextFrame >= frames) {
      throw new NoSuchElementException();
    }
    Preconditions.checkState(state() != State.STOPPED, "Pipeline %s has been closed", id);
    try {
      // Frames that arrived early are not returned once rendering has been cancelled.
      checkCancelled();
      while (early.isEmpty() || early.peek().frame() != nextFrame) {
        FrameResult result = awaitResult();
        if (result.error() != null) {
          throw failure(result);
        }
        early.add(result);
      }
      return emit(early.poll());
    } catch (RenderException | RuntimeException | Error e) {
      // Includes exceptions thrown by the ProgressListener.
      close();
      throw e;
    }
  }

  /** Waits for the next result from the workers, regardless of which frame it is for. */
  private FrameResult awaitResult() throws RenderException {
    try {
      for (; ; ) {
        checkCancelled();
        FrameResult result = results.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (result != null) {
          return result;
        }
        // Workers put their last result before they exit, so if none are left and the queue is
        // empty nothing more is coming.
        if (liveWorkers.get() == 0 && results.isEmpty() && !cancellation.isCancelled()) {
          throw new RenderCancelledException(
              String.format("Frame workers exited before delivering frame %d", nextFrame),
              nextFrame);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RenderCancelledException(
          String.format("Interrupted while waiting for frame %d", nextFrame), nextFrame);
    }
  }

  private void checkCancelled() throws RenderCancelledException {
    if (cancellation.isCancelled()) {
      throw new RenderCancelledException(
          String.format("Rendering was cancelled before frame %d", nextFrame), nextFrame);
    }
  }

  private static RenderException failure(FrameResult result) {
    Throwable error = result.error();
    logger.atFine().withCause(error).log("Frame %d failed", result.frame());
    if (error instanceof RenderException renderException) {
      return renderException;
    }
    return new RenderException(
        String.format("Frame %d failed: %s", result.frame(), error), result.frame(), error);
  }

  private Frame emit(FrameResult result) {
    assert result.frame() == nextFrame && result.image() != null;
    elapsed.add(result.elapsed());
    progress.frameCompleted(result.frame(), result.elapsed());
    nextFrame++;
    if (nextFrame == frames) {
      FrameTimings timings = FrameTimings.of(elapsed);
      logger.atFine().log("Pipeline %s finished: %s", id, timings);
      progress.renderCompleted(timings);
      close();
    }
    return new Frame(result.frame(), result.image(), result.elapsed());
  }

  @Override
  public void close() {
    synchronized (this) {
      if (state == State.STOPPED) {
        return;
      }
      state = State.DRAINING;
    }
    // Runs stopWorkers() (unless it already ran) and detaches us from the parent Cancellation.
    cancellation.cancel();
    Uninterruptibles.awaitTerminationUninterruptibly(executor);
    jobs.clear();
    results.clear();
    early.clear();
    synchronized (this) {
      state = State.STOPPED;
    }
    logger.atFine().log("Pipeline %s stopped after %d of %d frames", id, nextFrame, frames);
  }
}
