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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.Uninterruptibles;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.randomart.testing.ThreadChecks;

@RunWith(JUnit4.class)
public class FramePipelineTest {

  private static final String THREAD_PREFIX = "randomart-";

  private final Cancellation cancellation = Cancellation.create();

  @After
  public void noLeakedThreads() {
    ThreadChecks.assertNoLiveThreads(THREAD_PREFIX, Duration.ofSeconds(5));
  }

  /** Returns a 1x1 image whose pixel's RGB value is the frame index. */
  private static BufferedImage imageFor(int frame) {
    BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
    image.setRGB(0, 0, 0xff000000 | frame);
    return image;
  }

  /** A renderer that takes {@code millis} to render each frame. */
  private static FrameRenderer slowRenderer(long millis) {
    return frame -> {
      Uninterruptibles.sleepUninterruptibly(Duration.ofMillis(millis));
      return imageFor(frame);
    };
  }

  @Test
  public void framesAreInOrder() throws RenderException {
    // Later frames are often faster, so they finish out of order.
    FrameRenderer renderer =
        frame -> {
          Uninterruptibles.sleepUninterruptibly(
              Duration.ofMillis(ThreadLocalRandom.current().nextInt(30)));
          return imageFor(frame);
        };
    List<Integer> indices = new ArrayList<>();
    try (FramePipeline pipeline =
        new FramePipeline(renderer, 20, 5, ProgressListener.NONE, cancellation)) {
      while (pipeline.hasNext()) {
        Frame frame = pipeline.next();
        assertThat(frame.image().getRGB(0, 0) & 0xffffff).isEqualTo(frame.index());
        indices.add(frame.index());
      }
      assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
    }
    assertThat(indices).containsExactlyElementsIn(range(20)).inOrder();
  }

  @Test(timeout = 10_000)
  public void framesFinishedOutOfOrderAreReturnedInOrder() throws RenderException {
    // Frame 0 can't finish until frame 3 has.
    CountDownLatch frame3Done = new CountDownLatch(1);
    List<Integer> finished = Collections.synchronizedList(new ArrayList<>());
    FrameRenderer renderer =
        frame -> {
          if (frame == 0) {
            Uninterruptibles.awaitUninterruptibly(frame3Done);
          }
          BufferedImage image = imageFor(frame);
          finished.add(frame);
          if (frame == 3) {
            frame3Done.countDown();
          }
          return image;
        };
    List<Integer> indices = new ArrayList<>();
    try (FramePipeline pipeline =
        new FramePipeline(renderer, 5, 5, ProgressListener.NONE, cancellation)) {
      while (pipeline.hasNext()) {
        indices.add(pipeline.next().index());
      }
    }
    assertThat(finished.indexOf(3)).isLessThan(finished.indexOf(0));
    assertThat(indices).containsExactly(0, 1, 2, 3, 4).inOrder();
  }

  @Test
  public void moreFramesThanQueueSlots() throws RenderException {
    List<Integer> indices = new ArrayList<>();
    try (FramePipeline pipeline =
        new FramePipeline(slowRenderer(1), 50, 2, ProgressListener.NONE, cancellation)) {
      while (pipeline.hasNext()) {
        indices.add(pipeline.next().index());
      }
    }
    assertThat(indices).containsExactlyElementsIn(range(50)).inOrder();
  }

  @Test
  public void progressIsReported() throws RenderException {
    List<Integer> completed = new ArrayList<>();
    List<FrameTimings> timings = new ArrayList<>();
    ProgressListener listener =
        new ProgressListener() {
          @Override
          public void frameCompleted(int frame, Duration elapsed) {
            completed.add(frame);
          }

          @Override
          public void renderCompleted(FrameTimings frameTimings) {
            timings.add(frameTimings);
          }
        };
    try (FramePipeline pipeline =
        new FramePipeline(slowRenderer(5), 6, 3, listener, cancellation)) {
      while (pipeline.hasNext()) {
        pipeline.next();
      }
    }
    assertThat(completed).containsExactlyElementsIn(range(6)).inOrder();
    assertThat(timings).hasSize(1);
    FrameTimings summary = timings.get(0);
    assertThat(summary.frames()).isEqualTo(6);
    assertThat(summary.min()).isAtMost(summary.average());
    assertThat(summary.average()).isAtMost(summary.max());
    assertThat(summary.min()).isAtLeast(Duration.ofMillis(5));
  }

  @Test
  public void cancellationIsPrompt() throws RenderException {
    AtomicInteger started = new AtomicInteger();
    FrameRenderer renderer =
        frame -> {
          started.incrementAndGet();
          Uninterruptibles.sleepUninterruptibly(Duration.ofMillis(100));
          return imageFor(frame);
        };
    FramePipeline pipeline =
        new FramePipeline(renderer, 100, 2, ProgressListener.NONE, cancellation);
    try {
      assertThat(pipeline.next().index()).isEqualTo(0);
      Stopwatch stopwatch = Stopwatch.createStarted();
      cancellation.cancel();
      RenderCancelledException e =
          assertThrows(RenderCancelledException.class, pipeline::next);
      assertThat(e.frame().getAsInt()).isEqualTo(1);
      assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
      // Rendering all 100 frames would take 5 seconds; stopping only waits for frames in progress.
      assertThat(stopwatch.elapsed()).isLessThan(Duration.ofSeconds(2));
      assertThat(pipeline.hasNext()).isFalse();
    } finally {
      pipeline.close();
    }
    assertThat(started.get()).isLessThan(100);
    ThreadChecks.assertNoLiveThreads(THREAD_PREFIX, Duration.ofSeconds(1));
  }

  @Test
  public void closeStopsEarly() throws RenderException {
    FramePipeline pipeline =
        new FramePipeline(slowRenderer(20), 100, 4, ProgressListener.NONE, cancellation);
    assertThat(pipeline.next().index()).isEqualTo(0);
    assertThat(pipeline.state()).isEqualTo(FramePipeline.State.RUNNING);
    pipeline.close();
    assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
    assertThat(pipeline.hasNext()).isFalse();
    assertThrows(IllegalStateException.class, pipeline::next);
    // Closing again has no effect, and the caller's Cancellation is untouched.
    pipeline.close();
    assertThat(cancellation.isCancelled()).isFalse();
  }

  @Test
  public void cancelledBeforeStart() {
    cancellation.cancel();
    try (FramePipeline pipeline =
        new FramePipeline(slowRenderer(0), 10, 2, ProgressListener.NONE, cancellation)) {
      assertThrows(RenderCancelledException.class, pipeline::next);
      assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
    }
  }

  @Test
  public void workerErrorAbortsPipeline() {
    RenderException failure = new RenderException("frame 3 is broken", 3, null);
    FrameRenderer renderer =
        frame -> {
          if (frame == 3) {
            throw failure;
          }
          return imageFor(frame);
        };
    List<Integer> indices = new ArrayList<>();
    try (FramePipeline pipeline =
        new FramePipeline(renderer, 10, 2, ProgressListener.NONE, cancellation)) {
      RenderException e =
          assertThrows(
              RenderException.class,
              () -> {
                while (pipeline.hasNext()) {
                  indices.add(pipeline.next().index());
                }
              });
      assertThat(e).isSameInstanceAs(failure);
      assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
      assertThat(pipeline.hasNext()).isFalse();
    }
    // Frames before the failure may or may not have been delivered, but never frames after it.
    assertThat(indices).isEqualTo(range(indices.size()));
    assertThat(indices.size()).isAtMost(3);
  }

  @Test
  public void uncheckedWorkerErrorIsWrapped() {
    IllegalStateException bug = new IllegalStateException("bug");
    FrameRenderer renderer =
        frame -> {
          throw bug;
        };
    try (FramePipeline pipeline =
        new FramePipeline(renderer, 1, 1, ProgressListener.NONE, cancellation)) {
      RenderException e = assertThrows(RenderException.class, pipeline::next);
      assertThat(e).isNotInstanceOf(RenderCancelledException.class);
      assertThat(e).hasCauseThat().isSameInstanceAs(bug);
      assertThat(e.frame().getAsInt()).isEqualTo(0);
    }
  }

  @Test
  public void workerThrowableIsReportedAsFailure() {
    OutOfMemoryError error = new OutOfMemoryError("frame too large");
    FrameRenderer renderer =
        frame -> {
          if (frame == 0) {
            throw error;
          }
          Uninterruptibles.sleepUninterruptibly(Duration.ofMillis(50));
          return imageFor(frame);
        };
    Stopwatch stopwatch = Stopwatch.createStarted();
    try (FramePipeline pipeline =
        new FramePipeline(renderer, 200, 4, ProgressListener.NONE, cancellation)) {
      RenderException e = assertThrows(RenderException.class, pipeline::next);
      assertThat(e).isNotInstanceOf(RenderCancelledException.class);
      assertThat(e).hasCauseThat().isSameInstanceAs(error);
      assertThat(e.frame().getAsInt()).isEqualTo(0);
      assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
    }
    // Rendering the other 199 frames would take about 2.5 seconds.
    assertThat(stopwatch.elapsed()).isLessThan(Duration.ofSeconds(2));
  }

  @Test
  public void listenerExceptionClosesPipeline() throws RenderException {
    IllegalStateException broken = new IllegalStateException("listener broke");
    ProgressListener listener =
        new ProgressListener() {
          @Override
          public void frameCompleted(int frame, Duration elapsed) {
            if (frame == 1) {
              throw broken;
            }
          }
        };
    try (FramePipeline pipeline =
        new FramePipeline(slowRenderer(20), 100, 2, listener, cancellation)) {
      assertThat(pipeline.next().index()).isEqualTo(0);
      IllegalStateException e = assertThrows(IllegalStateException.class, pipeline::next);
      assertThat(e).isSameInstanceAs(broken);
      assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
      assertThat(pipeline.hasNext()).isFalse();
    }
    ThreadChecks.assertNoLiveThreads(THREAD_PREFIX, Duration.ofSeconds(1));
  }

  @Test
  public void renderCompletedExceptionClosesPipeline() throws RenderException {
    IllegalStateException broken = new IllegalStateException("listener broke");
    ProgressListener listener =
        new ProgressListener() {
          @Override
          public void renderCompleted(FrameTimings timings) {
            throw broken;
          }
        };
    FramePipeline pipeline = new FramePipeline(slowRenderer(0), 3, 2, listener, cancellation);
    assertThat(pipeline.next().index()).isEqualTo(0);
    assertThat(pipeline.next().index()).isEqualTo(1);
    IllegalStateException e = assertThrows(IllegalStateException.class, pipeline::next);
    assertThat(e).isSameInstanceAs(broken);
    assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
  }

  @Test
  public void interruptedConsumer() {
    try (FramePipeline pipeline =
        new FramePipeline(slowRenderer(50), 10, 2, ProgressListener.NONE, cancellation)) {
      Thread.currentThread().interrupt();
      assertThrows(RenderCancelledException.class, pipeline::next);
      assertThat(Thread.interrupted()).isTrue();
      assertThat(pipeline.state()).isEqualTo(FramePipeline.State.STOPPED);
    }
  }

  private static List<Integer> range(int n) {
    List<Integer> result = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      result.add(i);
    }
    return result;
  }
}
