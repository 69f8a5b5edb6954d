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

import java.awt.image.BufferedImage;
import java.io.IOException;
import org.randomart.expr.Expr;

/**
 * Renders a generated expression tree into images, one per frame.
 *
 * <p>Each method takes a {@link Cancellation}; cancelling it (from any thread) stops rendering and
 * makes the method (or the next call to {@link FrameSequence#next}) throw a {@link
 * RenderCancelledException}.
 */
public final class Renderer {

  private Renderer() {}

  /**
   * Starts rendering every frame, returning a sequence that yields them in order. The caller must
   * close the sequence.
   */
  public static FrameSequence frames(Expr root, RenderOptions options, Cancellation cancellation) {
    return new FramePipeline(
        new Rasterizer(root, options),
        options.frames(),
        options.workers(),
        options.progressListener(),
        cancellation);
  }

  /** Renders and returns the first frame only. */
  public static BufferedImage render(Expr root, RenderOptions options, Cancellation cancellation)
      throws RenderException {
    try (FrameSequence frames = frames(root, options, cancellation)) {
      return frames.next().image();
    }
  }

  /**
   * Renders every frame, passing each to {@code consumer} in order. If the consumer throws,
   * rendering is stopped and the exception is rethrown.
   */
  public static void renderEach(
      Expr root, RenderOptions options, Cancellation cancellation, FrameConsumer consumer)
      throws RenderException, IOException {
    try (FrameSequence frames = frames(root, options, cancellation)) {
      while (frames.hasNext()) {
        Frame frame = frames.next();
        consumer.accept(frame.index(), frame.image());
      }
    }
  }
}
