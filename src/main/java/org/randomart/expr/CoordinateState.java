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

package org.randomart.expr;

import com.google.common.base.Preconditions;

/**
 * The values of the six components for one pixel of one frame, each normalized to [-1, 1].
 *
 * <p>A CoordinateState is created for each (pixel, frame) pair and only lives for one evaluation.
 */
public record CoordinateState(double x, double y, double frame, double r, double g, double b) {

  /** The largest value of an 8-bit color channel. */
  private static final double CHANNEL_MAX = 255;

  /**
   * Builds the state for pixel ({@code x}, {@code y}) of frame {@code frame}, given the image size,
   * the number of frames, and an RGB sample (as returned by {@link
   * java.awt.image.BufferedImage#getRGB}, alpha ignored) from the source image.
   */
  public static CoordinateState of(
      int x, int y, int width, int height, int frame, int frames, int sourceRgb) {
    Preconditions.checkElementIndex(x, width, "x");
    Preconditions.checkElementIndex(y, height, "y");
    Preconditions.checkElementIndex(frame, frames, "frame");
    return new CoordinateState(
        normalize(x, width),
        normalize(y, height),
        normalize(frame, frames),
        channel(sourceRgb >> 16),
        channel(sourceRgb >> 8),
        channel(sourceRgb));
  }

  /**
   * Maps {@code i} in {@code [0, n-1]} linearly onto {@code [-1, 1]}. An axis with a single element
   * maps to -1, the value its first element would have on any longer axis.
   */
  static double normalize(int i, int n) {
    if (n <= 1) {
      return -1;
    }
    return (double) i / (n - 1) * 2 - 1;
  }

  /** Maps the low 8 bits of {@code bits} from {@code [0, 255]} onto {@code [-1, 1]}. */
  private static double channel(int bits) {
    return (bits & 0xff) / CHANNEL_MAX * 2 - 1;
  }

  /** Returns the value of the given component. */
  public double get(Component component) {
    return switch (component) {
      case X -> x;
      case Y -> y;
      case FRAME -> frame;
      case R -> r;
      case G -> g;
      case B -> b;
    };
  }
}
