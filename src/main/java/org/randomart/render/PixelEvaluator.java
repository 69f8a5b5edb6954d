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

import org.randomart.expr.ColorTriple;
import org.randomart.expr.CoordinateState;
import org.randomart.expr.EvalException;
import org.randomart.expr.Expr;

/** Computes the color of a single pixel of a single frame. */
public final class PixelEvaluator {

  /** The source sample used when there is no source image. */
  public static final int OPAQUE_WHITE = 0xffffffff;

  private PixelEvaluator() {}

  /**
   * Evaluates {@code root} for pixel ({@code x}, {@code y}) of frame {@code frame} and returns the
   * resulting color as an opaque ARGB value.
   *
   * @param sourceRgb the source image's pixel at ({@code x}, {@code y}), or {@link #OPAQUE_WHITE}
   * @throws EvalException if the expression does not evaluate to a triple of numbers
   */
  public static int evalPixel(
      Expr root, int x, int y, int width, int height, int frame, int frames, int sourceRgb)
      throws EvalException {
    CoordinateState state = CoordinateState.of(x, y, width, height, frame, frames, sourceRgb);
    return ColorTriple.of(root.eval(state)).toArgb();
  }
}
