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

/**
 * The numeric value of an evaluated root expression: three numbers that are mapped to the red,
 * green and blue channels of a pixel.
 */
public record ColorTriple(double red, double green, double blue) {

  /**
   * Converts an evaluated root. It must be a {@link Expr.Triple} whose elements are all numbers.
   */
  public static ColorTriple of(Expr evaluated) throws EvalException {
    if (!(evaluated instanceof Expr.Triple triple)) {
      throw new EvalException(EvalException.Kind.NOT_A_COLOR_TRIPLE, evaluated);
    }
    return new ColorTriple(
        Expr.requireNumber(triple.one()),
        Expr.requireNumber(triple.two()),
        Expr.requireNumber(triple.three()));
  }

  /**
   * Maps a value in [-1, 1] to an 8-bit channel as {@code (v + 1) / 2 * 255}, keeping the low 8
   * bits of the truncated result. Values outside [-1, 1] wrap around; NaN maps to 0.
   */
  public static int toChannel(double v) {
    return (int) ((v + 1) / 2 * 255) & 0xff;
  }

  /** Returns this color as an opaque ARGB pixel. */
  public int toArgb() {
    return 0xff000000 | (toChannel(red) << 16) | (toChannel(green) << 8) | toChannel(blue);
  }
}
