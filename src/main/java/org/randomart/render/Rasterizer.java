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
import org.jspecify.annotations.Nullable;
import org.randomart.expr.EvalException;
import org.randomart.expr.Expr;

/**
 * Renders a frame by evaluating the expression tree at each of its pixels, one after another. The
 * tree is shared read-only, so one Rasterizer may render different frames on different threads.
 */
final class Rasterizer implements FrameRenderer {
  private final Expr root;
  private final int width;
  private final int height;
  private final int frames;
  private final @Nullable BufferedImage source;

  Rasterizer(Expr root, RenderOptions options) {
    this.root = root;
    this.width = options.width();
    this.height = options.height();
    this.frames = options.frames();
    this.source = options.source();
  }

  @Override
  public BufferedImage render(int frame) throws RenderException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int sample = (source == null) ? PixelEvaluator.OPAQUE_WHITE : source.getRGB(x, y);
        try {
          image.setRGB(
              x, y, PixelEvaluator.evalPixel(root, x, y, width, height, frame, frames, sample));
        } catch (EvalException e) {
          throw new RenderException(
              String.format(
                  "Cannot render pixel (%d, %d) of frame %d: %s", x, y, frame, e.getMessage()),
              frame,
              e);
        }
      }
    }
    return image;
  }
}
