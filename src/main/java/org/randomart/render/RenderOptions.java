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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.awt.image.BufferedImage;
import org.jspecify.annotations.Nullable;

/**
 * What to render: the image size, the number of frames, an optional source image whose colors are
 * available to the expression as {@code r, g, b}, and how many frames to render in parallel.
 */
public final class RenderOptions {

  public static final int DEFAULT_WIDTH = 400;
  public static final int DEFAULT_HEIGHT = 400;
  public static final int DEFAULT_FRAMES = 1;

  /** The fewest worker threads used by default, even on machines with few processors. */
  static final int MIN_DEFAULT_PARALLELISM = 10;

  private final int width;
  private final int height;
  private final int frames;
  private final int parallelism;
  private final @Nullable BufferedImage source;
  private final ProgressListener progressListener;

  private RenderOptions(Builder builder) {
    this.source = builder.source;
    // A source image determines the resolution.
    this.width = (source != null) ? source.getWidth() : builder.width;
    this.height = (source != null) ? source.getHeight() : builder.height;
    this.frames = builder.frames;
    this.parallelism = builder.parallelism;
    this.progressListener = builder.progressListener;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int frames() {
    return frames;
  }

  /** The source image, or null if {@code r, g, b} should all be 1 (white). */
  public @Nullable BufferedImage source() {
    return source;
  }

  public ProgressListener progressListener() {
    return progressListener;
  }

  /** The number of frames rendered concurrently: never more than the number of frames. */
  public int workers() {
    return Math.min(frames, parallelism);
  }

  public static final class Builder {
    private int width = DEFAULT_WIDTH;
    private int height = DEFAULT_HEIGHT;
    private int frames = DEFAULT_FRAMES;
    private int parallelism =
        Math.max(MIN_DEFAULT_PARALLELISM, Runtime.getRuntime().availableProcessors());
    private @Nullable BufferedImage source;
    private ProgressListener progressListener = ProgressListener.NONE;

    private Builder() {}

    /** Sets the size of the output; ignored if there is a source image. */
    @CanIgnoreReturnValue
    public Builder setResolution(int width, int height) {
      this.width = width;
      this.height = height;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setFrames(int frames) {
      this.frames = frames;
      return this;
    }

    /** Sets the maximum number of frames to render concurrently. */
    @CanIgnoreReturnValue
    public Builder setParallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    /** Sets the source image; the output will have the same size. */
    @CanIgnoreReturnValue
    public Builder setSource(@Nullable BufferedImage source) {
      this.source = source;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setProgressListener(ProgressListener progressListener) {
      this.progressListener = Preconditions.checkNotNull(progressListener);
      return this;
    }

    public RenderOptions build() {
      RenderOptions options = new RenderOptions(this);
      Preconditions.checkArgument(
          options.frames > 0, "number of frames must be positive (was %s)", options.frames);
      Preconditions.checkArgument(
          options.width > 0, "width must be positive (was %s)", options.width);
      Preconditions.checkArgument(
          options.height > 0, "height must be positive (was %s)", options.height);
      Preconditions.checkArgument(
          options.parallelism > 0, "parallelism must be positive (was %s)", options.parallelism);
      return options;
    }
  }
}
