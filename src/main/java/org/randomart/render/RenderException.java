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

import java.util.OptionalInt;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a frame cannot be rendered, or when rendering is abandoned (see {@link
 * RenderCancelledException}).
 */
public class RenderException extends Exception {

  /** The index of the frame being rendered, or -1 if the failure isn't specific to a frame. */
  private final int frame;

  public RenderException(String message, int frame, @Nullable Throwable cause) {
    super(message, cause);
    this.frame = frame;
  }

  /** The frame that failed, if the failure was specific to one frame. */
  public OptionalInt frame() {
    return (frame < 0) ? OptionalInt.empty() : OptionalInt.of(frame);
  }
}
