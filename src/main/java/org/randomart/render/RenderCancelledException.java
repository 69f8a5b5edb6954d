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

/**
 * Thrown to the consumer of a {@link FrameSequence} when rendering was cancelled or the consuming
 * thread was interrupted while waiting for a frame.
 */
public class RenderCancelledException extends RenderException {

  public RenderCancelledException(String message, int frame) {
    super(message, frame, null);
  }
}
