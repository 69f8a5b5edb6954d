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
 * The frames of a render, produced lazily and returned in order. Frames are rendered in the
 * background while the consumer works through them.
 *
 * <p>A FrameSequence must be closed when the consumer is done with it, whether or not it has taken
 * every frame; closing stops any rendering still in progress and waits for the rendering threads to
 * exit. Closing is idempotent. The sequence closes itself after returning the last frame or
 * throwing an exception.
 */
public interface FrameSequence extends AutoCloseable {

  /** Returns true if the sequence is open and has not yet returned all of its frames. */
  boolean hasNext();

  /**
   * Waits for the next frame and returns it.
   *
   * @throws RenderException if this or any other frame failed to render; the sequence is closed
   * @throws RenderCancelledException if rendering was cancelled or the calling thread was
   *     interrupted; the sequence is closed
   */
  Frame next() throws RenderException;

  @Override
  void close();
}
