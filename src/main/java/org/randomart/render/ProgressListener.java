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

import java.time.Duration;

/**
 * Receives progress notifications from a render. Methods are called on the thread that consumes
 * the frames, in frame order.
 */
public interface ProgressListener {

  /** A listener that ignores all notifications. */
  ProgressListener NONE = new ProgressListener() {};

  /** Called as each frame is handed to the consumer, with the time it took to render. */
  default void frameCompleted(int frame, Duration elapsed) {}

  /** Called once after the last frame has been handed to the consumer. */
  default void renderCompleted(FrameTimings timings) {}
}
