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
import java.time.Duration;
import java.util.Collection;

/** Summary statistics of the time taken to render each frame. */
public record FrameTimings(int frames, Duration average, Duration min, Duration max) {

  /** Summarizes a non-empty collection of per-frame render times. */
  public static FrameTimings of(Collection<Duration> elapsed) {
    Preconditions.checkArgument(!elapsed.isEmpty(), "no frames were rendered");
    Duration total = Duration.ZERO;
    Duration min = null;
    Duration max = Duration.ZERO;
    for (Duration d : elapsed) {
      total = total.plus(d);
      if (min == null || d.compareTo(min) < 0) {
        min = d;
      }
      if (d.compareTo(max) > 0) {
        max = d;
      }
    }
    return new FrameTimings(elapsed.size(), total.dividedBy(elapsed.size()), min, max);
  }

  @Override
  public String toString() {
    return String.format("%d frames; average %s, min %s, max %s", frames, average, min, max);
  }
}
