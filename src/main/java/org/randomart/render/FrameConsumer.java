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
import java.io.IOException;

/** Receives each frame of a render, in order; see {@link Renderer#renderEach}. */
@FunctionalInterface
public interface FrameConsumer {
  void accept(int index, BufferedImage image) throws IOException;
}
