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

package org.randomart.grammar;

import org.jspecify.annotations.Nullable;
import org.randomart.expr.SourcePos;

/**
 * Thrown when a grammar cannot be loaded: a syntax error, a production defined more than once, or a
 * production whose alternative weights are out of range or add up to more than 1.
 */
public class GrammarException extends Exception {

  private final @Nullable SourcePos pos;

  public GrammarException(@Nullable SourcePos pos, String message) {
    super(message);
    this.pos = pos;
  }

  public GrammarException(@Nullable SourcePos pos, String message, Throwable cause) {
    super(message, cause);
    this.pos = pos;
  }

  /** The position of the offending grammar element, if known. */
  public @Nullable SourcePos pos() {
    return pos;
  }
}
