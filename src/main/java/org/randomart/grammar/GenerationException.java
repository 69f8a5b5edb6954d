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

/** Thrown when a random expression tree cannot be generated from a grammar. */
public class GenerationException extends Exception {

  public enum Kind {
    /**
     * An alternative referred to a rule that the grammar does not define. The grammar itself is
     * broken, so this is never retried.
     */
    UNDEFINED_RULE,

    /**
     * A rule was entered with no remaining depth. The enclosing rule may retry with a different
     * alternative.
     */
    MAX_DEPTH,

    /**
     * A rule failed to generate on every one of its allowed tries. Generation ends; the enclosing
     * rules do not retry.
     */
    MAX_TRIES
  }

  private final Kind kind;

  GenerationException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  GenerationException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
