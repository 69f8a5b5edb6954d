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

package org.randomart.expr;

/**
 * The position of a grammar element: the name of the source it was read from, and a 1-based line
 * and column.
 */
public record SourcePos(String source, int line, int column) {

  /** A position for nodes that were built directly rather than read from a grammar. */
  public static SourcePos builtin(String description) {
    return new SourcePos(description, 0, 0);
  }

  @Override
  public String toString() {
    return source + ":" + line + ":" + column;
  }
}
