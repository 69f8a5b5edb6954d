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
 * Thrown when an expression does not reduce to the shape its context requires: an operand that is
 * not a number, a condition that is not a boolean, or a root that is not a color triple.
 */
public class EvalException extends Exception {

  /** What the offending node should have been. */
  public enum Kind {
    NOT_A_NUMBER("a number"),
    NOT_A_BOOLEAN("a boolean"),
    NOT_A_COLOR_TRIPLE("a color triple");

    final String expected;

    Kind(String expected) {
      this.expected = expected;
    }
  }

  private final Kind kind;
  private final Expr node;

  public EvalException(Kind kind, Expr node) {
    super(String.format("%s %s at %s is not %s", node.kind(), node, node.pos(), kind.expected));
    this.kind = kind;
    this.node = node;
  }

  public Kind kind() {
    return kind;
  }

  /** The (evaluated) node that had the wrong shape. */
  public Expr node() {
    return node;
  }
}
