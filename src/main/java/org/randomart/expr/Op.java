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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.Function;

/**
 * The binary operators. Arithmetic operators produce a number and comparisons produce a boolean;
 * both require numeric operands.
 */
public enum Op {
  ADD("add"),
  SUB("sub"),
  MUL("mul"),
  DIV("div"),
  MOD("mod"),
  GT("gt"),
  GE("ge"),
  LT("lt"),
  LE("le");

  private static final ImmutableMap<String, Op> BY_NAME =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(Op::opName, Function.identity()));

  private final String opName;

  Op(String opName) {
    this.opName = opName;
  }

  /** The name used for this operator in grammars, e.g. {@code "add"}. */
  public String opName() {
    return opName;
  }

  /** True for {@code gt, ge, lt, le}. */
  public boolean isComparison() {
    return switch (this) {
      case GT, GE, LT, LE -> true;
      default -> false;
    };
  }

  /**
   * Applies an arithmetic operator. Division by zero is not an error: it produces an infinity or
   * NaN, as IEEE-754 specifies. {@code mod} is the floating-point remainder.
   */
  public double applyArithmetic(double left, double right) {
    return switch (this) {
      case ADD -> left + right;
      case SUB -> left - right;
      case MUL -> left * right;
      case DIV -> left / right;
      case MOD -> left % right;
      default -> throw new IllegalStateException(opName + " is not an arithmetic operator");
    };
  }

  /** Applies a comparison operator. */
  public boolean applyComparison(double left, double right) {
    return switch (this) {
      case GT -> left > right;
      case GE -> left >= right;
      case LT -> left < right;
      case LE -> left <= right;
      default -> throw new IllegalStateException(opName + " is not a comparison");
    };
  }

  /** Returns the operator with the given grammar name. */
  public static Op forName(String name) {
    Op result = BY_NAME.get(name);
    if (result == null) {
      throw new IllegalArgumentException("Unknown operator \"" + name + "\"");
    }
    return result;
  }

  @Override
  public String toString() {
    return opName;
  }
}
