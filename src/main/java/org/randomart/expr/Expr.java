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

import org.randomart.util.StringUtil;

/**
 * An evaluation-time expression node. A tree of Exprs is produced once by generation and is then
 * shared, read-only, by every pixel evaluation; {@link #eval} never modifies a node and returns
 * either the node itself (for values) or a newly allocated result.
 *
 * <p>Every node remembers the position of the grammar element it was generated from, so that
 * evaluation errors can point back at the grammar.
 */
public sealed interface Expr {

  /** The position of the grammar element this node was generated from. */
  SourcePos pos();

  /** A short description of this kind of node, used in error messages. */
  String kind();

  /**
   * Evaluates this node against the given state. Evaluating the same node against equal states
   * always returns equal results.
   */
  Expr eval(CoordinateState state) throws EvalException;

  /** Returns the value of an evaluated node, which must be a {@link NumberValue}. */
  static double requireNumber(Expr evaluated) throws EvalException {
    if (evaluated instanceof NumberValue number) {
      return number.value();
    }
    throw new EvalException(EvalException.Kind.NOT_A_NUMBER, evaluated);
  }

  /** Returns the value of an evaluated node, which must be a {@link BooleanValue}. */
  static boolean requireBoolean(Expr evaluated) throws EvalException {
    if (evaluated instanceof BooleanValue bool) {
      return bool.value();
    }
    throw new EvalException(EvalException.Kind.NOT_A_BOOLEAN, evaluated);
  }

  /** A numeric constant. */
  record NumberValue(SourcePos pos, double value) implements Expr {
    @Override
    public String kind() {
      return "number";
    }

    @Override
    public Expr eval(CoordinateState state) {
      return this;
    }

    @Override
    public String toString() {
      return StringUtil.formatNumber(value);
    }
  }

  /** A boolean constant. */
  record BooleanValue(SourcePos pos, boolean value) implements Expr {
    @Override
    public String kind() {
      return "boolean";
    }

    @Override
    public Expr eval(CoordinateState state) {
      return this;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** Evaluates to the current value of one of the coordinate state's components. */
  record ComponentRef(SourcePos pos, Component component) implements Expr {
    @Override
    public String kind() {
      return "component";
    }

    @Override
    public Expr eval(CoordinateState state) {
      return new NumberValue(pos, state.get(component));
    }

    @Override
    public String toString() {
      return component.symbol();
    }
  }

  /** Applies an {@link Op} to two numeric operands. */
  record BinaryOp(SourcePos pos, Op op, Expr left, Expr right) implements Expr {
    @Override
    public String kind() {
      return "operator";
    }

    @Override
    public Expr eval(CoordinateState state) throws EvalException {
      double l = requireNumber(left.eval(state));
      double r = requireNumber(right.eval(state));
      if (op.isComparison()) {
        return new BooleanValue(pos, op.applyComparison(l, r));
      }
      return new NumberValue(pos, op.applyArithmetic(l, r));
    }

    @Override
    public String toString() {
      return op.opName() + "(" + left + ", " + right + ")";
    }
  }

  /**
   * Three expressions evaluated independently. The elements of an evaluated Triple are not
   * type-checked until the root is converted to a color (see {@link ColorTriple#of}).
   */
  record Triple(SourcePos pos, Expr one, Expr two, Expr three) implements Expr {
    @Override
    public String kind() {
      return "triple";
    }

    /** Returns the element at {@code index} (0, 1 or 2). */
    public Expr element(int index) {
      return switch (index) {
        case 0 -> one;
        case 1 -> two;
        case 2 -> three;
        default -> throw new IndexOutOfBoundsException(index);
      };
    }

    @Override
    public Expr eval(CoordinateState state) throws EvalException {
      Expr a = one.eval(state);
      Expr b = two.eval(state);
      Expr c = three.eval(state);
      return new Triple(pos, a, b, c);
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("{", "}", 3, this::element);
    }
  }

  /**
   * Evaluates the condition, which must be a boolean, and then exactly one of the two branches. The
   * branch that is not taken is never evaluated, so it may be ill-typed without causing an error.
   */
  record IfThenElse(SourcePos pos, Expr cond, Expr then, Expr otherwise) implements Expr {
    @Override
    public String kind() {
      return "conditional";
    }

    @Override
    public Expr eval(CoordinateState state) throws EvalException {
      if (requireBoolean(cond.eval(state))) {
        return then.eval(state);
      }
      return otherwise.eval(state);
    }

    @Override
    public String toString() {
      return "if " + cond + " then " + then + " else " + otherwise;
    }
  }
}
