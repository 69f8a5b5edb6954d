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

import org.randomart.expr.Component;
import org.randomart.expr.Expr;
import org.randomart.expr.Op;
import org.randomart.expr.SourcePos;
import org.randomart.util.StringUtil;

/**
 * A grammar-time expression node: the right hand side of an alternative, waiting to be expanded
 * into a concrete {@link Expr}.
 *
 * <p>Templates and Exprs are kept as separate hierarchies even where variants look alike: a {@link
 * RandomLiteral} must be turned into a constant once, at generation time, and must never survive
 * into the tree that is evaluated for each pixel.
 */
public sealed interface Template {

  SourcePos pos();

  /**
   * Expands this template into an Expr, using {@code state} for random choices and rule lookup.
   * {@code depth} is the number of rule expansions still allowed.
   */
  Expr generate(GeneratorState state, int depth) throws GenerationException;

  record NumberLiteral(SourcePos pos, double value) implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) {
      return new Expr.NumberValue(pos, value);
    }

    @Override
    public String toString() {
      return StringUtil.formatNumber(value);
    }
  }

  record BooleanLiteral(SourcePos pos, boolean value) implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) {
      return new Expr.BooleanValue(pos, value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  record ComponentLiteral(SourcePos pos, Component component) implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) {
      return new Expr.ComponentRef(pos, component);
    }

    @Override
    public String toString() {
      return component.symbol();
    }
  }

  /** {@code ?}: a number drawn uniformly from [-1, 1) when the tree is generated. */
  record RandomLiteral(SourcePos pos) implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) {
      return new Expr.NumberValue(pos, state.nextSigned());
    }

    @Override
    public String toString() {
      return "?";
    }
  }

  /** A reference to another production, expanded by sampling one of its alternatives. */
  record RuleRef(SourcePos pos, String name) implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) throws GenerationException {
      return state.expandRule(this, depth);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record BinaryOp(SourcePos pos, Op op, Template left, Template right) implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) throws GenerationException {
      Expr l = left.generate(state, depth);
      Expr r = right.generate(state, depth);
      return new Expr.BinaryOp(pos, op, l, r);
    }

    @Override
    public String toString() {
      return op.opName() + "(" + left + ", " + right + ")";
    }
  }

  record Triplet(SourcePos pos, Template one, Template two, Template three)
      implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) throws GenerationException {
      Expr a = one.generate(state, depth);
      Expr b = two.generate(state, depth);
      Expr c = three.generate(state, depth);
      return new Expr.Triple(pos, a, b, c);
    }

    @Override
    public String toString() {
      return "{" + one + ", " + two + ", " + three + "}";
    }
  }

  record IfThenElse(SourcePos pos, Template cond, Template then, Template otherwise)
      implements Template {
    @Override
    public Expr generate(GeneratorState state, int depth) throws GenerationException {
      Expr c = cond.generate(state, depth);
      Expr t = then.generate(state, depth);
      Expr e = otherwise.generate(state, depth);
      return new Expr.IfThenElse(pos, c, t, e);
    }

    @Override
    public String toString() {
      return "if " + cond + " then " + then + " else " + otherwise;
    }
  }
}
