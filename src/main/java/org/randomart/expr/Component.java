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
import java.util.stream.Collectors;

/** The six scalars of a {@link CoordinateState} that an expression may refer to. */
public enum Component {
  X("x"),
  Y("y"),
  FRAME("f"),
  R("r"),
  G("g"),
  B("b");

  private static final ImmutableMap<String, Component> BY_SYMBOL =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(Component::symbol, Function.identity()));

  private final String symbol;

  Component(String symbol) {
    this.symbol = symbol;
  }

  /** The single-letter name used for this component in grammars. */
  public String symbol() {
    return symbol;
  }

  /** Returns the component with the given grammar symbol. */
  public static Component forSymbol(String symbol) {
    Component result = BY_SYMBOL.get(symbol);
    if (result == null) {
      throw new IllegalArgumentException(
          "Unknown component \""
              + symbol
              + "\" (expected one of "
              + BY_SYMBOL.keySet().stream().collect(Collectors.joining(", "))
              + ")");
    }
    return result;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
