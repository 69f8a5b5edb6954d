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

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import org.randomart.expr.Expr;

/** Generates random expression trees from a grammar. */
public final class Generator {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private Generator() {}

  /**
   * Resolves the grammar's rules and expands its start rule into an expression tree.
   *
   * <p>The result is a deterministic function of the grammar and {@code options}.
   *
   * @throws GrammarException if a production is defined more than once or has invalid weights
   * @throws GenerationException if a rule refers to an undefined rule, or if the start rule could
   *     not be expanded within the depth and try limits
   */
  public static Generation generate(Grammar grammar, GeneratorOptions options)
      throws GrammarException, GenerationException {
    ImmutableMap<String, ResolvedProduction> rules = GeneratorState.resolveRules(grammar);
    GeneratorState state = new GeneratorState(options, rules);
    logger.atFine().log("Generating from %s with %s", grammar.source(), options);
    Expr root = state.expand(rules.get(grammar.start().name()), options.maxDepth());
    logger.atFine().log("Generated %s", root);
    return new Generation(root, options);
  }
}
