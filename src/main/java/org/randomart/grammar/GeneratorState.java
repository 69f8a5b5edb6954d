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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SplittableRandom;
import org.randomart.expr.Expr;

/**
 * The state of a single generation run: the options, the seeded random number source, and the
 * grammar's resolved rules.
 *
 * <p>A GeneratorState belongs to the one thread running {@link Generator#generate}; the random
 * number source is not safe for concurrent use.
 */
public final class GeneratorState {

  private final GeneratorOptions options;
  private final SplittableRandom random;
  private final ImmutableMap<String, ResolvedProduction> rules;

  GeneratorState(GeneratorOptions options, ImmutableMap<String, ResolvedProduction> rules) {
    this.options = options;
    this.random = new SplittableRandom(options.seed());
    this.rules = rules;
  }

  /**
   * Resolves each of the grammar's productions, keyed by name in grammar order. Throws a
   * GrammarException if a name is defined more than once or a production's weights are invalid.
   */
  static ImmutableMap<String, ResolvedProduction> resolveRules(Grammar grammar)
      throws GrammarException {
    Map<String, ResolvedProduction> rules = new LinkedHashMap<>();
    for (Production production : grammar.productions()) {
      ResolvedProduction first = rules.get(production.name());
      if (first != null) {
        throw new GrammarException(
            production.pos(),
            String.format(
                "production %s has been defined multiple times (at %s and %s)",
                production.name(), first.production.pos(), production.pos()));
      }
      rules.put(production.name(), ResolvedProduction.resolve(production));
    }
    return ImmutableMap.copyOf(rules);
  }

  /** Returns a number drawn uniformly from [-1, 1). */
  double nextSigned() {
    return random.nextDouble() * 2 - 1;
  }

  /** Expands a reference to a rule; referring to a rule that isn't defined is fatal. */
  Expr expandRule(Template.RuleRef ref, int depth) throws GenerationException {
    ResolvedProduction rule = rules.get(ref.name());
    if (rule == null) {
      throw new GenerationException(
          GenerationException.Kind.UNDEFINED_RULE,
          String.format("rule %s does not exist (referenced at %s)", ref.name(), ref.pos()));
    }
    return expand(rule, depth);
  }

  /**
   * Picks an alternative of {@code rule} at random and generates it with one less level of depth.
   * If that fails because a nested rule ran out of depth, picks again, up to the configured number
   * of tries. Any other failure, including a nested rule running out of tries, ends generation.
   */
  Expr expand(ResolvedProduction rule, int depth) throws GenerationException {
    if (depth <= 0) {
      throw new GenerationException(
          GenerationException.Kind.MAX_DEPTH,
          String.format("reached max depth (%d) expanding %s", options.maxDepth(), rule.name()));
    }
    GenerationException lastFailure = null;
    for (int i = 0; i < options.maxGenerationTries(); i++) {
      WeightedAlternative alternative = rule.alternatives.get(rule.pick(random.nextDouble()));
      try {
        return alternative.template().generate(this, depth - 1);
      } catch (GenerationException e) {
        if (e.kind() != GenerationException.Kind.MAX_DEPTH) {
          throw e;
        }
        lastFailure = e;
      }
    }
    throw new GenerationException(
        GenerationException.Kind.MAX_TRIES,
        String.format(
            "reached max generation tries (%d) for production %s",
            options.maxGenerationTries(), rule.name()),
        lastFailure);
  }
}
