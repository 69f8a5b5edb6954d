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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import org.antlr.v4.runtime.CharStreams;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.randomart.compiler.GrammarCompiler;
import org.randomart.expr.Component;
import org.randomart.expr.Expr;
import org.randomart.expr.SourcePos;

@RunWith(JUnit4.class)
public class GeneratorTest {

  private static final SourcePos POS = SourcePos.builtin("test");

  /** A typical grammar: every production's weights add up to 1, and most alternatives recurse. */
  private static final String ART =
      """
      S ::= {C, C, C} %1 .
      C ::= add(C, C) %0.25 | mul(C, C) %0.25 | if B then C else C %0.1
          | x %0.1 | y %0.1 | f %0.1 | ? %0.1 .
      B ::= gt(C, C) %0.5 | lt(C, C) %0.5 .
      """;

  private static Grammar compile(String text) throws GrammarException {
    return GrammarCompiler.compile(CharStreams.fromString(text), "test");
  }

  private static WeightedAlternative alternative(Component component, double probability) {
    return new WeightedAlternative(
        POS, new Template.ComponentLiteral(POS, component), probability);
  }

  private static Production production(String name, WeightedAlternative... alternatives) {
    return new Production(POS, name, ImmutableList.copyOf(alternatives));
  }

  @Test
  public void sameSeedSameTree() throws Exception {
    Grammar grammar = compile(ART);
    for (long seed = 0; seed < 20; seed++) {
      GeneratorOptions options = GeneratorOptions.withDefaults(seed);
      Generation first = Generator.generate(grammar, options);
      Generation second = Generator.generate(grammar, options);
      assertThat(second.root()).isEqualTo(first.root());
      assertThat(second.root().toString()).isEqualTo(first.root().toString());
      assertThat(first.options()).isEqualTo(options);
    }
  }

  @Test
  public void differentSeedsDifferentTrees() throws Exception {
    Grammar grammar = compile(ART);
    Set<String> trees = new HashSet<>();
    for (long seed = 0; seed < 20; seed++) {
      trees.add(Generator.generate(grammar, GeneratorOptions.withDefaults(seed)).root().toString());
    }
    assertThat(trees.size()).isGreaterThan(1);
  }

  @Test
  public void wellFormedGrammarNeverRunsOutOfTries() throws Exception {
    Grammar grammar = compile(ART);
    for (long seed = 0; seed < 500; seed++) {
      Expr root = Generator.generate(grammar, GeneratorOptions.withDefaults(seed)).root();
      assertThat(root).isInstanceOf(Expr.Triple.class);
    }
  }

  @Test
  public void randomLiteralIsFixedAtGeneration() throws Exception {
    Grammar grammar = compile("S ::= {?, ?, ?} %1 .");
    Expr.Triple root =
        (Expr.Triple) Generator.generate(grammar, GeneratorOptions.withDefaults(42)).root();
    Set<Double> values = new HashSet<>();
    for (int i = 0; i < 3; i++) {
      double value = ((Expr.NumberValue) root.element(i)).value();
      assertThat(value).isAtLeast(-1.0);
      assertThat(value).isLessThan(1.0);
      values.add(value);
    }
    assertThat(values).hasSize(3);
  }

  @Test
  public void weightedSampling() throws GrammarException {
    ResolvedProduction rule =
        ResolvedProduction.resolve(
            production(
                "S",
                alternative(Component.X, 0.5),
                alternative(Component.Y, 0.2),
                alternative(Component.FRAME, 0.3)));
    Map<Double, Double> frequencies = sample(rule, 100_000);
    assertThat(frequencies.get(0.2)).isWithin(0.01).of(0.2);
    assertThat(frequencies.get(0.3)).isWithin(0.01).of(0.3);
    assertThat(frequencies.get(0.5)).isWithin(0.01).of(0.5);
  }

  @Test
  public void weightsBelowOneAreRenormalized() throws GrammarException {
    ResolvedProduction rule =
        ResolvedProduction.resolve(
            production("S", alternative(Component.X, 0.3), alternative(Component.Y, 0.1)));
    assertThat(rule.total).isWithin(1e-12).of(0.4);
    Map<Double, Double> frequencies = sample(rule, 100_000);
    assertThat(frequencies.get(0.1)).isWithin(0.01).of(0.25);
    assertThat(frequencies.get(0.3)).isWithin(0.01).of(0.75);
  }

  /** Returns the fraction of {@code n} picks that chose each alternative, keyed by probability. */
  private static Map<Double, Double> sample(ResolvedProduction rule, int n) {
    SplittableRandom random = new SplittableRandom(1);
    Map<Double, Double> counts = new HashMap<>();
    for (int i = 0; i < n; i++) {
      double probability = rule.alternatives.get(rule.pick(random.nextDouble())).probability();
      counts.merge(probability, 1.0 / n, Double::sum);
    }
    return counts;
  }

  @Test
  public void alternativesAreSortedByProbability() throws GrammarException {
    ResolvedProduction rule =
        ResolvedProduction.resolve(
            production(
                "S",
                alternative(Component.X, 0.5),
                alternative(Component.Y, 0.25),
                alternative(Component.R, 0.25)));
    assertThat(Lists.transform(rule.alternatives, a -> a.template().toString()))
        .containsExactly("y", "r", "x")
        .inOrder();
    assertThat(rule.pick(0)).isEqualTo(0);
    assertThat(rule.pick(0.3)).isEqualTo(1);
    assertThat(rule.pick(0.99999)).isEqualTo(2);
  }

  @Test
  public void weightsMayExceedOneByRounding() throws GrammarException {
    ResolvedProduction rule =
        ResolvedProduction.resolve(
            production(
                "S",
                alternative(Component.X, 0.1),
                alternative(Component.Y, 0.2),
                alternative(Component.R, 0.7)));
    // In floating point the sum may be slightly more than 1.
    assertThat(rule.total).isWithin(1e-9).of(1.0);
  }

  @Test
  public void weightsOverOne() {
    Grammar grammar =
        new Grammar(
            "test",
            ImmutableList.of(
                production("S", alternative(Component.X, 0.6), alternative(Component.Y, 0.5))));
    GrammarException e =
        assertThrows(
            GrammarException.class,
            () -> Generator.generate(grammar, GeneratorOptions.withDefaults(0)));
    assertThat(e).hasMessageThat().startsWith("production S's weights exceed 1");
    assertThat(e.pos()).isEqualTo(POS);
  }

  @Test
  public void duplicateProduction() {
    Grammar grammar =
        new Grammar(
            "test",
            ImmutableList.of(
                production("S", alternative(Component.X, 1)),
                production("S", alternative(Component.Y, 1))));
    GrammarException e = assertThrows(GrammarException.class, grammar::validate);
    assertThat(e).hasMessageThat().contains("production S has been defined multiple times");
  }

  @Test
  public void depthIsBounded() throws GrammarException {
    Grammar grammar = compile("S ::= add(S, S) %1.0 .");
    GenerationException e =
        assertThrows(
            GenerationException.class,
            () -> Generator.generate(grammar, new GeneratorOptions(0, 5, 3)));
    assertThat(e.kind()).isEqualTo(GenerationException.Kind.MAX_TRIES);
    Throwable root = Throwables.getRootCause(e);
    assertThat(root).isInstanceOf(GenerationException.class);
    assertThat(((GenerationException) root).kind()).isEqualTo(GenerationException.Kind.MAX_DEPTH);
    // The innermost rule's MAX_TRIES is not retried by the rules above it.
    assertThat(e).hasCauseThat().isSameInstanceAs(root);
  }

  @Test(timeout = 10_000)
  public void grammarWithoutBaseCaseFailsQuicklyWithDefaults() throws GrammarException {
    Grammar grammar = compile("S ::= add(S, S) %1.0 .");
    for (long seed = 0; seed < 10; seed++) {
      GeneratorOptions options = GeneratorOptions.withDefaults(seed);
      GenerationException e =
          assertThrows(GenerationException.class, () -> Generator.generate(grammar, options));
      assertThat(e.kind()).isEqualTo(GenerationException.Kind.MAX_TRIES);
      assertThat(e)
          .hasMessageThat()
          .isEqualTo(
              String.format(
                  "reached max generation tries (%d) for production S",
                  options.maxGenerationTries()));
    }
  }

  @Test
  public void zeroDepthFailsImmediately() throws GrammarException {
    Grammar grammar = compile("S ::= {x, y, f} %1 .");
    GenerationException e =
        assertThrows(
            GenerationException.class,
            () -> Generator.generate(grammar, new GeneratorOptions(0, 0, 10)));
    assertThat(e.kind()).isEqualTo(GenerationException.Kind.MAX_DEPTH);
  }

  @Test
  public void shallowAlternativeIsFoundByRetrying() throws Exception {
    // With depth 2 only the x alternative of C can succeed; retries find it.
    Grammar grammar =
        compile(
            """
            S ::= {C, C, C} %1 .
            C ::= add(C, C) %0.9 | x %0.1 .
            """);
    Generation generation = Generator.generate(grammar, new GeneratorOptions(3, 2, 1000));
    assertThat(generation.root().toString()).isEqualTo("{x, x, x}");
  }

  @Test
  public void undefinedRuleIsNotRetried() throws GrammarException {
    Grammar grammar =
        compile(
            """
            S ::= {C, C, C} %1 .
            C ::= Missing %0.5 | x %0.5 .
            """);
    int undefined = 0;
    for (long seed = 0; seed < 20; seed++) {
      try {
        Generator.generate(grammar, GeneratorOptions.withDefaults(seed));
      } catch (GenerationException e) {
        // Retrying would eventually pick x, so any failure must be the undefined rule.
        assertThat(e.kind()).isEqualTo(GenerationException.Kind.UNDEFINED_RULE);
        assertThat(e)
            .hasMessageThat()
            .isEqualTo("rule Missing does not exist (referenced at test:2:7)");
        undefined++;
      }
    }
    assertThat(undefined).isGreaterThan(0);
  }
}
