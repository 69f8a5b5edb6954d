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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;

/**
 * A production prepared for sampling: its alternatives sorted by ascending probability, with a
 * table of cumulative probabilities.
 */
final class ResolvedProduction {

  /**
   * Weights may add up to slightly more than 1 when they are decimal approximations (e.g. {@code
   * 0.33 | 0.33 | 0.34}); sums up to this far above 1 are accepted.
   */
  private static final double WEIGHT_TOLERANCE = 1e-9;

  final Production production;

  /** The production's alternatives, in ascending order of probability (ties in source order). */
  final ImmutableList<WeightedAlternative> alternatives;

  /** {@code cumulative[i]} is the sum of the probabilities of {@code alternatives[0..i]}. */
  private final double[] cumulative;

  /** The sum of all the alternatives' probabilities, which is the last element of cumulative. */
  final double total;

  private ResolvedProduction(
      Production production, ImmutableList<WeightedAlternative> alternatives, double[] cumulative) {
    this.production = production;
    this.alternatives = alternatives;
    this.cumulative = cumulative;
    this.total = cumulative[cumulative.length - 1];
  }

  /**
   * Sorts the production's alternatives and computes their cumulative probabilities. Throws a
   * GrammarException if any probability is outside [0, 1] or if they add up to more than 1.
   */
  static ResolvedProduction resolve(Production production) throws GrammarException {
    ImmutableList<WeightedAlternative> sorted =
        ImmutableList.sortedCopyOf(
            Comparator.comparingDouble(WeightedAlternative::probability),
            production.alternatives());
    double[] cumulative = new double[sorted.size()];
    double sum = 0;
    for (int i = 0; i < cumulative.length; i++) {
      WeightedAlternative alternative = sorted.get(i);
      double probability = alternative.probability();
      if (!(probability >= 0 && probability <= 1)) {
        throw new GrammarException(
            alternative.pos(),
            String.format(
                "production %s has a weight outside [0, 1] (%s) at %s",
                production.name(), probability, alternative.pos()));
      }
      sum += probability;
      if (sum > 1 + WEIGHT_TOLERANCE) {
        throw new GrammarException(
            production.pos(),
            String.format("production %s's weights exceed 1 (%s)", production.name(), sum));
      }
      cumulative[i] = sum;
    }
    return new ResolvedProduction(production, sorted, cumulative);
  }

  String name() {
    return production.name();
  }

  /**
   * Returns the index (in {@link #alternatives}) of the alternative selected by {@code unit}, a
   * uniform sample from [0, 1).
   *
   * <p>The sample is scaled to [0, total) so that the probabilities are effectively renormalized
   * when they add up to less than 1. The result is the first alternative whose cumulative
   * probability is at least the scaled sample; rounding may leave the sample past the last entry,
   * in which case the last alternative is chosen.
   */
  int pick(double unit) {
    double sample = unit * total;
    int lo = 0;
    int hi = cumulative.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (cumulative[mid] < sample) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return Math.min(lo, cumulative.length - 1);
  }
}
