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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A parsed grammar: an ordered list of productions, the first of which is the start rule.
 *
 * <p>A Grammar is not checked when it is constructed; {@link #validate} (called by the grammar
 * compiler) and {@link Generator#generate} report duplicate names and bad weights.
 */
public record Grammar(String source, ImmutableList<Production> productions) {

  public Grammar {
    Preconditions.checkArgument(!productions.isEmpty(), "Grammar %s has no productions", source);
  }

  /** The production that generation starts from. */
  public Production start() {
    return productions.get(0);
  }

  /**
   * Checks that production names are unique and that each production's weights are valid, throwing
   * a GrammarException for the first problem found.
   */
  public void validate() throws GrammarException {
    GeneratorState.resolveRules(this);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Production production : productions) {
      sb.append(production).append('\n');
    }
    return sb.toString();
  }
}
