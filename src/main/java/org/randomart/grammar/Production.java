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
import java.util.stream.Collectors;
import org.randomart.expr.SourcePos;

/** A named rule and its weighted alternatives, in the order they were written. */
public record Production(
    SourcePos pos, String name, ImmutableList<WeightedAlternative> alternatives) {

  public Production {
    Preconditions.checkArgument(!alternatives.isEmpty(), "Production %s has no alternatives", name);
  }

  @Override
  public String toString() {
    return alternatives.stream()
        .map(WeightedAlternative::toString)
        .collect(Collectors.joining(" | ", name + " ::= ", " ."));
  }
}
