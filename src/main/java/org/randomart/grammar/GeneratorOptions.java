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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.time.Clock;

/**
 * The options for one generation run. Given the same grammar, the same options always generate
 * the same expression tree, so these are saved (as JSON, see {@link #toJson}) to make a run
 * reproducible.
 *
 * @param seed the seed for the random number source, treated as an unsigned 64-bit value
 * @param maxDepth how many nested rule expansions are allowed
 * @param maxGenerationTries how many times a rule may pick an alternative before giving up
 */
public record GeneratorOptions(long seed, int maxDepth, int maxGenerationTries) {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final int DEFAULT_MAX_DEPTH = 10;
  public static final int DEFAULT_MAX_GENERATION_TRIES = 100;

  static final String SEED = "seed";
  static final String MAX_DEPTH = "max_depth";
  static final String MAX_GENERATION_TRIES = "max_generation_tries";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final BigInteger UNSIGNED_LONG_LIMIT = BigInteger.ONE.shiftLeft(Long.SIZE);

  public GeneratorOptions {
    Preconditions.checkArgument(maxDepth >= 0, "maxDepth must be non-negative (was %s)", maxDepth);
    Preconditions.checkArgument(
        maxGenerationTries > 0, "maxGenerationTries must be positive (was %s)", maxGenerationTries);
  }

  /** The default options with the given seed. */
  public static GeneratorOptions withDefaults(long seed) {
    return new GeneratorOptions(seed, DEFAULT_MAX_DEPTH, DEFAULT_MAX_GENERATION_TRIES);
  }

  /** The default options, seeded with the clock's current time in seconds. */
  public static GeneratorOptions defaults(Clock clock) {
    return withDefaults(clock.instant().getEpochSecond());
  }

  public GeneratorOptions withSeed(long seed) {
    return new GeneratorOptions(seed, maxDepth, maxGenerationTries);
  }

  public GeneratorOptions withMaxDepth(int maxDepth) {
    return new GeneratorOptions(seed, maxDepth, maxGenerationTries);
  }

  public GeneratorOptions withMaxGenerationTries(int maxGenerationTries) {
    return new GeneratorOptions(seed, maxDepth, maxGenerationTries);
  }

  /**
   * Returns these options as a single-line JSON object with the keys {@code seed}, {@code
   * max_depth} and {@code max_generation_tries}.
   */
  public String toJson() {
    ObjectNode node = MAPPER.createObjectNode();
    node.put(SEED, new BigInteger(Long.toUnsignedString(seed)));
    node.put(MAX_DEPTH, maxDepth);
    node.put(MAX_GENERATION_TRIES, maxGenerationTries);
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      // Serializing a tree of plain numbers can't fail.
      throw new AssertionError(e);
    }
  }

  /**
   * Reads options written by {@link #toJson}. Fields that are missing take their values from
   * {@code defaults} (with a warning); unknown fields are ignored.
   *
   * @throws IOException if the input is not a JSON object or a field has the wrong type
   */
  public static GeneratorOptions fromJson(Reader reader, GeneratorOptions defaults)
      throws IOException {
    JsonNode root = MAPPER.readTree(reader);
    if (root == null || root.isMissingNode() || root.isNull()) {
      logger.atWarning().log("Generator options are empty; using defaults %s", defaults);
      return defaults;
    }
    if (!root.isObject()) {
      throw new IOException("Generator options must be a JSON object, not " + root.getNodeType());
    }
    long seed = defaults.seed;
    JsonNode seedNode = root.get(SEED);
    if (seedNode == null) {
      warnMissing(SEED, Long.toUnsignedString(defaults.seed));
    } else {
      seed = unsignedLong(seedNode);
    }
    int maxDepth = intField(root, MAX_DEPTH, defaults.maxDepth);
    int maxGenerationTries = intField(root, MAX_GENERATION_TRIES, defaults.maxGenerationTries);
    try {
      return new GeneratorOptions(seed, maxDepth, maxGenerationTries);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid generator options: " + e.getMessage(), e);
    }
  }

  private static long unsignedLong(JsonNode node) throws IOException {
    if (!node.isIntegralNumber()) {
      throw new IOException(SEED + " must be an integer, not " + node);
    }
    BigInteger value = node.bigIntegerValue();
    if (value.signum() < 0 || value.compareTo(UNSIGNED_LONG_LIMIT) >= 0) {
      throw new IOException(SEED + " must be an unsigned 64-bit integer, not " + value);
    }
    // Keeps the low 64 bits, so values above Long.MAX_VALUE become negative longs.
    return value.longValue();
  }

  private static int intField(JsonNode root, String name, int fallback) throws IOException {
    JsonNode node = root.get(name);
    if (node == null) {
      warnMissing(name, fallback);
      return fallback;
    }
    if (!node.isInt()) {
      throw new IOException(name + " must be a 32-bit integer, not " + node);
    }
    return node.intValue();
  }

  private static void warnMissing(String name, Object fallback) {
    logger.atWarning().log(
        "Generator options missing %s -> fallback to default: %s", name, fallback);
  }

  @Override
  public String toString() {
    return String.format(
        "seed=%s, max_depth=%d, max_generation_tries=%d",
        Long.toUnsignedString(seed), maxDepth, maxGenerationTries);
  }
}
