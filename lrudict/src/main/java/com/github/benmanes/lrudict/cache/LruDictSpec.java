/*
 * Copyright 2026 The LruDict Authors. All Rights Reserved.
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
package com.github.benmanes.lrudict.cache;

import static com.github.benmanes.lrudict.cache.LruDict.UNSET_INT;
import static com.github.benmanes.lrudict.cache.LruDict.requireArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * The settings of a {@link LruDict} builder written as text, for example read from a property
 * file or a command-line flag. The text is a comma-separated list of settings:
 * <ul>
 *   <li>{@code maximumSize=N} sets {@link LruDict#maximumSize(long)}, where {@code N} is between
 *       zero and {@link Integer#MAX_VALUE}
 *   <li>{@code recordStats} sets {@link LruDict#recordStats()}
 * </ul>
 * Spaces around the commas and the equals sign are ignored, empty settings are skipped, and a
 * setting may not appear twice. A parsed spec always yields a valid builder, although a maximum
 * size must still be given before {@code build()} when the text has none.
 * <p>
 * Settings that take an object, such as a removal listener, are made on the builder returned by
 * {@link LruDict#from(LruDictSpec)}.
 */
public final class LruDictSpec {
  long maximumSize = UNSET_INT;
  boolean recordStats;

  private LruDictSpec() {}

  /**
   * Returns the settings read from {@code text}.
   *
   * @param text the comma-separated settings
   * @return the parsed settings
   * @throws IllegalArgumentException if a setting is unknown, repeated, or has a bad value
   */
  @SuppressWarnings("StringSplitter")
  public static LruDictSpec parse(String text) {
    requireNonNull(text);
    var spec = new LruDictSpec();
    for (String setting : text.split(",")) {
      String trimmed = setting.trim();
      if (!trimmed.isEmpty()) {
        spec.apply(trimmed);
      }
    }
    return spec;
  }

  /** Applies a single {@code key} or {@code key=value} setting. */
  void apply(String setting) {
    int separator = setting.indexOf('=');
    String key = (separator < 0) ? setting : setting.substring(0, separator).trim();
    @Nullable String value = (separator < 0) ? null : setting.substring(separator + 1).trim();

    if (key.equals("maximumSize")) {
      requireArgument(maximumSize == UNSET_INT, "maximumSize was already set to %s", maximumSize);
      maximumSize = parseMaximumSize(value);
    } else if (key.equals("recordStats")) {
      requireArgument(!recordStats, "recordStats was already set");
      requireArgument(value == null, "recordStats does not take a value, but was given %s", value);
      recordStats = true;
    } else {
      throw new IllegalArgumentException("Unknown setting " + key);
    }
  }

  /** Returns the maximum size written as {@code value}, checked against the builder's limits. */
  static long parseMaximumSize(@Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "maximumSize requires a value");
    long size;
    try {
      size = Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("maximumSize must be a whole number, but was " + value, e);
    }
    requireArgument((size >= 0) && (size <= Integer.MAX_VALUE),
        "maximumSize must be between 0 and %s, but was %s", Integer.MAX_VALUE, size);
    return size;
  }

  /** Returns a new builder with these settings. */
  LruDict<Object, Object> toBuilder() {
    LruDict<Object, Object> builder = LruDict.newBuilder();
    if (maximumSize != UNSET_INT) {
      builder.maximumSize(maximumSize);
    }
    if (recordStats) {
      builder.recordStats();
    }
    return builder;
  }

  /**
   * Returns the settings in the form accepted by {@link #parse}, with the maximum size first.
   * Parsing the result yields an equal spec.
   */
  public String toParsableString() {
    var settings = new StringBuilder();
    if (maximumSize != UNSET_INT) {
      settings.append("maximumSize=").append(maximumSize);
    }
    if (recordStats) {
      settings.append((settings.length() == 0) ? "" : ",").append("recordStats");
    }
    return settings.toString();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof LruDictSpec)) {
      return false;
    }
    var other = (LruDictSpec) o;
    return (maximumSize == other.maximumSize) && (recordStats == other.recordStats);
  }

  @Override
  public int hashCode() {
    return Objects.hash(maximumSize, recordStats);
  }

  @Override
  public String toString() {
    return "LruDictSpec{" + toParsableString() + '}';
  }
}
