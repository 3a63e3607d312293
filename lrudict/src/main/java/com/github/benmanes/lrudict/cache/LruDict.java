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

import static java.util.Objects.requireNonNull;

import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.lrudict.cache.stats.CacheStats;
import com.github.benmanes.lrudict.cache.stats.SimpleStatsCounter;
import com.github.benmanes.lrudict.cache.stats.StatsCounter;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * Configures and creates {@link Cache} instances. A cache needs a {@linkplain #maximumSize maximum
 * size}; a {@linkplain #removalListener removal listener} and {@linkplain #recordStats statistics}
 * are optional.
 * <pre>{@code
 *   Cache<Fingerprint, CompiledScript> scripts = LruDict.newBuilder()
 *       .maximumSize(1_000)
 *       .removalListener((Fingerprint key, CompiledScript script, RemovalCause cause) ->
 *           System.out.printf("Key %s was removed (%s)%n", key, cause))
 *       .build();
 * }</pre>
 * Each setting may be made once. A builder may build any number of caches, which share nothing
 * but the removal listener.
 *
 * @param <K> the key type that the removal listener, if any, accepts
 * @param <V> the value type that the removal listener, if any, accepts
 */
public final class LruDict<K, V> {
  static final int UNSET_INT = -1;

  long maximumSize = UNSET_INT;

  @Nullable RemovalListener<? super K, ? super V> removalListener;
  @Nullable Supplier<? extends StatsCounter> statsCounterSupplier;

  private LruDict() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /** Returns a builder with no settings made. */
  @CheckReturnValue
  public static LruDict<Object, Object> newBuilder() {
    return new LruDict<>();
  }

  /** Returns a builder with the settings of {@code spec}. */
  @CheckReturnValue
  public static LruDict<Object, Object> from(LruDictSpec spec) {
    return spec.toBuilder();
  }

  /**
   * Returns a builder with the settings written in {@code spec}.
   *
   * @throws IllegalArgumentException if {@link LruDictSpec#parse} rejects {@code spec}
   */
  @CheckReturnValue
  public static LruDict<Object, Object> from(String spec) {
    return from(LruDictSpec.parse(spec));
  }

  /**
   * Sets the number of entries a cache holds before an insertion evicts the least recently used
   * one. A cache with a maximum of zero evicts every entry as soon as it is inserted.
   *
   * @throws IllegalArgumentException if {@code maximumSize} is negative or above
   *         {@link Integer#MAX_VALUE}
   * @throws IllegalStateException if the maximum size was already set
   */
  public LruDict<K, V> maximumSize(long maximumSize) {
    requireState(this.maximumSize == UNSET_INT,
        "maximum size was already set to %s", this.maximumSize);
    requireArgument(maximumSize >= 0, "maximum size must not be negative");
    requireArgument(maximumSize <= Integer.MAX_VALUE,
        "maximum size must not exceed %s", Integer.MAX_VALUE);
    this.maximumSize = maximumSize;
    return this;
  }

  /**
   * Sets the listener that a cache calls after an entry is evicted, replaced, or invalidated. The
   * call happens on the caller's thread once the cache is consistent again. An exception thrown by
   * the listener is logged and does not reach the caller.
   * <p>
   * The returned builder is this one, narrowed to the listener's key and value types; keep using
   * the returned reference.
   *
   * @throws IllegalStateException if a removal listener was already set
   */
  public <K1 extends K, V1 extends V> LruDict<K1, V1> removalListener(
      RemovalListener<? super K1, ? super V1> removalListener) {
    requireState(this.removalListener == null,
        "removal listener was already set to %s", this.removalListener);

    @SuppressWarnings("unchecked")
    LruDict<K1, V1> self = (LruDict<K1, V1>) this;
    self.removalListener = requireNonNull(removalListener);
    return self;
  }

  /**
   * Makes each cache count its hits, misses, loads, and evictions in a {@link SimpleStatsCounter},
   * reported by {@link Cache#stats}. Without it the cache reports {@link CacheStats#empty()}.
   *
   * @throws IllegalStateException if statistics recording was already set
   */
  public LruDict<K, V> recordStats() {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    statsCounterSupplier = SimpleStatsCounter::new;
    return this;
  }

  /**
   * Like {@link #recordStats()}, but each cache asks {@code statsCounterSupplier} for its counter
   * when it is built. An exception thrown by the counter is logged by the cache and otherwise
   * ignored.
   *
   * @throws IllegalStateException if statistics recording was already set
   */
  public LruDict<K, V> recordStats(Supplier<? extends StatsCounter> statsCounterSupplier) {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    this.statsCounterSupplier = requireNonNull(statsCounterSupplier);
    return this;
  }

  boolean isRecordingStats() {
    return (statsCounterSupplier != null);
  }

  /** Returns a new counter for a cache, or {@code null} if statistics are not recorded. */
  @Nullable StatsCounter newStatsCounter() {
    return (statsCounterSupplier == null)
        ? null
        : requireNonNull(statsCounterSupplier.get(), "the stats counter supplier returned null");
  }

  @SuppressWarnings("unchecked")
  @Nullable RemovalListener<K, V> getRemovalListener() {
    return (RemovalListener<K, V>) removalListener;
  }

  /**
   * Returns a new, empty cache with these settings. The builder is left unchanged.
   *
   * @throws IllegalStateException if the maximum size was not set
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> Cache<K1, V1> build() {
    requireState(maximumSize != UNSET_INT, "maximumSize requires a value");

    @SuppressWarnings("unchecked")
    LruDict<K1, V1> self = (LruDict<K1, V1>) this;
    return new BoundedLruCache<>(self);
  }

  /** Lists the settings that were made, such as {@code LruDict{maximumSize=10, recordStats}}. */
  @Override
  public String toString() {
    var s = new StringBuilder(64);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (maximumSize != UNSET_INT) {
      s.append("maximumSize=").append(maximumSize).append(", ");
    }
    if (isRecordingStats()) {
      s.append("recordStats, ");
    }
    if (removalListener != null) {
      s.append("removalListener, ");
    }
    if (s.length() > baseLength) {
      s.setLength(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
