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
package com.github.benmanes.lrudict.cache.stats;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.lrudict.cache.Cache;
import com.google.errorprone.annotations.Immutable;

/**
 * The totals a {@link Cache} has recorded. A lookup through {@code getIfPresent} or either
 * {@code get} counts one hit or one miss. A miss in {@code get(key, mappingFunction)} also counts
 * one load success when the function's value is stored, or one load failure when the function
 * returns {@code null} or throws. Each entry removed because the cache was full counts one
 * eviction. Writes, invalidations, replacements, and policy inspection are not counted.
 * <p>
 * All counts are non-negative and stop at {@link Long#MAX_VALUE}.
 */
@Immutable
public final class CacheStats {
  private static final CacheStats EMPTY = new CacheStats(0L, 0L, 0L, 0L, 0L);

  private final long hitCount;
  private final long missCount;
  private final long loadSuccessCount;
  private final long loadFailureCount;
  private final long evictionCount;

  private CacheStats(long hitCount, long missCount,
      long loadSuccessCount, long loadFailureCount, long evictionCount) {
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.loadSuccessCount = loadSuccessCount;
    this.loadFailureCount = loadFailureCount;
    this.evictionCount = evictionCount;
  }

  /**
   * Returns the statistics with the given counts.
   *
   * @throws IllegalArgumentException if a count is negative
   */
  public static CacheStats of(long hitCount, long missCount,
      long loadSuccessCount, long loadFailureCount, long evictionCount) {
    // the sign bit survives the union only if some count is negative
    if ((hitCount | missCount | loadSuccessCount | loadFailureCount | evictionCount) < 0) {
      throw new IllegalArgumentException(String.format(
          "counts must not be negative: hits=%d, misses=%d, loadSuccesses=%d, "
          + "loadFailures=%d, evictions=%d",
          hitCount, missCount, loadSuccessCount, loadFailureCount, evictionCount));
    }
    return new CacheStats(hitCount, missCount, loadSuccessCount, loadFailureCount, evictionCount);
  }

  /** Returns the statistics of a cache that has recorded nothing. */
  public static CacheStats empty() {
    return EMPTY;
  }

  /** Returns the number of lookups, {@code hitCount + missCount}. */
  public long requestCount() {
    return addCounts(hitCount, missCount);
  }

  public long hitCount() {
    return hitCount;
  }

  public long missCount() {
    return missCount;
  }

  /** Returns the share of lookups that were hits, or {@code 1.0} if there were none. */
  public double hitRate() {
    long requests = requestCount();
    return (requests == 0) ? 1.0 : (double) hitCount / requests;
  }

  /** Returns the share of lookups that were misses, or {@code 0.0} if there were none. */
  public double missRate() {
    long requests = requestCount();
    return (requests == 0) ? 0.0 : (double) missCount / requests;
  }

  /** Returns the number of mapping function calls, {@code loadSuccessCount + loadFailureCount}. */
  public long loadCount() {
    return addCounts(loadSuccessCount, loadFailureCount);
  }

  public long loadSuccessCount() {
    return loadSuccessCount;
  }

  public long loadFailureCount() {
    return loadFailureCount;
  }

  /** Returns the number of entries evicted because the cache was full. */
  public long evictionCount() {
    return evictionCount;
  }

  /** Returns the per-count sums of this and {@code other}. */
  public CacheStats plus(CacheStats other) {
    return new CacheStats(
        addCounts(hitCount, other.hitCount),
        addCounts(missCount, other.missCount),
        addCounts(loadSuccessCount, other.loadSuccessCount),
        addCounts(loadFailureCount, other.loadFailureCount),
        addCounts(evictionCount, other.evictionCount));
  }

  /**
   * Returns the per-count differences of this and {@code other}, where a count that would be
   * negative is zero. This gives the activity between two snapshots of the same cache.
   */
  public CacheStats minus(CacheStats other) {
    return new CacheStats(
        Math.max(0L, hitCount - other.hitCount),
        Math.max(0L, missCount - other.missCount),
        Math.max(0L, loadSuccessCount - other.loadSuccessCount),
        Math.max(0L, loadFailureCount - other.loadFailureCount),
        Math.max(0L, evictionCount - other.evictionCount));
  }

  /** Returns the sum of two non-negative counts, or {@link Long#MAX_VALUE} if it overflows. */
  static long addCounts(long a, long b) {
    long sum = a + b;
    return (sum < 0) ? Long.MAX_VALUE : sum;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof CacheStats)) {
      return false;
    }
    var other = (CacheStats) o;
    return (hitCount == other.hitCount)
        && (missCount == other.missCount)
        && (loadSuccessCount == other.loadSuccessCount)
        && (loadFailureCount == other.loadFailureCount)
        && (evictionCount == other.evictionCount);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hitCount, missCount, loadSuccessCount, loadFailureCount, evictionCount);
  }

  @Override
  public String toString() {
    return "CacheStats{hitCount=" + hitCount
        + ", missCount=" + missCount
        + ", loadSuccessCount=" + loadSuccessCount
        + ", loadFailureCount=" + loadFailureCount
        + ", evictionCount=" + evictionCount + '}';
  }
}
