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

import com.github.benmanes.lrudict.cache.RemovalCause;

/**
 * The counter used by {@code LruDict.recordStats()}. Each total is a plain field since a cache and
 * its counter belong to one thread, and a total that passes {@link Long#MAX_VALUE} stays there.
 */
public final class SimpleStatsCounter implements StatsCounter {
  private long hits;
  private long misses;
  private long loadSuccesses;
  private long loadFailures;
  private long evictions;

  @Override
  public void recordHits(int count) {
    hits = CacheStats.addCounts(hits, count);
  }

  @Override
  public void recordMisses(int count) {
    misses = CacheStats.addCounts(misses, count);
  }

  @Override
  public void recordLoadSuccess() {
    loadSuccesses = CacheStats.addCounts(loadSuccesses, 1);
  }

  @Override
  public void recordLoadFailure() {
    loadFailures = CacheStats.addCounts(loadFailures, 1);
  }

  @Override
  public void recordEviction(RemovalCause cause) {
    evictions = CacheStats.addCounts(evictions, 1);
  }

  @Override
  public CacheStats snapshot() {
    return CacheStats.of(hits, misses, loadSuccesses, loadFailures, evictions);
  }

  /** Adds the totals reported by {@code other} to this counter's. */
  public void incrementBy(StatsCounter other) {
    CacheStats stats = other.snapshot();
    hits = CacheStats.addCounts(hits, stats.hitCount());
    misses = CacheStats.addCounts(misses, stats.missCount());
    loadSuccesses = CacheStats.addCounts(loadSuccesses, stats.loadSuccessCount());
    loadFailures = CacheStats.addCounts(loadFailures, stats.loadFailureCount());
    evictions = CacheStats.addCounts(evictions, stats.evictionCount());
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
