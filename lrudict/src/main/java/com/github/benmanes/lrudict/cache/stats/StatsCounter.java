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

import com.github.benmanes.lrudict.cache.Cache;
import com.github.benmanes.lrudict.cache.RemovalCause;

/**
 * Receives the events that a {@link Cache} counts when it was built with statistics recording
 * enabled, and reports the totals as a {@link CacheStats}. A cache calls its counter on the owning
 * thread and never shares it with another cache unless the supplier given to the builder does.
 * <p>
 * A counter that throws does not affect the cache: the cache logs the exception and carries on,
 * reporting empty statistics when {@link #snapshot()} fails.
 */
public interface StatsCounter {

  /** Records that {@code count} lookups found a present entry. */
  void recordHits(int count);

  /** Records that {@code count} lookups found no entry. */
  void recordMisses(int count);

  /** Records that a mapping function produced a value, which the cache then stored. */
  void recordLoadSuccess();

  /** Records that a mapping function returned {@code null} or threw. */
  void recordLoadFailure();

  /**
   * Records that an entry left the cache without being asked to. Only
   * {@link RemovalCause#SIZE} evictions are reported here.
   *
   * @param cause the reason the entry was evicted
   */
  void recordEviction(RemovalCause cause);

  /** Returns the totals recorded so far. */
  CacheStats snapshot();
}
