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

import java.util.Map;

/**
 * An access point for inspecting the size-based eviction policy of a {@link Cache} instance. None
 * of these operations promote an entry or record statistics.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public interface Policy<K, V> {

  /**
   * Returns the maximum number of entries that the cache may hold. This is fixed when the cache is
   * built.
   *
   * @return the maximum size bounding
   */
  long getMaximum();

  /**
   * Returns an unmodifiable snapshot {@link Map} view of the cache with ordered traversal. The
   * order of iteration is from the least recently used entry (coldest) to the most recently used
   * entry (hottest), which is the order in which entries would be evicted.
   * <p>
   * Beware that obtaining the mappings is <em>NOT</em> a constant-time operation.
   *
   * @param limit the maximum size of the returned map (use {@link Integer#MAX_VALUE} to disregard
   *        the limit)
   * @return a snapshot view of the cache from the coldest entry to the hottest
   * @throws IllegalArgumentException if the limit specified is negative
   */
  Map<K, V> coldest(int limit);

  /**
   * Returns an unmodifiable snapshot {@link Map} view of the cache with ordered traversal. The
   * order of iteration is from the most recently used entry (hottest) to the least recently used
   * entry (coldest).
   * <p>
   * Beware that obtaining the mappings is <em>NOT</em> a constant-time operation.
   *
   * @param limit the maximum size of the returned map (use {@link Integer#MAX_VALUE} to disregard
   *        the limit)
   * @return a snapshot view of the cache from the hottest entry to the coldest
   * @throws IllegalArgumentException if the limit specified is negative
   */
  Map<K, V> hottest(int limit);

  /**
   * Returns a view of the keys from the most recently used to the least. Each iterator walks the
   * cache at the time that it is consumed and fails with a
   * {@link java.util.ConcurrentModificationException} if the cache is modified during iteration,
   * including by a lookup that promotes an entry.
   *
   * @return the keys in recency order
   */
  Iterable<K> keys();
}
