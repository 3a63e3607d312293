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

import java.util.NoSuchElementException;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.lrudict.cache.stats.CacheStats;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A semi-persistent mapping from keys to values that holds onto at most a fixed number of entries,
 * discarding the least recently used entry when that number would be exceeded. Cache entries are
 * manually added using {@link #put(Object, Object)} or {@link #get(Object, Function)}, and are
 * stored in the cache until either evicted or manually invalidated.
 * <p>
 * Every lookup that finds an entry, and every write, makes that entry the most recently used.
 * <p>
 * Implementations of this interface are <em>not</em> thread-safe. A cache is owned by a single
 * thread; callers that share an instance must provide their own mutual exclusion around every
 * operation, or create a cache per thread.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface Cache<K, V> {

  /**
   * Returns the value associated with the {@code key} in this cache, or {@code null} if there is no
   * cached value for the {@code key}. A found entry becomes the most recently used.
   *
   * @param key the key whose associated value is to be returned
   * @return the value to which the specified key is mapped, or {@code null} if this cache does not
   *         contain a mapping for the key
   * @throws NullPointerException if the specified key is null
   */
  @Nullable V getIfPresent(K key);

  /**
   * Returns the value associated with the {@code key} in this cache, which must be present. A found
   * entry becomes the most recently used. Callers that cannot be sure that the key is present
   * should use {@link #getIfPresent} instead.
   *
   * @param key the key whose associated value is to be returned
   * @return the value to which the specified key is mapped
   * @throws NullPointerException if the specified key is null
   * @throws NoSuchElementException if this cache does not contain a mapping for the key
   */
  V get(K key);

  /**
   * Returns the value associated with the {@code key} in this cache, obtaining that value from the
   * {@code mappingFunction} if necessary. The computed value is inserted as the most recently used
   * entry, which may evict the least recently used one.
   * <p>
   * If the function returns {@code null} then no mapping is recorded and {@code null} is returned.
   * If the function itself throws an (unchecked) exception, the exception is rethrown and no
   * mapping is recorded. The function must not modify this cache.
   *
   * @param key the key with which the specified value is to be associated
   * @param mappingFunction the function to compute a value
   * @return the current (existing or computed) value associated with the specified key, or null if
   *         the computed value is null
   * @throws NullPointerException if the specified key or mappingFunction is null
   * @throws RuntimeException or Error if the mappingFunction does so, in which case the mapping is
   *         left unestablished
   */
  @CanIgnoreReturnValue
  @Nullable V get(K key, Function<? super K, ? extends @Nullable V> mappingFunction);

  /**
   * Associates the {@code value} with the {@code key} in this cache as the most recently used
   * entry. If the cache previously contained a value associated with the {@code key}, the old
   * value is replaced by the new {@code value} without changing the number of entries. Otherwise,
   * if the cache is full then the least recently used entry is evicted.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key
   * @throws NullPointerException if the specified key or value is null
   */
  void put(K key, V value);

  /**
   * Returns whether this cache contains a mapping for the {@code key}. Unlike the lookup methods,
   * this does not change the recency of the entry or record statistics.
   *
   * @param key the key whose presence is to be tested
   * @return if the cache contains a mapping for the key
   * @throws NullPointerException if the specified key is null
   */
  boolean containsKey(K key);

  /**
   * Discards any cached value for the {@code key}.
   *
   * @param key the key whose mapping is to be removed from the cache
   * @throws NullPointerException if the specified key is null
   */
  void invalidate(K key);

  /**
   * Discards all entries in the cache, notifying the removal listener from the least recently used
   * entry to the most.
   */
  void invalidateAll();

  /**
   * Returns the exact number of entries in this cache.
   *
   * @return the number of mappings in this cache
   */
  long size();

  /**
   * Returns a current snapshot of this cache's cumulative statistics. All statistics are
   * initialized to zero and are monotonically increasing over the lifetime of the cache.
   * <p>
   * Due to the performance penalty of maintaining statistics, some implementations may not record
   * the usage history immediately or at all.
   *
   * @return the current snapshot of the statistics of this cache
   */
  CacheStats stats();

  /**
   * Returns access to inspect the cache's eviction order. The operations on the policy do not
   * change the recency of any entry.
   *
   * @return access to the eviction policy of this cache
   */
  Policy<K, V> policy();
}
