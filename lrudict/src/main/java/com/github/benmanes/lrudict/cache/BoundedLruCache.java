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

import static com.github.benmanes.lrudict.cache.LruDict.requireArgument;
import static com.github.benmanes.lrudict.cache.LruDict.requireState;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.lrudict.cache.stats.CacheStats;
import com.github.benmanes.lrudict.cache.stats.StatsCounter;
import com.google.errorprone.annotations.Var;

/**
 * A cache that holds at most {@code maximumSize} entries and discards the least recently used
 * entry when that bound is exceeded.
 * <p>
 * The hash table maps each key to an {@link Entry}, which is also the node that the
 * {@link RecencyList} links in recency order. An entry is always added to, moved within, and
 * removed from the table and the list together, so that the table's keys are exactly the keys on
 * the list. A lookup finds the entry by its key and then unlinks and relinks it at the front of the
 * list in constant time, without searching for it.
 * <p>
 * This class is not thread-safe.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
final class BoundedLruCache<K, V> implements Cache<K, V> {
  static final Logger logger = System.getLogger(BoundedLruCache.class.getName());

  final HashMap<K, Entry<K, V>> data;
  final RecencyList<K> recencyList;
  final @Nullable RemovalListener<K, V> removalListener;
  final @Nullable StatsCounter statsCounter;
  final int maximumSize;

  @Nullable Policy<K, V> policy;

  BoundedLruCache(LruDict<K, V> builder) {
    this.maximumSize = Math.toIntExact(builder.maximumSize);
    this.data = new HashMap<>();
    this.recencyList = new RecencyList<>();
    this.removalListener = builder.getRemovalListener();
    this.statsCounter = builder.newStatsCounter();
  }

  /* --------------- Lookups --------------- */

  @Override
  public @Nullable V getIfPresent(K key) {
    Entry<K, V> entry = data.get(requireNonNull(key));
    if (entry == null) {
      recordStats(counter -> counter.recordMisses(1));
      return null;
    }
    onAccess(entry);
    recordStats(counter -> counter.recordHits(1));
    return entry.value;
  }

  @Override
  public V get(K key) {
    V value = getIfPresent(key);
    if (value == null) {
      throw new NoSuchElementException("The key " + key + " was not present in the cache");
    }
    return value;
  }

  @Override
  public @Nullable V get(K key, Function<? super K, ? extends @Nullable V> mappingFunction) {
    requireNonNull(mappingFunction);
    V present = getIfPresent(key);
    if (present != null) {
      return present;
    }

    @Var V value = null;
    try {
      value = mappingFunction.apply(key);
    } finally {
      if (value == null) {
        recordStats(StatsCounter::recordLoadFailure);
      } else {
        recordStats(StatsCounter::recordLoadSuccess);
      }
    }
    if (value != null) {
      requireState(!data.containsKey(key),
          "The mapping function for %s modified the cache", key);
      put(key, value);
    }
    return value;
  }

  @Override
  public boolean containsKey(K key) {
    return data.containsKey(requireNonNull(key));
  }

  /** Makes the entry the most recently used. */
  void onAccess(Entry<K, V> entry) {
    if (!recencyList.isFirst(entry)) {
      recencyList.moveToFront(entry);
    }
  }

  /* --------------- Writes --------------- */

  @Override
  public void put(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);

    Entry<K, V> prior = data.get(key);
    if (prior != null) {
      V oldValue = prior.value;
      prior.value = value;
      onAccess(prior);
      if (oldValue != value) {
        notifyRemoval(key, oldValue, RemovalCause.REPLACED);
      }
      return;
    }

    var entry = new Entry<K, V>(key, value);
    recencyList.addFirst(entry);
    data.put(key, entry);
    evictEntries();
  }

  /**
   * Evicts the least recently used entries while the cache exceeds its maximum size. When the
   * maximum size is zero this discards the entry that was just inserted.
   */
  void evictEntries() {
    while (data.size() > maximumSize) {
      K key = recencyList.removeLast().getKey();
      Entry<K, V> evicted = data.remove(key);
      requireState(evicted != null, "An evicted key %s was not present in the table", key);
      recordStats(counter -> counter.recordEviction(RemovalCause.SIZE));
      notifyRemoval(key, evicted.value, RemovalCause.SIZE);
    }
  }

  @Override
  public void invalidate(K key) {
    Entry<K, V> entry = data.remove(requireNonNull(key));
    if (entry != null) {
      recencyList.remove(entry);
      notifyRemoval(key, entry.value, RemovalCause.EXPLICIT);
    }
  }

  @Override
  public void invalidateAll() {
    while (!recencyList.isEmpty()) {
      K key = recencyList.removeLast().getKey();
      Entry<K, V> entry = data.remove(key);
      requireState(entry != null, "An invalidated key %s was not present in the table", key);
      notifyRemoval(key, entry.value, RemovalCause.EXPLICIT);
    }
  }

  /** Notifies the listener, if any, that the entry was removed. */
  void notifyRemoval(K key, V value, RemovalCause cause) {
    if (removalListener == null) {
      return;
    }
    try {
      removalListener.onRemoval(key, value, cause);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by removal listener", t);
    }
  }

  /** Passes the event to the stats counter, if any, logging what it throws. */
  void recordStats(Consumer<StatsCounter> event) {
    if (statsCounter == null) {
      return;
    }
    try {
      event.accept(statsCounter);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
    }
  }

  /* --------------- Inspection --------------- */

  @Override
  public long size() {
    return data.size();
  }

  @Override
  public CacheStats stats() {
    if (statsCounter == null) {
      return CacheStats.empty();
    }
    try {
      return statsCounter.snapshot();
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
      return CacheStats.empty();
    }
  }

  @Override
  public Policy<K, V> policy() {
    Policy<K, V> p = policy;
    return (p == null) ? (policy = new RecencyPolicy()) : p;
  }

  /** Returns an ordered snapshot of up to {@code limit} entries in the iterator's order. */
  Map<K, V> snapshot(Iterator<K> keys, int limit) {
    requireArgument(limit >= 0, "limit must not be negative: %s", limit);
    var map = new LinkedHashMap<K, V>(snapshotCapacity(Math.min(limit, data.size())));
    while (keys.hasNext() && (map.size() < limit)) {
      K key = keys.next();
      Entry<K, V> entry = data.get(key);
      requireState(entry != null, "A listed key %s was not present in the table", key);
      map.put(key, entry.value);
    }
    return Collections.unmodifiableMap(map);
  }

  /** Returns a table capacity that holds {@code size} mappings without resizing. */
  static int snapshotCapacity(int size) {
    return (int) Math.min(Integer.MAX_VALUE, 1L + (4L * size) / 3L);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "size=" + data.size() + ", "
        + "maximumSize=" + maximumSize + ", "
        + "keys=" + recencyList
        + '}';
  }

  /** An inspection view over the recency order of the entries. */
  final class RecencyPolicy implements Policy<K, V> {

    @Override
    public long getMaximum() {
      return maximumSize;
    }

    @Override
    public Map<K, V> coldest(int limit) {
      return snapshot(recencyList.descendingIterator(), limit);
    }

    @Override
    public Map<K, V> hottest(int limit) {
      return snapshot(recencyList.iterator(), limit);
    }

    @Override
    public Iterable<K> keys() {
      return recencyList::iterator;
    }
  }

  /** A table value that is also linked into the recency list by its key. */
  static final class Entry<K, V> extends RecencyList.Node<K> {
    V value;

    Entry(K key, V value) {
      super(key);
      this.value = value;
    }
  }
}
