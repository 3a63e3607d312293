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

/**
 * Told about every entry that leaves a cache or has its value replaced, together with the
 * {@link RemovalCause}.
 * <p>
 * The listener is invoked synchronously by the thread that performed the removal, after the cache
 * has finished updating its structure. An instance may be called concurrently by multiple caches
 * only if it is shared between caches owned by different threads.
 * <p>
 * Any exception thrown by the listener is logged and suppressed so that it cannot interrupt the
 * cache operation that triggered the notification.
 *
 * @param <K> the most general type of keys this listener can listen for
 * @param <V> the most general type of values this listener can listen for
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

  /**
   * Called once per removed or replaced entry.
   *
   * @param key the entry's key
   * @param value the entry's value, or for {@link RemovalCause#REPLACED} the value it had before
   * @param cause why the entry was removed
   */
  void onRemoval(K key, V value, RemovalCause cause);
}
