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
package com.github.benmanes.lrudict.cache.testing;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;

import com.github.benmanes.lrudict.cache.RemovalCause;
import com.github.benmanes.lrudict.cache.RemovalListener;

/**
 * Some common removal listener implementations for tests.
 */
public final class RemovalListeners {

  private RemovalListeners() {}

  /** A removal listener that stores the notifications for inspection. */
  public static <K, V> ConsumingRemovalListener<K, V> consuming() {
    return new ConsumingRemovalListener<>();
  }

  /** A removal listener that throws an exception if a notification arrives. */
  public static <K, V> RejectingRemovalListener<K, V> rejecting() {
    return new RejectingRemovalListener<>();
  }

  private static void validate(Object key, Object value, RemovalCause cause) {
    requireNonNull(key);
    requireNonNull(value);
    requireNonNull(cause);
  }

  public static final class RejectingRemovalListener<K, V> implements RemovalListener<K, V> {
    public int rejected;

    @Override
    public void onRemoval(K key, V value, RemovalCause cause) {
      validate(key, value, cause);
      rejected++;
      throw new IllegalStateException("Rejected removal of "
          + new RemovalNotification<>(key, value, cause));
    }
  }

  public static final class ConsumingRemovalListener<K, V> implements RemovalListener<K, V> {
    private final List<RemovalNotification<K, V>> removed;

    public ConsumingRemovalListener() {
      this.removed = new ArrayList<>();
    }

    @Override
    public void onRemoval(K key, V value, RemovalCause cause) {
      validate(key, value, cause);
      removed.add(new RemovalNotification<>(key, value, cause));
    }

    public List<RemovalNotification<K, V>> removed() {
      return removed;
    }
  }
}
