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

import static com.github.benmanes.lrudict.cache.CacheSubject.assertThat;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.benmanes.lrudict.cache.stats.CacheStats;
import com.google.common.collect.ImmutableList;

/**
 * The test cases for the {@link Policy} inspection view.
 */
final class PolicyTest {
  Cache<Integer, String> cache;
  Policy<Integer, String> policy;

  @BeforeEach
  void setUp() {
    cache = LruDict.newBuilder().maximumSize(10).recordStats().build();
    for (int i = 0; i < 5; i++) {
      cache.put(i, "v" + i);
    }
    policy = cache.policy();
  }

  @Test
  void policy_isCached() {
    assertThat(cache.policy()).isSameInstanceAs(policy);
  }

  @Test
  void getMaximum() {
    assertThat(policy.getMaximum()).isEqualTo(10L);
    assertThat(LruDict.newBuilder().maximumSize(0).build().policy().getMaximum()).isEqualTo(0L);
  }

  @Test
  void hottest() {
    Map<Integer, String> hottest = policy.hottest(Integer.MAX_VALUE);
    assertThat(hottest).containsExactly(4, "v4", 3, "v3", 2, "v2", 1, "v1", 0, "v0").inOrder();
  }

  @Test
  void hottest_limited() {
    assertThat(policy.hottest(2)).containsExactly(4, "v4", 3, "v3").inOrder();
    assertThat(policy.hottest(0)).isEmpty();
  }

  @Test
  void coldest() {
    Map<Integer, String> coldest = policy.coldest(Integer.MAX_VALUE);
    assertThat(coldest).containsExactly(0, "v0", 1, "v1", 2, "v2", 3, "v3", 4, "v4").inOrder();
  }

  @Test
  void coldest_limited() {
    assertThat(policy.coldest(2)).containsExactly(0, "v0", 1, "v1").inOrder();
    assertThat(policy.coldest(0)).isEmpty();
  }

  @Test
  void coldest_afterPromotion() {
    assertThat(cache.getIfPresent(0)).isEqualTo("v0");
    assertThat(policy.coldest(2)).containsExactly(1, "v1", 2, "v2").inOrder();
    assertThat(policy.hottest(1)).containsExactly(0, "v0");
  }

  @Test
  void snapshot_negativeLimit() {
    assertThrows(IllegalArgumentException.class, () -> policy.hottest(-1));
    assertThrows(IllegalArgumentException.class, () -> policy.coldest(-1));
  }

  @Test
  void snapshotCapacity_largeCache() {
    assertThat(BoundedLruCache.snapshotCapacity(0)).isEqualTo(1);
    assertThat(BoundedLruCache.snapshotCapacity(3)).isEqualTo(5);
    assertThat(BoundedLruCache.snapshotCapacity(1 << 30)).isEqualTo(1_431_655_766);
    assertThat(BoundedLruCache.snapshotCapacity((1 << 30) + 1)).isGreaterThan(1 << 30);
    assertThat(BoundedLruCache.snapshotCapacity(Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
  }

  @Test
  void snapshot_whenEmpty() {
    cache.invalidateAll();
    assertThat(policy.hottest(5)).isEmpty();
    assertThat(policy.coldest(5)).isEmpty();
  }

  @Test
  void snapshot_unmodifiable() {
    Map<Integer, String> hottest = policy.hottest(5);
    assertThrows(UnsupportedOperationException.class, () -> hottest.put(5, "v5"));
    assertThrows(UnsupportedOperationException.class, hottest::clear);
  }

  @Test
  void snapshot_isDetachedFromCache() {
    Map<Integer, String> hottest = policy.hottest(5);
    cache.invalidate(4);
    assertThat(hottest).containsKey(4);
    assertThat(hottest).hasSize(5);
  }

  @Test
  void snapshot_hasNoSideEffects() {
    var before = ImmutableList.copyOf(policy.keys());
    assertThat(policy.coldest(3)).hasSize(3);
    assertThat(policy.hottest(3)).hasSize(3);

    assertThat(policy.keys()).containsExactlyElementsIn(before).inOrder();
    assertThat(cache.stats()).isEqualTo(CacheStats.empty());
    assertThat(cache).isValid();
  }

  @Test
  void keys() {
    assertThat(policy.keys()).containsExactly(4, 3, 2, 1, 0).inOrder();
  }

  @Test
  void keys_isLiveView() {
    Iterable<Integer> keys = policy.keys();
    cache.put(5, "v5");
    assertThat(cache.getIfPresent(2)).isEqualTo("v2");
    assertThat(keys).containsExactly(2, 5, 4, 3, 1, 0).inOrder();
  }

  @Test
  void keys_isRestartable() {
    Iterable<Integer> keys = policy.keys();
    assertThat(ImmutableList.copyOf(keys)).isEqualTo(ImmutableList.copyOf(keys));
  }

  @Test
  void keys_concurrentModification() {
    Iterator<Integer> iterator = policy.keys().iterator();
    assertThat(iterator.next()).isEqualTo(4);
    assertThat(cache.getIfPresent(0)).isEqualTo("v0");
    assertThrows(ConcurrentModificationException.class, iterator::next);
  }

  @Test
  void keys_readOfHead_doesNotInvalidateIterator() {
    Iterator<Integer> iterator = policy.keys().iterator();
    assertThat(cache.getIfPresent(4)).isEqualTo("v4");
    assertThat(ImmutableList.copyOf(iterator)).containsExactly(4, 3, 2, 1, 0).inOrder();
  }
}
