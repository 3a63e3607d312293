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

/**
 * This package contains a bounded, least-recently-used in-memory cache. Caches are configured and
 * created using the {@link com.github.benmanes.lrudict.cache.LruDict} builder, optionally from a
 * {@link com.github.benmanes.lrudict.cache.LruDictSpec} string.
 * <p>
 * A {@link com.github.benmanes.lrudict.cache.Cache} holds at most a fixed number of entries. Each
 * lookup that finds an entry and each write makes that entry the most recently used, and an
 * insertion beyond the maximum evicts the least recently used entry. Every operation runs in
 * constant time.
 * <p>
 * The caches are owned by a single thread and are not safe for concurrent use.
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.lrudict.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
