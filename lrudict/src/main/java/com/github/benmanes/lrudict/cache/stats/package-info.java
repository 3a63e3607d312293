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
 * Statistics that a cache records when built with {@code recordStats()}.
 * <p>
 * Summary statistics are stored in an immutable
 * {@link com.github.benmanes.lrudict.cache.stats.CacheStats} instance, which is obtained from a
 * {@link com.github.benmanes.lrudict.cache.stats.StatsCounter}.
 */
@NullMarked
package com.github.benmanes.lrudict.cache.stats;

import org.jspecify.annotations.NullMarked;
