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

/** Why an entry was removed from a cache, as passed to a {@link RemovalListener}. */
public enum RemovalCause {

  /** {@link Cache#invalidate} or {@link Cache#invalidateAll()} removed the entry. */
  EXPLICIT {
    @Override public boolean wasEvicted() {
      return false;
    }
  },

  /**
   * {@link Cache#put} gave the key a different value. The key stays in the cache, now as the most
   * recently used, and the listener receives the old value.
   */
  REPLACED {
    @Override public boolean wasEvicted() {
      return false;
    }
  },

  /** The entry was the least recently used when an insertion went past the maximum size. */
  SIZE {
    @Override public boolean wasEvicted() {
      return true;
    }
  };

  /** Returns whether the cache removed the entry on its own rather than at the caller's request. */
  public abstract boolean wasEvicted();
}
