/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
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
package com.github.benmanes.rxcache.cache;

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * Describes a failure to expire an entry, such as the {@link CacheUpdater} throwing while
 * computing its replacement value. The entry is left in the cache, marked as expired.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ExpirationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient @Nullable Object key;

  public ExpirationException(Object key, Throwable cause) {
    super("Failed to expire the entry: " + requireNonNull(key), requireNonNull(cause));
    this.key = key;
  }

  /** Returns the key of the entry that failed to expire, if still available. */
  public @Nullable Object key() {
    return key;
  }
}
