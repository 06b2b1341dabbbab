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
 * Thrown when reading an entry whose expiry has elapsed but that is still present, either because
 * its {@link ExpirationType} is {@link ExpirationType#DO_NOTHING} or because it has not been swept
 * yet.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class KeyHasExpiredException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final transient @Nullable Object key;

  public KeyHasExpiredException(Object key) {
    super("The entry has expired: " + requireNonNull(key));
    this.key = key;
  }

  /** Returns the key of the expired entry, if still available. */
  public @Nullable Object key() {
    return key;
  }
}
