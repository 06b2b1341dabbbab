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
package com.github.benmanes.rxcache;

import java.util.NoSuchElementException;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when reading, updating or removing an entry whose key is absent.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class KeyNotFoundException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;

  private final transient @Nullable Object key;

  public KeyNotFoundException(@Nullable Object key) {
    super("The key was not found: " + Objects.toString(key));
    this.key = key;
  }

  /** Returns the key that was absent, if still available. */
  public @Nullable Object key() {
    return key;
  }
}
