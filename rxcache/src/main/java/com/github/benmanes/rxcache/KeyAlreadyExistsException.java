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

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when adding an entry whose key is already present.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class KeyAlreadyExistsException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final transient @Nullable Object key;

  public KeyAlreadyExistsException(@Nullable Object key) {
    super("The key already exists: " + Objects.toString(key));
    this.key = key;
  }

  /** Returns the key that was already present, if still available. */
  public @Nullable Object key() {
    return key;
  }
}
