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

/**
 * The action taken by the cache when an entry's expiry elapses.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum ExpirationType {

  /** The entry stays in the cache and is reported as expired once. */
  DO_NOTHING,

  /** The entry is removed, as if by {@link ObservableCache#remove}. */
  REMOVE,

  /**
   * The entry's value is replaced with one computed by the {@link CacheUpdater} and its expiry
   * restarts. The entry is removed if the updater does not produce a value.
   */
  UPDATE
}
