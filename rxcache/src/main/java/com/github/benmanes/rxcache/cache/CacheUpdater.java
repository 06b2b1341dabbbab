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

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/**
 * Computes the replacement values of entries whose expiry elapsed while configured with
 * {@link ExpirationType#UPDATE}.
 * <p>
 * Most implementations will only need to implement {@link #update}. The updater is invoked by the
 * cache's expiration sweep while it holds the cache's writer lock, so it must not call back into
 * the cache.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@FunctionalInterface
public interface CacheUpdater<K, V> {

  /**
   * Computes the replacement value for the key.
   *
   * @param key the key whose entry expired
   * @return the new value, or {@code null} to remove the entry
   * @throws Exception if the value cannot be computed, in which case the entry is left expired
   *         and the failure is published on {@link ObservableCache#expirationFailures()}
   */
  @Nullable
  V update(K key) throws Exception;

  /**
   * Computes the replacement values for the keys whose entries expired in the same sweep. A key
   * missing from the returned map has its entry removed.
   * <p>
   * The default implementation calls {@link #update} for each key, stopping at the first failure,
   * which is then reported for all of the keys. Override it when a bulk computation is more
   * efficient.
   *
   * @param keys the keys whose entries expired
   * @return a map from the keys to their new values
   * @throws Exception if the values cannot be computed, in which case the entries are left
   *         expired and the failure is published on {@link ObservableCache#expirationFailures()}
   */
  default Map<? extends K, ? extends V> updateAll(Set<? extends K> keys) throws Exception {
    Map<K, V> result = new HashMap<>();
    for (K key : keys) {
      V value = update(key);
      if (value != null) {
        result.put(key, value);
      }
    }
    return result;
  }
}
