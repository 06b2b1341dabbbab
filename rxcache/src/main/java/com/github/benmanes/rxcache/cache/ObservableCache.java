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

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.github.benmanes.rxcache.KeyAlreadyExistsException;
import com.github.benmanes.rxcache.KeyNotFoundException;
import com.github.benmanes.rxcache.ObjectDisposedException;
import com.github.benmanes.rxcache.collections.NotificationSuppression;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;

/**
 * An in-memory cache of key-value mappings that publishes every change and expires its entries
 * after a duration. Keys and values may not be {@code null}.
 * <p>
 * Every operation returns a cold RxJava source: nothing happens until it is subscribed to, and each
 * subscription performs the operation again. Queries run while holding the cache's lock as a
 * reader, so they may run in parallel with each other; mutations and the expiration of entries run
 * while holding it as a writer, one at a time. Where the work runs is chosen by the caller with
 * {@code subscribeOn} and {@code observeOn}. Disposing a subscription before the lock is granted
 * cancels the operation; the operations on several entries also stop between entries when
 * disposed. Work that has been applied is never rolled back.
 * <p>
 * Invalid arguments are rejected with an exception when the operation is created. All other
 * failures, such as a missing key or a closed cache, are signalled to the subscriber. The
 * operations on several entries are not atomic: they fail at the first entry that cannot be
 * processed, keeping the changes made to the entries before it.
 * <p>
 * Each successful mutation publishes exactly one {@link CacheChange} per affected entry on
 * {@link #changes()} before the operation completes. {@link #clear()} publishes a single
 * {@link CacheChangeType#RESET}.
 * <p>
 * The cache's lock is not reentrant: an operation must not be awaited from within a subscriber
 * that is notified while the cache holds its lock, such as a subscriber to {@link #changes()}
 * without a notification scheduler.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public interface ObservableCache<K, V> extends AutoCloseable {

  /* --------------- Additions --------------- */

  /**
   * Returns a {@link Completable} that adds the mapping with the cache's default expiration.
   * Fails with a {@link KeyAlreadyExistsException} if the key is present.
   */
  Completable add(K key, V value);

  /**
   * Returns a {@link Completable} that adds the mapping, expiring it after {@code expiry}. Fails
   * with a {@link KeyAlreadyExistsException} if the key is present.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Completable add(K key, V value, Duration expiry, ExpirationType expirationType);

  /**
   * Returns a {@link Completable} that adds the mappings in iteration order with the cache's
   * default expiration, failing at the first key that is present.
   */
  Completable addRange(Map<? extends K, ? extends V> items);

  /**
   * Returns a {@link Completable} that adds the mappings in iteration order, failing at the first
   * key that is present.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Completable addRange(Map<? extends K, ? extends V> items,
      Duration expiry, ExpirationType expirationType);

  /** Returns a {@link Completable} that adds or replaces the mapping, with the default expiry. */
  Completable addOrUpdate(K key, V value);

  /**
   * Returns a {@link Completable} that adds or replaces the mapping with the given expiration.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Completable addOrUpdate(K key, V value, Duration expiry, ExpirationType expirationType);

  /** Returns a {@link Single} of whether the mapping was added, as it is when the key is absent. */
  Single<Boolean> tryAdd(K key, V value);

  /**
   * Returns a {@link Single} of whether the mapping was added, which it is if the key is absent.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Single<Boolean> tryAdd(K key, V value, Duration expiry, ExpirationType expirationType);

  /**
   * Returns a {@link Single} of the value mapped to the key, adding the value computed by the
   * {@code producer} with the default expiration if the key is absent. The producer runs while
   * the cache holds its writer lock; its failures are signalled to the subscriber.
   */
  Single<V> getOrAdd(K key, Function<? super K, ? extends V> producer);

  /**
   * Returns a {@link Single} of the value mapped to the key, adding the value computed by the
   * {@code producer} with the given expiration if the key is absent.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Single<V> getOrAdd(K key, Function<? super K, ? extends V> producer,
      Duration expiry, ExpirationType expirationType);

  /* --------------- Updates --------------- */

  /**
   * Returns a {@link Completable} that replaces the value, keeping the entry's expiration settings
   * and restarting its expiry. Fails with a {@link KeyNotFoundException} if the key is absent, or
   * with a {@link KeyHasExpiredException} if the entry's expiry has elapsed.
   */
  Completable update(K key, V value);

  /**
   * Returns a {@link Completable} that replaces the value, keeping the entry's expiration settings
   * and restarting its expiry. Fails with a {@link KeyNotFoundException} if the key is absent, or
   * with a {@link KeyHasExpiredException} if {@code throwIfExpired} is set and the entry's expiry
   * has elapsed.
   */
  Completable update(K key, V value, boolean throwIfExpired);

  /**
   * Returns a {@link Completable} that replaces the values in iteration order, failing at the
   * first key that is absent or whose entry has expired.
   *
   * @throws NullPointerException if a key or value is null
   */
  Completable updateRange(Map<? extends K, ? extends V> items);

  /**
   * Returns a {@link Completable} that replaces the values in iteration order, failing at the
   * first key that is absent, or whose entry has expired if {@code throwIfExpired} is set.
   *
   * @throws NullPointerException if a key or value is null
   */
  Completable updateRange(Map<? extends K, ? extends V> items, boolean throwIfExpired);

  /** Returns a {@link Single} of whether the value was replaced, as it is when the key exists. */
  Single<Boolean> tryUpdate(K key, V value);

  /**
   * Returns a {@link Completable} that applies the new expiration settings to the entry,
   * restarting its expiry. Fails with a {@link KeyNotFoundException} if the key is absent, or
   * with a {@link KeyHasExpiredException} if the entry's expiry has elapsed.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Completable updateExpiration(K key, Duration expiry, ExpirationType expirationType);

  /**
   * Returns a {@link Completable} that applies the new expiration settings to the entry,
   * restarting its expiry. Fails with a {@link KeyNotFoundException} if the key is absent, or
   * with a {@link KeyHasExpiredException} if {@code throwIfExpired} is set and the entry's expiry
   * has elapsed.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Completable updateExpiration(K key, Duration expiry,
      ExpirationType expirationType, boolean throwIfExpired);

  /**
   * Returns a {@link Completable} that applies the new expiration settings to the entries in
   * iteration order, failing at the first key that is absent or whose entry has expired.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Completable updateExpiration(Iterable<? extends K> keys,
      Duration expiry, ExpirationType expirationType);

  /**
   * Returns a {@link Completable} that applies the new expiration settings to the entries in
   * iteration order, failing at the first key that is absent, or whose entry has expired if
   * {@code throwIfExpired} is set.
   *
   * @throws IllegalArgumentException if the expiry is negative, or the expiration type is
   *         {@link ExpirationType#UPDATE} and the cache has no {@link CacheUpdater}
   */
  Completable updateExpiration(Iterable<? extends K> keys, Duration expiry,
      ExpirationType expirationType, boolean throwIfExpired);

  /* --------------- Removals --------------- */

  /**
   * Returns a {@link Completable} that removes the mapping. Fails with a
   * {@link KeyNotFoundException} if the key is absent.
   */
  Completable remove(K key);

  /**
   * Returns a {@link Completable} that removes the mappings in iteration order, failing at the
   * first key that is absent.
   */
  Completable removeRange(Iterable<? extends K> keys);

  /** Returns a {@link Single} of whether the mapping was removed, which it is if present. */
  Single<Boolean> tryRemove(K key);

  /** Returns a {@link Completable} that removes all of the mappings, publishing a single reset. */
  Completable clear();

  /* --------------- Queries --------------- */

  /**
   * Returns a {@link Single} of the value mapped to the key. Fails with a
   * {@link KeyNotFoundException} if the key is absent, or with a {@link KeyHasExpiredException} if
   * the entry's expiry has elapsed.
   */
  Single<V> get(K key);

  /**
   * Returns a {@link Single} of the value mapped to the key. Fails with a
   * {@link KeyNotFoundException} if the key is absent, or with a {@link KeyHasExpiredException} if
   * {@code throwIfExpired} is set and the entry's expiry has elapsed.
   */
  Single<V> get(K key, boolean throwIfExpired);

  /**
   * Returns an {@link Observable} of the values mapped to the keys, in iteration order. Fails at
   * the first key that is absent or whose entry has expired.
   */
  Observable<V> getAll(Iterable<? extends K> keys);

  /**
   * Returns an {@link Observable} of the values mapped to the keys, in iteration order. Fails at
   * the first key that is absent, or whose entry has expired if {@code throwIfExpired} is set.
   */
  Observable<V> getAll(Iterable<? extends K> keys, boolean throwIfExpired);

  /** Returns a {@link Single} of whether the key is present. */
  Single<Boolean> contains(K key);

  /** Returns a {@link Single} of whether all of the keys are present; true if there are none. */
  Single<Boolean> containsAll(Iterable<? extends K> keys);

  /** Returns an {@link Observable} of the keys that are present, in iteration order. */
  Observable<K> containsWhich(Iterable<? extends K> keys);

  /**
   * Returns a {@link Maybe} of the time remaining until the entry expires, which is negative if
   * it has expired but is still present, or empty if it never expires. Fails with a
   * {@link KeyNotFoundException} if the key is absent.
   */
  Maybe<Duration> expiresIn(K key);

  /**
   * Returns a {@link Maybe} of the {@link Ticker} reading, in nanoseconds, at which the entry
   * expires, or empty if it never expires. Fails with a {@link KeyNotFoundException} if the key is
   * absent.
   */
  Maybe<Long> expiresAt(K key);

  /* --------------- Snapshots and streams --------------- */

  /**
   * Returns the number of mappings.
   *
   * @throws ObjectDisposedException if the cache has been closed
   */
  int currentCount();

  /** Returns an {@link Observable} of the number of mappings, followed by each change to it. */
  Observable<Integer> count();

  /**
   * Returns a snapshot of the keys.
   *
   * @throws ObjectDisposedException if the cache has been closed
   */
  List<K> currentKeys();

  /**
   * Returns a snapshot of the values.
   *
   * @throws ObjectDisposedException if the cache has been closed
   */
  List<V> currentValues();

  /** Returns an {@link Observable} of the present keys, followed by the keys added later. */
  Observable<K> keys();

  /**
   * Returns an {@link Observable} of the present values, followed by the values added or
   * replaced later. Values are held only until they are delivered to the subscriber.
   */
  Observable<V> values();

  /**
   * Returns the hot stream of changes. It does not replay earlier changes, and completes when the
   * cache is closed.
   */
  Observable<CacheChange<K, V>> changes();

  /** Returns the hot stream of {@link CacheChangeType#ITEM_EXPIRED} changes. */
  Observable<CacheChange<K, V>> itemExpirations();

  /** Returns the hot stream of failures to expire an entry. */
  Observable<ExpirationException> expirationFailures();

  /**
   * Stops publishing changes until the returned scope, and every other open scope, is closed.
   *
   * @param signalResetWhenFinished whether to publish a {@link CacheChangeType#RESET} when
   *        publishing resumes
   * @return the scope to close, typically with try-with-resources
   * @throws ObjectDisposedException if the cache has been closed
   */
  NotificationSuppression suppressChangeNotifications(boolean signalResetWhenFinished);

  /** Returns whether changes are currently published. */
  boolean isTrackingChanges();

  /* --------------- Lifecycle --------------- */

  /** Returns whether {@link #close()} has been called. */
  boolean isDisposed();

  /**
   * Rejects new operations, and releases the cache's resources once the operations that were
   * already admitted have completed. The streams complete at that point. Closing again has no
   * effect.
   */
  @Override
  void close();
}
