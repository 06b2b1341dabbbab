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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

import com.github.benmanes.rxcache.ObjectDisposedException;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.disposables.Disposable;

/**
 * Expires the entries of an {@link ObservableInMemoryCache}. A sweep is paced to run shortly after
 * the earliest pending expiry and, while holding the cache's writer lock, handles every entry whose
 * expiry has elapsed: it publishes an {@link CacheChangeType#ITEM_EXPIRED} change and then acts on
 * the entry's {@link ExpirationType}.
 * <p>
 * An entry that is left in place, either by {@link ExpirationType#DO_NOTHING} or because its
 * update failed, is reported once and then ignored until it is written again.
 * <p>
 * Every method except {@link #sweep()} must be called while holding the writer lock.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class ExpirationSweeper<K, V> {
  static final Logger logger = System.getLogger(ExpirationSweeper.class.getName());

  final Set<CachedElement<K, V>> reported;
  final ObservableInMemoryCache<K, V> cache;
  final Runnable sweepTask;
  final Executor executor;
  final Pacer pacer;

  ExpirationSweeper(ObservableInMemoryCache<K, V> cache, Pacer pacer, Executor executor) {
    this.reported = Collections.newSetFromMap(new IdentityHashMap<>());
    this.executor = requireNonNull(executor);
    this.cache = requireNonNull(cache);
    this.pacer = requireNonNull(pacer);
    this.sweepTask = this::sweep;
  }

  /** Schedules a sweep for when the written element expires. */
  void onWrite(CachedElement<K, V> element) {
    if (element.canExpire()) {
      long now = cache.ticker.read();
      pacer.schedule(executor, sweepTask, now, Math.max(0L, element.expiresIn(now)));
    }
  }

  /** Cancels the pending sweep. */
  void cancel() {
    pacer.cancel();
  }

  /** Runs a sweep once the cache's writer lock is granted. */
  void sweep() {
    if (!cache.lifecycle.isActive()) {
      return;
    }
    Disposable unused = cache.lock.withWriterLock(Completable.fromAction(this::expireEntries))
        .subscribe(() -> {}, this::onSweepFailure);
  }

  void onSweepFailure(Throwable error) {
    if (error instanceof ObjectDisposedException) {
      logger.log(Level.DEBUG, "Skipped the expiration sweep of a closed cache");
    } else {
      logger.log(Level.WARNING, "Exception thrown when expiring entries", error);
    }
  }

  /** Handles the entries whose expiry has elapsed and schedules the next sweep. */
  void expireEntries() {
    if (!cache.lifecycle.isActive()) {
      return;
    }

    long now = cache.ticker.read();
    List<CachedElement<K, V>> removals = new ArrayList<>();
    List<CachedElement<K, V>> updates = new ArrayList<>();
    for (CachedElement<K, V> element : cache.dictionary.values()) {
      if (!element.hasExpired(now) || reported.contains(element)) {
        continue;
      }
      cache.onExpired(element);
      switch (element.expirationType()) {
        case REMOVE:
          removals.add(element);
          break;
        case UPDATE:
          updates.add(element);
          break;
        case DO_NOTHING:
          reported.add(element);
          break;
        default:
          throw new IllegalStateException("Unknown expiration type: " + element.expirationType());
      }
    }

    for (CachedElement<K, V> element : removals) {
      cache.dictionary.tryRemove(element.key(), element);
    }
    if (!updates.isEmpty()) {
      update(updates);
    }
    reported.removeIf(element -> cache.dictionary.get(element.key()) != element);

    logger.log(Level.TRACE, "Expired {0} entries", removals.size() + updates.size());
    scheduleNext();
  }

  /** Replaces the values of the elements with those computed by the updater. */
  void update(List<CachedElement<K, V>> elements) {
    CacheUpdater<? super K, V> updater = requireNonNull(cache.updater);
    Set<K> keys = new LinkedHashSet<>();
    for (CachedElement<K, V> element : elements) {
      keys.add(element.key());
    }

    Map<?, ? extends V> values;
    try {
      values = requireNonNull(updater.updateAll(keys), "the updater returned a null map");
    } catch (Exception e) {
      for (CachedElement<K, V> element : elements) {
        fail(element, e);
      }
      return;
    }

    long now = cache.ticker.read();
    for (CachedElement<K, V> element : elements) {
      V value = values.get(element.key());
      if (value == null) {
        cache.dictionary.tryRemove(element.key(), element);
      } else {
        cache.dictionary.replace(element.key(), element, element.withValue(value, now));
      }
    }
  }

  /** Leaves the element expired and reports the failure. */
  void fail(CachedElement<K, V> element, Exception cause) {
    var failure = new ExpirationException(element.key(), cause);
    logger.log(Level.WARNING, "Exception thrown when updating an expired entry", failure);
    reported.add(element);
    cache.expirationFailures.onNext(failure);
  }

  /** Schedules a sweep for the earliest expiry that has not been handled yet. */
  void scheduleNext() {
    boolean pending = false;
    long earliest = 0L;
    for (CachedElement<K, V> element : cache.dictionary.values()) {
      if (!element.canExpire() || reported.contains(element)) {
        continue;
      }
      if (!pending || ((element.expiresAt() - earliest) < 0L)) {
        earliest = element.expiresAt();
        pending = true;
      }
    }
    if (pending) {
      long now = cache.ticker.read();
      pacer.schedule(executor, sweepTask, now, Math.max(0L, earliest - now));
    }
  }
}
