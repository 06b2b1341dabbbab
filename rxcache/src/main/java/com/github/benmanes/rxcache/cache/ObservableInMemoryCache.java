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

import static com.github.benmanes.rxcache.cache.ObservableCacheBuilder.requireArgument;
import static com.github.benmanes.rxcache.cache.ObservableCacheBuilder.saturatedToNanos;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.rxcache.KeyNotFoundException;
import com.github.benmanes.rxcache.Lifecycle;
import com.github.benmanes.rxcache.collections.DictionaryChange;
import com.github.benmanes.rxcache.collections.NotificationSuppression;
import com.github.benmanes.rxcache.collections.ObservableDictionary;
import com.github.benmanes.rxcache.lock.AsyncReaderWriterLock;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.CompletableEmitter;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.ObservableOnSubscribe;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.disposables.SerialDisposable;
import io.reactivex.rxjava3.functions.Action;
import io.reactivex.rxjava3.functions.Consumer;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import io.reactivex.rxjava3.subjects.UnicastSubject;

/**
 * An {@link ObservableCache} backed by an {@link ObservableDictionary} of {@link CachedElement}s,
 * guarded by an {@link AsyncReaderWriterLock}. The dictionary's changes are translated into
 * {@link CacheChange}s as they happen, while the cache holds its writer lock.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class ObservableInMemoryCache<K, V> implements ObservableCache<K, V> {
  static final Logger logger = System.getLogger(ObservableInMemoryCache.class.getName());

  final ObservableDictionary<K, CachedElement<K, V>> dictionary;
  final Subject<ExpirationException> expirationFailures;
  final @Nullable CacheUpdater<? super K, V> updater;
  final @Nullable Scheduler notificationScheduler;
  final Subject<CacheChange<K, V>> changes;
  final ExpirationType defaultExpirationType;
  final ExpirationSweeper<K, V> sweeper;
  final Disposable dictionarySubscription;
  final Subject<Integer> countChanges;
  final AsyncReaderWriterLock lock;
  final long defaultExpiryNanos;
  final Lifecycle lifecycle;
  final Ticker ticker;

  ObservableInMemoryCache(ObservableCacheBuilder<K, V> builder,
      @Nullable CacheUpdater<? super K, V> updater) {
    this.expirationFailures = PublishSubject.<ExpirationException>create().toSerialized();
    this.changes = PublishSubject.<CacheChange<K, V>>create().toSerialized();
    this.countChanges = PublishSubject.<Integer>create().toSerialized();
    this.lifecycle = new Lifecycle("ObservableInMemoryCache");
    this.defaultExpirationType = builder.getExpirationType();
    this.notificationScheduler = builder.notificationScheduler;
    this.lock = new AsyncReaderWriterLock(builder.getExecutor());
    this.defaultExpiryNanos = builder.getExpiryNanos();
    this.dictionary = new ObservableDictionary<>();
    this.updater = updater;
    this.ticker = builder.getTicker();
    this.sweeper = new ExpirationSweeper<>(this, new Pacer(builder.getScheduler(),
        builder.getExpirationToleranceNanos()), builder.getExecutor());
    this.dictionarySubscription = dictionary.changes().subscribe(this::onDictionaryChange);
  }

  /* --------------- Additions --------------- */

  @Override
  public Completable add(K key, V value) {
    return addElement(key, value, defaultExpiryNanos, defaultExpirationType);
  }

  @Override
  public Completable add(K key, V value, Duration expiry, ExpirationType expirationType) {
    return addElement(key, value, toExpiryNanos(expiry), validate(expirationType));
  }

  Completable addElement(K key, V value, long expiryNanos, ExpirationType expirationType) {
    requireNonNull(key);
    requireNonNull(value);
    return write(() -> {
      var element = newElement(key, value, expiryNanos, expirationType);
      dictionary.add(key, element);
      sweeper.onWrite(element);
    });
  }

  @Override
  public Completable addRange(Map<? extends K, ? extends V> items) {
    return addElements(items, defaultExpiryNanos, defaultExpirationType);
  }

  @Override
  public Completable addRange(Map<? extends K, ? extends V> items,
      Duration expiry, ExpirationType expirationType) {
    return addElements(items, toExpiryNanos(expiry), validate(expirationType));
  }

  Completable addElements(Map<? extends K, ? extends V> items,
      long expiryNanos, ExpirationType expirationType) {
    requireEntries(items);
    return writeEach(items.entrySet(), entry -> {
      var element = newElement(entry.getKey(), entry.getValue(), expiryNanos, expirationType);
      dictionary.add(element.key(), element);
      sweeper.onWrite(element);
    });
  }

  @Override
  public Completable addOrUpdate(K key, V value) {
    return putElement(key, value, defaultExpiryNanos, defaultExpirationType);
  }

  @Override
  public Completable addOrUpdate(K key, V value, Duration expiry, ExpirationType expirationType) {
    return putElement(key, value, toExpiryNanos(expiry), validate(expirationType));
  }

  Completable putElement(K key, V value, long expiryNanos, ExpirationType expirationType) {
    requireNonNull(key);
    requireNonNull(value);
    return write(() -> {
      var element = newElement(key, value, expiryNanos, expirationType);
      dictionary.put(key, element);
      sweeper.onWrite(element);
    });
  }

  @Override
  public Single<Boolean> tryAdd(K key, V value) {
    return tryAddElement(key, value, defaultExpiryNanos, defaultExpirationType);
  }

  @Override
  public Single<Boolean> tryAdd(K key, V value, Duration expiry, ExpirationType expirationType) {
    return tryAddElement(key, value, toExpiryNanos(expiry), validate(expirationType));
  }

  Single<Boolean> tryAddElement(K key, V value, long expiryNanos, ExpirationType expirationType) {
    requireNonNull(key);
    requireNonNull(value);
    return writeSingle(() -> {
      var element = newElement(key, value, expiryNanos, expirationType);
      if (!dictionary.tryAdd(key, element)) {
        return false;
      }
      sweeper.onWrite(element);
      return true;
    });
  }

  @Override
  public Single<V> getOrAdd(K key, Function<? super K, ? extends V> producer) {
    return getOrAddElement(key, producer, defaultExpiryNanos, defaultExpirationType);
  }

  @Override
  public Single<V> getOrAdd(K key, Function<? super K, ? extends V> producer,
      Duration expiry, ExpirationType expirationType) {
    return getOrAddElement(key, producer, toExpiryNanos(expiry), validate(expirationType));
  }

  Single<V> getOrAddElement(K key, Function<? super K, ? extends V> producer,
      long expiryNanos, ExpirationType expirationType) {
    requireNonNull(key);
    requireNonNull(producer);
    return writeSingle(() -> {
      CachedElement<K, V> existing = dictionary.get(key);
      if (existing != null) {
        return existing.value();
      }
      V value = requireNonNull(producer.apply(key), "the producer returned null");
      var element = newElement(key, value, expiryNanos, expirationType);
      dictionary.add(key, element);
      sweeper.onWrite(element);
      return value;
    });
  }

  /* --------------- Updates --------------- */

  @Override
  public Completable update(K key, V value) {
    return update(key, value, /* throwIfExpired= */ true);
  }

  @Override
  public Completable update(K key, V value, boolean throwIfExpired) {
    requireNonNull(key);
    requireNonNull(value);
    return write(() -> updateValue(key, value, throwIfExpired));
  }

  @Override
  public Completable updateRange(Map<? extends K, ? extends V> items) {
    return updateRange(items, /* throwIfExpired= */ true);
  }

  @Override
  public Completable updateRange(Map<? extends K, ? extends V> items, boolean throwIfExpired) {
    requireEntries(items);
    return writeEach(items.entrySet(),
        entry -> updateValue(entry.getKey(), entry.getValue(), throwIfExpired));
  }

  @Override
  public Single<Boolean> tryUpdate(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);
    return writeSingle(() -> {
      CachedElement<K, V> existing = dictionary.get(key);
      if (existing == null) {
        return false;
      }
      replace(existing, existing.withValue(value, ticker.read()));
      return true;
    });
  }

  void updateValue(K key, V value, boolean throwIfExpired) {
    long now = ticker.read();
    CachedElement<K, V> existing = getElement(key, throwIfExpired, now);
    replace(existing, existing.withValue(value, now));
  }

  @Override
  public Completable updateExpiration(K key, Duration expiry, ExpirationType expirationType) {
    return updateExpiration(key, expiry, expirationType, /* throwIfExpired= */ true);
  }

  @Override
  public Completable updateExpiration(K key, Duration expiry,
      ExpirationType expirationType, boolean throwIfExpired) {
    requireNonNull(key);
    long expiryNanos = toExpiryNanos(expiry);
    validate(expirationType);
    return write(() -> updateExpiration(key, expiryNanos, expirationType, throwIfExpired));
  }

  @Override
  public Completable updateExpiration(Iterable<? extends K> keys,
      Duration expiry, ExpirationType expirationType) {
    return updateExpiration(keys, expiry, expirationType, /* throwIfExpired= */ true);
  }

  @Override
  public Completable updateExpiration(Iterable<? extends K> keys, Duration expiry,
      ExpirationType expirationType, boolean throwIfExpired) {
    requireNonNull(keys);
    long expiryNanos = toExpiryNanos(expiry);
    validate(expirationType);
    return writeEach(keys,
        key -> updateExpiration(key, expiryNanos, expirationType, throwIfExpired));
  }

  void updateExpiration(K key, long expiryNanos,
      ExpirationType expirationType, boolean throwIfExpired) {
    long now = ticker.read();
    CachedElement<K, V> existing = getElement(key, throwIfExpired, now);
    replace(existing, existing.withExpiration(expiryNanos, expirationType, now));
  }

  void replace(CachedElement<K, V> existing, CachedElement<K, V> replacement) {
    dictionary.replace(existing.key(), existing, replacement);
    sweeper.onWrite(replacement);
  }

  /* --------------- Removals --------------- */

  @Override
  public Completable remove(K key) {
    requireNonNull(key);
    return write(() -> dictionary.remove(key));
  }

  @Override
  public Completable removeRange(Iterable<? extends K> keys) {
    requireNonNull(keys);
    return writeEach(keys, dictionary::remove);
  }

  @Override
  public Single<Boolean> tryRemove(K key) {
    requireNonNull(key);
    return writeSingle(() -> (dictionary.tryRemove(key) != null));
  }

  @Override
  public Completable clear() {
    return write(dictionary::clear);
  }

  /* --------------- Queries --------------- */

  @Override
  public Single<V> get(K key) {
    return get(key, /* throwIfExpired= */ true);
  }

  @Override
  public Single<V> get(K key, boolean throwIfExpired) {
    requireNonNull(key);
    return readSingle(() -> getValue(key, throwIfExpired, ticker.read()));
  }

  @Override
  public Observable<V> getAll(Iterable<? extends K> keys) {
    return getAll(keys, /* throwIfExpired= */ true);
  }

  @Override
  public Observable<V> getAll(Iterable<? extends K> keys, boolean throwIfExpired) {
    requireNonNull(keys);
    return readObservable(emitter -> {
      long now = ticker.read();
      for (K key : keys) {
        if (emitter.isDisposed()) {
          return;
        }
        emitter.onNext(getValue(key, throwIfExpired, now));
      }
      emitter.onComplete();
    });
  }

  V getValue(K key, boolean throwIfExpired, long now) {
    return getElement(key, throwIfExpired, now).value();
  }

  CachedElement<K, V> getElement(K key, boolean throwIfExpired, long now) {
    CachedElement<K, V> element = dictionary.get(key);
    if (element == null) {
      throw new KeyNotFoundException(key);
    } else if (throwIfExpired && element.hasExpired(now)) {
      throw new KeyHasExpiredException(key);
    }
    return element;
  }

  @Override
  public Single<Boolean> contains(K key) {
    requireNonNull(key);
    return readSingle(() -> dictionary.containsKey(key));
  }

  @Override
  public Single<Boolean> containsAll(Iterable<? extends K> keys) {
    requireNonNull(keys);
    return readSingle(() -> {
      for (K key : keys) {
        if (!dictionary.containsKey(key)) {
          return false;
        }
      }
      return true;
    });
  }

  @Override
  public Observable<K> containsWhich(Iterable<? extends K> keys) {
    requireNonNull(keys);
    return readObservable(emitter -> {
      for (K key : keys) {
        if (emitter.isDisposed()) {
          return;
        } else if (dictionary.containsKey(key)) {
          emitter.onNext(key);
        }
      }
      emitter.onComplete();
    });
  }

  @Override
  public Maybe<Duration> expiresIn(K key) {
    requireNonNull(key);
    return Maybe.defer(() -> {
      lifecycle.checkActive();
      return lock.withReaderLock(Maybe.fromCallable(() -> {
        CachedElement<K, V> element = dictionary.get(key);
        if (element == null) {
          throw new KeyNotFoundException(key);
        }
        return element.canExpire()
            ? Duration.ofNanos(element.expiresIn(ticker.read()))
            : null;
      }));
    });
  }

  @Override
  public Maybe<Long> expiresAt(K key) {
    requireNonNull(key);
    return Maybe.defer(() -> {
      lifecycle.checkActive();
      return lock.withReaderLock(Maybe.fromCallable(() -> {
        CachedElement<K, V> element = dictionary.get(key);
        if (element == null) {
          throw new KeyNotFoundException(key);
        }
        return element.canExpire() ? element.expiresAt() : null;
      }));
    });
  }

  /* --------------- Snapshots and streams --------------- */

  @Override
  public int currentCount() {
    lifecycle.checkActive();
    return dictionary.size();
  }

  @Override
  public Observable<Integer> count() {
    return snapshotThenLive(() -> List.of(dictionary.size()), countChanges)
        .distinctUntilChanged();
  }

  @Override
  public List<K> currentKeys() {
    lifecycle.checkActive();
    return dictionary.keys();
  }

  @Override
  public List<V> currentValues() {
    lifecycle.checkActive();
    List<CachedElement<K, V>> elements = dictionary.values();
    List<V> values = new ArrayList<>(elements.size());
    for (CachedElement<K, V> element : elements) {
      values.add(element.value());
    }
    return values;
  }

  @Override
  public Observable<K> keys() {
    return snapshotThenLive(dictionary::keys, changes
        .filter(change -> change.type() == CacheChangeType.ITEM_ADDED)
        .map(change -> requireNonNull(change.key())));
  }

  @Override
  public Observable<V> values() {
    return snapshotThenLive(this::currentValues, changes
        .filter(change -> (change.type() == CacheChangeType.ITEM_ADDED)
            || (change.type() == CacheChangeType.ITEM_VALUE_REPLACED))
        .map(change -> requireNonNull(change.value())));
  }

  /**
   * Returns the snapshot followed by the live items. Both are captured while holding the reader
   * lock, so that no item is missed or repeated between them. The items are queued only until the
   * subscriber receives them.
   */
  <T> Observable<T> snapshotThenLive(Supplier<List<T>> snapshot, Observable<T> live) {
    Observable<T> items = Observable.defer(() -> {
      lifecycle.checkActive();
      var liveSubscription = new SerialDisposable();
      Subject<T> queue = UnicastSubject.<T>create().toSerialized();
      Completable capture = lock.withReaderLock(Completable.fromAction(() -> {
        for (T item : snapshot.get()) {
          queue.onNext(item);
        }
        liveSubscription.replace(live.subscribe(queue::onNext, queue::onError,
            queue::onComplete));
      }));
      return capture.andThen(queue).doFinally(liveSubscription::dispose);
    });
    return deliver(items);
  }

  @Override
  public Observable<CacheChange<K, V>> changes() {
    return deliver(changes);
  }

  @Override
  public Observable<CacheChange<K, V>> itemExpirations() {
    return changes().filter(change -> change.type() == CacheChangeType.ITEM_EXPIRED);
  }

  @Override
  public Observable<ExpirationException> expirationFailures() {
    return deliver(expirationFailures);
  }

  <T> Observable<T> deliver(Observable<T> source) {
    return (notificationScheduler == null)
        ? source.hide()
        : source.observeOn(notificationScheduler);
  }

  @Override
  public NotificationSuppression suppressChangeNotifications(boolean signalResetWhenFinished) {
    lifecycle.checkActive();
    NotificationSuppression suppression =
        dictionary.suppressChangeNotifications(signalResetWhenFinished);
    return () -> {
      suppression.close();
      if (lifecycle.isActive() && dictionary.isTrackingChanges()) {
        countChanges.onNext(dictionary.size());
      }
    };
  }

  @Override
  public boolean isTrackingChanges() {
    return dictionary.isTrackingChanges();
  }

  void onDictionaryChange(DictionaryChange<K, CachedElement<K, V>> change) {
    switch (change.type()) {
      case ITEM_ADDED:
        changes.onNext(CacheChange.itemAdded(requireNonNull(change.value())));
        break;
      case ITEM_REPLACED:
        changes.onNext(CacheChange.itemValueReplaced(requireNonNull(change.value()),
            requireNonNull(change.oldValue()).value()));
        break;
      case ITEM_REMOVED:
        changes.onNext(CacheChange.itemRemoved(requireNonNull(change.value())));
        break;
      case RESET:
        changes.onNext(CacheChange.reset());
        break;
      default:
        throw new IllegalStateException("Unknown change type: " + change.type());
    }
    countChanges.onNext(dictionary.size());
  }

  /** Publishes that the element's expiry elapsed, unless notifications are suppressed. */
  void onExpired(CachedElement<K, V> element) {
    if (dictionary.isTrackingChanges()) {
      changes.onNext(CacheChange.itemExpired(element));
    }
  }

  /* --------------- Lifecycle --------------- */

  @Override
  public boolean isDisposed() {
    return lifecycle.isDisposed();
  }

  @Override
  public void close() {
    if (!lifecycle.beginDisposal()) {
      return;
    }
    Disposable unused = lock.withWriterLock(Completable.fromAction(this::dispose))
        .subscribe(() -> {}, error ->
            logger.log(Level.WARNING, "Exception thrown when closing the cache", error));
  }

  /** Releases the resources while holding the writer lock, after all admitted operations. */
  void dispose() {
    sweeper.cancel();
    dictionarySubscription.dispose();
    dictionary.close();
    changes.onComplete();
    countChanges.onComplete();
    expirationFailures.onComplete();
    lifecycle.completeDisposal();
    lock.close();
    logger.log(Level.DEBUG, "Closed the cache");
  }

  /* --------------- Helpers --------------- */

  CachedElement<K, V> newElement(K key, V value, long expiryNanos, ExpirationType type) {
    return new CachedElement<>(requireNonNull(key), requireNonNull(value),
        expiryNanos, type, ticker.read());
  }

  static void requireEntries(Map<?, ?> items) {
    for (var entry : items.entrySet()) {
      requireNonNull(entry.getKey());
      requireNonNull(entry.getValue());
    }
  }

  ExpirationType validate(ExpirationType expirationType) {
    requireNonNull(expirationType);
    requireArgument((expirationType != ExpirationType.UPDATE) || (updater != null),
        "%s expiration requires the cache to be built with a CacheUpdater", expirationType);
    return expirationType;
  }

  static long toExpiryNanos(Duration expiry) {
    requireArgument(!expiry.isNegative(), "expiry cannot be negative: %s", expiry);
    return saturatedToNanos(expiry);
  }

  /** Returns a cold source that runs the action while holding the writer lock. */
  Completable write(Action action) {
    return Completable.defer(() -> {
      lifecycle.checkActive();
      return lock.withWriterLock(Completable.fromAction(action));
    });
  }

  /**
   * Returns a cold source that runs the action for each item while holding the writer lock,
   * stopping between items if disposed and at the first failure.
   */
  <T> Completable writeEach(Iterable<T> items, Consumer<? super T> action) {
    return Completable.defer(() -> {
      lifecycle.checkActive();
      return lock.withWriterLock(Completable.create((CompletableEmitter emitter) -> {
        for (T item : items) {
          if (emitter.isDisposed()) {
            return;
          }
          action.accept(item);
        }
        emitter.onComplete();
      }));
    });
  }

  /** Returns a cold source that computes a result while holding the writer lock. */
  <T> Single<T> writeSingle(Callable<T> callable) {
    return Single.defer(() -> {
      lifecycle.checkActive();
      return lock.withWriterLock(Single.fromCallable(callable));
    });
  }

  /** Returns a cold source that computes a result while holding the reader lock. */
  <T> Single<T> readSingle(Callable<T> callable) {
    return Single.defer(() -> {
      lifecycle.checkActive();
      return lock.withReaderLock(Single.fromCallable(callable));
    });
  }

  /** Returns a cold source that emits the items while holding the reader lock. */
  <T> Observable<T> readObservable(ObservableOnSubscribe<T> source) {
    return Observable.defer(() -> {
      lifecycle.checkActive();
      return lock.withReaderLock(Observable.create(source));
    });
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + lifecycle + ", " + lock + "}";
  }
}
