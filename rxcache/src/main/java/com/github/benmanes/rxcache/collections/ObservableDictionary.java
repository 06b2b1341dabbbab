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
package com.github.benmanes.rxcache.collections;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.rxcache.KeyAlreadyExistsException;
import com.github.benmanes.rxcache.KeyNotFoundException;
import com.github.benmanes.rxcache.Lifecycle;
import com.github.benmanes.rxcache.ObjectDisposedException;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;

/**
 * A keyed store that publishes a {@link DictionaryChange} for every mutation, synchronously on the
 * mutating thread before the mutating method returns. The change stream is hot and does not replay
 * earlier changes; it completes when the dictionary is closed.
 * <p>
 * Individual operations are atomic, but sequences of them are not coordinated; callers that need
 * a consistent view across several operations serialize access themselves. Publishing may be
 * paused with {@link #suppressChangeNotifications(boolean)}.
 * <p>
 * Once closed, every operation throws an {@link ObjectDisposedException}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ObservableDictionary<K, V> implements AutoCloseable {
  final Subject<DictionaryChange<K, V>> changes;
  final ConcurrentHashMap<K, V> data;
  final AtomicBoolean resetRequested;
  final AtomicInteger suppressions;
  final Lifecycle lifecycle;

  public ObservableDictionary() {
    this.changes = PublishSubject.<DictionaryChange<K, V>>create().toSerialized();
    this.lifecycle = new Lifecycle("ObservableDictionary");
    this.resetRequested = new AtomicBoolean();
    this.suppressions = new AtomicInteger();
    this.data = new ConcurrentHashMap<>();
  }

  /** Creates a dictionary holding the given mappings, without publishing them. */
  public ObservableDictionary(Map<? extends K, ? extends V> initial) {
    this();
    data.putAll(initial);
  }

  /* --------------- Queries --------------- */

  public int size() {
    lifecycle.checkActive();
    return data.size();
  }

  public boolean isEmpty() {
    lifecycle.checkActive();
    return data.isEmpty();
  }

  public boolean containsKey(K key) {
    requireNonNull(key);
    lifecycle.checkActive();
    return data.containsKey(key);
  }

  /** Returns the value mapped to the key, or {@code null} if absent. */
  public @Nullable V get(K key) {
    requireNonNull(key);
    lifecycle.checkActive();
    return data.get(key);
  }

  /** Returns a snapshot of the keys. */
  public List<K> keys() {
    lifecycle.checkActive();
    return new ArrayList<>(data.keySet());
  }

  /** Returns a snapshot of the values. */
  public List<V> values() {
    lifecycle.checkActive();
    return new ArrayList<>(data.values());
  }

  /** Returns a snapshot of the mappings. */
  public Map<K, V> entries() {
    lifecycle.checkActive();
    return Map.copyOf(data);
  }

  /* --------------- Mutations --------------- */

  /**
   * Adds a new mapping.
   *
   * @throws KeyAlreadyExistsException if the key is already present
   */
  public void add(K key, V value) {
    if (!tryAdd(key, value)) {
      throw new KeyAlreadyExistsException(key);
    }
  }

  /** Adds a new mapping if the key is absent, returning whether it was added. */
  @CanIgnoreReturnValue
  public boolean tryAdd(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);
    lifecycle.checkActive();
    if (data.putIfAbsent(key, value) != null) {
      return false;
    }
    publish(DictionaryChange.itemAdded(key, value));
    return true;
  }

  /** Adds or replaces the mapping, returning the previous value if present. */
  @CanIgnoreReturnValue
  public @Nullable V put(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);
    lifecycle.checkActive();
    V oldValue = data.put(key, value);
    publish((oldValue == null)
        ? DictionaryChange.itemAdded(key, value)
        : DictionaryChange.itemReplaced(key, value, oldValue));
    return oldValue;
  }

  /** Replaces the mapping only if present, returning the previous value or {@code null}. */
  @CanIgnoreReturnValue
  public @Nullable V replace(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);
    lifecycle.checkActive();
    V oldValue = data.replace(key, value);
    if (oldValue != null) {
      publish(DictionaryChange.itemReplaced(key, value, oldValue));
    }
    return oldValue;
  }

  /** Replaces the mapping only if currently mapped to {@code expected}. */
  @CanIgnoreReturnValue
  public boolean replace(K key, V expected, V value) {
    requireNonNull(key);
    requireNonNull(expected);
    requireNonNull(value);
    lifecycle.checkActive();
    if (!data.replace(key, expected, value)) {
      return false;
    }
    publish(DictionaryChange.itemReplaced(key, value, expected));
    return true;
  }

  /**
   * Removes the mapping.
   *
   * @return the removed value
   * @throws KeyNotFoundException if the key is absent
   */
  @CanIgnoreReturnValue
  public V remove(K key) {
    V value = tryRemove(key);
    if (value == null) {
      throw new KeyNotFoundException(key);
    }
    return value;
  }

  /** Removes the mapping if present, returning the removed value or {@code null}. */
  @CanIgnoreReturnValue
  public @Nullable V tryRemove(K key) {
    requireNonNull(key);
    lifecycle.checkActive();
    V value = data.remove(key);
    if (value != null) {
      publish(DictionaryChange.itemRemoved(key, value));
    }
    return value;
  }

  /** Removes the mapping only if currently mapped to {@code expected}. */
  @CanIgnoreReturnValue
  public boolean tryRemove(K key, V expected) {
    requireNonNull(key);
    requireNonNull(expected);
    lifecycle.checkActive();
    if (!data.remove(key, expected)) {
      return false;
    }
    publish(DictionaryChange.itemRemoved(key, expected));
    return true;
  }

  /** Removes all of the mappings, publishing a single {@link DictionaryChangeType#RESET}. */
  public void clear() {
    lifecycle.checkActive();
    data.clear();
    publish(DictionaryChange.reset());
  }

  /* --------------- Notifications --------------- */

  /** Returns the hot stream of changes. */
  public Observable<DictionaryChange<K, V>> changes() {
    return changes.hide();
  }

  /** Returns whether changes are currently published. */
  public boolean isTrackingChanges() {
    return (suppressions.get() == 0);
  }

  /**
   * Stops publishing changes until the returned scope, and every other open scope, is closed.
   *
   * @param signalResetWhenFinished whether to publish a {@link DictionaryChangeType#RESET} when
   *        publishing resumes
   * @return the scope to close, typically with try-with-resources
   */
  public NotificationSuppression suppressChangeNotifications(boolean signalResetWhenFinished) {
    lifecycle.checkActive();
    suppressions.incrementAndGet();
    return new Suppression(signalResetWhenFinished);
  }

  void publish(DictionaryChange<K, V> change) {
    if (suppressions.get() == 0) {
      changes.onNext(change);
    }
  }

  /** Completes the change stream and discards the mappings. Closing again has no effect. */
  @Override
  public void close() {
    if (!lifecycle.beginDisposal()) {
      return;
    }
    data.clear();
    changes.onComplete();
    lifecycle.completeDisposal();
  }

  @Override
  public String toString() {
    return data.toString();
  }

  final class Suppression implements NotificationSuppression {
    final boolean signalResetWhenFinished;
    final AtomicBoolean closed;

    Suppression(boolean signalResetWhenFinished) {
      this.signalResetWhenFinished = signalResetWhenFinished;
      this.closed = new AtomicBoolean();
    }

    @Override
    public void close() {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
      if (signalResetWhenFinished) {
        resetRequested.set(true);
      }
      if ((suppressions.decrementAndGet() == 0)
          && resetRequested.getAndSet(false) && lifecycle.isActive()) {
        publish(DictionaryChange.reset());
      }
    }
  }
}
