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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * An event published by an {@link ObservableCache}. Every change but {@link CacheChangeType#RESET}
 * carries the key, the value and the entry's expiration settings at the time of the change; a
 * {@link CacheChangeType#ITEM_VALUE_REPLACED} also carries the value that was replaced.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class CacheChange<K, V> {
  private final @Nullable ExpirationType expirationType;
  private final @Nullable Duration expiry;
  private final CacheChangeType type;
  private final @Nullable V oldValue;
  private final @Nullable V value;
  private final @Nullable K key;

  private CacheChange(CacheChangeType type, @Nullable K key, @Nullable V value,
      @Nullable V oldValue, @Nullable Duration expiry, @Nullable ExpirationType expirationType) {
    this.type = requireNonNull(type);
    this.expirationType = expirationType;
    this.oldValue = oldValue;
    this.expiry = expiry;
    this.value = value;
    this.key = key;
  }

  static <K, V> CacheChange<K, V> of(CacheChangeType type,
      CachedElement<K, V> element, @Nullable V oldValue) {
    return new CacheChange<>(type, element.key(), element.value(), oldValue,
        element.expiry().orElse(null), element.expirationType());
  }

  /** Returns a change describing the addition of the element. */
  public static <K, V> CacheChange<K, V> itemAdded(CachedElement<K, V> element) {
    return of(CacheChangeType.ITEM_ADDED, element, null);
  }

  /** Returns a change describing the element replacing an entry that held {@code oldValue}. */
  public static <K, V> CacheChange<K, V> itemValueReplaced(
      CachedElement<K, V> element, V oldValue) {
    return of(CacheChangeType.ITEM_VALUE_REPLACED, element, requireNonNull(oldValue));
  }

  /** Returns a change describing that the element's expiry elapsed. */
  public static <K, V> CacheChange<K, V> itemExpired(CachedElement<K, V> element) {
    return of(CacheChangeType.ITEM_EXPIRED, element, null);
  }

  /** Returns a change describing the removal of the element. */
  public static <K, V> CacheChange<K, V> itemRemoved(CachedElement<K, V> element) {
    return of(CacheChangeType.ITEM_REMOVED, element, null);
  }

  /** Returns a change describing that the cache's contents should be read again. */
  public static <K, V> CacheChange<K, V> reset() {
    return new CacheChange<>(CacheChangeType.RESET, null, null, null, null, null);
  }

  public CacheChangeType type() {
    return type;
  }

  public @Nullable K key() {
    return key;
  }

  /** Returns the added, new, expired or removed value. */
  public @Nullable V value() {
    return value;
  }

  /** Returns the value that was replaced. */
  public @Nullable V oldValue() {
    return oldValue;
  }

  /** Returns the entry's expiry, or empty if it never expires or this is a reset. */
  public Optional<Duration> expiry() {
    return Optional.ofNullable(expiry);
  }

  public @Nullable ExpirationType expirationType() {
    return expirationType;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof CacheChange)) {
      return false;
    }
    var change = (CacheChange<?, ?>) o;
    return (type == change.type)
        && (expirationType == change.expirationType)
        && Objects.equals(key, change.key)
        && Objects.equals(value, change.value)
        && Objects.equals(oldValue, change.oldValue)
        && Objects.equals(expiry, change.expiry);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, key, value, oldValue, expiry, expirationType);
  }

  @Override
  public String toString() {
    if (type == CacheChangeType.RESET) {
      return type.toString();
    }
    var builder = new StringBuilder(type.toString())
        .append("{key=").append(key)
        .append(", value=").append(value);
    if (oldValue != null) {
      builder.append(", oldValue=").append(oldValue);
    }
    return builder.append('}').toString();
  }
}
