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
import java.util.Optional;

/**
 * A cached value together with its expiration settings. An element is immutable: a new value or a
 * new expiry is applied by replacing the element, which restarts its expiry window.
 * <p>
 * Times are {@link Ticker} readings in nanoseconds. An element that never expires has an
 * {@link #expiresAt()} of {@link Long#MAX_VALUE}, and so does one whose expiry lies beyond the
 * ticker's range.
 *
 * @param <K> the type of the key
 * @param <V> the type of the value
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class CachedElement<K, V> {
  static final long NEVER = Long.MAX_VALUE;

  private final ExpirationType expirationType;
  private final long expiryNanos;
  private final long writeTime;
  private final long expiresAt;
  private final V value;
  private final K key;

  CachedElement(K key, V value, long expiryNanos, ExpirationType expirationType, long now) {
    this.expirationType = requireNonNull(expirationType);
    this.value = requireNonNull(value);
    this.key = requireNonNull(key);
    this.expiryNanos = expiryNanos;
    this.writeTime = now;
    this.expiresAt = (expiryNanos == NEVER) ? NEVER : saturatedAdd(now, expiryNanos);
  }

  public K key() {
    return key;
  }

  public V value() {
    return value;
  }

  /** Returns the duration after a write that the element expires, or empty if it never does. */
  public Optional<Duration> expiry() {
    return (expiryNanos == NEVER) ? Optional.empty() : Optional.of(Duration.ofNanos(expiryNanos));
  }

  /** Returns the expiry in nanoseconds, or {@link Long#MAX_VALUE} if the element never expires. */
  long expiryNanos() {
    return expiryNanos;
  }

  public ExpirationType expirationType() {
    return expirationType;
  }

  /** Returns the ticker reading when the element was written. */
  public long writeTime() {
    return writeTime;
  }

  /** Returns the ticker reading when the element expires. */
  public long expiresAt() {
    return expiresAt;
  }

  /** Returns whether the element can expire. */
  public boolean canExpire() {
    return (expiresAt != NEVER);
  }

  /** Returns whether the expiry has elapsed at the given ticker reading. */
  public boolean hasExpired(long now) {
    return canExpire() && ((now - expiresAt) >= 0L);
  }

  /** Returns the nanoseconds until the element expires, which is negative once it has. */
  long expiresIn(long now) {
    return (expiresAt - now);
  }

  /** Returns an element with the new value and the same expiration settings, written now. */
  CachedElement<K, V> withValue(V newValue, long now) {
    return new CachedElement<>(key, newValue, expiryNanos, expirationType, now);
  }

  /** Returns an element with the same value and the new expiration settings, written now. */
  CachedElement<K, V> withExpiration(long newExpiryNanos, ExpirationType newType, long now) {
    return new CachedElement<>(key, value, newExpiryNanos, newType, now);
  }

  /** Returns {@code now + delay}, capped at {@link #NEVER}, for a non-negative delay. */
  static long saturatedAdd(long now, long delay) {
    long sum = now + delay;
    return (sum < now) ? NEVER : sum;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{key=" + key + ", value=" + value
        + ", expirationType=" + expirationType
        + ", expiry=" + expiry().map(Duration::toString).orElse("never") + "}";
  }
}
