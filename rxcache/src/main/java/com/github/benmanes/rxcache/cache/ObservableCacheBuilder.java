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
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;

/**
 * A builder of {@link ObservableCache} instances having a combination of the following features:
 * <ul>
 *   <li>a default expiration applied to the entries added without one
 *   <li>replacement of expired values computed by a {@link CacheUpdater}
 *   <li>delivery of change notifications on a chosen {@link Scheduler}
 * </ul>
 * <p>
 * These features are all optional; caches can be created using all or none of them. By default,
 * entries never expire and notifications are delivered on the thread that made the change.
 * <p>
 * Usage example:
 * <pre>{@code
 *   ObservableCache<Key, Graph> graphs = ObservableCacheBuilder.newBuilder()
 *       .expireAfter(Duration.ofMinutes(10))
 *       .expirationType(ExpirationType.UPDATE)
 *       .build(key -> createExpensiveGraph(key));
 * }</pre>
 * <p>
 * Each setting may be applied once. The builder may be used to create multiple independent caches.
 *
 * @param <K> the most general key type this builder will be able to create caches for
 * @param <V> the most general value type this builder will be able to create caches for
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ObservableCacheBuilder<K, V> {
  static final ExpirationType DEFAULT_EXPIRATION_TYPE = ExpirationType.REMOVE;

  @Nullable Scheduler notificationScheduler;
  @Nullable Duration expirationTolerance;
  @Nullable ExpirationType expirationType;
  @Nullable Duration expireAfter;
  @Nullable Scheduler scheduler;
  @Nullable Executor executor;
  @Nullable Ticker ticker;

  private ObservableCacheBuilder() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /** Returns the smallest power of two greater than or equal to {@code x}. */
  static long ceilingPowerOfTwo(long x) {
    // From Hacker's Delight, Chapter 3, Harry S. Warren Jr.
    return 1L << -Long.numberOfLeadingZeros(x - 1);
  }

  /**
   * Returns the number of nanoseconds of the given duration without throwing or overflowing.
   * <p>
   * Instead of throwing {@link ArithmeticException}, this method silently saturates to either
   * {@link Long#MAX_VALUE} or {@link Long#MIN_VALUE}, which makes an extremely long expiry behave
   * as if the entry never expires.
   */
  static long saturatedToNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException tooBig) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  /**
   * Constructs a new {@code ObservableCacheBuilder} instance with default settings: entries never
   * expire and notifications are delivered synchronously.
   *
   * @return a new instance with default settings
   */
  @CheckReturnValue
  public static ObservableCacheBuilder<Object, Object> newBuilder() {
    return new ObservableCacheBuilder<>();
  }

  /**
   * Constructs a new {@code ObservableCacheBuilder} instance with the settings specified in
   * {@code spec}.
   *
   * @param spec the specification to build from
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static ObservableCacheBuilder<Object, Object> from(ObservableCacheSpec spec) {
    return spec.toBuilder();
  }

  /**
   * Constructs a new {@code ObservableCacheBuilder} instance with the settings specified in
   * {@code spec}.
   *
   * @param spec a String in the format specified by {@link ObservableCacheSpec}
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static ObservableCacheBuilder<Object, Object> from(String spec) {
    return from(ObservableCacheSpec.parse(spec));
  }

  /**
   * Specifies the default duration after which an entry expires, measured from when its value was
   * last written. It applies to the operations that are not given an expiry. By default, entries
   * never expire.
   *
   * @param duration the length of time after a write that an entry expires
   * @return this {@code ObservableCacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code duration} is negative
   * @throws IllegalStateException if the expiry was already set
   */
  @CanIgnoreReturnValue
  public ObservableCacheBuilder<K, V> expireAfter(Duration duration) {
    requireState(expireAfter == null, "expireAfter was already set to %s", expireAfter);
    requireArgument(!duration.isNegative(), "duration cannot be negative: %s", duration);
    this.expireAfter = duration;
    return this;
  }

  long getExpiryNanos() {
    return (expireAfter == null) ? CachedElement.NEVER : saturatedToNanos(expireAfter);
  }

  /**
   * Specifies the default action taken when an entry expires. It applies to the operations that
   * are not given an expiration type. By default, expired entries are removed.
   *
   * @param expirationType the action taken when an entry's expiry elapses
   * @return this {@code ObservableCacheBuilder} instance (for chaining)
   * @throws IllegalStateException if the expiration type was already set
   */
  @CanIgnoreReturnValue
  public ObservableCacheBuilder<K, V> expirationType(ExpirationType expirationType) {
    requireState(this.expirationType == null,
        "expiration type was already set to %s", this.expirationType);
    this.expirationType = requireNonNull(expirationType);
    return this;
  }

  ExpirationType getExpirationType() {
    return (expirationType == null) ? DEFAULT_EXPIRATION_TYPE : expirationType;
  }

  /**
   * Specifies how much later than its expiry an entry may be handled so that nearby expirations
   * are handled by the same sweep. By default, a little over a second is used.
   *
   * @param tolerance the delay below which a sweep is postponed
   * @return this {@code ObservableCacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code tolerance} is negative
   * @throws IllegalStateException if the tolerance was already set
   */
  @CanIgnoreReturnValue
  public ObservableCacheBuilder<K, V> expirationTolerance(Duration tolerance) {
    requireState(expirationTolerance == null,
        "expiration tolerance was already set to %s", expirationTolerance);
    requireArgument(!tolerance.isNegative(), "tolerance cannot be negative: %s", tolerance);
    this.expirationTolerance = tolerance;
    return this;
  }

  long getExpirationToleranceNanos() {
    return (expirationTolerance == null) ? Pacer.TOLERANCE : saturatedToNanos(expirationTolerance);
  }

  /**
   * Specifies a nanosecond-precision time source for use in determining when entries expire. By
   * default, {@link System#nanoTime} is used.
   * <p>
   * The primary intent of this method is to facilitate testing of caches which have been configured
   * with expiration, for example by following a virtual-time scheduler with
   * {@link Ticker#schedulerTicker(Scheduler)}.
   *
   * @param ticker a nanosecond-precision time source
   * @return this {@code ObservableCacheBuilder} instance (for chaining)
   * @throws IllegalStateException if a ticker was already set
   */
  @CanIgnoreReturnValue
  public ObservableCacheBuilder<K, V> ticker(Ticker ticker) {
    requireState(this.ticker == null, "Ticker was already set to %s", this.ticker);
    this.ticker = requireNonNull(ticker);
    return this;
  }

  Ticker getTicker() {
    return (ticker == null) ? Ticker.systemTicker() : ticker;
  }

  /**
   * Specifies the scheduler that triggers the expiration sweeps, which then run on the
   * {@link #executor(Executor)}. By default, {@link Schedulers#computation()} is used.
   *
   * @param scheduler the scheduler that submits a sweep to the executor after a given delay
   * @return this {@code ObservableCacheBuilder} instance (for chaining)
   * @throws IllegalStateException if a scheduler was already set
   */
  @CanIgnoreReturnValue
  public ObservableCacheBuilder<K, V> scheduler(Scheduler scheduler) {
    requireState(this.scheduler == null, "scheduler was already set to %s", this.scheduler);
    this.scheduler = requireNonNull(scheduler);
    return this;
  }

  Scheduler getScheduler() {
    return (scheduler == null) ? Schedulers.computation() : scheduler;
  }

  /**
   * Specifies the scheduler on which subscribers to the cache's streams, such as
   * {@link ObservableCache#changes()}, {@link ObservableCache#values()} and
   * {@link ObservableCache#expirationFailures()}, are notified. By default, they are notified on
   * the thread that made the change, before the changing operation completes.
   *
   * @param scheduler the scheduler that delivers notifications
   * @return this {@code ObservableCacheBuilder} instance (for chaining)
   * @throws IllegalStateException if a notification scheduler was already set
   */
  @CanIgnoreReturnValue
  public ObservableCacheBuilder<K, V> notificationScheduler(Scheduler scheduler) {
    requireState(notificationScheduler == null,
        "notification scheduler was already set to %s", notificationScheduler);
    this.notificationScheduler = requireNonNull(scheduler);
    return this;
  }

  /**
   * Specifies the executor that runs the expiration sweeps and admits operations queued behind the
   * cache's lock. By default, {@link ForkJoinPool#commonPool()} is used.
   * <p>
   * A test may prefer to configure the cache to execute tasks directly on the same thread. Beware
   * that configuring a cache with an executor that throws {@link RejectedExecutionException} may
   * delay expiration.
   *
   * @param executor the executor to use for asynchronous execution
   * @return this {@code ObservableCacheBuilder} instance (for chaining)
   * @throws IllegalStateException if an executor was already set
   */
  @CanIgnoreReturnValue
  public ObservableCacheBuilder<K, V> executor(Executor executor) {
    requireState(this.executor == null, "executor was already set to %s", this.executor);
    this.executor = requireNonNull(executor);
    return this;
  }

  Executor getExecutor() {
    return (executor == null) ? ForkJoinPool.commonPool() : executor;
  }

  /**
   * Builds a cache whose entries may not use {@link ExpirationType#UPDATE}.
   *
   * @param <K1> the key type of the cache
   * @param <V1> the value type of the cache
   * @return a cache having the requested features
   * @throws IllegalStateException if the default expiration type is {@link ExpirationType#UPDATE}
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> ObservableCache<K1, V1> build() {
    requireState(getExpirationType() != ExpirationType.UPDATE,
        "%s expiration requires a CacheUpdater", ExpirationType.UPDATE);

    @SuppressWarnings("unchecked")
    ObservableCacheBuilder<K1, V1> self = (ObservableCacheBuilder<K1, V1>) this;
    return new ObservableInMemoryCache<>(self, /* updater= */ null);
  }

  /**
   * Builds a cache that replaces the values of entries expiring with
   * {@link ExpirationType#UPDATE} with those computed by the {@code updater}.
   *
   * @param updater computes the replacement values of expired entries
   * @param <K1> the key type of the updater
   * @param <V1> the value type of the updater
   * @return a cache having the requested features
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> ObservableCache<K1, V1> build(
      CacheUpdater<? super K1, V1> updater) {
    requireNonNull(updater);

    @SuppressWarnings("unchecked")
    ObservableCacheBuilder<K1, V1> self = (ObservableCacheBuilder<K1, V1>) this;
    return new ObservableInMemoryCache<>(self, updater);
  }

  /**
   * Returns a string representation for this ObservableCacheBuilder instance. The exact form of
   * the returned string is not specified.
   */
  @Override
  public String toString() {
    var s = new StringBuilder(64);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (expireAfter != null) {
      s.append("expireAfter=").append(expireAfter).append(", ");
    }
    if (expirationType != null) {
      s.append("expirationType=").append(expirationType.toString().toLowerCase(Locale.US))
          .append(", ");
    }
    if (expirationTolerance != null) {
      s.append("expirationTolerance=").append(expirationTolerance).append(", ");
    }
    if (notificationScheduler != null) {
      s.append("notificationScheduler, ");
    }
    if (s.length() > baseLength) {
      s.deleteCharAt(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
