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
package com.github.benmanes.rxcache.pool;

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.rxcache.Lifecycle;
import com.github.benmanes.rxcache.ObjectDisposedException;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * A pool of reusable instances. Idle instances are kept in a lock-free queue and handed out as
 * {@link Pooled} tickets, which must either be released back into the pool or detached from it.
 * New instances are built by the supplied {@link Callable} on the pool's {@link Executor}.
 * <p>
 * The pool owns every instance it built or was given, minus those detached or discarded. An idle
 * instance that is {@link AutoCloseable} is closed when it is discarded, either by
 * {@link #decreaseAvailablePoolSizeAsync(int)} or by closing the pool. Closing the pool does not
 * affect the instances that are currently acquired; closing their tickets afterwards discards
 * them.
 *
 * @param <V> the type of the pooled instances
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class Pool<V> implements AutoCloseable {
  static final Logger logger = System.getLogger(Pool.class.getName());

  final Queue<CompletableFuture<@Nullable Pooled<V>>> waiters;
  final Callable<? extends V> instanceBuilder;
  final AtomicInteger totalInstancesCount;
  final Queue<V> pooledInstances;
  final Lifecycle lifecycle;
  final Executor executor;

  /**
   * Creates an empty pool that builds its instances on {@link ForkJoinPool#commonPool()}.
   *
   * @param instanceBuilder builds a new instance when the pool grows
   */
  public Pool(Callable<? extends V> instanceBuilder) {
    this(instanceBuilder, 0);
  }

  /**
   * Creates a pool populated with {@code initialPoolSize} instances, built on the calling thread.
   *
   * @param instanceBuilder builds a new instance when the pool grows
   * @param initialPoolSize the number of instances to build eagerly
   * @throws IllegalArgumentException if {@code initialPoolSize} is negative
   * @throws CompletionException if the instance builder throws a checked exception
   */
  public Pool(Callable<? extends V> instanceBuilder, int initialPoolSize) {
    this(instanceBuilder, initialPoolSize, ForkJoinPool.commonPool());
  }

  /**
   * Creates a pool populated with {@code initialPoolSize} instances, built on the calling thread,
   * that builds any further instances on the given executor.
   *
   * @param instanceBuilder builds a new instance when the pool grows
   * @param initialPoolSize the number of instances to build eagerly
   * @param executor the executor that builds and discards instances asynchronously
   * @throws IllegalArgumentException if {@code initialPoolSize} is negative
   * @throws CompletionException if the instance builder throws a checked exception
   */
  public Pool(Callable<? extends V> instanceBuilder, int initialPoolSize, Executor executor) {
    this(instanceBuilder, executor);
    requireArgument(initialPoolSize >= 0,
        "initial pool size must not be negative: %s", initialPoolSize);
    for (int i = 0; i < initialPoolSize; i++) {
      pooledInstances.add(newInstance());
      totalInstancesCount.incrementAndGet();
    }
  }

  /**
   * Creates a pool that initially holds the given instances.
   *
   * @param instanceBuilder builds a new instance when the pool grows
   * @param initialInstances the instances to take ownership of
   */
  public Pool(Callable<? extends V> instanceBuilder, Iterable<? extends V> initialInstances) {
    this(instanceBuilder, initialInstances, ForkJoinPool.commonPool());
  }

  /**
   * Creates a pool that initially holds the given instances and builds any further instances on
   * the given executor.
   *
   * @param instanceBuilder builds a new instance when the pool grows
   * @param initialInstances the instances to take ownership of
   * @param executor the executor that builds and discards instances asynchronously
   */
  public Pool(Callable<? extends V> instanceBuilder,
      Iterable<? extends V> initialInstances, Executor executor) {
    this(instanceBuilder, executor);
    for (V instance : initialInstances) {
      pooledInstances.add(requireNonNull(instance));
      totalInstancesCount.incrementAndGet();
    }
  }

  private Pool(Callable<? extends V> instanceBuilder, Executor executor) {
    this.instanceBuilder = requireNonNull(instanceBuilder);
    this.executor = requireNonNull(executor);
    this.totalInstancesCount = new AtomicInteger();
    this.pooledInstances = new ConcurrentLinkedQueue<>();
    this.waiters = new ConcurrentLinkedQueue<>();
    this.lifecycle = new Lifecycle("Pool");
  }

  /**
   * Returns the number of idle instances.
   *
   * @throws ObjectDisposedException if the pool has been closed
   */
  public int availableInstancesCount() {
    lifecycle.checkActive();
    return pooledInstances.size();
  }

  /** Returns the number of instances owned by the pool, both idle and acquired. */
  public int totalInstancesCount() {
    return totalInstancesCount.get();
  }

  /** Returns whether {@link #close()} has been called. */
  public boolean isDisposed() {
    return lifecycle.isDisposed();
  }

  /**
   * Builds {@code increaseBy} instances one after another on the executor and adds them to the
   * pool. Cancelling the returned future stops the growth between two builds; an instance that
   * was being built when the future was cancelled is discarded.
   *
   * @param increaseBy the number of instances to add
   * @return a future that completes when all of the instances were added
   * @throws IllegalArgumentException if {@code increaseBy} is negative
   * @throws ObjectDisposedException if the pool has been closed
   */
  public CompletableFuture<Void> increasePoolSizeAsync(int increaseBy) {
    requireArgument(increaseBy >= 0, "cannot increase the pool size by %s", increaseBy);
    lifecycle.checkActive();

    var result = new CompletableFuture<Void>();
    executor.execute(() -> {
      try {
        for (int i = 0; i < increaseBy; i++) {
          if (result.isDone()) {
            return;
          }
          V instance = newInstance();
          if (result.isDone()) {
            discard(instance);
            return;
          }
          totalInstancesCount.incrementAndGet();
          recycle(instance);
          lifecycle.checkActive();
        }
        result.complete(null);
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    return result;
  }

  /**
   * Removes {@code decreaseBy} idle instances from the pool and discards them. Acquired instances
   * are never affected.
   *
   * @param decreaseBy the number of idle instances to remove
   * @return a future that completes when the instances were discarded
   * @throws IllegalArgumentException if {@code decreaseBy} is negative or exceeds the number of
   *         available instances
   * @throws ObjectDisposedException if the pool has been closed
   */
  public CompletableFuture<Void> decreaseAvailablePoolSizeAsync(int decreaseBy) {
    requireArgument(decreaseBy >= 0, "cannot decrease the pool size by %s", decreaseBy);
    int available = availableInstancesCount();
    requireArgument(decreaseBy <= available, "Cannot decrease the amount of (available) pooled "
        + "items by more than what's available: %s > %s", decreaseBy, available);

    return CompletableFuture.runAsync(() -> {
      for (int i = 0; i < decreaseBy; i++) {
        V instance = pooledInstances.poll();
        if (instance == null) {
          return;
        }
        totalInstancesCount.decrementAndGet();
        discard(instance);
      }
    }, executor);
  }

  /**
   * Acquires an idle instance, completing with {@code null} if none is available.
   *
   * @return a future of the ticket, or of {@code null} if the pool is empty
   * @throws ObjectDisposedException if the pool has been closed
   */
  public CompletableFuture<@Nullable Pooled<V>> acquirePooledValueAsync() {
    return acquirePooledValueAsync(AcquisitionMode.AVAILABLE_INSTANCE_OR_NULL);
  }

  /**
   * Acquires an idle instance, behaving as described by the {@code mode} when none is available.
   * Cancelling a future that is waiting for a released instance withdraws the request.
   *
   * @param mode what to do when the pool is empty
   * @return a future of the ticket, or of {@code null} if the pool is empty and the mode is
   *         {@link AcquisitionMode#AVAILABLE_INSTANCE_OR_NULL}
   * @throws ObjectDisposedException if the pool has been closed
   */
  public CompletableFuture<@Nullable Pooled<V>> acquirePooledValueAsync(AcquisitionMode mode) {
    requireNonNull(mode);
    lifecycle.checkActive();

    V instance = pooledInstances.poll();
    if (instance != null) {
      return CompletableFuture.completedFuture(new Pooled<>(this, instance));
    }
    switch (mode) {
      case AVAILABLE_INSTANCE_OR_NULL:
        return CompletableFuture.completedFuture(null);
      case AVAILABLE_INSTANCE_OR_CREATE:
        return createPooledValue();
      case AVAILABLE_INSTANCE_OR_WAIT:
        return waitForPooledValue();
      default:
        throw new IllegalArgumentException("Unknown acquisition mode: " + mode);
    }
  }

  /** Builds a new instance on the executor, returning it to the pool if the caller cancelled. */
  private CompletableFuture<@Nullable Pooled<V>> createPooledValue() {
    var result = new CompletableFuture<@Nullable Pooled<V>>();
    executor.execute(() -> {
      try {
        V created = newInstance();
        totalInstancesCount.incrementAndGet();
        if (!result.complete(new Pooled<>(this, created))) {
          recycle(created);
        }
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    return result;
  }

  /** Parks a waiter that a subsequent release will hand its instance to. */
  private CompletableFuture<@Nullable Pooled<V>> waitForPooledValue() {
    var waiter = new CompletableFuture<@Nullable Pooled<V>>();
    waiter.whenComplete((pooled, error) -> {
      if (waiter.isCancelled()) {
        waiters.remove(waiter);
      }
    });
    waiters.add(waiter);
    dispatchToWaiters();
    if (!lifecycle.isActive()) {
      failWaiters();
    }
    return waiter;
  }

  /**
   * Returns the ticket's instance to the pool, or hands it to a waiting acquirer.
   *
   * @param pooledValue the ticket acquired from this pool
   * @throws IllegalArgumentException if the ticket belongs to another pool, or has already been
   *         released or detached
   * @throws ObjectDisposedException if the pool has been closed
   */
  public void releasePooledValue(Pooled<V> pooledValue) {
    requireNonNull(pooledValue);
    requireArgument(pooledValue.pool == this,
        "Only pooled values managed by this pool can be released back into the pool.");
    lifecycle.checkActive();

    V instance = pooledValue.claim(Pooled.State.RELEASED);
    recycle(instance);
  }

  /**
   * Takes the ticket's instance out of the pool's ownership. The caller becomes responsible for
   * the instance's disposal.
   *
   * @param pooledValue the ticket acquired from this pool
   * @return the detached instance
   * @throws IllegalArgumentException if the ticket belongs to another pool, or has already been
   *         released or detached
   * @throws ObjectDisposedException if the pool has been closed
   */
  @CanIgnoreReturnValue
  public V detachPooledValue(Pooled<V> pooledValue) {
    requireNonNull(pooledValue);
    requireArgument(pooledValue.pool == this,
        "Only pooled values managed by this pool can be detached from the pool.");
    lifecycle.checkActive();

    V instance = pooledValue.claim(Pooled.State.DETACHED);
    totalInstancesCount.decrementAndGet();
    return instance;
  }

  /**
   * Closes the pool, discarding the idle instances and failing the pending waiters with an
   * {@link ObjectDisposedException}. Acquired instances are discarded as their tickets close.
   */
  @Override
  public void close() {
    if (!lifecycle.beginDisposal()) {
      return;
    }
    drainIdleInstances();
    failWaiters();
    lifecycle.completeDisposal();
    logger.log(Level.DEBUG, "Closed pool with {0} instances still acquired",
        totalInstancesCount.get());
  }

  /** Puts an instance back into circulation, or discards it if the pool is closing. */
  void recycle(V instance) {
    pooledInstances.add(instance);
    dispatchToWaiters();
    if (!lifecycle.isActive()) {
      drainIdleInstances();
    }
  }

  /** Hands idle instances to the waiters in arrival order. */
  void dispatchToWaiters() {
    for (;;) {
      CompletableFuture<@Nullable Pooled<V>> waiter = waiters.peek();
      if (waiter == null) {
        return;
      } else if (waiter.isDone()) {
        waiters.remove(waiter);
        continue;
      }
      V instance = pooledInstances.poll();
      if (instance == null) {
        return;
      }
      if (!waiters.remove(waiter) || !waiter.complete(new Pooled<>(this, instance))) {
        // lost the waiter to a cancellation or to another dispatcher
        pooledInstances.add(instance);
      }
    }
  }

  void drainIdleInstances() {
    for (V instance; (instance = pooledInstances.poll()) != null;) {
      totalInstancesCount.decrementAndGet();
      discard(instance);
    }
  }

  void failWaiters() {
    for (CompletableFuture<@Nullable Pooled<V>> waiter; (waiter = waiters.poll()) != null;) {
      waiter.completeExceptionally(new ObjectDisposedException("Pool"));
    }
  }

  /** Builds a new instance, wrapping a checked exception in a {@link CompletionException}. */
  V newInstance() {
    try {
      return requireNonNull(instanceBuilder.call(), "the instance builder returned null");
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new CompletionException(e);
    }
  }

  /** Closes the instance if it holds resources. */
  static void discard(Object instance) {
    if (instance instanceof AutoCloseable) {
      try {
        ((AutoCloseable) instance).close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Exception thrown when discarding a pooled instance", e);
      }
    }
  }

  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{total=" + totalInstancesCount.get()
        + ", available=" + pooledInstances.size() + ", " + lifecycle.state() + "}";
  }
}
