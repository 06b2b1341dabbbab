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

import java.util.concurrent.atomic.AtomicReference;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A ticket for an instance acquired from a {@link Pool}. The ticket is either released back into
 * the pool or detached from it, exactly once, after which its value can no longer be accessed.
 * Closing the ticket releases it if neither has happened yet, which makes it suitable for
 * try-with-resources.
 *
 * @param <V> the type of the pooled instance
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class Pooled<V> implements AutoCloseable {
  enum State { ACQUIRED, RELEASED, DETACHED }

  final AtomicReference<State> state;
  final Pool<V> pool;
  final V value;

  Pooled(Pool<V> pool, V value) {
    this.state = new AtomicReference<>(State.ACQUIRED);
    this.value = requireNonNull(value);
    this.pool = requireNonNull(pool);
  }

  /**
   * Returns the pooled instance.
   *
   * @throws IllegalStateException if the ticket was released or detached
   */
  public V value() {
    if (state.get() != State.ACQUIRED) {
      throw new IllegalStateException("The pooled value is no longer accessible "
          + "after it has been released back into or detached from its pool");
    }
    return value;
  }

  /** Returns the pool that this ticket was acquired from. */
  public Pool<V> owningPool() {
    return pool;
  }

  /** Returns whether the instance was returned to the pool. */
  public boolean hasBeenReleasedBackToPool() {
    return (state.get() == State.RELEASED);
  }

  /** Returns whether the instance was taken out of the pool's ownership. */
  public boolean hasBeenDetachedFromPool() {
    return (state.get() == State.DETACHED);
  }

  /**
   * Returns the instance to its pool.
   *
   * @see Pool#releasePooledValue(Pooled)
   */
  public void releaseBackToPool() {
    pool.releasePooledValue(this);
  }

  /**
   * Takes the instance out of its pool's ownership.
   *
   * @see Pool#detachPooledValue(Pooled)
   */
  @CanIgnoreReturnValue
  public V detachFromPool() {
    return pool.detachPooledValue(this);
  }

  /**
   * Releases the instance back into the pool unless the ticket was already released or detached.
   * If the pool has been closed the instance is discarded instead.
   */
  @Override
  public void close() {
    if (state.compareAndSet(State.ACQUIRED, State.RELEASED)) {
      pool.recycle(value);
    }
  }

  /** Moves the ticket out of the acquired state, failing if it has already left it. */
  V claim(State target) {
    if (state.compareAndSet(State.ACQUIRED, target)) {
      return value;
    }
    State current = state.get();
    if (target == State.RELEASED) {
      throw new IllegalArgumentException((current == State.RELEASED)
          ? "Pooled values that have already been released back and returned to the pool "
              + "cannot be released a second time."
          : "Detached pooled values can no longer be released and returned back into the pool.");
    }
    throw new IllegalArgumentException((current == State.DETACHED)
        ? "Pooled values that have already been detached from the pool cannot be detached "
            + "a second time."
        : "Pooled values that have been released back into the pool can no longer be detached.");
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '[' + state.get() + ']';
  }
}
