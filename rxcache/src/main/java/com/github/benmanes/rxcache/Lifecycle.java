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
package com.github.benmanes.rxcache;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicReference;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * An atomic {@link LifecycleState} holder. Disposal is claimed by a single caller through
 * {@link #beginDisposal()}, which makes repeated or concurrent {@code close()} calls no-ops.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class Lifecycle {
  private final AtomicReference<LifecycleState> state;
  private final String owner;

  public Lifecycle(String owner) {
    this.state = new AtomicReference<>(LifecycleState.ACTIVE);
    this.owner = requireNonNull(owner);
  }

  /** Returns the current state. */
  public LifecycleState state() {
    return state.get();
  }

  /** Returns whether new work is accepted. */
  public boolean isActive() {
    return (state.get() == LifecycleState.ACTIVE);
  }

  /** Returns whether disposal has started or finished. */
  public boolean isDisposed() {
    return (state.get() != LifecycleState.ACTIVE);
  }

  /**
   * Ensures that the component is accepting new work.
   *
   * @throws ObjectDisposedException if disposal has started
   */
  public void checkActive() {
    if (!isActive()) {
      throw new ObjectDisposedException(owner);
    }
  }

  /**
   * Moves from {@code ACTIVE} to {@code DISPOSING}.
   *
   * @return if the caller won the transition and is responsible for releasing the resources
   */
  @CanIgnoreReturnValue
  public boolean beginDisposal() {
    return state.compareAndSet(LifecycleState.ACTIVE, LifecycleState.DISPOSING);
  }

  /** Moves from {@code DISPOSING} to {@code DISPOSED}. */
  public void completeDisposal() {
    state.compareAndSet(LifecycleState.DISPOSING, LifecycleState.DISPOSED);
  }

  @Override
  public String toString() {
    return owner + '[' + state.get() + ']';
  }
}
