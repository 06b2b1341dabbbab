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
package com.github.benmanes.rxcache.lock;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A grant of an {@link AsyncReaderWriterLock}, either shared (reader) or exclusive (writer).
 * Closing the ticket releases the grant; subsequent closes have no effect.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ReaderWriterLock implements AutoCloseable {
  private final AsyncReaderWriterLock owner;
  private final AtomicBoolean released;
  private final boolean exclusive;
  private final long id;

  ReaderWriterLock(AsyncReaderWriterLock owner, long id, boolean exclusive) {
    this.owner = requireNonNull(owner);
    this.released = new AtomicBoolean();
    this.exclusive = exclusive;
    this.id = id;
  }

  /** Returns the grant's sequence number, which increases with every admission. */
  public long id() {
    return id;
  }

  /** Returns whether this is a writer's grant. */
  public boolean isExclusive() {
    return exclusive;
  }

  /** Returns whether the grant has been released. */
  public boolean isReleased() {
    return released.get();
  }

  /** Releases the grant, admitting the next queued requests. */
  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      owner.release(this);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", exclusive=" + exclusive
        + ", released=" + released.get() + "}";
  }
}
