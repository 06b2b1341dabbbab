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

import java.util.concurrent.TimeUnit;

import io.reactivex.rxjava3.core.Scheduler;

/**
 * A source of nanosecond timestamps against which entry expiry is measured. Only the difference
 * between two readings is meaningful.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@FunctionalInterface
public interface Ticker {

  /** Returns the number of nanoseconds elapsed since this ticker's fixed point of reference. */
  long read();

  /** Returns a ticker that reads the current time using {@link System#nanoTime}. */
  static Ticker systemTicker() {
    return SystemTicker.INSTANCE;
  }

  /**
   * Returns a ticker that follows the clock of the given scheduler. This keeps expiry in step with
   * a virtual-time scheduler, such as {@code io.reactivex.rxjava3.schedulers.TestScheduler}.
   */
  static Ticker schedulerTicker(Scheduler scheduler) {
    requireNonNull(scheduler);
    return () -> scheduler.now(TimeUnit.NANOSECONDS);
  }
}

enum SystemTicker implements Ticker {
  INSTANCE;

  @Override public long read() {
    return System.nanoTime();
  }
}
