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

import static com.google.common.truth.Truth.assertThat;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.google.common.primitives.Ints;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
@ExtendWith(MockitoExtension.class)
final class PacerTest {
  private static final long ONE_MINUTE_IN_NANOS = TimeUnit.MINUTES.toNanos(1);
  private static final Random random = new Random();
  private static final long NOW = random.nextLong();

  @Mock Scheduler scheduler;
  @Mock Executor executor;
  @Mock Runnable command;
  @Mock Disposable future;

  Pacer pacer;

  @BeforeEach
  void beforeEach() {
    pacer = new Pacer(scheduler);
  }

  @Test
  void schedule_initialize() {
    long delay = random.nextInt(Ints.saturatedCast(Pacer.TOLERANCE));
    doReturn(future).when(scheduler)
        .scheduleDirect(any(Runnable.class), eq(Pacer.TOLERANCE), eq(NANOSECONDS));
    pacer.schedule(executor, command, NOW, delay);

    assertThat(pacer.isScheduled()).isTrue();
    assertThat(pacer.future).isSameInstanceAs(future);
    assertThat(pacer.nextFireTime).isEqualTo(NOW + Pacer.TOLERANCE);
  }

  @Test
  void schedule_handsOffToExecutor() {
    doReturn(future).when(scheduler)
        .scheduleDirect(any(Runnable.class), anyLong(), eq(NANOSECONDS));
    pacer.schedule(executor, command, NOW, ONE_MINUTE_IN_NANOS);
    verifyNoInteractions(executor, command);

    var task = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).scheduleDirect(task.capture(), eq(ONE_MINUTE_IN_NANOS), eq(NANOSECONDS));

    task.getValue().run();
    verify(executor).execute(command);
    verifyNoInteractions(command);
  }

  @Test
  void schedule_handOff_rejected() {
    doReturn(future).when(scheduler)
        .scheduleDirect(any(Runnable.class), anyLong(), eq(NANOSECONDS));
    doThrow(RejectedExecutionException.class).when(executor).execute(command);
    pacer.schedule(executor, command, NOW, ONE_MINUTE_IN_NANOS);

    var task = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).scheduleDirect(task.capture(), anyLong(), eq(NANOSECONDS));
    task.getValue().run();
    verifyNoInteractions(command);
  }

  @Test
  void schedule_cancel_schedule() {
    long fireTime = NOW + Pacer.TOLERANCE;
    long delay = random.nextInt(Ints.saturatedCast(Pacer.TOLERANCE));
    doReturn(future).when(scheduler)
        .scheduleDirect(any(Runnable.class), eq(Pacer.TOLERANCE), eq(NANOSECONDS));

    pacer.schedule(executor, command, NOW, delay);
    assertThat(pacer.nextFireTime).isEqualTo(fireTime);
    assertThat(pacer.future).isSameInstanceAs(future);
    assertThat(pacer.isScheduled()).isTrue();

    pacer.cancel();
    verify(future).dispose();
    assertThat(pacer.nextFireTime).isEqualTo(0L);
    assertThat(pacer.isScheduled()).isFalse();
    assertThat(pacer.future).isNull();

    pacer.schedule(executor, command, NOW, delay);
    assertThat(pacer.isScheduled()).isTrue();
    assertThat(pacer.nextFireTime).isEqualTo(fireTime);
    assertThat(pacer.future).isSameInstanceAs(future);
  }

  @Test
  void schedule_afterNextFireTime_skip() {
    pacer.nextFireTime = NOW + ONE_MINUTE_IN_NANOS;
    pacer.future = future;

    long expectedNextFireTime = pacer.nextFireTime;
    pacer.schedule(executor, command, NOW, ONE_MINUTE_IN_NANOS);
    verifyNoInteractions(scheduler, executor, command);
    verify(future, never()).dispose();

    assertThat(pacer.isScheduled()).isTrue();
    assertThat(pacer.future).isSameInstanceAs(future);
    assertThat(pacer.nextFireTime).isEqualTo(expectedNextFireTime);
  }

  @Test
  void schedule_beforeNextFireTime_skip() {
    pacer.nextFireTime = NOW + ONE_MINUTE_IN_NANOS;
    pacer.future = future;

    long expectedNextFireTime = pacer.nextFireTime;
    long delay = ONE_MINUTE_IN_NANOS
        - Math.max(1, random.nextInt(Ints.saturatedCast(Pacer.TOLERANCE)));
    pacer.schedule(executor, command, NOW, delay);
    verifyNoInteractions(scheduler, executor, command);
    verify(future, never()).dispose();

    assertThat(pacer.isScheduled()).isTrue();
    assertThat(pacer.future).isSameInstanceAs(future);
    assertThat(pacer.nextFireTime).isEqualTo(expectedNextFireTime);
  }

  @Test
  void schedule_beforeNextFireTime_minimumDelay() {
    pacer.nextFireTime = NOW + ONE_MINUTE_IN_NANOS;
    pacer.future = future;

    long delay = random.nextInt(Ints.saturatedCast(Pacer.TOLERANCE));
    Disposable replacement = Disposable.empty();
    doReturn(replacement).when(scheduler)
        .scheduleDirect(any(Runnable.class), eq(Pacer.TOLERANCE), eq(NANOSECONDS));
    pacer.schedule(executor, command, NOW, delay);

    verify(future).dispose();
    verifyNoInteractions(executor, command);

    assertThat(pacer.future).isSameInstanceAs(replacement);
    assertThat(pacer.nextFireTime).isEqualTo(NOW + Pacer.TOLERANCE);
    assertThat(pacer.isScheduled()).isTrue();
  }

  @Test
  void schedule_beforeNextFireTime_customDelay() {
    pacer.nextFireTime = NOW + ONE_MINUTE_IN_NANOS;
    pacer.future = future;

    long delay = (Pacer.TOLERANCE + Math.max(1, random.nextInt(Integer.MAX_VALUE)));
    Disposable replacement = Disposable.empty();
    doReturn(replacement).when(scheduler)
        .scheduleDirect(any(Runnable.class), eq(delay), eq(NANOSECONDS));
    pacer.schedule(executor, command, NOW, delay);

    verify(future).dispose();
    verifyNoInteractions(executor, command);

    assertThat(pacer.future).isSameInstanceAs(replacement);
    assertThat(pacer.nextFireTime).isEqualTo(NOW + delay);
    assertThat(pacer.isScheduled()).isTrue();
  }

  @Test
  void schedule_afterFired_reschedules() {
    pacer.nextFireTime = NOW + ONE_MINUTE_IN_NANOS;
    pacer.future = future;
    when(future.isDisposed()).thenReturn(true);

    Disposable replacement = Disposable.empty();
    doReturn(replacement).when(scheduler)
        .scheduleDirect(any(Runnable.class), eq(ONE_MINUTE_IN_NANOS), eq(NANOSECONDS));
    pacer.schedule(executor, command, NOW, ONE_MINUTE_IN_NANOS);

    assertThat(pacer.future).isSameInstanceAs(replacement);
    assertThat(pacer.isScheduled()).isTrue();
  }

  @Test
  void schedule_customTolerance() {
    pacer = new Pacer(scheduler, /* tolerance= */ 0L);
    doReturn(future).when(scheduler).scheduleDirect(any(Runnable.class), eq(1L), eq(NANOSECONDS));
    pacer.schedule(executor, command, NOW, 1L);

    assertThat(pacer.nextFireTime).isEqualTo(NOW + 1L);
    assertThat(pacer.isScheduled()).isTrue();
  }

  @Test
  void cancel_initialize() {
    pacer.cancel();
    assertThat(pacer.nextFireTime).isEqualTo(0L);
    assertThat(pacer.isScheduled()).isFalse();
    assertThat(pacer.future).isNull();
  }

  @Test
  void cancel_scheduled() {
    pacer.nextFireTime = NOW + ONE_MINUTE_IN_NANOS;
    pacer.future = future;

    pacer.cancel();
    verify(future).dispose();
    assertThat(pacer.future).isNull();
    assertThat(pacer.isScheduled()).isFalse();
    assertThat(pacer.nextFireTime).isEqualTo(0L);
  }

  @Test
  void isScheduled_nullFuture() {
    pacer.future = null;
    assertThat(pacer.isScheduled()).isFalse();
  }

  @Test
  void isScheduled_disposedFuture() {
    pacer.future = Disposable.disposed();
    assertThat(pacer.isScheduled()).isFalse();
  }

  @Test
  void isScheduled_inFlight() {
    pacer.future = Disposable.empty();
    assertThat(pacer.isScheduled()).isTrue();
  }
}
