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
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.benmanes.rxcache.collections.NotificationSuppression;
import com.google.common.collect.Lists;

import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.TestScheduler;

/**
 * Drives the expiration sweeps on virtual time.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class ExpirationTest {
  static final Duration ONE_MINUTE = Duration.ofMinutes(1);

  TestScheduler scheduler;
  ObservableCache<Integer, String> cache;
  TestObserver<CacheChange<Integer, String>> changes;

  @BeforeEach
  void beforeEach() {
    scheduler = new TestScheduler();
    useCache(builder().build());
  }

  @AfterEach
  void afterEach() {
    cache.close();
  }

  ObservableCacheBuilder<Object, Object> builder() {
    return ObservableCacheBuilder.newBuilder()
        .ticker(Ticker.schedulerTicker(scheduler))
        .scheduler(scheduler)
        .executor(Runnable::run);
  }

  void useCache(ObservableCache<Integer, String> replacement) {
    if (cache != null) {
      cache.close();
    }
    cache = replacement;
    changes = cache.changes().test();
  }

  List<CacheChangeType> changeTypes() {
    return Lists.transform(changes.values(), CacheChange::type);
  }

  CacheChange<Integer, String> lastChange() {
    List<CacheChange<Integer, String>> values = changes.values();
    return values.get(values.size() - 1);
  }

  /* --------------- Remove --------------- */

  @Test
  void remove() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();

    scheduler.advanceTimeBy(59, SECONDS);
    assertThat(cache.currentKeys()).containsExactly(1);

    scheduler.advanceTimeBy(1, SECONDS);
    assertThat(cache.currentCount()).isEqualTo(0);
    assertThat(changeTypes()).containsExactly(CacheChangeType.ITEM_ADDED,
        CacheChangeType.ITEM_EXPIRED, CacheChangeType.ITEM_REMOVED).inOrder();
    assertThat(lastChange().value()).isEqualTo("One");
  }

  @Test
  void remove_defaultExpiry() {
    useCache(builder().expireAfter(ONE_MINUTE).build());
    cache.add(1, "One").blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentCount()).isEqualTo(0);
    assertThat(lastChange().type()).isEqualTo(CacheChangeType.ITEM_REMOVED);
  }

  @Test
  void remove_inExpiryOrder() {
    cache.add(1, "One", Duration.ofMinutes(2), ExpirationType.REMOVE).blockingAwait();
    cache.add(2, "Two", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();
    cache.add(3, "Three").blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentKeys()).containsExactly(1, 3);

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentKeys()).containsExactly(3);

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentKeys()).containsExactly(3);
  }

  @Test
  void remove_zeroExpiry() {
    cache.add(1, "One", Duration.ZERO, ExpirationType.REMOVE).blockingAwait();
    cache.get(1).test().assertError(KeyHasExpiredException.class);

    scheduler.advanceTimeBy(Pacer.TOLERANCE, NANOSECONDS);
    assertThat(cache.currentCount()).isEqualTo(0);
  }

  @Test
  void remove_pacedByTolerance() {
    cache.add(1, "One", Duration.ofMillis(1), ExpirationType.REMOVE).blockingAwait();

    scheduler.advanceTimeBy(1, SECONDS);
    assertThat(cache.currentCount()).isEqualTo(1);

    scheduler.advanceTimeBy(100, MILLISECONDS);
    assertThat(cache.currentCount()).isEqualTo(0);
  }

  @Test
  void remove_customTolerance() {
    useCache(builder().expirationTolerance(Duration.ZERO).build());
    cache.add(1, "One", Duration.ofMillis(1), ExpirationType.REMOVE).blockingAwait();

    scheduler.advanceTimeBy(1, MILLISECONDS);
    assertThat(cache.currentCount()).isEqualTo(0);
  }

  @Test
  void remove_afterRewrite() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();
    scheduler.advanceTimeBy(30, SECONDS);
    cache.update(1, "Uno").blockingAwait();

    scheduler.advanceTimeBy(30, SECONDS);
    assertThat(cache.get(1).blockingGet()).isEqualTo("Uno");

    scheduler.advanceTimeBy(30, SECONDS);
    assertThat(cache.currentCount()).isEqualTo(0);
  }

  @Test
  void itemExpirations() {
    TestObserver<CacheChange<Integer, String>> expirations = cache.itemExpirations().test();
    cache.add(1, "One", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();
    cache.add(2, "Two").blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    expirations.assertValueCount(1);
    assertThat(expirations.values().get(0).key()).isEqualTo(1);
    assertThat(expirations.values().get(0).type()).isEqualTo(CacheChangeType.ITEM_EXPIRED);
  }

  @Test
  void suppressed() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();
    try (NotificationSuppression suppression = cache.suppressChangeNotifications(false)) {
      scheduler.advanceTimeBy(1, MINUTES);
    }
    assertThat(cache.currentCount()).isEqualTo(0);
    assertThat(changeTypes()).containsExactly(CacheChangeType.ITEM_ADDED);
  }

  /* --------------- Do nothing --------------- */

  @Test
  void doNothing() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.DO_NOTHING).blockingAwait();
    scheduler.advanceTimeBy(1, MINUTES);

    assertThat(changeTypes()).containsExactly(
        CacheChangeType.ITEM_ADDED, CacheChangeType.ITEM_EXPIRED).inOrder();
    cache.get(1).test().assertError(KeyHasExpiredException.class);
    cache.get(1, /* throwIfExpired= */ false).test().assertResult("One");
    cache.contains(1).test().assertResult(true);

    scheduler.advanceTimeBy(10, MINUTES);
    assertThat(changes.values()).hasSize(2);
    assertThat(cache.expiresIn(1).blockingGet()).isEqualTo(Duration.ofMinutes(-10));
  }

  @Test
  void doNothing_reportedAgainAfterRewrite() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.DO_NOTHING).blockingAwait();
    scheduler.advanceTimeBy(2, MINUTES);
    cache.update(1, "Uno", /* throwIfExpired= */ false).blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(changeTypes()).containsExactly(CacheChangeType.ITEM_ADDED,
        CacheChangeType.ITEM_EXPIRED, CacheChangeType.ITEM_VALUE_REPLACED,
        CacheChangeType.ITEM_EXPIRED).inOrder();
    assertThat(lastChange().value()).isEqualTo("Uno");
  }

  @Test
  void doNothing_getAll() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.DO_NOTHING).blockingAwait();
    cache.add(2, "Two").blockingAwait();
    scheduler.advanceTimeBy(1, MINUTES);

    cache.getAll(List.of(2, 1)).test()
        .assertValues("Two")
        .assertError(KeyHasExpiredException.class);
    cache.getAll(List.of(2, 1), /* throwIfExpired= */ false).test().assertResult("Two", "One");
  }

  @Test
  void doNothing_update() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.DO_NOTHING).blockingAwait();
    scheduler.advanceTimeBy(1, MINUTES);

    cache.update(1, "Uno").test().assertError(KeyHasExpiredException.class);
    assertThat(cache.get(1, /* throwIfExpired= */ false).blockingGet()).isEqualTo("One");

    cache.update(1, "Uno", /* throwIfExpired= */ false).blockingAwait();
    assertThat(cache.get(1).blockingGet()).isEqualTo("Uno");
  }

  @Test
  void doNothing_updateRange() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.DO_NOTHING).blockingAwait();
    cache.add(2, "Two").blockingAwait();
    scheduler.advanceTimeBy(1, MINUTES);

    Map<Integer, String> items = new LinkedHashMap<>();
    items.put(2, "Dos");
    items.put(1, "Uno");
    cache.updateRange(items).test().assertError(KeyHasExpiredException.class);
    assertThat(cache.get(2).blockingGet()).isEqualTo("Dos");
    assertThat(cache.get(1, /* throwIfExpired= */ false).blockingGet()).isEqualTo("One");

    cache.updateRange(items, /* throwIfExpired= */ false).blockingAwait();
    assertThat(cache.get(1).blockingGet()).isEqualTo("Uno");
  }

  @Test
  void doNothing_updateExpiration() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.DO_NOTHING).blockingAwait();
    scheduler.advanceTimeBy(1, MINUTES);

    cache.updateExpiration(1, ONE_MINUTE, ExpirationType.REMOVE).test()
        .assertError(KeyHasExpiredException.class);
    cache.updateExpiration(1, ONE_MINUTE, ExpirationType.REMOVE, /* throwIfExpired= */ false)
        .blockingAwait();
    assertThat(cache.expiresIn(1).blockingGet()).isEqualTo(ONE_MINUTE);

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentCount()).isEqualTo(0);
  }

  @Test
  void doNothing_updateExpiration_keys() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.DO_NOTHING).blockingAwait();
    cache.add(2, "Two").blockingAwait();
    scheduler.advanceTimeBy(1, MINUTES);

    cache.updateExpiration(List.of(2, 1), ONE_MINUTE, ExpirationType.REMOVE).test()
        .assertError(KeyHasExpiredException.class);
    assertThat(cache.expiresIn(2).blockingGet()).isEqualTo(ONE_MINUTE);
    assertThat(cache.expiresIn(1).blockingGet()).isEqualTo(Duration.ZERO);

    cache.updateExpiration(List.of(2, 1), ONE_MINUTE,
        ExpirationType.REMOVE, /* throwIfExpired= */ false).blockingAwait();
    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentCount()).isEqualTo(0);
  }

  /* --------------- Update --------------- */

  @Test
  void update() {
    var calls = new AtomicInteger();
    useCache(builder().build(key -> "v" + calls.incrementAndGet()));
    cache.add(1, "One", ONE_MINUTE, ExpirationType.UPDATE).blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(changeTypes()).containsExactly(CacheChangeType.ITEM_ADDED,
        CacheChangeType.ITEM_EXPIRED, CacheChangeType.ITEM_VALUE_REPLACED).inOrder();
    assertThat(lastChange().value()).isEqualTo("v1");
    assertThat(lastChange().oldValue()).isEqualTo("One");
    assertThat(cache.expiresIn(1).blockingGet()).isEqualTo(ONE_MINUTE);

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.get(1).blockingGet()).isEqualTo("v2");
    assertThat(calls.get()).isEqualTo(2);
  }

  @Test
  void update_defaultExpirationType() {
    useCache(builder()
        .expireAfter(ONE_MINUTE)
        .expirationType(ExpirationType.UPDATE)
        .build(key -> "v" + key));
    cache.add(1, "One").blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.get(1).blockingGet()).isEqualTo("v1");
  }

  @Test
  void update_nullRemoves() {
    useCache(builder().build(key -> null));
    cache.add(1, "One", ONE_MINUTE, ExpirationType.UPDATE).blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentCount()).isEqualTo(0);
    assertThat(changeTypes()).containsExactly(CacheChangeType.ITEM_ADDED,
        CacheChangeType.ITEM_EXPIRED, CacheChangeType.ITEM_REMOVED).inOrder();
  }

  @Test
  void update_fails() {
    var calls = new AtomicInteger();
    useCache(builder().build(key -> {
      calls.incrementAndGet();
      throw new IOException();
    }));
    TestObserver<ExpirationException> failures = cache.expirationFailures().test();
    cache.add(1, "One", ONE_MINUTE, ExpirationType.UPDATE).blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    failures.assertValueCount(1);
    assertThat(failures.values().get(0).key()).isEqualTo(1);
    assertThat(failures.values().get(0)).hasCauseThat().isInstanceOf(IOException.class);
    assertThat(changes.values()).hasSize(2);
    cache.get(1, /* throwIfExpired= */ false).test().assertResult("One");

    scheduler.advanceTimeBy(10, MINUTES);
    assertThat(calls.get()).isEqualTo(1);
    failures.assertValueCount(1);
  }

  @Test
  void update_inBulk() {
    List<Set<Integer>> batches = new ArrayList<>();
    CacheUpdater<Integer, String> updater = new CacheUpdater<>() {
      @Override public @Nullable String update(Integer key) {
        throw new UnsupportedOperationException();
      }
      @Override public Map<Integer, String> updateAll(Set<? extends Integer> keys) {
        batches.add(Set.copyOf(keys));
        Map<Integer, String> result = new HashMap<>();
        for (Integer key : keys) {
          result.put(key, "v" + key);
        }
        return result;
      }
    };
    useCache(builder().build(updater));
    cache.addRange(Map.of(1, "One", 2, "Two", 3, "Three"),
        ONE_MINUTE, ExpirationType.UPDATE).blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(batches).containsExactly(Set.of(1, 2, 3));
    assertThat(cache.currentValues()).containsExactly("v1", "v2", "v3");
  }

  /* --------------- Expiration settings --------------- */

  @Test
  void updateExpiration() {
    cache.add(1, "One").blockingAwait();
    cache.updateExpiration(1, Duration.ofSeconds(10), ExpirationType.REMOVE).blockingAwait();

    scheduler.advanceTimeBy(10, SECONDS);
    assertThat(cache.currentCount()).isEqualTo(0);
  }

  @Test
  void updateExpiration_keys() {
    cache.addRange(Map.of(1, "One", 2, "Two", 3, "Three")).blockingAwait();
    cache.updateExpiration(List.of(1, 2), ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(cache.currentKeys()).containsExactly(3);
  }

  @Test
  void expiresAt() {
    scheduler.advanceTimeBy(10, SECONDS);
    cache.add(1, "One", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();

    scheduler.advanceTimeBy(20, SECONDS);
    cache.expiresAt(1).test().assertResult(SECONDS.toNanos(70));
  }

  @Test
  void expiresIn() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();
    scheduler.advanceTimeBy(20, SECONDS);
    cache.expiresIn(1).test().assertResult(Duration.ofSeconds(40));
  }

  /* --------------- Lifecycle --------------- */

  @Test
  void close_cancelsSweep() {
    cache.add(1, "One", ONE_MINUTE, ExpirationType.REMOVE).blockingAwait();
    var inMemory = (ObservableInMemoryCache<Integer, String>) cache;
    assertThat(inMemory.sweeper.pacer.isScheduled()).isTrue();

    cache.close();
    assertThat(inMemory.sweeper.pacer.isScheduled()).isFalse();

    scheduler.advanceTimeBy(1, MINUTES);
    assertThat(changeTypes()).containsExactly(CacheChangeType.ITEM_ADDED);
    changes.assertComplete();
  }
}
