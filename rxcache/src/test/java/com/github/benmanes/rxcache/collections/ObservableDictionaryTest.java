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
package com.github.benmanes.rxcache.collections;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.benmanes.rxcache.KeyAlreadyExistsException;
import com.github.benmanes.rxcache.KeyNotFoundException;
import com.github.benmanes.rxcache.ObjectDisposedException;
import com.google.common.testing.EqualsTester;
import com.google.common.testing.NullPointerTester;

import io.reactivex.rxjava3.observers.TestObserver;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class ObservableDictionaryTest {
  ObservableDictionary<String, Integer> dictionary;
  TestObserver<DictionaryChange<String, Integer>> changes;

  @BeforeEach
  void beforeEach() {
    dictionary = new ObservableDictionary<>();
    changes = dictionary.changes().test();
  }

  @Test
  void nullParameters() {
    new NullPointerTester()
        .setDefault(Object.class, "a")
        .testAllPublicInstanceMethods(dictionary);
  }

  @Test
  void initialMappings_notPublished() {
    dictionary = new ObservableDictionary<>(Map.of("a", 1, "b", 2));
    changes = dictionary.changes().test();

    assertThat(dictionary.entries()).containsExactly("a", 1, "b", 2);
    changes.assertEmpty();
  }

  /* --------------- Mutations --------------- */

  @Test
  void add() {
    dictionary.add("a", 1);
    assertThat(dictionary.get("a")).isEqualTo(1);
    assertThat(dictionary.size()).isEqualTo(1);
    changes.assertValue(DictionaryChange.itemAdded("a", 1));
  }

  @Test
  void add_present() {
    dictionary.add("a", 1);
    var e = assertThrows(KeyAlreadyExistsException.class, () -> dictionary.add("a", 2));
    assertThat(e.key()).isEqualTo("a");
    assertThat(dictionary.get("a")).isEqualTo(1);
    changes.assertValueCount(1);
  }

  @Test
  void tryAdd() {
    assertThat(dictionary.tryAdd("a", 1)).isTrue();
    assertThat(dictionary.tryAdd("a", 2)).isFalse();
    assertThat(dictionary.get("a")).isEqualTo(1);
    changes.assertValue(DictionaryChange.itemAdded("a", 1));
  }

  @Test
  void put() {
    assertThat(dictionary.put("a", 1)).isNull();
    assertThat(dictionary.put("a", 2)).isEqualTo(1);
    changes.assertValues(DictionaryChange.itemAdded("a", 1),
        DictionaryChange.itemReplaced("a", 2, 1));
  }

  @Test
  void replace() {
    assertThat(dictionary.replace("a", 1)).isNull();
    dictionary.add("a", 1);
    assertThat(dictionary.replace("a", 2)).isEqualTo(1);
    changes.assertValues(DictionaryChange.itemAdded("a", 1),
        DictionaryChange.itemReplaced("a", 2, 1));
  }

  @Test
  void replace_expected() {
    dictionary.add("a", 1);
    assertThat(dictionary.replace("a", 3, 2)).isFalse();
    assertThat(dictionary.replace("a", 1, 2)).isTrue();
    assertThat(dictionary.get("a")).isEqualTo(2);
    changes.assertValues(DictionaryChange.itemAdded("a", 1),
        DictionaryChange.itemReplaced("a", 2, 1));
  }

  @Test
  void remove() {
    dictionary.add("a", 1);
    assertThat(dictionary.remove("a")).isEqualTo(1);
    assertThat(dictionary.containsKey("a")).isFalse();
    changes.assertValues(DictionaryChange.itemAdded("a", 1),
        DictionaryChange.itemRemoved("a", 1));
  }

  @Test
  void remove_absent() {
    var e = assertThrows(KeyNotFoundException.class, () -> dictionary.remove("a"));
    assertThat(e.key()).isEqualTo("a");
    changes.assertEmpty();
  }

  @Test
  void tryRemove() {
    dictionary.add("a", 1);
    assertThat(dictionary.tryRemove("b")).isNull();
    assertThat(dictionary.tryRemove("a")).isEqualTo(1);
    changes.assertValues(DictionaryChange.itemAdded("a", 1),
        DictionaryChange.itemRemoved("a", 1));
  }

  @Test
  void tryRemove_expected() {
    dictionary.add("a", 1);
    assertThat(dictionary.tryRemove("a", 2)).isFalse();
    assertThat(dictionary.tryRemove("a", 1)).isTrue();
    assertThat(dictionary.isEmpty()).isTrue();
    changes.assertValueCount(2);
  }

  @Test
  void clear() {
    dictionary.add("a", 1);
    dictionary.add("b", 2);
    dictionary.clear();

    assertThat(dictionary.isEmpty()).isTrue();
    changes.assertValueCount(3);
    assertThat(changes.values().get(2).type()).isEqualTo(DictionaryChangeType.RESET);
  }

  @Test
  void snapshots_areCopies() {
    dictionary.add("a", 1);
    var keys = dictionary.keys();
    var values = dictionary.values();
    var entries = dictionary.entries();
    dictionary.add("b", 2);

    assertThat(keys).containsExactly("a");
    assertThat(values).containsExactly(1);
    assertThat(entries).containsExactly("a", 1);
  }

  /* --------------- Suppression --------------- */

  @Test
  void suppress_withoutReset() {
    try (NotificationSuppression suppression = dictionary.suppressChangeNotifications(false)) {
      assertThat(dictionary.isTrackingChanges()).isFalse();
      dictionary.add("a", 1);
    }
    assertThat(dictionary.isTrackingChanges()).isTrue();
    changes.assertEmpty();

    dictionary.add("b", 2);
    changes.assertValue(DictionaryChange.itemAdded("b", 2));
  }

  @Test
  void suppress_withReset() {
    try (NotificationSuppression suppression = dictionary.suppressChangeNotifications(true)) {
      dictionary.add("a", 1);
      dictionary.add("b", 2);
    }
    changes.assertValue(DictionaryChange.reset());
  }

  @Test
  void suppress_nested_resetOnLastClose() {
    NotificationSuppression outer = dictionary.suppressChangeNotifications(false);
    NotificationSuppression inner = dictionary.suppressChangeNotifications(true);
    dictionary.add("a", 1);

    inner.close();
    assertThat(dictionary.isTrackingChanges()).isFalse();
    changes.assertEmpty();

    outer.close();
    assertThat(dictionary.isTrackingChanges()).isTrue();
    changes.assertValue(DictionaryChange.reset());
  }

  @Test
  void suppress_closeTwice() {
    NotificationSuppression first = dictionary.suppressChangeNotifications(false);
    NotificationSuppression second = dictionary.suppressChangeNotifications(false);
    first.close();
    first.close();

    assertThat(dictionary.isTrackingChanges()).isFalse();
    second.close();
    assertThat(dictionary.isTrackingChanges()).isTrue();
  }

  /* --------------- Close --------------- */

  @Test
  void close() {
    dictionary.add("a", 1);
    dictionary.close();
    dictionary.close();

    changes.assertComplete();
    assertThrows(ObjectDisposedException.class, dictionary::size);
    assertThrows(ObjectDisposedException.class, () -> dictionary.add("b", 2));
    assertThrows(ObjectDisposedException.class, () -> dictionary.suppressChangeNotifications(true));
  }

  @Test
  void close_whileSuppressed_noReset() {
    NotificationSuppression suppression = dictionary.suppressChangeNotifications(true);
    dictionary.close();
    suppression.close();

    changes.assertNoValues();
    changes.assertComplete();
  }

  /* --------------- DictionaryChange --------------- */

  @Test
  void change_equality() {
    new EqualsTester()
        .addEqualityGroup(DictionaryChange.itemAdded("a", 1), DictionaryChange.itemAdded("a", 1))
        .addEqualityGroup(DictionaryChange.itemAdded("a", 2))
        .addEqualityGroup(DictionaryChange.itemRemoved("a", 1))
        .addEqualityGroup(DictionaryChange.itemReplaced("a", 1, 2))
        .addEqualityGroup(DictionaryChange.reset(), DictionaryChange.reset())
        .testEquals();
  }

  @Test
  void change_accessors() {
    DictionaryChange<String, Integer> change = DictionaryChange.itemReplaced("a", 2, 1);
    assertThat(change.type()).isEqualTo(DictionaryChangeType.ITEM_REPLACED);
    assertThat(change.key()).isEqualTo("a");
    assertThat(change.value()).isEqualTo(2);
    assertThat(change.oldValue()).isEqualTo(1);
    assertThat(change.toString()).contains("ITEM_REPLACED");
  }
}
