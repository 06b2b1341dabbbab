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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A mutation of an {@link ObservableDictionary}. A {@link DictionaryChangeType#RESET} carries no
 * key or value, and only a {@link DictionaryChangeType#ITEM_REPLACED} carries the old value.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class DictionaryChange<K, V> {
  private final DictionaryChangeType type;
  private final @Nullable V oldValue;
  private final @Nullable V value;
  private final @Nullable K key;

  private DictionaryChange(DictionaryChangeType type,
      @Nullable K key, @Nullable V value, @Nullable V oldValue) {
    this.type = requireNonNull(type);
    this.oldValue = oldValue;
    this.value = value;
    this.key = key;
  }

  public static <K, V> DictionaryChange<K, V> itemAdded(K key, V value) {
    return new DictionaryChange<>(DictionaryChangeType.ITEM_ADDED,
        requireNonNull(key), requireNonNull(value), null);
  }

  public static <K, V> DictionaryChange<K, V> itemReplaced(K key, V value, V oldValue) {
    return new DictionaryChange<>(DictionaryChangeType.ITEM_REPLACED,
        requireNonNull(key), requireNonNull(value), requireNonNull(oldValue));
  }

  public static <K, V> DictionaryChange<K, V> itemRemoved(K key, V value) {
    return new DictionaryChange<>(DictionaryChangeType.ITEM_REMOVED,
        requireNonNull(key), requireNonNull(value), null);
  }

  public static <K, V> DictionaryChange<K, V> reset() {
    return new DictionaryChange<>(DictionaryChangeType.RESET, null, null, null);
  }

  public DictionaryChangeType type() {
    return type;
  }

  public @Nullable K key() {
    return key;
  }

  /** Returns the added, new or removed value. */
  public @Nullable V value() {
    return value;
  }

  /** Returns the value that was replaced. */
  public @Nullable V oldValue() {
    return oldValue;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof DictionaryChange)) {
      return false;
    }
    var change = (DictionaryChange<?, ?>) o;
    return (type == change.type)
        && Objects.equals(key, change.key)
        && Objects.equals(value, change.value)
        && Objects.equals(oldValue, change.oldValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, key, value, oldValue);
  }

  @Override
  public String toString() {
    return (type == DictionaryChangeType.RESET)
        ? type.toString()
        : type + "{key=" + key + ", value=" + value
            + ((oldValue == null) ? "" : ", oldValue=" + oldValue) + "}";
  }
}
