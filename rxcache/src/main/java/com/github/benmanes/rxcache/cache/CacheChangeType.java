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

/**
 * The kind of event described by a {@link CacheChange}.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum CacheChangeType {
  ITEM_ADDED,
  ITEM_VALUE_REPLACED,
  /** The entry's expiry elapsed; followed by the change that the expiration caused, if any. */
  ITEM_EXPIRED,
  ITEM_REMOVED,
  /** The contents changed wholesale and should be read again. */
  RESET
}
