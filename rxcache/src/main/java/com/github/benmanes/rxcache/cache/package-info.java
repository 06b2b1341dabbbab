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
/**
 * This package contains an observable in-memory cache whose entries expire after a duration.
 * <p>
 * {@link com.github.benmanes.rxcache.cache.ObservableCache} exposes every operation as a cold
 * RxJava source that runs when subscribed to, holding the cache's
 * {@link com.github.benmanes.rxcache.lock.AsyncReaderWriterLock} as a reader for queries and as a
 * writer for mutations. Each mutation publishes a
 * {@link com.github.benmanes.rxcache.cache.CacheChange} before the operation completes.
 * <p>
 * When an entry's expiry elapses, the cache acts according to the entry's
 * {@link com.github.benmanes.rxcache.cache.ExpirationType}: it leaves the entry in place, removes
 * it, or replaces its value using the configured
 * {@link com.github.benmanes.rxcache.cache.CacheUpdater}. Instances are configured and created
 * with {@link com.github.benmanes.rxcache.cache.ObservableCacheBuilder}.
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.rxcache.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
