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
 * This package contains the lifecycle and error types shared by the observable cache, the object
 * pool and the asynchronous reader/writer lock.
 * <ul>
 *   <li>{@link com.github.benmanes.rxcache.cache} - an observable in-memory cache with expiration
 *   <li>{@link com.github.benmanes.rxcache.collections} - a dictionary that publishes its changes
 *   <li>{@link com.github.benmanes.rxcache.lock} - a reader/writer lock acquired asynchronously
 *   <li>{@link com.github.benmanes.rxcache.pool} - a pool of reusable instances
 * </ul>
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.rxcache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
