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
 * This package contains a pool of reusable instances whose values are handed out as
 * {@link com.github.benmanes.rxcache.pool.Pooled} tickets.
 * <p>
 * A ticket is returned with {@link com.github.benmanes.rxcache.pool.Pooled#releaseBackToPool()}
 * (or by closing it) or taken permanently with
 * {@link com.github.benmanes.rxcache.pool.Pooled#detachFromPool()}. Each ticket may do one or
 * the other, once.
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.rxcache.pool;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
