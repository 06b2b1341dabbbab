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
 * This package contains a reader/writer lock whose acquisitions are asynchronous.
 * <p>
 * Any number of readers may hold {@link com.github.benmanes.rxcache.lock.AsyncReaderWriterLock}
 * together while a writer holds it alone. Requests are admitted in arrival order, so a queued
 * writer is not starved by a stream of readers.
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.rxcache.lock;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
