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
package com.github.benmanes.rxcache.pool;

/**
 * The behavior of {@link Pool#acquirePooledValueAsync(AcquisitionMode)} when the pool is empty.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum AcquisitionMode {

  /** Completes with {@code null} if no instance is available. */
  AVAILABLE_INSTANCE_OR_NULL,

  /** Waits until another caller releases an instance back into the pool. */
  AVAILABLE_INSTANCE_OR_WAIT,

  /** Builds a new instance, which is then owned by the pool like any other. */
  AVAILABLE_INSTANCE_OR_CREATE
}
