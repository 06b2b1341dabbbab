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
package com.github.benmanes.rxcache;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when an operation is attempted on a component that has been closed, or whose disposal
 * is in progress.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ObjectDisposedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String objectName;

  public ObjectDisposedException(String objectName) {
    super("Cannot access a disposed object: " + objectName);
    this.objectName = requireNonNull(objectName);
  }

  /** Returns the name of the disposed object. */
  public String objectName() {
    return objectName;
  }
}
