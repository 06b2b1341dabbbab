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

/**
 * A scope during which an {@link ObservableDictionary} does not publish its changes. Scopes nest;
 * publishing resumes when the last open scope is closed.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public interface NotificationSuppression extends AutoCloseable {

  /** Ends the scope. Closing it again has no effect. */
  @Override
  void close();
}
