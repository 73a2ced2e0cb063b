/*
 * Copyright (c) 2025, Arcesium LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arcesium.cypherguard.version;

/**
 * Supplies the version string of the target database, typically by asking the database itself once
 * per connection.
 */
@FunctionalInterface
public interface VersionSource {

  /**
   * Gets the raw version string of the target database, for example {@code 5.12.0}.
   *
   * @return The version string.
   */
  String getVersion();
}
