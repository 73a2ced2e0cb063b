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
package com.arcesium.cypherguard.common;

/**
 * Thrown when a database version string cannot be classified because its leading component is not
 * an integer.
 */
public class MalformedVersionException extends CypherGuardException {
  private final String versionString;

  /**
   * Constructs a MalformedVersionException for the given version string.
   *
   * @param versionString The version string that could not be parsed (can be null).
   * @param cause The parse failure, if any.
   */
  public MalformedVersionException(String versionString, Throwable cause) {
    super(cause, "Unable to determine major version from '%s'", versionString);
    this.versionString = versionString;
  }

  /**
   * Gets the version string that could not be parsed.
   *
   * @return The raw version string.
   */
  public String getVersionString() {
    return versionString;
  }
}
