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

import com.arcesium.cypherguard.common.MalformedVersionException;
import org.apache.commons.lang3.StringUtils;

/**
 * Capability tiers of the target Neo4j database. The tier decides which rewrite rules a query needs
 * before it can run. Tiers are declared oldest first.
 */
public enum Neo4jVersion {
  V4(4),
  V5(5);

  private final int minimumMajor;

  Neo4jVersion(int minimumMajor) {
    this.minimumMajor = minimumMajor;
  }

  /**
   * Gets the lowest major version number that belongs to this tier.
   *
   * @return The minimum major version.
   */
  public int getMinimumMajor() {
    return minimumMajor;
  }

  /**
   * Checks whether this tier is the same as or newer than the given tier.
   *
   * @param other The tier to compare against.
   * @return true if this tier is at least {@code other}.
   */
  public boolean isAtLeast(Neo4jVersion other) {
    return compareTo(other) >= 0;
  }

  /**
   * Gets the newest known tier.
   *
   * @return The newest tier.
   */
  public static Neo4jVersion newest() {
    Neo4jVersion[] values = values();
    return values[values.length - 1];
  }

  /**
   * Classifies a version string reported by the database.
   *
   * <p>Supports both semantic versioning ({@code 5.12.0}, {@code 4.4.18}) and calendar versioning
   * ({@code 2025.11.2}); calendar years are numerically above every semantic major, so they map to
   * the newest tier.
   *
   * @param versionString The version string reported by the database.
   * @return The matching tier.
   * @throws MalformedVersionException if the leading component is not an integer.
   */
  public static Neo4jVersion classify(String versionString) {
    String major = StringUtils.substringBefore(StringUtils.trimToEmpty(versionString), ".");
    int majorVersion;
    try {
      majorVersion = Integer.parseInt(major);
    } catch (NumberFormatException ex) {
      throw new MalformedVersionException(versionString, ex);
    }

    Neo4jVersion result = V4;
    for (Neo4jVersion version : values()) {
      if (majorVersion >= version.minimumMajor) {
        result = version;
      }
    }
    return result;
  }
}
