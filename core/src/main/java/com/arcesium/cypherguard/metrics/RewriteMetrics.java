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
package com.arcesium.cypherguard.metrics;

import com.arcesium.cypherguard.version.Neo4jVersion;
import java.time.Duration;

/** Represents metrics collected for one rewrite call. Implements the Metrics interface. */
public class RewriteMetrics implements Metrics {
  private final Neo4jVersion version;
  private final Duration totalDuration;
  private final int changeCount;
  private final boolean modified;
  private final String rejectedBy;

  /**
   * Constructs a new RewriteMetrics object.
   *
   * @param version The version tier the query was rewritten for.
   * @param totalDuration The duration of the rewrite call.
   * @param changeCount The number of change-log entries produced.
   * @param modified Whether the returned query differs from the input.
   * @param rejectedBy The rule that rejected the query, or null if it was accepted.
   */
  public RewriteMetrics(
      Neo4jVersion version,
      Duration totalDuration,
      int changeCount,
      boolean modified,
      String rejectedBy) {
    this.version = version;
    this.totalDuration = totalDuration;
    this.changeCount = changeCount;
    this.modified = modified;
    this.rejectedBy = rejectedBy;
  }

  /**
   * Gets the version tier the query was rewritten for.
   *
   * @return The version tier.
   */
  public Neo4jVersion getVersion() {
    return version;
  }

  /**
   * Gets the duration of the rewrite call.
   *
   * @return The total duration.
   */
  public Duration getTotalDuration() {
    return totalDuration;
  }

  /**
   * Gets the number of change-log entries produced.
   *
   * @return The change count, zero for rejected queries.
   */
  public int getChangeCount() {
    return changeCount;
  }

  /**
   * Checks whether the returned query differs from the input.
   *
   * @return true if the query was modified.
   */
  public boolean isModified() {
    return modified;
  }

  /**
   * Gets the name of the rule that rejected the query.
   *
   * @return The rule name, or null if the query was accepted.
   */
  public String getRejectedBy() {
    return rejectedBy;
  }

  /**
   * Checks whether the query was rejected.
   *
   * @return true if a rule rejected the query.
   */
  public boolean isRejected() {
    return rejectedBy != null;
  }

  @Override
  public String toString() {
    return "RewriteMetrics{"
        + "version="
        + version
        + ", totalDuration="
        + totalDuration
        + ", changeCount="
        + changeCount
        + ", modified="
        + modified
        + ", rejectedBy='"
        + rejectedBy
        + '\''
        + '}';
  }
}
