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

import com.arcesium.cypherguard.metrics.MetricCollector;
import com.arcesium.cypherguard.version.Neo4jVersion;
import com.arcesium.cypherguard.version.VersionSource;

/**
 * Configuration class for CypherGuard. This class holds the settings used to build a {@link
 * com.arcesium.cypherguard.CypherGuard} instance for one database connection.
 */
public class CypherGuardConfiguration {
  private Neo4jVersion version;
  private VersionSource versionSource;
  private Neo4jVersion fallbackVersion;
  private boolean allowApoc;
  private boolean strict;
  private MetricCollector metricCollector;

  /**
   * Gets the explicitly configured version tier.
   *
   * @return The version tier, or null if it is resolved from a version source.
   */
  public Neo4jVersion getVersion() {
    return version;
  }

  public void setVersion(Neo4jVersion version) {
    this.version = version;
  }

  /**
   * Gets the source that reports the database version string.
   *
   * @return The version source, or null if the tier is configured explicitly.
   */
  public VersionSource getVersionSource() {
    return versionSource;
  }

  public void setVersionSource(VersionSource versionSource) {
    this.versionSource = versionSource;
  }

  /**
   * Gets the tier used when the reported version string cannot be parsed.
   *
   * @return The fallback tier, or null to fail on malformed versions.
   */
  public Neo4jVersion getFallbackVersion() {
    return fallbackVersion;
  }

  public void setFallbackVersion(Neo4jVersion fallbackVersion) {
    this.fallbackVersion = fallbackVersion;
  }

  /**
   * Checks whether APOC calls may pass through unchanged.
   *
   * @return true if APOC is allowed.
   */
  public boolean isAllowApoc() {
    return allowApoc;
  }

  public void setAllowApoc(boolean allowApoc) {
    this.allowApoc = allowApoc;
  }

  /**
   * Gets the reserved strict flag.
   *
   * @return The strict flag.
   */
  public boolean isStrict() {
    return strict;
  }

  public void setStrict(boolean strict) {
    this.strict = strict;
  }

  /**
   * Gets the metric collector.
   *
   * @return The metric collector, or null if metrics are not collected.
   */
  public MetricCollector getMetricCollector() {
    return metricCollector;
  }

  public void setMetricCollector(MetricCollector metricCollector) {
    this.metricCollector = metricCollector;
  }
}
