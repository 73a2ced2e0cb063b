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
package com.arcesium.cypherguard;

import com.arcesium.cypherguard.common.CypherGuardConfiguration;
import com.arcesium.cypherguard.common.MalformedVersionException;
import com.arcesium.cypherguard.common.QueryRejectedException;
import com.arcesium.cypherguard.common.ValidationException;
import com.arcesium.cypherguard.metrics.MetricCollector;
import com.arcesium.cypherguard.metrics.RewriteMetrics;
import com.arcesium.cypherguard.rewrite.CypherRewriter;
import com.arcesium.cypherguard.rewrite.RewriteResult;
import com.arcesium.cypherguard.version.Neo4jVersion;
import com.arcesium.cypherguard.version.VersionSource;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for preparing LLM-generated Cypher for execution. One instance is built per database
 * connection: the version tier is resolved once at build time and every query is then rewritten
 * for that tier and checked for destructive operations.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class CypherGuard {
  private static final Logger LOGGER = LoggerFactory.getLogger(CypherGuard.class);

  private final CypherGuardConfiguration configuration;
  private final CypherRewriter rewriter;

  private CypherGuard(CypherGuardConfiguration configuration, Neo4jVersion version) {
    this.configuration = configuration;
    this.rewriter =
        new CypherRewriter(version, configuration.isAllowApoc(), configuration.isStrict());
  }

  /**
   * Rewrites a query for the configured version tier and validates it.
   *
   * @param query The query text.
   * @return The approved query and its change log.
   * @throws QueryRejectedException if the query is rejected; its text must not be executed.
   */
  public RewriteResult rewrite(String query) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    RewriteResult result;
    try {
      result = rewriter.rewrite(query);
    } catch (QueryRejectedException ex) {
      LOGGER.warn("Query rejected by {}: {}", ex.getRuleName(), ex.getMessage());
      collectMetrics(
          new RewriteMetrics(getVersion(), stopwatch.elapsed(), 0, false, ex.getRuleName()));
      throw ex;
    }

    for (String change : result.getChanges()) {
      LOGGER.debug("Cypher rewrite: {}", change);
    }
    collectMetrics(
        new RewriteMetrics(
            getVersion(),
            stopwatch.elapsed(),
            result.getChanges().size(),
            result.isModified(),
            null));
    return result;
  }

  private void collectMetrics(RewriteMetrics metrics) {
    MetricCollector metricCollector = configuration.getMetricCollector();
    if (metricCollector != null) {
      metricCollector.collectMetrics(metrics);
    }
  }

  public Neo4jVersion getVersion() {
    return rewriter.getVersion();
  }

  public CypherRewriter getRewriter() {
    return rewriter;
  }

  public CypherGuardConfiguration getConfiguration() {
    return configuration;
  }

  /**
   * Creates a new Builder that resolves the version tier from a version source.
   *
   * @param versionSource The source of the database version string.
   * @return A new Builder instance.
   */
  public static Builder builderFor(VersionSource versionSource) {
    ValidationException.checkNotNull(versionSource, "Version source cannot be null");
    Builder builder = new Builder();
    builder.configuration.setVersionSource(versionSource);
    return builder;
  }

  /**
   * Creates a new Builder for a known version tier.
   *
   * @param version The version tier.
   * @return A new Builder instance.
   */
  public static Builder builderFor(Neo4jVersion version) {
    ValidationException.checkNotNull(version, "Version cannot be null");
    Builder builder = new Builder();
    builder.configuration.setVersion(version);
    return builder;
  }

  /** Builder class for constructing CypherGuard instances. */
  public static class Builder {
    private final CypherGuardConfiguration configuration;

    private Builder() {
      configuration = new CypherGuardConfiguration();
      configuration.setAllowApoc(false);
      configuration.setStrict(true);
    }

    /**
     * Sets whether APOC calls may pass through unchanged.
     *
     * @param allowApoc true to allow APOC calls.
     * @return This Builder instance.
     */
    public Builder allowApoc(boolean allowApoc) {
      this.configuration.setAllowApoc(allowApoc);
      return this;
    }

    /**
     * Sets the reserved strict flag.
     *
     * @param strict The strict flag.
     * @return This Builder instance.
     */
    public Builder strict(boolean strict) {
      this.configuration.setStrict(strict);
      return this;
    }

    /**
     * Sets the tier to use when the reported version string is malformed. Without a fallback, a
     * malformed version fails {@link #build()}.
     *
     * @param fallbackVersion The fallback tier.
     * @return This Builder instance.
     */
    public Builder fallbackVersion(Neo4jVersion fallbackVersion) {
      this.configuration.setFallbackVersion(fallbackVersion);
      return this;
    }

    /**
     * Sets the collector that receives {@link RewriteMetrics} for every call.
     *
     * @param metricCollector The metric collector.
     * @return This Builder instance.
     */
    public Builder metricCollector(MetricCollector metricCollector) {
      this.configuration.setMetricCollector(metricCollector);
      return this;
    }

    /**
     * Builds the CypherGuard, resolving the version tier if a version source was given.
     *
     * @return A new CypherGuard instance.
     * @throws MalformedVersionException if the version string is malformed and no fallback is set.
     */
    public CypherGuard build() {
      return new CypherGuard(configuration, resolveVersion());
    }

    private Neo4jVersion resolveVersion() {
      if (configuration.getVersion() != null) {
        return configuration.getVersion();
      }
      String versionString = configuration.getVersionSource().getVersion();
      try {
        Neo4jVersion version = Neo4jVersion.classify(versionString);
        LOGGER.info("Detected Neo4j version {} as tier {}", versionString, version);
        return version;
      } catch (MalformedVersionException ex) {
        if (configuration.getFallbackVersion() == null) {
          throw ex;
        }
        LOGGER.warn(
            "Unable to classify Neo4j version '{}', using {}",
            versionString,
            configuration.getFallbackVersion());
        return configuration.getFallbackVersion();
      }
    }
  }
}
