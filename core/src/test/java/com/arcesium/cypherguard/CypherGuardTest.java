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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.arcesium.cypherguard.common.DisallowedExtensionException;
import com.arcesium.cypherguard.common.ForbiddenOperationException;
import com.arcesium.cypherguard.common.MalformedVersionException;
import com.arcesium.cypherguard.common.ValidationException;
import com.arcesium.cypherguard.metrics.MetricCollector;
import com.arcesium.cypherguard.metrics.RewriteMetrics;
import com.arcesium.cypherguard.rewrite.CypherRewriter;
import com.arcesium.cypherguard.rewrite.RewriteResult;
import com.arcesium.cypherguard.version.Neo4jVersion;
import com.arcesium.cypherguard.version.VersionSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CypherGuardTest {
  @Mock private VersionSource mockVersionSource;

  @Mock private MetricCollector mockMetricCollector;

  @Captor private ArgumentCaptor<RewriteMetrics> metricsCaptor;

  @ParameterizedTest
  @CsvSource({"5.12.0, V5", "4.4.18, V4", "2025.11.2, V5", "' 5.0 ', V5", "3.5.35, V4"})
  void testResolvesVersionFromSource(String versionString, Neo4jVersion expected) {
    when(mockVersionSource.getVersion()).thenReturn(versionString);

    CypherGuard guard = CypherGuard.builderFor(mockVersionSource).build();

    assertThat(guard.getVersion()).isEqualTo(expected);
  }

  @Test
  void testResolvesVersionOnce() {
    when(mockVersionSource.getVersion()).thenReturn("5.12.0");

    CypherGuard guard = CypherGuard.builderFor(mockVersionSource).build();
    guard.rewrite("MATCH (n) RETURN n");
    guard.rewrite("MATCH (a) RETURN size((a)-->())");

    verify(mockVersionSource, times(1)).getVersion();
  }

  @Test
  void testMalformedVersion() {
    when(mockVersionSource.getVersion()).thenReturn("unknown");

    assertThatThrownBy(() -> CypherGuard.builderFor(mockVersionSource).build())
        .isInstanceOf(MalformedVersionException.class)
        .hasMessage("Unable to determine major version from 'unknown'");
  }

  @Test
  void testMalformedVersionWithFallback() {
    when(mockVersionSource.getVersion()).thenReturn("unknown");

    CypherGuard guard =
        CypherGuard.builderFor(mockVersionSource).fallbackVersion(Neo4jVersion.V4).build();

    assertThat(guard.getVersion()).isEqualTo(Neo4jVersion.V4);
  }

  @Test
  void testBuilderDefaults() {
    CypherGuard guard = CypherGuard.builderFor(Neo4jVersion.V5).build();

    assertThat(guard.getConfiguration().isAllowApoc()).isFalse();
    assertThat(guard.getConfiguration().isStrict()).isTrue();
    assertThat(guard.getConfiguration().getMetricCollector()).isNull();
    assertThat(guard.getRewriter().getVersion()).isEqualTo(Neo4jVersion.V5);
  }

  @Test
  void testBuilderRejectsNulls() {
    assertThatThrownBy(() -> CypherGuard.builderFor((VersionSource) null))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> CypherGuard.builderFor((Neo4jVersion) null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void testAllowApoc() {
    String query = "RETURN apoc.text.join(names, ',')";

    assertThatThrownBy(() -> CypherGuard.builderFor(Neo4jVersion.V5).build().rewrite(query))
        .isInstanceOf(DisallowedExtensionException.class)
        .hasMessageContaining("apoc.text.join");

    RewriteResult result =
        CypherGuard.builderFor(Neo4jVersion.V5).allowApoc(true).strict(false).build().rewrite(query);
    assertThat(result.getQuery()).isEqualTo(query);
    assertThat(result.getChanges()).isEmpty();
  }

  @Test
  void testCollectsMetricsOnSuccess() {
    CypherGuard guard =
        CypherGuard.builderFor(Neo4jVersion.V5).metricCollector(mockMetricCollector).build();

    RewriteResult result = guard.rewrite("MATCH (a) RETURN size((a)-->())");

    assertThat(result.getChanges())
        .containsExactly("Rewrote size((pattern)) → COUNT { }", CypherRewriter.QUERY_REWRITTEN);
    verify(mockMetricCollector).collectMetrics(metricsCaptor.capture());
    RewriteMetrics metrics = metricsCaptor.getValue();
    assertThat(metrics.getVersion()).isEqualTo(Neo4jVersion.V5);
    assertThat(metrics.getChangeCount()).isEqualTo(2);
    assertThat(metrics.isModified()).isTrue();
    assertThat(metrics.isRejected()).isFalse();
    assertThat(metrics.getTotalDuration().isNegative()).isFalse();
  }

  @Test
  void testCollectsMetricsOnRejection() {
    CypherGuard guard =
        CypherGuard.builderFor(Neo4jVersion.V4).metricCollector(mockMetricCollector).build();

    assertThatThrownBy(() -> guard.rewrite("MATCH (n) DETACH DELETE n"))
        .isInstanceOf(ForbiddenOperationException.class);

    verify(mockMetricCollector).collectMetrics(metricsCaptor.capture());
    RewriteMetrics metrics = metricsCaptor.getValue();
    assertThat(metrics.getVersion()).isEqualTo(Neo4jVersion.V4);
    assertThat(metrics.isRejected()).isTrue();
    assertThat(metrics.getRejectedBy()).isEqualTo(ForbiddenOperationException.RULE_NAME);
    assertThat(metrics.getChangeCount()).isZero();
  }
}
