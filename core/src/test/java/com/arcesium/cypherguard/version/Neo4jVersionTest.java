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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arcesium.cypherguard.common.MalformedVersionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class Neo4jVersionTest {

  @ParameterizedTest
  @CsvSource({
    "5.12.0, V5",
    "5, V5",
    "4.4.18, V4",
    "3.5.35, V4",
    "2025.11.2, V5",
    "' 5.26.1 ', V5"
  })
  void testClassify(String versionString, Neo4jVersion expected) {
    assertThat(Neo4jVersion.classify(versionString)).isEqualTo(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"abc", "v5.1.0", ".5", "five.0"})
  void testClassifyMalformed(String versionString) {
    assertThatThrownBy(() -> Neo4jVersion.classify(versionString))
        .isInstanceOf(MalformedVersionException.class)
        .hasCauseInstanceOf(NumberFormatException.class)
        .satisfies(
            ex ->
                assertThat(((MalformedVersionException) ex).getVersionString())
                    .isEqualTo(versionString));
  }

  @Test
  void testOrdering() {
    assertThat(Neo4jVersion.newest()).isEqualTo(Neo4jVersion.V5);
    assertThat(Neo4jVersion.V5.isAtLeast(Neo4jVersion.V4)).isTrue();
    assertThat(Neo4jVersion.V5.isAtLeast(Neo4jVersion.V5)).isTrue();
    assertThat(Neo4jVersion.V4.isAtLeast(Neo4jVersion.V5)).isFalse();
    assertThat(Neo4jVersion.V5.getMinimumMajor()).isEqualTo(5);
  }
}
