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
package com.arcesium.cypherguard.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.arcesium.cypherguard.common.ChangeLog;
import com.arcesium.cypherguard.version.Neo4jVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ToStringOnNodeRuleTest {
  private ToStringOnNodeRule rule;
  private RewriteContext context;

  @BeforeEach
  void setUp() {
    rule = new ToStringOnNodeRule();
    context = new RewriteContext(Neo4jVersion.V5, false, true, new ChangeLog());
  }

  @Test
  void testPrefersNameProperty() {
    String query = "MATCH (n:Person) WHERE n.name IS NOT NULL RETURN toString(n)";

    assertThat(rule.apply(query, context))
        .isEqualTo("MATCH (n:Person) WHERE n.name IS NOT NULL RETURN toString(n.name)");
    assertThat(context.getChangeLog().entries())
        .containsExactly("Rewrote toString(n) → toString(n.name)");
  }

  @Test
  void testFallsBackToNodeMap() {
    assertThat(rule.apply("MATCH (n) RETURN toString(n)", context))
        .isEqualTo("MATCH (n) RETURN { labels: labels(n), properties: properties(n) }");
    assertThat(context.getChangeLog().entries())
        .containsExactly("Rewrote toString(n) → node map representation");
  }

  @Test
  void testLogsEveryMatch() {
    String query = "MATCH (a)-->(b) RETURN toString(a), toString(b), b.name";

    assertThat(rule.apply(query, context))
        .isEqualTo(
            "MATCH (a)-->(b) RETURN { labels: labels(a), properties: properties(a) }, "
                + "toString(b.name), b.name");
    assertThat(context.getChangeLog().entries())
        .containsExactly(
            "Rewrote toString(a) → node map representation",
            "Rewrote toString(b) → toString(b.name)");
  }

  @Test
  void testIgnoresPropertyArguments() {
    assertThat(rule.matches("MATCH (n) RETURN toString(n.age)")).isFalse();
    assertThat(rule.matches("RETURN toString(42)")).isFalse();
  }
}
