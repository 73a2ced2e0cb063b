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
package com.arcesium.cypherguard.scope;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProjectionClauseTest {

  @Test
  void testLocatesItemLists() {
    String query = "MATCH (n)-->(m) WITH n, count(m) AS c ORDER BY c DESC WITH DISTINCT n RETURN n";

    List<ProjectionClause> clauses = ProjectionClause.locateAll(query);

    assertThat(clauses).hasSize(2);
    assertThat(clauses.get(0).getItemsText()).isEqualTo(" n, count(m) AS c ");
    assertThat(clauses.get(0).getItems())
        .extracting(ProjectionItem::getText)
        .containsExactly("n", "count(m) AS c");
    assertThat(clauses.get(0).getEnd()).isEqualTo(clauses.get(1).getStart());
    assertThat(clauses.get(1).getItemsText()).isEqualTo(" n ");
    assertThat(clauses.get(1).getEnd()).isEqualTo(query.length());
  }

  @Test
  void testIgnoresStringOperatorsAndLiterals() {
    assertThat(
            ProjectionClause.locateAll(
                "MATCH (n) WHERE n.name STARTS WITH 'A' OR n.name ENDS WITH 'with' RETURN n"))
        .isEmpty();

    List<ProjectionClause> clauses =
        ProjectionClause.locateAll("MATCH (n) WITH n.name STARTS WITH 'A' AS flag RETURN flag");
    assertThat(clauses).hasSize(1);
    assertThat(clauses.get(0).getItems())
        .extracting(ProjectionItem::getAlias)
        .containsExactly("flag");
  }

  @Test
  void testWildcard() {
    assertThat(ProjectionClause.locateAll("MATCH (n) WITH *, 1 AS one RETURN n").get(0).isWildcard())
        .isTrue();
  }

  @Test
  void testProjectionItem() {
    ProjectionItem bare = ProjectionItem.parse(" n.name AS name ");
    assertThat(bare.getExpression()).isEqualTo("n.name");
    assertThat(bare.getAlias()).isEqualTo("name");
    assertThat(bare.isBareReference()).isTrue();
    assertThat(bare.getReferencedVariable()).isEqualTo("n");

    ProjectionItem expression = ProjectionItem.parse("CASE WHEN n.age > 18 THEN 'a' END AS kind");
    assertThat(expression.getAlias()).isEqualTo("kind");
    assertThat(expression.isBareReference()).isFalse();
    assertThat(expression.getReferencedVariable()).isNull();

    assertThat(ProjectionItem.parse("1 AS one").isBareReference()).isFalse();
    assertThat(ProjectionItem.parse("null").isBareReference()).isFalse();
    assertThat(ProjectionItem.parse("ghost").getAlias()).isNull();
  }
}
