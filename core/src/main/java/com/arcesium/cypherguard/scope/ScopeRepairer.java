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

import com.arcesium.cypherguard.common.ChangeLog;
import com.arcesium.cypherguard.cypher.CypherLexer;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps {@code WITH} projections consistent with the variables actually in scope. {@link
 * #sanitize(String, ChangeLog)} drops references to variables that were never defined, and {@link
 * #repair(String, ChangeLog)} re-adds variables that the final {@code RETURN} needs but the last
 * projection dropped.
 *
 * <p>Instances are stateless; scope is tracked in a fresh {@link ScopeState} per call.
 */
public class ScopeRepairer {
  private static final List<String> INTRODUCING_CLAUSES =
      ImmutableList.of("MATCH", "OPTIONAL", "UNWIND", "CALL");
  private static final List<String> RETURN_TAIL = ImmutableList.of("ORDER", "SKIP", "LIMIT");

  private final ScopeAnalyzer analyzer;

  public ScopeRepairer() {
    this(new LexicalScopeAnalyzer());
  }

  public ScopeRepairer(ScopeAnalyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Checks whether the query has any projection clause to work on.
   *
   * @param query The query text.
   * @return true if the query contains a top-level {@code WITH} clause.
   */
  public boolean hasProjection(String query) {
    return !ProjectionClause.locateAll(query).isEmpty();
  }

  /**
   * Removes bare references to undefined variables from every {@code WITH} clause. Expressions are
   * always kept. A clause is left untouched if every item would be removed.
   *
   * @param query The query text.
   * @param changeLog Receives one entry per removed item.
   * @return The sanitized query.
   */
  public String sanitize(String query, ChangeLog changeLog) {
    List<ProjectionClause> clauses = ProjectionClause.locateAll(query);
    if (clauses.isEmpty()) {
      return query;
    }

    ScopeState state = new ScopeState();
    state.defineAll(analyzer.definedNames(query.substring(0, clauses.get(0).getStart())));

    StringBuilder result = new StringBuilder();
    int copied = 0;
    for (ProjectionClause clause : clauses) {
      List<ProjectionItem> kept = new ArrayList<>();
      List<ProjectionItem> phantoms = new ArrayList<>();
      for (ProjectionItem item : clause.getItems()) {
        if (item.isWildcard() || !item.isBareReference()) {
          kept.add(item);
        } else if (state.isDefined(item.getReferencedVariable())) {
          kept.add(item);
        } else {
          phantoms.add(item);
        }
      }

      if (!phantoms.isEmpty() && !kept.isEmpty()) {
        result.append(query, copied, clause.getItemsStart());
        result.append(replaceItems(clause.getItemsText(), kept));
        copied = clause.getItemsEnd();
        for (ProjectionItem phantom : phantoms) {
          changeLog.record("Removed phantom variable '%s' from WITH clause", phantom.getText());
        }
      }

      for (ProjectionItem item : kept) {
        state.defineAll(analyzer.definedNames(item.getText()));
      }
      state.defineAll(
          analyzer.definedNames(query.substring(clause.getItemsEnd(), clause.getEnd())));
    }
    result.append(query.substring(copied));
    return result.toString();
  }

  /**
   * Appends to the last {@code WITH} clause the variables the final {@code RETURN} reads but the
   * clause does not project. Only variables defined before that clause are restored.
   *
   * @param query The query text.
   * @param changeLog Receives one entry per restored variable.
   * @return The repaired query.
   */
  public String repair(String query, ChangeLog changeLog) {
    List<ProjectionClause> clauses = ProjectionClause.locateAll(query);
    if (clauses.isEmpty()) {
      return query;
    }
    ProjectionClause last = clauses.get(clauses.size() - 1);
    if (last.isWildcard() || last.getItems().isEmpty()) {
      return query;
    }

    String masked = CypherLexer.maskLiterals(query);
    List<Integer> returns =
        CypherLexer.indexesOfTopLevelKeyword(masked, "RETURN").stream()
            .filter(offset -> offset >= last.getItemsEnd())
            .collect(Collectors.toList());
    if (returns.isEmpty()) {
      return query;
    }
    int returnOffset = returns.get(returns.size() - 1);

    ScopeState available = new ScopeState();
    available.defineAll(analyzer.definedNames(query.substring(0, clauses.get(0).getStart())));
    for (ProjectionClause clause : clauses.subList(0, clauses.size() - 1)) {
      available.defineAll(analyzer.definedNames(clause.getItemsText()));
      available.defineAll(
          analyzer.definedNames(query.substring(clause.getItemsEnd(), clause.getEnd())));
    }

    Set<String> projected = new LinkedHashSet<>();
    for (ProjectionItem item : last.getItems()) {
      projected.addAll(analyzer.definedNames(item.getText()));
    }
    Set<String> introduced =
        introducedNames(query.substring(last.getItemsEnd(), returnOffset));

    List<String> missing = new ArrayList<>();
    for (String name : consumedByReturn(query.substring(returnOffset + "RETURN".length()))) {
      if (!projected.contains(name) && !introduced.contains(name) && available.isDefined(name)) {
        missing.add(name);
      }
    }
    if (missing.isEmpty()) {
      return query;
    }

    String items = last.getItemsText();
    String trailing = items.substring(items.stripTrailing().length());
    String repairedItems = items.stripTrailing() + ", " + String.join(", ", missing) + trailing;
    for (String name : missing) {
      changeLog.record("Restored variable '%s' to WITH clause", name);
    }
    return query.substring(0, last.getItemsStart())
        + repairedItems
        + query.substring(last.getItemsEnd());
  }

  private Set<String> introducedNames(String between) {
    int offset =
        CypherLexer.indexOfTopLevelKeyword(
            CypherLexer.maskLiterals(between), 0, INTRODUCING_CLAUSES);
    if (offset < 0) {
      return new LinkedHashSet<>();
    }
    return analyzer.definedNames(between.substring(offset));
  }

  private Set<String> consumedByReturn(String returnBody) {
    String masked = CypherLexer.maskLiterals(returnBody);
    int tailOffset = CypherLexer.indexOfTopLevelKeyword(masked, 0, RETURN_TAIL);
    String itemsText = tailOffset < 0 ? returnBody : returnBody.substring(0, tailOffset);

    Set<String> consumed = new LinkedHashSet<>();
    Set<String> aliases = new LinkedHashSet<>();
    for (String rawItem : CypherLexer.splitTopLevel(itemsText, ',')) {
      if (rawItem.isBlank()) {
        continue;
      }
      ProjectionItem item = ProjectionItem.parse(rawItem);
      consumed.addAll(analyzer.consumedNames(item.getExpression()));
      if (item.getAlias() != null) {
        aliases.add(item.getAlias());
      }
    }
    if (tailOffset >= 0) {
      for (String name : analyzer.consumedNames(returnBody.substring(tailOffset))) {
        if (!aliases.contains(name)) {
          consumed.add(name);
        }
      }
    }
    return consumed;
  }

  private static String replaceItems(String itemsText, List<ProjectionItem> kept) {
    String leading = itemsText.substring(0, itemsText.length() - itemsText.stripLeading().length());
    String trailing = itemsText.substring(itemsText.stripTrailing().length());
    return leading
        + kept.stream().map(ProjectionItem::getText).collect(Collectors.joining(", "))
        + trailing;
  }
}
