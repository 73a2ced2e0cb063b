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

import com.arcesium.cypherguard.cypher.CypherLexer;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A {@code WITH} clause located in a query. Offsets refer to the query the clause was located in:
 * the item list spans {@code [itemsStart, itemsEnd)} and the clause, including the non-projection
 * clauses that follow it, ends at {@code end}.
 */
public class ProjectionClause {
  private static final String WITH = "WITH";
  private static final String DISTINCT = "DISTINCT";

  // keywords that end a WITH item list
  private static final List<String> ITEM_LIST_TERMINATORS =
      ImmutableList.of(
          "ORDER", "SKIP", "LIMIT", "WHERE", "MATCH", "OPTIONAL", "UNWIND", "CALL", "WITH",
          "RETURN", "UNION", "CREATE", "MERGE", "DELETE", "DETACH", "SET", "REMOVE", "FOREACH");

  private final int start;
  private final int itemsStart;
  private final int itemsEnd;
  private final int end;
  private final String itemsText;
  private final List<ProjectionItem> items;

  private ProjectionClause(String query, int start, int itemsStart, int itemsEnd, int end) {
    this.start = start;
    this.itemsStart = itemsStart;
    this.itemsEnd = itemsEnd;
    this.end = end;
    this.itemsText = query.substring(itemsStart, itemsEnd);
    List<ProjectionItem> parsed = new ArrayList<>();
    for (String rawItem : CypherLexer.splitTopLevel(itemsText, ',')) {
      if (!rawItem.isBlank()) {
        parsed.add(ProjectionItem.parse(rawItem));
      }
    }
    this.items = ImmutableList.copyOf(parsed);
  }

  /**
   * Locates every top-level {@code WITH} clause of a query, in order. {@code WITH} inside string
   * literals, nested subqueries and the {@code STARTS WITH} / {@code ENDS WITH} operators is
   * ignored.
   *
   * @param query The query text.
   * @return The clauses in order of appearance.
   */
  public static List<ProjectionClause> locateAll(String query) {
    String masked = CypherLexer.maskLiterals(query);
    List<Integer> starts = new ArrayList<>();
    for (int offset : CypherLexer.indexesOfTopLevelKeyword(masked, WITH)) {
      if (!isStringOperator(masked, offset)) {
        starts.add(offset);
      }
    }

    List<ProjectionClause> clauses = new ArrayList<>();
    for (int i = 0; i < starts.size(); i++) {
      int start = starts.get(i);
      int itemsStart = start + WITH.length();
      int afterModifier = skipWhitespace(masked, itemsStart);
      if (CypherLexer.isKeywordAt(masked, afterModifier, DISTINCT)) {
        itemsStart = afterModifier + DISTINCT.length();
      }
      int end = (i + 1 < starts.size()) ? starts.get(i + 1) : query.length();
      int itemsEnd = findItemsEnd(masked, itemsStart, end);
      clauses.add(new ProjectionClause(query, start, itemsStart, itemsEnd, end));
    }
    return clauses;
  }

  private static int findItemsEnd(String masked, int from, int limit) {
    int offset = from;
    while (true) {
      int found = CypherLexer.indexOfTopLevelKeyword(masked, offset, ITEM_LIST_TERMINATORS);
      if (found < 0 || found >= limit) {
        return limit;
      }
      if (CypherLexer.isKeywordAt(masked, found, WITH) && isStringOperator(masked, found)) {
        offset = found + WITH.length();
        continue;
      }
      return found;
    }
  }

  private static boolean isStringOperator(String masked, int withOffset) {
    String previous = previousWord(masked, withOffset).toUpperCase(Locale.ROOT);
    return previous.equals("STARTS") || previous.equals("ENDS");
  }

  private static String previousWord(String text, int offset) {
    int i = offset - 1;
    while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
      i--;
    }
    int wordEnd = i + 1;
    while (i >= 0 && CypherLexer.isIdentifierPart(text.charAt(i))) {
      i--;
    }
    return text.substring(i + 1, wordEnd);
  }

  private static int skipWhitespace(String text, int offset) {
    int i = offset;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  public int getStart() {
    return start;
  }

  public int getItemsStart() {
    return itemsStart;
  }

  public int getItemsEnd() {
    return itemsEnd;
  }

  public int getEnd() {
    return end;
  }

  /**
   * Gets the raw item list text, including surrounding whitespace.
   *
   * @return The item list text.
   */
  public String getItemsText() {
    return itemsText;
  }

  public List<ProjectionItem> getItems() {
    return items;
  }

  /**
   * Checks whether the clause projects everything in scope with {@code *}.
   *
   * @return true if any item is the wildcard.
   */
  public boolean isWildcard() {
    return items.stream().anyMatch(ProjectionItem::isWildcard);
  }

  @Override
  public String toString() {
    return "ProjectionClause{" + "start=" + start + ", items=" + items + '}';
  }
}
