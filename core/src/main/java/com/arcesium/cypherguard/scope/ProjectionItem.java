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
import com.arcesium.cypherguard.cypher.CypherVariables;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** One comma-separated item of a projection clause, for example {@code count(m) AS total}. */
public class ProjectionItem {
  private static final Pattern BARE_REFERENCE =
      Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)(?:\\s*\\.\\s*[A-Za-z_][A-Za-z0-9_]*)*");

  private final String text;
  private final String expression;
  private final String alias;

  private ProjectionItem(String text, String expression, String alias) {
    this.text = text;
    this.expression = expression;
    this.alias = alias;
  }

  /**
   * Parses an item, splitting off a trailing top-level {@code AS alias}.
   *
   * @param rawItem The item text.
   * @return The parsed item.
   */
  public static ProjectionItem parse(String rawItem) {
    String text = rawItem.trim();
    List<Integer> asOffsets =
        CypherLexer.indexesOfTopLevelKeyword(CypherLexer.maskLiterals(text), "AS");
    if (asOffsets.isEmpty()) {
      return new ProjectionItem(text, text, null);
    }
    int asOffset = asOffsets.get(asOffsets.size() - 1);
    String alias = text.substring(asOffset + 2).trim();
    return new ProjectionItem(
        text, text.substring(0, asOffset).trim(), alias.isEmpty() ? null : alias);
  }

  public String getText() {
    return text;
  }

  public String getExpression() {
    return expression;
  }

  /**
   * Gets the alias bound with {@code AS}.
   *
   * @return The alias, or null if the item has none.
   */
  public String getAlias() {
    return alias;
  }

  public boolean isWildcard() {
    return "*".equals(expression);
  }

  /**
   * Checks whether the item is a plain variable reference, optionally with property access, as
   * opposed to an expression such as a function call, literal or assignment.
   *
   * @return true for bare references.
   */
  public boolean isBareReference() {
    Matcher matcher = BARE_REFERENCE.matcher(expression);
    return matcher.matches() && !CypherVariables.isKeyword(matcher.group(1));
  }

  /**
   * Gets the variable a bare reference points to, for example {@code n} for {@code n.name}.
   *
   * @return The referenced variable, or null if the item is not a bare reference.
   */
  public String getReferencedVariable() {
    Matcher matcher = BARE_REFERENCE.matcher(expression);
    if (!matcher.matches() || CypherVariables.isKeyword(matcher.group(1))) {
      return null;
    }
    return matcher.group(1);
  }

  @Override
  public String toString() {
    return text;
  }
}
