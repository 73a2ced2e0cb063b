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
package com.arcesium.cypherguard.cypher;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Discovers variable names in fragments of Cypher text. */
public final class CypherVariables {
  private static final Pattern VAR_PATTERN = Pattern.compile("\\b([a-zA-Z_][a-zA-Z0-9_]*)\\b");

  // identifier chain such as n, n.name or apoc.coll.toSet, optionally followed by a call
  private static final Pattern CHAIN_PATTERN =
      Pattern.compile(
          "(?<![A-Za-z0-9_$.`])([A-Za-z_][A-Za-z0-9_]*)((?:\\s*\\.\\s*[A-Za-z_][A-Za-z0-9_]*)*)(\\s*\\()?");

  /** Reserved words that are never variables. Compared case-insensitively. */
  public static final Set<String> KEYWORDS =
      ImmutableSet.of(
          "MATCH", "OPTIONAL", "WITH", "RETURN", "WHERE", "ORDER", "BY", "SKIP", "LIMIT", "UNWIND",
          "COUNT", "DISTINCT", "AS", "AND", "OR", "XOR", "NOT", "IN", "IS", "CASE", "WHEN", "THEN",
          "ELSE", "END", "ASC", "DESC", "ASCENDING", "DESCENDING", "NULL", "TRUE", "FALSE",
          "STARTS", "ENDS", "CONTAINS", "CALL", "YIELD", "UNION", "ALL", "EXISTS", "TOFLOAT",
          "TOINTEGER", "TOLONG", "TOSTRING", "TOBOOLEAN");

  private CypherVariables() {}

  /**
   * Tokenizes a fragment into identifier names, dropping reserved keywords. Every identifier-shaped
   * token is returned, including property keys and function names. Scope analysis uses the
   * narrower {@link #referencedVariables(String)}, which applies the same keyword filter to
   * identifier chains.
   *
   * @param fragment The Cypher fragment.
   * @return Identifiers in order of first appearance, with their original case.
   */
  public static Set<String> extractVariables(String fragment) {
    Set<String> variables = new LinkedHashSet<>();
    Matcher matcher = VAR_PATTERN.matcher(fragment);
    while (matcher.find()) {
      String token = matcher.group(1);
      if (!isKeyword(token)) {
        variables.add(token);
      }
    }
    return variables;
  }

  /**
   * Finds the variables a fragment actually refers to. Unlike {@link #extractVariables(String)},
   * this skips property keys, function and procedure names, labels and relationship types, map
   * keys, parameters and anything inside string literals.
   *
   * @param fragment The Cypher fragment.
   * @return Referenced variables in order of first appearance.
   */
  public static Set<String> referencedVariables(String fragment) {
    String masked = CypherLexer.maskLiterals(fragment);
    Set<String> variables = new LinkedHashSet<>();
    Matcher matcher = CHAIN_PATTERN.matcher(masked);
    while (matcher.find()) {
      if (matcher.group(3) != null) {
        continue;
      }
      String name = matcher.group(1);
      if (isKeyword(name)) {
        continue;
      }
      char before = previousNonSpace(masked, matcher.start());
      if (before == ':') {
        continue;
      }
      char after = nextNonSpace(masked, matcher.end());
      if (after == ':' && (before == '{' || before == ',') && braceDepth(masked, matcher.start()) > 0) {
        continue;
      }
      variables.add(name);
    }
    return variables;
  }

  /**
   * Checks whether a token is a reserved keyword.
   *
   * @param token The token.
   * @return true if the token is reserved.
   */
  public static boolean isKeyword(String token) {
    return KEYWORDS.contains(token.toUpperCase(Locale.ROOT));
  }

  private static char previousNonSpace(String text, int offset) {
    for (int i = offset - 1; i >= 0; i--) {
      char c = text.charAt(i);
      if (!Character.isWhitespace(c)) {
        return c;
      }
    }
    return 0;
  }

  private static char nextNonSpace(String text, int offset) {
    for (int i = offset; i < text.length(); i++) {
      char c = text.charAt(i);
      if (!Character.isWhitespace(c)) {
        return c;
      }
    }
    return 0;
  }

  private static int braceDepth(String text, int offset) {
    int depth = 0;
    for (int i = 0; i < offset; i++) {
      char c = text.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}' && depth > 0) {
        depth--;
      }
    }
    return depth;
  }
}
