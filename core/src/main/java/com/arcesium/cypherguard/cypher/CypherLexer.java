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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Lexical helpers for scanning Cypher text without parsing it. All scanning methods work on text
 * whose string literals have been blanked by {@link #maskLiterals(String)}, so offsets found in the
 * masked text are valid offsets into the original text.
 */
public final class CypherLexer {
  private CypherLexer() {}

  /**
   * Replaces the contents of single- and double-quoted string literals with spaces. Quote characters
   * are kept so the result has the same length as the input.
   *
   * @param text The text to mask.
   * @return The masked text.
   */
  public static String maskLiterals(String text) {
    StringBuilder masked = new StringBuilder(text.length());
    char quote = 0;
    boolean escaped = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote == 0) {
        if (c == '\'' || c == '"') {
          quote = c;
        }
        masked.append(c);
      } else if (escaped) {
        escaped = false;
        masked.append(' ');
      } else if (c == '\\') {
        escaped = true;
        masked.append(' ');
      } else if (c == quote) {
        quote = 0;
        masked.append(c);
      } else {
        masked.append(' ');
      }
    }
    return masked.toString();
  }

  /**
   * Splits text on a delimiter that appears outside of brackets and string literals.
   *
   * @param text The text to split.
   * @param delimiter The delimiter character.
   * @return The parts, untrimmed, in order.
   */
  public static List<String> splitTopLevel(String text, char delimiter) {
    String masked = maskLiterals(text);
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (isOpening(c)) {
        depth++;
      } else if (isClosing(c)) {
        depth = Math.max(0, depth - 1);
      } else if (c == delimiter && depth == 0) {
        parts.add(text.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(text.substring(start));
    return parts;
  }

  /**
   * Finds the first occurrence of any of the given keywords at bracket depth zero, starting at
   * {@code from}. Bracket depth is counted relative to {@code from}.
   *
   * @param masked Text masked by {@link #maskLiterals(String)}.
   * @param from The offset to start scanning from.
   * @param keywords Upper-case keywords to look for.
   * @return The offset of the first keyword, or -1 if none is found.
   */
  public static int indexOfTopLevelKeyword(String masked, int from, Collection<String> keywords) {
    int depth = 0;
    for (int i = from; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (isOpening(c)) {
        depth++;
      } else if (isClosing(c)) {
        depth = Math.max(0, depth - 1);
      } else if (depth == 0 && Character.isLetter(c)) {
        for (String keyword : keywords) {
          if (isKeywordAt(masked, i, keyword)) {
            return i;
          }
        }
      }
    }
    return -1;
  }

  /**
   * Finds every occurrence of a keyword at bracket depth zero.
   *
   * @param masked Text masked by {@link #maskLiterals(String)}.
   * @param keyword The upper-case keyword.
   * @return Offsets of every occurrence, in order.
   */
  public static List<Integer> indexesOfTopLevelKeyword(String masked, String keyword) {
    List<Integer> offsets = new ArrayList<>();
    int depth = 0;
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (isOpening(c)) {
        depth++;
      } else if (isClosing(c)) {
        depth = Math.max(0, depth - 1);
      } else if (depth == 0 && isKeywordAt(masked, i, keyword)) {
        offsets.add(i);
      }
    }
    return offsets;
  }

  /**
   * Checks whether a keyword starts at the given offset as a whole word.
   *
   * @param text The text to inspect.
   * @param offset The candidate offset.
   * @param keyword The upper-case keyword.
   * @return true if the keyword occurs at {@code offset} bounded by non-identifier characters.
   */
  public static boolean isKeywordAt(String text, int offset, String keyword) {
    if (!text.regionMatches(true, offset, keyword, 0, keyword.length())) {
      return false;
    }
    if (offset > 0) {
      char before = text.charAt(offset - 1);
      if (isIdentifierPart(before) || before == '.' || before == '$' || before == '`') {
        return false;
      }
    }
    int end = offset + keyword.length();
    return end >= text.length() || !isIdentifierPart(text.charAt(end));
  }

  /**
   * Checks whether a character may appear inside an unquoted identifier.
   *
   * @param c The character.
   * @return true for letters, digits and underscore.
   */
  public static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isOpening(char c) {
    return c == '(' || c == '[' || c == '{';
  }

  private static boolean isClosing(char c) {
    return c == ')' || c == ']' || c == '}';
  }
}
