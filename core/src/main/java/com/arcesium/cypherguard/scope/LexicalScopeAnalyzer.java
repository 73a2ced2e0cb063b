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
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort {@link ScopeAnalyzer} built on word scanning rather than a parser. It understands
 * string literals, property access, function calls, labels and aliases, and nothing more.
 */
public class LexicalScopeAnalyzer implements ScopeAnalyzer {
  private static final Pattern ALIAS_PATTERN =
      Pattern.compile("\\bAS\\s+([A-Za-z_][A-Za-z0-9_]*)\\b", Pattern.CASE_INSENSITIVE);

  @Override
  public Set<String> consumedNames(String fragment) {
    String masked = CypherLexer.maskLiterals(fragment);
    StringBuilder withoutAliases = new StringBuilder(fragment);
    Matcher matcher = ALIAS_PATTERN.matcher(masked);
    while (matcher.find()) {
      for (int i = matcher.start(); i < matcher.end(); i++) {
        withoutAliases.setCharAt(i, ' ');
      }
    }
    return CypherVariables.referencedVariables(withoutAliases.toString());
  }

  @Override
  public Set<String> definedNames(String fragment) {
    Set<String> names = new LinkedHashSet<>(CypherVariables.referencedVariables(fragment));
    Matcher matcher = ALIAS_PATTERN.matcher(CypherLexer.maskLiterals(fragment));
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }
}
