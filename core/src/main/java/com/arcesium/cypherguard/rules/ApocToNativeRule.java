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

import com.arcesium.cypherguard.common.DisallowedExtensionException;
import com.arcesium.cypherguard.version.Neo4jVersion;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts APOC calls that have a native Cypher equivalent. Any APOC call left over after conversion
 * rejects the query, unless the caller allowed APOC, in which case the query is left untouched.
 */
public class ApocToNativeRule extends AbstractPatternRule {
  public static final String NAME = "apoc-to-native";

  private static final Pattern APOC_PATTERN =
      Pattern.compile("\\bapoc\\.", Pattern.CASE_INSENSITIVE);
  private static final Pattern APOC_CALL_PATTERN =
      Pattern.compile("\\bapoc(?:\\s*\\.\\s*[A-Za-z_][A-Za-z0-9_]*)+", Pattern.CASE_INSENSITIVE);

  // applied in insertion order
  private static final Map<Pattern, String> NATIVE_SUBSTITUTIONS =
      ImmutableMap.of(
          Pattern.compile(
              "apoc\\.coll\\.toSet\\s*\\(\\s*([^)]+?)\\s*\\)", Pattern.CASE_INSENSITIVE),
          "collect(DISTINCT $1)",
          Pattern.compile(
              "apoc\\.coll\\.contains\\s*\\(\\s*([^,()]+?)\\s*,\\s*([^()]+?)\\s*\\)",
              Pattern.CASE_INSENSITIVE),
          "($2 IN $1)",
          Pattern.compile("apoc\\.coll\\.sum\\s*\\(\\s*([^()]+?)\\s*\\)", Pattern.CASE_INSENSITIVE),
          "reduce(total = 0, value IN $1 | total + value)",
          Pattern.compile(
              "apoc\\.node\\.degree\\s*\\(\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*\\)",
              Pattern.CASE_INSENSITIVE),
          "COUNT { ($1)--() }");

  public ApocToNativeRule() {
    super(NAME, RuleKind.REWRITE, Neo4jVersion.V5, APOC_PATTERN);
  }

  @Override
  public String apply(String query, RewriteContext context) {
    if (context.isAllowApoc()) {
      return query;
    }

    String result = query;
    for (Map.Entry<Pattern, String> substitution : NATIVE_SUBSTITUTIONS.entrySet()) {
      result = substitution.getKey().matcher(result).replaceAll(substitution.getValue());
    }

    Matcher leftover = APOC_PATTERN.matcher(result);
    if (leftover.find()) {
      throw new DisallowedExtensionException(NAME, callName(result.substring(leftover.start())));
    }
    if (!result.equals(query)) {
      context.getChangeLog().record("Rewrote APOC to native Cypher");
    }
    return result;
  }

  // escaped namespaces such as apoc.`coll` have no plain call name
  private static String callName(String fromApoc) {
    Matcher call = APOC_CALL_PATTERN.matcher(fromApoc);
    return call.lookingAt() ? call.group().replaceAll("\\s+", "") : "apoc.";
  }
}
