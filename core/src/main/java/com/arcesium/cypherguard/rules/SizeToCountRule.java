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

import com.arcesium.cypherguard.version.Neo4jVersion;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code size((pattern))} into {@code COUNT { (pattern) }}. Neo4j 5 no longer accepts
 * pattern expressions inside {@code size}. The inner pattern is kept verbatim.
 */
public class SizeToCountRule extends AbstractPatternRule {
  public static final String NAME = "size-to-count";

  private static final Pattern SIZE_PATTERN =
      Pattern.compile("size\\s*\\(\\s*\\((.*?)\\)\\s*\\)", Pattern.CASE_INSENSITIVE);

  public SizeToCountRule() {
    super(NAME, RuleKind.REWRITE, Neo4jVersion.V5, SIZE_PATTERN);
  }

  @Override
  public String apply(String query, RewriteContext context) {
    Matcher matcher = pattern.matcher(query);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(
          result, Matcher.quoteReplacement("COUNT { (" + matcher.group(1) + ") }"));
    }
    matcher.appendTail(result);
    context.getChangeLog().record("Rewrote size((pattern)) → COUNT { }");
    return result.toString();
  }
}
