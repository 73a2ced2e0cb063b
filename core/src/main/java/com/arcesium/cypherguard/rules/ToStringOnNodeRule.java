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
 * Rewrites {@code toString(var)} where {@code var} is a bare variable. Stringifying a node is not
 * meaningful, so the call becomes {@code toString(var.name)} when the query already refers to
 * {@code var.name}, and a map of the node's labels and properties otherwise.
 */
public class ToStringOnNodeRule extends AbstractPatternRule {
  public static final String NAME = "tostring-on-node";

  private static final Pattern TOSTRING_PATTERN =
      Pattern.compile(
          "toString\\s*\\(\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\)", Pattern.CASE_INSENSITIVE);

  public ToStringOnNodeRule() {
    super(NAME, RuleKind.REWRITE, Neo4jVersion.V5, TOSTRING_PATTERN);
  }

  @Override
  public String apply(String query, RewriteContext context) {
    Matcher matcher = pattern.matcher(query);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String var = matcher.group(1);
      String replacement;
      if (query.contains(var + ".name")) {
        replacement = "toString(" + var + ".name)";
        context.getChangeLog().record("Rewrote toString(%s) → toString(%s.name)", var, var);
      } else {
        replacement = "{ labels: labels(" + var + "), properties: properties(" + var + ") }";
        context.getChangeLog().record("Rewrote toString(%s) → node map representation", var);
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
