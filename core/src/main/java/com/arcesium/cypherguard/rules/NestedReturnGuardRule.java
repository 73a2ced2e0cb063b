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

import com.arcesium.cypherguard.common.StructurallyInvalidQueryException;
import com.arcesium.cypherguard.version.Neo4jVersion;
import java.util.regex.Pattern;

/**
 * Rejects subquery expressions that open directly with {@code RETURN}, such as {@code COUNT {
 * RETURN ... }}. These are never valid, so the rule rejects regardless of configuration.
 */
public class NestedReturnGuardRule extends AbstractPatternRule {
  public static final String COUNT_RETURN_GUARD = "count-return-guard";
  public static final String COLLECT_RETURN_GUARD = "collect-return-guard";

  private final String construct;

  /**
   * Constructs a guard for one subquery function.
   *
   * @param name The rule name.
   * @param function The subquery function keyword, for example {@code COUNT}.
   */
  public NestedReturnGuardRule(String name, String function) {
    super(
        name,
        RuleKind.REJECT,
        Neo4jVersion.V5,
        Pattern.compile(
            Pattern.quote(function) + "\\s*\\{\\s*return\\b", Pattern.CASE_INSENSITIVE));
    this.construct = function + " { RETURN ... }";
  }

  /** Guard for {@code COUNT { RETURN ... }}. */
  public static NestedReturnGuardRule countReturn() {
    return new NestedReturnGuardRule(COUNT_RETURN_GUARD, "COUNT");
  }

  /** Guard for {@code collect { RETURN ... }}. */
  public static NestedReturnGuardRule collectReturn() {
    return new NestedReturnGuardRule(COLLECT_RETURN_GUARD, "collect");
  }

  @Override
  public String apply(String query, RewriteContext context) {
    throw new StructurallyInvalidQueryException(name(), construct);
  }
}
