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

/**
 * A named textual rule: a detection predicate plus either a rewrite or a rejection. Implementations
 * are immutable and safe to share between threads.
 */
public interface RewriteRule {

  /**
   * Gets the stable name of the rule, used in change logs and rejections.
   *
   * @return The rule name.
   */
  String name();

  /**
   * Gets what the rule does when it matches.
   *
   * @return The rule kind.
   */
  RuleKind kind();

  /**
   * Gets the oldest version tier that needs this rule.
   *
   * @return The minimum version tier.
   */
  Neo4jVersion minimumVersion();

  /**
   * Checks whether the rule's pattern occurs in the query.
   *
   * @param query The query text.
   * @return true if the rule would act on the query.
   */
  boolean matches(String query);

  /**
   * Applies the rule. Callers only invoke this when {@link #matches(String)} returned true.
   *
   * @param query The query text.
   * @param context The per-call context.
   * @return The rewritten query text.
   * @throws com.arcesium.cypherguard.common.QueryRejectedException if the rule rejects the query.
   */
  String apply(String query, RewriteContext context);

  /**
   * Checks whether the rule runs for the given version tier.
   *
   * @param version The target tier.
   * @return true if the rule is needed for {@code version}.
   */
  default boolean appliesTo(Neo4jVersion version) {
    return version.isAtLeast(minimumVersion());
  }
}
