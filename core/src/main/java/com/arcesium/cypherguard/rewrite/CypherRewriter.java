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
package com.arcesium.cypherguard.rewrite;

import com.arcesium.cypherguard.common.ChangeLog;
import com.arcesium.cypherguard.common.ValidationException;
import com.arcesium.cypherguard.rules.RewriteContext;
import com.arcesium.cypherguard.rules.RewriteRule;
import com.arcesium.cypherguard.rules.RuleSet;
import com.arcesium.cypherguard.scope.ScopeRepairer;
import com.arcesium.cypherguard.validation.SafetyValidator;
import com.arcesium.cypherguard.version.Neo4jVersion;
import java.util.List;

/**
 * Version-aware Cypher rewriter with auto-repair.
 *
 * <p>For the newest version tier a query goes through scope sanitizing, the version's rewrite rules
 * in registry order, scope repair and finally the safety validator. Older tiers accept the original
 * syntax, so only the safety validator runs. The first stage that rejects the query aborts the
 * call.
 *
 * <p>A rewriter holds only immutable configuration and can be shared between threads. It performs
 * no I/O.
 */
public class CypherRewriter {
  /** Change-log entry appended whenever the returned query differs from the trimmed input. */
  public static final String QUERY_REWRITTEN = "Query rewritten";

  private final Neo4jVersion version;
  private final boolean allowApoc;
  private final boolean strict;
  private final List<RewriteRule> rules;
  private final ScopeRepairer scopeRepairer;
  private final SafetyValidator safetyValidator;

  /**
   * Constructs a CypherRewriter with the default rule set.
   *
   * @param version The target version tier.
   * @param allowApoc Whether APOC calls may pass through unchanged.
   * @param strict Reserved strictness flag.
   */
  public CypherRewriter(Neo4jVersion version, boolean allowApoc, boolean strict) {
    this(version, allowApoc, strict, RuleSet.defaultRules(), new ScopeRepairer());
  }

  /**
   * Constructs a CypherRewriter.
   *
   * @param version The target version tier.
   * @param allowApoc Whether APOC calls may pass through unchanged.
   * @param strict Reserved strictness flag.
   * @param ruleSet The rules to draw from; only those applicable to {@code version} run.
   * @param scopeRepairer The scope sanitizer and repairer.
   */
  public CypherRewriter(
      Neo4jVersion version,
      boolean allowApoc,
      boolean strict,
      RuleSet ruleSet,
      ScopeRepairer scopeRepairer) {
    ValidationException.checkNotNull(version, "Version cannot be null");
    ValidationException.checkNotNull(ruleSet, "Rule set cannot be null");
    ValidationException.checkNotNull(scopeRepairer, "Scope repairer cannot be null");
    this.version = version;
    this.allowApoc = allowApoc;
    this.strict = strict;
    this.rules = ruleSet.forVersion(version);
    this.scopeRepairer = scopeRepairer;
    this.safetyValidator = SafetyValidator.getInstance();
  }

  /**
   * Rewrites and validates a query.
   *
   * @param query The query text, typically produced by an LLM.
   * @return The query to execute and the changes applied to it.
   * @throws com.arcesium.cypherguard.common.QueryRejectedException if any stage rejects the query.
   * @throws ValidationException if the query is null.
   */
  public RewriteResult rewrite(String query) {
    ValidationException.checkNotNull(query, "Query cannot be null");
    String trimmed = query.trim();
    ChangeLog changeLog = new ChangeLog();

    String result = trimmed;
    if (version == Neo4jVersion.newest()) {
      result = rewriteForNewest(result, new RewriteContext(version, allowApoc, strict, changeLog));
    }

    safetyValidator.validate(result);

    if (!result.equals(trimmed)) {
      changeLog.record(QUERY_REWRITTEN);
    }
    return new RewriteResult(result, changeLog.entries());
  }

  private String rewriteForNewest(String query, RewriteContext context) {
    String result = query;
    if (scopeRepairer.hasProjection(result)) {
      result = scopeRepairer.sanitize(result, context.getChangeLog());
    }

    for (RewriteRule rule : rules) {
      if (rule.matches(result)) {
        result = rule.apply(result, context);
      }
    }

    return scopeRepairer.repair(result, context.getChangeLog());
  }

  public Neo4jVersion getVersion() {
    return version;
  }

  public boolean isAllowApoc() {
    return allowApoc;
  }

  public boolean isStrict() {
    return strict;
  }

  /**
   * Gets the rules that run for this rewriter's version tier, in execution order.
   *
   * @return The active rules.
   */
  public List<RewriteRule> getRules() {
    return rules;
  }
}
