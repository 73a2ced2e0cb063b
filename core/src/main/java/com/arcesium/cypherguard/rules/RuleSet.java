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

import com.arcesium.cypherguard.common.ValidationException;
import com.arcesium.cypherguard.version.Neo4jVersion;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable registry of rewrite rules. Rules run in registration order; the default set is
 * built once and shared by every rewriter.
 */
public final class RuleSet {
  private static final RuleSet DEFAULT =
      new RuleSet(
          ImmutableList.of(
              new SizeToCountRule(),
              new ApocToNativeRule(),
              NestedReturnGuardRule.countReturn(),
              NestedReturnGuardRule.collectReturn(),
              new ToStringOnNodeRule()));

  private final List<RewriteRule> rules;

  private RuleSet(List<RewriteRule> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  /**
   * Gets the default rule set.
   *
   * @return The shared default rule set.
   */
  public static RuleSet defaultRules() {
    return DEFAULT;
  }

  /**
   * Creates a rule set from the given rules, keeping their order.
   *
   * @param rules The rules in execution order.
   * @return A new RuleSet.
   * @throws ValidationException if two rules share a name.
   */
  public static RuleSet of(List<? extends RewriteRule> rules) {
    Set<String> names = new HashSet<>();
    for (RewriteRule rule : rules) {
      ValidationException.check(names.add(rule.name()), "Duplicate rule name %s", rule.name());
    }
    return new RuleSet(ImmutableList.copyOf(rules));
  }

  /**
   * Gets all rules in execution order.
   *
   * @return The rules.
   */
  public List<RewriteRule> rules() {
    return rules;
  }

  /**
   * Gets the rules needed for a version tier, in execution order.
   *
   * @param version The target tier.
   * @return The applicable rules.
   */
  public List<RewriteRule> forVersion(Neo4jVersion version) {
    return rules.stream()
        .filter(rule -> rule.appliesTo(version))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Looks up a rule by name.
   *
   * @param name The rule name.
   * @return The rule, if registered.
   */
  public Optional<RewriteRule> find(String name) {
    return rules.stream().filter(rule -> rule.name().equals(name)).findFirst();
  }

  @Override
  public String toString() {
    return "RuleSet{" + "rules=" + rules + '}';
  }
}
