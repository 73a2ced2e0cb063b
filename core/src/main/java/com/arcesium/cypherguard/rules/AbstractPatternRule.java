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
import java.util.regex.Pattern;

/** Base class for rules detected by a single regular expression. */
public abstract class AbstractPatternRule implements RewriteRule {
  private final String name;
  private final RuleKind kind;
  private final Neo4jVersion minimumVersion;
  protected final Pattern pattern;

  protected AbstractPatternRule(
      String name, RuleKind kind, Neo4jVersion minimumVersion, Pattern pattern) {
    this.name = name;
    this.kind = kind;
    this.minimumVersion = minimumVersion;
    this.pattern = pattern;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public RuleKind kind() {
    return kind;
  }

  @Override
  public Neo4jVersion minimumVersion() {
    return minimumVersion;
  }

  @Override
  public boolean matches(String query) {
    return pattern.matcher(query).find();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name='" + name + "', kind=" + kind + '}';
  }
}
