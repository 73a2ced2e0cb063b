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

import com.arcesium.cypherguard.common.ChangeLog;
import com.arcesium.cypherguard.version.Neo4jVersion;

/**
 * Per-call settings and change log handed to every rule. A context is created for a single rewrite
 * call and never shared.
 */
public class RewriteContext {
  private final Neo4jVersion version;
  private final boolean allowApoc;
  private final boolean strict;
  private final ChangeLog changeLog;

  /**
   * Constructs a RewriteContext.
   *
   * @param version The target version tier.
   * @param allowApoc Whether APOC calls may pass through unchanged.
   * @param strict Reserved strictness flag.
   * @param changeLog The change log of the current call.
   */
  public RewriteContext(
      Neo4jVersion version, boolean allowApoc, boolean strict, ChangeLog changeLog) {
    this.version = version;
    this.allowApoc = allowApoc;
    this.strict = strict;
    this.changeLog = changeLog;
  }

  public Neo4jVersion getVersion() {
    return version;
  }

  public boolean isAllowApoc() {
    return allowApoc;
  }

  /**
   * Gets the strict flag. It is accepted and carried for future severity tuning; no rule changes
   * behavior on it yet.
   *
   * @return The strict flag.
   */
  public boolean isStrict() {
    return strict;
  }

  public ChangeLog getChangeLog() {
    return changeLog;
  }
}
