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
package com.arcesium.cypherguard.common;

/**
 * Base class for every failure that rejects a query during rewriting. A rejected query must never
 * be executed; the rule name identifies which stage refused it.
 */
public abstract class QueryRejectedException extends CypherGuardException {
  private final String ruleName;

  /**
   * Constructs a QueryRejectedException.
   *
   * @param ruleName The name of the rule or stage that rejected the query.
   * @param message The detail message.
   */
  protected QueryRejectedException(String ruleName, String message) {
    super(message);
    this.ruleName = ruleName;
  }

  /**
   * Gets the name of the rule or stage that rejected the query.
   *
   * @return The rule name.
   */
  public String getRuleName() {
    return ruleName;
  }
}
