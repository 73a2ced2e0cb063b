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

/** Thrown when a query contains a construct that is never valid in the target Cypher dialect. */
public class StructurallyInvalidQueryException extends QueryRejectedException {
  /**
   * Constructs a StructurallyInvalidQueryException.
   *
   * @param ruleName The rule that detected the construct.
   * @param construct A short description of the offending construct.
   */
  public StructurallyInvalidQueryException(String ruleName, String construct) {
    super(ruleName, construct + " is invalid Cypher");
  }
}
