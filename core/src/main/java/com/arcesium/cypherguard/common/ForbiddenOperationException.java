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
 * Thrown by the safety validator when a query contains a mutating or administrative operation. This
 * rejection cannot be disabled by configuration.
 */
public class ForbiddenOperationException extends QueryRejectedException {
  /** Rule name reported for safety validator rejections. */
  public static final String RULE_NAME = "safety-validator";

  private final String keyword;

  /**
   * Constructs a ForbiddenOperationException.
   *
   * @param keyword The denylisted keyword found in the query.
   */
  public ForbiddenOperationException(String keyword) {
    super(RULE_NAME, "Forbidden operation detected: " + keyword);
    this.keyword = keyword;
  }

  /**
   * Gets the denylisted keyword that was found.
   *
   * @return The keyword in its canonical upper-case form.
   */
  public String getKeyword() {
    return keyword;
  }
}
