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
 * Thrown when an APOC call survives native conversion and extensions are not permitted for the
 * query.
 */
public class DisallowedExtensionException extends QueryRejectedException {
  /** Reason code reported for unresolved APOC usage. */
  public static final String APOC_DISALLOWED = "apoc-disallowed";

  private final String call;

  /**
   * Constructs a DisallowedExtensionException.
   *
   * @param ruleName The rule that rejected the call.
   * @param call The first unresolved extension call, for example {@code apoc.text.join}.
   */
  public DisallowedExtensionException(String ruleName, String call) {
    super(ruleName, APOC_DISALLOWED + ": APOC usage is not allowed in Neo4j 5 (" + call + ")");
    this.call = call;
  }

  /**
   * Gets the unresolved extension call.
   *
   * @return The call name.
   */
  public String getCall() {
    return call;
  }

  /**
   * Gets the reason code for this rejection.
   *
   * @return Always {@link #APOC_DISALLOWED}.
   */
  public String getReason() {
    return APOC_DISALLOWED;
  }
}
