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
package com.arcesium.cypherguard.validation;

import com.arcesium.cypherguard.common.ForbiddenOperationException;
import com.arcesium.cypherguard.common.ValidationException;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Final gate in front of query execution. Scans the whole query text, string literals and
 * subqueries included, for mutating and administrative operations and rejects the query on the
 * first hit. There is no way to relax this check.
 */
public final class SafetyValidator {
  private static final Map<String, Pattern> DENYLIST =
      ImmutableMap.<String, Pattern>builder()
          .put("CALL dbms", keyword("CALL\\s+dbms"))
          .put("DROP", keyword("DROP"))
          .put("DETACH DELETE", keyword("DETACH\\s+DELETE"))
          .put("DELETE", keyword("DELETE"))
          .put("SET", keyword("SET"))
          .put("REMOVE", keyword("REMOVE"))
          .put("CREATE", keyword("CREATE"))
          .put("MERGE", keyword("MERGE"))
          .build();

  private static final SafetyValidator INSTANCE = new SafetyValidator();

  private SafetyValidator() {}

  /**
   * Gets the shared validator.
   *
   * @return The validator instance.
   */
  public static SafetyValidator getInstance() {
    return INSTANCE;
  }

  /**
   * Validates that a query is free of denylisted operations.
   *
   * @param query The fully rewritten query text.
   * @throws ForbiddenOperationException if a denylisted operation is present.
   */
  public void validate(String query) {
    ValidationException.checkNotNull(query, "Query cannot be null");
    for (Map.Entry<String, Pattern> entry : DENYLIST.entrySet()) {
      if (entry.getValue().matcher(query).find()) {
        throw new ForbiddenOperationException(entry.getKey());
      }
    }
  }

  /**
   * Gets the denylisted keywords in the order they are checked.
   *
   * @return The keywords.
   */
  public Iterable<String> getDenylist() {
    return DENYLIST.keySet();
  }

  private static Pattern keyword(String regex) {
    return Pattern.compile(
        "(?<![A-Za-z0-9_.$])" + regex + "(?![A-Za-z0-9_])", Pattern.CASE_INSENSITIVE);
  }
}
