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

import static org.assertj.core.api.Assertions.*;

import java.util.MissingFormatArgumentException;
import org.junit.jupiter.api.Test;

class ValidationExceptionTest {

  @Test
  void testConstructorWithMessageAndArgs() {
    ValidationException exception = new ValidationException("Unknown rule: %s", "size-to-count");

    assertThat(exception).hasMessage("Unknown rule: size-to-count");
  }

  @Test
  void testConstructorWithMessageOnly() {
    ValidationException exception = new ValidationException("Query cannot be null");

    assertThat(exception).hasMessage("Query cannot be null").isInstanceOf(RuntimeException.class);
  }

  @Test
  void testCheckWithTrueCondition() {
    assertThatCode(() -> ValidationException.check(true, "Duplicate rule %s", "size-to-count"))
        .doesNotThrowAnyException();
  }

  @Test
  void testCheckWithFalseConditionAndFormatting() {
    assertThatThrownBy(() -> ValidationException.check(false, "Duplicate rule %s", "apoc-to-native"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Duplicate rule apoc-to-native");
  }

  @Test
  void testCheckNotNull() {
    assertThatCode(() -> ValidationException.checkNotNull("MATCH (n) RETURN n", "Query is null"))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> ValidationException.checkNotNull(null, "Query is null"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Query is null");
  }

  @Test
  void testWithInsufficientArgs() {
    assertThatThrownBy(() -> new ValidationException("Error: %s and %s", "Only one"))
        .isInstanceOf(MissingFormatArgumentException.class);
  }
}
