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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChangeLogTest {

  @Test
  void testRecordsInOrder() {
    ChangeLog changeLog = new ChangeLog();
    assertThat(changeLog.isEmpty()).isTrue();

    changeLog.record("Rewrote size((pattern)) → COUNT { }");
    changeLog.record("Restored variable '%s' to WITH clause", "m");

    assertThat(changeLog.size()).isEqualTo(2);
    assertThat(changeLog.entries())
        .containsExactly(
            "Rewrote size((pattern)) → COUNT { }", "Restored variable 'm' to WITH clause");
  }

  @Test
  void testEntriesAreASnapshot() {
    ChangeLog changeLog = new ChangeLog();
    changeLog.record("first");
    List<String> snapshot = changeLog.entries();
    changeLog.record("second");

    assertThat(snapshot).containsExactly("first");
    assertThatThrownBy(() -> snapshot.add("third")).isInstanceOf(UnsupportedOperationException.class);
  }
}
