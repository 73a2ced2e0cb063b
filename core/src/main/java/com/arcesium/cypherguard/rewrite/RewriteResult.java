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
package com.arcesium.cypherguard.rewrite;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** The outcome of a successful rewrite: the query to execute and the changes made to get there. */
public class RewriteResult {
  private final String query;
  private final List<String> changes;

  /**
   * Constructs a RewriteResult.
   *
   * @param query The rewritten, validated query.
   * @param changes Descriptions of every applied change, in application order.
   */
  public RewriteResult(String query, List<String> changes) {
    this.query = query;
    this.changes = ImmutableList.copyOf(changes);
  }

  public String getQuery() {
    return query;
  }

  public List<String> getChanges() {
    return changes;
  }

  /**
   * Checks whether any change was applied.
   *
   * @return true if the change log is not empty.
   */
  public boolean isModified() {
    return !changes.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RewriteResult that = (RewriteResult) o;
    return query.equals(that.query) && changes.equals(that.changes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(query, changes);
  }

  @Override
  public String toString() {
    return "RewriteResult{" + "query='" + query + '\'' + ", changes=" + changes + '}';
  }
}
