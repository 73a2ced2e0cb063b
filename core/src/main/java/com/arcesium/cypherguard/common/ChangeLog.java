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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered record of the transformations applied to a single query. A ChangeLog belongs to one
 * rewrite call and is not thread-safe.
 */
public class ChangeLog {
  private final List<String> entries = new ArrayList<>();

  /**
   * Records a change.
   *
   * @param entry Human-readable description of the change.
   */
  public void record(String entry) {
    entries.add(entry);
  }

  /**
   * Records a change described by a format string.
   *
   * @param format The format string.
   * @param args The format arguments.
   */
  @FormatMethod
  public void record(String format, Object... args) {
    entries.add(String.format(format, args));
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  /**
   * Returns a snapshot of the recorded entries in application order.
   *
   * @return An immutable copy of the entries.
   */
  public List<String> entries() {
    return ImmutableList.copyOf(entries);
  }

  @Override
  public String toString() {
    return "ChangeLog{" + "entries=" + entries + '}';
  }
}
