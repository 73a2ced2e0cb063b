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
package com.arcesium.cypherguard.scope;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names defined so far while walking one query. Created fresh for every call and never shared.
 */
public class ScopeState {
  private final Set<String> defined = new LinkedHashSet<>();

  public void define(String name) {
    defined.add(name);
  }

  public void defineAll(Collection<String> names) {
    defined.addAll(names);
  }

  public boolean isDefined(String name) {
    return defined.contains(name);
  }

  public Set<String> getDefined() {
    return new LinkedHashSet<>(defined);
  }

  @Override
  public String toString() {
    return "ScopeState{" + "defined=" + defined + '}';
  }
}
