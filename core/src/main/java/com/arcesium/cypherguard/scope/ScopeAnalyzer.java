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

import java.util.Set;

/**
 * Discovers which variable names a fragment of Cypher defines and which it consumes. This is the
 * only seam between scope tracking and the way Cypher text is tokenized.
 */
public interface ScopeAnalyzer {

  /**
   * Finds the variable names a fragment reads. Names bound by the fragment's own aliases are not
   * consumed.
   *
   * @param fragment The Cypher fragment.
   * @return Consumed names in order of first appearance.
   */
  Set<String> consumedNames(String fragment);

  /**
   * Finds the variable names a fragment brings into scope, both through aliases and through the
   * identifiers it introduces.
   *
   * @param fragment The Cypher fragment.
   * @return Defined names in order of first appearance.
   */
  Set<String> definedNames(String fragment);
}
