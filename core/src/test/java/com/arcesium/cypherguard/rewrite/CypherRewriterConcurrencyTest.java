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

import static org.assertj.core.api.Assertions.assertThat;

import com.arcesium.cypherguard.version.Neo4jVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CypherRewriterConcurrencyTest {
  private static final String[][] CASES = {
    {"MATCH (a) RETURN size((a)-->())", "MATCH (a) RETURN COUNT { (a)-->() }"},
    {"RETURN apoc.coll.toSet(x)", "RETURN collect(DISTINCT x)"},
    {"MATCH (n:Person) WITH n, ghost RETURN n", "MATCH (n:Person) WITH n RETURN n"},
    {
      "MATCH (n:Person)-[:KNOWS]->(m:Person) WITH n RETURN n.name, m.name",
      "MATCH (n:Person)-[:KNOWS]->(m:Person) WITH n, m RETURN n.name, m.name"
    },
    {"MATCH (n) RETURN toString(n)", "MATCH (n) RETURN { labels: labels(n), properties: properties(n) }"}
  };

  @Test
  void testSharedRewriterIsThreadSafe() throws Exception {
    CypherRewriter rewriter = new CypherRewriter(Neo4jVersion.V5, false, true);
    int threadCount = 8;
    int iterations = 200;
    ExecutorService executorService = Executors.newFixedThreadPool(threadCount);

    List<Callable<Boolean>> tasks = new ArrayList<>();
    for (int i = 0; i < iterations; i++) {
      String[] testCase = CASES[i % CASES.length];
      tasks.add(
          () -> {
            RewriteResult result = rewriter.rewrite(testCase[0]);
            return result.getQuery().equals(testCase[1])
                && result.getChanges().contains(CypherRewriter.QUERY_REWRITTEN);
          });
    }

    try {
      for (Future<Boolean> future : executorService.invokeAll(tasks)) {
        assertThat(future.get()).isTrue();
      }
    } finally {
      executorService.shutdown();
      executorService.awaitTermination(10, TimeUnit.SECONDS);
    }
  }
}
