/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
 
package org.apache.rowguard.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import org.apache.rowguard.exception.AccessDeniedException;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.exception.ErrorCode;
import org.apache.rowguard.model.sql.ParameterizedClause;

public class TestQueryFilterInjector {
  private static final String QUERY = "SELECT id, region FROM sales.orders;  ";
  private static final RlsFilterResponse FILTERED =
      RlsFilterResponse.builder()
          .hasFilters(true)
          .whereClause("(\"region\" = 'West')")
          .parameterizedClause(
              ParameterizedClause.builder()
                  .sql("(\"region\" = ?)")
                  .parameters(Collections.singletonList("West"))
                  .build())
          .policiesApplied(Collections.singletonList("dept_filter"))
          .build();

  private final QueryFilterInjector injector = QueryFilterInjector.getInstance();

  @Test
  void testInject() {
    assertEquals(
        "SELECT * FROM (\n"
            + "    SELECT id, region FROM sales.orders\n"
            + ") AS __rls_filtered\n"
            + "WHERE (\"region\" = 'West')",
        injector.inject(QUERY, FILTERED));
  }

  @Test
  void testUnrestrictedQueryIsUnchanged() {
    assertSame(QUERY, injector.inject(QUERY, RlsFilterResponse.unrestricted()));
  }

  @Test
  void testDenied() {
    AccessDeniedException e =
        assertThrows(
            AccessDeniedException.class,
            () -> injector.inject(QUERY, RlsFilterResponse.denied("policy store unavailable")));
    assertEquals("Access denied: policy store unavailable", e.getMessage());
    assertEquals(ErrorCode.ACCESS_DENIED, e.getErrorCode());
  }

  @Test
  void testInjectParameterized() {
    ParameterizedClause result =
        injector.injectParameterized(
            "SELECT * FROM sales.orders WHERE amount > ?",
            Collections.singletonList(100),
            FILTERED);

    assertEquals(
        "SELECT * FROM (\n"
            + "    SELECT * FROM sales.orders WHERE amount > ?\n"
            + ") AS __rls_filtered\n"
            + "WHERE (\"region\" = ?)",
        result.getSql());
    assertEquals(Arrays.asList(100, "West"), result.getParameters());
  }

  @Test
  void testAuditOnlyResponseIsNotApplied() {
    ParameterizedClause result =
        injector.injectParameterized(QUERY, Collections.emptyList(), FILTERED.toAuditOnly());

    assertEquals(QUERY, result.getSql());
    assertEquals(Collections.emptyList(), result.getParameters());
  }
}
