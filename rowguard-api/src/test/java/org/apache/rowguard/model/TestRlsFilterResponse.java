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
 
package org.apache.rowguard.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import org.apache.rowguard.model.access.ConditionFailure;
import org.apache.rowguard.model.access.FailureReason;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.sql.ParameterizedClause;

public class TestRlsFilterResponse {

  @Test
  void testUnrestricted() {
    RlsFilterResponse response = RlsFilterResponse.unrestricted();
    assertFalse(response.isHasFilters());
    assertFalse(response.isAccessDenied());
    assertTrue(response.getPoliciesApplied().isEmpty());
  }

  @Test
  void testDenied() {
    RlsFilterResponse response = RlsFilterResponse.denied("policy store unavailable");
    assertTrue(response.isAccessDenied());
    assertFalse(response.isHasFilters());
    assertEquals("policy store unavailable", response.getDenialReason());
  }

  @Test
  void testToAuditOnly() {
    ConditionFailure failure =
        ConditionFailure.builder()
            .policyId("p1")
            .conditionId("c1")
            .reason(FailureReason.MISSING_ATTRIBUTE)
            .build();
    RlsFilterResponse response =
        RlsFilterResponse.builder()
            .hasFilters(true)
            .whereClause("(1 = 0)")
            .parameterizedClause(ParameterizedClause.builder().sql("(1 = 0)").build())
            .policiesApplied(Collections.singletonList("p1"))
            .conditionFailures(Collections.singletonList(failure))
            .build();

    RlsFilterResponse auditOnly = response.toAuditOnly();

    assertTrue(auditOnly.isAuditOnly());
    assertFalse(auditOnly.isHasFilters());
    assertNull(auditOnly.getWhereClause());
    assertNull(auditOnly.getParameterizedClause());
    assertEquals(Collections.singletonList("p1"), auditOnly.getPoliciesApplied());
    assertEquals(Collections.singletonList(failure), auditOnly.getConditionFailures());
  }

  @Test
  void testDeniedToAuditOnly() {
    RlsFilterResponse auditOnly = RlsFilterResponse.denied("no matching policy").toAuditOnly();
    assertFalse(auditOnly.isAccessDenied());
    assertNull(auditOnly.getDenialReason());
  }
}
