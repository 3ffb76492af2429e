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
 
package org.apache.rowguard.admin;

import static org.apache.rowguard.testutil.RlsTestData.ANALYST_ROLE;
import static org.apache.rowguard.testutil.RlsTestData.SCHEMA_NAME;
import static org.apache.rowguard.testutil.RlsTestData.TABLE_NAME;
import static org.apache.rowguard.testutil.RlsTestData.analyst;
import static org.apache.rowguard.testutil.RlsTestData.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import org.apache.rowguard.engine.RowLevelSecurityEngine;
import org.apache.rowguard.exception.PolicyValidationException;
import org.apache.rowguard.model.policy.GroupLogic;
import org.apache.rowguard.model.policy.PolicyTemplate;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.repository.InMemoryPolicyRepository;
import org.apache.rowguard.validation.PolicyValidator;

public class TestPolicyTemplates {
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void testList() {
    assertEquals(
        Arrays.asList(
            PolicyTemplates.DEPARTMENT_FILTER,
            PolicyTemplates.REGION_FILTER,
            PolicyTemplates.OWNER_FILTER,
            PolicyTemplates.TEAM_HIERARCHY),
        PolicyTemplates.list().stream().map(PolicyTemplate::getId).collect(Collectors.toList()));
    assertEquals(
        GroupLogic.OR,
        PolicyTemplates.get(PolicyTemplates.TEAM_HIERARCHY).get().getFilterGroup().getLogic());
    assertFalse(PolicyTemplates.get("missing").isPresent());
  }

  @Test
  void testApply() {
    RlsPolicy first = apply(PolicyTemplates.OWNER_FILTER);
    RlsPolicy second = apply(PolicyTemplates.OWNER_FILTER);

    assertEquals("Owner Filter - orders", first.getName());
    assertEquals(TABLE_NAME, first.getTableName());
    assertEquals(SCHEMA_NAME, first.getSchemaName());
    assertNull(first.getConnectionId());
    assertEquals(Collections.singleton(ANALYST_ROLE), first.getRoleIds());
    assertEquals("admin", first.getChangeLogInfo().getCreatedBy());
    assertEquals(NOW, first.getChangeLogInfo().getCreatedAt());
    assertNotEquals(first.getId(), second.getId());
  }

  @Test
  void testUnknownTemplate() {
    assertThrows(PolicyValidationException.class, () -> apply("missing"));
  }

  @Test
  void testTemplatesProduceValidPolicies() {
    PolicyValidator validator = new PolicyValidator(16, null);
    for (PolicyTemplate template : PolicyTemplates.list()) {
      assertEquals(Collections.emptyList(), validator.findViolations(apply(template.getId())));
    }
  }

  @Test
  void testTeamHierarchyFilter() {
    Map<String, Object> attributes = new HashMap<>();
    attributes.put("team", "t7");
    try (RowLevelSecurityEngine engine =
        RowLevelSecurityEngine.builder()
            .policyRepository(new InMemoryPolicyRepository(null))
            .build()) {
      String whereClause =
          engine
              .evaluateWithPolicies(
                  request(TABLE_NAME, analyst("u1", attributes)),
                  Collections.singletonList(apply(PolicyTemplates.TEAM_HIERARCHY)))
              .getWhereClause();

      assertEquals("(\"team_id\" = 't7' OR \"created_by\" = 'u1')", whereClause);
    }
  }

  private static RlsPolicy apply(String templateId) {
    return PolicyTemplates.apply(
        templateId,
        TABLE_NAME,
        SCHEMA_NAME,
        null,
        Collections.singleton(ANALYST_ROLE),
        "admin",
        CLOCK);
  }
}
