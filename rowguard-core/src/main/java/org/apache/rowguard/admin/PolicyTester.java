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

import java.util.Collections;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.rowguard.engine.RowLevelSecurityEngine;
import org.apache.rowguard.model.access.RlsFilterRequest;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.model.security.UserSecurityContext;

/**
 * Previews the filter a single policy produces for a synthetic user. The policy does not need to
 * be stored; the decision cache and audit trail are not touched.
 */
@Log4j2
@RequiredArgsConstructor
public class PolicyTester {
  static final String DEFAULT_CONNECTION_ID = "test";
  static final String DEFAULT_SCHEMA_NAME = "public";

  @NonNull private final RowLevelSecurityEngine engine;

  /**
   * @param connectionId (optional) connection to evaluate against, {@code test} when null
   * @param schemaName (optional) schema to evaluate against, {@code public} when null
   */
  public PolicyTestResult test(
      @NonNull RlsPolicy policy,
      @NonNull UserSecurityContext user,
      String connectionId,
      String schemaName,
      @NonNull String tableName) {
    RlsFilterRequest request =
        RlsFilterRequest.builder()
            .connectionId(connectionId == null ? DEFAULT_CONNECTION_ID : connectionId)
            .schemaName(schemaName == null ? DEFAULT_SCHEMA_NAME : schemaName)
            .tableName(tableName)
            .userContext(user)
            .build();
    RlsFilterResponse response =
        engine.evaluateWithPolicies(request, Collections.singletonList(policy));
    log.debug("Tested policy {} for user {}: {}", policy.getId(), user.getUserId(), response);
    return PolicyTestResult.builder()
        .policyWouldApply(response.getPoliciesApplied().contains(policy.getId()))
        .whereClause(response.getWhereClause())
        .parameterizedClause(response.getParameterizedClause())
        .accessDenied(response.isAccessDenied())
        .denialReason(response.getDenialReason())
        .conditionFailures(response.getConditionFailures())
        .build();
  }
}
