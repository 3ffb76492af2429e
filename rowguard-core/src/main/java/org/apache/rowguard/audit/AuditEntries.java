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
 
package org.apache.rowguard.audit;

import java.time.Instant;
import java.util.List;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.model.access.RlsFilterRequest;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.audit.AccessDecision;
import org.apache.rowguard.model.audit.PolicyReference;
import org.apache.rowguard.model.audit.RlsAuditEntry;

/** Builds audit entries from evaluated decisions. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditEntries {
  public static final String DATA_ACCESS_ACTION = "data_access";
  public static final String TABLE_OBJECT_TYPE = "table";

  /**
   * @param response the enforced form of the decision, before any audit mode rewrite
   */
  public static RlsAuditEntry forDecision(
      Instant timestamp,
      RlsFilterRequest request,
      RlsFilterResponse response,
      List<PolicyReference> policiesEvaluated,
      boolean auditOnly,
      boolean cached) {
    return RlsAuditEntry.builder()
        .timestamp(timestamp)
        .userId(request.getUserContext().getUserId())
        .action(DATA_ACCESS_ACTION)
        .objectType(TABLE_OBJECT_TYPE)
        .objectId(request.getSchemaName() + "." + request.getTableName())
        .connectionId(request.getConnectionId())
        .policiesEvaluated(policiesEvaluated)
        .policiesApplied(response.getPoliciesApplied())
        .decision(response.isAccessDenied() ? AccessDecision.DENY : AccessDecision.ALLOW)
        .reason(response.getDenialReason())
        .filtersApplied(response.isHasFilters() ? response.getWhereClause() : null)
        .conditionFailures(response.getConditionFailures())
        .auditOnly(auditOnly)
        .cached(cached)
        .build();
  }
}
