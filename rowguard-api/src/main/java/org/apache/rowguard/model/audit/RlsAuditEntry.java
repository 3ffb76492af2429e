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
 
package org.apache.rowguard.model.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Value;

import org.apache.rowguard.model.access.ConditionFailure;

/** Audit record of a single access decision. */
@Value
@Builder
public class RlsAuditEntry {
  Instant timestamp;

  String userId;

  // Kind of access, currently always data_access
  String action;

  String objectType;

  // schema.table
  String objectId;

  String connectionId;

  // Policies that matched the request, in evaluation order
  @Builder.Default List<PolicyReference> policiesEvaluated = Collections.emptyList();

  @Builder.Default List<String> policiesApplied = Collections.emptyList();

  AccessDecision decision;

  String reason;

  // The inline where clause, null when no filter applies
  String filtersApplied;

  @Builder.Default List<ConditionFailure> conditionFailures = Collections.emptyList();

  // The decision was recorded but not enforced
  boolean auditOnly;

  // The decision was served from the access decision cache
  boolean cached;
}
