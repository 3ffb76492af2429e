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
 
package org.apache.rowguard.model.access;

import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import org.apache.rowguard.annotations.Evolving;
import org.apache.rowguard.model.sql.ParameterizedClause;

/**
 * The outcome of an access evaluation. It is always one of three states: denied, unrestricted
 * (no filter) or allowed with a filter that must be conjoined to every query on the resource.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Evolving
public class RlsFilterResponse {
  /** Whether {@link #whereClause} must be applied. */
  boolean hasFilters;

  /** The filter with literals rendered inline, for display and audit. */
  String whereClause;

  /** The filter with bound parameters, the form callers should execute. */
  ParameterizedClause parameterizedClause;

  /** Ids of the policies that matched the request, in evaluation order. */
  @Builder.Default List<String> policiesApplied = Collections.emptyList();

  /** Whether the query must not run at all. */
  boolean accessDenied;

  String denialReason;

  /** Conditions that failed to compile and were treated as always false. */
  @Builder.Default List<ConditionFailure> conditionFailures = Collections.emptyList();

  /**
   * Set when the engine runs in audit mode. The decision was recorded but is not to be enforced,
   * callers apply no filter.
   */
  boolean auditOnly;

  public static RlsFilterResponse unrestricted() {
    return RlsFilterResponse.builder().build();
  }

  public static RlsFilterResponse denied(String reason) {
    return RlsFilterResponse.builder().accessDenied(true).denialReason(reason).build();
  }

  /** Returns the informational, non-enforcing form of this response. */
  public RlsFilterResponse toAuditOnly() {
    return toBuilder()
        .hasFilters(false)
        .whereClause(null)
        .parameterizedClause(null)
        .accessDenied(false)
        .denialReason(null)
        .auditOnly(true)
        .build();
  }
}
