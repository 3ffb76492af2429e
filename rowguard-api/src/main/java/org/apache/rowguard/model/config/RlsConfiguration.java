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
 
package org.apache.rowguard.model.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import org.apache.rowguard.model.policy.CombinationStrategy;
import org.apache.rowguard.model.sql.SqlDialect;

/** Process wide row-level security settings, read at the start of every evaluation. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RlsConfiguration {
  public static final RlsConfiguration DEFAULT = RlsConfiguration.builder().build();

  /** Global switch. When false every request is unrestricted. */
  @Builder.Default boolean enabled = true;

  /** Deny access when no policy matches the request, instead of granting unrestricted access. */
  @Builder.Default boolean defaultDeny = false;

  /** How long an access decision may be served from cache. Zero or less disables caching. */
  @Builder.Default int cacheTtlSeconds = 300;

  /** Record every decision through the audit sink. */
  @Builder.Default boolean logAccess = true;

  /**
   * Compute and record decisions without enforcing them. Responses carry no filter and are
   * flagged as audit only.
   */
  @Builder.Default boolean auditMode = false;

  /**
   * Grant unrestricted access when the policy or role store cannot be reached. Off by default,
   * an unreachable store denies.
   */
  @Builder.Default boolean failOpen = false;

  /** Upper bound for a single call to the policy, role or attribute store. */
  @Builder.Default long storeTimeoutMillis = 2000L;

  /** Deepest condition group nesting accepted when a policy is written. */
  @Builder.Default int maxGroupDepth = 16;

  @NonNull @Builder.Default CombinationStrategy combinationStrategy = CombinationStrategy.ALL;

  @NonNull @Builder.Default SqlDialect dialect = SqlDialect.POSTGRESQL;

  /**
   * (Optional) Fully qualified class name of an {@link org.apache.rowguard.spi.audit.AuditSink}
   * implementation. Audit entries are logged when unset.
   */
  String auditSinkClass;
}
