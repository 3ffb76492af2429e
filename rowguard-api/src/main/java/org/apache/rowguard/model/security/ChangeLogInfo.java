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
 
package org.apache.rowguard.model.security;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Records who created or last modified a role or policy, and when. Maintained by the
 * administrative layer; the evaluation path never reads it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ChangeLogInfo {
  /** The identifier of the user that created this record. */
  String createdBy;

  /** The identifier of the user that last modified this record. */
  String lastModifiedBy;

  /** The timestamp when this record was created. */
  Instant createdAt;

  /** The timestamp when this record was last modified. */
  Instant lastModifiedAt;

  public static ChangeLogInfo created(String user, Instant now) {
    return ChangeLogInfo.builder()
        .createdBy(user)
        .lastModifiedBy(user)
        .createdAt(now)
        .lastModifiedAt(now)
        .build();
  }

  public ChangeLogInfo modified(String user, Instant now) {
    return toBuilder().lastModifiedBy(user).lastModifiedAt(now).build();
  }
}
