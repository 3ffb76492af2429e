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
import java.util.Collections;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Assignment of roles to a user, optionally limited to an effective time window. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserRoleMapping {
  @NonNull String userId;

  @Builder.Default Set<String> roleIds = Collections.emptySet();

  /** Start of the assignment, inclusive. Null means the assignment has no start bound. */
  Instant effectiveFrom;

  /** End of the assignment, exclusive. Null means the assignment never expires. */
  Instant effectiveTo;

  public boolean isEffectiveAt(Instant instant) {
    if (effectiveFrom != null && instant.isBefore(effectiveFrom)) {
      return false;
    }
    return effectiveTo == null || instant.isBefore(effectiveTo);
  }
}
