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

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The security context of the user a request is evaluated for: identity, assigned roles and
 * arbitrary attributes such as department or region.
 *
 * <p>Contexts are built per request and never persisted by the engine.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserSecurityContext {
  @NonNull String userId;

  String username;

  String email;

  /** Ids of the roles assigned to the user. */
  @Builder.Default Set<String> roles = Collections.emptySet();

  /** Attributes available to dynamic conditions, keyed by attribute name. */
  @Builder.Default Map<String, Object> attributes = Collections.emptyMap();
}
