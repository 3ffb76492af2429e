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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A security role that groups users for policy targeting.
 *
 * <p>The id is the immutable identity of the role; name and priority may change over time. Roles
 * are owned by the administrative store, policies reference them through {@code roleIds}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SecurityRole {
  /** The unique identifier of the role. */
  @NonNull String id;

  /** Display name of the role. */
  @NonNull String name;

  String description;

  /** Whether newly created users receive this role. */
  boolean defaultRole;

  /** Role priority, a higher value is more restrictive. */
  int priority;

  ChangeLogInfo changeLogInfo;
}
