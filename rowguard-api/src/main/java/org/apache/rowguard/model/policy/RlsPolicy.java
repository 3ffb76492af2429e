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
 
package org.apache.rowguard.model.policy;

import java.util.Collections;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import org.apache.rowguard.annotations.Evolving;
import org.apache.rowguard.model.security.ChangeLogInfo;

/**
 * A named, scoped row-level security rule. When it applies to a request, its filter group narrows
 * the rows the user may see.
 *
 * <p>A null scope field ({@link #connectionId}, {@link #schemaName}, {@link #tableName}) matches
 * any value. A policy only applies to users holding at least one of its {@link #roleIds}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Evolving
public class RlsPolicy {
  @NonNull String id;

  @NonNull String name;

  String description;

  @Builder.Default boolean enabled = true;

  /** Lower values are evaluated first. */
  int priority;

  String connectionId;

  String schemaName;

  String tableName;

  @NonNull RlsConditionGroup filterGroup;

  @Builder.Default Set<String> roleIds = Collections.emptySet();

  ChangeLogInfo changeLogInfo;
}
