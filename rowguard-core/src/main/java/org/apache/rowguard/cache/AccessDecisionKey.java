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
 
package org.apache.rowguard.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Builder;
import lombok.Value;

import org.apache.rowguard.model.access.RlsFilterRequest;
import org.apache.rowguard.model.security.UserSecurityContext;

/**
 * Identifies a cached access decision.
 *
 * <p>Besides user and resource, the key holds everything a compiled filter depends on: the
 * identity fields and attributes of the context, which dynamic conditions read, and the store
 * generations, so any mutation makes earlier entries unreachable.
 */
@Value
@Builder
public class AccessDecisionKey {
  String userId;
  String username;
  String email;
  String connectionId;
  String schemaName;
  String tableName;
  List<String> roles;
  Map<String, Object> attributes;
  long policyGeneration;
  long roleAssignmentGeneration;
  long attributeGeneration;

  public static AccessDecisionKey of(
      RlsFilterRequest request,
      UserSecurityContext context,
      long policyGeneration,
      long roleAssignmentGeneration,
      long attributeGeneration) {
    List<String> roles = new ArrayList<>(context.getRoles());
    Collections.sort(roles);
    return AccessDecisionKey.builder()
        .userId(context.getUserId())
        .username(context.getUsername())
        .email(context.getEmail())
        .connectionId(request.getConnectionId())
        .schemaName(request.getSchemaName())
        .tableName(request.getTableName())
        .roles(Collections.unmodifiableList(roles))
        .attributes(Collections.unmodifiableMap(new TreeMap<>(context.getAttributes())))
        .policyGeneration(policyGeneration)
        .roleAssignmentGeneration(roleAssignmentGeneration)
        .attributeGeneration(attributeGeneration)
        .build();
  }
}
