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
 
package org.apache.rowguard.permission;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.model.permission.ObjectPermission;
import org.apache.rowguard.model.permission.ObjectPermissions;
import org.apache.rowguard.model.permission.PermissionLevel;
import org.apache.rowguard.model.permission.SecurableObjectType;
import org.apache.rowguard.model.security.UserSecurityContext;

/**
 * Evaluates object level permissions. A user holds the highest level granted on the object either
 * directly or through one of their roles.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ObjectPermissionEvaluator {
  private static final ObjectPermissionEvaluator INSTANCE = new ObjectPermissionEvaluator();

  public static ObjectPermissionEvaluator getInstance() {
    return INSTANCE;
  }

  public boolean hasPermission(
      UserSecurityContext user,
      SecurableObjectType objectType,
      String objectId,
      PermissionLevel required,
      Collection<ObjectPermission> permissions) {
    return effectivePermission(user, objectType, objectId, permissions).implies(required);
  }

  public PermissionLevel effectivePermission(
      UserSecurityContext user,
      SecurableObjectType objectType,
      String objectId,
      Collection<ObjectPermission> permissions) {
    PermissionLevel effective = PermissionLevel.NONE;
    for (ObjectPermission permission : permissions) {
      if (appliesTo(permission, objectType, objectId)
          && grantedTo(permission, user)
          && permission.getPermissionLevel().compareTo(effective) > 0) {
        effective = permission.getPermissionLevel();
      }
    }
    return effective;
  }

  /** Collects the permissions on an object together with the user's effective level. */
  public ObjectPermissions describe(
      UserSecurityContext user,
      SecurableObjectType objectType,
      String objectId,
      Collection<ObjectPermission> permissions) {
    List<ObjectPermission> onObject =
        permissions.stream()
            .filter(permission -> appliesTo(permission, objectType, objectId))
            .collect(Collectors.toList());
    return ObjectPermissions.builder()
        .objectType(objectType)
        .objectId(objectId)
        .permissions(onObject)
        .effectivePermission(effectivePermission(user, objectType, objectId, onObject))
        .build();
  }

  private static boolean appliesTo(
      ObjectPermission permission, SecurableObjectType objectType, String objectId) {
    return permission.getObjectType() == objectType && permission.getObjectId().equals(objectId);
  }

  private static boolean grantedTo(ObjectPermission permission, UserSecurityContext user) {
    if (permission.getUserId() != null && permission.getUserId().equals(user.getUserId())) {
      return true;
    }
    return permission.getRoleId() != null && user.getRoles().contains(permission.getRoleId());
  }
}
