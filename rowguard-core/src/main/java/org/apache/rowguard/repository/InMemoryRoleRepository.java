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
 
package org.apache.rowguard.repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import lombok.NonNull;

import org.apache.rowguard.model.security.SecurityRole;
import org.apache.rowguard.spi.repository.RoleRepository;

public class InMemoryRoleRepository implements RoleRepository {
  private final ConcurrentMap<String, SecurityRole> roles = new ConcurrentHashMap<>();

  /** Returns all roles ordered by priority, then id. */
  @Override
  public List<SecurityRole> listRoles() {
    List<SecurityRole> result = new ArrayList<>(roles.values());
    result.sort(
        Comparator.comparingInt(SecurityRole::getPriority).thenComparing(SecurityRole::getId));
    return result;
  }

  @Override
  public Optional<SecurityRole> getRole(String roleId) {
    return Optional.ofNullable(roles.get(roleId));
  }

  @Override
  public SecurityRole save(@NonNull SecurityRole role) {
    roles.put(role.getId(), role);
    return role;
  }

  @Override
  public boolean delete(String roleId) {
    return roles.remove(roleId) != null;
  }
}
