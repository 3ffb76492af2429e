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
 
package org.apache.rowguard.context;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

import org.apache.rowguard.exception.StoreUnavailableException;
import org.apache.rowguard.model.security.UserRoleMapping;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.spi.repository.UserAttributeRepository;
import org.apache.rowguard.spi.repository.UserRoleRepository;

/**
 * Builds the immutable context a request is evaluated with.
 *
 * <p>The roles of the request are extended with those of the user's role mapping when the mapping
 * is effective. Stored attributes are added below the request's own attributes, so a value sent
 * with the request wins. Either repository may be absent.
 */
@Log4j2
public class SecurityContextResolver {
  private final UserRoleRepository userRoleRepository;
  private final UserAttributeRepository userAttributeRepository;
  private final StoreCalls storeCalls;

  public SecurityContextResolver(
      UserRoleRepository userRoleRepository,
      UserAttributeRepository userAttributeRepository,
      StoreCalls storeCalls) {
    this.userRoleRepository = userRoleRepository;
    this.userAttributeRepository = userAttributeRepository;
    this.storeCalls = storeCalls;
  }

  /**
   * @throws StoreUnavailableException if a repository fails or does not answer in time
   */
  public UserSecurityContext resolve(
      UserSecurityContext requestContext, Instant now, long timeoutMillis) {
    String userId = requestContext.getUserId();
    Set<String> roles = new HashSet<>(requestContext.getRoles());
    if (userRoleRepository != null) {
      Optional<UserRoleMapping> mapping =
          storeCalls.call(
              "Role mapping lookup", timeoutMillis, () -> userRoleRepository.getMapping(userId));
      if (mapping.isPresent()) {
        if (mapping.get().isEffectiveAt(now)) {
          roles.addAll(mapping.get().getRoleIds());
        } else {
          log.debug("Role mapping of user {} is not effective at {}", userId, now);
        }
      }
    }
    Map<String, Object> attributes = new HashMap<>();
    if (userAttributeRepository != null) {
      Map<String, Object> stored =
          storeCalls.call(
              "Attribute lookup",
              timeoutMillis,
              () -> userAttributeRepository.getAttributes(userId));
      if (stored != null) {
        attributes.putAll(stored);
      }
    }
    attributes.putAll(requestContext.getAttributes());
    return requestContext.toBuilder()
        .roles(Collections.unmodifiableSet(roles))
        .attributes(Collections.unmodifiableMap(attributes))
        .build();
  }
}
