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

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import lombok.NonNull;

import org.apache.rowguard.model.security.UserRoleMapping;
import org.apache.rowguard.spi.repository.UserRoleRepository;

public class InMemoryUserRoleRepository implements UserRoleRepository {
  private final ConcurrentMap<String, UserRoleMapping> mappings = new ConcurrentHashMap<>();
  private final AtomicLong generation = new AtomicLong();

  @Override
  public Optional<UserRoleMapping> getMapping(String userId) {
    return Optional.ofNullable(mappings.get(userId));
  }

  @Override
  public UserRoleMapping save(@NonNull UserRoleMapping mapping) {
    mappings.put(mapping.getUserId(), mapping);
    generation.incrementAndGet();
    return mapping;
  }

  @Override
  public boolean delete(String userId) {
    boolean removed = mappings.remove(userId) != null;
    if (removed) {
      generation.incrementAndGet();
    }
    return removed;
  }

  @Override
  public long getGeneration() {
    return generation.get();
  }
}
