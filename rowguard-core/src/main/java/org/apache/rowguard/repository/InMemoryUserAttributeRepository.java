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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import lombok.NonNull;

import org.apache.rowguard.spi.repository.UserAttributeRepository;

public class InMemoryUserAttributeRepository implements UserAttributeRepository {
  private final ConcurrentMap<String, ConcurrentMap<String, Object>> attributes =
      new ConcurrentHashMap<>();
  private final AtomicLong generation = new AtomicLong();

  @Override
  public Map<String, Object> getAttributes(String userId) {
    Map<String, Object> stored = attributes.get(userId);
    return stored == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new HashMap<>(stored));
  }

  @Override
  public void putAttribute(String userId, @NonNull String name, @NonNull Object value) {
    attributes.computeIfAbsent(userId, id -> new ConcurrentHashMap<>()).put(name, value);
    generation.incrementAndGet();
  }

  @Override
  public void removeAttribute(String userId, String name) {
    Map<String, Object> stored = attributes.get(userId);
    if (stored != null && stored.remove(name) != null) {
      generation.incrementAndGet();
    }
  }

  @Override
  public long getGeneration() {
    return generation.get();
  }
}
