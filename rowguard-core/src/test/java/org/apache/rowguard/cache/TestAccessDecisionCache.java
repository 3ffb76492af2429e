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

import static org.apache.rowguard.testutil.RlsTestData.TABLE_NAME;
import static org.apache.rowguard.testutil.RlsTestData.analyst;
import static org.apache.rowguard.testutil.RlsTestData.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import org.junit.jupiter.api.Test;

import org.apache.rowguard.model.access.RlsFilterRequest;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.resolver.PolicyDecision;

public class TestAccessDecisionCache {
  private static final PolicyDecision DECISION =
      PolicyDecision.builder().response(RlsFilterResponse.unrestricted()).build();

  private final UserSecurityContext context =
      analyst("u1", Collections.singletonMap("region", "West"));
  private final RlsFilterRequest request = request(TABLE_NAME, context);

  @Test
  void testGetAndPut() {
    AccessDecisionCache cache = AccessDecisionCache.create(60);
    AccessDecisionKey key = AccessDecisionKey.of(request, context, 1L, 0L, 0L);

    assertFalse(cache.get(key).isPresent());
    cache.put(key, DECISION);
    assertSame(DECISION, cache.get(AccessDecisionKey.of(request, context, 1L, 0L, 0L)).get());
    assertEquals(1L, cache.stats().hitCount());
    assertEquals(1L, cache.stats().missCount());

    cache.invalidateAll();
    assertFalse(cache.get(key).isPresent());
  }

  @Test
  void testDisabledCache() {
    AccessDecisionCache cache = AccessDecisionCache.create(0);
    AccessDecisionKey key = AccessDecisionKey.of(request, context, 1L, 0L, 0L);
    cache.put(key, DECISION);

    assertFalse(cache.isEnabled());
    assertFalse(cache.get(key).isPresent());
    assertEquals(0L, cache.size());
  }

  @Test
  void testKeyIgnoresRoleOrder() {
    UserSecurityContext first =
        context.toBuilder().roles(new HashSet<>(Arrays.asList("b", "a", "c"))).build();
    UserSecurityContext second =
        context.toBuilder().roles(new HashSet<>(Arrays.asList("c", "b", "a"))).build();
    assertEquals(
        AccessDecisionKey.of(request, first, 1L, 2L, 3L),
        AccessDecisionKey.of(request, second, 1L, 2L, 3L));
  }

  @Test
  void testKeyChangesWithGenerationsAndAttributes() {
    AccessDecisionKey base = AccessDecisionKey.of(request, context, 1L, 1L, 1L);
    assertNotEquals(base, AccessDecisionKey.of(request, context, 2L, 1L, 1L));
    assertNotEquals(base, AccessDecisionKey.of(request, context, 1L, 2L, 1L));
    assertNotEquals(base, AccessDecisionKey.of(request, context, 1L, 1L, 2L));

    Map<String, Object> attributes = new HashMap<>();
    attributes.put("region", "East");
    UserSecurityContext east = context.toBuilder().attributes(attributes).build();
    assertNotEquals(base, AccessDecisionKey.of(request, east, 1L, 1L, 1L));
    assertTrue(base.getRoles().contains("analyst"));
  }
}
