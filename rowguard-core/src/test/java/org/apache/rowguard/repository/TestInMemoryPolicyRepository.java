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

import static org.apache.rowguard.testutil.RlsTestData.ownerPolicy;
import static org.apache.rowguard.testutil.RlsTestData.regionPolicy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import org.apache.rowguard.exception.PolicyValidationException;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.validation.PolicyValidator;

public class TestInMemoryPolicyRepository {
  private final InMemoryPolicyRepository repository =
      new InMemoryPolicyRepository(new PolicyValidator(16, null));

  @Test
  void testSaveAndGet() {
    repository.save(ownerPolicy());
    repository.save(regionPolicy());

    assertEquals(2, repository.listPolicies().size());
    assertEquals(ownerPolicy(), repository.getPolicy("owner_filter").get());
    assertFalse(repository.getPolicy("missing").isPresent());
  }

  @Test
  void testGenerationAdvancesOnChange() {
    assertEquals(0L, repository.getGeneration());
    repository.save(ownerPolicy());
    assertEquals(1L, repository.getGeneration());

    assertTrue(repository.delete("owner_filter"));
    assertEquals(2L, repository.getGeneration());

    assertFalse(repository.delete("owner_filter"));
    assertEquals(2L, repository.getGeneration());
  }

  @Test
  void testSetEnabled() {
    repository.save(ownerPolicy());

    assertFalse(repository.setEnabled("owner_filter", false).get().isEnabled());
    assertFalse(repository.getPolicy("owner_filter").get().isEnabled());
    assertEquals(2L, repository.getGeneration());

    assertFalse(repository.setEnabled("missing", true).isPresent());
    assertEquals(2L, repository.getGeneration());
  }

  @Test
  void testInvalidPolicyIsRejected() {
    RlsPolicy invalid = ownerPolicy().toBuilder().roleIds(Collections.emptySet()).build();

    assertThrows(PolicyValidationException.class, () -> repository.save(invalid));
    assertTrue(repository.listPolicies().isEmpty());
    assertEquals(0L, repository.getGeneration());
  }
}
