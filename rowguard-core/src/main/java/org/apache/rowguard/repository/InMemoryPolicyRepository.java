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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.spi.repository.PolicyRepository;
import org.apache.rowguard.validation.PolicyValidator;

/** Thread safe, process local {@link PolicyRepository}. Policies are validated when saved. */
@Log4j2
public class InMemoryPolicyRepository implements PolicyRepository {
  private final ConcurrentMap<String, RlsPolicy> policies = new ConcurrentHashMap<>();
  private final AtomicLong generation = new AtomicLong();
  private final PolicyValidator validator;

  /**
   * @param validator (optional) validator applied to every saved policy
   */
  public InMemoryPolicyRepository(PolicyValidator validator) {
    this.validator = validator;
  }

  @Override
  public List<RlsPolicy> listPolicies() {
    return new ArrayList<>(policies.values());
  }

  @Override
  public Optional<RlsPolicy> getPolicy(String policyId) {
    return Optional.ofNullable(policies.get(policyId));
  }

  @Override
  public RlsPolicy save(@NonNull RlsPolicy policy) {
    if (validator != null) {
      validator.validate(policy);
    }
    policies.put(policy.getId(), policy);
    long current = generation.incrementAndGet();
    log.debug("Saved policy {}, generation {}", policy.getId(), current);
    return policy;
  }

  /**
   * Enables or disables a stored policy.
   *
   * @return the updated policy, empty if no policy has the id
   */
  public Optional<RlsPolicy> setEnabled(String policyId, boolean enabled) {
    RlsPolicy updated =
        policies.computeIfPresent(
            policyId, (id, policy) -> policy.toBuilder().enabled(enabled).build());
    if (updated == null) {
      return Optional.empty();
    }
    generation.incrementAndGet();
    log.debug("Policy {} enabled: {}", policyId, enabled);
    return Optional.of(updated);
  }

  @Override
  public boolean delete(String policyId) {
    boolean removed = policies.remove(policyId) != null;
    if (removed) {
      generation.incrementAndGet();
      log.debug("Deleted policy {}", policyId);
    }
    return removed;
  }

  @Override
  public long getGeneration() {
    return generation.get();
  }
}
