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
 
package org.apache.rowguard.spi.repository;

import java.util.List;
import java.util.Optional;

import org.apache.rowguard.annotations.Evolving;
import org.apache.rowguard.model.policy.RlsPolicy;

/**
 * Store of row-level security policies.
 *
 * <p>Implementations must increment the value returned by {@link #getGeneration()} on every
 * mutation. The access decision cache includes the generation in its keys, so a decision computed
 * before a mutation is never served after it.
 */
@Evolving
public interface PolicyRepository {

  /** Returns a snapshot of every stored policy, enabled or not. */
  List<RlsPolicy> listPolicies();

  Optional<RlsPolicy> getPolicy(String policyId);

  /**
   * Creates or replaces the policy with the same id.
   *
   * @return the stored policy
   */
  RlsPolicy save(RlsPolicy policy);

  /**
   * Deletes a policy.
   *
   * @return true if a policy with the id existed
   */
  boolean delete(String policyId);

  /** Monotonic counter bumped by every mutation. */
  long getGeneration();
}
