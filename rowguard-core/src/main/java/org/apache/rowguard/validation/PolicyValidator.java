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
 
package org.apache.rowguard.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import org.apache.rowguard.compiler.ConditionEvaluator;
import org.apache.rowguard.exception.ConditionCompilationException;
import org.apache.rowguard.exception.MissingAttributeException;
import org.apache.rowguard.exception.PolicyValidationException;
import org.apache.rowguard.model.policy.RlsCondition;
import org.apache.rowguard.model.policy.RlsConditionGroup;
import org.apache.rowguard.model.policy.RlsFilterType;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.spi.repository.RoleRepository;
import org.apache.rowguard.sql.ExpressionGuard;

/**
 * Checks policies before they are stored, so that evaluation only ever sees well formed trees.
 *
 * <p>Conditions are compiled against a sample context. Attributes the sample lacks are expected,
 * they depend on the user, but any other compilation error is a violation.
 */
@Log4j2
public class PolicyValidator {
  private static final UserSecurityContext SAMPLE_CONTEXT =
      UserSecurityContext.builder()
          .userId("policy-validator")
          .username("policy-validator")
          .email("policy-validator@localhost")
          .roles(Collections.singleton("policy-validator"))
          .build();

  private final int maxGroupDepth;
  private final RoleRepository roleRepository;
  private final ConditionEvaluator conditionEvaluator;

  /**
   * @param maxGroupDepth deepest accepted group nesting, the root group is at depth 1
   * @param roleRepository (optional) when present, every role id must exist in it
   */
  public PolicyValidator(int maxGroupDepth, RoleRepository roleRepository) {
    this.maxGroupDepth = maxGroupDepth;
    this.roleRepository = roleRepository;
    this.conditionEvaluator = ConditionEvaluator.getInstance();
  }

  /**
   * @throws PolicyValidationException listing every violation found
   */
  public void validate(RlsPolicy policy) {
    List<String> violations = findViolations(policy);
    if (!violations.isEmpty()) {
      log.info("Rejected policy {}: {}", policy.getId(), violations);
      throw new PolicyValidationException(policy.getId(), violations);
    }
  }

  public List<String> findViolations(RlsPolicy policy) {
    List<String> violations = new ArrayList<>();
    if (StringUtils.isBlank(policy.getId())) {
      violations.add("policy id is blank");
    }
    if (StringUtils.isBlank(policy.getName())) {
      violations.add("policy name is blank");
    }
    checkRoles(policy.getRoleIds(), violations);
    checkGroup(
        policy.getFilterGroup(),
        1,
        Collections.newSetFromMap(new IdentityHashMap<>()),
        violations);
    return violations;
  }

  private void checkRoles(Set<String> roleIds, List<String> violations) {
    if (roleIds == null || roleIds.isEmpty()) {
      violations.add("policy must target at least one role");
      return;
    }
    for (String roleId : roleIds) {
      if (StringUtils.isBlank(roleId)) {
        violations.add("role id is blank");
      } else if (roleRepository != null && !roleRepository.getRole(roleId).isPresent()) {
        violations.add("unknown role " + roleId);
      }
    }
  }

  private void checkGroup(
      RlsConditionGroup group, int depth, Set<RlsConditionGroup> path, List<String> violations) {
    if (!path.add(group)) {
      violations.add("group " + group.getId() + " contains itself");
      return;
    }
    if (depth > maxGroupDepth) {
      violations.add(
          String.format(
              "group %s is nested %d levels deep, at most %d allowed",
              group.getId(), depth, maxGroupDepth));
      path.remove(group);
      return;
    }
    if (group.getConditions() == null) {
      violations.add("group " + group.getId() + " has no condition list");
    } else {
      for (RlsCondition condition : group.getConditions()) {
        if (condition == null) {
          violations.add("group " + group.getId() + " contains a null condition");
        } else {
          checkCondition(condition, violations);
        }
      }
    }
    if (group.getGroups() == null) {
      violations.add("group " + group.getId() + " has no group list");
    } else {
      for (RlsConditionGroup nested : group.getGroups()) {
        if (nested == null) {
          violations.add("group " + group.getId() + " contains a null group");
        } else {
          checkGroup(nested, depth + 1, path, violations);
        }
      }
    }
    path.remove(group);
  }

  private void checkCondition(RlsCondition condition, List<String> violations) {
    if (condition.getFilterType() == RlsFilterType.EXPRESSION
        && StringUtils.isNotBlank(condition.getExpression())) {
      Optional<String> forbidden = ExpressionGuard.findForbiddenToken(condition.getExpression());
      if (forbidden.isPresent()) {
        violations.add(
            String.format(
                "condition %s: expression contains forbidden token '%s'",
                condition.getId(), forbidden.get()));
        return;
      }
    }
    try {
      conditionEvaluator.resolve(condition, SAMPLE_CONTEXT);
    } catch (MissingAttributeException e) {
      log.debug(
          "Condition {} reads attribute {} at evaluation time",
          condition.getId(),
          e.getAttributeName());
    } catch (ConditionCompilationException e) {
      violations.add(String.format("condition %s: %s", condition.getId(), e.getMessage()));
    }
  }
}
