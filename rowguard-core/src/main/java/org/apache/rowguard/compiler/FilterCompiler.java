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
 
package org.apache.rowguard.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.rowguard.exception.ConditionCompilationException;
import org.apache.rowguard.exception.EmitterException;
import org.apache.rowguard.model.access.ConditionFailure;
import org.apache.rowguard.model.access.FailureReason;
import org.apache.rowguard.model.policy.RlsCondition;
import org.apache.rowguard.model.policy.RlsConditionGroup;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.predicate.ConstantPredicate;
import org.apache.rowguard.predicate.PredicateNode;
import org.apache.rowguard.predicate.Predicates;

/**
 * Compiles a condition group tree into a {@link PredicateNode}.
 *
 * <p>Conditions are resolved by the {@link ConditionEvaluator}, nested groups recursively. A
 * condition that fails to compile becomes an always-false leaf and its failure is reported, so a
 * broken condition can only ever narrow access. Null members of a group are treated the same way.
 * An empty AND group compiles to TRUE, an empty OR group to FALSE. Expressions carrying forbidden
 * SQL tokens are not narrowed but rejected with an {@link EmitterException}.
 */
@Log4j2
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public class FilterCompiler {
  private static final FilterCompiler INSTANCE =
      new FilterCompiler(ConditionEvaluator.getInstance());

  private final ConditionEvaluator conditionEvaluator;

  public static FilterCompiler getInstance() {
    return INSTANCE;
  }

  public CompiledFilter compile(RlsConditionGroup group, UserSecurityContext context) {
    List<ConditionFailure> failures = new ArrayList<>();
    PredicateNode predicate = compileGroup(group, context, failures);
    return new CompiledFilter(predicate, Collections.unmodifiableList(failures));
  }

  private PredicateNode compileGroup(
      RlsConditionGroup group, UserSecurityContext context, List<ConditionFailure> failures) {
    if (group.getConditions() == null || group.getGroups() == null) {
      return malformed(group.getId(), "Group " + group.getId() + " has no member list", failures);
    }
    List<PredicateNode> children =
        new ArrayList<>(group.getConditions().size() + group.getGroups().size());
    for (RlsCondition condition : group.getConditions()) {
      if (condition == null) {
        children.add(
            malformed(group.getId(), "Group " + group.getId() + " has a null condition", failures));
      } else {
        children.add(compileCondition(condition, context, failures));
      }
    }
    for (RlsConditionGroup nested : group.getGroups()) {
      if (nested == null) {
        children.add(
            malformed(group.getId(), "Group " + group.getId() + " has a null group", failures));
      } else {
        children.add(compileGroup(nested, context, failures));
      }
    }
    return Predicates.junction(group.getLogic(), children);
  }

  private PredicateNode compileCondition(
      RlsCondition condition, UserSecurityContext context, List<ConditionFailure> failures) {
    try {
      return conditionEvaluator.resolve(condition, context);
    } catch (ConditionCompilationException e) {
      log.debug(
          "Condition {} evaluates to false for user {}: {}",
          condition.getId(),
          context.getUserId(),
          e.getMessage());
      failures.add(
          ConditionFailure.builder()
              .conditionId(condition.getId())
              .reason(e.getReason())
              .message(e.getMessage())
              .build());
      return ConstantPredicate.FALSE;
    } catch (EmitterException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Condition {} could not be compiled", condition.getId(), e);
      return malformed(
          condition.getId(), "Condition " + condition.getId() + " is malformed", failures);
    }
  }

  private static PredicateNode malformed(
      String conditionId, String message, List<ConditionFailure> failures) {
    failures.add(
        ConditionFailure.builder()
            .conditionId(conditionId)
            .reason(FailureReason.INVALID_CONDITION)
            .message(message)
            .build());
    return ConstantPredicate.FALSE;
  }
}
