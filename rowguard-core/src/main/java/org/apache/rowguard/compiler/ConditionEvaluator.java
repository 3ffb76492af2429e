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

import java.util.List;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.exception.ConditionCompilationException;
import org.apache.rowguard.exception.MissingAttributeException;
import org.apache.rowguard.model.access.FailureReason;
import org.apache.rowguard.model.policy.RlsCondition;
import org.apache.rowguard.model.policy.RlsOperator;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.predicate.ComparisonPredicate;
import org.apache.rowguard.predicate.PredicateNode;
import org.apache.rowguard.sql.Identifiers;

/**
 * Resolves a single {@link RlsCondition} against a user's security context into a bound leaf
 * predicate.
 *
 * <ul>
 *   <li>STATIC conditions bind the stored value(s).
 *   <li>DYNAMIC conditions read the operand from the context. A missing attribute raises {@link
 *       MissingAttributeException}; callers must treat the condition as always false.
 *   <li>EXPRESSION conditions keep the administrator's SQL text, binding its placeholders.
 * </ul>
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ConditionEvaluator {
  private static final ConditionEvaluator INSTANCE = new ConditionEvaluator();

  public static ConditionEvaluator getInstance() {
    return INSTANCE;
  }

  /**
   * @throws ConditionCompilationException if the condition is malformed, its operands do not fit
   *     the operator or a referenced attribute is missing
   */
  public PredicateNode resolve(RlsCondition condition, UserSecurityContext context) {
    switch (condition.getFilterType()) {
      case STATIC:
        checkColumn(condition);
        return comparison(
            condition,
            OperandValues.forOperator(
                condition.getId(),
                condition.getOperator(),
                condition.getValue(),
                condition.getValue2(),
                false));
      case DYNAMIC:
        checkColumn(condition);
        if (condition.getOperator().getArity() == RlsOperator.Arity.NONE) {
          throw new ConditionCompilationException(
              condition.getId(),
              FailureReason.INVALID_ARITY,
              String.format(
                  "Operator %s takes no operand and cannot be dynamic",
                  condition.getOperator().getValue()));
        }
        Object attribute = AttributeResolver.resolve(condition, context);
        return comparison(
            condition,
            OperandValues.forOperator(
                condition.getId(), condition.getOperator(), attribute, null, true));
      case EXPRESSION:
        return ExpressionBinder.bind(condition, context);
      default:
        throw new ConditionCompilationException(
            condition.getId(),
            FailureReason.INVALID_CONDITION,
            "Unsupported filter type " + condition.getFilterType());
    }
  }

  private static void checkColumn(RlsCondition condition) {
    if (!Identifiers.isValid(condition.getColumn())) {
      throw new ConditionCompilationException(
          condition.getId(),
          FailureReason.INVALID_CONDITION,
          "Invalid column identifier: " + condition.getColumn());
    }
  }

  private static ComparisonPredicate comparison(RlsCondition condition, List<Object> operands) {
    return new ComparisonPredicate(
        condition.getId(), condition.getColumn(), condition.getOperator(), operands);
  }
}
