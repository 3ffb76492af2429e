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

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.exception.ConditionCompilationException;
import org.apache.rowguard.model.access.FailureReason;
import org.apache.rowguard.model.policy.RlsOperator;

/** Shapes raw operand values into the operand list an operator's arity requires. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
class OperandValues {

  static boolean isList(Object value) {
    return value instanceof Collection || value instanceof Object[];
  }

  static List<Object> asList(Object value) {
    if (value instanceof Collection) {
      return new ArrayList<>((Collection<?>) value);
    }
    if (value instanceof Object[]) {
      return new ArrayList<>(Arrays.asList((Object[]) value));
    }
    return Collections.singletonList(value);
  }

  /**
   * Checks that {@code value} can be bound as a single SQL parameter: strings, finite numbers,
   * booleans, java.time values and UUIDs.
   */
  static Object scalar(String conditionId, Object value) {
    if (value == null) {
      throw new ConditionCompilationException(
          conditionId, FailureReason.INVALID_ARITY, "Operand must not be null");
    }
    if (value instanceof Double || value instanceof Float) {
      double number = ((Number) value).doubleValue();
      if (Double.isNaN(number) || Double.isInfinite(number)) {
        throw new ConditionCompilationException(
            conditionId, FailureReason.UNSUPPORTED_VALUE, "Operand must be a finite number");
      }
      return value;
    }
    if (value instanceof String
        || value instanceof Number
        || value instanceof Boolean
        || value instanceof Temporal
        || value instanceof UUID) {
      return value;
    }
    if (value instanceof Character) {
      return value.toString();
    }
    if (isList(value)) {
      throw new ConditionCompilationException(
          conditionId, FailureReason.INVALID_ARITY, "Expected a single value but got a list");
    }
    throw new ConditionCompilationException(
        conditionId,
        FailureReason.UNSUPPORTED_VALUE,
        "Unsupported operand type " + value.getClass().getName());
  }

  /**
   * Builds the operand list for {@code operator}.
   *
   * @param value the first operand, a list for list operators or, for range operators, either the
   *     lower bound or a two element list
   * @param value2 the upper bound of a range operator
   * @param promoteScalar whether a single value is accepted where a list is required
   */
  static List<Object> forOperator(
      String conditionId,
      RlsOperator operator,
      Object value,
      Object value2,
      boolean promoteScalar) {
    switch (operator.getArity()) {
      case NONE:
        if (value != null || value2 != null) {
          throw arityViolation(conditionId, operator, "takes no operand");
        }
        return Collections.emptyList();
      case SCALAR:
        if (value2 != null) {
          throw arityViolation(conditionId, operator, "takes exactly one operand");
        }
        if (value == null || isList(value)) {
          throw arityViolation(conditionId, operator, "requires exactly one scalar operand");
        }
        return Collections.singletonList(scalar(conditionId, value));
      case RANGE:
        return range(conditionId, operator, value, value2);
      case LIST:
        if (value2 != null) {
          throw arityViolation(conditionId, operator, "takes a single list operand");
        }
        if (value == null || (!isList(value) && !promoteScalar)) {
          throw arityViolation(conditionId, operator, "requires a list operand");
        }
        List<Object> values = asList(value);
        if (values.isEmpty()) {
          throw arityViolation(conditionId, operator, "requires a non-empty list");
        }
        List<Object> operands = new ArrayList<>(values.size());
        for (Object element : values) {
          operands.add(scalar(conditionId, element));
        }
        return operands;
      default:
        throw new ConditionCompilationException(
            conditionId, FailureReason.INVALID_CONDITION, "Unsupported operator " + operator);
    }
  }

  private static List<Object> range(
      String conditionId, RlsOperator operator, Object value, Object value2) {
    Object lower;
    Object upper;
    if (value2 == null && isList(value)) {
      List<Object> bounds = asList(value);
      if (bounds.size() != 2) {
        throw arityViolation(conditionId, operator, "requires exactly two bounds");
      }
      lower = bounds.get(0);
      upper = bounds.get(1);
    } else {
      lower = value;
      upper = value2;
    }
    if (lower == null || upper == null) {
      throw arityViolation(conditionId, operator, "requires a lower and an upper bound");
    }
    return Arrays.asList(scalar(conditionId, lower), scalar(conditionId, upper));
  }

  private static ConditionCompilationException arityViolation(
      String conditionId, RlsOperator operator, String detail) {
    return new ConditionCompilationException(
        conditionId,
        FailureReason.INVALID_ARITY,
        String.format("Operator %s %s", operator.getValue(), detail));
  }
}
