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
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.commons.lang3.StringUtils;

import org.apache.rowguard.exception.ConditionCompilationException;
import org.apache.rowguard.exception.EmitterException;
import org.apache.rowguard.model.access.FailureReason;
import org.apache.rowguard.model.policy.RlsCondition;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.predicate.ExpressionPredicate;
import org.apache.rowguard.sql.ExpressionGuard;

/**
 * Turns an expression condition into an {@link ExpressionPredicate}. Placeholders are replaced by
 * bound parameters, a list value expands to a parenthesized parameter list. An expression with a
 * forbidden SQL token is rejected before any value is bound.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
class ExpressionBinder {
  static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.]+)\\s*}}");

  static ExpressionPredicate bind(RlsCondition condition, UserSecurityContext context) {
    String expression = condition.getExpression();
    if (StringUtils.isBlank(expression)) {
      throw new ConditionCompilationException(
          condition.getId(), FailureReason.INVALID_CONDITION, "Expression condition is empty");
    }
    Optional<String> forbidden = ExpressionGuard.findForbiddenToken(expression);
    if (forbidden.isPresent()) {
      throw new EmitterException(
          String.format(
              "Expression of condition %s contains forbidden token '%s'",
              condition.getId(), forbidden.get()));
    }
    List<String> fragments = new ArrayList<>();
    List<Object> parameters = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    Matcher matcher = PLACEHOLDER.matcher(expression);
    int position = 0;
    while (matcher.find()) {
      current.append(expression, position, matcher.start());
      Object value =
          AttributeResolver.resolvePlaceholder(condition.getId(), matcher.group(1), context);
      if (OperandValues.isList(value)) {
        List<Object> values = OperandValues.asList(value);
        if (values.isEmpty()) {
          throw new ConditionCompilationException(
              condition.getId(),
              FailureReason.INVALID_ARITY,
              "Placeholder {{" + matcher.group(1) + "}} resolved to an empty list");
        }
        current.append('(');
        for (int i = 0; i < values.size(); i++) {
          if (i > 0) {
            current.append(", ");
          }
          fragments.add(current.toString());
          parameters.add(OperandValues.scalar(condition.getId(), values.get(i)));
          current.setLength(0);
        }
        current.append(')');
      } else {
        fragments.add(current.toString());
        parameters.add(OperandValues.scalar(condition.getId(), value));
        current.setLength(0);
      }
      position = matcher.end();
    }
    current.append(expression.substring(position));
    fragments.add(current.toString());
    return new ExpressionPredicate(condition.getId(), fragments, parameters);
  }
}
