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
import java.util.Map;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.exception.ConditionCompilationException;
import org.apache.rowguard.exception.MissingAttributeException;
import org.apache.rowguard.model.access.FailureReason;
import org.apache.rowguard.model.policy.RlsCondition;
import org.apache.rowguard.model.security.UserAttributeType;
import org.apache.rowguard.model.security.UserSecurityContext;

/** Reads dynamic operands from a user's security context. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
class AttributeResolver {

  /**
   * Resolves the attribute a dynamic condition refers to.
   *
   * @throws MissingAttributeException if the attribute is absent or null
   */
  static Object resolve(RlsCondition condition, UserSecurityContext context) {
    UserAttributeType type = condition.getUserAttribute();
    String custom = condition.getCustomAttribute();
    if (type == null) {
      if (custom == null || custom.isEmpty()) {
        throw new ConditionCompilationException(
            condition.getId(),
            FailureReason.INVALID_CONDITION,
            "Dynamic condition names no user attribute");
      }
      return require(condition, custom, context.getAttributes().get(custom));
    }
    switch (type) {
      case USER_ID:
        return require(condition, type.getValue(), context.getUserId());
      case USERNAME:
        return require(condition, type.getValue(), context.getUsername());
      case EMAIL:
        return require(condition, type.getValue(), context.getEmail());
      case ROLE:
        if (context.getRoles().isEmpty()) {
          throw new MissingAttributeException(condition.getId(), type.getValue());
        }
        List<Object> roles = new ArrayList<>(context.getRoles());
        roles.sort(null);
        return Collections.unmodifiableList(roles);
      case CUSTOM:
        if (custom == null || custom.isEmpty()) {
          throw new ConditionCompilationException(
              condition.getId(),
              FailureReason.INVALID_CONDITION,
              "Custom user attribute requires a custom attribute name");
        }
        return require(condition, custom, context.getAttributes().get(custom));
      default:
        Map<String, Object> attributes = context.getAttributes();
        if (attributes.get(type.getValue()) != null) {
          return attributes.get(type.getValue());
        }
        if (custom != null && attributes.get(custom) != null) {
          return attributes.get(custom);
        }
        throw new MissingAttributeException(condition.getId(), type.getValue());
    }
  }

  /** Resolves an expression placeholder such as {@code user_id} or {@code attr.region}. */
  static Object resolvePlaceholder(
      String conditionId, String placeholder, UserSecurityContext context) {
    switch (placeholder) {
      case "user_id":
        return requireValue(conditionId, placeholder, context.getUserId());
      case "username":
        return requireValue(conditionId, placeholder, context.getUsername());
      case "email":
        return requireValue(conditionId, placeholder, context.getEmail());
      default:
        if (placeholder.startsWith("attr.") && placeholder.length() > "attr.".length()) {
          String name = placeholder.substring("attr.".length());
          return requireValue(conditionId, name, context.getAttributes().get(name));
        }
        throw new ConditionCompilationException(
            conditionId,
            FailureReason.INVALID_CONDITION,
            "Unknown expression placeholder {{" + placeholder + "}}");
    }
  }

  private static Object require(RlsCondition condition, String name, Object value) {
    return requireValue(condition.getId(), name, value);
  }

  private static Object requireValue(String conditionId, String name, Object value) {
    if (value == null) {
      throw new MissingAttributeException(conditionId, name);
    }
    return value;
  }
}
