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
 
package org.apache.rowguard.model.access;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Why a single condition was replaced by an always-false predicate. */
public enum FailureReason {
  /** A dynamic condition or expression placeholder referenced an attribute the user lacks. */
  MISSING_ATTRIBUTE("missing_attribute"),
  /** The operands do not match the operator's arity. */
  INVALID_ARITY("invalid_arity"),
  /** An operand has a type that cannot be bound as a SQL parameter. */
  UNSUPPORTED_VALUE("unsupported_value"),
  /** The condition is malformed, e.g. no column or an operand source inconsistent with its type. */
  INVALID_CONDITION("invalid_condition");

  private final String value;

  FailureReason(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static FailureReason fromValue(String value) {
    for (FailureReason reason : values()) {
      if (reason.value.equalsIgnoreCase(value) || reason.name().equalsIgnoreCase(value)) {
        return reason;
      }
    }
    throw new IllegalArgumentException("Unknown failure reason: " + value);
  }
}
