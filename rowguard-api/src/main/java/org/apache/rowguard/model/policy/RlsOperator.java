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
 
package org.apache.rowguard.model.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of comparison operators a condition may use. Each operator fixes the number and
 * shape of operands it accepts, see {@link Arity}.
 */
public enum RlsOperator {
  EQUALS("equals", Arity.SCALAR),
  NOT_EQUALS("not_equals", Arity.SCALAR),
  IN("in", Arity.LIST),
  NOT_IN("not_in", Arity.LIST),
  CONTAINS("contains", Arity.SCALAR),
  STARTS_WITH("starts_with", Arity.SCALAR),
  GREATER_THAN("greater_than", Arity.SCALAR),
  LESS_THAN("less_than", Arity.SCALAR),
  BETWEEN("between", Arity.RANGE),
  NOT_BETWEEN("not_between", Arity.RANGE),
  IS_NULL("is_null", Arity.NONE),
  IS_NOT_NULL("is_not_null", Arity.NONE);

  /** Operand shape required by an operator. */
  public enum Arity {
    /** No operand at all. */
    NONE,
    /** Exactly one scalar. */
    SCALAR,
    /** Two scalars, a lower and an upper bound. */
    RANGE,
    /** A non-empty list of scalars. */
    LIST
  }

  private final String value;
  private final Arity arity;

  RlsOperator(String value, Arity arity) {
    this.value = value;
    this.arity = arity;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public Arity getArity() {
    return arity;
  }

  @JsonCreator
  public static RlsOperator fromValue(String value) {
    for (RlsOperator operator : values()) {
      if (operator.value.equalsIgnoreCase(value) || operator.name().equalsIgnoreCase(value)) {
        return operator;
      }
    }
    throw new IllegalArgumentException("Unknown operator: " + value);
  }
}
