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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import org.apache.rowguard.model.security.UserAttributeType;

/**
 * A single comparison in a policy filter.
 *
 * <p>Exactly one operand source is populated, consistent with {@link #filterType}:
 *
 * <ul>
 *   <li>{@link RlsFilterType#STATIC}: {@link #value} (and {@link #value2} for range operators)
 *   <li>{@link RlsFilterType#DYNAMIC}: {@link #userAttribute} and/or {@link #customAttribute}
 *   <li>{@link RlsFilterType#EXPRESSION}: {@link #expression}
 * </ul>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RlsCondition {
  @NonNull String id;

  /** Column the condition filters on, optionally qualified ({@code alias.column}). */
  String column;

  @NonNull RlsOperator operator;

  @NonNull @Builder.Default RlsFilterType filterType = RlsFilterType.STATIC;

  /**
   * Static operand. A list for {@code in}/{@code not_in}; the lower bound, or a two element list,
   * for range operators.
   */
  Object value;

  /** Upper bound of a static range operator. */
  Object value2;

  UserAttributeType userAttribute;

  String customAttribute;

  /**
   * Administrator-authored SQL fragment. May reference {@code {{user_id}}}, {@code {{username}}},
   * {@code {{email}}} and {@code {{attr.<name>}}}, which are bound as parameters.
   */
  String expression;
}
