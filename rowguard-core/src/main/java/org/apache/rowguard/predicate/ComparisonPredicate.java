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
 
package org.apache.rowguard.predicate;

import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import org.apache.rowguard.model.policy.RlsOperator;

/**
 * A column compared against resolved operands. The number of operands matches the operator's
 * arity: none for null checks, one for scalar operators, two for ranges and one or more for lists.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class ComparisonPredicate extends PredicateNode {
  private final String conditionId;
  private final String column;
  private final RlsOperator operator;
  private final List<Object> operands;

  public ComparisonPredicate(
      String conditionId,
      @NonNull String column,
      @NonNull RlsOperator operator,
      @NonNull List<Object> operands) {
    this.conditionId = conditionId;
    this.column = column;
    this.operator = operator;
    this.operands = Collections.unmodifiableList(operands);
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) {
    return visitor.visitComparison(this);
  }
}
