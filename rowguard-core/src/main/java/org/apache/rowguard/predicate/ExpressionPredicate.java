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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.google.common.base.Preconditions;

/**
 * An administrator-authored SQL fragment. The text is split around its bound values: {@code
 * fragments} always holds exactly one element more than {@code parameters} and the fragment at
 * index {@code i} precedes parameter {@code i}.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class ExpressionPredicate extends PredicateNode {
  private final String conditionId;
  private final List<String> fragments;
  private final List<Object> parameters;

  public ExpressionPredicate(String conditionId, List<String> fragments, List<Object> parameters) {
    Preconditions.checkArgument(
        fragments.size() == parameters.size() + 1,
        "Expression must have one more fragment than parameters");
    this.conditionId = conditionId;
    this.fragments = Collections.unmodifiableList(new ArrayList<>(fragments));
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  public static ExpressionPredicate ofText(String conditionId, String text) {
    return new ExpressionPredicate(
        conditionId, Collections.singletonList(text), Collections.emptyList());
  }

  /** The expression text with every bound value shown as {@code ?}. */
  public String getTemplate() {
    return String.join("?", fragments);
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) {
    return visitor.visitExpression(this);
  }
}
