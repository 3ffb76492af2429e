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
import lombok.ToString;

import org.apache.rowguard.model.policy.GroupLogic;

/** Two or more predicates joined by AND or OR. Built through {@link Predicates}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class JunctionPredicate extends PredicateNode {
  private final GroupLogic logic;
  private final List<PredicateNode> children;

  JunctionPredicate(GroupLogic logic, List<PredicateNode> children) {
    this.logic = logic;
    this.children = Collections.unmodifiableList(children);
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) {
    return visitor.visitJunction(this);
  }
}
