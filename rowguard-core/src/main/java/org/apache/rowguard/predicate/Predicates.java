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
import java.util.Arrays;
import java.util.List;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.model.policy.GroupLogic;

/** Factory for junctions that folds constants away. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class Predicates {

  /**
   * Joins {@code children} with {@code logic}.
   *
   * <p>The neutral element of the logic (TRUE for AND, FALSE for OR) is dropped and the absorbing
   * element (FALSE for AND, TRUE for OR) collapses the whole junction. No children yields the
   * neutral element, a single remaining child is returned as is. Nested junctions with the same
   * logic are kept as written, so the rendered filter mirrors the authored group structure.
   */
  public static PredicateNode junction(GroupLogic logic, List<PredicateNode> children) {
    ConstantPredicate neutral =
        logic == GroupLogic.AND ? ConstantPredicate.TRUE : ConstantPredicate.FALSE;
    ConstantPredicate absorbing =
        logic == GroupLogic.AND ? ConstantPredicate.FALSE : ConstantPredicate.TRUE;
    List<PredicateNode> kept = new ArrayList<>(children.size());
    for (PredicateNode child : children) {
      if (child.equals(absorbing)) {
        return absorbing;
      }
      if (!child.equals(neutral)) {
        kept.add(child);
      }
    }
    if (kept.isEmpty()) {
      return neutral;
    }
    if (kept.size() == 1) {
      return kept.get(0);
    }
    return new JunctionPredicate(logic, kept);
  }

  public static PredicateNode and(PredicateNode... children) {
    return junction(GroupLogic.AND, Arrays.asList(children));
  }

  public static PredicateNode or(PredicateNode... children) {
    return junction(GroupLogic.OR, Arrays.asList(children));
  }
}
