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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import org.apache.rowguard.model.policy.GroupLogic;
import org.apache.rowguard.model.policy.RlsOperator;

public class TestPredicates {
  private static final PredicateNode REGION =
      new ComparisonPredicate(
          "c1", "region", RlsOperator.EQUALS, Collections.singletonList("West"));
  private static final PredicateNode OWNER =
      new ComparisonPredicate(
          "c2", "owner_id", RlsOperator.EQUALS, Collections.singletonList("u1"));

  @Test
  void testEmptyJunctionsAreNeutral() {
    assertSame(
        ConstantPredicate.TRUE, Predicates.junction(GroupLogic.AND, Collections.emptyList()));
    assertSame(
        ConstantPredicate.FALSE, Predicates.junction(GroupLogic.OR, Collections.emptyList()));
  }

  @Test
  void testAndFolding() {
    assertSame(REGION, Predicates.and(ConstantPredicate.TRUE, REGION));
    assertSame(ConstantPredicate.FALSE, Predicates.and(REGION, ConstantPredicate.FALSE, OWNER));
    assertSame(ConstantPredicate.TRUE, Predicates.and(ConstantPredicate.TRUE));
  }

  @Test
  void testOrFolding() {
    assertSame(REGION, Predicates.or(ConstantPredicate.FALSE, REGION));
    assertSame(ConstantPredicate.TRUE, Predicates.or(REGION, ConstantPredicate.TRUE));
    assertTrue(Predicates.or(ConstantPredicate.FALSE, ConstantPredicate.FALSE).isAlwaysFalse());
  }

  @Test
  void testJunctionKeepsChildOrder() {
    PredicateNode node = Predicates.and(REGION, ConstantPredicate.TRUE, OWNER);
    assertTrue(node instanceof JunctionPredicate);
    JunctionPredicate junction = (JunctionPredicate) node;
    assertEquals(GroupLogic.AND, junction.getLogic());
    assertEquals(Arrays.asList(REGION, OWNER), junction.getChildren());
  }

  @Test
  void testExpressionTemplate() {
    ExpressionPredicate expression =
        new ExpressionPredicate(
            "e1", Arrays.asList("a = ", " OR b = ", ""), Arrays.asList((Object) 1, "x"));
    assertEquals("a = ? OR b = ?", expression.getTemplate());
  }
}
