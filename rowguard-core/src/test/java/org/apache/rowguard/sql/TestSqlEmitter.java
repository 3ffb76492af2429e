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
 
package org.apache.rowguard.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import org.apache.rowguard.exception.EmitterException;
import org.apache.rowguard.model.policy.CombinationStrategy;
import org.apache.rowguard.model.policy.RlsOperator;
import org.apache.rowguard.model.sql.ParameterizedClause;
import org.apache.rowguard.model.sql.SqlDialect;
import org.apache.rowguard.predicate.ComparisonPredicate;
import org.apache.rowguard.predicate.ConstantPredicate;
import org.apache.rowguard.predicate.ExpressionPredicate;
import org.apache.rowguard.predicate.PredicateNode;
import org.apache.rowguard.predicate.Predicates;

public class TestSqlEmitter {
  private final SqlEmitter emitter = SqlEmitter.getInstance();

  private static ComparisonPredicate comparison(
      String column, RlsOperator operator, Object... operands) {
    return new ComparisonPredicate("c", column, operator, new ArrayList<>(Arrays.asList(operands)));
  }

  @Test
  void testEqualsIsParameterized() {
    ParameterizedClause clause =
        emitter.emit(comparison("region", RlsOperator.EQUALS, "West"), SqlDialect.POSTGRESQL);
    assertEquals("\"region\" = ?", clause.getSql());
    assertEquals(Collections.singletonList("West"), clause.getParameters());
  }

  @Test
  void testInExpandsToParameterList() {
    PredicateNode in = comparison("region", RlsOperator.IN, "East", "West");
    ParameterizedClause clause = emitter.emit(in, SqlDialect.POSTGRESQL);
    assertEquals("\"region\" IN (?, ?)", clause.getSql());
    assertEquals(Arrays.asList("East", "West"), clause.getParameters());
    assertEquals("\"region\" IN ('East', 'West')", emitter.render(in, SqlDialect.POSTGRESQL));
  }

  @Test
  void testBetweenAndNullChecks() {
    PredicateNode between = comparison("amount", RlsOperator.BETWEEN, 10, 20);
    assertEquals(
        "\"amount\" BETWEEN ? AND ?", emitter.emit(between, SqlDialect.POSTGRESQL).getSql());
    assertEquals(
        "\"amount\" NOT BETWEEN 10 AND 20",
        emitter.render(comparison("amount", RlsOperator.NOT_BETWEEN, 10, 20), SqlDialect.ANSI));

    ParameterizedClause isNull =
        emitter.emit(comparison("deleted_at", RlsOperator.IS_NULL), SqlDialect.POSTGRESQL);
    assertEquals("\"deleted_at\" IS NULL", isNull.getSql());
    assertTrue(isNull.getParameters().isEmpty());
  }

  @Test
  void testLikeOperatorsEscapeWildcards() {
    ParameterizedClause contains =
        emitter.emit(comparison("name", RlsOperator.CONTAINS, "50%_off"), SqlDialect.POSTGRESQL);
    assertEquals("\"name\" LIKE ? ESCAPE '!'", contains.getSql());
    assertEquals(Collections.singletonList("%50!%!_off%"), contains.getParameters());

    assertEquals(
        "`name` LIKE 'ab!!c%' ESCAPE '!'",
        emitter.render(comparison("name", RlsOperator.STARTS_WITH, "ab!c"), SqlDialect.MYSQL));
  }

  @Test
  void testBigQueryLikeUsesBackslashWithoutEscapeClause() {
    ParameterizedClause contains =
        emitter.emit(comparison("name", RlsOperator.CONTAINS, "a_b"), SqlDialect.BIGQUERY);
    assertEquals("`name` LIKE ?", contains.getSql());
    assertEquals(Collections.singletonList("%a\\_b%"), contains.getParameters());

    String inline =
        emitter.render(comparison("name", RlsOperator.CONTAINS, "a_b"), SqlDialect.BIGQUERY);
    assertEquals("`name` LIKE '%a\\\\_b%'", inline);
    assertFalse(inline.contains("ESCAPE"));

    assertEquals(
        "`name` LIKE '50\\\\%\\\\\\\\x%'",
        emitter.render(
            comparison("name", RlsOperator.STARTS_WITH, "50%\\x"), SqlDialect.BIGQUERY));
  }

  @Test
  void testIdentifierQuotingPerDialect() {
    PredicateNode predicate = comparison("o.region", RlsOperator.NOT_EQUALS, "West");
    assertEquals(
        "\"o\".\"region\" <> 'West'", emitter.render(predicate, SqlDialect.POSTGRESQL));
    assertEquals("`o`.`region` <> 'West'", emitter.render(predicate, SqlDialect.MYSQL));
    assertEquals("`o`.`region` <> 'West'", emitter.render(predicate, SqlDialect.BIGQUERY));
    assertEquals("\"o\".\"region\" <> 'West'", emitter.render(predicate, SqlDialect.SNOWFLAKE));
  }

  @Test
  void testStringLiteralEscaping() {
    PredicateNode predicate = comparison("name", RlsOperator.EQUALS, "O'Brien");
    assertEquals("\"name\" = 'O''Brien'", emitter.render(predicate, SqlDialect.POSTGRESQL));
    assertEquals("`name` = 'O\\'Brien'", emitter.render(predicate, SqlDialect.BIGQUERY));
  }

  @Test
  void testLiteralTypes() {
    assertEquals(
        "\"amount\" > 1000",
        emitter.render(
            comparison("amount", RlsOperator.GREATER_THAN, new BigDecimal("1E+3")),
            SqlDialect.POSTGRESQL));
    assertEquals(
        "\"active\" = TRUE",
        emitter.render(comparison("active", RlsOperator.EQUALS, true), SqlDialect.POSTGRESQL));
    assertEquals(
        "\"created\" < '2024-01-31'",
        emitter.render(
            comparison("created", RlsOperator.LESS_THAN, LocalDate.of(2024, 1, 31)),
            SqlDialect.POSTGRESQL));
    assertThrows(
        EmitterException.class,
        () ->
            emitter.emit(
                comparison("created", RlsOperator.EQUALS, new Object()), SqlDialect.POSTGRESQL));
  }

  @Test
  void testConstants() {
    assertEquals("1 = 1", emitter.render(ConstantPredicate.TRUE, SqlDialect.POSTGRESQL));
    assertEquals("1 = 0", emitter.emit(ConstantPredicate.FALSE, SqlDialect.MYSQL).getSql());
  }

  @Test
  void testNestedJunctionsAreParenthesized() {
    PredicateNode predicate =
        Predicates.and(
            comparison("region", RlsOperator.EQUALS, "West"),
            Predicates.or(
                comparison("status", RlsOperator.EQUALS, "open"),
                comparison("status", RlsOperator.EQUALS, "pending")));
    ParameterizedClause clause = emitter.emit(predicate, SqlDialect.POSTGRESQL);
    assertEquals("\"region\" = ? AND (\"status\" = ? OR \"status\" = ?)", clause.getSql());
    assertEquals(Arrays.asList("West", "open", "pending"), clause.getParameters());
  }

  @Test
  void testExpressionInJunction() {
    PredicateNode predicate =
        Predicates.and(
            comparison("region", RlsOperator.EQUALS, "West"),
            new ExpressionPredicate(
                "e", Arrays.asList("tenant = ", " OR shared"), Collections.singletonList("u1")));
    assertEquals(
        "\"region\" = 'West' AND (tenant = 'u1' OR shared)",
        emitter.render(predicate, SqlDialect.POSTGRESQL));
  }

  @ParameterizedTest
  @MethodSource("forbiddenExpressions")
  void testExpressionInjectionIsRejected(String expression) {
    assertThrows(
        EmitterException.class,
        () -> emitter.emit(ExpressionPredicate.ofText("e", expression), SqlDialect.POSTGRESQL));
  }

  private static Stream<Arguments> forbiddenExpressions() {
    return Stream.of(
        Arguments.of("1 = 1; DROP TABLE orders"),
        Arguments.of("region = 'West' -- and more"),
        Arguments.of("region = 'West' /* hidden"),
        Arguments.of("hidden */ region = 'West'"));
  }

  @Test
  void testInvalidColumnIsRejected() {
    assertThrows(
        EmitterException.class,
        () ->
            emitter.emit(
                comparison("region\" OR 1=1", RlsOperator.EQUALS, "x"), SqlDialect.POSTGRESQL));
  }

  @Test
  void testOperandCountIsChecked() {
    assertThrows(
        EmitterException.class,
        () -> emitter.emit(comparison("amount", RlsOperator.BETWEEN, 10), SqlDialect.ANSI));
  }

  @ParameterizedTest
  @EnumSource(SqlDialect.class)
  void testEveryOperatorRendersInEveryDialect(SqlDialect dialect) {
    for (RlsOperator operator : RlsOperator.values()) {
      List<Object> operands = new ArrayList<>();
      switch (operator.getArity()) {
        case NONE:
          break;
        case SCALAR:
          operands.add("a");
          break;
        case RANGE:
          operands.add(1);
          operands.add(2);
          break;
        case LIST:
          operands.add("a");
          operands.add("b");
          break;
        default:
          throw new IllegalStateException("Unknown arity " + operator.getArity());
      }
      PredicateNode predicate = new ComparisonPredicate("c", "col", operator, operands);
      ParameterizedClause clause = emitter.emit(predicate, dialect);
      assertTrue(clause.getSql().startsWith(dialect.quoteIdentifier("col")), operator.getValue());
      assertEquals(operands.size(), clause.getParameters().size(), operator.getValue());
      assertEquals(
          operands.size(),
          clause.getSql().chars().filter(c -> c == '?').count(),
          operator.getValue());
    }
  }

  @Test
  void testCombine() {
    ParameterizedClause owner =
        emitter.emit(comparison("owner_id", RlsOperator.EQUALS, "u1"), SqlDialect.POSTGRESQL);
    ParameterizedClause region =
        emitter.emit(comparison("region", RlsOperator.EQUALS, "West"), SqlDialect.POSTGRESQL);

    ParameterizedClause all =
        emitter.combine(Arrays.asList(owner, region), CombinationStrategy.ALL);
    assertEquals("(\"owner_id\" = ?) AND (\"region\" = ?)", all.getSql());
    assertEquals(Arrays.asList("u1", "West"), all.getParameters());
    assertEquals(
        "(a) OR (b)", emitter.combineRendered(Arrays.asList("a", "b"), CombinationStrategy.ANY));
  }
}
