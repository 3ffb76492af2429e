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

import java.math.BigDecimal;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.exception.EmitterException;
import org.apache.rowguard.model.policy.CombinationStrategy;
import org.apache.rowguard.model.policy.GroupLogic;
import org.apache.rowguard.model.policy.RlsOperator;
import org.apache.rowguard.model.sql.ParameterizedClause;
import org.apache.rowguard.model.sql.SqlDialect;
import org.apache.rowguard.predicate.ComparisonPredicate;
import org.apache.rowguard.predicate.ConstantPredicate;
import org.apache.rowguard.predicate.ExpressionPredicate;
import org.apache.rowguard.predicate.JunctionPredicate;
import org.apache.rowguard.predicate.PredicateNode;
import org.apache.rowguard.predicate.PredicateVisitor;

/**
 * Renders compiled predicates as SQL for a {@link SqlDialect}.
 *
 * <p>{@link #emit} produces the executable form: every value is a {@code ?} placeholder with the
 * value bound in order. {@link #render} produces the same text with values written as escaped
 * literals, used for display and auditing. Both forms quote column identifiers per dialect and
 * parenthesize nested junctions and expressions.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class SqlEmitter {
  private static final SqlEmitter INSTANCE = new SqlEmitter();

  static final String ALWAYS_TRUE = "1 = 1";
  static final String ALWAYS_FALSE = "1 = 0";

  public static SqlEmitter getInstance() {
    return INSTANCE;
  }

  /**
   * @throws EmitterException if the predicate cannot be rendered safely for the dialect
   */
  public ParameterizedClause emit(PredicateNode predicate, SqlDialect dialect) {
    List<Object> parameters = new ArrayList<>();
    String sql = predicate.accept(new RenderingVisitor(dialect, parameters));
    return ParameterizedClause.builder().sql(sql).parameters(parameters).build();
  }

  /**
   * @throws EmitterException if the predicate cannot be rendered safely for the dialect
   */
  public String render(PredicateNode predicate, SqlDialect dialect) {
    return predicate.accept(new RenderingVisitor(dialect, null));
  }

  /** Joins per-policy clauses, each parenthesized, with the strategy's connective. */
  public ParameterizedClause combine(
      List<ParameterizedClause> clauses, CombinationStrategy strategy) {
    List<String> sql = new ArrayList<>(clauses.size());
    List<Object> parameters = new ArrayList<>();
    for (ParameterizedClause clause : clauses) {
      sql.add(clause.getSql());
      parameters.addAll(clause.getParameters());
    }
    return ParameterizedClause.builder()
        .sql(combineRendered(sql, strategy))
        .parameters(parameters)
        .build();
  }

  /** Joins rendered per-policy clauses, each parenthesized, with the strategy's connective. */
  public String combineRendered(List<String> clauses, CombinationStrategy strategy) {
    String connective = strategy == CombinationStrategy.ALL ? " AND " : " OR ";
    StringBuilder combined = new StringBuilder();
    for (String clause : clauses) {
      if (combined.length() > 0) {
        combined.append(connective);
      }
      combined.append('(').append(clause).append(')');
    }
    return combined.toString();
  }

  private static final class RenderingVisitor implements PredicateVisitor<String> {
    private final SqlDialect dialect;
    // null when values are rendered inline
    private final List<Object> parameters;

    private RenderingVisitor(SqlDialect dialect, List<Object> parameters) {
      this.dialect = dialect;
      this.parameters = parameters;
    }

    @Override
    public String visitConstant(ConstantPredicate constant) {
      return constant.getValue() ? ALWAYS_TRUE : ALWAYS_FALSE;
    }

    @Override
    public String visitComparison(ComparisonPredicate comparison) {
      RlsOperator operator = comparison.getOperator();
      List<Object> operands = comparison.getOperands();
      checkOperandCount(comparison);
      String column = quoteColumn(comparison.getColumn());
      switch (operator) {
        case EQUALS:
          return column + " = " + value(operands.get(0));
        case NOT_EQUALS:
          return column + " <> " + value(operands.get(0));
        case IN:
          return column + " IN " + valueList(operands);
        case NOT_IN:
          return column + " NOT IN " + valueList(operands);
        case CONTAINS:
          return like(
              column,
              LikePatterns.contains(String.valueOf(operands.get(0)), dialect.getLikeEscape()));
        case STARTS_WITH:
          return like(
              column,
              LikePatterns.startsWith(String.valueOf(operands.get(0)), dialect.getLikeEscape()));
        case GREATER_THAN:
          return column + " > " + value(operands.get(0));
        case LESS_THAN:
          return column + " < " + value(operands.get(0));
        case BETWEEN:
          return column + " BETWEEN " + value(operands.get(0)) + " AND " + value(operands.get(1));
        case NOT_BETWEEN:
          return column
              + " NOT BETWEEN "
              + value(operands.get(0))
              + " AND "
              + value(operands.get(1));
        case IS_NULL:
          return column + " IS NULL";
        case IS_NOT_NULL:
          return column + " IS NOT NULL";
        default:
          throw new EmitterException(
              String.format("Dialect %s cannot render operator %s", dialect, operator));
      }
    }

    @Override
    public String visitExpression(ExpressionPredicate expression) {
      Optional<String> forbidden = ExpressionGuard.findForbiddenToken(expression.getTemplate());
      if (forbidden.isPresent()) {
        throw new EmitterException(
            String.format(
                "Expression of condition %s contains forbidden token '%s'",
                expression.getConditionId(), forbidden.get()));
      }
      StringBuilder sql = new StringBuilder(expression.getFragments().get(0));
      for (int i = 0; i < expression.getParameters().size(); i++) {
        sql.append(value(expression.getParameters().get(i)));
        sql.append(expression.getFragments().get(i + 1));
      }
      return sql.toString().trim();
    }

    @Override
    public String visitJunction(JunctionPredicate junction) {
      String connective = junction.getLogic() == GroupLogic.AND ? " AND " : " OR ";
      StringBuilder sql = new StringBuilder();
      for (PredicateNode child : junction.getChildren()) {
        if (sql.length() > 0) {
          sql.append(connective);
        }
        String rendered = child.accept(this);
        if (child instanceof JunctionPredicate || child instanceof ExpressionPredicate) {
          sql.append('(').append(rendered).append(')');
        } else {
          sql.append(rendered);
        }
      }
      return sql.toString();
    }

    private String quoteColumn(String column) {
      if (!Identifiers.isValid(column)) {
        throw new EmitterException("Invalid column identifier: " + column);
      }
      return Identifiers.quote(column, dialect);
    }

    private String like(String column, String pattern) {
      String like = column + " LIKE " + value(pattern);
      if (!dialect.hasLikeEscapeClause()) {
        return like;
      }
      return like + " ESCAPE '" + dialect.getLikeEscape() + "'";
    }

    private String valueList(List<Object> values) {
      StringBuilder list = new StringBuilder("(");
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          list.append(", ");
        }
        list.append(value(values.get(i)));
      }
      return list.append(')').toString();
    }

    private String value(Object value) {
      if (parameters != null) {
        checkBindable(value);
        parameters.add(value);
        return "?";
      }
      return literal(value);
    }

    private void checkBindable(Object value) {
      literal(value);
    }

    private String literal(Object value) {
      if (value instanceof String) {
        return dialect.quoteString((String) value);
      }
      if (value instanceof Boolean) {
        return ((Boolean) value) ? "TRUE" : "FALSE";
      }
      if (value instanceof BigDecimal) {
        return ((BigDecimal) value).toPlainString();
      }
      if (value instanceof Number) {
        double number = ((Number) value).doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
          throw new EmitterException("Cannot render non-finite number " + value);
        }
        return value.toString();
      }
      if (value instanceof Temporal || value instanceof UUID) {
        return dialect.quoteString(value.toString());
      }
      throw new EmitterException(
          String.format(
              "Dialect %s cannot render value of type %s",
              dialect, value == null ? "null" : value.getClass().getName()));
    }

    private static void checkOperandCount(ComparisonPredicate comparison) {
      int count = comparison.getOperands().size();
      boolean valid;
      switch (comparison.getOperator().getArity()) {
        case NONE:
          valid = count == 0;
          break;
        case SCALAR:
          valid = count == 1;
          break;
        case RANGE:
          valid = count == 2;
          break;
        case LIST:
          valid = count > 0;
          break;
        default:
          valid = false;
      }
      if (!valid) {
        throw new EmitterException(
            String.format(
                "Condition %s has %d operand(s) for operator %s",
                comparison.getConditionId(), count, comparison.getOperator().getValue()));
      }
    }
  }
}
