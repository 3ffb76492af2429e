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
 
package org.apache.rowguard.model.sql;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Quoting and escaping rules of the database engines filters are emitted for.
 *
 * <p>Identifiers are wrapped in the dialect's quote character with embedded quote characters
 * doubled. String literals are wrapped in single quotes; embedded quotes are escaped with the
 * dialect's quote escape and, where the engine treats backslash as an escape character inside
 * literals, backslashes are doubled.
 *
 * <p>LIKE wildcards are escaped with {@code !} and an explicit ESCAPE clause, except on BigQuery,
 * which has no ESCAPE clause and always treats backslash as the pattern escape.
 */
public enum SqlDialect {
  POSTGRESQL('"', false, "''", '!', true),
  MYSQL('`', true, "''", '!', true),
  SNOWFLAKE('"', true, "''", '!', true),
  BIGQUERY('`', true, "\\'", '\\', false),
  ANSI('"', false, "''", '!', true);

  private final char identifierQuote;
  private final boolean backslashEscapes;
  private final String quoteEscape;
  private final char likeEscape;
  private final boolean likeEscapeClause;

  SqlDialect(
      char identifierQuote,
      boolean backslashEscapes,
      String quoteEscape,
      char likeEscape,
      boolean likeEscapeClause) {
    this.identifierQuote = identifierQuote;
    this.backslashEscapes = backslashEscapes;
    this.quoteEscape = quoteEscape;
    this.likeEscape = likeEscape;
    this.likeEscapeClause = likeEscapeClause;
  }

  /** Character that escapes wildcards in LIKE patterns of this dialect. */
  public char getLikeEscape() {
    return likeEscape;
  }

  /** Whether a LIKE must name its escape character in an ESCAPE clause. */
  public boolean hasLikeEscapeClause() {
    return likeEscapeClause;
  }

  /** Quotes a single, unqualified identifier part. */
  public String quoteIdentifier(String identifier) {
    String quote = String.valueOf(identifierQuote);
    return quote + identifier.replace(quote, quote + quote) + quote;
  }

  /** Renders a string as a literal of this dialect. */
  public String quoteString(String value) {
    String escaped = backslashEscapes ? value.replace("\\", "\\\\") : value;
    return "'" + escaped.replace("'", quoteEscape) + "'";
  }

  @JsonCreator
  public static SqlDialect fromValue(String value) {
    for (SqlDialect dialect : values()) {
      if (dialect.name().equalsIgnoreCase(value)) {
        return dialect;
      }
    }
    if ("postgres".equalsIgnoreCase(value)) {
      return POSTGRESQL;
    }
    throw new IllegalArgumentException("Unknown SQL dialect: " + value);
  }
}
