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

import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.model.sql.SqlDialect;

/** Validation and quoting of the column names policies filter on. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class Identifiers {
  private static final Pattern QUALIFIED_IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)*");

  /** Whether {@code column} is a plain, optionally dot-qualified, identifier. */
  public static boolean isValid(String column) {
    return column != null && QUALIFIED_IDENTIFIER.matcher(column).matches();
  }

  /** Quotes every part of a dot-qualified identifier. */
  public static String quote(String column, SqlDialect dialect) {
    if (!isValid(column)) {
      throw new IllegalArgumentException("Invalid column identifier: " + column);
    }
    StringBuilder quoted = new StringBuilder();
    for (String part : column.split("\\.")) {
      if (quoted.length() > 0) {
        quoted.append('.');
      }
      quoted.append(dialect.quoteIdentifier(part));
    }
    return quoted.toString();
  }
}
