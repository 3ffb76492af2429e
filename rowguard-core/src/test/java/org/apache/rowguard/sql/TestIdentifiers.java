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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import org.apache.rowguard.model.sql.SqlDialect;

public class TestIdentifiers {

  @ParameterizedTest
  @ValueSource(strings = {"region", "_id", "o.region", "db.schema.col$1"})
  void testValidIdentifiers(String column) {
    assertTrue(Identifiers.isValid(column));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1col", "o.", "a b", "region;", "\"region\"", "a.-b"})
  void testInvalidIdentifiers(String column) {
    assertFalse(Identifiers.isValid(column));
  }

  @Test
  void testQuote() {
    assertEquals("\"o\".\"region\"", Identifiers.quote("o.region", SqlDialect.ANSI));
    assertEquals("`region`", Identifiers.quote("region", SqlDialect.MYSQL));
    assertThrows(IllegalArgumentException.class, () -> Identifiers.quote(null, SqlDialect.ANSI));
  }
}
