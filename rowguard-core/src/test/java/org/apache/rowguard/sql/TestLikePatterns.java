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

import org.junit.jupiter.api.Test;

public class TestLikePatterns {

  @Test
  void testEscape() {
    assertEquals("plain", LikePatterns.escape("plain"));
    assertEquals("100!%", LikePatterns.escape("100%"));
    assertEquals("a!_b!!c", LikePatterns.escape("a_b!c"));
  }

  @Test
  void testPatterns() {
    assertEquals("%west%", LikePatterns.contains("west"));
    assertEquals("we!_st%", LikePatterns.startsWith("we_st"));
  }

  @Test
  void testEscapeWithBackslash() {
    assertEquals("a\\_b\\\\c", LikePatterns.escape("a_b\\c", '\\'));
    assertEquals("%a!b%", LikePatterns.contains("a!b", '\\'));
    assertEquals("10\\%%", LikePatterns.startsWith("10%", '\\'));
  }
}
