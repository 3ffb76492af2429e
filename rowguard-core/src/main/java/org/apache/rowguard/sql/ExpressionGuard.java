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

import java.util.Optional;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Rejects expression text that could end the filter's statement or hide the remainder of the
 * query: statement separators and comment markers are never allowed, even inside quotes.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpressionGuard {
  private static final String[] FORBIDDEN_TOKENS = {";", "--", "/*", "*/"};

  /** Returns the first forbidden token found in {@code text}, if any. */
  public static Optional<String> findForbiddenToken(String text) {
    for (String token : FORBIDDEN_TOKENS) {
      if (text.contains(token)) {
        return Optional.of(token);
      }
    }
    return Optional.empty();
  }
}
