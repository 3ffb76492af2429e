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

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Builds LIKE patterns from plain text. Wildcards in the text are escaped with {@link
 * #ESCAPE_CHARACTER} unless the dialect dictates another escape character.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class LikePatterns {
  public static final char ESCAPE_CHARACTER = '!';

  public static String escape(String text) {
    return escape(text, ESCAPE_CHARACTER);
  }

  public static String escape(String text, char escapeCharacter) {
    StringBuilder escaped = new StringBuilder(text.length() + 8);
    for (char c : text.toCharArray()) {
      if (c == '%' || c == '_' || c == escapeCharacter) {
        escaped.append(escapeCharacter);
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  public static String contains(String text) {
    return contains(text, ESCAPE_CHARACTER);
  }

  public static String contains(String text, char escapeCharacter) {
    return "%" + escape(text, escapeCharacter) + "%";
  }

  public static String startsWith(String text) {
    return startsWith(text, ESCAPE_CHARACTER);
  }

  public static String startsWith(String text, char escapeCharacter) {
    return escape(text, escapeCharacter) + "%";
  }
}
