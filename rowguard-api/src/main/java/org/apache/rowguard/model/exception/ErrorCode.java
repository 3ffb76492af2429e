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
 
package org.apache.rowguard.model.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
  INVALID_CONFIGURATION(10001),
  INVALID_POLICY(10002),
  CONDITION_COMPILATION(10003),
  MISSING_ATTRIBUTE(10004),
  EMITTER_FAILURE(10005),
  STORE_UNAVAILABLE(10006),
  ACCESS_DENIED(10007),
  UNSUPPORTED_FEATURE(10008),
  PARSE_EXCEPTION(10009);

  private final int errorCode;

  ErrorCode(int errorCode) {
    this.errorCode = errorCode;
  }
}
