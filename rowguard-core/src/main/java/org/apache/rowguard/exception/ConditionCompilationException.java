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
 
package org.apache.rowguard.exception;

import lombok.Getter;

import org.apache.rowguard.model.access.FailureReason;
import org.apache.rowguard.model.exception.ErrorCode;
import org.apache.rowguard.model.exception.InternalException;

/**
 * A single condition could not be compiled. The failure is scoped to that condition: the enclosing
 * group evaluates it as always false and records the reason.
 */
@Getter
public class ConditionCompilationException extends InternalException {
  private final String conditionId;
  private final FailureReason reason;

  public ConditionCompilationException(String conditionId, FailureReason reason, String message) {
    this(ErrorCode.CONDITION_COMPILATION, conditionId, reason, message);
  }

  protected ConditionCompilationException(
      ErrorCode errorCode, String conditionId, FailureReason reason, String message) {
    super(errorCode, message);
    this.conditionId = conditionId;
    this.reason = reason;
  }
}
