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

/** A dynamic condition referenced an attribute absent from the user's security context. */
@Getter
public class MissingAttributeException extends ConditionCompilationException {
  private final String attributeName;

  public MissingAttributeException(String conditionId, String attributeName) {
    super(
        ErrorCode.MISSING_ATTRIBUTE,
        conditionId,
        FailureReason.MISSING_ATTRIBUTE,
        String.format(
            "Condition %s references attribute %s which is not present in the user context",
            conditionId, attributeName));
    this.attributeName = attributeName;
  }
}
