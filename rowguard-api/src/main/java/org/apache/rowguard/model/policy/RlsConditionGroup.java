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
 
package org.apache.rowguard.model.policy;

import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A boolean tree node joining conditions and nested groups with a single {@link GroupLogic}.
 *
 * <p>Groups must form a finite tree of bounded depth; this is checked when a policy is written,
 * not while it is evaluated.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RlsConditionGroup {
  @NonNull String id;

  @NonNull @Builder.Default GroupLogic logic = GroupLogic.AND;

  @Builder.Default List<RlsCondition> conditions = Collections.emptyList();

  @Builder.Default List<RlsConditionGroup> groups = Collections.emptyList();

  public boolean isEmpty() {
    return conditions.isEmpty() && groups.isEmpty();
  }
}
