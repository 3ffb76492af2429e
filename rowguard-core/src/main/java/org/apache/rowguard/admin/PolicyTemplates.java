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
 
package org.apache.rowguard.admin;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.exception.PolicyValidationException;
import org.apache.rowguard.model.policy.GroupLogic;
import org.apache.rowguard.model.policy.PolicyTemplate;
import org.apache.rowguard.model.policy.RlsCondition;
import org.apache.rowguard.model.policy.RlsConditionGroup;
import org.apache.rowguard.model.policy.RlsFilterType;
import org.apache.rowguard.model.policy.RlsOperator;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.model.security.ChangeLogInfo;
import org.apache.rowguard.model.security.UserAttributeType;

/** Pre-built filter groups for common row-level security patterns. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicyTemplates {
  public static final String DEPARTMENT_FILTER = "department_filter";
  public static final String REGION_FILTER = "region_filter";
  public static final String OWNER_FILTER = "owner_filter";
  public static final String TEAM_HIERARCHY = "team_hierarchy";

  private static final Map<String, PolicyTemplate> TEMPLATES = createTemplates();

  public static List<PolicyTemplate> list() {
    return Collections.unmodifiableList(new ArrayList<>(TEMPLATES.values()));
  }

  public static Optional<PolicyTemplate> get(String templateId) {
    return Optional.ofNullable(TEMPLATES.get(templateId));
  }

  /**
   * Instantiates a template as a policy scoped to one table.
   *
   * @param schemaName (optional) schema scope, any schema when null
   * @param connectionId (optional) connection scope, any connection when null
   * @throws PolicyValidationException if the template does not exist
   */
  public static RlsPolicy apply(
      String templateId,
      String tableName,
      String schemaName,
      String connectionId,
      Set<String> roleIds,
      String createdBy,
      Clock clock) {
    PolicyTemplate template =
        get(templateId)
            .orElseThrow(
                () ->
                    new PolicyValidationException(
                        templateId,
                        Collections.singletonList("unknown template " + templateId)));
    return RlsPolicy.builder()
        .id(UUID.randomUUID().toString())
        .name(template.getName() + " - " + tableName)
        .description(template.getDescription())
        .connectionId(connectionId)
        .schemaName(schemaName)
        .tableName(tableName)
        .filterGroup(template.getFilterGroup())
        .roleIds(roleIds)
        .changeLogInfo(ChangeLogInfo.created(createdBy, clock.instant()))
        .build();
  }

  private static Map<String, PolicyTemplate> createTemplates() {
    Map<String, PolicyTemplate> templates = new LinkedHashMap<>();
    register(
        templates,
        DEPARTMENT_FILTER,
        "Department Filter",
        "Users can only see data for their department",
        group(
            "dept_group",
            GroupLogic.AND,
            dynamic("dept_cond", "department", RlsOperator.EQUALS, UserAttributeType.DEPARTMENT)));
    register(
        templates,
        REGION_FILTER,
        "Region Filter",
        "Users can only see data for their region(s)",
        group(
            "region_group",
            GroupLogic.AND,
            dynamic("region_cond", "region", RlsOperator.IN, UserAttributeType.REGION)));
    register(
        templates,
        OWNER_FILTER,
        "Owner Filter",
        "Users can only see records they own",
        group(
            "owner_group",
            GroupLogic.AND,
            dynamic("owner_cond", "owner_id", RlsOperator.EQUALS, UserAttributeType.USER_ID)));
    register(
        templates,
        TEAM_HIERARCHY,
        "Team Hierarchy",
        "Users can see their team's data and subordinates",
        group(
            "team_group",
            GroupLogic.OR,
            dynamic("team_cond", "team_id", RlsOperator.EQUALS, UserAttributeType.TEAM),
            dynamic("owner_cond", "created_by", RlsOperator.EQUALS, UserAttributeType.USER_ID)));
    return Collections.unmodifiableMap(templates);
  }

  private static void register(
      Map<String, PolicyTemplate> templates,
      String id,
      String name,
      String description,
      RlsConditionGroup filterGroup) {
    templates.put(
        id,
        PolicyTemplate.builder()
            .id(id)
            .name(name)
            .description(description)
            .filterGroup(filterGroup)
            .build());
  }

  private static RlsConditionGroup group(String id, GroupLogic logic, RlsCondition... conditions) {
    return RlsConditionGroup.builder()
        .id(id)
        .logic(logic)
        .conditions(Collections.unmodifiableList(Arrays.asList(conditions)))
        .build();
  }

  private static RlsCondition dynamic(
      String id, String column, RlsOperator operator, UserAttributeType attribute) {
    return RlsCondition.builder()
        .id(id)
        .column(column)
        .operator(operator)
        .filterType(RlsFilterType.DYNAMIC)
        .userAttribute(attribute)
        .build();
  }
}
