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
 
package org.apache.rowguard.query;

import java.util.ArrayList;
import java.util.List;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.commons.lang3.StringUtils;

import org.apache.rowguard.exception.AccessDeniedException;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.sql.ParameterizedClause;

/**
 * Applies an access decision to a query by wrapping it in a filtering outer select:
 *
 * <pre>
 * SELECT * FROM (
 *     &lt;query&gt;
 * ) AS __rls_filtered
 * WHERE &lt;filter&gt;
 * </pre>
 *
 * The filter's columns must be visible in the query's result.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class QueryFilterInjector {
  static final String FILTERED_ALIAS = "__rls_filtered";

  private static final QueryFilterInjector INSTANCE = new QueryFilterInjector();

  public static QueryFilterInjector getInstance() {
    return INSTANCE;
  }

  /**
   * Returns the query restricted by the response's inline filter.
   *
   * @throws AccessDeniedException if the response denies access
   */
  public String inject(String query, RlsFilterResponse response) {
    checkAllowed(response);
    if (!response.isHasFilters() || StringUtils.isBlank(response.getWhereClause())) {
      return query;
    }
    return wrap(query, response.getWhereClause());
  }

  /**
   * Returns the query restricted by the response's parameterized filter. The filter's parameters
   * follow any parameters the query itself binds.
   *
   * @param queryParameters values bound to the query's own placeholders
   * @throws AccessDeniedException if the response denies access
   */
  public ParameterizedClause injectParameterized(
      String query, List<Object> queryParameters, RlsFilterResponse response) {
    checkAllowed(response);
    ParameterizedClause filter = response.getParameterizedClause();
    if (!response.isHasFilters() || filter == null) {
      return ParameterizedClause.builder().sql(query).parameters(queryParameters).build();
    }
    List<Object> parameters = new ArrayList<>(queryParameters);
    parameters.addAll(filter.getParameters());
    return ParameterizedClause.builder()
        .sql(wrap(query, filter.getSql()))
        .parameters(parameters)
        .build();
  }

  private static void checkAllowed(RlsFilterResponse response) {
    if (response.isAccessDenied()) {
      throw new AccessDeniedException("Access denied: " + response.getDenialReason());
    }
  }

  private static String wrap(String query, String filter) {
    String inner = StringUtils.stripEnd(query.trim(), "; \t\r\n");
    return "SELECT * FROM (\n    " + inner + "\n) AS " + FILTERED_ALIAS + "\nWHERE " + filter;
  }
}
