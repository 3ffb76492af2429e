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
 
package org.apache.rowguard.resolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.rowguard.compiler.CompiledFilter;
import org.apache.rowguard.compiler.FilterCompiler;
import org.apache.rowguard.exception.EmitterException;
import org.apache.rowguard.model.access.ConditionFailure;
import org.apache.rowguard.model.access.RlsFilterRequest;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.audit.PolicyReference;
import org.apache.rowguard.model.config.RlsConfiguration;
import org.apache.rowguard.model.policy.CombinationStrategy;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.model.sql.ParameterizedClause;
import org.apache.rowguard.predicate.PredicateNode;
import org.apache.rowguard.sql.SqlEmitter;

/**
 * Selects the policies that apply to a request, compiles them for the user and combines them into
 * a single filter.
 *
 * <p>Each matched policy is emitted as its own parenthesized clause. With {@link
 * CombinationStrategy#ALL} the clauses are joined with AND and a policy that compiles to TRUE adds
 * nothing; with {@link CombinationStrategy#ANY} they are joined with OR and a single TRUE policy
 * lifts the restriction.
 */
@Log4j2
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public class PolicyResolver {
  public static final String NO_MATCHING_POLICY_REASON =
      "no matching policy; default deny enforced";

  private static final PolicyResolver INSTANCE =
      new PolicyResolver(FilterCompiler.getInstance(), SqlEmitter.getInstance());

  private static final Comparator<RlsPolicy> EVALUATION_ORDER =
      Comparator.comparingInt(RlsPolicy::getPriority).thenComparing(RlsPolicy::getId);

  private final FilterCompiler filterCompiler;
  private final SqlEmitter sqlEmitter;

  public static PolicyResolver getInstance() {
    return INSTANCE;
  }

  /**
   * Returns the enabled policies in scope of the request whose roles intersect the user's roles,
   * in evaluation order: priority ascending, then id.
   */
  public List<RlsPolicy> match(
      RlsFilterRequest request, UserSecurityContext context, Collection<RlsPolicy> policies) {
    return policies.stream()
        .filter(RlsPolicy::isEnabled)
        .filter(policy -> inScope(policy, request))
        .filter(policy -> appliesToUser(policy, context))
        .sorted(EVALUATION_ORDER)
        .collect(Collectors.toList());
  }

  /**
   * Computes the response for a request from the given policy snapshot.
   *
   * @throws EmitterException if a matched policy cannot be rendered safely
   */
  public PolicyDecision resolve(
      RlsFilterRequest request,
      UserSecurityContext context,
      Collection<RlsPolicy> policies,
      RlsConfiguration configuration) {
    List<RlsPolicy> matched = match(request, context, policies);
    if (matched.isEmpty()) {
      log.debug(
          "No policy matches {}.{} for user {}",
          request.getSchemaName(),
          request.getTableName(),
          context.getUserId());
      RlsFilterResponse response =
          configuration.isDefaultDeny()
              ? RlsFilterResponse.denied(NO_MATCHING_POLICY_REASON)
              : RlsFilterResponse.unrestricted();
      return PolicyDecision.builder().response(response).build();
    }

    List<CompiledPolicy> compiled = new ArrayList<>(matched.size());
    for (RlsPolicy policy : matched) {
      compiled.add(compile(policy, context));
    }
    List<ConditionFailure> failures =
        compiled.stream()
            .flatMap(policy -> policy.getFailures().stream())
            .collect(Collectors.toList());
    List<String> policyIds =
        matched.stream().map(RlsPolicy::getId).collect(Collectors.toList());
    List<PolicyReference> references =
        matched.stream()
            .map(policy -> new PolicyReference(policy.getId(), policy.getPriority()))
            .collect(Collectors.toList());

    List<PredicateNode> restrictions =
        restrictions(compiled, configuration.getCombinationStrategy());
    RlsFilterResponse.RlsFilterResponseBuilder response =
        RlsFilterResponse.builder()
            .policiesApplied(Collections.unmodifiableList(policyIds))
            .conditionFailures(Collections.unmodifiableList(failures));
    if (!restrictions.isEmpty()) {
      List<ParameterizedClause> clauses = new ArrayList<>(restrictions.size());
      List<String> rendered = new ArrayList<>(restrictions.size());
      for (PredicateNode restriction : restrictions) {
        clauses.add(sqlEmitter.emit(restriction, configuration.getDialect()));
        rendered.add(sqlEmitter.render(restriction, configuration.getDialect()));
      }
      response
          .hasFilters(true)
          .parameterizedClause(
              sqlEmitter.combine(clauses, configuration.getCombinationStrategy()))
          .whereClause(
              sqlEmitter.combineRendered(rendered, configuration.getCombinationStrategy()));
    }
    return PolicyDecision.builder()
        .response(response.build())
        .matchedPolicies(Collections.unmodifiableList(references))
        .build();
  }

  private CompiledPolicy compile(RlsPolicy policy, UserSecurityContext context) {
    CompiledFilter filter = filterCompiler.compile(policy.getFilterGroup(), context);
    List<ConditionFailure> failures =
        filter.getFailures().stream()
            .map(failure -> failure.toBuilder().policyId(policy.getId()).build())
            .collect(Collectors.toList());
    if (!failures.isEmpty()) {
      log.info(
          "Policy {} has {} condition(s) evaluated as false for user {}",
          policy.getId(),
          failures.size(),
          context.getUserId());
    }
    return new CompiledPolicy(
        policy.getId(), policy.getPriority(), filter.getPredicate(), failures);
  }

  /** Returns the predicates that narrow the result, an empty list when nothing is restricted. */
  private static List<PredicateNode> restrictions(
      List<CompiledPolicy> compiled, CombinationStrategy strategy) {
    List<PredicateNode> restrictions = new ArrayList<>(compiled.size());
    for (CompiledPolicy policy : compiled) {
      if (policy.getPredicate().isAlwaysTrue()) {
        if (strategy == CombinationStrategy.ANY) {
          return Collections.emptyList();
        }
        continue;
      }
      restrictions.add(policy.getPredicate());
    }
    return restrictions;
  }

  private static boolean inScope(RlsPolicy policy, RlsFilterRequest request) {
    return matchesScope(policy.getConnectionId(), request.getConnectionId())
        && matchesScope(policy.getSchemaName(), request.getSchemaName())
        && matchesScope(policy.getTableName(), request.getTableName());
  }

  private static boolean matchesScope(String scope, String requested) {
    return scope == null || scope.equals(requested);
  }

  private static boolean appliesToUser(RlsPolicy policy, UserSecurityContext context) {
    return policy.getRoleIds() != null
        && !Collections.disjoint(policy.getRoleIds(), context.getRoles());
  }
}
