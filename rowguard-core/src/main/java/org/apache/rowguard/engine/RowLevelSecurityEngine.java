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
 
package org.apache.rowguard.engine;

import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.CacheStats;

import org.apache.commons.lang3.StringUtils;

import org.apache.rowguard.audit.AuditEntries;
import org.apache.rowguard.audit.AuditRecorder;
import org.apache.rowguard.audit.LoggingAuditSink;
import org.apache.rowguard.cache.AccessDecisionCache;
import org.apache.rowguard.cache.AccessDecisionKey;
import org.apache.rowguard.context.SecurityContextResolver;
import org.apache.rowguard.context.StoreCalls;
import org.apache.rowguard.exception.EmitterException;
import org.apache.rowguard.exception.StoreUnavailableException;
import org.apache.rowguard.model.access.RlsFilterRequest;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.config.RlsConfiguration;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.reflection.ReflectionUtils;
import org.apache.rowguard.resolver.PolicyDecision;
import org.apache.rowguard.resolver.PolicyResolver;
import org.apache.rowguard.spi.audit.AuditSink;
import org.apache.rowguard.spi.repository.PolicyRepository;
import org.apache.rowguard.spi.repository.UserAttributeRepository;
import org.apache.rowguard.spi.repository.UserRoleRepository;

/**
 * Entry point for row-level security decisions.
 *
 * <p>An evaluation resolves the user's context, serves the decision from the cache or computes it
 * from the current policies, records it for audit and returns it. The response is always either a
 * denial, unrestricted access or a filter to conjoin to the query; failures of the stores or of
 * filter rendering become denials, never unfiltered access (unless {@link
 * RlsConfiguration#isFailOpen()} is set for store failures).
 *
 * <p>The engine is safe for concurrent use. Configuration changes apply to evaluations that start
 * after {@link #updateConfiguration(RlsConfiguration)} returns.
 */
@Log4j2
public class RowLevelSecurityEngine implements Closeable {
  public static final String STORE_UNAVAILABLE_REASON = "policy store unavailable";
  public static final String FILTER_COMPILATION_FAILED_REASON = "filter compilation failed";

  private final PolicyRepository policyRepository;
  private final UserRoleRepository userRoleRepository;
  private final UserAttributeRepository userAttributeRepository;
  private final PolicyResolver policyResolver;
  private final SecurityContextResolver contextResolver;
  private final StoreCalls storeCalls;
  private final AuditRecorder auditRecorder;
  private final Clock clock;

  private volatile RlsConfiguration configuration;
  private volatile AccessDecisionCache cache;

  /**
   * @param policyRepository source of policies
   * @param userRoleRepository (optional) role assignments merged into request contexts
   * @param userAttributeRepository (optional) stored attributes merged into request contexts
   * @param configuration (optional) initial configuration, {@link RlsConfiguration#DEFAULT} when
   *     null
   * @param auditRecorder (optional) recorder for decisions, built from {@link
   *     RlsConfiguration#getAuditSinkClass()} when null
   * @param storeCalls (optional) time limiter for store calls
   * @param clock (optional) clock for audit timestamps and role mapping windows
   */
  @Builder
  private RowLevelSecurityEngine(
      @NonNull PolicyRepository policyRepository,
      UserRoleRepository userRoleRepository,
      UserAttributeRepository userAttributeRepository,
      RlsConfiguration configuration,
      AuditRecorder auditRecorder,
      StoreCalls storeCalls,
      Clock clock) {
    this.policyRepository = policyRepository;
    this.userRoleRepository = userRoleRepository;
    this.userAttributeRepository = userAttributeRepository;
    this.configuration = configuration == null ? RlsConfiguration.DEFAULT : configuration;
    this.storeCalls = storeCalls == null ? new StoreCalls() : storeCalls;
    this.auditRecorder =
        auditRecorder == null
            ? AuditRecorder.create(createAuditSink(this.configuration))
            : auditRecorder;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.policyResolver = PolicyResolver.getInstance();
    this.contextResolver =
        new SecurityContextResolver(userRoleRepository, userAttributeRepository, this.storeCalls);
    this.cache = AccessDecisionCache.create(this.configuration.getCacheTtlSeconds());
  }

  /** Decides which rows of the requested table the user may read. */
  public RlsFilterResponse evaluateAccess(@NonNull RlsFilterRequest request) {
    RlsConfiguration config = configuration;
    AccessDecisionCache decisionCache = cache;
    if (!config.isEnabled()) {
      return RlsFilterResponse.unrestricted();
    }
    Instant now = clock.instant();
    long timeoutMillis = config.getStoreTimeoutMillis();

    StoreSnapshot snapshot;
    try {
      snapshot =
          storeCalls.call(
              "Security context lookup",
              timeoutMillis,
              () -> readSnapshot(request, now));
    } catch (StoreUnavailableException e) {
      return storeFailure(request, config, now, e);
    }
    UserSecurityContext context = snapshot.getContext();
    AccessDecisionKey key = snapshot.getKey();

    Optional<PolicyDecision> cached = decisionCache.get(key);
    PolicyDecision decision;
    if (cached.isPresent()) {
      decision = cached.get();
    } else {
      List<RlsPolicy> policies;
      try {
        policies = storeCalls.call("Policy lookup", timeoutMillis, policyRepository::listPolicies);
      } catch (StoreUnavailableException e) {
        return storeFailure(request, config, now, e);
      }
      decision = compute(request, context, policies, config);
      decisionCache.put(key, decision);
    }
    return complete(request, decision, config, now, cached.isPresent());
  }

  /**
   * Evaluates a request against the given policies only, bypassing the stores, the cache and the
   * audit trail. The request's user context is used as is. Used to preview policies before they
   * are saved.
   */
  public RlsFilterResponse evaluateWithPolicies(
      @NonNull RlsFilterRequest request, @NonNull Collection<RlsPolicy> policies) {
    return compute(request, request.getUserContext(), policies, configuration).getResponse();
  }

  /** Replaces the configuration. The decision cache is rebuilt and starts empty. */
  public void updateConfiguration(@NonNull RlsConfiguration configuration) {
    this.cache = AccessDecisionCache.create(configuration.getCacheTtlSeconds());
    this.configuration = configuration;
    log.info("Row-level security configuration updated: {}", configuration);
  }

  public RlsConfiguration getConfiguration() {
    return configuration;
  }

  /** Drops every cached decision. */
  public void invalidateCache() {
    cache.invalidateAll();
  }

  public CacheStats getCacheStats() {
    return cache.stats();
  }

  @VisibleForTesting
  AccessDecisionCache getCache() {
    return cache;
  }

  @Override
  public void close() {
    auditRecorder.close();
    storeCalls.close();
  }

  /**
   * Resolves the user's context and reads the store generations in one pass, so the whole read
   * shares the single time limit of the enclosing call.
   */
  private StoreSnapshot readSnapshot(RlsFilterRequest request, Instant now) {
    UserSecurityContext context = contextResolver.resolve(request.getUserContext(), now, 0L);
    // Generations are read before the policies: a decision is never stored under a generation
    // newer than the policies it was computed from.
    long policyGeneration = policyRepository.getGeneration();
    long roleGeneration = userRoleRepository == null ? 0L : userRoleRepository.getGeneration();
    long attributeGeneration =
        userAttributeRepository == null ? 0L : userAttributeRepository.getGeneration();
    return new StoreSnapshot(
        context,
        AccessDecisionKey.of(
            request, context, policyGeneration, roleGeneration, attributeGeneration));
  }

  private PolicyDecision compute(
      RlsFilterRequest request,
      UserSecurityContext context,
      Collection<RlsPolicy> policies,
      RlsConfiguration config) {
    try {
      return policyResolver.resolve(request, context, policies, config);
    } catch (EmitterException e) {
      log.error(
          "Failed to render filter on {}.{} for user {}",
          request.getSchemaName(),
          request.getTableName(),
          context.getUserId(),
          e);
      return PolicyDecision.builder()
          .response(RlsFilterResponse.denied(FILTER_COMPILATION_FAILED_REASON))
          .build();
    } catch (RuntimeException e) {
      log.error(
          "Unexpected failure while compiling filter on {}.{} for user {}",
          request.getSchemaName(),
          request.getTableName(),
          context.getUserId(),
          e);
      return PolicyDecision.builder()
          .response(RlsFilterResponse.denied(FILTER_COMPILATION_FAILED_REASON))
          .build();
    }
  }

  private RlsFilterResponse storeFailure(
      RlsFilterRequest request,
      RlsConfiguration config,
      Instant now,
      StoreUnavailableException e) {
    RlsFilterResponse response;
    if (config.isFailOpen()) {
      log.warn(
          "Store unavailable, granting unrestricted access to user {} as configured",
          request.getUserContext().getUserId(),
          e);
      response = RlsFilterResponse.unrestricted();
    } else {
      log.warn(
          "Store unavailable, denying access to user {}",
          request.getUserContext().getUserId(),
          e);
      response = RlsFilterResponse.denied(STORE_UNAVAILABLE_REASON);
    }
    return complete(
        request, PolicyDecision.builder().response(response).build(), config, now, false);
  }

  private RlsFilterResponse complete(
      RlsFilterRequest request,
      PolicyDecision decision,
      RlsConfiguration config,
      Instant now,
      boolean cached) {
    RlsFilterResponse response = decision.getResponse();
    if (response.isAccessDenied()) {
      log.info(
          "Access to {}.{} denied for user {}: {}",
          request.getSchemaName(),
          request.getTableName(),
          request.getUserContext().getUserId(),
          response.getDenialReason());
    } else {
      log.debug(
          "Access to {}.{} for user {} (cached: {}): {}",
          request.getSchemaName(),
          request.getTableName(),
          request.getUserContext().getUserId(),
          cached,
          response.isHasFilters() ? response.getWhereClause() : "unrestricted");
    }
    if (config.isLogAccess() || config.isAuditMode()) {
      auditRecorder.record(
          AuditEntries.forDecision(
              now,
              request,
              response,
              decision.getMatchedPolicies(),
              config.isAuditMode(),
              cached));
    }
    return config.isAuditMode() ? response.toAuditOnly() : response;
  }

  private static AuditSink createAuditSink(RlsConfiguration configuration) {
    if (StringUtils.isBlank(configuration.getAuditSinkClass())) {
      return new LoggingAuditSink();
    }
    return ReflectionUtils.createInstanceOfClass(
        configuration.getAuditSinkClass(), AuditSink.class);
  }

  @Value
  private static class StoreSnapshot {
    UserSecurityContext context;
    AccessDecisionKey key;
  }
}
