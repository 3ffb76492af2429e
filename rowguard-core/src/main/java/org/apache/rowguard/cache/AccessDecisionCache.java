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
 
package org.apache.rowguard.cache;

import java.time.Duration;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

import org.apache.rowguard.resolver.PolicyDecision;

/**
 * Time bounded cache of access decisions.
 *
 * <p>Reads and writes are not coordinated: two evaluations missing the same key both compute the
 * decision and the last write wins. Decisions are deterministic for a key, so either value is
 * correct. A TTL of zero or less disables the cache.
 */
@Log4j2
public class AccessDecisionCache {
  private static final long MAXIMUM_SIZE = 10_000L;

  private final Cache<AccessDecisionKey, PolicyDecision> cache;

  private AccessDecisionCache(Cache<AccessDecisionKey, PolicyDecision> cache) {
    this.cache = cache;
  }

  public static AccessDecisionCache create(int ttlSeconds) {
    if (ttlSeconds <= 0) {
      log.info("Access decision cache disabled");
      return new AccessDecisionCache(null);
    }
    return new AccessDecisionCache(
        CacheBuilder.newBuilder()
            .maximumSize(MAXIMUM_SIZE)
            .expireAfterWrite(Duration.ofSeconds(ttlSeconds))
            .recordStats()
            .build());
  }

  public boolean isEnabled() {
    return cache != null;
  }

  public Optional<PolicyDecision> get(AccessDecisionKey key) {
    if (cache == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  public void put(AccessDecisionKey key, PolicyDecision decision) {
    if (cache != null) {
      cache.put(key, decision);
    }
  }

  public void invalidateAll() {
    if (cache != null) {
      cache.invalidateAll();
      log.debug("Access decision cache invalidated");
    }
  }

  public long size() {
    return cache == null ? 0L : cache.size();
  }

  public CacheStats stats() {
    return cache == null ? new CacheStats(0, 0, 0, 0, 0, 0) : cache.stats();
  }
}
