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
 
package org.apache.rowguard.context;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

import lombok.extern.log4j.Log4j2;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;

import org.apache.rowguard.exception.StoreUnavailableException;

/**
 * Runs calls to the policy, role and attribute stores under a time limit. Every failure, including
 * a timeout, surfaces as {@link StoreUnavailableException}.
 */
@Log4j2
public class StoreCalls implements Closeable {
  private final ExecutorService executorService;
  private final TimeLimiter timeLimiter;

  public StoreCalls() {
    this(
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("rowguard-store-%d")
                .setDaemon(true)
                .build()));
  }

  StoreCalls(ExecutorService executorService) {
    this.executorService = executorService;
    this.timeLimiter = SimpleTimeLimiter.create(executorService);
  }

  /**
   * Runs {@code call}, giving up after {@code timeoutMillis}. A non positive timeout runs the call
   * on the calling thread without a limit.
   *
   * @throws StoreUnavailableException if the call fails or times out
   */
  public <T> T call(String description, long timeoutMillis, Callable<T> call) {
    if (timeoutMillis <= 0) {
      try {
        return call.call();
      } catch (Exception e) {
        throw new StoreUnavailableException(description + " failed", e);
      }
    }
    try {
      return timeLimiter.callWithTimeout(call, Duration.ofMillis(timeoutMillis));
    } catch (TimeoutException e) {
      log.warn("{} timed out after {} ms", description, timeoutMillis);
      throw new StoreUnavailableException(
          String.format("%s timed out after %d ms", description, timeoutMillis), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreUnavailableException(description + " was interrupted", e);
    } catch (ExecutionException | UncheckedExecutionException e) {
      throw new StoreUnavailableException(description + " failed", e.getCause());
    }
  }

  @Override
  public void close() {
    executorService.shutdownNow();
  }
}
