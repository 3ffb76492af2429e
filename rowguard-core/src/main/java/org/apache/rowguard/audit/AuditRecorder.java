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
 
package org.apache.rowguard.audit;

import java.io.Closeable;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apache.rowguard.model.audit.RlsAuditEntry;
import org.apache.rowguard.spi.audit.AuditSink;

/**
 * Hands audit entries to an {@link AuditSink} off the evaluation path. Recording is best effort:
 * a rejected dispatch or a failing sink is logged and otherwise ignored.
 */
@Log4j2
public class AuditRecorder implements Closeable {
  /** Entries waiting for the sink beyond this many are dropped. */
  public static final int DEFAULT_QUEUE_CAPACITY = 10_000;

  private final AuditSink sink;
  private final Executor executor;
  // Shut down on close when the recorder created it
  private final ExecutorService ownedExecutor;

  public AuditRecorder(@NonNull AuditSink sink, @NonNull Executor executor) {
    this(sink, executor, null);
  }

  private AuditRecorder(AuditSink sink, Executor executor, ExecutorService ownedExecutor) {
    this.sink = sink;
    this.executor = executor;
    this.ownedExecutor = ownedExecutor;
  }

  /** Creates a recorder dispatching on its own single daemon thread. */
  public static AuditRecorder create(AuditSink sink) {
    return create(sink, DEFAULT_QUEUE_CAPACITY);
  }

  @VisibleForTesting
  static AuditRecorder create(@NonNull AuditSink sink, int queueCapacity) {
    ExecutorService executorService =
        new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            new ThreadFactoryBuilder().setNameFormat("rowguard-audit-%d").setDaemon(true).build());
    return new AuditRecorder(sink, executorService, executorService);
  }

  public void record(RlsAuditEntry entry) {
    try {
      executor.execute(() -> write(entry));
    } catch (RejectedExecutionException e) {
      log.warn("Audit entry for user {} was dropped: {}", entry.getUserId(), e.getMessage());
    }
  }

  private void write(RlsAuditEntry entry) {
    try {
      sink.write(entry);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to write audit entry for user {} on {}",
          entry.getUserId(),
          entry.getObjectId(),
          e);
    }
  }

  @Override
  public void close() {
    if (ownedExecutor != null) {
      ownedExecutor.shutdown();
    }
  }
}
