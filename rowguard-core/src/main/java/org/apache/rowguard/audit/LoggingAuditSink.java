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

import lombok.extern.log4j.Log4j2;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.apache.rowguard.model.audit.RlsAuditEntry;
import org.apache.rowguard.model.exception.ErrorCode;
import org.apache.rowguard.model.exception.InternalException;
import org.apache.rowguard.spi.audit.AuditSink;

/** Writes audit entries as single line JSON to the {@code org.apache.rowguard.audit} logger. */
@Log4j2(topic = "org.apache.rowguard.audit")
public class LoggingAuditSink implements AuditSink {
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  @Override
  public void write(RlsAuditEntry entry) {
    log.info(toJson(entry));
  }

  static String toJson(RlsAuditEntry entry) {
    try {
      return MAPPER.writeValueAsString(entry);
    } catch (JsonProcessingException e) {
      throw new InternalException(ErrorCode.PARSE_EXCEPTION, "Failed to serialize audit entry", e);
    }
  }
}
