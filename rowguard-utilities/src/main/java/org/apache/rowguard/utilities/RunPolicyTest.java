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
 
package org.apache.rowguard.utilities;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.annotations.VisibleForTesting;

import org.apache.rowguard.engine.RowLevelSecurityEngine;
import org.apache.rowguard.exception.ConfigurationException;
import org.apache.rowguard.model.access.RlsFilterRequest;
import org.apache.rowguard.model.access.RlsFilterResponse;
import org.apache.rowguard.model.config.RlsConfiguration;
import org.apache.rowguard.model.policy.RlsPolicy;
import org.apache.rowguard.model.security.UserSecurityContext;
import org.apache.rowguard.query.QueryFilterInjector;
import org.apache.rowguard.repository.InMemoryPolicyRepository;
import org.apache.rowguard.validation.PolicyValidator;

/**
 * Evaluates a set of policies for a synthetic user and prints the resulting access decision,
 * optionally together with a query rewritten to enforce it. Nothing is executed against a
 * database.
 */
@Log4j2
public class RunPolicyTest {
  public static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory()).registerModule(new JavaTimeModule());
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
          .configure(SerializationFeature.INDENT_OUTPUT, true)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  static final String DEFAULT_CONFIGURATION_RESOURCE = "rowguard-defaults.yaml";

  private static final String POLICIES_OPTION = "p";
  private static final String USER_CONTEXT_OPTION = "u";
  private static final String CONNECTION_OPTION = "c";
  private static final String SCHEMA_OPTION = "s";
  private static final String TABLE_OPTION = "t";
  private static final String CONFIG_OPTION = "r";
  private static final String QUERY_OPTION = "q";
  private static final String HELP_OPTION = "h";

  @VisibleForTesting
  static final Options OPTIONS =
      new Options()
          .addRequiredOption(
              POLICIES_OPTION,
              "policies",
              true,
              "The path to a yaml or json file containing the policies to evaluate")
          .addRequiredOption(
              USER_CONTEXT_OPTION,
              "userContext",
              true,
              "The path to a yaml or json file describing the user to evaluate for")
          .addRequiredOption(TABLE_OPTION, "table", true, "The table being queried")
          .addOption(
              SCHEMA_OPTION, "schema", true, "The schema of the table. Defaults to public.")
          .addOption(
              CONNECTION_OPTION, "connection", true, "The connection id. Defaults to test.")
          .addOption(
              CONFIG_OPTION,
              "rlsConfig",
              true,
              "The path to a yaml file with row-level security settings. "
                  + "These settings override the defaults.")
          .addOption(
              QUERY_OPTION,
              "query",
              true,
              "The path to a file containing a query to rewrite with the resulting filter")
          .addOption(HELP_OPTION, "help", false, "Displays help information to run this utility");

  public static void main(String[] args) throws IOException {
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd;
    try {
      cmd = parser.parse(OPTIONS, args);
    } catch (ParseException e) {
      new HelpFormatter().printHelp("rowguard-utilities.jar", OPTIONS, true);
      return;
    }
    if (cmd.hasOption(HELP_OPTION)) {
      new HelpFormatter().printHelp("RunPolicyTest", OPTIONS);
      return;
    }
    run(cmd, System.out);
  }

  @VisibleForTesting
  static void run(CommandLine cmd, PrintStream out) throws IOException {
    RlsConfiguration configuration =
        loadConfiguration(getCustomConfigurations(cmd.getOptionValue(CONFIG_OPTION)));
    PolicySet policySet = readFile(cmd.getOptionValue(POLICIES_OPTION), PolicySet.class);
    UserSecurityContext userContext =
        readFile(cmd.getOptionValue(USER_CONTEXT_OPTION), UserSecurityContext.class);
    RlsFilterRequest request =
        RlsFilterRequest.builder()
            .connectionId(cmd.getOptionValue(CONNECTION_OPTION, "test"))
            .schemaName(cmd.getOptionValue(SCHEMA_OPTION, "public"))
            .tableName(cmd.getOptionValue(TABLE_OPTION))
            .userContext(userContext)
            .build();

    RlsFilterResponse response = evaluate(configuration, policySet.getPolicies(), request);
    out.println(JSON_MAPPER.writeValueAsString(response));
    if (cmd.hasOption(QUERY_OPTION)) {
      String query =
          new String(
              Files.readAllBytes(Paths.get(cmd.getOptionValue(QUERY_OPTION))),
              StandardCharsets.UTF_8);
      if (response.isAccessDenied()) {
        log.warn("Query not rewritten, access is denied: {}", response.getDenialReason());
      } else {
        out.println(QueryFilterInjector.getInstance().inject(query, response));
      }
    }
  }

  @VisibleForTesting
  static RlsFilterResponse evaluate(
      RlsConfiguration configuration, List<RlsPolicy> policies, RlsFilterRequest request) {
    InMemoryPolicyRepository repository =
        new InMemoryPolicyRepository(new PolicyValidator(configuration.getMaxGroupDepth(), null));
    for (RlsPolicy policy : policies) {
      repository.save(policy);
    }
    log.info("Loaded {} policies", policies.size());
    try (RowLevelSecurityEngine engine =
        RowLevelSecurityEngine.builder()
            .policyRepository(repository)
            .configuration(configuration)
            .build()) {
      return engine.evaluateAccess(request);
    }
  }

  /** Reads the bundled defaults and applies the custom settings, if any, on top of them. */
  @VisibleForTesting
  static RlsConfiguration loadConfiguration(byte[] customConfigs) throws IOException {
    try (InputStream inputStream =
        RunPolicyTest.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIGURATION_RESOURCE)) {
      if (inputStream == null) {
        throw new ConfigurationException(
            "Default configuration " + DEFAULT_CONFIGURATION_RESOURCE + " not found");
      }
      JsonNode defaults = YAML_MAPPER.readTree(inputStream);
      if (!(defaults instanceof ObjectNode)) {
        throw new ConfigurationException(
            "Default configuration " + DEFAULT_CONFIGURATION_RESOURCE + " is not a mapping");
      }
      if (customConfigs != null) {
        YAML_MAPPER.readerForUpdating(defaults).readValue(customConfigs);
      }
      return YAML_MAPPER.treeToValue(defaults, RlsConfiguration.class);
    }
  }

  static byte[] getCustomConfigurations(String configPath) throws IOException {
    return configPath == null ? null : Files.readAllBytes(Paths.get(configPath));
  }

  private static <T> T readFile(String path, Class<T> type) throws IOException {
    try (InputStream inputStream = Files.newInputStream(Paths.get(path))) {
      return YAML_MAPPER.readValue(inputStream, type);
    }
  }

  /** Contents of a policies file. */
  @Value
  @Builder
  @Jacksonized
  public static class PolicySet {
    @Builder.Default List<RlsPolicy> policies = Collections.emptyList();
  }
}
