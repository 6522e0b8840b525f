/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.governance.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level governance configuration: the governed tables plus run settings.
 *
 * <pre>{@code
 * parallelism: 4
 * maxCommitAttempts: 3
 * grantTable: governance.access_grants
 * tables:
 *   - name: customers
 *     columns: [...]
 *     cleansing: {...}
 *     scd: {...}
 *     masking: {...}
 * }</pre>
 *
 * <p>JSON documents are accepted too, being valid YAML.
 */
public final class GovernanceConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(GovernanceConfig.class);
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  public static final int DEFAULT_MAX_COMMIT_ATTEMPTS = 3;
  public static final String DEFAULT_GRANT_TABLE = "access_grants";

  private final Map<String, TableDefinition> tables;
  private final int parallelism;
  private final int maxCommitAttempts;
  private final String grantTable;

  public GovernanceConfig(Map<String, TableDefinition> tables, int parallelism,
      int maxCommitAttempts, String grantTable) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
    }
    if (maxCommitAttempts < 1) {
      throw new IllegalArgumentException("maxCommitAttempts must be at least 1: "
          + maxCommitAttempts);
    }
    this.tables = ImmutableMap.copyOf(tables);
    this.parallelism = parallelism;
    this.maxCommitAttempts = maxCommitAttempts;
    this.grantTable = grantTable;
  }

  public Map<String, TableDefinition> getTables() {
    return tables;
  }

  /**
   * Returns a table definition.
   *
   * @throws IllegalArgumentException if the table is not configured
   */
  public TableDefinition getTable(String name) {
    TableDefinition table = tables.get(name);
    if (table == null) {
      throw new IllegalArgumentException("Unknown table: '" + name + "'. Configured tables: "
          + tables.keySet());
    }
    return table;
  }

  public int getParallelism() {
    return parallelism;
  }

  public int getMaxCommitAttempts() {
    return maxCommitAttempts;
  }

  public String getGrantTable() {
    return grantTable;
  }

  /**
   * Reads a YAML or JSON document.
   *
   * @throws IOException if the stream cannot be read or parsed
   */
  @SuppressWarnings("unchecked")
  public static GovernanceConfig load(InputStream in) throws IOException {
    Map<String, Object> map = YAML_MAPPER.readValue(in, Map.class);
    if (map == null) {
      throw new IOException("Empty governance configuration");
    }
    return fromMap(map);
  }

  /**
   * Reads a configuration from the classpath.
   *
   * @throws IOException if the resource is missing or cannot be parsed
   */
  public static GovernanceConfig fromResource(String resourcePath) throws IOException {
    InputStream in = GovernanceConfig.class.getResourceAsStream(resourcePath);
    if (in == null) {
      throw new IOException("Resource not found: " + resourcePath);
    }
    try (InputStream stream = in) {
      GovernanceConfig config = load(stream);
      LOGGER.info("Loaded governance configuration from {}: tables={}", resourcePath,
          config.getTables().keySet());
      return config;
    }
  }

  @SuppressWarnings("unchecked")
  public static GovernanceConfig fromMap(Map<String, Object> map) {
    Map<String, TableDefinition> tables = new LinkedHashMap<>();
    Object tableList = map.get("tables");
    if (tableList instanceof List) {
      for (Object item : (List<?>) tableList) {
        if (!(item instanceof Map)) {
          throw new IllegalArgumentException("Table entries must be mappings: " + item);
        }
        TableDefinition table = TableDefinition.fromMap((Map<String, Object>) item);
        if (tables.put(table.getName(), table) != null) {
          throw new IllegalArgumentException("Table '" + table.getName()
              + "' is defined more than once");
        }
      }
    }
    Integer parallelism = ConfigValues.integer(map, "parallelism");
    Integer attempts = ConfigValues.integer(map, "maxCommitAttempts");
    String grantTable = ConfigValues.string(map, "grantTable");
    return new GovernanceConfig(tables,
        parallelism != null ? parallelism : 1,
        attempts != null ? attempts : DEFAULT_MAX_COMMIT_ATTEMPTS,
        grantTable != null ? grantTable : DEFAULT_GRANT_TABLE);
  }

  @Override public String toString() {
    return "GovernanceConfig{tables=" + tables.keySet() + ", parallelism=" + parallelism
        + ", maxCommitAttempts=" + maxCommitAttempts + "}";
  }
}
