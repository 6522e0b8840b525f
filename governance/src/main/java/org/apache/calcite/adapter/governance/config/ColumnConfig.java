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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declared column of a governed table.
 *
 * <p>Declarations drive the SQL row type of the tables exposed by
 * {@link org.apache.calcite.adapter.governance.schema.GovernanceSchema}:
 *
 * <pre>{@code
 * columns:
 *   - name: customer_id
 *     type: INTEGER
 *   - name: balance
 *     type: DECIMAL(15,2)
 *   - name: updated_at
 *     type: TIMESTAMP
 * }</pre>
 *
 * <p>The type defaults to VARCHAR.
 */
public class ColumnConfig {

  private final String name;
  private final String type;
  private final @Nullable String description;

  private ColumnConfig(Builder builder) {
    this.name = builder.name;
    this.type = builder.type != null ? builder.type.trim().toUpperCase(Locale.ROOT) : "VARCHAR";
    this.description = builder.description;
  }

  /**
   * Returns the column name.
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the SQL type (e.g., VARCHAR, INTEGER, DECIMAL(15,2)).
   */
  public String getType() {
    return type;
  }

  public @Nullable String getDescription() {
    return description;
  }

  public static ColumnConfig of(String name, String type) {
    return builder().name(name).type(type).build();
  }

  /**
   * Creates a new builder for ColumnConfig.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a ColumnConfig from a YAML/JSON map.
   *
   * @param map Configuration map with keys: name, type, description
   * @return ColumnConfig instance
   */
  public static ColumnConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    builder.name(ConfigValues.string(map, "name"));
    builder.type(ConfigValues.string(map, "type"));
    builder.description(ConfigValues.string(map, "description"));
    return builder.build();
  }

  /**
   * Parses a list of column configurations from a YAML/JSON list.
   *
   * <p>Plain strings are accepted as VARCHAR columns.
   */
  @SuppressWarnings("unchecked")
  public static List<ColumnConfig> fromList(@Nullable List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }

    List<ColumnConfig> result = new ArrayList<ColumnConfig>();
    for (Object item : list) {
      if (item instanceof Map) {
        result.add(fromMap((Map<String, Object>) item));
      } else if (item != null) {
        result.add(builder().name(item.toString()).build());
      }
    }
    return result;
  }

  @Override public String toString() {
    return name + " " + type;
  }

  /**
   * Builder for ColumnConfig.
   */
  public static class Builder {
    private String name;
    private String type;
    private String description;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public ColumnConfig build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Column name is required");
      }
      return new ColumnConfig(this);
    }
  }
}
