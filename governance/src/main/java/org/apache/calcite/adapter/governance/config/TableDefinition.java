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

import org.apache.calcite.adapter.governance.masking.MaskingPolicy;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Everything the governance layers need to know about one table: its
 * declared columns, cleansing rules, SCD merge settings, masking policy and
 * the columns exposed by the masked view.
 */
public final class TableDefinition {
  private final String name;
  private final List<ColumnConfig> columns;
  private final TableConfig cleansing;
  private final ScdConfig scd;
  private final MaskingPolicy masking;
  private final List<String> goldColumns;

  private TableDefinition(Builder builder) {
    this.name = builder.name;
    this.columns = ImmutableList.copyOf(builder.columns);
    this.cleansing = builder.cleansing != null
        ? builder.cleansing : TableConfig.builder(builder.name).build();
    this.scd = builder.scd;
    this.masking = builder.masking != null ? builder.masking : MaskingPolicy.none();
    this.goldColumns = ImmutableList.copyOf(builder.goldColumns);
  }

  public String getName() {
    return name;
  }

  public List<ColumnConfig> getColumns() {
    return columns;
  }

  public TableConfig getCleansing() {
    return cleansing;
  }

  public ScdConfig getScd() {
    return scd;
  }

  public MaskingPolicy getMasking() {
    return masking;
  }

  /** Columns of the masked view; empty means every column. */
  public List<String> getGoldColumns() {
    return goldColumns;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Creates a TableDefinition from a YAML/JSON map with keys name, columns,
   * cleansing, scd, masking, goldColumns.
   */
  public static TableDefinition fromMap(Map<String, Object> map) {
    String name = ConfigValues.string(map, "name");
    Builder builder = builder(name);
    Object columns = map.get("columns");
    if (columns instanceof List) {
      builder.columns(ColumnConfig.fromList((List<?>) columns));
    }
    Map<String, Object> cleansing = ConfigValues.map(map, "cleansing");
    if (cleansing != null) {
      builder.cleansing(TableConfig.fromMap(cleansing, name));
    }
    Map<String, Object> scd = ConfigValues.map(map, "scd");
    if (scd == null) {
      throw new IllegalArgumentException("Table '" + name + "' has no scd section");
    }
    builder.scd(ScdConfig.fromMap(scd, name + "_silver"));
    builder.masking(MaskingPolicy.fromMap(ConfigValues.map(map, "masking")));
    builder.goldColumns(ConfigValues.stringList(map.get("goldColumns")));
    return builder.build();
  }

  @Override public String toString() {
    return "TableDefinition{" + name + ", columns=" + columns + "}";
  }

  /**
   * Builder for TableDefinition.
   */
  public static final class Builder {
    private final String name;
    private List<ColumnConfig> columns = ImmutableList.of();
    private TableConfig cleansing;
    private ScdConfig scd;
    private MaskingPolicy masking;
    private List<String> goldColumns = ImmutableList.of();

    private Builder(String name) {
      this.name = name;
    }

    public Builder columns(List<ColumnConfig> columns) {
      this.columns = columns;
      return this;
    }

    public Builder cleansing(@Nullable TableConfig cleansing) {
      this.cleansing = cleansing;
      return this;
    }

    public Builder scd(ScdConfig scd) {
      this.scd = scd;
      return this;
    }

    public Builder masking(@Nullable MaskingPolicy masking) {
      this.masking = masking;
      return this;
    }

    public Builder goldColumns(List<String> goldColumns) {
      this.goldColumns = goldColumns;
      return this;
    }

    public TableDefinition build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Table name is required");
      }
      if (scd == null) {
        throw new IllegalArgumentException("Table '" + name + "' needs an SCD config");
      }
      return new TableDefinition(this);
    }
  }
}
