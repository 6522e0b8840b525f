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
package org.apache.calcite.adapter.governance.schema;

import org.apache.calcite.adapter.governance.GovernanceColumns;
import org.apache.calcite.adapter.governance.config.ColumnConfig;
import org.apache.calcite.adapter.governance.config.TableDefinition;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column of a governed SQL table with its parsed type.
 */
final class GovernedColumn {
  final String name;
  final SqlValues.ColumnType type;

  GovernedColumn(String name, SqlValues.ColumnType type) {
    this.name = name;
    this.type = type;
  }

  /**
   * Columns of the historical tables: the declared columns, then the quality
   * and validity interval columns unless declared.
   */
  static List<GovernedColumn> historyColumns(TableDefinition definition) {
    Map<String, GovernedColumn> columns = new LinkedHashMap<>();
    for (ColumnConfig column : definition.getColumns()) {
      columns.put(column.getName(),
          new GovernedColumn(column.getName(), SqlValues.parseType(column.getType())));
    }
    addIfAbsent(columns, GovernanceColumns.DATA_QUALITY_FLAGS, SqlValues.VARCHAR);
    addIfAbsent(columns, GovernanceColumns.QUALITY_SCORE, SqlValues.INTEGER);
    addIfAbsent(columns, GovernanceColumns.VALID_FROM, SqlValues.TIMESTAMP);
    addIfAbsent(columns, GovernanceColumns.VALID_TO, SqlValues.TIMESTAMP);
    return new ArrayList<>(columns.values());
  }

  /**
   * Columns of the masked table: the configured gold columns (or every
   * history column), masked fields as VARCHAR, then the masking audit
   * columns.
   */
  static List<GovernedColumn> goldColumns(TableDefinition definition) {
    Map<String, GovernedColumn> history = new LinkedHashMap<>();
    for (GovernedColumn column : historyColumns(definition)) {
      history.put(column.name, column);
    }
    List<String> names = definition.getGoldColumns().isEmpty()
        ? new ArrayList<>(history.keySet())
        : definition.getGoldColumns();
    Map<String, GovernedColumn> columns = new LinkedHashMap<>();
    for (String name : names) {
      GovernedColumn column = history.get(name);
      if (column == null || definition.getMasking().isMasked(name)) {
        column = new GovernedColumn(name, SqlValues.VARCHAR);
      }
      columns.put(name, column);
    }
    addIfAbsent(columns, GovernanceColumns.MASKED_AT, SqlValues.TIMESTAMP);
    addIfAbsent(columns, GovernanceColumns.MASKED_FOR_USER, SqlValues.VARCHAR);
    addIfAbsent(columns, GovernanceColumns.APPLIED_ACCESS_LEVEL, SqlValues.VARCHAR);
    return new ArrayList<>(columns.values());
  }

  static RelDataType rowType(RelDataTypeFactory typeFactory, List<GovernedColumn> columns) {
    RelDataTypeFactory.Builder builder = typeFactory.builder();
    for (GovernedColumn column : columns) {
      builder.add(column.name, column.type.toRelDataType(typeFactory));
    }
    return builder.build();
  }

  static Object[] toRow(Map<String, Object> record, List<GovernedColumn> columns) {
    Object[] row = new Object[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      GovernedColumn column = columns.get(i);
      row[i] = SqlValues.toInternal(record.get(column.name), column.type.typeName);
    }
    return row;
  }

  private static void addIfAbsent(Map<String, GovernedColumn> columns, String name,
      SqlValues.ColumnType type) {
    if (!columns.containsKey(name)) {
      columns.put(name, new GovernedColumn(name, type));
    }
  }
}
