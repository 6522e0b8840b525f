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

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.governance.config.TableDefinition;
import org.apache.calcite.adapter.governance.scd.HistoryStore;
import org.apache.calcite.adapter.governance.scd.HistoryTable;
import org.apache.calcite.adapter.governance.scd.VersionedRecord;
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Unmasked view of a historical table: either every version or only the
 * current ones.
 *
 * <p>Each scan reads the store's latest committed snapshot.
 */
public class HistoryScannableTable extends AbstractTable implements ScannableTable {

  /** Which versions a scan returns. */
  public enum Mode {
    /** Every version, open and closed. */
    HISTORY,
    /** Open versions only. */
    CURRENT
  }

  private final String name;
  private final HistoryStore store;
  private final Mode mode;
  private final List<GovernedColumn> columns;

  public HistoryScannableTable(TableDefinition definition, HistoryStore store, Mode mode) {
    this.name = definition.getName();
    this.store = store;
    this.mode = mode;
    this.columns = GovernedColumn.historyColumns(definition);
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return GovernedColumn.rowType(typeFactory, columns);
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    return new AbstractEnumerable<@Nullable Object[]>() {
      @Override public Enumerator<@Nullable Object[]> enumerator() {
        HistoryTable snapshot = store.snapshot();
        List<VersionedRecord> versions =
            mode == Mode.CURRENT ? snapshot.current() : snapshot.allVersions();
        List<@Nullable Object[]> rows = new ArrayList<>(versions.size());
        for (Map<String, Object> record : HistoryTable.toRows(versions)) {
          rows.add(GovernedColumn.toRow(record, columns));
        }
        return Linq4j.enumerator(rows);
      }
    };
  }

  @Override public String toString() {
    return "HistoryScannableTable{" + name + ", " + mode + "}";
  }
}
