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
import org.apache.calcite.adapter.governance.masking.MaskedReader;
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
import java.util.function.Supplier;

/**
 * Current versions of a historical table masked for the session user.
 *
 * <p>The user's access level is resolved on every scan.
 */
public class MaskedScannableTable extends AbstractTable implements ScannableTable {
  private final String name;
  private final MaskedReader reader;
  private final Supplier<String> sessionUser;
  private final List<GovernedColumn> columns;

  public MaskedScannableTable(TableDefinition definition, MaskedReader reader,
      Supplier<String> sessionUser) {
    this.name = definition.getName();
    this.reader = reader;
    this.sessionUser = sessionUser;
    this.columns = GovernedColumn.goldColumns(definition);
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return GovernedColumn.rowType(typeFactory, columns);
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    return new AbstractEnumerable<@Nullable Object[]>() {
      @Override public Enumerator<@Nullable Object[]> enumerator() {
        List<Map<String, Object>> records = reader.readCurrent(sessionUser.get());
        List<@Nullable Object[]> rows = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
          rows.add(GovernedColumn.toRow(record, columns));
        }
        return Linq4j.enumerator(rows);
      }
    };
  }

  @Override public String toString() {
    return "MaskedScannableTable{" + name + "}";
  }
}
