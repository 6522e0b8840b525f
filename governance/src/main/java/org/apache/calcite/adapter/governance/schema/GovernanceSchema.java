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

import org.apache.calcite.adapter.governance.access.AccessGrantStore;
import org.apache.calcite.adapter.governance.config.TableDefinition;
import org.apache.calcite.adapter.governance.masking.MaskedReader;
import org.apache.calcite.adapter.governance.masking.MaskingEvaluator;
import org.apache.calcite.adapter.governance.scd.HistoryStore;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Schema exposing governed tables to SQL.
 *
 * <p>For each table definition with declared columns and a history store,
 * three tables are registered:
 * <ul>
 *   <li>{@code {name}_silver} - every version, unmasked;</li>
 *   <li>{@code {name}_current} - current versions, unmasked;</li>
 *   <li>{@code {name}_gold} - current versions masked for the session
 *       user.</li>
 * </ul>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Connection connection = DriverManager.getConnection("jdbc:calcite:");
 * CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
 * calcite.getRootSchema().add("gov",
 *     new GovernanceSchema(config.getTables().values(), stores, grants, () -> user));
 * }</pre>
 */
public class GovernanceSchema extends AbstractSchema {
  private static final Logger LOGGER = LoggerFactory.getLogger(GovernanceSchema.class);

  public static final String SILVER_SUFFIX = "_silver";
  public static final String CURRENT_SUFFIX = "_current";
  public static final String GOLD_SUFFIX = "_gold";

  private final Map<String, Table> tableMap;

  public GovernanceSchema(Collection<TableDefinition> definitions,
      Map<String, ? extends HistoryStore> stores, AccessGrantStore grants,
      Supplier<String> sessionUser) {
    this(definitions, stores, grants, sessionUser, Clock.systemUTC());
  }

  /**
   * Creates a schema.
   *
   * @param definitions Governed tables
   * @param stores History store per table name
   * @param grants Grant store consulted by the masked tables
   * @param sessionUser Identity of the user running queries, read per scan
   * @param clock Clock for {@code masked_at} and grant expiry
   */
  public GovernanceSchema(Collection<TableDefinition> definitions,
      Map<String, ? extends HistoryStore> stores, AccessGrantStore grants,
      Supplier<String> sessionUser, Clock clock) {
    ImmutableMap.Builder<String, Table> builder = ImmutableMap.builder();
    MaskingEvaluator evaluator = new MaskingEvaluator();
    for (TableDefinition definition : definitions) {
      String name = definition.getName();
      HistoryStore store = stores.get(name);
      if (definition.getColumns().isEmpty()) {
        LOGGER.warn("Table {} declares no columns; not exposed to SQL", name);
        continue;
      }
      if (store == null) {
        LOGGER.warn("Table {} has no history store; not exposed to SQL", name);
        continue;
      }
      MaskedReader reader = new MaskedReader(store, definition.getMasking(), grants, evaluator,
          definition.getGoldColumns(), clock);
      builder.put(name + SILVER_SUFFIX,
          new HistoryScannableTable(definition, store, HistoryScannableTable.Mode.HISTORY));
      builder.put(name + CURRENT_SUFFIX,
          new HistoryScannableTable(definition, store, HistoryScannableTable.Mode.CURRENT));
      builder.put(name + GOLD_SUFFIX, new MaskedScannableTable(definition, reader, sessionUser));
      LOGGER.debug("Registered SQL tables for {}", name);
    }
    this.tableMap = builder.build();
    LOGGER.info("Governance schema created with tables {}", tableMap.keySet());
  }

  @Override protected Map<String, Table> getTableMap() {
    return tableMap;
  }
}
