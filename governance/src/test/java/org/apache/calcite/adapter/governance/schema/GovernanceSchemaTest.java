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

import org.apache.calcite.adapter.governance.access.AccessGrant;
import org.apache.calcite.adapter.governance.access.DefaultGrants;
import org.apache.calcite.adapter.governance.access.InMemoryAccessGrantStore;
import org.apache.calcite.adapter.governance.config.ColumnConfig;
import org.apache.calcite.adapter.governance.config.ScdConfig;
import org.apache.calcite.adapter.governance.config.TableDefinition;
import org.apache.calcite.adapter.governance.masking.MaskingPolicy;
import org.apache.calcite.adapter.governance.scd.HistoryStore;
import org.apache.calcite.adapter.governance.scd.InMemoryHistoryStore;
import org.apache.calcite.adapter.governance.scd.ScdMergeEngine;
import org.apache.calcite.jdbc.CalciteConnection;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GovernanceSchema} through a Calcite JDBC connection.
 */
@Tag("unit")
public class GovernanceSchemaTest {

  private Connection connection;
  private InMemoryAccessGrantStore grants;
  private final AtomicReference<String> sessionUser =
      new AtomicReference<String>("analyst@company.com");

  private static Map<String, Object> customer(long id, String ts, String email, int score) {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("customer_id", id);
    row.put("full_name", "Customer " + id);
    row.put("email", email);
    row.put("updated_at", ts);
    row.put("quality_score", score);
    return row;
  }

  @BeforeEach
  public void setUp() throws Exception {
    TableDefinition customers = TableDefinition.builder("customers")
        .columns(Arrays.asList(
            ColumnConfig.of("customer_id", "BIGINT"),
            ColumnConfig.of("full_name", "VARCHAR"),
            ColumnConfig.of("email", "VARCHAR"),
            ColumnConfig.of("updated_at", "TIMESTAMP")))
        .scd(ScdConfig.forCustomers("customers_silver", "updated_at"))
        .masking(MaskingPolicy.standardPii())
        .goldColumns(Arrays.asList("customer_id", "email"))
        .build();
    TableDefinition orders = TableDefinition.builder("orders")
        .scd(ScdConfig.generic("orders_silver", Arrays.asList("order_id"), "ts"))
        .build();

    InMemoryHistoryStore store = new InMemoryHistoryStore("customers_silver");
    List<Map<String, Object>> batch = new ArrayList<Map<String, Object>>();
    batch.add(customer(1, "2024-01-01T00:00:00Z", "jane@example.com", 100));
    batch.add(customer(1, "2024-03-01T00:00:00Z", "jane.doe@example.com", 100));
    batch.add(customer(2, "2024-02-01T00:00:00Z", "raj@example.org", 75));
    store.commit(new ScdMergeEngine(customers.getScd()).merge(batch, store.snapshot()));

    grants = new InMemoryAccessGrantStore();
    for (AccessGrant grant : DefaultGrants.at(Instant.parse("2024-01-01T00:00:00Z"))) {
      grants.grant(grant);
    }
    Map<String, HistoryStore> stores = new HashMap<String, HistoryStore>();
    stores.put("customers", store);
    stores.put("orders", new InMemoryHistoryStore("orders_silver"));

    GovernanceSchema schema = new GovernanceSchema(Arrays.asList(customers, orders), stores,
        grants, sessionUser::get,
        Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));

    connection = DriverManager.getConnection("jdbc:calcite:");
    CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
    calcite.getRootSchema().add("gov", schema);
  }

  @AfterEach
  public void tearDown() throws Exception {
    if (connection != null) {
      connection.close();
    }
  }

  private long count(String sql) throws SQLException {
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      assertTrue(rs.next());
      return rs.getLong(1);
    }
  }

  @Test void testHistoryTable() throws SQLException {
    assertEquals(3, count("SELECT COUNT(*) FROM \"gov\".\"customers_silver\""));
    assertEquals(2, count("SELECT COUNT(*) FROM \"gov\".\"customers_silver\" "
        + "WHERE \"valid_to\" IS NULL"));
    assertEquals(1, count("SELECT COUNT(*) FROM \"gov\".\"customers_silver\" "
        + "WHERE \"quality_score\" < 100"));
  }

  @Test void testCurrentTable() throws SQLException {
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("SELECT \"customer_id\", \"email\", \"valid_from\" "
             + "FROM \"gov\".\"customers_current\" ORDER BY \"customer_id\"")) {
      assertTrue(rs.next());
      assertEquals(1L, rs.getLong(1));
      assertEquals("jane.doe@example.com", rs.getString(2));
      assertTrue(rs.next());
      assertEquals(2L, rs.getLong(1));
      assertEquals("raj@example.org", rs.getString(2));
      assertFalse(rs.next());
    }
  }

  @Test void testGoldTableMasksPerSessionUser() throws SQLException {
    String sql = "SELECT \"email\", \"applied_access_level\", \"masked_for_user\" "
        + "FROM \"gov\".\"customers_gold\" WHERE \"customer_id\" = 1";
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      assertTrue(rs.next());
      assertEquals("***@***", rs.getString(1));
      assertEquals("masked_only", rs.getString(2));
      assertEquals("analyst@company.com", rs.getString(3));
    }

    sessionUser.set("scientist@company.com");
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      assertTrue(rs.next());
      assertEquals("j***@example.com", rs.getString(1));
      assertEquals("partial_access", rs.getString(2));
    }

    grants.deactivate("scientist@company.com");
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      assertTrue(rs.next());
      assertEquals("***@***", rs.getString(1));
    }
  }

  @Test void testTableWithoutColumnsIsNotExposed() {
    assertThrows(SQLException.class,
        () -> count("SELECT COUNT(*) FROM \"gov\".\"orders_silver\""));
  }
}
