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
package org.apache.calcite.adapter.governance.access;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link JdbcAccessGrantStore} against an in-memory H2 database.
 */
@Tag("unit")
public class JdbcAccessGrantStoreTest {

  private static final Instant JAN = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instant FEB = Instant.parse("2024-02-01T00:00:00Z");
  private static final Instant MAR = Instant.parse("2024-03-01T00:00:00Z");

  private String jdbcUrl;
  private Connection keepAlive;
  private JdbcAccessGrantStore store;

  @BeforeEach
  public void setUp() throws Exception {
    jdbcUrl = "jdbc:h2:mem:grants_" + UUID.randomUUID().toString().replace("-", "")
        + ";DB_CLOSE_DELAY=-1";
    keepAlive = DriverManager.getConnection(jdbcUrl);
    store = new JdbcAccessGrantStore(jdbcUrl, "pii_access_grants");
    store.createTable();
  }

  @AfterEach
  public void tearDown() throws Exception {
    try (Statement statement = keepAlive.createStatement()) {
      statement.execute("DROP ALL OBJECTS");
    }
    keepAlive.close();
  }

  @Test void testDefaultGrantsRoundTrip() throws SQLException {
    for (AccessGrant grant : DefaultGrants.at(JAN)) {
      store.insert(grant);
    }

    List<AccessGrant> grants = store.grantsOf("scientist@company.com");
    assertEquals(1, grants.size());
    AccessGrant grant = grants.get(0);
    assertEquals(AccessLevel.PARTIAL_ACCESS, grant.getAccessLevel());
    assertEquals("scientist", grant.getUserGroup());
    assertEquals(JAN, grant.getGrantedAt());
    assertNull(grant.getExpiresAt());
    assertEquals(AccessLevel.FULL_ACCESS, store.resolveAccessLevel("governance@company.com", FEB));
    assertEquals(AccessLevel.MASKED_ONLY, store.resolveAccessLevel("nobody@company.com", FEB));
  }

  @Test void testTemporaryGrantExpires() throws SQLException {
    store.insert(AccessGrant.builder("ana@company.com", AccessLevel.MASKED_ONLY)
        .grantedAt(JAN).build());
    store.insert(AccessGrant.builder("ana@company.com", AccessLevel.FULL_ACCESS)
        .grantedAt(FEB)
        .expiresAt(MAR)
        .grantedBy("dpo@company.com")
        .approvalTicketId("GOV-42")
        .reason("Fraud investigation")
        .build());

    AccessGrant during = store.effectiveGrant("ana@company.com", FEB.plusSeconds(3600));
    assertEquals(AccessLevel.FULL_ACCESS, during.getAccessLevel());
    assertEquals("GOV-42", during.getApprovalTicketId());
    assertEquals(AccessLevel.MASKED_ONLY, store.resolveAccessLevel("ana@company.com", MAR));
  }

  @Test void testDeactivationAppliesToNextLookup() throws SQLException {
    store.insert(AccessGrant.builder("ana@company.com", AccessLevel.FULL_ACCESS)
        .grantedAt(JAN).build());
    assertEquals(AccessLevel.FULL_ACCESS, store.resolveAccessLevel("ana@company.com", FEB));

    assertEquals(1, store.deactivate("ana@company.com"));

    assertEquals(AccessLevel.MASKED_ONLY, store.resolveAccessLevel("ana@company.com", FEB));
    assertEquals(0, store.deactivate("ana@company.com"));
  }

  @Test void testUnknownLevelReadsAsMaskedOnly() throws SQLException {
    try (Statement statement = keepAlive.createStatement()) {
      statement.execute("INSERT INTO pii_access_grants (user_email, access_level, granted_at, "
          + "is_active) VALUES ('eve@company.com', 'root', TIMESTAMP '2024-01-01 00:00:00', TRUE)");
    }
    assertEquals(AccessLevel.MASKED_ONLY, store.resolveAccessLevel("eve@company.com", FEB));
  }

  @Test void testLookupFailureIsWrapped() {
    JdbcAccessGrantStore missing = new JdbcAccessGrantStore(jdbcUrl, "no_such_table");
    assertThrows(AccessGrantLookupException.class,
        () -> missing.effectiveGrant("ana@company.com", FEB));
  }

  @Test void testRejectsUnsafeTableName() {
    assertThrows(IllegalArgumentException.class,
        () -> new JdbcAccessGrantStore(jdbcUrl, "grants; DROP TABLE x"));
    assertEquals("gov.grants", new JdbcAccessGrantStore(jdbcUrl, "gov.grants").getTableName());
  }

  @Test void testCreateTableIsRepeatable() throws SQLException {
    store.createTable();
    assertEquals(0, store.grantsOf("ana@company.com").size());
  }
}
