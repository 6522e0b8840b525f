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
package org.apache.calcite.adapter.governance.masking;

import org.apache.calcite.adapter.governance.GovernanceColumns;
import org.apache.calcite.adapter.governance.access.AccessGrant;
import org.apache.calcite.adapter.governance.access.AccessGrantLookupException;
import org.apache.calcite.adapter.governance.access.AccessGrantStore;
import org.apache.calcite.adapter.governance.access.AccessLevel;
import org.apache.calcite.adapter.governance.access.DefaultGrants;
import org.apache.calcite.adapter.governance.access.InMemoryAccessGrantStore;
import org.apache.calcite.adapter.governance.config.ScdConfig;
import org.apache.calcite.adapter.governance.scd.BusinessKey;
import org.apache.calcite.adapter.governance.scd.InMemoryHistoryStore;
import org.apache.calcite.adapter.governance.scd.ScdMergeEngine;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link MaskedReader}.
 */
@Tag("unit")
public class MaskedReaderTest {

  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private InMemoryHistoryStore store;
  private InMemoryAccessGrantStore grants;

  private static Map<String, Object> customer(long id, String ts, String email) {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("customer_id", id);
    row.put("email", email);
    row.put("nric", "S1234567D");
    row.put("updated_at", ts);
    return row;
  }

  @BeforeEach
  public void setUp() throws Exception {
    store = new InMemoryHistoryStore("customers_silver");
    ScdMergeEngine engine = new ScdMergeEngine(
        ScdConfig.forCustomers("customers_silver", "updated_at"));
    List<Map<String, Object>> batch = new ArrayList<Map<String, Object>>();
    batch.add(customer(1, "2024-01-01T00:00:00Z", "jane@example.com"));
    batch.add(customer(1, "2024-03-01T00:00:00Z", "jane.doe@example.com"));
    batch.add(customer(2, "2024-02-01T00:00:00Z", "raj@example.org"));
    store.commit(engine.merge(batch, store.snapshot()));

    grants = new InMemoryAccessGrantStore();
    for (AccessGrant grant : DefaultGrants.at(Instant.parse("2024-01-01T00:00:00Z"))) {
      grants.grant(grant);
    }
  }

  private MaskedReader reader(AccessGrantStore grantStore, List<String> columns) {
    return new MaskedReader(store, MaskingPolicy.standardPii(), grantStore,
        new MaskingEvaluator(), columns, CLOCK);
  }

  @Test void testCurrentRowsPerAccessLevel() {
    MaskedReader reader = reader(grants, ImmutableList.<String>of());

    List<Map<String, Object>> full = reader.readCurrent("governance@company.com");
    List<Map<String, Object>> partial = reader.readCurrent("scientist@company.com");
    List<Map<String, Object>> masked = reader.readCurrent("analyst@company.com");

    assertEquals(2, full.size());
    assertEquals("jane.doe@example.com", full.get(0).get("email"));
    assertEquals("j***@example.com", partial.get(0).get("email"));
    assertEquals("S****67D", partial.get(0).get("nric"));
    assertEquals("***@***", masked.get(0).get("email"));
    assertEquals("***", masked.get(1).get("nric"));
    assertEquals(1L, masked.get(0).get("customer_id"));

    Map<String, Object> row = partial.get(0);
    assertEquals(NOW, row.get(GovernanceColumns.MASKED_AT));
    assertEquals("scientist@company.com", row.get(GovernanceColumns.MASKED_FOR_USER));
    assertEquals("partial_access", row.get(GovernanceColumns.APPLIED_ACCESS_LEVEL));
  }

  @Test void testUnknownUserIsMasked() {
    Map<String, Object> row = reader(grants, ImmutableList.<String>of())
        .readCurrent("stranger@company.com").get(0);
    assertEquals("***@***", row.get("email"));
    assertEquals("masked_only", row.get(GovernanceColumns.APPLIED_ACCESS_LEVEL));
  }

  @Test void testRevocationAppliesToNextRead() {
    MaskedReader reader = reader(grants, ImmutableList.<String>of());
    assertEquals("jane.doe@example.com",
        reader.readCurrent("governance@company.com").get(0).get("email"));

    grants.deactivate("governance@company.com");

    Map<String, Object> row = reader.readCurrent("governance@company.com").get(0);
    assertEquals("***@***", row.get("email"));
    assertEquals("masked_only", row.get(GovernanceColumns.APPLIED_ACCESS_LEVEL));
  }

  @Test void testGrantLookupFailureFailsClosed() {
    AccessGrantStore broken = (userId, at) -> {
      throw new AccessGrantLookupException("grant database unavailable", null);
    };
    MaskedReader reader = reader(broken, ImmutableList.<String>of());

    assertEquals(AccessLevel.MASKED_ONLY, reader.resolveAccessLevel("governance@company.com"));
    assertEquals("***@***", reader.readCurrent("governance@company.com").get(0).get("email"));
  }

  @Test void testAsOfAndHistory() {
    MaskedReader reader = reader(grants, ImmutableList.<String>of());

    List<Map<String, Object>> asOf =
        reader.readAsOf("governance@company.com", Instant.parse("2024-01-15T00:00:00Z"));
    assertEquals(1, asOf.size());
    assertEquals("jane@example.com", asOf.get(0).get("email"));

    List<Map<String, Object>> history =
        reader.readHistory("scientist@company.com", BusinessKey.of("customer_id", 1L));
    assertEquals(2, history.size());
    assertEquals("j***@example.com", history.get(0).get("email"));
    assertEquals(Instant.parse("2024-03-01T00:00:00Z"),
        history.get(0).get(GovernanceColumns.VALID_TO));
  }

  @Test void testColumnProjection() {
    Map<String, Object> row = reader(grants, Arrays.asList("customer_id", "email"))
        .readCurrent("analyst@company.com").get(0);

    assertEquals(Arrays.asList("customer_id", "email", GovernanceColumns.MASKED_AT,
        GovernanceColumns.MASKED_FOR_USER, GovernanceColumns.APPLIED_ACCESS_LEVEL),
        new ArrayList<String>(row.keySet()));
  }
}
