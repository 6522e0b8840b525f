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

import org.apache.calcite.adapter.governance.masking.FieldMask;
import org.apache.calcite.adapter.governance.quality.TransformerRegistry;
import org.apache.calcite.adapter.governance.quality.ValidatorRegistry;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for loading {@link GovernanceConfig} from YAML.
 */
@Tag("unit")
public class GovernanceConfigTest {

  @Test void testLoadFromResource() throws IOException {
    GovernanceConfig config = GovernanceConfig.fromResource("/customers-governance.yaml");

    assertEquals(2, config.getParallelism());
    assertEquals(5, config.getMaxCommitAttempts());
    assertEquals("pii_access_grants", config.getGrantTable());
    assertEquals(Arrays.asList("customers", "transactions"),
        Arrays.asList(config.getTables().keySet().toArray()));
  }

  @Test void testCustomerTable() throws IOException {
    TableDefinition customers =
        GovernanceConfig.fromResource("/customers-governance.yaml").getTable("customers");

    assertEquals(9, customers.getColumns().size());
    assertEquals("BIGINT", customers.getColumns().get(0).getType());

    TableConfig cleansing = customers.getCleansing();
    assertEquals("customers", cleansing.getName());
    assertNull(cleansing.getSourcePrefix());
    assertEquals("standardize_nric", cleansing.getRule("nric").getTransformer());
    assertEquals(Collections.singletonList("validate_gender"),
        cleansing.getRule("gender").getValidators());
    assertEquals("standardize_phone_number", cleansing.getRule("phone").getTransformer());
    assertEquals(Arrays.asList("nric", "full_name"),
        Arrays.asList(cleansing.getUppercaseFields().toArray()));
    assertEquals(Arrays.asList("email", "address"),
        Arrays.asList(cleansing.getFillNullFields().toArray()));
    assertEquals(1, cleansing.getDerivedFields().size());
    assertEquals("is_valid_postal_code",
        cleansing.getDerivedFields().get(0).getValidityColumn());
    assertEquals("silver_processed_ts", cleansing.getProcessedTimestampColumn());

    ScdConfig scd = customers.getScd();
    assertEquals("customers_silver", scd.getTargetName());
    assertEquals(Collections.singletonList("customer_id"), scd.getKeys());
    assertTrue(scd.isIgnoreNullUpdates());
    assertTrue(scd.isDelete(Collections.<String, Object>singletonMap("operation", "DELETE")));

    assertEquals(FieldMask.of("address", "mask_address", "postal_code"),
        customers.getMasking().getMask("address"));
    assertEquals("mask_nric", customers.getMasking().getMask("nric").getFunction());
    assertEquals(6, customers.getGoldColumns().size());
  }

  @Test void testTransactionTableDefaults() throws IOException {
    TableDefinition transactions =
        GovernanceConfig.fromResource("/customers-governance.yaml").getTable("transactions");

    assertEquals("VARCHAR", transactions.getColumns().get(1).getType());
    assertTrue(transactions.getCleansing().getRules().isEmpty());
    assertEquals("transactions_history", transactions.getScd().getTargetName());
    assertFalse(transactions.getScd().isIgnoreNullUpdates());
    assertEquals(Arrays.asList("status", "amount"),
        transactions.getScd().getTrackHistoryColumns());
    assertTrue(transactions.getMasking().isEmpty());
  }

  @Test void testUnknownTable() throws IOException {
    GovernanceConfig config = GovernanceConfig.fromResource("/customers-governance.yaml");
    assertThrows(IllegalArgumentException.class, () -> config.getTable("orders"));
  }

  @Test void testMissingResource() {
    assertThrows(IOException.class, () -> GovernanceConfig.fromResource("/missing.yaml"));
  }

  @Test void testDuplicateTable() {
    String yaml = "tables:\n"
        + "  - {name: t, scd: {keys: [id], sequenceBy: ts}}\n"
        + "  - {name: t, scd: {keys: [id], sequenceBy: ts}}\n";
    assertThrows(IllegalArgumentException.class, () -> load(yaml));
  }

  @Test void testTableWithoutScd() {
    assertThrows(IllegalArgumentException.class, () -> load("tables:\n  - {name: t}\n"));
  }

  @Test void testBadInteger() {
    assertThrows(IllegalArgumentException.class, () -> load("parallelism: lots\n"));
  }

  @Test void testDefaults() throws IOException {
    GovernanceConfig config = load("tables: []\n");
    assertEquals(1, config.getParallelism());
    assertEquals(GovernanceConfig.DEFAULT_MAX_COMMIT_ATTEMPTS, config.getMaxCommitAttempts());
    assertEquals(GovernanceConfig.DEFAULT_GRANT_TABLE, config.getGrantTable());
  }

  @Test void testUnknownNamesRejectedAgainstRegistries() {
    TableConfig config = TableConfig.builder("t")
        .transform("a", "shout")
        .build();
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> config.checkNames(TransformerRegistry.defaults(), ValidatorRegistry.defaults()));
    assertTrue(e.getMessage().contains("shout"));

    assertThrows(IllegalArgumentException.class,
        () -> TableConfig.builder("t")
            .validate("a", "validate_nothing")
            .registries(TransformerRegistry.defaults(), ValidatorRegistry.defaults())
            .build());
  }

  @Test void testStandardCustomerConfigIsValid() {
    TableConfig config = StandardConfigs.customerCleansing();
    config.checkNames(TransformerRegistry.defaults(), ValidatorRegistry.defaults());
    assertEquals(Arrays.asList("nric", "email", "gender", "country", "phone", "full_name",
        "address"), ruleNames(config));
    assertNull(config.getSourcePrefix());
  }

  private static List<String> ruleNames(TableConfig config) {
    List<String> names = new ArrayList<String>();
    for (FieldRule rule : config.getRules()) {
      names.add(rule.getFieldName());
    }
    return names;
  }

  private static GovernanceConfig load(String yaml) throws IOException {
    return GovernanceConfig.load(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }
}
