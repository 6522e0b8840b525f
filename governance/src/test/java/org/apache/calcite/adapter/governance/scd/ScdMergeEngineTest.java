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
package org.apache.calcite.adapter.governance.scd;

import org.apache.calcite.adapter.governance.GovernanceColumns;
import org.apache.calcite.adapter.governance.config.ScdConfig;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ScdMergeEngine}.
 */
@Tag("unit")
public class ScdMergeEngineTest {

  private static final String T1 = "2024-01-01T00:00:00Z";
  private static final String T2 = "2024-01-02T00:00:00Z";
  private static final String T3 = "2024-01-03T00:00:00Z";
  private static final String T4 = "2024-01-04T00:00:00Z";

  private static final ScdConfig CONFIG = ScdConfig.builder("customers_silver")
      .keys("customer_id")
      .sequenceBy("ts")
      .trackHistoryExceptColumns("op")
      .applyAsDeletes("op = 'D'")
      .build();

  private final ScdMergeEngine engine = new ScdMergeEngine(CONFIG);

  private static Map<String, Object> row(long id, String ts, String name) {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("customer_id", id);
    row.put("ts", ts);
    row.put("name", name);
    row.put("op", "U");
    return row;
  }

  private static Map<String, Object> delete(long id, String ts) {
    Map<String, Object> row = row(id, ts, null);
    row.put("op", "D");
    return row;
  }

  private static Instant t(String text) {
    return Instant.parse(text);
  }

  private static BusinessKey key(long id) {
    return BusinessKey.of("customer_id", id);
  }

  private HistoryTable mergeInto(HistoryTable table, List<Map<String, Object>> batch) {
    return engine.merge(batch, table).applyTo(table);
  }

  @Test void testNewKeyOpensVersion() {
    MergeResult result = engine.merge(
        Collections.singletonList(row(1, T1, "Ann")), HistoryTable.empty());

    assertEquals(1, result.getNewKeys());
    assertEquals(1, result.getVersionsOpened());
    assertEquals(0, result.getVersionsClosed());
    HistoryTable table = result.applyTo(HistoryTable.empty());
    VersionedRecord current = table.current().get(0);
    assertEquals(t(T1), current.getValidFrom());
    assertNull(current.getValidTo());
    assertEquals("Ann", current.get("name"));
  }

  @Test void testChangeClosesAndOpens() {
    // supplied out of order on purpose
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Arrays.asList(row(1, T2, "Ann Lee"), row(1, T1, "Ann")));

    List<VersionedRecord> history = table.history(key(1));
    assertEquals(2, history.size());
    assertEquals(t(T1), history.get(0).getValidFrom());
    assertEquals(t(T2), history.get(0).getValidTo());
    assertEquals("Ann", history.get(0).get("name"));
    assertEquals(t(T2), history.get(1).getValidFrom());
    assertNull(history.get(1).getValidTo());
    assertEquals("Ann Lee", history.get(1).get("name"));

    assertEquals("Ann", table.asOf(t("2024-01-01T12:00:00Z")).get(0).get("name"));
    assertEquals("Ann Lee", table.asOf(t(T2)).get(0).get("name"));
    assertTrue(table.asOf(t("2023-12-31T00:00:00Z")).isEmpty());
  }

  @Test void testIncrementalBatches() {
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Collections.singletonList(row(1, T1, "Ann")));
    MergeResult second = engine.merge(Collections.singletonList(row(1, T3, "Ann Lee")), table);

    assertEquals(0, second.getNewKeys());
    assertEquals(1, second.getVersionsOpened());
    assertEquals(1, second.getVersionsClosed());
    KeyDelta delta = second.getDeltas().get(0);
    assertEquals(t(T3), delta.getOpened().get(0).getValidFrom());
    assertEquals(t(T3), delta.getClosed().get(0).getValidTo());
    assertEquals(table.get(key(1)), delta.getBefore());
  }

  @Test void testStaleRecordsAreDiscarded() {
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Collections.singletonList(row(1, T2, "Ann")));

    MergeResult result = engine.merge(Arrays.asList(row(1, T1, "Old"), row(1, T2, "Same time")),
        table);

    assertEquals(2, result.getStaleDiscarded());
    assertFalse(result.hasChanges());
    assertEquals("Ann", result.applyTo(table).current().get(0).get("name"));
  }

  @Test void testNoopUpdateCreatesNoVersion() {
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Collections.singletonList(row(1, T1, "Ann")));
    Map<String, Object> sameButOp = row(1, T2, "Ann");
    sameButOp.put("op", "I");

    MergeResult result = engine.merge(Collections.singletonList(sameButOp), table);

    assertEquals(1, result.getNoopDiscarded());
    assertFalse(result.hasChanges());
  }

  @Test void testNumericValuesCompareByValue() {
    Map<String, Object> first = row(1, T1, "Ann");
    first.put("balance", 10);
    HistoryTable table = mergeInto(HistoryTable.empty(), Collections.singletonList(first));

    Map<String, Object> asLong = row(1, T2, "Ann");
    asLong.put("balance", 10L);
    Map<String, Object> asDecimal = row(1, T3, "Ann");
    asDecimal.put("balance", new BigDecimal("10.00"));

    MergeResult result = engine.merge(Arrays.asList(asLong, asDecimal), table);

    assertEquals(2, result.getNoopDiscarded());
    assertFalse(result.hasChanges());
  }

  @Test void testNullUpdatesAreIgnoredByDefault() {
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Collections.singletonList(row(1, T1, "Ann")));

    MergeResult result = engine.merge(Collections.singletonList(row(1, T2, null)), table);

    assertEquals(1, result.getNoopDiscarded());
    assertFalse(result.hasChanges());
  }

  @Test void testNullUpdatesAreChangesWhenNotIgnored() {
    ScdMergeEngine strict = new ScdMergeEngine(ScdConfig.builder("customers_silver")
        .keys("customer_id")
        .sequenceBy("ts")
        .trackHistoryExceptColumns("op")
        .ignoreNullUpdates(false)
        .build());
    HistoryTable table = strict.merge(Collections.singletonList(row(1, T1, "Ann")),
        HistoryTable.empty()).applyTo(HistoryTable.empty());

    MergeResult result = strict.merge(Collections.singletonList(row(1, T2, null)), table);

    assertEquals(1, result.getVersionsOpened());
    VersionedRecord current = result.applyTo(table).current().get(0);
    assertTrue(current.getAttributes().containsKey("name"));
    assertNull(current.get("name"));
  }

  @Test void testIgnoredNullKeepsPreviousValueInNewVersion() {
    Map<String, Object> first = row(1, T1, "Ann");
    first.put("city", "Singapore");
    HistoryTable table = mergeInto(HistoryTable.empty(), Collections.singletonList(first));

    Map<String, Object> update = row(1, T2, "Ann Lee");
    update.put("city", null);
    VersionedRecord current = mergeInto(table, Collections.singletonList(update))
        .current().get(0);

    assertEquals("Ann Lee", current.get("name"));
    assertEquals("Singapore", current.get("city"));
  }

  @Test void testQualityMetadataComesFromIncomingRow() {
    Map<String, Object> flagged = row(1, T1, "Ann");
    flagged.put("email", "ann@");
    flagged.put(GovernanceColumns.DATA_QUALITY_FLAGS, "email_validate_email");
    flagged.put(GovernanceColumns.QUALITY_SCORE, 0);
    flagged.put("is_valid_postal_code", false);
    HistoryTable table = mergeInto(HistoryTable.empty(), Collections.singletonList(flagged));

    Map<String, Object> clean = row(1, T2, "Ann");
    clean.put("email", "ann@example.com");
    clean.put(GovernanceColumns.DATA_QUALITY_FLAGS, null);
    clean.put(GovernanceColumns.QUALITY_SCORE, 100);
    clean.put("is_valid_postal_code", null);
    VersionedRecord current = mergeInto(table, Collections.singletonList(clean))
        .current().get(0);

    assertEquals("ann@example.com", current.get("email"));
    assertEquals(100, current.get(GovernanceColumns.QUALITY_SCORE));
    assertNull(current.get(GovernanceColumns.DATA_QUALITY_FLAGS));
    assertNull(current.get("is_valid_postal_code"));
  }

  @Test void testFractionalSequenceValuesStayDistinct() {
    ScdMergeEngine versioned = new ScdMergeEngine(
        ScdConfig.generic("items_history", Collections.singletonList("id"), "version"));
    Map<String, Object> first = new LinkedHashMap<String, Object>();
    first.put("id", 1);
    first.put("version", 1.2);
    first.put("name", "A");
    Map<String, Object> second = new LinkedHashMap<String, Object>(first);
    second.put("version", 1.7);
    second.put("name", "B");

    MergeResult result = versioned.merge(Arrays.asList(second, first), HistoryTable.empty());

    assertEquals(2, result.getVersionsOpened());
    assertEquals(0, result.getSupersededInBatch());
    VersionedRecord current = result.applyTo(HistoryTable.empty()).current().get(0);
    assertEquals("B", current.get("name"));
  }

  @Test void testDeleteClosesCurrentVersion() {
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Collections.singletonList(row(1, T1, "Ann")));

    MergeResult result = engine.merge(Collections.singletonList(delete(1, T2)), table);
    HistoryTable after = result.applyTo(table);

    assertEquals(1, result.getDeletes());
    assertEquals(1, result.getVersionsClosed());
    assertEquals(0, result.getVersionsOpened());
    assertTrue(after.current().isEmpty());
    VersionedRecord closed = after.history(key(1)).get(0);
    assertEquals(t(T2), closed.getValidTo());
    assertTrue(closed.isDeleted());
    assertTrue(after.get(key(1)).isDeleted());
  }

  @Test void testDeleteWithUnchangedValuesStillCloses() {
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Collections.singletonList(row(1, T1, "Ann")));
    Map<String, Object> deleteRow = row(1, T2, "Ann");
    deleteRow.put("op", "D");

    MergeResult result = engine.merge(Collections.singletonList(deleteRow), table);

    assertEquals(1, result.getDeletes());
    assertEquals(0, result.getNoopDiscarded());
  }

  @Test void testDeleteOfUnknownKeyIsIgnored() {
    MergeResult result = engine.merge(Collections.singletonList(delete(5, T1)),
        HistoryTable.empty());

    assertEquals(1, result.getDeletesIgnored());
    assertFalse(result.hasChanges());
  }

  @Test void testKeyReopensAfterDelete() {
    HistoryTable table = mergeInto(HistoryTable.empty(),
        Arrays.asList(row(1, T1, "Ann"), delete(1, T2)));

    MergeResult late = engine.merge(
        Collections.singletonList(row(1, "2024-01-01T12:00:00Z", "Late")), table);
    assertEquals(1, late.getStaleDiscarded());

    HistoryTable reopened = mergeInto(table, Collections.singletonList(row(1, T4, "Ann again")));
    List<VersionedRecord> history = reopened.history(key(1));
    assertEquals(2, history.size());
    assertEquals(t(T4), history.get(1).getValidFrom());
    assertNull(history.get(1).getValidTo());
    assertEquals("Ann again", reopened.current().get(0).get("name"));
    assertTrue(reopened.asOf(t(T3)).isEmpty());
  }

  @Test void testSameSequenceLastWriteWins() {
    MergeResult result = engine.merge(
        Arrays.asList(row(1, T1, "First"), row(2, T1, "Other"), row(1, T1, "Second")),
        HistoryTable.empty());

    assertEquals(1, result.getSupersededInBatch());
    assertEquals(2, result.getVersionsOpened());
    HistoryTable table = result.applyTo(HistoryTable.empty());
    assertEquals(1, table.history(key(1)).size());
    assertEquals("Second", table.history(key(1)).get(0).get("name"));
  }

  @Test void testMalformedRecordsAreRejectedIndividually() {
    Map<String, Object> noKey = row(1, T1, "x");
    noKey.remove("customer_id");
    Map<String, Object> noSequence = row(2, T1, "x");
    noSequence.put("ts", null);
    Map<String, Object> badSequence = row(3, "yesterday", "x");

    List<Map<String, Object>> batch = new ArrayList<Map<String, Object>>();
    batch.add(noKey);
    batch.add(row(4, T1, "Good"));
    batch.add(null);
    batch.add(noSequence);
    batch.add(badSequence);

    MergeResult result = engine.merge(batch, HistoryTable.empty());

    assertEquals(4, result.getRejected().size());
    assertEquals(0, result.getRejected().get(0).getIndex());
    assertEquals(2, result.getRejected().get(1).getIndex());
    assertNull(result.getRejected().get(1).getRow());
    assertTrue(result.getRejected().get(2).getReason().contains("ts"));
    assertTrue(result.getRejected().get(3).getReason().contains("yesterday"));
    assertEquals(1, result.getVersionsOpened());
    assertEquals(key(4), result.getDeltas().get(0).getKey());
  }

  @Test void testIntegrityFailureOnlyAffectsItsKey() {
    BusinessKey corrupt = key(9);
    VersionedRecord v1 = new VersionedRecord(corrupt, row(9, T1, "a"), t(T1), t(T3), false);
    VersionedRecord v2 = VersionedRecord.open(corrupt, row(9, T2, "b"), t(T2));
    HistoryTable table =
        HistoryTable.of(Collections.singletonList(KeyHistory.of(corrupt, Arrays.asList(v1, v2))));

    MergeResult result = engine.merge(Arrays.asList(row(9, T4, "c"), row(10, T4, "new")), table);

    assertEquals(1, result.getFailures().size());
    assertEquals(corrupt, result.getFailures().get(0).getKey());
    assertEquals(1, result.getDeltas().size());
    assertEquals(key(10), result.getDeltas().get(0).getKey());
    assertEquals(1, result.getVersionsOpened());
    assertEquals(0, result.getVersionsClosed());
    assertEquals(2, result.applyTo(table).history(corrupt).size());
  }

  @Test void testMixedNumericKeyTypesAreOneKey() {
    Map<String, Object> asInt = row(1, T1, "Ann");
    asInt.put("customer_id", 1);
    MergeResult result = engine.merge(Arrays.asList(asInt, row(1, T2, "Ann Lee")),
        HistoryTable.empty());

    assertEquals(1, result.getDeltas().size());
    assertEquals(2, result.getDeltas().get(0).getAfter().size());
  }

  @Test void testValidityColumnsInInputAreIgnored() {
    Map<String, Object> input = row(1, T2, "Ann");
    input.put("valid_from", t(T1));
    input.put("valid_to", t(T3));

    VersionedRecord current = mergeInto(HistoryTable.empty(), Collections.singletonList(input))
        .current().get(0);

    assertEquals(t(T2), current.getValidFrom());
    assertFalse(current.getAttributes().containsKey("valid_from"));
    assertTrue(input.containsKey("valid_from"));
    assertEquals(t(T2), current.toRow().get("valid_from"));
  }

  @Test void testParallelMergeMatchesSequential() throws Exception {
    List<Map<String, Object>> batch = new ArrayList<Map<String, Object>>();
    for (int i = 0; i < 50; i++) {
      batch.add(row(i, T1, "v1-" + i));
      batch.add(row(i, T2, "v2-" + i));
      if (i % 5 == 0) {
        batch.add(delete(i, T3));
      }
    }

    HistoryTable sequential = mergeInto(HistoryTable.empty(), batch);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      MergeResult parallel = new ScdMergeEngine(CONFIG, executor)
          .merge(batch, HistoryTable.empty());
      assertEquals(100, parallel.getVersionsOpened());
      assertEquals(10, parallel.getDeletes());
      assertEquals(sequential.allVersions(), parallel.applyTo(HistoryTable.empty()).allVersions());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test void testInterruptedMergeIsCancelled() {
    Thread.currentThread().interrupt();
    try {
      assertThrows(CancellationException.class,
          () -> engine.merge(Collections.singletonList(row(1, T1, "Ann")), HistoryTable.empty()));
    } finally {
      Thread.interrupted();
    }
  }

  @Test void testMergeDoesNotModifyInput() {
    Map<String, Object> input = row(1, T1, "Ann");
    Map<String, Object> copy = new HashMap<String, Object>(input);
    engine.merge(Collections.singletonList(input), HistoryTable.empty());
    assertEquals(copy, input);
  }
}
