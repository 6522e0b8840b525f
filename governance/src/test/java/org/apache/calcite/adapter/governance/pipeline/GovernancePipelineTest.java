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
package org.apache.calcite.adapter.governance.pipeline;

import org.apache.calcite.adapter.governance.GovernanceColumns;
import org.apache.calcite.adapter.governance.cleanse.CleansingBuilder;
import org.apache.calcite.adapter.governance.config.GovernanceConfig;
import org.apache.calcite.adapter.governance.config.ScdConfig;
import org.apache.calcite.adapter.governance.config.StandardConfigs;
import org.apache.calcite.adapter.governance.scd.CommitConflictException;
import org.apache.calcite.adapter.governance.scd.HistoryStore;
import org.apache.calcite.adapter.governance.scd.HistoryTable;
import org.apache.calcite.adapter.governance.scd.InMemoryHistoryStore;
import org.apache.calcite.adapter.governance.scd.MergeResult;
import org.apache.calcite.adapter.governance.scd.ScdMergeEngine;
import org.apache.calcite.adapter.governance.scd.VersionedRecord;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GovernancePipeline}.
 */
@Tag("unit")
public class GovernancePipelineTest {

  private static Map<String, Object> customer(long id, String updatedAt, String email) {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("customer_id", id);
    row.put("full_name", "customer " + id);
    row.put("nric", "s1234567d");
    row.put("email", email);
    row.put("updated_at", updatedAt);
    return row;
  }

  private static List<Map<String, Object>> batch() {
    return Arrays.asList(
        customer(1, "2024-01-01T00:00:00Z", "one@example.com"),
        customer(1, "2024-02-01T00:00:00Z", "one@example.org"),
        customer(2, "2024-01-15T00:00:00Z", "broken"),
        customer(3, "not a time", "three@example.com"));
  }

  private static GovernancePipeline pipeline(HistoryStore store, int maxAttempts,
      GovernancePipeline.ProgressListener listener) {
    return new GovernancePipeline("customers",
        new CleansingBuilder(StandardConfigs.customerCleansing()),
        new ScdMergeEngine(ScdConfig.forCustomers("customers_silver", "updated_at")),
        store, maxAttempts, listener);
  }

  private static VersionedRecord current(HistoryTable table, long customerId) {
    for (VersionedRecord version : table.current()) {
      if (((Number) version.get("customer_id")).longValue() == customerId) {
        return version;
      }
    }
    throw new AssertionError("No current version for customer " + customerId);
  }

  @Test void testCleanseMergeAndCommit() {
    InMemoryHistoryStore store = new InMemoryHistoryStore("customers_silver");
    RecordingListener listener = new RecordingListener();

    PipelineResult result = pipeline(store, 3, listener).execute(batch());

    assertTrue(result.isCommitted());
    assertFalse(result.isFailed());
    assertEquals(4, result.getInputRows());
    assertEquals(4, result.getCleansedRows());
    assertEquals(1, result.getQualitySummary().getFlaggedRows());
    assertEquals(1, result.getRejected().size());
    assertEquals(3, result.getRejected().get(0).getIndex());
    assertFalse(result.isCompleteSuccess());
    assertEquals(1, result.getCommitAttempts());
    assertEquals(3, result.getMerge().getVersionsOpened());

    HistoryTable table = store.snapshot();
    assertEquals(2, table.current().size());
    assertEquals("S1234567D", current(table, 1L).get("nric"));
    assertEquals("email_validate_email",
        current(table, 2L).get(GovernanceColumns.DATA_QUALITY_FLAGS));
    assertEquals(Arrays.asList("start:cleansing", "done:cleansing", "start:merge", "done:merge",
        "start:commit", "attempt:1:ok", "done:commit"), listener.events);
  }

  @Test void testConflictIsRetriedAgainstFreshSnapshot() {
    ConflictingStore store = new ConflictingStore(1);
    RecordingListener listener = new RecordingListener();

    PipelineResult result = pipeline(store, 3, listener).execute(batch());

    assertTrue(result.isCommitted());
    assertEquals(2, result.getCommitAttempts());
    assertEquals(1, result.getErrors().size());
    assertTrue(listener.events.contains("attempt:1:conflict"));
    assertEquals(2, store.snapshot().current().size());
  }

  @Test void testPersistentConflictFails() {
    ConflictingStore store = new ConflictingStore(Integer.MAX_VALUE);

    PipelineResult result = pipeline(store, 2, null).execute(batch());

    assertTrue(result.isFailed());
    assertFalse(result.isCommitted());
    assertEquals(2, result.getCommitAttempts());
    assertEquals(2, result.getErrors().size());
    assertEquals(0, store.snapshot().versionCount());
  }

  @Test void testCancelledBeforeCommitLeavesStoreUnchanged() {
    InMemoryHistoryStore store = new InMemoryHistoryStore("customers_silver");
    AtomicReference<GovernancePipeline> ref = new AtomicReference<GovernancePipeline>();
    GovernancePipeline pipeline = pipeline(store, 3, new RecordingListener() {
      @Override public void onPhaseComplete(String phase, int processedItems) {
        super.onPhaseComplete(phase, processedItems);
        if (GovernancePipeline.PHASE_MERGE.equals(phase)) {
          ref.get().cancel();
        }
      }
    });
    ref.set(pipeline);

    PipelineResult result = pipeline.execute(batch());

    assertTrue(result.isCancelled());
    assertFalse(result.isCommitted());
    assertEquals(0, store.snapshot().versionCount());
  }

  @Test void testPipelineRunsAgainAfterCancellation() {
    InMemoryHistoryStore store = new InMemoryHistoryStore("customers_silver");
    AtomicReference<GovernancePipeline> ref = new AtomicReference<GovernancePipeline>();
    AtomicBoolean cancelOnce = new AtomicBoolean(true);
    GovernancePipeline pipeline = pipeline(store, 3, new RecordingListener() {
      @Override public void onPhaseComplete(String phase, int processedItems) {
        if (GovernancePipeline.PHASE_MERGE.equals(phase) && cancelOnce.getAndSet(false)) {
          ref.get().cancel();
        }
      }
    });
    ref.set(pipeline);

    assertTrue(pipeline.execute(batch()).isCancelled());
    PipelineResult second = pipeline.execute(batch());

    assertFalse(second.isCancelled());
    assertTrue(second.isCommitted());
    assertEquals(2, store.snapshot().current().size());
  }

  @Test void testStoreFailureIsReported() {
    HistoryStore broken = new InMemoryHistoryStore("customers_silver") {
      @Override public HistoryTable snapshot() {
        throw new IllegalStateException("history unavailable");
      }
    };

    PipelineResult result = pipeline(broken, 3, null).execute(batch());

    assertTrue(result.isFailed());
    assertEquals("history unavailable", result.getFailureMessage());
    assertEquals(4, result.getCleansedRows());
  }

  @Test void testCreateFromConfig() throws Exception {
    GovernanceConfig config = GovernanceConfig.fromResource("/customers-governance.yaml");
    InMemoryHistoryStore store = new InMemoryHistoryStore("customers_silver");
    Map<String, Object> raw = new LinkedHashMap<String, Object>();
    raw.put("customer_id", 10L);
    raw.put("full_name", "Tan Mei Ling");
    raw.put("nric", "t1234567j");
    raw.put("email", "mei@example.sg");
    raw.put("gender", "female");
    raw.put("address", "10 Collyer Quay, Singapore 049315");

    PipelineResult result = GovernancePipeline.create(config, "customers", store, null)
        .execute(Collections.singletonList(raw));

    assertTrue(result.isCompleteSuccess());
    Map<String, Object> row = store.snapshot().current().get(0).getAttributes();
    assertEquals("T1234567J", row.get("nric"));
    assertEquals("F", row.get("gender"));
    assertEquals("049315", row.get("postal_code"));
    assertEquals("TAN MEI LING", row.get("full_name"));
    assertEquals(100, row.get(GovernanceColumns.QUALITY_SCORE));
  }

  /** Listener that records what it is told. */
  private static class RecordingListener implements GovernancePipeline.ProgressListener {
    final List<String> events = new ArrayList<String>();

    @Override public void onPhaseStart(String phase, int totalItems) {
      events.add("start:" + phase);
    }

    @Override public void onPhaseComplete(String phase, int processedItems) {
      events.add("done:" + phase);
    }

    @Override public void onCommitAttempt(int attempt, int maxAttempts, Exception error) {
      events.add("attempt:" + attempt + (error == null ? ":ok" : ":conflict"));
    }
  }

  /** Store whose first commits conflict, as if another writer got there first. */
  private static class ConflictingStore extends InMemoryHistoryStore {
    private final AtomicInteger conflictsLeft;

    ConflictingStore(int conflicts) {
      super("customers_silver");
      this.conflictsLeft = new AtomicInteger(conflicts);
    }

    @Override public void commit(MergeResult result) throws CommitConflictException {
      if (conflictsLeft.getAndDecrement() > 0) {
        throw new CommitConflictException(getName(),
            Collections.singletonList(result.getDeltas().get(0).getKey()));
      }
      super.commit(result);
    }
  }
}
