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
import org.apache.calcite.adapter.governance.util.Values;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Merges a batch of change records into an SCD Type 2 history.
 *
 * <p>For each business key, the batch's rows are applied in sequence order
 * against the key's existing history:
 * <ul>
 *   <li>rows with the same sequence value collapse to the last one in batch
 *       order;</li>
 *   <li>rows not newer than the open version (or older than the end of a
 *       deleted key's last version) are stale and dropped;</li>
 *   <li>a delete signal closes the open version at the row's sequence value;
 *       without an open version it is ignored;</li>
 *   <li>rows equal to the open version on the tracked columns are dropped;
 *       any other row closes the open version and opens a new one.</li>
 * </ul>
 *
 * <p>The delete check runs before the no-op check, so a delete row whose
 * other values equal the current version still closes it.
 *
 * <p>When null updates are ignored, a null column takes the open version's
 * value, except for the cleansing metadata columns (see
 * {@link GovernanceColumns#isRecordMetadata}), which always come from the
 * incoming row.
 *
 * <p>The engine does not write anything: it returns a {@link MergeResult}
 * for a {@link HistoryStore} to commit. Keys are independent; with an
 * executor they are merged in parallel, and the result lists keys in order
 * of first appearance either way.
 */
public class ScdMergeEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScdMergeEngine.class);

  private final ScdConfig config;
  private final @Nullable ExecutorService executor;

  public ScdMergeEngine(ScdConfig config) {
    this(config, null);
  }

  /**
   * Creates an engine.
   *
   * @param config Merge configuration
   * @param executor Executor for per-key merges; null merges on the calling
   *     thread. The engine does not shut it down.
   */
  public ScdMergeEngine(ScdConfig config, @Nullable ExecutorService executor) {
    this.config = config;
    this.executor = executor;
  }

  public ScdConfig getConfig() {
    return config;
  }

  /**
   * Merges a batch into a history snapshot.
   *
   * @param batch Change records; not modified
   * @param target History the batch is merged into
   * @return deltas and statistics
   * @throws CancellationException if the calling thread is interrupted
   */
  public MergeResult merge(List<? extends Map<String, ?>> batch, HistoryTable target) {
    long startTime = System.currentTimeMillis();
    MergeResult.Builder result = MergeResult.builder(config.getTargetName())
        .inputRows(batch.size());

    Map<BusinessKey, List<Change>> changesByKey = new LinkedHashMap<>();
    for (int i = 0; i < batch.size(); i++) {
      Map<String, ?> row = batch.get(i);
      Change change = parse(i, row, result);
      if (change != null) {
        changesByKey.computeIfAbsent(change.key, k -> new ArrayList<>()).add(change);
      }
    }

    for (KeyOutcome outcome : mergeKeys(changesByKey, target)) {
      outcome.addTo(result);
    }
    MergeResult merged = result.elapsedMs(System.currentTimeMillis() - startTime).build();

    if (!merged.getRejected().isEmpty()) {
      LOGGER.warn("Target {}: rejected {} malformed records, first: {}",
          config.getTargetName(), merged.getRejected().size(), merged.getRejected().get(0));
    }
    for (KeyFailure failure : merged.getFailures()) {
      LOGGER.warn("Target {}: merge failed for {}: {}", config.getTargetName(),
          failure.getKey(), failure.getMessage());
    }
    if (merged.getStaleDiscarded() > 0 || merged.getDeletesIgnored() > 0) {
      LOGGER.warn("Target {}: discarded {} stale records, ignored {} deletes of keys "
              + "without a current version", config.getTargetName(),
          merged.getStaleDiscarded(), merged.getDeletesIgnored());
    }
    LOGGER.info("Target {}: merged in {}ms: {}", config.getTargetName(),
        merged.getElapsedMs(), merged);
    return merged;
  }

  private @Nullable Change parse(int index, @Nullable Map<String, ?> row,
      MergeResult.Builder result) {
    if (row == null) {
      result.addRejected(new RejectedRecord(index, "null record", null));
      return null;
    }
    BusinessKey key = BusinessKey.from(row, config.getKeys());
    if (key == null) {
      result.addRejected(
          new RejectedRecord(index, "missing key column(s) " + config.getKeys(), row));
      return null;
    }
    Object rawSequence = row.get(config.getSequenceBy());
    if (rawSequence == null) {
      result.addRejected(new RejectedRecord(index,
          "missing sequence column '" + config.getSequenceBy() + "'", row));
      return null;
    }
    Instant sequence;
    boolean delete;
    try {
      sequence = SequenceValues.toInstant(rawSequence);
    } catch (IllegalArgumentException e) {
      result.addRejected(new RejectedRecord(index, e.getMessage(), row));
      return null;
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> values = (Map<String, Object>) row;
    try {
      delete = config.isDelete(values);
    } catch (RuntimeException e) {
      result.addRejected(
          new RejectedRecord(index, "delete condition failed: " + e.getMessage(), row));
      return null;
    }
    return new Change(index, key, sequence, values, delete);
  }

  private List<KeyOutcome> mergeKeys(Map<BusinessKey, List<Change>> changesByKey,
      HistoryTable target) {
    List<KeyOutcome> outcomes = new ArrayList<>(changesByKey.size());
    if (executor == null || changesByKey.size() < 2) {
      for (Map.Entry<BusinessKey, List<Change>> entry : changesByKey.entrySet()) {
        if (Thread.currentThread().isInterrupted()) {
          throw new CancellationException("Merge into " + config.getTargetName()
              + " interrupted");
        }
        outcomes.add(mergeKey(entry.getKey(), entry.getValue(), target.get(entry.getKey())));
      }
      return outcomes;
    }

    List<Callable<KeyOutcome>> tasks = new ArrayList<>(changesByKey.size());
    for (Map.Entry<BusinessKey, List<Change>> entry : changesByKey.entrySet()) {
      BusinessKey key = entry.getKey();
      List<Change> changes = entry.getValue();
      KeyHistory before = target.get(key);
      tasks.add(() -> mergeKey(key, changes, before));
    }
    try {
      for (Future<KeyOutcome> future : executor.invokeAll(tasks)) {
        outcomes.add(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Merge into " + config.getTargetName()
          + " interrupted");
    } catch (ExecutionException e) {
      throw new IllegalStateException("Merge into " + config.getTargetName()
          + " failed unexpectedly", e.getCause());
    }
    return outcomes;
  }

  private KeyOutcome mergeKey(BusinessKey key, List<Change> changes, KeyHistory before) {
    KeyOutcome outcome = new KeyOutcome(key);

    // List.sort is stable: equal sequence values keep their batch order.
    List<Change> sorted = new ArrayList<>(changes);
    sorted.sort(Comparator.comparing((Change c) -> c.sequence));

    List<VersionedRecord> versions = new ArrayList<>(before.getVersions());
    for (int i = 0; i < sorted.size(); i++) {
      Change change = sorted.get(i);
      if (i + 1 < sorted.size() && sorted.get(i + 1).sequence.equals(change.sequence)) {
        outcome.superseded++;
        continue;
      }
      apply(key, change, versions, outcome);
    }

    if (versions.equals(before.getVersions())) {
      return outcome;
    }
    KeyHistory after = KeyHistory.of(key, versions);
    try {
      HistoryIntegrity.verify(after);
    } catch (MergeIntegrityException e) {
      return outcome.fail(e.getMessage());
    }
    outcome.newKey = before.isEmpty();
    outcome.delta = new KeyDelta(before, after);
    return outcome;
  }

  private void apply(BusinessKey key, Change change, List<VersionedRecord> versions,
      KeyOutcome outcome) {
    int last = versions.size() - 1;
    VersionedRecord latest = last >= 0 ? versions.get(last) : null;
    VersionedRecord open = latest != null && latest.isOpen() ? latest : null;

    if (open != null) {
      if (!change.sequence.isAfter(open.getValidFrom())) {
        outcome.stale++;
        LOGGER.debug("{}: stale record #{} at {} (current version from {})", key,
            change.index, change.sequence, open.getValidFrom());
        return;
      }
    } else if (latest != null && change.sequence.isBefore(latest.getValidTo())) {
      outcome.stale++;
      LOGGER.debug("{}: stale record #{} at {} (deleted at {})", key, change.index,
          change.sequence, latest.getValidTo());
      return;
    }

    if (change.delete) {
      if (open == null) {
        outcome.deletesIgnored++;
        return;
      }
      versions.set(last, open.closeAt(change.sequence, true));
      outcome.closed++;
      outcome.deletes++;
      return;
    }

    Map<String, Object> attributes = attributesOf(change.row, open);
    if (open != null && sameTrackedValues(open.getAttributes(), attributes)) {
      outcome.noop++;
      return;
    }
    if (open != null) {
      versions.set(last, open.closeAt(change.sequence, false));
      outcome.closed++;
    }
    versions.add(VersionedRecord.open(key, attributes, change.sequence));
    outcome.opened++;
  }

  private Map<String, Object> attributesOf(Map<String, Object> row,
      @Nullable VersionedRecord open) {
    Map<String, Object> attributes = new LinkedHashMap<>(row);
    attributes.remove(GovernanceColumns.VALID_FROM);
    attributes.remove(GovernanceColumns.VALID_TO);
    if (config.isIgnoreNullUpdates() && open != null) {
      for (Map.Entry<String, Object> entry : open.getAttributes().entrySet()) {
        if (attributes.get(entry.getKey()) == null && entry.getValue() != null
            && !GovernanceColumns.isRecordMetadata(entry.getKey())) {
          attributes.put(entry.getKey(), entry.getValue());
        }
      }
    }
    return attributes;
  }

  private boolean sameTrackedValues(Map<String, Object> current, Map<String, Object> incoming) {
    Set<String> columns = new LinkedHashSet<>(current.keySet());
    columns.addAll(incoming.keySet());
    for (String column : config.comparisonColumns(columns)) {
      if (!Values.equal(current.get(column), incoming.get(column))) {
        return false;
      }
    }
    return true;
  }

  /** A parsed input row. */
  private static final class Change {
    final int index;
    final BusinessKey key;
    final Instant sequence;
    final Map<String, Object> row;
    final boolean delete;

    Change(int index, BusinessKey key, Instant sequence, Map<String, Object> row,
        boolean delete) {
      this.index = index;
      this.key = key;
      this.sequence = sequence;
      this.row = row;
      this.delete = delete;
    }
  }

  /** What merging one key produced. */
  private static final class KeyOutcome {
    final BusinessKey key;
    boolean newKey;
    long opened;
    long closed;
    long deletes;
    long deletesIgnored;
    long stale;
    long noop;
    long superseded;
    @Nullable KeyDelta delta;
    @Nullable KeyFailure failure;

    KeyOutcome(BusinessKey key) {
      this.key = key;
    }

    KeyOutcome fail(String message) {
      failure = new KeyFailure(key, message);
      opened = 0;
      closed = 0;
      deletes = 0;
      return this;
    }

    void addTo(MergeResult.Builder result) {
      if (failure != null) {
        result.addFailure(failure);
      }
      if (delta != null) {
        result.addDelta(delta);
      }
      if (newKey) {
        result.newKeys++;
      }
      result.versionsOpened += opened;
      result.versionsClosed += closed;
      result.deletes += deletes;
      result.deletesIgnored += deletesIgnored;
      result.staleDiscarded += stale;
      result.noopDiscarded += noop;
      result.supersededInBatch += superseded;
    }
  }
}
