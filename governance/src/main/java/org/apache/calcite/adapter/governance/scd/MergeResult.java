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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of merging one batch into a history snapshot.
 *
 * <p>The result is a set of per-key deltas plus statistics; nothing is
 * persisted until a {@link HistoryStore} commits it.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * MergeResult result = engine.merge(batch, store.snapshot());
 * for (RejectedRecord rejected : result.getRejected()) {
 *   LOGGER.warn("Row {} rejected: {}", rejected.getIndex(), rejected.getReason());
 * }
 * store.commit(result);
 * }</pre>
 */
public class MergeResult {

  private final String targetName;
  private final List<KeyDelta> deltas;
  private final List<RejectedRecord> rejected;
  private final List<KeyFailure> failures;
  private final long inputRows;
  private final long newKeys;
  private final long versionsOpened;
  private final long versionsClosed;
  private final long deletes;
  private final long deletesIgnored;
  private final long staleDiscarded;
  private final long noopDiscarded;
  private final long supersededInBatch;
  private final long elapsedMs;

  private MergeResult(Builder builder) {
    this.targetName = builder.targetName;
    this.deltas = Collections.unmodifiableList(new ArrayList<>(builder.deltas));
    this.rejected = Collections.unmodifiableList(new ArrayList<>(builder.rejected));
    this.failures = Collections.unmodifiableList(new ArrayList<>(builder.failures));
    this.inputRows = builder.inputRows;
    this.newKeys = builder.newKeys;
    this.versionsOpened = builder.versionsOpened;
    this.versionsClosed = builder.versionsClosed;
    this.deletes = builder.deletes;
    this.deletesIgnored = builder.deletesIgnored;
    this.staleDiscarded = builder.staleDiscarded;
    this.noopDiscarded = builder.noopDiscarded;
    this.supersededInBatch = builder.supersededInBatch;
    this.elapsedMs = builder.elapsedMs;
  }

  public String getTargetName() {
    return targetName;
  }

  /** Per-key changes, in order of first appearance in the batch. */
  public List<KeyDelta> getDeltas() {
    return deltas;
  }

  public List<RejectedRecord> getRejected() {
    return rejected;
  }

  public List<KeyFailure> getFailures() {
    return failures;
  }

  public long getInputRows() {
    return inputRows;
  }

  /** Keys that had no history before this batch and got one. */
  public long getNewKeys() {
    return newKeys;
  }

  public long getVersionsOpened() {
    return versionsOpened;
  }

  public long getVersionsClosed() {
    return versionsClosed;
  }

  /** Delete signals that closed an open version. */
  public long getDeletes() {
    return deletes;
  }

  /** Delete signals for keys without an open version. */
  public long getDeletesIgnored() {
    return deletesIgnored;
  }

  /** Rows not newer than what the target already holds. */
  public long getStaleDiscarded() {
    return staleDiscarded;
  }

  /** Rows identical to the current version on the tracked columns. */
  public long getNoopDiscarded() {
    return noopDiscarded;
  }

  /** Rows replaced by a later row of the same key with the same sequence value. */
  public long getSupersededInBatch() {
    return supersededInBatch;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public boolean hasChanges() {
    return !deltas.isEmpty();
  }

  /**
   * Applies the deltas to a table without checking their preconditions.
   * Stores use this after verifying each delta's {@code before} history.
   */
  public HistoryTable applyTo(HistoryTable table) {
    List<KeyHistory> updated = new ArrayList<>(deltas.size());
    for (KeyDelta delta : deltas) {
      updated.add(delta.getAfter());
    }
    return table.withHistories(updated);
  }

  @Override public String toString() {
    return "MergeResult{target=" + targetName
        + ", input=" + inputRows
        + ", keysChanged=" + deltas.size()
        + ", newKeys=" + newKeys
        + ", opened=" + versionsOpened
        + ", closed=" + versionsClosed
        + ", deletes=" + deletes
        + ", deletesIgnored=" + deletesIgnored
        + ", stale=" + staleDiscarded
        + ", noop=" + noopDiscarded
        + ", superseded=" + supersededInBatch
        + ", rejected=" + rejected.size()
        + ", failures=" + failures.size() + "}";
  }

  static Builder builder(String targetName) {
    return new Builder(targetName);
  }

  /**
   * Builder for MergeResult.
   */
  static class Builder {
    private final String targetName;
    private final List<KeyDelta> deltas = new ArrayList<>();
    private final List<RejectedRecord> rejected = new ArrayList<>();
    private final List<KeyFailure> failures = new ArrayList<>();
    private long inputRows;
    long newKeys;
    long versionsOpened;
    long versionsClosed;
    long deletes;
    long deletesIgnored;
    long staleDiscarded;
    long noopDiscarded;
    long supersededInBatch;
    private long elapsedMs;

    Builder(String targetName) {
      this.targetName = targetName;
    }

    Builder inputRows(long inputRows) {
      this.inputRows = inputRows;
      return this;
    }

    Builder addDelta(KeyDelta delta) {
      deltas.add(delta);
      return this;
    }

    Builder addRejected(RejectedRecord record) {
      rejected.add(record);
      return this;
    }

    Builder addFailure(KeyFailure failure) {
      failures.add(failure);
      return this;
    }

    Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    MergeResult build() {
      return new MergeResult(this);
    }
  }
}
