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

import org.apache.calcite.adapter.governance.cleanse.CleansingBuilder;
import org.apache.calcite.adapter.governance.cleanse.CleansingResult;
import org.apache.calcite.adapter.governance.config.GovernanceConfig;
import org.apache.calcite.adapter.governance.config.TableDefinition;
import org.apache.calcite.adapter.governance.scd.CommitConflictException;
import org.apache.calcite.adapter.governance.scd.HistoryStore;
import org.apache.calcite.adapter.governance.scd.MergeResult;
import org.apache.calcite.adapter.governance.scd.ScdMergeEngine;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one batch of raw records through the governance layers of a table.
 *
 * <ol>
 *   <li>Cleansing - standardize, validate and score every record</li>
 *   <li>Merge - merge the cleansed batch into a snapshot of the history</li>
 *   <li>Commit - apply the merge atomically to the history store</li>
 * </ol>
 *
 * <p>When the commit finds that another writer changed one of the batch's
 * keys, the merge is redone against a fresh snapshot, up to
 * {@code maxCommitAttempts} times. A run cancelled through {@link #cancel()}
 * or by interrupting its thread stops before committing and leaves the store
 * unchanged. A pipeline may run any number of batches, one at a time.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * GovernancePipeline pipeline =
 *     GovernancePipeline.create(config, "customers", store, executor);
 * PipelineResult result = pipeline.execute(rawRecords);
 * }</pre>
 *
 * @see PipelineResult
 */
public class GovernancePipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(GovernancePipeline.class);

  public static final String PHASE_CLEANSING = "cleansing";
  public static final String PHASE_MERGE = "merge";
  public static final String PHASE_COMMIT = "commit";

  private final String tableName;
  private final CleansingBuilder cleansingBuilder;
  private final ScdMergeEngine mergeEngine;
  private final HistoryStore store;
  private final int maxCommitAttempts;
  private final @Nullable ProgressListener progressListener;
  private volatile boolean cancelled;

  /**
   * Creates a pipeline with default registries, sequential merging and the
   * default number of commit attempts.
   */
  public GovernancePipeline(TableDefinition definition, HistoryStore store) {
    this(definition.getName(), new CleansingBuilder(definition.getCleansing()),
        new ScdMergeEngine(definition.getScd()), store,
        GovernanceConfig.DEFAULT_MAX_COMMIT_ATTEMPTS, null);
  }

  /**
   * Creates a pipeline.
   *
   * @param tableName Governed table name, for logging
   * @param cleansingBuilder Cleansing step
   * @param mergeEngine Merge step
   * @param store History store the merge is committed to
   * @param maxCommitAttempts Attempts before giving up on commit conflicts
   * @param progressListener Listener for progress updates, may be null
   */
  public GovernancePipeline(String tableName, CleansingBuilder cleansingBuilder,
      ScdMergeEngine mergeEngine, HistoryStore store, int maxCommitAttempts,
      @Nullable ProgressListener progressListener) {
    if (maxCommitAttempts < 1) {
      throw new IllegalArgumentException("maxCommitAttempts must be at least 1");
    }
    this.tableName = tableName;
    this.cleansingBuilder = cleansingBuilder;
    this.mergeEngine = mergeEngine;
    this.store = store;
    this.maxCommitAttempts = maxCommitAttempts;
    this.progressListener = progressListener;
  }

  /**
   * Creates a pipeline for a configured table.
   *
   * @param executor Executor for parallel per-key merging, may be null
   */
  public static GovernancePipeline create(GovernanceConfig config, String tableName,
      HistoryStore store, @Nullable ExecutorService executor) {
    TableDefinition definition = config.getTable(tableName);
    return new GovernancePipeline(tableName, new CleansingBuilder(definition.getCleansing()),
        new ScdMergeEngine(definition.getScd(), executor), store,
        config.getMaxCommitAttempts(), new LoggingProgressListener());
  }

  /**
   * Requests cancellation; a run in progress stops before its next commit.
   * The next call to {@link #execute} starts uncancelled.
   */
  public void cancel() {
    cancelled = true;
  }

  /**
   * Executes the pipeline for one batch.
   *
   * @param rawBatch Raw records
   * @return Execution result; failures are reported in it, not thrown
   */
  public PipelineResult execute(List<? extends Map<String, ?>> rawBatch) {
    cancelled = false;
    LOGGER.info("Starting governance pipeline for {}: {} records", tableName, rawBatch.size());
    long startTime = System.currentTimeMillis();
    PipelineResult.Builder result = PipelineResult.builder(tableName).inputRows(rawBatch.size());

    try {
      // Phase 1: cleanse
      phaseStart(PHASE_CLEANSING, rawBatch.size());
      CleansingResult cleansed = cleansingBuilder.cleanse(rawBatch);
      result.cleansedRows(cleansed.getRecords().size()).qualitySummary(cleansed.getSummary());
      phaseComplete(PHASE_CLEANSING, cleansed.getRecords().size());

      // Phases 2 and 3: merge against a snapshot and commit, redoing the
      // merge when the snapshot went stale
      for (int attempt = 1; attempt <= maxCommitAttempts; attempt++) {
        if (isCancelled()) {
          return cancelled(result, startTime);
        }
        phaseStart(PHASE_MERGE, cleansed.getRecords().size());
        MergeResult merge = mergeEngine.merge(cleansed.getRecords(), store.snapshot());
        result.merge(merge);
        phaseComplete(PHASE_MERGE, merge.getDeltas().size());

        if (isCancelled()) {
          return cancelled(result, startTime);
        }
        phaseStart(PHASE_COMMIT, merge.getDeltas().size());
        result.commitAttempts(attempt);
        try {
          store.commit(merge);
          commitAttempt(attempt, null);
          phaseComplete(PHASE_COMMIT, merge.getDeltas().size());
          result.committed(true);
          break;
        } catch (CommitConflictException e) {
          commitAttempt(attempt, e);
          String message = String.format("Commit attempt %d/%d for %s conflicted: %s",
              attempt, maxCommitAttempts, tableName, e.getMessage());
          result.addError(message);
          if (attempt == maxCommitAttempts) {
            LOGGER.error(message);
            result.failed("Commit conflicts persisted after " + maxCommitAttempts
                + " attempts");
          } else {
            LOGGER.warn("{}; retrying against a fresh snapshot", message);
          }
        }
      }
    } catch (CancellationException e) {
      return cancelled(result, startTime);
    } catch (RuntimeException e) {
      LOGGER.error("Governance pipeline for {} failed: {}", tableName, e.getMessage(), e);
      result.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
      result.addError(String.valueOf(e.getMessage()));
    }

    PipelineResult built = result.elapsedMs(System.currentTimeMillis() - startTime).build();
    LOGGER.info("Governance pipeline for {} finished: {}", tableName, built);
    return built;
  }

  private boolean isCancelled() {
    return cancelled || Thread.currentThread().isInterrupted();
  }

  private PipelineResult cancelled(PipelineResult.Builder result, long startTime) {
    LOGGER.warn("Governance pipeline for {} cancelled before commit", tableName);
    return result.cancelled(true)
        .committed(false)
        .elapsedMs(System.currentTimeMillis() - startTime)
        .build();
  }

  private void phaseStart(String phase, int totalItems) {
    if (progressListener != null) {
      progressListener.onPhaseStart(phase, totalItems);
    }
  }

  private void phaseComplete(String phase, int processedItems) {
    if (progressListener != null) {
      progressListener.onPhaseComplete(phase, processedItems);
    }
  }

  private void commitAttempt(int attempt, @Nullable Exception error) {
    if (progressListener != null) {
      progressListener.onCommitAttempt(attempt, maxCommitAttempts, error);
    }
  }

  /**
   * Listener for pipeline progress updates.
   */
  public interface ProgressListener {
    /**
     * Called when a phase starts.
     *
     * @param phase Phase name
     * @param totalItems Number of items to process
     */
    void onPhaseStart(String phase, int totalItems);

    /**
     * Called when a phase completes.
     *
     * @param phase Phase name
     * @param processedItems Number of items processed
     */
    void onPhaseComplete(String phase, int processedItems);

    /**
     * Called after each commit attempt.
     *
     * @param attempt Attempt number, starting at 1
     * @param maxAttempts Maximum number of attempts
     * @param error Conflict that made the attempt fail, or null on success
     */
    void onCommitAttempt(int attempt, int maxAttempts, @Nullable Exception error);
  }

  /**
   * Progress listener that logs to SLF4J.
   */
  public static class LoggingProgressListener implements ProgressListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onPhaseStart(String phase, int totalItems) {
      LOG.info("Starting phase '{}' with {} items", phase, totalItems);
    }

    @Override
    public void onPhaseComplete(String phase, int processedItems) {
      LOG.info("Completed phase '{}': {} items processed", phase, processedItems);
    }

    @Override
    public void onCommitAttempt(int attempt, int maxAttempts, @Nullable Exception error) {
      if (error != null) {
        LOG.warn("Commit attempt {}/{} failed: {}", attempt, maxAttempts, error.getMessage());
      } else {
        LOG.debug("Commit attempt {}/{} succeeded", attempt, maxAttempts);
      }
    }
  }
}
