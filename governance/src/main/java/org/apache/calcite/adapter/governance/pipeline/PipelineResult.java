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

import org.apache.calcite.adapter.governance.quality.QualitySummary;
import org.apache.calcite.adapter.governance.scd.KeyFailure;
import org.apache.calcite.adapter.governance.scd.MergeResult;
import org.apache.calcite.adapter.governance.scd.RejectedRecord;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a governance pipeline run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PipelineResult result = pipeline.execute(batch);
 * if (result.isCommitted()) {
 *   System.out.println("Opened " + result.getMerge().getVersionsOpened() + " versions");
 * } else if (result.isFailed()) {
 *   System.err.println("Pipeline failed: " + result.getFailureMessage());
 * }
 * }</pre>
 *
 * @see GovernancePipeline
 */
public class PipelineResult {

  private final String tableName;
  private final long inputRows;
  private final long cleansedRows;
  private final QualitySummary qualitySummary;
  private final @Nullable MergeResult merge;
  private final int commitAttempts;
  private final boolean committed;
  private final boolean cancelled;
  private final boolean failed;
  private final @Nullable String failureMessage;
  private final List<String> errors;
  private final long elapsedMs;

  private PipelineResult(Builder builder) {
    this.tableName = builder.tableName;
    this.inputRows = builder.inputRows;
    this.cleansedRows = builder.cleansedRows;
    this.qualitySummary = builder.qualitySummary != null
        ? builder.qualitySummary : QualitySummary.empty();
    this.merge = builder.merge;
    this.commitAttempts = builder.commitAttempts;
    this.committed = builder.committed;
    this.cancelled = builder.cancelled;
    this.failed = builder.failed;
    this.failureMessage = builder.failureMessage;
    this.errors = Collections.unmodifiableList(new ArrayList<String>(builder.errors));
    this.elapsedMs = builder.elapsedMs;
  }

  /**
   * Returns the governed table name.
   */
  public String getTableName() {
    return tableName;
  }

  public long getInputRows() {
    return inputRows;
  }

  public long getCleansedRows() {
    return cleansedRows;
  }

  public QualitySummary getQualitySummary() {
    return qualitySummary;
  }

  /**
   * Returns the merge result of the last attempt, or null if the run stopped
   * before merging.
   */
  public @Nullable MergeResult getMerge() {
    return merge;
  }

  public List<RejectedRecord> getRejected() {
    return merge == null ? Collections.<RejectedRecord>emptyList() : merge.getRejected();
  }

  public List<KeyFailure> getKeyFailures() {
    return merge == null ? Collections.<KeyFailure>emptyList() : merge.getFailures();
  }

  public int getCommitAttempts() {
    return commitAttempts;
  }

  /**
   * Returns whether the merge was committed (or had nothing to commit).
   */
  public boolean isCommitted() {
    return committed;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public boolean isFailed() {
    return failed;
  }

  public @Nullable String getFailureMessage() {
    return failureMessage;
  }

  /**
   * Returns the error messages collected during the run.
   */
  public List<String> getErrors() {
    return errors;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns whether the run committed without rejected records or key
   * failures.
   */
  public boolean isCompleteSuccess() {
    return committed && getRejected().isEmpty() && getKeyFailures().isEmpty();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("PipelineResult{table=").append(tableName);
    sb.append(", input=").append(inputRows);
    if (cancelled) {
      sb.append(", CANCELLED");
    } else if (failed) {
      sb.append(", FAILED: ").append(failureMessage);
    } else {
      sb.append(", committed=").append(committed);
      sb.append(", attempts=").append(commitAttempts);
      sb.append(", quality=").append(qualitySummary);
      sb.append(", merge=").append(merge);
    }
    sb.append(", elapsed=").append(elapsedMs).append("ms}");
    return sb.toString();
  }

  static Builder builder(String tableName) {
    return new Builder(tableName);
  }

  /**
   * Builder for PipelineResult.
   */
  static class Builder {
    private final String tableName;
    private long inputRows;
    private long cleansedRows;
    private QualitySummary qualitySummary;
    private MergeResult merge;
    private int commitAttempts;
    private boolean committed;
    private boolean cancelled;
    private boolean failed;
    private String failureMessage;
    private final List<String> errors = new ArrayList<String>();
    private long elapsedMs;

    Builder(String tableName) {
      this.tableName = tableName;
    }

    Builder inputRows(long inputRows) {
      this.inputRows = inputRows;
      return this;
    }

    Builder cleansedRows(long cleansedRows) {
      this.cleansedRows = cleansedRows;
      return this;
    }

    Builder qualitySummary(QualitySummary qualitySummary) {
      this.qualitySummary = qualitySummary;
      return this;
    }

    Builder merge(MergeResult merge) {
      this.merge = merge;
      return this;
    }

    Builder commitAttempts(int commitAttempts) {
      this.commitAttempts = commitAttempts;
      return this;
    }

    Builder committed(boolean committed) {
      this.committed = committed;
      return this;
    }

    Builder cancelled(boolean cancelled) {
      this.cancelled = cancelled;
      return this;
    }

    Builder failed(String message) {
      this.failed = true;
      this.failureMessage = message;
      return this;
    }

    Builder addError(String error) {
      errors.add(error);
      return this;
    }

    Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    PipelineResult build() {
      return new PipelineResult(this);
    }
  }
}
