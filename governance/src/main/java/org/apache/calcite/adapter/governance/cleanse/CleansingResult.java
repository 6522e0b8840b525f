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
package org.apache.calcite.adapter.governance.cleanse;

import org.apache.calcite.adapter.governance.quality.QualitySummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Output of one cleansing run: the cleansed records, in input order, and
 * batch statistics.
 */
public class CleansingResult {

  private final String tableName;
  private final List<Map<String, Object>> records;
  private final QualitySummary summary;
  private final long transformFailures;
  private final long elapsedMs;

  private CleansingResult(Builder builder) {
    this.tableName = builder.tableName;
    this.records = Collections.unmodifiableList(new ArrayList<>(builder.records));
    this.summary = builder.summary != null ? builder.summary : QualitySummary.empty();
    this.transformFailures = builder.transformFailures;
    this.elapsedMs = builder.elapsedMs;
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * Returns the cleansed records; same size and order as the input batch.
   */
  public List<Map<String, Object>> getRecords() {
    return records;
  }

  public QualitySummary getSummary() {
    return summary;
  }

  /**
   * Returns how many transformer invocations threw; the affected values were
   * left as they were.
   */
  public long getTransformFailures() {
    return transformFailures;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "CleansingResult{table=" + tableName + ", rows=" + records.size()
        + ", transformFailures=" + transformFailures + ", " + summary + "}";
  }

  static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for CleansingResult.
   */
  static class Builder {
    private String tableName;
    private List<Map<String, Object>> records = Collections.emptyList();
    private QualitySummary summary;
    private long transformFailures;
    private long elapsedMs;

    Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    Builder records(List<Map<String, Object>> records) {
      this.records = records;
      return this;
    }

    Builder summary(QualitySummary summary) {
      this.summary = summary;
      return this;
    }

    Builder transformFailures(long transformFailures) {
      this.transformFailures = transformFailures;
      return this;
    }

    Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    CleansingResult build() {
      return new CleansingResult(this);
    }
  }
}
