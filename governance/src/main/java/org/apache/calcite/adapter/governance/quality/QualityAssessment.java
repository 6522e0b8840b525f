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
package org.apache.calcite.adapter.governance.quality;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of scoring one record against its table's checks.
 */
public final class QualityAssessment {
  private final int passed;
  private final int total;
  private final int score;
  private final List<String> failedChecks;
  private final Map<String, Boolean> results;

  QualityAssessment(int passed, int total, int score, List<String> failedChecks,
      Map<String, Boolean> results) {
    this.passed = passed;
    this.total = total;
    this.score = score;
    this.failedChecks = Collections.unmodifiableList(failedChecks);
    this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
  }

  public int getPassed() {
    return passed;
  }

  public int getTotal() {
    return total;
  }

  /** Score in [0, 100]; 100 exactly when no check failed. */
  public int getScore() {
    return score;
  }

  /** Failed flag names, deduplicated, in declaration order. */
  public List<String> getFailedChecks() {
    return failedChecks;
  }

  /** Pass/fail per flag name, in declaration order. */
  public Map<String, Boolean> getResults() {
    return results;
  }

  /**
   * Returns the {@code data_quality_flags} value: failed flag names joined
   * with {@value QualityScorer#FLAG_SEPARATOR}, or null when all passed.
   */
  public @Nullable String getFlags() {
    return failedChecks.isEmpty() ? null : String.join(QualityScorer.FLAG_SEPARATOR, failedChecks);
  }

  public boolean isClean() {
    return failedChecks.isEmpty();
  }

  @Override public String toString() {
    return "QualityAssessment{score=" + score + ", passed=" + passed + "/" + total
        + ", flags=" + getFlags() + "}";
  }
}
