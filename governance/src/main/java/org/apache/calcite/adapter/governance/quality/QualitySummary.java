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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Batch-level quality statistics: how many rows were flagged and which
 * checks failed how often.
 */
public final class QualitySummary {
  private final long rows;
  private final long flaggedRows;
  private final double averageScore;
  private final int minScore;
  private final Map<String, Long> failuresByFlag;

  private QualitySummary(Accumulator acc) {
    this.rows = acc.rows;
    this.flaggedRows = acc.flaggedRows;
    this.averageScore = acc.rows == 0 ? 100.0 : (double) acc.scoreSum / acc.rows;
    this.minScore = acc.rows == 0 ? 100 : acc.minScore;
    this.failuresByFlag = Collections.unmodifiableMap(new LinkedHashMap<>(acc.failuresByFlag));
  }

  public static Accumulator accumulator() {
    return new Accumulator();
  }

  public static QualitySummary empty() {
    return new Accumulator().build();
  }

  public long getRows() {
    return rows;
  }

  public long getFlaggedRows() {
    return flaggedRows;
  }

  public long getCleanRows() {
    return rows - flaggedRows;
  }

  public double getAverageScore() {
    return averageScore;
  }

  public int getMinScore() {
    return minScore;
  }

  /** Number of rows that failed each flag, in first-seen order. */
  public Map<String, Long> getFailuresByFlag() {
    return failuresByFlag;
  }

  @Override public String toString() {
    return String.format("QualitySummary{rows=%d, flagged=%d, avgScore=%.1f, minScore=%d, "
        + "failures=%s}", rows, flaggedRows, averageScore, minScore, failuresByFlag);
  }

  /**
   * Collects assessments; not thread-safe.
   */
  public static final class Accumulator {
    private long rows;
    private long flaggedRows;
    private long scoreSum;
    private int minScore = 100;
    private final Map<String, Long> failuresByFlag = new LinkedHashMap<>();

    private Accumulator() {
    }

    public Accumulator add(QualityAssessment assessment) {
      rows++;
      scoreSum += assessment.getScore();
      minScore = Math.min(minScore, assessment.getScore());
      if (!assessment.isClean()) {
        flaggedRows++;
        for (String flag : assessment.getFailedChecks()) {
          failuresByFlag.merge(flag, 1L, Long::sum);
        }
      }
      return this;
    }

    public QualitySummary build() {
      return new QualitySummary(this);
    }
  }
}
