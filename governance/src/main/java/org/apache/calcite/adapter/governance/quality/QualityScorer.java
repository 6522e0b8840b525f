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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a record against an ordered list of {@link ValidationCheck}s.
 *
 * <p>All checks are weighted equally. The score is
 * {@code round(100 * passed / total)}, or 100 when there are no checks, and
 * is capped at 99 when any check fails so that a score of 100 always means
 * "no flags".
 *
 * <p>A validator that throws counts as a failed check.
 */
public class QualityScorer {
  private static final Logger LOGGER = LoggerFactory.getLogger(QualityScorer.class);

  public static final String FLAG_SEPARATOR = ", ";

  /**
   * Evaluates every check against the record.
   *
   * @param record Record whose values the validators see
   * @param checks Checks in declaration order
   * @return assessment, never null
   */
  public QualityAssessment assess(Map<String, ?> record, List<ValidationCheck> checks) {
    Map<String, Boolean> results = new LinkedHashMap<>();
    List<String> failed = new ArrayList<>();
    int passed = 0;
    for (ValidationCheck check : checks) {
      String flag = check.getFlagName();
      boolean ok = runCheck(check, record.get(check.getFieldName()));
      if (ok) {
        passed++;
      } else if (!failed.contains(flag)) {
        failed.add(flag);
      }
      Boolean previous = results.get(flag);
      results.put(flag, previous == null ? ok : previous && ok);
    }
    int total = checks.size();
    return new QualityAssessment(passed, total, score(passed, total), failed, results);
  }

  /**
   * Computes the score for a number of passed checks out of a total.
   */
  public static int score(int passed, int total) {
    if (total == 0) {
      return 100;
    }
    int score = (int) Math.round(100.0 * passed / total);
    if (passed < total && score == 100) {
      return 99;
    }
    return score;
  }

  private static boolean runCheck(ValidationCheck check, Object value) {
    try {
      return check.getValidator().test(value);
    } catch (RuntimeException e) {
      LOGGER.debug("Validator {} threw for field {}: {}", check.getValidatorName(),
          check.getFieldName(), e.getMessage());
      return false;
    }
  }
}
