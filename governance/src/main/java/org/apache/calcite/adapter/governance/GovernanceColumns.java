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
package org.apache.calcite.adapter.governance;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Names of the columns the governance layers add to, or reserve in, a record.
 */
public final class GovernanceColumns {
  public static final String INGESTED_FILE = "ingested_file";
  public static final String INGESTION_TS = "ingestion_ts";
  public static final String DATA_QUALITY_FLAGS = "data_quality_flags";
  public static final String QUALITY_SCORE = "quality_score";
  public static final String VALID_FROM = "valid_from";
  public static final String VALID_TO = "valid_to";
  public static final String MASKED_AT = "masked_at";
  public static final String MASKED_FOR_USER = "masked_for_user";
  public static final String APPLIED_ACCESS_LEVEL = "applied_access_level";

  /** Prefix of the per-check boolean columns written by the cleansing layer. */
  public static final String VALIDITY_PREFIX = "is_valid_";

  private static final Set<String> UNPREFIXED =
      ImmutableSet.of(INGESTED_FILE, INGESTION_TS, DATA_QUALITY_FLAGS, QUALITY_SCORE);

  private static final Set<String> VALIDITY_INTERVAL = ImmutableSet.of(VALID_FROM, VALID_TO);

  private GovernanceColumns() {
  }

  /** Returns whether a column keeps its name when a source prefix is applied. */
  public static boolean isExemptFromPrefix(String column) {
    return UNPREFIXED.contains(column);
  }

  /**
   * Returns whether a column describes one cleansing pass over a record
   * rather than the record itself: quality flags and score, per-check
   * validity columns and ingestion lineage. A null in such a column is a
   * value, never a missing update.
   */
  public static boolean isRecordMetadata(String column) {
    return UNPREFIXED.contains(column) || column.startsWith(VALIDITY_PREFIX);
  }

  /** Returns whether a column is one of the validity interval columns. */
  public static boolean isValidityInterval(String column) {
    return VALIDITY_INTERVAL.contains(column);
  }
}
