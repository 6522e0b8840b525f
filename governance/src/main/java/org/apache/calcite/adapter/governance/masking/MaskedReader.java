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
package org.apache.calcite.adapter.governance.masking;

import org.apache.calcite.adapter.governance.GovernanceColumns;
import org.apache.calcite.adapter.governance.access.AccessGrantStore;
import org.apache.calcite.adapter.governance.access.AccessLevel;
import org.apache.calcite.adapter.governance.scd.BusinessKey;
import org.apache.calcite.adapter.governance.scd.HistoryStore;
import org.apache.calcite.adapter.governance.scd.HistoryTable;
import org.apache.calcite.adapter.governance.scd.VersionedRecord;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a historical table on behalf of a user, masked for that user's
 * access level.
 *
 * <p>The access level is looked up on every read and never cached, so a
 * grant revoked between two reads applies to the second one. When the grant
 * lookup fails the read falls back to {@link AccessLevel#MASKED_ONLY}.
 *
 * <p>Each output row carries {@code masked_at}, {@code masked_for_user}
 * and {@code applied_access_level}.
 */
public class MaskedReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(MaskedReader.class);

  private final HistoryStore store;
  private final MaskingPolicy policy;
  private final AccessGrantStore grants;
  private final MaskingEvaluator evaluator;
  private final List<String> columns;
  private final Clock clock;

  public MaskedReader(HistoryStore store, MaskingPolicy policy, AccessGrantStore grants) {
    this(store, policy, grants, new MaskingEvaluator(), ImmutableList.of(), Clock.systemUTC());
  }

  /**
   * Creates a reader.
   *
   * @param columns Columns to expose, in order; empty exposes every column
   * @throws IllegalArgumentException if the policy names an unknown function
   */
  public MaskedReader(HistoryStore store, MaskingPolicy policy, AccessGrantStore grants,
      MaskingEvaluator evaluator, List<String> columns, Clock clock) {
    policy.checkNames(evaluator.getFunctions());
    this.store = store;
    this.policy = policy;
    this.grants = grants;
    this.evaluator = evaluator;
    this.columns = ImmutableList.copyOf(columns);
    this.clock = clock;
  }

  public MaskingPolicy getPolicy() {
    return policy;
  }

  /**
   * Resolves a user's access level now; failures resolve to
   * {@link AccessLevel#MASKED_ONLY}.
   */
  public AccessLevel resolveAccessLevel(String userId) {
    return resolveAccessLevel(grants, userId, clock.instant());
  }

  /** Current versions, masked for the user. */
  public List<Map<String, Object>> readCurrent(String userId) {
    return mask(store.snapshot().current(), userId);
  }

  /** Versions current at an instant, masked for the user. */
  public List<Map<String, Object>> readAsOf(String userId, Instant asOf) {
    return mask(store.snapshot().asOf(asOf), userId);
  }

  /** Every version of a key, masked for the user. */
  public List<Map<String, Object>> readHistory(String userId, BusinessKey key) {
    return mask(store.snapshot().history(key), userId);
  }

  private List<Map<String, Object>> mask(List<VersionedRecord> versions, String userId) {
    Instant now = clock.instant();
    AccessLevel level = resolveAccessLevel(grants, userId, now);
    List<Map<String, Object>> rows = new ArrayList<>(versions.size());
    for (Map<String, Object> row : HistoryTable.toRows(versions)) {
      Map<String, Object> masked = evaluator.evaluate(row, policy, level);
      Map<String, Object> out;
      if (columns.isEmpty()) {
        out = masked;
      } else {
        out = new LinkedHashMap<>();
        for (String column : columns) {
          out.put(column, masked.get(column));
        }
      }
      out.put(GovernanceColumns.MASKED_AT, now);
      out.put(GovernanceColumns.MASKED_FOR_USER, userId);
      out.put(GovernanceColumns.APPLIED_ACCESS_LEVEL, level.getWireName());
      rows.add(out);
    }
    LOGGER.debug("Masked {} rows of {} for {} at level {}", rows.size(), store.getName(),
        userId, level);
    return rows;
  }

  /**
   * Resolves an access level, failing closed.
   */
  public static AccessLevel resolveAccessLevel(AccessGrantStore grants, String userId,
      Instant at) {
    try {
      return grants.resolveAccessLevel(userId, at);
    } catch (RuntimeException e) {
      LOGGER.warn("Grant lookup for {} failed, applying {}: {}", userId,
          AccessLevel.MASKED_ONLY, e.getMessage());
      return AccessLevel.MASKED_ONLY;
    }
  }
}
