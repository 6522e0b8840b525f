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
package org.apache.calcite.adapter.governance.config;

import org.apache.calcite.adapter.governance.GovernanceColumns;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Configuration of the SCD Type 2 merge for one historical table.
 *
 * <p>Exactly one of {@link #getTrackHistoryColumns() trackHistoryColumns}
 * and {@link #getTrackHistoryExceptColumns() trackHistoryExceptColumns} may
 * be set. With neither, every non-key, non-sequence column is tracked.
 *
 * <pre>{@code
 * scd:
 *   keys: [customer_id]
 *   sequenceBy: updated_at
 *   trackHistoryExceptColumns: [ingested_file, ingestion_ts]
 *   ignoreNullUpdates: true
 *   applyAsDeletes: "operation = 'DELETE'"
 * }</pre>
 */
public final class ScdConfig {
  private static final Predicate<Map<String, Object>> NEVER_DELETE = row -> false;

  private final String targetName;
  private final List<String> keys;
  private final String sequenceBy;
  private final @Nullable List<String> trackHistoryColumns;
  private final @Nullable List<String> trackHistoryExceptColumns;
  private final boolean ignoreNullUpdates;
  private final @Nullable String applyAsDeletes;
  private final Predicate<Map<String, Object>> deletePredicate;

  private ScdConfig(Builder builder) {
    this.targetName = builder.targetName;
    this.keys = ImmutableList.copyOf(builder.keys);
    this.sequenceBy = builder.sequenceBy;
    this.trackHistoryColumns = builder.trackHistoryColumns == null
        ? null : ImmutableList.copyOf(builder.trackHistoryColumns);
    this.trackHistoryExceptColumns = builder.trackHistoryExceptColumns == null
        ? null : ImmutableList.copyOf(builder.trackHistoryExceptColumns);
    this.ignoreNullUpdates = builder.ignoreNullUpdates;
    this.applyAsDeletes = builder.applyAsDeletes;
    if (builder.deletePredicate != null) {
      this.deletePredicate = builder.deletePredicate;
    } else if (builder.applyAsDeletes != null) {
      this.deletePredicate = DeleteCondition.parse(builder.applyAsDeletes);
    } else {
      this.deletePredicate = NEVER_DELETE;
    }
  }

  public String getTargetName() {
    return targetName;
  }

  public List<String> getKeys() {
    return keys;
  }

  public String getSequenceBy() {
    return sequenceBy;
  }

  public @Nullable List<String> getTrackHistoryColumns() {
    return trackHistoryColumns;
  }

  public @Nullable List<String> getTrackHistoryExceptColumns() {
    return trackHistoryExceptColumns;
  }

  public boolean isIgnoreNullUpdates() {
    return ignoreNullUpdates;
  }

  public @Nullable String getApplyAsDeletes() {
    return applyAsDeletes;
  }

  /** Returns whether a row is a delete signal for its key. */
  public boolean isDelete(Map<String, Object> row) {
    return deletePredicate.test(row);
  }

  /**
   * Returns the columns, out of the given ones, whose changes open a new
   * version. Key columns, the sequence column and the validity interval
   * columns never take part.
   */
  public Set<String> comparisonColumns(Collection<String> columns) {
    Set<String> result = new LinkedHashSet<>();
    if (trackHistoryColumns != null) {
      for (String column : trackHistoryColumns) {
        if (isComparable(column)) {
          result.add(column);
        }
      }
      return result;
    }
    for (String column : columns) {
      if (isComparable(column)
          && (trackHistoryExceptColumns == null || !trackHistoryExceptColumns.contains(column))) {
        result.add(column);
      }
    }
    return result;
  }

  private boolean isComparable(String column) {
    return !keys.contains(column)
        && !sequenceBy.equals(column)
        && !GovernanceColumns.isValidityInterval(column);
  }

  public static Builder builder(String targetName) {
    return new Builder(targetName);
  }

  /**
   * Customers keyed by {@code customer_id}, sequenced by the cleansing
   * timestamp, ignoring provenance and quality columns for change detection.
   */
  public static ScdConfig forCustomers(String targetName) {
    return forCustomers(targetName, "silver_processed_ts");
  }

  public static ScdConfig forCustomers(String targetName, String sequenceBy) {
    return builder(targetName)
        .keys("customer_id")
        .sequenceBy(sequenceBy)
        .trackHistoryExceptColumns(GovernanceColumns.INGESTED_FILE,
            GovernanceColumns.INGESTION_TS, "silver_processed_ts",
            GovernanceColumns.DATA_QUALITY_FLAGS, GovernanceColumns.QUALITY_SCORE,
            "is_valid_postal_code")
        .build();
  }

  /**
   * Transactions keyed by {@code transaction_id}, sequenced by
   * {@code transaction_ts}; optionally tracking only status and amount.
   */
  public static ScdConfig forTransactions(String targetName, boolean trackStatusOnly) {
    Builder builder = builder(targetName)
        .keys("transaction_id")
        .sequenceBy("transaction_ts");
    if (trackStatusOnly) {
      builder.trackHistoryColumns("status", "amount", "updated_at");
    }
    return builder.build();
  }

  /**
   * Products keyed by {@code product_id}, sequenced by {@code updated_at};
   * optionally tracking only price-related columns.
   */
  public static ScdConfig forProducts(String targetName, boolean trackPriceChanges) {
    Builder builder = builder(targetName)
        .keys("product_id")
        .sequenceBy("updated_at");
    if (trackPriceChanges) {
      builder.trackHistoryColumns("price", "cost", "availability", "status");
    }
    return builder.build();
  }

  public static ScdConfig generic(String targetName, List<String> keys, String sequenceBy) {
    return builder(targetName)
        .keys(keys.toArray(new String[0]))
        .sequenceBy(sequenceBy)
        .build();
  }

  /**
   * Creates an ScdConfig from a YAML/JSON map.
   *
   * @param defaultTargetName Target used when the map has no {@code target} key
   */
  public static ScdConfig fromMap(Map<String, Object> map, String defaultTargetName) {
    String target = ConfigValues.string(map, "target");
    Builder builder = builder(target != null ? target : defaultTargetName);
    builder.keys(ConfigValues.stringList(map.get("keys")).toArray(new String[0]));
    builder.sequenceBy(ConfigValues.string(map, "sequenceBy"));
    if (map.containsKey("trackHistoryColumns")) {
      builder.trackHistoryColumns(
          ConfigValues.stringList(map.get("trackHistoryColumns")).toArray(new String[0]));
    }
    if (map.containsKey("trackHistoryExceptColumns")) {
      builder.trackHistoryExceptColumns(
          ConfigValues.stringList(map.get("trackHistoryExceptColumns")).toArray(new String[0]));
    }
    Boolean ignoreNullUpdates = ConfigValues.bool(map, "ignoreNullUpdates");
    if (ignoreNullUpdates != null) {
      builder.ignoreNullUpdates(ignoreNullUpdates);
    }
    builder.applyAsDeletes(ConfigValues.string(map, "applyAsDeletes"));
    return builder.build();
  }

  @Override public String toString() {
    return "ScdConfig{" + targetName + ", keys=" + keys + ", sequenceBy=" + sequenceBy + "}";
  }

  /**
   * Builder for ScdConfig.
   */
  public static final class Builder {
    private final String targetName;
    private List<String> keys = ImmutableList.of();
    private String sequenceBy;
    private List<String> trackHistoryColumns;
    private List<String> trackHistoryExceptColumns;
    private boolean ignoreNullUpdates = true;
    private String applyAsDeletes;
    private Predicate<Map<String, Object>> deletePredicate;

    private Builder(String targetName) {
      this.targetName = targetName;
    }

    public Builder keys(String... keys) {
      this.keys = Arrays.asList(keys);
      return this;
    }

    public Builder sequenceBy(@Nullable String sequenceBy) {
      this.sequenceBy = sequenceBy;
      return this;
    }

    public Builder trackHistoryColumns(String... columns) {
      this.trackHistoryColumns = Arrays.asList(columns);
      return this;
    }

    public Builder trackHistoryExceptColumns(String... columns) {
      this.trackHistoryExceptColumns = Arrays.asList(columns);
      return this;
    }

    public Builder ignoreNullUpdates(boolean ignoreNullUpdates) {
      this.ignoreNullUpdates = ignoreNullUpdates;
      return this;
    }

    /** Delete signal as a condition; see {@link DeleteCondition}. */
    public Builder applyAsDeletes(@Nullable String condition) {
      this.applyAsDeletes = condition;
      return this;
    }

    /** Delete signal as a predicate; takes precedence over a condition. */
    public Builder deleteWhen(Predicate<Map<String, Object>> predicate) {
      this.deletePredicate = predicate;
      return this;
    }

    public ScdConfig build() {
      if (targetName == null || targetName.isEmpty()) {
        throw new IllegalArgumentException("SCD target name is required");
      }
      if (keys.isEmpty()) {
        throw new IllegalArgumentException("SCD config for '" + targetName
            + "' needs at least one key column");
      }
      if (sequenceBy == null || sequenceBy.isEmpty()) {
        throw new IllegalArgumentException("SCD config for '" + targetName
            + "' needs a sequenceBy column");
      }
      if (trackHistoryColumns != null && trackHistoryExceptColumns != null) {
        throw new IllegalArgumentException("SCD config for '" + targetName
            + "': trackHistoryColumns and trackHistoryExceptColumns are mutually exclusive");
      }
      return new ScdConfig(this);
    }
  }
}
