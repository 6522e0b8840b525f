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

import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable SCD Type 2 table: the history of every business key.
 *
 * <p>Supports the three canonical reads: {@link #current()},
 * {@link #asOf(Instant)} and {@link #history(BusinessKey)}.
 */
public final class HistoryTable {
  private static final HistoryTable EMPTY = new HistoryTable(ImmutableMap.of());

  private final Map<BusinessKey, KeyHistory> histories;

  private HistoryTable(Map<BusinessKey, KeyHistory> histories) {
    this.histories = histories;
  }

  public static HistoryTable empty() {
    return EMPTY;
  }

  public static HistoryTable of(Collection<KeyHistory> histories) {
    return EMPTY.withHistories(histories);
  }

  /** History of a key; empty when the key was never seen. */
  public KeyHistory get(BusinessKey key) {
    KeyHistory history = histories.get(key);
    return history != null ? history : KeyHistory.empty(key);
  }

  public Set<BusinessKey> keys() {
    return histories.keySet();
  }

  /** Every open version, in key order. */
  public List<VersionedRecord> current() {
    List<VersionedRecord> result = new ArrayList<>();
    for (KeyHistory history : histories.values()) {
      VersionedRecord open = history.open();
      if (open != null) {
        result.add(open);
      }
    }
    return result;
  }

  /** The version of each key that was current at an instant. */
  public List<VersionedRecord> asOf(Instant at) {
    List<VersionedRecord> result = new ArrayList<>();
    for (KeyHistory history : histories.values()) {
      VersionedRecord version = history.versionAt(at);
      if (version != null) {
        result.add(version);
      }
    }
    return result;
  }

  /** All versions of a key, oldest first. */
  public List<VersionedRecord> history(BusinessKey key) {
    return get(key).getVersions();
  }

  /** All versions of all keys. */
  public List<VersionedRecord> allVersions() {
    List<VersionedRecord> result = new ArrayList<>();
    for (KeyHistory history : histories.values()) {
      result.addAll(history.getVersions());
    }
    return result;
  }

  public int versionCount() {
    int count = 0;
    for (KeyHistory history : histories.values()) {
      count += history.size();
    }
    return count;
  }

  /** Returns a table in which the given histories replace existing ones. */
  public HistoryTable withHistories(Collection<KeyHistory> updated) {
    if (updated.isEmpty()) {
      return this;
    }
    Map<BusinessKey, KeyHistory> map = new LinkedHashMap<>(histories);
    for (KeyHistory history : updated) {
      map.put(history.getKey(), history);
    }
    return new HistoryTable(ImmutableMap.copyOf(map));
  }

  /** Flattens versions to rows carrying {@code valid_from} and {@code valid_to}. */
  public static List<Map<String, Object>> toRows(List<VersionedRecord> versions) {
    List<Map<String, Object>> rows = new ArrayList<>(versions.size());
    for (VersionedRecord version : versions) {
      rows.add(version.toRow());
    }
    return rows;
  }

  @Override public String toString() {
    return "HistoryTable{keys=" + histories.size() + ", versions=" + versionCount() + "}";
  }
}
