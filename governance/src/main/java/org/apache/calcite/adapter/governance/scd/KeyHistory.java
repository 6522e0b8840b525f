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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * All versions of one business key, ordered by {@code validFrom}.
 */
public final class KeyHistory {
  private final BusinessKey key;
  private final List<VersionedRecord> versions;

  private KeyHistory(BusinessKey key, List<VersionedRecord> versions) {
    this.key = key;
    this.versions = versions;
  }

  public static KeyHistory empty(BusinessKey key) {
    return new KeyHistory(key, ImmutableList.of());
  }

  /**
   * Creates a history. Versions are taken in the given order; use
   * {@link HistoryIntegrity#verify} to check them.
   */
  public static KeyHistory of(BusinessKey key, List<VersionedRecord> versions) {
    for (VersionedRecord version : versions) {
      if (!version.getKey().equals(key)) {
        throw new IllegalArgumentException("Version of " + version.getKey()
            + " does not belong to " + key);
      }
    }
    return new KeyHistory(key, ImmutableList.copyOf(versions));
  }

  public BusinessKey getKey() {
    return key;
  }

  public List<VersionedRecord> getVersions() {
    return versions;
  }

  public boolean isEmpty() {
    return versions.isEmpty();
  }

  public int size() {
    return versions.size();
  }

  /** The open version, or null if the key has none. */
  public @Nullable VersionedRecord open() {
    for (int i = versions.size() - 1; i >= 0; i--) {
      if (versions.get(i).isOpen()) {
        return versions.get(i);
      }
    }
    return null;
  }

  public @Nullable VersionedRecord latest() {
    return versions.isEmpty() ? null : versions.get(versions.size() - 1);
  }

  /** The version current at an instant, or null. */
  public @Nullable VersionedRecord versionAt(Instant at) {
    for (VersionedRecord version : versions) {
      if (version.isActiveAt(at)) {
        return version;
      }
    }
    return null;
  }

  /** Whether the key was seen but its last version was closed by a delete. */
  public boolean isDeleted() {
    VersionedRecord latest = latest();
    return latest != null && latest.isDeleted();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof KeyHistory
        && key.equals(((KeyHistory) o).key)
        && versions.equals(((KeyHistory) o).versions);
  }

  @Override public int hashCode() {
    return Objects.hash(key, versions);
  }

  @Override public String toString() {
    return "KeyHistory{" + key + ", " + versions + "}";
  }
}
