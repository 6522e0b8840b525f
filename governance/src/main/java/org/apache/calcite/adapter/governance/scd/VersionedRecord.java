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

import org.apache.calcite.adapter.governance.GovernanceColumns;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One version of an entity: its attributes and the half-open interval
 * {@code [validFrom, validTo)} during which they were current.
 *
 * <p>A null {@code validTo} marks the open, current version. A version that
 * was closed by a delete signal is flagged {@link #isDeleted() deleted}; the
 * key then has no current version until a newer row re-opens it.
 */
public final class VersionedRecord {
  private final BusinessKey key;
  private final Map<String, Object> attributes;
  private final Instant validFrom;
  private final @Nullable Instant validTo;
  private final boolean deleted;

  public VersionedRecord(BusinessKey key, Map<String, ?> attributes, Instant validFrom,
      @Nullable Instant validTo, boolean deleted) {
    this.key = Objects.requireNonNull(key, "key");
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.validFrom = Objects.requireNonNull(validFrom, "validFrom");
    this.validTo = validTo;
    this.deleted = deleted;
  }

  public static VersionedRecord open(BusinessKey key, Map<String, ?> attributes,
      Instant validFrom) {
    return new VersionedRecord(key, attributes, validFrom, null, false);
  }

  public BusinessKey getKey() {
    return key;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public @Nullable Object get(String column) {
    return attributes.get(column);
  }

  public Instant getValidFrom() {
    return validFrom;
  }

  public @Nullable Instant getValidTo() {
    return validTo;
  }

  public boolean isOpen() {
    return validTo == null;
  }

  public boolean isDeleted() {
    return deleted;
  }

  /** Whether this version was current at the given instant. */
  public boolean isActiveAt(Instant at) {
    return !validFrom.isAfter(at) && (validTo == null || validTo.isAfter(at));
  }

  /** Returns a copy closed at the given instant. */
  public VersionedRecord closeAt(Instant at, boolean byDelete) {
    return new VersionedRecord(key, attributes, validFrom, at, byDelete);
  }

  /** Attributes plus {@code valid_from} and {@code valid_to}. */
  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<>(attributes);
    row.put(GovernanceColumns.VALID_FROM, validFrom);
    row.put(GovernanceColumns.VALID_TO, validTo);
    return row;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VersionedRecord)) {
      return false;
    }
    VersionedRecord that = (VersionedRecord) o;
    return deleted == that.deleted
        && key.equals(that.key)
        && validFrom.equals(that.validFrom)
        && Objects.equals(validTo, that.validTo)
        && attributes.equals(that.attributes);
  }

  @Override public int hashCode() {
    return Objects.hash(key, validFrom, validTo, deleted);
  }

  @Override public String toString() {
    return "VersionedRecord{" + key + ", [" + validFrom + ", "
        + (validTo == null ? "open" : validTo) + ")" + (deleted ? " deleted" : "") + "}";
  }
}
