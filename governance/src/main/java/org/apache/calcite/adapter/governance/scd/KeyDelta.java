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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Change to one key's history produced by a merge.
 *
 * <p>{@link #getBefore() before} is the history the merge started from; a
 * store applies the delta only if its copy still equals it.
 */
public final class KeyDelta {
  private final KeyHistory before;
  private final KeyHistory after;
  private final List<VersionedRecord> opened;
  private final List<VersionedRecord> closed;

  public KeyDelta(KeyHistory before, KeyHistory after) {
    if (!before.getKey().equals(after.getKey())) {
      throw new IllegalArgumentException("Delta spans two keys: " + before.getKey()
          + " and " + after.getKey());
    }
    this.before = before;
    this.after = after;
    Set<Instant> existing = new HashSet<>();
    for (VersionedRecord version : before.getVersions()) {
      existing.add(version.getValidFrom());
    }
    List<VersionedRecord> newVersions = new ArrayList<>();
    for (VersionedRecord version : after.getVersions()) {
      if (!existing.contains(version.getValidFrom())) {
        newVersions.add(version);
      }
    }
    List<VersionedRecord> closedVersions = new ArrayList<>();
    VersionedRecord wasOpen = before.open();
    if (wasOpen != null) {
      for (VersionedRecord version : after.getVersions()) {
        if (version.getValidFrom().equals(wasOpen.getValidFrom()) && !version.isOpen()) {
          closedVersions.add(version);
        }
      }
    }
    this.opened = Collections.unmodifiableList(newVersions);
    this.closed = Collections.unmodifiableList(closedVersions);
  }

  public BusinessKey getKey() {
    return after.getKey();
  }

  public KeyHistory getBefore() {
    return before;
  }

  public KeyHistory getAfter() {
    return after;
  }

  /** Versions that did not exist before, in their final state. */
  public List<VersionedRecord> getOpened() {
    return opened;
  }

  /** The previously open version, now closed; empty if it is still open. */
  public List<VersionedRecord> getClosed() {
    return closed;
  }

  @Override public String toString() {
    return "KeyDelta{" + getKey() + ", opened=" + opened.size() + ", closed=" + closed.size()
        + "}";
  }
}
