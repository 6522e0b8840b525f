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

import java.util.List;

/**
 * Checks the invariants of one key's history:
 * <ul>
 *   <li>versions are ordered by {@code validFrom} and every interval is
 *       non-empty;</li>
 *   <li>each version ends where the next begins, except after a version
 *       closed by a delete, which may be followed by a gap;</li>
 *   <li>at most one version is open, and it is the latest.</li>
 * </ul>
 */
public final class HistoryIntegrity {
  private HistoryIntegrity() {
  }

  public static void verify(KeyHistory history) throws MergeIntegrityException {
    List<VersionedRecord> versions = history.getVersions();
    BusinessKey key = history.getKey();
    for (int i = 0; i < versions.size(); i++) {
      VersionedRecord version = versions.get(i);
      boolean last = i == versions.size() - 1;
      if (version.isOpen()) {
        if (!last) {
          throw new MergeIntegrityException(key, "open version from "
              + version.getValidFrom() + " is not the latest");
        }
        continue;
      }
      if (!version.getValidTo().isAfter(version.getValidFrom())) {
        throw new MergeIntegrityException(key, "empty or inverted interval ["
            + version.getValidFrom() + ", " + version.getValidTo() + ")");
      }
      if (!last) {
        VersionedRecord next = versions.get(i + 1);
        int cmp = next.getValidFrom().compareTo(version.getValidTo());
        if (cmp < 0) {
          throw new MergeIntegrityException(key, "version from " + next.getValidFrom()
              + " overlaps version ending " + version.getValidTo());
        }
        if (cmp > 0 && !version.isDeleted()) {
          throw new MergeIntegrityException(key, "gap between " + version.getValidTo()
              + " and " + next.getValidFrom());
        }
      }
    }
  }
}
