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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link HistoryStore} holding an immutable {@link HistoryTable} in memory.
 *
 * <p>Commits swap the whole snapshot with a compare-and-set, so concurrent
 * commits on disjoint keys both succeed while a commit that touches a key
 * someone else changed fails without effect.
 */
public class InMemoryHistoryStore implements HistoryStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryHistoryStore.class);

  private final String name;
  private final AtomicReference<HistoryTable> table;

  public InMemoryHistoryStore(String name) {
    this(name, HistoryTable.empty());
  }

  public InMemoryHistoryStore(String name, HistoryTable initial) {
    this.name = name;
    this.table = new AtomicReference<>(initial);
  }

  @Override public String getName() {
    return name;
  }

  @Override public HistoryTable snapshot() {
    return table.get();
  }

  @Override public void commit(MergeResult result) throws CommitConflictException {
    if (!result.hasChanges()) {
      LOGGER.debug("Store {}: nothing to commit", name);
      return;
    }
    while (true) {
      HistoryTable base = table.get();
      List<BusinessKey> conflicts = new ArrayList<>();
      for (KeyDelta delta : result.getDeltas()) {
        if (!base.get(delta.getKey()).equals(delta.getBefore())) {
          conflicts.add(delta.getKey());
        }
      }
      if (!conflicts.isEmpty()) {
        LOGGER.warn("Store {}: commit conflicts on {} key(s)", name, conflicts.size());
        throw new CommitConflictException(name, conflicts);
      }
      HistoryTable next = result.applyTo(base);
      if (table.compareAndSet(base, next)) {
        LOGGER.info("Store {}: committed {} key change(s), {} versions in total", name,
            result.getDeltas().size(), next.versionCount());
        return;
      }
      // another commit landed in between; re-check against the new snapshot
    }
  }

  @Override public String toString() {
    return "InMemoryHistoryStore{" + name + ", " + table.get() + "}";
  }
}
