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
package org.apache.calcite.adapter.governance.access;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe, mutable {@link AccessGrantStore}.
 */
public class InMemoryAccessGrantStore implements AccessGrantStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAccessGrantStore.class);

  private final List<AccessGrant> grants = new CopyOnWriteArrayList<>();

  public InMemoryAccessGrantStore grant(AccessGrant grant) {
    grants.add(grant);
    LOGGER.info("Granted {} to {}", grant.getAccessLevel(), grant.getUserId());
    return this;
  }

  /**
   * Marks every active grant of a user inactive.
   *
   * @return number of grants deactivated
   */
  public synchronized int deactivate(String userId) {
    int count = 0;
    for (int i = 0; i < grants.size(); i++) {
      AccessGrant grant = grants.get(i);
      if (grant.getUserId().equals(userId) && grant.isActive()) {
        grants.set(i, grant.withActive(false));
        count++;
      }
    }
    LOGGER.info("Deactivated {} grant(s) of {}", count, userId);
    return count;
  }

  /**
   * Removes every grant of a user.
   *
   * @return number of grants removed
   */
  public synchronized int revoke(String userId) {
    List<AccessGrant> removed = new ArrayList<>();
    for (AccessGrant grant : grants) {
      if (grant.getUserId().equals(userId)) {
        removed.add(grant);
      }
    }
    grants.removeAll(removed);
    LOGGER.info("Revoked {} grant(s) of {}", removed.size(), userId);
    return removed.size();
  }

  public List<AccessGrant> grantsOf(String userId) {
    List<AccessGrant> result = new ArrayList<>();
    for (AccessGrant grant : grants) {
      if (grant.getUserId().equals(userId)) {
        result.add(grant);
      }
    }
    return result;
  }

  @Override public @Nullable AccessGrant effectiveGrant(String userId, Instant at) {
    return EffectiveGrants.select(grantsOf(userId), at);
  }
}
