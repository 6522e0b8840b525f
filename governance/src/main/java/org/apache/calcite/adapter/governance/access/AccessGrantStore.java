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

import java.time.Instant;

/**
 * Source of access grants.
 *
 * <p>Implementations read the current state on every call; callers must not
 * cache results across reads, so that a revoked grant takes effect on the
 * next read.
 */
public interface AccessGrantStore {

  /**
   * Returns the grant in effect for a user at an instant.
   *
   * @return the grant, or null when the user has none
   * @throws AccessGrantLookupException if the grants cannot be read
   */
  @Nullable AccessGrant effectiveGrant(String userId, Instant at);

  /**
   * Returns the access level of a user at an instant; a user without an
   * effective grant gets {@link AccessLevel#MASKED_ONLY}.
   */
  default AccessLevel resolveAccessLevel(String userId, Instant at) {
    AccessGrant grant = effectiveGrant(userId, at);
    return grant == null ? AccessLevel.MASKED_ONLY : grant.getAccessLevel();
  }
}
