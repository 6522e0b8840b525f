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
 * Chooses the grant that applies to a user.
 */
public final class EffectiveGrants {
  private EffectiveGrants() {
  }

  /**
   * Returns the effective grant among a user's grants: active, unexpired at
   * {@code at}, most recently granted. Grants with the same {@code granted_at}
   * resolve to the least privileged one.
   *
   * @return the grant, or null if none is effective
   */
  public static @Nullable AccessGrant select(Iterable<AccessGrant> grants, Instant at) {
    AccessGrant best = null;
    for (AccessGrant grant : grants) {
      if (!grant.isEffectiveAt(at)) {
        continue;
      }
      if (best == null) {
        best = grant;
        continue;
      }
      int cmp = grant.getGrantedAt().compareTo(best.getGrantedAt());
      if (cmp > 0
          || cmp == 0 && grant.getAccessLevel().ordinal() > best.getAccessLevel().ordinal()) {
        best = grant;
      }
    }
    return best;
  }
}
