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

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;

/**
 * Initial group grants for a fresh grant table: an analyst with masked
 * access, a scientist with partial access and a governance officer with
 * full access.
 */
public final class DefaultGrants {
  public static final String GRANTED_BY = "system";
  public static final String REASON = "Default group access";

  private DefaultGrants() {
  }

  public static List<AccessGrant> at(Instant grantedAt) {
    return ImmutableList.of(
        grant("analyst@company.com", "analyst", AccessLevel.MASKED_ONLY, grantedAt),
        grant("scientist@company.com", "scientist", AccessLevel.PARTIAL_ACCESS, grantedAt),
        grant("governance@company.com", "governance_officer", AccessLevel.FULL_ACCESS,
            grantedAt));
  }

  private static AccessGrant grant(String user, String group, AccessLevel level,
      Instant grantedAt) {
    return AccessGrant.builder(user, level)
        .userGroup(group)
        .grantedBy(GRANTED_BY)
        .grantedAt(grantedAt)
        .reason(REASON)
        .build();
  }
}
