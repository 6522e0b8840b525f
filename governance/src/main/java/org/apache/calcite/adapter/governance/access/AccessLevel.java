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

import java.util.Locale;

/**
 * How much of a masked field a user may see.
 */
public enum AccessLevel {
  /** Raw values. */
  FULL_ACCESS("full_access"),
  /** Partially masked values. */
  PARTIAL_ACCESS("partial_access"),
  /** Fully masked values; also the level of a user without a grant. */
  MASKED_ONLY("masked_only");

  private final String wireName;

  AccessLevel(String wireName) {
    this.wireName = wireName;
  }

  /** Name as stored in the grant table. */
  public String getWireName() {
    return wireName;
  }

  /**
   * Parses a stored access level. Unknown or missing values resolve to
   * {@link #MASKED_ONLY}.
   */
  public static AccessLevel fromWireName(@Nullable String name) {
    if (name == null) {
      return MASKED_ONLY;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (AccessLevel level : values()) {
      if (level.wireName.equals(normalized)) {
        return level;
      }
    }
    return MASKED_ONLY;
  }

  @Override public String toString() {
    return wireName;
  }
}
