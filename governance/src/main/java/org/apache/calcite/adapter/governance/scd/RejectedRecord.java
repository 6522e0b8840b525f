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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An input row the merge could not use, with its position in the batch.
 */
public final class RejectedRecord {
  private final int index;
  private final String reason;
  private final @Nullable Map<String, Object> row;

  public RejectedRecord(int index, String reason, @Nullable Map<String, ?> row) {
    this.index = index;
    this.reason = reason;
    this.row = row == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(row));
  }

  /** Zero-based position in the input batch. */
  public int getIndex() {
    return index;
  }

  public String getReason() {
    return reason;
  }

  public @Nullable Map<String, Object> getRow() {
    return row;
  }

  @Override public String toString() {
    return "RejectedRecord{#" + index + ": " + reason + "}";
  }
}
