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

/**
 * Holds the committed history of one SCD Type 2 table.
 *
 * <p>Readers always see a complete committed snapshot, never a partially
 * applied merge.
 */
public interface HistoryStore {

  String getName();

  /** Returns the latest committed snapshot. */
  HistoryTable snapshot();

  /**
   * Atomically applies a merge result.
   *
   * <p>Every delta's {@code before} history must equal the stored history
   * of its key; otherwise nothing is applied.
   *
   * @throws CommitConflictException if any key changed since the merge read it
   */
  void commit(MergeResult result) throws CommitConflictException;
}
