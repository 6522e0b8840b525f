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
package org.apache.calcite.adapter.governance.masking;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A named masking function with a partial and a full form.
 */
public interface MaskingFunction {

  String getName();

  /**
   * Partially masks a value.
   *
   * @param value Raw value
   * @param auxiliaryValues Values of the auxiliary columns named by the
   *     field mask, in order
   * @return the partially masked value, or null when the value is malformed;
   *     the caller then falls back to {@link #full}
   */
  @Nullable String partial(@Nullable Object value, List<@Nullable Object> auxiliaryValues);

  /** Fully masks a value. Must not throw. */
  String full(@Nullable Object value);
}
