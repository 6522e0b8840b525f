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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Binds a masking function to a field, with the auxiliary columns the
 * function reads (for example {@code postal_code} for {@code mask_address}).
 */
public final class FieldMask {
  private final String field;
  private final String function;
  private final List<String> auxiliaryFields;

  public FieldMask(String field, String function, List<String> auxiliaryFields) {
    this.field = Objects.requireNonNull(field, "field");
    this.function = Objects.requireNonNull(function, "function");
    this.auxiliaryFields = ImmutableList.copyOf(auxiliaryFields);
  }

  public static FieldMask of(String field, String function, String... auxiliaryFields) {
    return new FieldMask(field, function, ImmutableList.copyOf(auxiliaryFields));
  }

  public String getField() {
    return field;
  }

  public String getFunction() {
    return function;
  }

  public List<String> getAuxiliaryFields() {
    return auxiliaryFields;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FieldMask
        && field.equals(((FieldMask) o).field)
        && function.equals(((FieldMask) o).function)
        && auxiliaryFields.equals(((FieldMask) o).auxiliaryFields);
  }

  @Override public int hashCode() {
    return Objects.hash(field, function, auxiliaryFields);
  }

  @Override public String toString() {
    return auxiliaryFields.isEmpty()
        ? field + " -> " + function
        : field + " -> " + function + " USING COLUMNS " + auxiliaryFields;
  }
}
