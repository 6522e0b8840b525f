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

import org.apache.calcite.adapter.governance.util.Values;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity of an entity: the values of its key columns, in key order.
 *
 * <p>Integral values are normalized so that {@code 1} and {@code 1L} are the
 * same key.
 */
public final class BusinessKey {
  private final List<String> columns;
  private final List<Object> values;

  private BusinessKey(List<String> columns, List<Object> values) {
    this.columns = columns;
    this.values = values;
  }

  /**
   * Creates a key from explicit values.
   *
   * @throws IllegalArgumentException if the sizes differ or a value is null
   */
  public static BusinessKey of(List<String> columns, List<?> values) {
    if (columns.size() != values.size() || columns.isEmpty()) {
      throw new IllegalArgumentException("Key columns " + columns + " do not match values "
          + values);
    }
    List<Object> normalized = new ArrayList<>();
    for (int i = 0; i < values.size(); i++) {
      Object value = values.get(i);
      if (value == null) {
        throw new IllegalArgumentException("Key column '" + columns.get(i) + "' is null");
      }
      normalized.add(Values.normalizeKey(value));
    }
    return new BusinessKey(ImmutableList.copyOf(columns), Collections.unmodifiableList(normalized));
  }

  /** Single-column key. */
  public static BusinessKey of(String column, Object value) {
    return of(Collections.singletonList(column), Collections.singletonList(value));
  }

  /**
   * Extracts the key of a row.
   *
   * @return the key, or null if any key column is missing or null
   */
  public static @Nullable BusinessKey from(Map<String, ?> row, List<String> keyColumns) {
    List<Object> values = new ArrayList<>(keyColumns.size());
    for (String column : keyColumns) {
      Object value = row.get(column);
      if (value == null) {
        return null;
      }
      values.add(value);
    }
    return of(keyColumns, values);
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<Object> getValues() {
    return values;
  }

  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      map.put(columns.get(i), values.get(i));
    }
    return map;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof BusinessKey
        && columns.equals(((BusinessKey) o).columns)
        && values.equals(((BusinessKey) o).values);
  }

  @Override public int hashCode() {
    return values.hashCode();
  }

  @Override public String toString() {
    if (columns.size() == 1) {
      return columns.get(0) + "=" + values.get(0);
    }
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(columns.get(i)).append('=').append(values.get(i));
    }
    return sb.append(')').toString();
  }
}
