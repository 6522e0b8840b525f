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
package org.apache.calcite.adapter.governance.config;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Coercions shared by the {@code fromMap} factories.
 */
final class ConfigValues {
  private ConfigValues() {
  }

  /** Accepts a single string or a list of scalars. */
  static List<String> stringList(@Nullable Object value) {
    if (value == null) {
      return Collections.emptyList();
    }
    if (value instanceof List) {
      List<String> result = new ArrayList<>();
      for (Object item : (List<?>) value) {
        if (item != null) {
          result.add(item.toString());
        }
      }
      return result;
    }
    return Collections.singletonList(value.toString());
  }

  static @Nullable String string(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value == null ? null : value.toString();
  }

  static @Nullable Boolean bool(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      return Boolean.parseBoolean((String) value);
    }
    return null;
  }

  static @Nullable Integer integer(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return Integer.valueOf(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("'" + key + "' must be an integer: " + value, e);
      }
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  static @Nullable Map<String, Object> map(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("'" + key + "' must be a mapping, got: " + value);
    }
    return (Map<String, Object>) value;
  }
}
