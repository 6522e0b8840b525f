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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered set of field masks applied to a table's records.
 *
 * <p>YAML form; each value is a function name, a
 * {@code "function USING COLUMNS (a, b)"} string, or a mapping:
 * <pre>{@code
 * masking:
 *   email: mask_email
 *   address: mask_address USING COLUMNS (postal_code)
 *   nric: {function: mask_nric}
 * }</pre>
 */
public final class MaskingPolicy {
  private static final Pattern USING_COLUMNS =
      Pattern.compile("^\\s*(\\w+)\\s+USING\\s+COLUMNS\\s*\\(([^)]*)\\)\\s*$",
          Pattern.CASE_INSENSITIVE);

  private static final MaskingPolicy NONE = new MaskingPolicy(ImmutableList.of());

  private final List<FieldMask> masks;

  public MaskingPolicy(List<FieldMask> masks) {
    for (int i = 0; i < masks.size(); i++) {
      for (int j = 0; j < i; j++) {
        if (masks.get(i).getField().equals(masks.get(j).getField())) {
          throw new IllegalArgumentException("Field '" + masks.get(i).getField()
              + "' is masked more than once");
        }
      }
    }
    this.masks = ImmutableList.copyOf(masks);
  }

  public static MaskingPolicy none() {
    return NONE;
  }

  public static MaskingPolicy of(FieldMask... masks) {
    return new MaskingPolicy(ImmutableList.copyOf(masks));
  }

  /**
   * Email, phone, NRIC, address (using {@code postal_code}) and SSN.
   */
  public static MaskingPolicy standardPii() {
    return of(
        FieldMask.of("email", MaskingFunctions.MASK_EMAIL),
        FieldMask.of("phone", MaskingFunctions.MASK_PHONE),
        FieldMask.of("nric", MaskingFunctions.MASK_NRIC),
        FieldMask.of("address", MaskingFunctions.MASK_ADDRESS, "postal_code"),
        FieldMask.of("ssn", MaskingFunctions.MASK_SSN));
  }

  public List<FieldMask> getMasks() {
    return masks;
  }

  public boolean isMasked(String field) {
    return getMask(field) != null;
  }

  public @Nullable FieldMask getMask(String field) {
    for (FieldMask mask : masks) {
      if (mask.getField().equals(field)) {
        return mask;
      }
    }
    return null;
  }

  public boolean isEmpty() {
    return masks.isEmpty();
  }

  /**
   * Checks that every function this policy names is registered.
   *
   * @throws IllegalArgumentException naming the first unknown function
   */
  public void checkNames(MaskingFunctions functions) {
    for (FieldMask mask : masks) {
      if (!functions.contains(mask.getFunction())) {
        throw new IllegalArgumentException("Field '" + mask.getField()
            + "': unknown masking function '" + mask.getFunction() + "'");
      }
    }
  }

  @SuppressWarnings("unchecked")
  public static MaskingPolicy fromMap(@Nullable Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return NONE;
    }
    List<FieldMask> masks = new ArrayList<>();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      String field = entry.getKey();
      Object value = entry.getValue();
      if (value instanceof String) {
        masks.add(parse(field, (String) value));
      } else if (value instanceof Map) {
        Map<String, Object> options = (Map<String, Object>) value;
        Object function = options.get("function");
        if (function == null) {
          throw new IllegalArgumentException("Mask for field '" + field + "' needs a function");
        }
        masks.add(new FieldMask(field, function.toString(), toList(options.get("using"))));
      } else {
        throw new IllegalArgumentException("Mask for field '" + field
            + "' must be a function name or a mapping, got: " + value);
      }
    }
    return new MaskingPolicy(masks);
  }

  private static FieldMask parse(String field, String text) {
    Matcher matcher = USING_COLUMNS.matcher(text);
    if (!matcher.matches()) {
      return new FieldMask(field, text.trim(), Collections.emptyList());
    }
    List<String> columns = new ArrayList<>();
    for (String column : matcher.group(2).split(",")) {
      if (!column.trim().isEmpty()) {
        columns.add(column.trim());
      }
    }
    return new FieldMask(field, matcher.group(1), columns);
  }

  private static List<String> toList(@Nullable Object value) {
    if (value == null) {
      return Collections.emptyList();
    }
    if (value instanceof List) {
      List<String> result = new ArrayList<>();
      for (Object item : (List<?>) value) {
        result.add(String.valueOf(item));
      }
      return result;
    }
    return Collections.singletonList(value.toString());
  }

  @Override public String toString() {
    return "MaskingPolicy" + masks;
  }
}
