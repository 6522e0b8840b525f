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
import java.util.Objects;

/**
 * Cleansing rule for one field: at most one transformer, any number of
 * validators, and the uppercase / fill-null switches.
 *
 * <p>YAML forms:
 * <pre>{@code
 * fields:
 *   nric: {transformer: standardize_nric, validators: [validate_singapore_nric]}
 *   email:
 *     validators: validate_email
 *     fillNull: true
 *   phone: standardize_phone_number      # transformer shorthand
 * }</pre>
 */
public final class FieldRule {
  private final String fieldName;
  private final @Nullable String transformer;
  private final List<String> validators;
  private final boolean uppercase;
  private final boolean fillNull;

  private FieldRule(Builder builder) {
    this.fieldName = builder.fieldName;
    this.transformer = builder.transformer;
    this.validators = Collections.unmodifiableList(new ArrayList<>(builder.validators));
    this.uppercase = builder.uppercase;
    this.fillNull = builder.fillNull;
  }

  public String getFieldName() {
    return fieldName;
  }

  public @Nullable String getTransformer() {
    return transformer;
  }

  public List<String> getValidators() {
    return validators;
  }

  public boolean isUppercase() {
    return uppercase;
  }

  public boolean isFillNull() {
    return fillNull;
  }

  public static Builder builder(String fieldName) {
    return new Builder(fieldName);
  }

  public Builder toBuilder() {
    Builder builder = new Builder(fieldName);
    builder.transformer = transformer;
    builder.validators.addAll(validators);
    builder.uppercase = uppercase;
    builder.fillNull = fillNull;
    return builder;
  }

  /**
   * Parses a rule from its YAML value, which is either a transformer name or
   * a map with keys transformer, validators (or validator), uppercase,
   * fillNull.
   */
  @SuppressWarnings("unchecked")
  public static FieldRule fromConfig(String fieldName, @Nullable Object value) {
    Builder builder = builder(fieldName);
    if (value instanceof String) {
      return builder.transformer((String) value).build();
    }
    if (value == null) {
      return builder.build();
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("Rule for field '" + fieldName
          + "' must be a transformer name or a mapping, got: " + value);
    }
    Map<String, Object> map = (Map<String, Object>) value;
    builder.transformer(ConfigValues.string(map, "transformer"));
    for (String validator : ConfigValues.stringList(map.get("validators"))) {
      builder.validator(validator);
    }
    for (String validator : ConfigValues.stringList(map.get("validator"))) {
      builder.validator(validator);
    }
    Boolean uppercase = ConfigValues.bool(map, "uppercase");
    if (uppercase != null) {
      builder.uppercase(uppercase);
    }
    Boolean fillNull = ConfigValues.bool(map, "fillNull");
    if (fillNull != null) {
      builder.fillNull(fillNull);
    }
    return builder.build();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldRule)) {
      return false;
    }
    FieldRule that = (FieldRule) o;
    return uppercase == that.uppercase
        && fillNull == that.fillNull
        && fieldName.equals(that.fieldName)
        && Objects.equals(transformer, that.transformer)
        && validators.equals(that.validators);
  }

  @Override public int hashCode() {
    return Objects.hash(fieldName, transformer, validators, uppercase, fillNull);
  }

  @Override public String toString() {
    return "FieldRule{" + fieldName + ", transformer=" + transformer
        + ", validators=" + validators + ", uppercase=" + uppercase
        + ", fillNull=" + fillNull + "}";
  }

  /**
   * Builder for FieldRule.
   */
  public static final class Builder {
    private final String fieldName;
    private String transformer;
    private final List<String> validators = new ArrayList<>();
    private boolean uppercase;
    private boolean fillNull;

    private Builder(String fieldName) {
      if (fieldName == null || fieldName.isEmpty()) {
        throw new IllegalArgumentException("Field name is required");
      }
      this.fieldName = fieldName;
    }

    public Builder transformer(@Nullable String transformer) {
      this.transformer = transformer;
      return this;
    }

    /** Adds a validator; a name already present is ignored. */
    public Builder validator(String validator) {
      if (!validators.contains(validator)) {
        validators.add(validator);
      }
      return this;
    }

    public Builder uppercase(boolean uppercase) {
      this.uppercase = uppercase;
      return this;
    }

    public Builder fillNull(boolean fillNull) {
      this.fillNull = fillNull;
      return this;
    }

    public FieldRule build() {
      return new FieldRule(this);
    }
  }
}
