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

import org.apache.calcite.adapter.governance.GovernanceColumns;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Column computed from another column during cleansing.
 *
 * <p>The source value goes through the transformers in order. When a
 * validator is given, its verdict is written to a boolean validity column
 * ({@code is_valid_{name}} unless named explicitly); the verdict does not
 * enter the quality score.
 *
 * <pre>{@code
 * derived:
 *   - name: postal_code
 *     source: address
 *     transformers: [extract_postal_code, standardize_singapore_postal_code]
 *     validator: validate_singapore_postal_code
 * }</pre>
 */
public final class DerivedField {
  private final String name;
  private final String source;
  private final List<String> transformers;
  private final @Nullable String validator;
  private final @Nullable String validityColumn;

  private DerivedField(Builder builder) {
    this.name = builder.name;
    this.source = builder.source;
    this.transformers = Collections.unmodifiableList(new ArrayList<>(builder.transformers));
    this.validator = builder.validator;
    if (builder.validityColumn != null) {
      this.validityColumn = builder.validityColumn;
    } else if (builder.validator != null) {
      this.validityColumn = GovernanceColumns.VALIDITY_PREFIX + builder.name;
    } else {
      this.validityColumn = null;
    }
  }

  public String getName() {
    return name;
  }

  public String getSource() {
    return source;
  }

  public List<String> getTransformers() {
    return transformers;
  }

  public @Nullable String getValidator() {
    return validator;
  }

  /** Name of the boolean validity column, null when there is no validator. */
  public @Nullable String getValidityColumn() {
    return validityColumn;
  }

  public static Builder builder(String name, String source) {
    return new Builder(name, source);
  }

  public static DerivedField fromMap(Map<String, Object> map) {
    Builder builder = builder(ConfigValues.string(map, "name"), ConfigValues.string(map, "source"));
    for (String transformer : ConfigValues.stringList(map.get("transformers"))) {
      builder.transformer(transformer);
    }
    builder.validator(ConfigValues.string(map, "validator"));
    builder.validityColumn(ConfigValues.string(map, "validityColumn"));
    return builder.build();
  }

  @Override public String toString() {
    return "DerivedField{" + name + " <- " + source + " " + transformers + "}";
  }

  /**
   * Builder for DerivedField.
   */
  public static final class Builder {
    private final String name;
    private final String source;
    private final List<String> transformers = new ArrayList<>();
    private String validator;
    private String validityColumn;

    private Builder(String name, String source) {
      this.name = name;
      this.source = source;
    }

    public Builder transformer(String transformer) {
      transformers.add(transformer);
      return this;
    }

    public Builder validator(@Nullable String validator) {
      this.validator = validator;
      return this;
    }

    public Builder validityColumn(@Nullable String validityColumn) {
      this.validityColumn = validityColumn;
      return this;
    }

    public DerivedField build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Derived field name is required");
      }
      if (source == null || source.isEmpty()) {
        throw new IllegalArgumentException("Derived field '" + name + "' needs a source column");
      }
      return new DerivedField(this);
    }
  }
}
