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

import org.apache.calcite.adapter.governance.quality.TransformerRegistry;
import org.apache.calcite.adapter.governance.quality.ValidatorRegistry;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cleansing configuration for one table.
 *
 * <p>Rules are kept in declaration order; that order fixes both the order in
 * which transformers run and the order of names in
 * {@code data_quality_flags}.
 *
 * <p>Upper-casing happens after validation. Reprocessing a cleansed batch is
 * only guaranteed to reproduce the same flags when every upper-cased field
 * either has a case-normalizing transformer or only case-insensitive
 * validators; {@code validate_singapore_nric} and {@code validate_nric_9char}
 * are case-sensitive.
 *
 * <p>Field names in rules are the names after the source prefix is applied.
 *
 * <p>Example:
 * <pre>{@code
 * cleansing:
 *   sourcePrefix: src_
 *   nullSentinel: "None"
 *   fields:
 *     nric: {transformer: standardize_nric, validators: [validate_singapore_nric]}
 *     email: {validators: [validate_email]}
 *   uppercase: [full_name]
 *   fillNull: [email, phone]
 * }</pre>
 */
public final class TableConfig {
  public static final String DEFAULT_NULL_SENTINEL = "None";

  private final String name;
  private final List<FieldRule> rules;
  private final @Nullable String sourcePrefix;
  private final String nullSentinel;
  private final boolean trimValues;
  private final List<DerivedField> derivedFields;
  private final boolean validationColumns;
  private final @Nullable String processedTimestampColumn;

  private TableConfig(Builder builder) {
    this.name = builder.name;
    List<FieldRule> built = new ArrayList<>();
    for (FieldRule.Builder rule : builder.rules.values()) {
      built.add(rule.build());
    }
    this.rules = Collections.unmodifiableList(built);
    this.sourcePrefix = builder.sourcePrefix;
    this.nullSentinel = builder.nullSentinel;
    this.trimValues = builder.trimValues;
    this.derivedFields = Collections.unmodifiableList(new ArrayList<>(builder.derivedFields));
    this.validationColumns = builder.validationColumns;
    this.processedTimestampColumn = builder.processedTimestampColumn;
  }

  public String getName() {
    return name;
  }

  public List<FieldRule> getRules() {
    return rules;
  }

  public @Nullable FieldRule getRule(String fieldName) {
    for (FieldRule rule : rules) {
      if (rule.getFieldName().equals(fieldName)) {
        return rule;
      }
    }
    return null;
  }

  /** Fields that are upper-cased after validation, in declaration order. */
  public Set<String> getUppercaseFields() {
    Set<String> fields = new LinkedHashSet<>();
    for (FieldRule rule : rules) {
      if (rule.isUppercase()) {
        fields.add(rule.getFieldName());
      }
    }
    return fields;
  }

  /** Fields whose nulls are replaced by the sentinel, in declaration order. */
  public Set<String> getFillNullFields() {
    Set<String> fields = new LinkedHashSet<>();
    for (FieldRule rule : rules) {
      if (rule.isFillNull()) {
        fields.add(rule.getFieldName());
      }
    }
    return fields;
  }

  public @Nullable String getSourcePrefix() {
    return sourcePrefix;
  }

  public String getNullSentinel() {
    return nullSentinel;
  }

  public boolean isTrimValues() {
    return trimValues;
  }

  public List<DerivedField> getDerivedFields() {
    return derivedFields;
  }

  /** Whether a boolean {@code is_valid_{field}_{validator}} column is written per check. */
  public boolean isValidationColumns() {
    return validationColumns;
  }

  public @Nullable String getProcessedTimestampColumn() {
    return processedTimestampColumn;
  }

  /**
   * Checks that every transformer and validator this config names is
   * registered.
   *
   * @throws IllegalArgumentException naming the first unknown name
   */
  public void checkNames(TransformerRegistry transformers, ValidatorRegistry validators) {
    for (FieldRule rule : rules) {
      if (rule.getTransformer() != null && !transformers.contains(rule.getTransformer())) {
        throw new IllegalArgumentException("Table '" + name + "', field '"
            + rule.getFieldName() + "': unknown transformer '" + rule.getTransformer() + "'");
      }
      for (String validator : rule.getValidators()) {
        if (!validators.contains(validator)) {
          throw new IllegalArgumentException("Table '" + name + "', field '"
              + rule.getFieldName() + "': unknown validator '" + validator + "'");
        }
      }
    }
    for (DerivedField derived : derivedFields) {
      for (String transformer : derived.getTransformers()) {
        if (!transformers.contains(transformer)) {
          throw new IllegalArgumentException("Table '" + name + "', derived field '"
              + derived.getName() + "': unknown transformer '" + transformer + "'");
        }
      }
      if (derived.getValidator() != null && !validators.contains(derived.getValidator())) {
        throw new IllegalArgumentException("Table '" + name + "', derived field '"
            + derived.getName() + "': unknown validator '" + derived.getValidator() + "'");
      }
    }
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Creates a TableConfig from a YAML/JSON map.
   *
   * @param defaultName Name used when the map has no {@code name} key
   */
  @SuppressWarnings("unchecked")
  public static TableConfig fromMap(Map<String, Object> map, String defaultName) {
    String name = ConfigValues.string(map, "name");
    Builder builder = builder(name != null ? name : defaultName);
    builder.sourcePrefix(ConfigValues.string(map, "sourcePrefix"));
    String sentinel = ConfigValues.string(map, "nullSentinel");
    if (sentinel != null) {
      builder.nullSentinel(sentinel);
    }
    Boolean trim = ConfigValues.bool(map, "trimValues");
    if (trim != null) {
      builder.trimValues(trim);
    }
    Map<String, Object> fields = ConfigValues.map(map, "fields");
    if (fields != null) {
      for (Map.Entry<String, Object> entry : fields.entrySet()) {
        builder.rule(FieldRule.fromConfig(entry.getKey(), entry.getValue()));
      }
    }
    builder.uppercase(ConfigValues.stringList(map.get("uppercase")).toArray(new String[0]));
    builder.fillNull(ConfigValues.stringList(map.get("fillNull")).toArray(new String[0]));
    Object derived = map.get("derived");
    if (derived instanceof List) {
      for (Object item : (List<?>) derived) {
        if (!(item instanceof Map)) {
          throw new IllegalArgumentException("Derived field entries must be mappings: " + item);
        }
        builder.derive(DerivedField.fromMap((Map<String, Object>) item));
      }
    }
    Boolean validationColumns = ConfigValues.bool(map, "validationColumns");
    if (validationColumns != null) {
      builder.validationColumns(validationColumns);
    }
    builder.processedTimestampColumn(ConfigValues.string(map, "processedTimestampColumn"));
    return builder.build();
  }

  @Override public String toString() {
    return "TableConfig{" + name + ", rules=" + rules + ", derived=" + derivedFields + "}";
  }

  /**
   * Builder for TableConfig.
   *
   * <p>Declaring a field again updates its existing rule in place, so the
   * field keeps its original position.
   */
  public static final class Builder {
    private final String name;
    private final Map<String, FieldRule.Builder> rules = new LinkedHashMap<>();
    private String sourcePrefix;
    private String nullSentinel = DEFAULT_NULL_SENTINEL;
    private boolean trimValues = true;
    private final List<DerivedField> derivedFields = new ArrayList<>();
    private boolean validationColumns;
    private String processedTimestampColumn;
    private TransformerRegistry transformers;
    private ValidatorRegistry validators;

    private Builder(String name) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Table name is required");
      }
      this.name = name;
    }

    /**
     * Copies every setting of an existing config into this builder. Later
     * calls override what was included.
     */
    public Builder include(TableConfig other) {
      for (FieldRule rule : other.rules) {
        rules.put(rule.getFieldName(), rule.toBuilder());
      }
      if (other.sourcePrefix != null) {
        sourcePrefix = other.sourcePrefix;
      }
      nullSentinel = other.nullSentinel;
      trimValues = other.trimValues;
      derivedFields.addAll(other.derivedFields);
      validationColumns = other.validationColumns;
      if (other.processedTimestampColumn != null) {
        processedTimestampColumn = other.processedTimestampColumn;
      }
      return this;
    }

    /** Replaces the whole rule for a field. */
    public Builder rule(FieldRule rule) {
      rules.put(rule.getFieldName(), rule.toBuilder());
      return this;
    }

    public Builder transform(String field, String transformer) {
      field(field).transformer(transformer);
      return this;
    }

    public Builder validate(String field, String... validators) {
      FieldRule.Builder rule = field(field);
      for (String validator : validators) {
        rule.validator(validator);
      }
      return this;
    }

    public Builder uppercase(String... fields) {
      for (String field : fields) {
        field(field).uppercase(true);
      }
      return this;
    }

    public Builder fillNull(String... fields) {
      for (String field : fields) {
        field(field).fillNull(true);
      }
      return this;
    }

    public Builder sourcePrefix(@Nullable String sourcePrefix) {
      this.sourcePrefix = sourcePrefix;
      return this;
    }

    public Builder nullSentinel(String nullSentinel) {
      this.nullSentinel = nullSentinel;
      return this;
    }

    public Builder trimValues(boolean trimValues) {
      this.trimValues = trimValues;
      return this;
    }

    public Builder derive(DerivedField derivedField) {
      derivedFields.removeIf(d -> d.getName().equals(derivedField.getName()));
      derivedFields.add(derivedField);
      return this;
    }

    public Builder validationColumns(boolean validationColumns) {
      this.validationColumns = validationColumns;
      return this;
    }

    public Builder processedTimestampColumn(@Nullable String column) {
      this.processedTimestampColumn = column;
      return this;
    }

    /** Binds registries so that {@link #build()} rejects unknown names. */
    public Builder registries(TransformerRegistry transformers, ValidatorRegistry validators) {
      this.transformers = transformers;
      this.validators = validators;
      return this;
    }

    private FieldRule.Builder field(String field) {
      return rules.computeIfAbsent(field, FieldRule::builder);
    }

    public TableConfig build() {
      if (nullSentinel == null) {
        throw new IllegalArgumentException("Null sentinel must not be null");
      }
      TableConfig config = new TableConfig(this);
      if (transformers != null && validators != null) {
        config.checkNames(transformers, validators);
      }
      return config;
    }
  }
}
