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
package org.apache.calcite.adapter.governance.cleanse;

import org.apache.calcite.adapter.governance.GovernanceColumns;
import org.apache.calcite.adapter.governance.config.DerivedField;
import org.apache.calcite.adapter.governance.config.FieldRule;
import org.apache.calcite.adapter.governance.config.TableConfig;
import org.apache.calcite.adapter.governance.quality.FieldTransformer;
import org.apache.calcite.adapter.governance.quality.FieldValidator;
import org.apache.calcite.adapter.governance.quality.QualityAssessment;
import org.apache.calcite.adapter.governance.quality.QualityScorer;
import org.apache.calcite.adapter.governance.quality.QualitySummary;
import org.apache.calcite.adapter.governance.quality.TransformerRegistry;
import org.apache.calcite.adapter.governance.quality.ValidationCheck;
import org.apache.calcite.adapter.governance.quality.ValidatorRegistry;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw records into cleansed, quality-annotated records according to a
 * {@link TableConfig}.
 *
 * <p>Per record, in order: source prefix, trimming, field transformers,
 * derived fields, validation and scoring, null filling, upper-casing, and
 * the processed timestamp. Records that fail validation are kept; their
 * failures are reported in {@code data_quality_flags} and
 * {@code quality_score}.
 *
 * <p>A builder resolves every transformer and validator name once, at
 * construction, and is safe to share between threads afterwards.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CleansingBuilder builder = new CleansingBuilder(StandardConfigs.customerCleansing());
 * CleansingResult result = builder.cleanse(rawRecords);
 * }</pre>
 */
public class CleansingBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(CleansingBuilder.class);

  private final TableConfig config;
  private final Map<String, FieldTransformer> transformers;
  private final List<ValidationCheck> checks;
  private final List<ResolvedDerivedField> derivedFields;
  private final Set<String> fillNullFields;
  private final Set<String> uppercaseFields;
  private final QualityScorer scorer;
  private final Clock clock;

  /**
   * Creates a builder with the built-in registries and the UTC system clock.
   */
  public CleansingBuilder(TableConfig config) {
    this(config, TransformerRegistry.defaults(), ValidatorRegistry.defaults(), Clock.systemUTC());
  }

  /**
   * Creates a builder.
   *
   * @throws IllegalArgumentException if the config names an unregistered
   *     transformer or validator
   */
  public CleansingBuilder(TableConfig config, TransformerRegistry transformerRegistry,
      ValidatorRegistry validatorRegistry, Clock clock) {
    config.checkNames(transformerRegistry, validatorRegistry);
    this.config = config;
    this.clock = clock;
    this.scorer = new QualityScorer();

    Map<String, FieldTransformer> resolved = new LinkedHashMap<>();
    List<ValidationCheck> resolvedChecks = new ArrayList<>();
    for (FieldRule rule : config.getRules()) {
      if (rule.getTransformer() != null) {
        resolved.put(rule.getFieldName(), transformerRegistry.get(rule.getTransformer()));
      }
      for (String validator : rule.getValidators()) {
        resolvedChecks.add(
            new ValidationCheck(rule.getFieldName(), validator, validatorRegistry.get(validator)));
      }
    }
    this.transformers = Collections.unmodifiableMap(resolved);
    this.checks = Collections.unmodifiableList(resolvedChecks);

    List<ResolvedDerivedField> derived = new ArrayList<>();
    for (DerivedField field : config.getDerivedFields()) {
      List<FieldTransformer> chain = new ArrayList<>();
      for (String name : field.getTransformers()) {
        chain.add(transformerRegistry.get(name));
      }
      FieldValidator validator = field.getValidator() == null
          ? null : validatorRegistry.get(field.getValidator());
      derived.add(new ResolvedDerivedField(field, chain, validator));
    }
    this.derivedFields = Collections.unmodifiableList(derived);
    this.fillNullFields = config.getFillNullFields();
    this.uppercaseFields = config.getUppercaseFields();
  }

  public TableConfig getConfig() {
    return config;
  }

  /** The resolved checks, in the order their flags are reported. */
  public List<ValidationCheck> getChecks() {
    return checks;
  }

  /**
   * Cleanses a batch.
   *
   * @param batch Raw records; not modified
   * @return result whose records correspond one-to-one to the input
   */
  public CleansingResult cleanse(List<? extends Map<String, ?>> batch) {
    long startTime = System.currentTimeMillis();
    QualitySummary.Accumulator summary = QualitySummary.accumulator();
    long[] transformFailures = new long[1];
    List<Map<String, Object>> output = new ArrayList<>(batch.size());

    for (Map<String, ?> record : batch) {
      if (record == null) {
        LOGGER.warn("Table {}: null record in batch, cleansing it as an empty record",
            config.getName());
      }
      Map<String, Object> cleansed =
          cleanseRecord(record == null ? Collections.emptyMap() : record, summary,
              transformFailures);
      output.add(cleansed);
    }

    QualitySummary built = summary.build();
    long elapsed = System.currentTimeMillis() - startTime;
    LOGGER.info("Table {}: cleansed {} records, {} flagged, average score {}, "
            + "{} transformer failures in {}ms", config.getName(), output.size(),
        built.getFlaggedRows(), String.format(Locale.ROOT, "%.1f", built.getAverageScore()),
        transformFailures[0], elapsed);
    if (transformFailures[0] > 0) {
      LOGGER.warn("Table {}: {} transformer invocations failed; values were left unchanged",
          config.getName(), transformFailures[0]);
    }

    return CleansingResult.builder()
        .tableName(config.getName())
        .records(output)
        .summary(built)
        .transformFailures(transformFailures[0])
        .elapsedMs(elapsed)
        .build();
  }

  /**
   * Cleanses a single record.
   *
   * @param record Raw record; not modified
   * @return a new, cleansed record
   */
  public Map<String, Object> cleanseRecord(Map<String, ?> record) {
    return cleanseRecord(record, QualitySummary.accumulator(), new long[1]);
  }

  private Map<String, Object> cleanseRecord(Map<String, ?> record,
      QualitySummary.Accumulator summary, long[] transformFailures) {
    Map<String, Object> row = applyPrefix(record);

    if (config.isTrimValues()) {
      for (Map.Entry<String, Object> entry : row.entrySet()) {
        if (entry.getValue() instanceof String) {
          entry.setValue(((String) entry.getValue()).trim());
        }
      }
    }

    for (Map.Entry<String, FieldTransformer> entry : transformers.entrySet()) {
      String field = entry.getKey();
      if (row.containsKey(field)) {
        row.put(field, transform(field, entry.getValue(), row.get(field), transformFailures));
      }
    }

    for (ResolvedDerivedField derived : derivedFields) {
      DerivedField field = derived.field;
      Object value = row.get(field.getSource());
      for (FieldTransformer transformer : derived.chain) {
        value = transform(field.getName(), transformer, value, transformFailures);
      }
      row.put(field.getName(), value);
      if (derived.validator != null) {
        row.put(field.getValidityColumn(), isValid(derived.validator, value));
      }
    }

    QualityAssessment assessment = scorer.assess(validationView(row), checks);
    summary.add(assessment);
    row.put(GovernanceColumns.DATA_QUALITY_FLAGS, assessment.getFlags());
    row.put(GovernanceColumns.QUALITY_SCORE, assessment.getScore());
    if (config.isValidationColumns()) {
      for (Map.Entry<String, Boolean> result : assessment.getResults().entrySet()) {
        row.put(GovernanceColumns.VALIDITY_PREFIX + result.getKey(), result.getValue());
      }
    }

    String sentinel = config.getNullSentinel();
    for (String field : fillNullFields) {
      if (row.get(field) == null) {
        row.put(field, sentinel);
      }
    }

    for (String field : uppercaseFields) {
      Object value = row.get(field);
      if (value instanceof String
          && !(fillNullFields.contains(field) && sentinel.equals(value))) {
        row.put(field, ((String) value).trim().toUpperCase(Locale.ROOT));
      }
    }

    if (config.getProcessedTimestampColumn() != null) {
      row.put(config.getProcessedTimestampColumn(), Instant.now(clock));
    }

    if (LOGGER.isDebugEnabled() && !assessment.isClean()) {
      LOGGER.debug("Table {}: record flagged {} (score {})", config.getName(),
          assessment.getFlags(), assessment.getScore());
    }
    return row;
  }

  private Map<String, Object> applyPrefix(Map<String, ?> record) {
    String prefix = config.getSourcePrefix();
    Map<String, Object> row = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : record.entrySet()) {
      String column = entry.getKey();
      if (prefix != null && !prefix.isEmpty() && !column.startsWith(prefix)
          && !GovernanceColumns.isExemptFromPrefix(column)) {
        column = prefix + column;
      }
      row.put(column, entry.getValue());
    }
    return row;
  }

  /**
   * Returns the values validators see: the sentinel of a fill-null field
   * reads as null.
   */
  private Map<String, Object> validationView(Map<String, Object> row) {
    if (fillNullFields.isEmpty()) {
      return row;
    }
    Map<String, Object> view = null;
    String sentinel = config.getNullSentinel();
    for (String field : fillNullFields) {
      if (sentinel.equals(row.get(field))) {
        if (view == null) {
          view = new HashMap<>(row);
        }
        view.put(field, null);
      }
    }
    return view != null ? view : row;
  }

  private @Nullable Object transform(String field, FieldTransformer transformer,
      @Nullable Object value, long[] transformFailures) {
    try {
      return transformer.apply(value);
    } catch (RuntimeException e) {
      transformFailures[0]++;
      LOGGER.debug("Table {}: transformer failed for field {}: {}", config.getName(), field,
          e.getMessage());
      return value;
    }
  }

  private static boolean isValid(FieldValidator validator, @Nullable Object value) {
    try {
      return validator.test(value);
    } catch (RuntimeException e) {
      LOGGER.debug("Derived field validator failed: {}", e.getMessage());
      return false;
    }
  }

  /** Derived field with its transformer chain and validator resolved. */
  private static final class ResolvedDerivedField {
    final DerivedField field;
    final List<FieldTransformer> chain;
    final @Nullable FieldValidator validator;

    ResolvedDerivedField(DerivedField field, List<FieldTransformer> chain,
        @Nullable FieldValidator validator) {
      this.field = field;
      this.chain = chain;
      this.validator = validator;
    }
  }
}
