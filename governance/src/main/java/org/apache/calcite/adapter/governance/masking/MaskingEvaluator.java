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

import org.apache.calcite.adapter.governance.access.AccessLevel;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link MaskingPolicy} to records for a given access level.
 *
 * <ul>
 *   <li>{@link AccessLevel#FULL_ACCESS}: values are returned unchanged;</li>
 *   <li>{@link AccessLevel#PARTIAL_ACCESS}: the partial form;</li>
 *   <li>{@link AccessLevel#MASKED_ONLY}: the full form.</li>
 * </ul>
 *
 * <p>A malformed value, or a masking function that throws, yields the full
 * form; masking never lets a raw value through at a restricted level.
 * Auxiliary columns are read from the unmasked record.
 */
public class MaskingEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(MaskingEvaluator.class);

  private final MaskingFunctions functions;

  public MaskingEvaluator() {
    this(MaskingFunctions.defaults());
  }

  public MaskingEvaluator(MaskingFunctions functions) {
    this.functions = functions;
  }

  public MaskingFunctions getFunctions() {
    return functions;
  }

  /**
   * Masks one record.
   *
   * @param record Unmasked record; not modified
   * @return a new record with the masked fields replaced
   * @throws IllegalArgumentException if the policy names an unknown function
   */
  public Map<String, Object> evaluate(Map<String, ?> record, MaskingPolicy policy,
      AccessLevel level) {
    Map<String, Object> masked = new LinkedHashMap<>(record);
    if (level == AccessLevel.FULL_ACCESS) {
      return masked;
    }
    for (FieldMask mask : policy.getMasks()) {
      if (record.containsKey(mask.getField())) {
        masked.put(mask.getField(), maskValue(mask, record, level));
      }
    }
    return masked;
  }

  public List<Map<String, Object>> evaluateAll(List<? extends Map<String, ?>> records,
      MaskingPolicy policy, AccessLevel level) {
    List<Map<String, Object>> result = new ArrayList<>(records.size());
    for (Map<String, ?> record : records) {
      result.add(evaluate(record, policy, level));
    }
    return result;
  }

  /**
   * Masks the value of one field of a record.
   */
  public @Nullable Object maskValue(FieldMask mask, Map<String, ?> record, AccessLevel level) {
    Object value = record.get(mask.getField());
    if (level == AccessLevel.FULL_ACCESS) {
      return value;
    }
    MaskingFunction function = functions.get(mask.getFunction());
    if (level == AccessLevel.PARTIAL_ACCESS) {
      List<@Nullable Object> auxiliary = new ArrayList<>();
      for (String field : mask.getAuxiliaryFields()) {
        auxiliary.add(record.get(field));
      }
      try {
        String partial = function.partial(value, auxiliary);
        if (partial != null) {
          return partial;
        }
        LOGGER.debug("Field {}: malformed value for {}, fully masking", mask.getField(),
            function.getName());
      } catch (RuntimeException e) {
        LOGGER.debug("Field {}: {} failed, fully masking: {}", mask.getField(),
            function.getName(), e.getMessage());
      }
    }
    return full(function, value);
  }

  private static String full(MaskingFunction function, @Nullable Object value) {
    try {
      return function.full(value);
    } catch (RuntimeException e) {
      LOGGER.debug("{} full mask failed: {}", function.getName(), e.getMessage());
      return MaskingFunctions.STARS;
    }
  }
}
