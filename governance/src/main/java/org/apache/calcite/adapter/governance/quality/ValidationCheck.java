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
package org.apache.calcite.adapter.governance.quality;

import java.util.Objects;

/**
 * A validator bound to a field, as declared by a table config.
 *
 * <p>The check's {@link #getFlagName() flag name} is
 * {@code {field}_{validator}}; it is what appears in
 * {@code data_quality_flags} when the check fails.
 */
public final class ValidationCheck {
  private final String fieldName;
  private final String validatorName;
  private final FieldValidator validator;

  public ValidationCheck(String fieldName, String validatorName, FieldValidator validator) {
    this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
    this.validatorName = Objects.requireNonNull(validatorName, "validatorName");
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public String getFieldName() {
    return fieldName;
  }

  public String getValidatorName() {
    return validatorName;
  }

  public FieldValidator getValidator() {
    return validator;
  }

  public String getFlagName() {
    return fieldName + "_" + validatorName;
  }

  @Override public String toString() {
    return getFlagName();
  }
}
