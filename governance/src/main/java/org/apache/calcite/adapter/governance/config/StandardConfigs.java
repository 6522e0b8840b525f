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

/**
 * Ready-made cleansing configurations.
 */
public final class StandardConfigs {
  private StandardConfigs() {
  }

  /**
   * Customer records: NRIC, email, gender and nationality checks, phone
   * standardization, postal code extracted from the address.
   */
  public static TableConfig customerCleansing() {
    return customerCleansing("customers");
  }

  public static TableConfig customerCleansing(String tableName) {
    return TableConfig.builder(tableName)
        .transform("nric", TransformerRegistry.STANDARDIZE_NRIC)
        .validate("nric", ValidatorRegistry.VALIDATE_SINGAPORE_NRIC)
        .validate("email", ValidatorRegistry.VALIDATE_EMAIL)
        .transform("gender", TransformerRegistry.NORMALIZE_GENDER)
        .validate("gender", ValidatorRegistry.VALIDATE_GENDER)
        .transform("country", TransformerRegistry.NORMALIZE_NATIONALITY_CODE)
        .validate("country", ValidatorRegistry.VALIDATE_NATIONALITY_CODE)
        .transform("phone", TransformerRegistry.STANDARDIZE_PHONE_NUMBER)
        .uppercase("full_name", "nric", "gender", "country")
        .fillNull("email", "phone", "address")
        .derive(
            DerivedField.builder("postal_code", "address")
                .transformer(TransformerRegistry.EXTRACT_POSTAL_CODE)
                .transformer(TransformerRegistry.STANDARDIZE_SINGAPORE_POSTAL_CODE)
                .validator(ValidatorRegistry.VALIDATE_SINGAPORE_POSTAL_CODE)
                .validityColumn("is_valid_postal_code")
                .build())
        .processedTimestampColumn("silver_processed_ts")
        .build();
  }

  /**
   * Transactions: currency normalization and validation.
   */
  public static TableConfig transactionCleansing(String tableName) {
    return TableConfig.builder(tableName)
        .transform("currency", TransformerRegistry.NORMALIZE_CURRENCY_CODE)
        .validate("currency", ValidatorRegistry.VALIDATE_CURRENCY_CODE)
        .validate("transaction_id", ValidatorRegistry.NOT_NULL)
        .processedTimestampColumn("silver_processed_ts")
        .build();
  }
}
