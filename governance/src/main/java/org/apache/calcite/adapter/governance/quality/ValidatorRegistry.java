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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Named registry of {@link FieldValidator}s.
 *
 * <p>{@link #defaults()} returns a registry holding the built-in validators:
 * <ul>
 *   <li>{@code validate_email} - null fails; case-insensitive</li>
 *   <li>{@code validate_singapore_nric} - null passes; format and checksum;
 *       case-sensitive, expects the upper-case form</li>
 *   <li>{@code validate_nric_9char} - null passes; nine upper-case
 *       alphanumerics</li>
 *   <li>{@code validate_singapore_postal_code} - null passes; six digits
 *       once whitespace is removed</li>
 *   <li>{@code validate_gender} - null passes; M, F or X, any case</li>
 *   <li>{@code validate_nationality_code} - null passes; any case</li>
 *   <li>{@code validate_currency_code} - null passes; any case</li>
 *   <li>{@code not_null} - only null fails</li>
 * </ul>
 *
 * <p>Registration is expected to happen before the registry is shared with
 * cleansing workers; lookups are safe from any thread once populated.
 */
public class ValidatorRegistry {
  public static final String VALIDATE_EMAIL = "validate_email";
  public static final String VALIDATE_SINGAPORE_NRIC = "validate_singapore_nric";
  public static final String VALIDATE_NRIC_9CHAR = "validate_nric_9char";
  public static final String VALIDATE_SINGAPORE_POSTAL_CODE = "validate_singapore_postal_code";
  public static final String VALIDATE_GENDER = "validate_gender";
  public static final String VALIDATE_NATIONALITY_CODE = "validate_nationality_code";
  public static final String VALIDATE_CURRENCY_CODE = "validate_currency_code";
  public static final String NOT_NULL = "not_null";

  private static final Pattern EMAIL =
      Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
  private static final Pattern NRIC = Pattern.compile("^[STFGM]\\d{7}[A-Z]$");
  private static final Pattern NRIC_9CHAR = Pattern.compile("^[A-Z0-9]{9}$");
  private static final Pattern POSTAL_CODE = Pattern.compile("^\\d{6}$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final int[] NRIC_WEIGHTS = {2, 7, 6, 5, 4, 3, 2};
  private static final String ST_CHECK_LETTERS = "JZIHGFEDCBA";
  private static final String FG_CHECK_LETTERS = "XWUTRQPNMLK";
  private static final String M_CHECK_LETTERS = "XWUTRQPNJLK";

  private static final Set<String> GENDERS = ImmutableSet.of("M", "F", "X");
  private static final Set<String> NATIONALITY_CODES =
      ImmutableSet.of("USA", "US", "UK", "GB", "SG", "CN", "TW", "FR", "DK");
  private static final Set<String> CURRENCY_CODES =
      ImmutableSet.of("USD", "RMB", "YEN", "SGD", "CNY", "JPY");

  private final Map<String, FieldValidator> validators = new LinkedHashMap<>();

  /**
   * Creates an empty registry.
   */
  public ValidatorRegistry() {
  }

  /**
   * Creates a registry populated with the built-in validators.
   */
  public static ValidatorRegistry defaults() {
    ValidatorRegistry registry = new ValidatorRegistry();
    registry.register(VALIDATE_EMAIL, ValidatorRegistry::isValidEmail);
    registry.register(VALIDATE_SINGAPORE_NRIC, ValidatorRegistry::isValidSingaporeNric);
    registry.register(VALIDATE_NRIC_9CHAR,
        value -> value == null || matches(NRIC_9CHAR, value));
    registry.register(VALIDATE_SINGAPORE_POSTAL_CODE, ValidatorRegistry::isValidPostalCode);
    registry.register(VALIDATE_GENDER, value -> isOneOf(GENDERS, value));
    registry.register(VALIDATE_NATIONALITY_CODE, value -> isOneOf(NATIONALITY_CODES, value));
    registry.register(VALIDATE_CURRENCY_CODE, value -> isOneOf(CURRENCY_CODES, value));
    registry.register(NOT_NULL, value -> value != null);
    return registry;
  }

  /**
   * Registers a validator, replacing any existing one with the same name.
   *
   * @return this registry
   */
  public synchronized ValidatorRegistry register(String name, FieldValidator validator) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Validator name must not be empty");
    }
    if (validator == null) {
      throw new IllegalArgumentException("Validator '" + name + "' must not be null");
    }
    validators.put(name, validator);
    return this;
  }

  /**
   * Looks up a validator.
   *
   * @throws IllegalArgumentException if no validator has that name
   */
  public synchronized FieldValidator get(String name) {
    FieldValidator validator = validators.get(name);
    if (validator == null) {
      throw new IllegalArgumentException("Unknown validator: '" + name
          + "'. Known validators: " + validators.keySet());
    }
    return validator;
  }

  public synchronized boolean contains(String name) {
    return validators.containsKey(name);
  }

  public synchronized Set<String> names() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(validators.keySet()));
  }

  /** Null fails; the value must be a string in email form. */
  public static boolean isValidEmail(@Nullable Object value) {
    return value != null && matches(EMAIL, value);
  }

  /**
   * Null passes; otherwise the value must be an upper-case NRIC or FIN whose
   * final letter matches the checksum of its seven digits.
   */
  public static boolean isValidSingaporeNric(@Nullable Object value) {
    if (value == null) {
      return true;
    }
    if (!matches(NRIC, value)) {
      return false;
    }
    String nric = value.toString();
    int sum = 0;
    for (int i = 0; i < NRIC_WEIGHTS.length; i++) {
      sum += (nric.charAt(i + 1) - '0') * NRIC_WEIGHTS[i];
    }
    String checkLetters;
    switch (nric.charAt(0)) {
    case 'S':
      checkLetters = ST_CHECK_LETTERS;
      break;
    case 'T':
      sum += 4;
      checkLetters = ST_CHECK_LETTERS;
      break;
    case 'F':
      checkLetters = FG_CHECK_LETTERS;
      break;
    case 'G':
      sum += 4;
      checkLetters = FG_CHECK_LETTERS;
      break;
    case 'M':
      sum += 3;
      checkLetters = M_CHECK_LETTERS;
      break;
    default:
      return false;
    }
    return nric.charAt(8) == checkLetters.charAt(sum % 11);
  }

  /** Null passes; otherwise six digits once whitespace is removed. */
  public static boolean isValidPostalCode(@Nullable Object value) {
    if (value == null) {
      return true;
    }
    if (!(value instanceof CharSequence)) {
      return false;
    }
    String stripped = WHITESPACE.matcher(value.toString()).replaceAll("");
    return POSTAL_CODE.matcher(stripped).matches();
  }

  private static boolean matches(Pattern pattern, Object value) {
    return value instanceof CharSequence && pattern.matcher((CharSequence) value).matches();
  }

  private static boolean isOneOf(Set<String> allowed, @Nullable Object value) {
    if (value == null) {
      return true;
    }
    return value instanceof CharSequence
        && allowed.contains(value.toString().toUpperCase(Locale.ROOT));
  }
}
