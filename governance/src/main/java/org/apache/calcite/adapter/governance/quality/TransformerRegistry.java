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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named registry of {@link FieldTransformer}s.
 *
 * <p>Every built-in transformer is idempotent and null-preserving, and
 * returns non-string input unchanged.
 */
public class TransformerRegistry {
  public static final String IDENTITY = "identity";
  public static final String NONE = "none";
  public static final String TRIM = "trim";
  public static final String UPPERCASE_TRIM = "uppercase_trim";
  public static final String LOWERCASE_TRIM = "lowercase_trim";
  public static final String STANDARDIZE_NRIC = "standardize_nric";
  public static final String NORMALIZE_NAME = "normalize_name";
  public static final String NORMALIZE_GENDER = "normalize_gender";
  public static final String NORMALIZE_NATIONALITY_CODE = "normalize_nationality_code";
  public static final String NORMALIZE_CURRENCY_CODE = "normalize_currency_code";
  public static final String STANDARDIZE_PHONE_NUMBER = "standardize_phone_number";
  public static final String STANDARDIZE_SINGAPORE_POSTAL_CODE =
      "standardize_singapore_postal_code";
  public static final String EXTRACT_POSTAL_CODE = "extract_postal_code";

  private static final Map<String, String> GENDERS = ImmutableMap.<String, String>builder()
      .put("M", "M").put("MALE", "M")
      .put("F", "F").put("FEMALE", "F")
      .put("X", "X")
      .build();

  private static final Map<String, String> NATIONALITIES = ImmutableMap.<String, String>builder()
      .put("USA", "US").put("US", "US")
      .put("UK", "GB").put("GB", "GB")
      .put("SG", "SG").put("SINGAPORE", "SG")
      .put("CN", "CN").put("CHINA", "CN")
      .put("TW", "TW").put("TAIWAN", "TW")
      .put("FR", "FR").put("FRANCE", "FR")
      .put("DK", "DK").put("DENMARK", "DK")
      .build();

  private static final Map<String, String> CURRENCIES = ImmutableMap.<String, String>builder()
      .put("USD", "USD")
      .put("RMB", "CNY").put("CNY", "CNY")
      .put("YEN", "JPY").put("JPY", "JPY")
      .put("SGD", "SGD")
      .build();

  private static final Pattern NOT_PHONE_CHARS = Pattern.compile("[^0-9+]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DIGITS = Pattern.compile("^\\d{1,6}$");
  private static final Pattern SIX_DIGIT_GROUP = Pattern.compile("(?<!\\d)(\\d{6})(?!\\d)");

  private final Map<String, FieldTransformer> transformers = new LinkedHashMap<>();

  public TransformerRegistry() {
  }

  /**
   * Creates a registry populated with the built-in transformers.
   */
  public static TransformerRegistry defaults() {
    TransformerRegistry registry = new TransformerRegistry();
    FieldTransformer identity = value -> value;
    FieldTransformer upper = strings(s -> s.trim().toUpperCase(Locale.ROOT));
    registry.register(IDENTITY, identity);
    registry.register(NONE, identity);
    registry.register(TRIM, strings(String::trim));
    registry.register(UPPERCASE_TRIM, upper);
    registry.register(STANDARDIZE_NRIC, upper);
    registry.register(NORMALIZE_NAME, upper);
    registry.register(LOWERCASE_TRIM, strings(s -> s.trim().toLowerCase(Locale.ROOT)));
    registry.register(NORMALIZE_GENDER, strings(s -> lookup(GENDERS, s)));
    registry.register(NORMALIZE_NATIONALITY_CODE, strings(s -> lookup(NATIONALITIES, s)));
    registry.register(NORMALIZE_CURRENCY_CODE, strings(s -> lookup(CURRENCIES, s)));
    registry.register(STANDARDIZE_PHONE_NUMBER,
        strings(TransformerRegistry::standardizePhoneNumber));
    registry.register(STANDARDIZE_SINGAPORE_POSTAL_CODE,
        strings(TransformerRegistry::standardizePostalCode));
    registry.register(EXTRACT_POSTAL_CODE, value -> extractPostalCode(value));
    return registry;
  }

  /**
   * Registers a transformer, replacing any existing one with the same name.
   *
   * @return this registry
   */
  public synchronized TransformerRegistry register(String name, FieldTransformer transformer) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Transformer name must not be empty");
    }
    if (transformer == null) {
      throw new IllegalArgumentException("Transformer '" + name + "' must not be null");
    }
    transformers.put(name, transformer);
    return this;
  }

  /**
   * Looks up a transformer.
   *
   * @throws IllegalArgumentException if no transformer has that name
   */
  public synchronized FieldTransformer get(String name) {
    FieldTransformer transformer = transformers.get(name);
    if (transformer == null) {
      throw new IllegalArgumentException("Unknown transformer: '" + name
          + "'. Known transformers: " + transformers.keySet());
    }
    return transformer;
  }

  public synchronized boolean contains(String name) {
    return transformers.containsKey(name);
  }

  public synchronized Set<String> names() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(transformers.keySet()));
  }

  /**
   * Standardizes a Singapore phone number to the {@code +65} form.
   *
   * <p>Everything except digits and {@code +} is removed first. A leading
   * {@code 65} is read as the country code only when more than eight digits
   * follow the strip, since local eight-digit numbers may themselves start
   * with {@code 65}. Numbers that match none of the known shapes are returned
   * stripped.
   */
  public static String standardizePhoneNumber(String phone) {
    String cleaned = NOT_PHONE_CHARS.matcher(phone).replaceAll("");
    if (cleaned.startsWith("+")) {
      return cleaned;
    }
    if (cleaned.startsWith("65") && cleaned.length() > 8) {
      return "+" + cleaned;
    }
    if (cleaned.startsWith("0")) {
      return "+65" + cleaned.substring(1);
    }
    if (cleaned.length() == 8) {
      return "+65" + cleaned;
    }
    return cleaned;
  }

  /** Removes whitespace and left-pads short all-digit codes to six digits. */
  public static String standardizePostalCode(String postalCode) {
    String cleaned = WHITESPACE.matcher(postalCode).replaceAll("");
    if (DIGITS.matcher(cleaned).matches()) {
      StringBuilder padded = new StringBuilder();
      for (int i = cleaned.length(); i < 6; i++) {
        padded.append('0');
      }
      return padded.append(cleaned).toString();
    }
    return cleaned;
  }

  /** Returns the first standalone six-digit group of an address, or null. */
  public static @Nullable String extractPostalCode(@Nullable Object address) {
    if (!(address instanceof CharSequence)) {
      return null;
    }
    Matcher matcher = SIX_DIGIT_GROUP.matcher((CharSequence) address);
    return matcher.find() ? matcher.group(1) : null;
  }

  private static String lookup(Map<String, String> canonical, String value) {
    String key = value.trim().toUpperCase(Locale.ROOT);
    String mapped = canonical.get(key);
    return mapped != null ? mapped : key;
  }

  private static FieldTransformer strings(Function<String, @Nullable Object> fn) {
    return value -> value instanceof String ? fn.apply((String) value) : value;
  }
}
