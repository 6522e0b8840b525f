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

import org.apache.calcite.adapter.governance.quality.TransformerRegistry;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Registry of {@link MaskingFunction}s.
 *
 * <p>Built-ins, partial form / full form:
 * <ul>
 *   <li>{@code mask_email}: {@code j***@example.com} / {@code ***@***}</li>
 *   <li>{@code mask_phone}: first four, {@code " ****"}, last four /
 *       {@code ***}</li>
 *   <li>{@code mask_nric}: first character, {@code ****}, last three /
 *       {@code ***}</li>
 *   <li>{@code mask_address}: {@code *** Singapore 123456} / {@code ***}</li>
 *   <li>{@code mask_ssn}: {@code ***-**-6789} / {@code ***}</li>
 *   <li>{@code redact}: {@code ***} / {@code ***}</li>
 * </ul>
 */
public class MaskingFunctions {
  public static final String MASK_EMAIL = "mask_email";
  public static final String MASK_PHONE = "mask_phone";
  public static final String MASK_NRIC = "mask_nric";
  public static final String MASK_ADDRESS = "mask_address";
  public static final String MASK_SSN = "mask_ssn";
  public static final String REDACT = "redact";

  static final String STARS = "***";

  private final Map<String, MaskingFunction> functions = new LinkedHashMap<>();

  public MaskingFunctions() {
  }

  public static MaskingFunctions defaults() {
    MaskingFunctions registry = new MaskingFunctions();
    registry.register(new SimpleMask(MASK_EMAIL, "***@***", MaskingFunctions::maskEmail));
    registry.register(new SimpleMask(MASK_PHONE, STARS, (s, aux) ->
        s.length() < 8 ? null : s.substring(0, 4) + " ****" + s.substring(s.length() - 4)));
    registry.register(new SimpleMask(MASK_NRIC, STARS, (s, aux) ->
        s.length() < 4 ? null : s.charAt(0) + "****" + s.substring(s.length() - 3)));
    registry.register(new SimpleMask(MASK_ADDRESS, STARS, MaskingFunctions::maskAddress));
    registry.register(new SimpleMask(MASK_SSN, STARS, (s, aux) ->
        s.length() < 4 ? null : "***-**-" + s.substring(s.length() - 4)));
    registry.register(new SimpleMask(REDACT, STARS, (s, aux) -> STARS));
    return registry;
  }

  public synchronized MaskingFunctions register(MaskingFunction function) {
    functions.put(function.getName(), function);
    return this;
  }

  /**
   * Looks up a function.
   *
   * @throws IllegalArgumentException if no function has that name
   */
  public synchronized MaskingFunction get(String name) {
    MaskingFunction function = functions.get(name);
    if (function == null) {
      throw new IllegalArgumentException("Unknown masking function: '" + name
          + "'. Known functions: " + functions.keySet());
    }
    return function;
  }

  public synchronized boolean contains(String name) {
    return functions.containsKey(name);
  }

  public synchronized Set<String> names() {
    return new LinkedHashSet<>(functions.keySet());
  }

  private static @Nullable String maskEmail(String email, List<@Nullable Object> aux) {
    int at = email.indexOf('@');
    if (at <= 0 || at == email.length() - 1) {
      return null;
    }
    String domain = email.substring(at + 1);
    int next = domain.indexOf('@');
    if (next >= 0) {
      domain = domain.substring(0, next);
    }
    return email.charAt(0) + "***@" + domain;
  }

  private static @Nullable String maskAddress(String address, List<@Nullable Object> aux) {
    String postalCode = null;
    for (Object value : aux) {
      if (value != null && !value.toString().trim().isEmpty()) {
        postalCode = value.toString().trim();
        break;
      }
    }
    if (postalCode == null) {
      postalCode = TransformerRegistry.extractPostalCode(address);
    }
    return postalCode == null ? null : "*** Singapore " + postalCode;
  }

  /**
   * Masking function over string values; non-string or null input is
   * malformed for the partial form.
   */
  static final class SimpleMask implements MaskingFunction {
    private final String name;
    private final String fullMask;
    private final BiFunction<String, List<@Nullable Object>, @Nullable String> partial;

    SimpleMask(String name, String fullMask,
        BiFunction<String, List<@Nullable Object>, @Nullable String> partial) {
      this.name = name;
      this.fullMask = fullMask;
      this.partial = partial;
    }

    @Override public String getName() {
      return name;
    }

    @Override public @Nullable String partial(@Nullable Object value,
        List<@Nullable Object> auxiliaryValues) {
      if (!(value instanceof CharSequence)) {
        return null;
      }
      return partial.apply(value.toString(), auxiliaryValues);
    }

    @Override public String full(@Nullable Object value) {
      return fullMask;
    }
  }
}
