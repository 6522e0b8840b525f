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
package org.apache.calcite.adapter.governance.util;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Value comparisons that treat numbers of different boxed types as equal
 * when they hold the same numeric value.
 */
public final class Values {
  private Values() {
  }

  /**
   * Returns whether two values are equal; {@code 1}, {@code 1L} and
   * {@code new BigDecimal("1.00")} are all equal to each other.
   */
  public static boolean equal(@Nullable Object a, @Nullable Object b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    if (a instanceof Number && b instanceof Number) {
      BigDecimal x = toBigDecimal((Number) a);
      BigDecimal y = toBigDecimal((Number) b);
      if (x != null && y != null) {
        return x.compareTo(y) == 0;
      }
    }
    return Objects.equals(a, b);
  }

  /**
   * Normalizes integral numbers to {@link Long} so they can be used as map
   * keys regardless of their boxed type; other values are returned as is.
   */
  public static @Nullable Object normalizeKey(@Nullable Object value) {
    if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger && ((BigInteger) value).bitLength() < 64) {
      return ((BigInteger) value).longValue();
    }
    return value;
  }

  /** Returns null for NaN and infinities, which have no decimal form. */
  public static @Nullable BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (number instanceof BigInteger) {
      return new BigDecimal((BigInteger) number);
    }
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return null;
      }
      return BigDecimal.valueOf(d);
    }
    return BigDecimal.valueOf(number.longValue());
  }
}
