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
package org.apache.calcite.adapter.governance.scd;

import org.apache.calcite.adapter.governance.util.Values;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Normalizes sequence column values to {@link Instant}.
 *
 * <p>Accepted: {@code Instant}, {@code java.util.Date} (including
 * {@code java.sql.Timestamp}), {@code OffsetDateTime}, {@code ZonedDateTime},
 * {@code LocalDateTime} (read as UTC), {@code LocalDate} (start of day UTC),
 * numbers (epoch milliseconds; a fraction is kept down to the nanosecond)
 * and ISO-8601 strings in any of those forms;
 * a space may separate date and time.
 */
public final class SequenceValues {
  private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

  private SequenceValues() {
  }

  /**
   * Converts a value.
   *
   * @throws IllegalArgumentException if the value is null or of an
   *     unsupported type or format
   */
  public static Instant toInstant(@Nullable Object value) {
    if (value == null) {
      throw new IllegalArgumentException("sequence value is null");
    }
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (value instanceof Date) {
      return Instant.ofEpochMilli(((Date) value).getTime());
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (value instanceof Number) {
      return fromEpochMillis((Number) value);
    }
    if (value instanceof CharSequence) {
      return parse(value.toString().trim());
    }
    throw new IllegalArgumentException("unsupported sequence type "
        + value.getClass().getName());
  }

  private static Instant fromEpochMillis(Number number) {
    BigDecimal millis = Values.toBigDecimal(number);
    if (millis == null) {
      throw new IllegalArgumentException("sequence value " + number + " is not finite");
    }
    BigDecimal nanos = millis.movePointRight(6).stripTrailingZeros();
    if (nanos.scale() > 0) {
      throw new IllegalArgumentException("sequence value " + number
          + " is finer than a nanosecond");
    }
    BigInteger[] secondsAndNanos = nanos.toBigIntegerExact().divideAndRemainder(NANOS_PER_SECOND);
    if (secondsAndNanos[0].bitLength() >= 64) {
      throw new IllegalArgumentException("sequence value " + number + " is out of range");
    }
    try {
      return Instant.ofEpochSecond(secondsAndNanos[0].longValue(),
          secondsAndNanos[1].longValue());
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("sequence value " + number + " is out of range", e);
    }
  }

  private static Instant parse(String text) {
    if (text.isEmpty()) {
      throw new IllegalArgumentException("sequence value is empty");
    }
    String iso = text.length() > 10 && text.charAt(10) == ' '
        ? text.substring(0, 10) + 'T' + text.substring(11)
        : text;
    try {
      if (iso.length() == 10) {
        return LocalDate.parse(iso).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso,
          ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime) {
        return ((ZonedDateTime) parsed).toInstant();
      }
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("unparsable sequence value '" + text + "'", e);
    }
  }
}
