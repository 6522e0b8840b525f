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
package org.apache.calcite.adapter.governance.schema;

import org.apache.calcite.adapter.governance.scd.SequenceValues;
import org.apache.calcite.adapter.governance.util.Values;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declared SQL types and the conversion of record values to Calcite's
 * internal representation (TIMESTAMP as epoch millis, DATE as epoch days).
 */
final class SqlValues {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqlValues.class);

  private static final Pattern TYPE =
      Pattern.compile("^([A-Z][A-Z ]*?)\\s*(?:\\(\\s*(\\d+)\\s*(?:,\\s*(\\d+)\\s*)?\\))?$");

  private static final Map<String, SqlTypeName> ALIASES = ImmutableMap.<String, SqlTypeName>builder()
      .put("INT", SqlTypeName.INTEGER)
      .put("STRING", SqlTypeName.VARCHAR)
      .put("TEXT", SqlTypeName.VARCHAR)
      .put("NUMERIC", SqlTypeName.DECIMAL)
      .put("BOOL", SqlTypeName.BOOLEAN)
      .put("LONG", SqlTypeName.BIGINT)
      .build();

  private SqlValues() {
  }

  /**
   * A parsed declared type such as {@code DECIMAL(15,2)}.
   */
  static final class ColumnType {
    final SqlTypeName typeName;
    final int precision;
    final int scale;

    ColumnType(SqlTypeName typeName, int precision, int scale) {
      this.typeName = typeName;
      this.precision = precision;
      this.scale = scale;
    }

    RelDataType toRelDataType(RelDataTypeFactory typeFactory) {
      RelDataType type;
      if (precision >= 0 && scale >= 0 && typeName.allowsPrecScale(true, true)) {
        type = typeFactory.createSqlType(typeName, precision, scale);
      } else if (precision >= 0 && typeName.allowsPrecNoScale()) {
        type = typeFactory.createSqlType(typeName, precision);
      } else {
        type = typeFactory.createSqlType(typeName);
      }
      return typeFactory.createTypeWithNullability(type, true);
    }

    @Override public String toString() {
      return precision < 0 ? typeName.getName()
          : typeName.getName() + "(" + precision + (scale < 0 ? "" : "," + scale) + ")";
    }
  }

  static final ColumnType VARCHAR = new ColumnType(SqlTypeName.VARCHAR, -1, -1);
  static final ColumnType INTEGER = new ColumnType(SqlTypeName.INTEGER, -1, -1);
  static final ColumnType TIMESTAMP = new ColumnType(SqlTypeName.TIMESTAMP, -1, -1);

  /**
   * Parses a declared type.
   *
   * @throws IllegalArgumentException for an unknown or unsupported type
   */
  static ColumnType parseType(String declared) {
    Matcher matcher = TYPE.matcher(declared.trim().toUpperCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Cannot parse SQL type '" + declared + "'");
    }
    String name = matcher.group(1).trim();
    SqlTypeName typeName = ALIASES.get(name);
    if (typeName == null) {
      typeName = SqlTypeName.get(name);
    }
    if (typeName == null) {
      throw new IllegalArgumentException("Unknown SQL type '" + declared + "'");
    }
    switch (typeName) {
    case VARCHAR:
    case CHAR:
    case BOOLEAN:
    case TINYINT:
    case SMALLINT:
    case INTEGER:
    case BIGINT:
    case REAL:
    case FLOAT:
    case DOUBLE:
    case DECIMAL:
    case DATE:
    case TIMESTAMP:
      break;
    default:
      throw new IllegalArgumentException("Unsupported SQL type '" + declared + "'");
    }
    int precision = matcher.group(2) == null ? -1 : Integer.parseInt(matcher.group(2));
    int scale = matcher.group(3) == null ? -1 : Integer.parseInt(matcher.group(3));
    return new ColumnType(typeName, precision, scale);
  }

  /**
   * Converts a record value to the internal representation of a type.
   * Values that cannot be converted become null.
   */
  static @Nullable Object toInternal(@Nullable Object value, SqlTypeName type) {
    if (value == null) {
      return null;
    }
    switch (type) {
    case VARCHAR:
    case CHAR:
      return value.toString();
    case BOOLEAN:
      if (value instanceof Boolean) {
        return value;
      }
      String text = value.toString().trim();
      if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
        return Boolean.valueOf(text);
      }
      return unconvertible(value, type);
    case TINYINT:
    case SMALLINT:
    case INTEGER:
    case BIGINT:
    case REAL:
    case FLOAT:
    case DOUBLE:
    case DECIMAL:
      BigDecimal number = toBigDecimal(value);
      if (number == null) {
        return unconvertible(value, type);
      }
      return toNumber(number, type);
    case TIMESTAMP:
      try {
        return SequenceValues.toInstant(value).toEpochMilli();
      } catch (IllegalArgumentException e) {
        return unconvertible(value, type);
      }
    case DATE:
      if (value instanceof LocalDate) {
        return (int) ((LocalDate) value).toEpochDay();
      }
      try {
        Instant instant = SequenceValues.toInstant(value);
        return (int) instant.atOffset(ZoneOffset.UTC).toLocalDate().toEpochDay();
      } catch (IllegalArgumentException e) {
        return unconvertible(value, type);
      }
    default:
      return value.toString();
    }
  }

  private static Object toNumber(BigDecimal number, SqlTypeName type) {
    switch (type) {
    case TINYINT:
      return number.byteValue();
    case SMALLINT:
      return number.shortValue();
    case INTEGER:
      return number.intValue();
    case BIGINT:
      return number.longValue();
    case REAL:
      return number.floatValue();
    case FLOAT:
    case DOUBLE:
      return number.doubleValue();
    default:
      return number;
    }
  }

  private static @Nullable BigDecimal toBigDecimal(Object value) {
    if (value instanceof Number) {
      return Values.toBigDecimal((Number) value);
    }
    if (value instanceof Boolean) {
      return null;
    }
    try {
      return new BigDecimal(value.toString().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static @Nullable Object unconvertible(Object value, SqlTypeName type) {
    LOGGER.debug("Value '{}' cannot be read as {}, returning null", value, type);
    return null;
  }
}
