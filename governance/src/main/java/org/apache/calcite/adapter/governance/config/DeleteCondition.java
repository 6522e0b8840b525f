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

import org.apache.calcite.adapter.governance.util.Values;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Delete signal written as a simple condition over one column.
 *
 * <p>Supported forms: {@code column = 'text'}, {@code column = 42},
 * {@code column = true} and {@code column IS TRUE}. A null column value
 * never matches.
 */
public final class DeleteCondition implements Predicate<Map<String, Object>> {
  private static final Pattern EQUALS =
      Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+?)\\s*$");
  private static final Pattern IS_TRUE =
      Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\s+IS\\s+TRUE\\s*$", Pattern.CASE_INSENSITIVE);

  private final String expression;
  private final String column;
  private final String expected;
  private final boolean quoted;

  private DeleteCondition(String expression, String column, String expected, boolean quoted) {
    this.expression = expression;
    this.column = column;
    this.expected = expected;
    this.quoted = quoted;
  }

  /**
   * Parses a condition.
   *
   * @throws IllegalArgumentException if the expression has none of the
   *     supported forms
   */
  public static DeleteCondition parse(String expression) {
    if (expression == null) {
      throw new IllegalArgumentException("Delete condition must not be null");
    }
    Matcher isTrue = IS_TRUE.matcher(expression);
    if (isTrue.matches()) {
      return new DeleteCondition(expression, isTrue.group(1), "true", false);
    }
    Matcher equals = EQUALS.matcher(expression);
    if (equals.matches()) {
      String literal = equals.group(2);
      if (literal.length() >= 2
          && (literal.startsWith("'") && literal.endsWith("'")
              || literal.startsWith("\"") && literal.endsWith("\""))) {
        return new DeleteCondition(expression, equals.group(1),
            literal.substring(1, literal.length() - 1), true);
      }
      return new DeleteCondition(expression, equals.group(1), literal, false);
    }
    throw new IllegalArgumentException("Unsupported delete condition: '" + expression
        + "'. Expected \"column = value\" or \"column IS TRUE\"");
  }

  public String getColumn() {
    return column;
  }

  @Override public boolean test(Map<String, Object> row) {
    Object value = row.get(column);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean) {
      String lower = expected.toLowerCase(Locale.ROOT);
      return ("true".equals(lower) || "false".equals(lower))
          && (Boolean) value == Boolean.parseBoolean(lower);
    }
    if (value instanceof Number && !quoted) {
      BigDecimal literal = parseNumber(expected);
      return literal != null && Values.equal(value, literal);
    }
    return expected.equals(value.toString());
  }

  private static @Nullable BigDecimal parseNumber(String text) {
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Override public String toString() {
    return expression;
  }
}
