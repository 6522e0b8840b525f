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
package org.apache.calcite.adapter.governance.access;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * {@link AccessGrantStore} reading an external grant table over JDBC.
 *
 * <p>The table has the columns {@code user_email, user_group, access_level,
 * granted_by, granted_at, expires_at, is_active, reason,
 * approval_ticket_id}. Every lookup opens a connection and reads the user's
 * grants afresh, so changes made by the approval workflow apply to the next
 * read.
 */
public class JdbcAccessGrantStore implements AccessGrantStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcAccessGrantStore.class);

  private static final String DDL_RESOURCE =
      "org/apache/calcite/adapter/governance/access/access_grants.sql";
  private static final Pattern TABLE_NAME =
      Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");
  private static final String COLUMNS = "user_email, user_group, access_level, granted_by, "
      + "granted_at, expires_at, is_active, reason, approval_ticket_id";

  private final String jdbcUrl;
  private final Properties info;
  private final String tableName;

  public JdbcAccessGrantStore(String jdbcUrl, String tableName) {
    this(jdbcUrl, new Properties(), tableName);
  }

  /**
   * Creates a store.
   *
   * @param jdbcUrl JDBC URL of the database holding the grant table
   * @param info Connection properties (user, password, ...)
   * @param tableName Grant table, optionally schema-qualified
   * @throws IllegalArgumentException if the table name is not a plain
   *     identifier
   */
  public JdbcAccessGrantStore(String jdbcUrl, Properties info, String tableName) {
    if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid grant table name: '" + tableName + "'");
    }
    this.jdbcUrl = jdbcUrl;
    this.info = info;
    this.tableName = tableName;
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * Creates the grant table if it does not exist.
   */
  public void createTable() throws SQLException {
    String ddl = loadDdl().replace("${table}", tableName);
    try (Connection connection = connect();
         Statement statement = connection.createStatement()) {
      statement.execute(ddl);
    }
    LOGGER.info("Ensured grant table {} exists", tableName);
  }

  /**
   * Inserts a grant.
   */
  public void insert(AccessGrant grant) throws SQLException {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS
        + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, grant.getUserId());
      statement.setString(2, grant.getUserGroup());
      statement.setString(3, grant.getAccessLevel().getWireName());
      statement.setString(4, grant.getGrantedBy());
      statement.setTimestamp(5, Timestamp.from(grant.getGrantedAt()));
      if (grant.getExpiresAt() != null) {
        statement.setTimestamp(6, Timestamp.from(grant.getExpiresAt()));
      } else {
        statement.setNull(6, Types.TIMESTAMP);
      }
      statement.setBoolean(7, grant.isActive());
      statement.setString(8, grant.getReason());
      statement.setString(9, grant.getApprovalTicketId());
      statement.executeUpdate();
    }
    LOGGER.info("Granted {} to {} in {}", grant.getAccessLevel(), grant.getUserId(), tableName);
  }

  /**
   * Marks every active grant of a user inactive.
   *
   * @return number of grants deactivated
   */
  public int deactivate(String userId) throws SQLException {
    String sql = "UPDATE " + tableName
        + " SET is_active = FALSE WHERE user_email = ? AND is_active = TRUE";
    int count;
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, userId);
      count = statement.executeUpdate();
    }
    LOGGER.info("Deactivated {} grant(s) of {} in {}", count, userId, tableName);
    return count;
  }

  /**
   * Reads every grant of a user, active or not.
   */
  public List<AccessGrant> grantsOf(String userId) throws SQLException {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE user_email = ?";
    List<AccessGrant> grants = new ArrayList<>();
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, userId);
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          grants.add(toGrant(rs));
        }
      }
    }
    return grants;
  }

  @Override public @Nullable AccessGrant effectiveGrant(String userId, Instant at) {
    try {
      AccessGrant grant = EffectiveGrants.select(grantsOf(userId), at);
      LOGGER.debug("Effective grant of {} at {}: {}", userId, at, grant);
      return grant;
    } catch (SQLException e) {
      throw new AccessGrantLookupException("Failed to read grants of '" + userId + "' from "
          + tableName, e);
    }
  }

  private static AccessGrant toGrant(ResultSet rs) throws SQLException {
    Timestamp grantedAt = rs.getTimestamp("granted_at");
    Timestamp expiresAt = rs.getTimestamp("expires_at");
    return AccessGrant.builder(rs.getString("user_email"),
            AccessLevel.fromWireName(rs.getString("access_level")))
        .userGroup(rs.getString("user_group"))
        .grantedBy(rs.getString("granted_by"))
        .grantedAt(grantedAt != null ? grantedAt.toInstant() : Instant.EPOCH)
        .expiresAt(expiresAt != null ? expiresAt.toInstant() : null)
        .active(rs.getBoolean("is_active"))
        .reason(rs.getString("reason"))
        .approvalTicketId(rs.getString("approval_ticket_id"))
        .build();
  }

  private Connection connect() throws SQLException {
    return DriverManager.getConnection(jdbcUrl, info);
  }

  private String loadDdl() throws SQLException {
    try (InputStream is = getClass().getClassLoader().getResourceAsStream(DDL_RESOURCE)) {
      if (is == null) {
        throw new SQLException("SQL resource not found: " + DDL_RESOURCE);
      }
      StringBuilder sb = new StringBuilder();
      try (BufferedReader reader =
               new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (!line.trim().startsWith("--")) {
            sb.append(line).append('\n');
          }
        }
      }
      return sb.toString().trim();
    } catch (IOException e) {
      throw new SQLException("Failed to load SQL resource: " + DDL_RESOURCE, e);
    }
  }

  @Override public String toString() {
    return "JdbcAccessGrantStore{" + tableName + "}";
  }
}
