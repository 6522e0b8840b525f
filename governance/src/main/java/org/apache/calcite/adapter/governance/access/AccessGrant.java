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

import java.time.Instant;
import java.util.Objects;

/**
 * A row of the access grant table: which access level a user holds, who
 * granted it, when, and until when.
 */
public final class AccessGrant {
  private final String userId;
  private final @Nullable String userGroup;
  private final AccessLevel accessLevel;
  private final @Nullable String grantedBy;
  private final Instant grantedAt;
  private final @Nullable Instant expiresAt;
  private final boolean active;
  private final @Nullable String reason;
  private final @Nullable String approvalTicketId;

  private AccessGrant(Builder builder) {
    this.userId = builder.userId;
    this.userGroup = builder.userGroup;
    this.accessLevel = builder.accessLevel;
    this.grantedBy = builder.grantedBy;
    this.grantedAt = builder.grantedAt;
    this.expiresAt = builder.expiresAt;
    this.active = builder.active;
    this.reason = builder.reason;
    this.approvalTicketId = builder.approvalTicketId;
  }

  /** User identity; stored in the {@code user_email} column. */
  public String getUserId() {
    return userId;
  }

  public @Nullable String getUserGroup() {
    return userGroup;
  }

  public AccessLevel getAccessLevel() {
    return accessLevel;
  }

  public @Nullable String getGrantedBy() {
    return grantedBy;
  }

  public Instant getGrantedAt() {
    return grantedAt;
  }

  public @Nullable Instant getExpiresAt() {
    return expiresAt;
  }

  public boolean isActive() {
    return active;
  }

  public @Nullable String getReason() {
    return reason;
  }

  public @Nullable String getApprovalTicketId() {
    return approvalTicketId;
  }

  /** Active and not expired at the given instant. */
  public boolean isEffectiveAt(Instant at) {
    return active && (expiresAt == null || expiresAt.isAfter(at));
  }

  /** Copy with a different active flag. */
  public AccessGrant withActive(boolean active) {
    return toBuilder().active(active).build();
  }

  public Builder toBuilder() {
    return builder(userId, accessLevel)
        .userGroup(userGroup)
        .grantedBy(grantedBy)
        .grantedAt(grantedAt)
        .expiresAt(expiresAt)
        .active(active)
        .reason(reason)
        .approvalTicketId(approvalTicketId);
  }

  public static Builder builder(String userId, AccessLevel accessLevel) {
    return new Builder(userId, accessLevel);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AccessGrant)) {
      return false;
    }
    AccessGrant that = (AccessGrant) o;
    return active == that.active
        && userId.equals(that.userId)
        && accessLevel == that.accessLevel
        && grantedAt.equals(that.grantedAt)
        && Objects.equals(expiresAt, that.expiresAt)
        && Objects.equals(userGroup, that.userGroup)
        && Objects.equals(grantedBy, that.grantedBy)
        && Objects.equals(reason, that.reason)
        && Objects.equals(approvalTicketId, that.approvalTicketId);
  }

  @Override public int hashCode() {
    return Objects.hash(userId, accessLevel, grantedAt, expiresAt, active);
  }

  @Override public String toString() {
    return "AccessGrant{" + userId + ", " + accessLevel + ", grantedAt=" + grantedAt
        + (expiresAt != null ? ", expiresAt=" + expiresAt : "")
        + (active ? "" : ", inactive") + "}";
  }

  /**
   * Builder for AccessGrant.
   */
  public static final class Builder {
    private final String userId;
    private final AccessLevel accessLevel;
    private String userGroup;
    private String grantedBy;
    private Instant grantedAt;
    private Instant expiresAt;
    private boolean active = true;
    private String reason;
    private String approvalTicketId;

    private Builder(String userId, AccessLevel accessLevel) {
      this.userId = userId;
      this.accessLevel = accessLevel;
    }

    public Builder userGroup(@Nullable String userGroup) {
      this.userGroup = userGroup;
      return this;
    }

    public Builder grantedBy(@Nullable String grantedBy) {
      this.grantedBy = grantedBy;
      return this;
    }

    public Builder grantedAt(Instant grantedAt) {
      this.grantedAt = grantedAt;
      return this;
    }

    public Builder expiresAt(@Nullable Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public Builder reason(@Nullable String reason) {
      this.reason = reason;
      return this;
    }

    public Builder approvalTicketId(@Nullable String approvalTicketId) {
      this.approvalTicketId = approvalTicketId;
      return this;
    }

    public AccessGrant build() {
      if (userId == null || userId.isEmpty()) {
        throw new IllegalArgumentException("Grant user is required");
      }
      if (accessLevel == null) {
        throw new IllegalArgumentException("Grant for '" + userId + "' needs an access level");
      }
      if (grantedAt == null) {
        throw new IllegalArgumentException("Grant for '" + userId + "' needs granted_at");
      }
      return new AccessGrant(this);
    }
  }
}
