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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link EffectiveGrants}, {@link AccessLevel} and
 * {@link InMemoryAccessGrantStore}.
 */
@Tag("unit")
public class EffectiveGrantsTest {

  private static final Instant JAN = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instant FEB = Instant.parse("2024-02-01T00:00:00Z");
  private static final Instant MAR = Instant.parse("2024-03-01T00:00:00Z");

  private static AccessGrant grant(AccessLevel level, Instant grantedAt) {
    return AccessGrant.builder("ana@company.com", level).grantedAt(grantedAt).build();
  }

  @Test void testLatestGrantWins() {
    AccessGrant older = grant(AccessLevel.FULL_ACCESS, JAN);
    AccessGrant newer = grant(AccessLevel.PARTIAL_ACCESS, FEB);

    assertSame(newer, EffectiveGrants.select(Arrays.asList(older, newer), MAR));
    assertSame(newer, EffectiveGrants.select(Arrays.asList(newer, older), MAR));
  }

  @Test void testInactiveAndExpiredGrantsAreSkipped() {
    AccessGrant inactive = grant(AccessLevel.FULL_ACCESS, FEB).withActive(false);
    AccessGrant expired = grant(AccessLevel.FULL_ACCESS, FEB).toBuilder().expiresAt(MAR).build();
    AccessGrant base = grant(AccessLevel.PARTIAL_ACCESS, JAN);
    List<AccessGrant> grants = Arrays.asList(inactive, expired, base);

    assertSame(expired, EffectiveGrants.select(grants, FEB));
    assertSame(base, EffectiveGrants.select(grants, MAR));
    assertNull(EffectiveGrants.select(Collections.singletonList(inactive), MAR));
  }

  @Test void testExpiryIsExclusive() {
    AccessGrant grant = grant(AccessLevel.FULL_ACCESS, JAN).toBuilder().expiresAt(FEB).build();
    assertEquals(true, grant.isEffectiveAt(FEB.minusSeconds(1)));
    assertEquals(false, grant.isEffectiveAt(FEB));
  }

  @Test void testTieGoesToLeastPrivileged() {
    AccessGrant full = grant(AccessLevel.FULL_ACCESS, JAN);
    AccessGrant masked = grant(AccessLevel.MASKED_ONLY, JAN);
    assertSame(masked, EffectiveGrants.select(Arrays.asList(full, masked), FEB));
    assertSame(masked, EffectiveGrants.select(Arrays.asList(masked, full), FEB));
  }

  @Test void testAccessLevelWireNames() {
    assertEquals(AccessLevel.FULL_ACCESS, AccessLevel.fromWireName("full_access"));
    assertEquals(AccessLevel.PARTIAL_ACCESS, AccessLevel.fromWireName(" PARTIAL_ACCESS "));
    assertEquals(AccessLevel.MASKED_ONLY, AccessLevel.fromWireName("superuser"));
    assertEquals(AccessLevel.MASKED_ONLY, AccessLevel.fromWireName(null));
    assertEquals("masked_only", AccessLevel.MASKED_ONLY.toString());
  }

  @Test void testGrantRequiresGrantedAt() {
    assertThrows(IllegalArgumentException.class,
        () -> AccessGrant.builder("ana@company.com", AccessLevel.FULL_ACCESS).build());
  }

  @Test void testInMemoryStoreDeactivation() {
    InMemoryAccessGrantStore store = new InMemoryAccessGrantStore();
    for (AccessGrant grant : DefaultGrants.at(JAN)) {
      store.grant(grant);
    }

    assertEquals(AccessLevel.FULL_ACCESS,
        store.resolveAccessLevel("governance@company.com", FEB));
    assertEquals(AccessLevel.PARTIAL_ACCESS,
        store.resolveAccessLevel("scientist@company.com", FEB));
    assertEquals(AccessLevel.MASKED_ONLY, store.resolveAccessLevel("analyst@company.com", FEB));
    assertEquals(AccessLevel.MASKED_ONLY, store.resolveAccessLevel("nobody@company.com", FEB));

    assertEquals(1, store.deactivate("governance@company.com"));
    assertEquals(AccessLevel.MASKED_ONLY,
        store.resolveAccessLevel("governance@company.com", FEB));
    assertEquals(1, store.grantsOf("governance@company.com").size());

    assertEquals(1, store.revoke("scientist@company.com"));
    assertNull(store.effectiveGrant("scientist@company.com", FEB));
  }

  @Test void testDefaultGrants() {
    List<AccessGrant> grants = DefaultGrants.at(JAN);
    assertEquals(3, grants.size());
    for (AccessGrant grant : grants) {
      assertEquals(DefaultGrants.GRANTED_BY, grant.getGrantedBy());
      assertEquals(DefaultGrants.REASON, grant.getReason());
      assertEquals(JAN, grant.getGrantedAt());
      assertNull(grant.getExpiresAt());
      assertEquals(true, grant.isActive());
    }
    assertEquals("governance_officer", grants.get(2).getUserGroup());
  }
}
