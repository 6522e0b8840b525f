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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HistoryIntegrity}.
 */
@Tag("unit")
public class HistoryIntegrityTest {

  private static final BusinessKey KEY = BusinessKey.of("id", 1L);
  private static final Map<String, Object> ATTRS = Collections.<String, Object>singletonMap("v", 1);

  private static Instant day(int n) {
    return Instant.parse("2024-01-01T00:00:00Z").plusSeconds(86400L * n);
  }

  private static VersionedRecord closed(int from, int to, boolean deleted) {
    return new VersionedRecord(KEY, ATTRS, day(from), day(to), deleted);
  }

  private static VersionedRecord open(int from) {
    return VersionedRecord.open(KEY, ATTRS, day(from));
  }

  private static void verify(VersionedRecord... versions) throws MergeIntegrityException {
    HistoryIntegrity.verify(KeyHistory.of(KEY, Arrays.asList(versions)));
  }

  @Test void testContiguousHistory() {
    assertDoesNotThrow(() -> verify(closed(0, 1, false), closed(1, 2, false), open(2)));
    assertDoesNotThrow(() -> verify());
  }

  @Test void testGapAfterDeleteIsAllowed() {
    assertDoesNotThrow(() -> verify(closed(0, 1, true), open(3)));
  }

  @Test void testGapWithoutDelete() {
    MergeIntegrityException e = assertThrows(MergeIntegrityException.class,
        () -> verify(closed(0, 1, false), open(3)));
    assertEquals(KEY, e.getKey());
    assertTrue(e.getMessage().contains("gap"));
  }

  @Test void testOverlap() {
    assertThrows(MergeIntegrityException.class,
        () -> verify(closed(0, 2, false), open(1)));
  }

  @Test void testOpenVersionMustBeLast() {
    assertThrows(MergeIntegrityException.class, () -> verify(open(0), closed(1, 2, false)));
  }

  @Test void testEmptyInterval() {
    assertThrows(MergeIntegrityException.class, () -> verify(closed(1, 1, false)));
  }

  @Test void testKeyHistoryRejectsForeignVersion() {
    VersionedRecord other = VersionedRecord.open(BusinessKey.of("id", 2L), ATTRS, day(0));
    assertThrows(IllegalArgumentException.class,
        () -> KeyHistory.of(KEY, Collections.singletonList(other)));
  }
}
