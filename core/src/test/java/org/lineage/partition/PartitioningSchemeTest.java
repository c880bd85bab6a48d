/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.partition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PartitioningSchemeTest {

  private static final KeyFunction USER_ID = KeyFunction.of("userId");

  @Test
  void should_compare_hash_partitionings_by_value() {
    assertEquals(
        PartitioningScheme.hash(USER_ID, 8), PartitioningScheme.hash(KeyFunction.of("userId"), 8));
    assertNotEquals(PartitioningScheme.hash(USER_ID, 8), PartitioningScheme.hash(USER_ID, 4));
    assertNotEquals(
        PartitioningScheme.hash(USER_ID, 8), PartitioningScheme.hash(KeyFunction.of("email"), 8));
    assertNotEquals(PartitioningScheme.hash(USER_ID, 8), PartitioningScheme.range(USER_ID, 8));
  }

  @Test
  void should_derive_partition_count_from_range_boundaries() {
    PartitioningScheme range = PartitioningScheme.range(USER_ID, List.of(10, 20, 30));

    assertEquals(PartitioningType.RANGE, range.getType());
    assertEquals(4, range.getPartitionCount().getAsInt());
    assertEquals(List.of(10, 20, 30), range.getRangeBoundaries());
    assertEquals("range(userId, [10, 20, 30])", range.toString());
  }

  @Test
  void should_report_missing_partition_count() {
    assertFalse(PartitioningScheme.unknown().hasPartitionCount());
    assertFalse(PartitioningScheme.hashUnresolved(USER_ID).hasPartitionCount());
    assertEquals("hash(userId, ?)", PartitioningScheme.hashUnresolved(USER_ID).toString());
    assertTrue(PartitioningScheme.unconstrained(3).hasPartitionCount());
  }

  @Test
  void should_treat_only_placed_partitionings_as_keyed() {
    assertFalse(PartitioningScheme.unconstrained(4).isKeyed());
    assertTrue(PartitioningScheme.hash(USER_ID, 4).isKeyed());
    assertTrue(PartitioningScheme.custom("geo", 4).isKeyed());
    assertEquals("geo", PartitioningScheme.custom("geo", 4).getPartitionerName().orElseThrow());
  }

  @Test
  void should_reject_invalid_arguments() {
    assertThrows(IllegalArgumentException.class, () -> PartitioningScheme.unconstrained(0));
    assertThrows(IllegalArgumentException.class, () -> PartitioningScheme.hash(USER_ID, -1));
    assertThrows(NullPointerException.class, () -> PartitioningScheme.hash(null, 2));
    assertThrows(
        IllegalArgumentException.class, () -> PartitioningScheme.range(USER_ID, List.of()));
    assertThrows(IllegalArgumentException.class, () -> PartitioningScheme.custom("", 2));
    assertThrows(IllegalArgumentException.class, () -> KeyFunction.of(null));
  }
}
