/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.partition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PartitionMappingTest {

  @Test
  void should_map_each_partition_to_itself() {
    assertEquals(Set.of(5), PartitionMapping.oneToOne().getParentPartitions(5));
  }

  @Test
  void should_offset_union_ranges() {
    PartitionMapping second = PartitionMapping.range(0, 3, 2);

    assertTrue(second.getParentPartitions(2).isEmpty());
    assertEquals(Set.of(0), second.getParentPartitions(3));
    assertEquals(Set.of(1), second.getParentPartitions(4));
    assertTrue(second.getParentPartitions(5).isEmpty());
  }

  @Test
  void should_cover_every_parent_partition_exactly_once_when_coalescing() {
    PartitionMapping mapping = PartitionMapping.coalesce(10, 3);
    Set<Integer> covered = new HashSet<>();
    int total = 0;

    for (int child = 0; child < 3; child++) {
      Set<Integer> parents = mapping.getParentPartitions(child);
      total += parents.size();
      covered.addAll(parents);
    }

    assertEquals(10, total);
    assertEquals(10, covered.size());
    assertEquals(Set.of(0, 1, 2), mapping.getParentPartitions(0));
    assertEquals(Set.of(6, 7, 8, 9), mapping.getParentPartitions(2));
  }

  @Test
  void should_reject_coalescing_into_more_partitions() {
    assertThrows(IllegalArgumentException.class, () -> PartitionMapping.coalesce(2, 4));
    assertThrows(IllegalArgumentException.class, () -> PartitionMapping.range(0, 0, 0));
  }
}
