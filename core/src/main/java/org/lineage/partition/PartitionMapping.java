/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.partition;

import com.google.common.base.Preconditions;
import java.util.Set;
import java.util.TreeSet;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Maps a child partition of a narrow dependency to the parent partitions it reads. Mappings are
 * descriptive: the planner records them, the execution layer may use them.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PartitionMapping {

  /** Shape of the mapping. */
  public enum Type {
    /** Child partition {@code i} reads parent partition {@code i}. */
    ONE_TO_ONE,

    /** A contiguous block of child partitions reads the same-sized block of the parent. */
    RANGE,

    /** Each child partition reads a contiguous group of parent partitions. */
    COALESCE
  }

  private final Type type;
  private final int parentStart;
  private final int childStart;
  private final int length;
  private final int parentPartitions;
  private final int childPartitions;

  private PartitionMapping(
      Type type,
      int parentStart,
      int childStart,
      int length,
      int parentPartitions,
      int childPartitions) {
    this.type = type;
    this.parentStart = parentStart;
    this.childStart = childStart;
    this.length = length;
    this.parentPartitions = parentPartitions;
    this.childPartitions = childPartitions;
  }

  public static PartitionMapping oneToOne() {
    return new PartitionMapping(Type.ONE_TO_ONE, 0, 0, -1, -1, -1);
  }

  /**
   * Child partitions {@code [childStart, childStart + length)} read parent partitions {@code
   * [parentStart, parentStart + length)}. Used by union.
   */
  public static PartitionMapping range(int parentStart, int childStart, int length) {
    Preconditions.checkArgument(parentStart >= 0 && childStart >= 0, "Offsets must be >= 0");
    Preconditions.checkArgument(length > 0, "Range length must be positive");
    return new PartitionMapping(Type.RANGE, parentStart, childStart, length, -1, -1);
  }

  /** {@code parentPartitions} parent partitions are merged into {@code childPartitions}. */
  public static PartitionMapping coalesce(int parentPartitions, int childPartitions) {
    Preconditions.checkArgument(
        childPartitions > 0 && childPartitions <= parentPartitions,
        "Cannot coalesce %s partitions into %s",
        parentPartitions,
        childPartitions);
    return new PartitionMapping(Type.COALESCE, 0, 0, -1, parentPartitions, childPartitions);
  }

  /**
   * Returns the parent partitions read by a child partition, in ascending order.
   *
   * @param childPartition child partition index
   * @return parent partition indices, empty if the child partition reads nothing from this parent
   */
  public Set<Integer> getParentPartitions(int childPartition) {
    Preconditions.checkArgument(childPartition >= 0, "Partition index must be >= 0");
    Set<Integer> parents = new TreeSet<>();
    switch (type) {
      case ONE_TO_ONE:
        parents.add(childPartition);
        break;
      case RANGE:
        if (childPartition >= childStart && childPartition < childStart + length) {
          parents.add(childPartition - childStart + parentStart);
        }
        break;
      case COALESCE:
        if (childPartition < childPartitions) {
          int start = (int) ((long) childPartition * parentPartitions / childPartitions);
          int end = (int) ((long) (childPartition + 1) * parentPartitions / childPartitions);
          for (int i = start; i < end; i++) {
            parents.add(i);
          }
        }
        break;
      default:
        throw new IllegalStateException("Unexpected mapping type: " + type);
    }
    return parents;
  }
}
