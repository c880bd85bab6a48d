/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

import com.google.common.base.Preconditions;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.lineage.partition.PartitionMapping;

/** Classified edge from a parent dataset to a child dataset. */
@Getter
@ToString
@EqualsAndHashCode
public final class Dependency {

  private final int parentId;
  private final int childId;
  private final DependencyKind kind;

  @Getter(AccessLevel.NONE)
  private final PartitionMapping partitionMapping;

  public Dependency(
      int parentId, int childId, DependencyKind kind, PartitionMapping partitionMapping) {
    Preconditions.checkNotNull(kind, "Dependency kind is required");
    Preconditions.checkArgument(
        kind == DependencyKind.NARROW || partitionMapping == null,
        "Only narrow dependencies carry a partition mapping");
    this.parentId = parentId;
    this.childId = childId;
    this.kind = kind;
    this.partitionMapping = partitionMapping;
  }

  public static Dependency narrow(int parentId, int childId, PartitionMapping mapping) {
    return new Dependency(parentId, childId, DependencyKind.NARROW, mapping);
  }

  public static Dependency wide(int parentId, int childId) {
    return new Dependency(parentId, childId, DependencyKind.WIDE, null);
  }

  public boolean isWide() {
    return kind == DependencyKind.WIDE;
  }

  /** Returns the partition mapping of a narrow dependency when it is known. */
  public Optional<PartitionMapping> getPartitionMapping() {
    return Optional.ofNullable(partitionMapping);
  }
}
