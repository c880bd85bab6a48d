/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.stage;

import lombok.Data;
import org.lineage.partition.PartitioningScheme;

/** A wide edge planned without a shuffle because the parent was already partitioned as needed. */
@Data
public final class ElidedDependency {
  private final int parentId;
  private final int childId;
  private final PartitioningScheme parentPartitioning;
  private final PartitioningScheme requiredPartitioning;
}
