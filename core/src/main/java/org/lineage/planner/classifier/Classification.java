/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.classifier;

import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;
import org.lineage.dataset.Dependency;
import org.lineage.partition.PartitioningScheme;

/** Classified edges and derived partitionings of a dataset about to be created. */
@ToString
public class Classification {

  @Getter private final List<Dependency> dependencies;
  @Getter private final PartitioningScheme partitioning;
  private final PartitioningScheme requiredPartitioning;

  public Classification(
      List<Dependency> dependencies,
      PartitioningScheme partitioning,
      PartitioningScheme requiredPartitioning) {
    this.dependencies = List.copyOf(dependencies);
    this.partitioning = partitioning;
    this.requiredPartitioning = requiredPartitioning;
  }

  public Optional<PartitioningScheme> getRequiredPartitioning() {
    return Optional.ofNullable(requiredPartitioning);
  }
}
