/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.stage;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.lineage.dataset.Aggregator;
import org.lineage.partition.PartitioningScheme;

/**
 * A shuffle boundary: the map side of {@code sourceDatasetId} (computed by stage {@code
 * sourceStageId}) is redistributed into {@code targetPartitioning} for {@code targetDatasetId}.
 */
@Getter
@EqualsAndHashCode
public final class ShuffleDescriptor {

  private final int shuffleId;
  private final int sourceStageId;
  private final int sourceDatasetId;
  private final int targetDatasetId;
  private final PartitioningScheme targetPartitioning;

  @Getter(AccessLevel.NONE)
  private final Aggregator aggregator;

  /** True if records are pre-aggregated before they are written. */
  private final boolean mapSideCombine;

  public ShuffleDescriptor(
      int shuffleId,
      int sourceStageId,
      int sourceDatasetId,
      int targetDatasetId,
      PartitioningScheme targetPartitioning,
      Aggregator aggregator,
      boolean mapSideCombine) {
    this.shuffleId = shuffleId;
    this.sourceStageId = sourceStageId;
    this.sourceDatasetId = sourceDatasetId;
    this.targetDatasetId = targetDatasetId;
    this.targetPartitioning = targetPartitioning;
    this.aggregator = aggregator;
    this.mapSideCombine = mapSideCombine;
  }

  /** Returns the aggregator reference, passed through untouched. */
  public Optional<Aggregator> getAggregator() {
    return Optional.ofNullable(aggregator);
  }

  @Override
  public String toString() {
    return "Shuffle{id="
        + shuffleId
        + ", stage "
        + sourceStageId
        + ": "
        + sourceDatasetId
        + " -> "
        + targetDatasetId
        + ", "
        + targetPartitioning
        + (mapSideCombine ? ", combine" : "")
        + '}';
  }
}
