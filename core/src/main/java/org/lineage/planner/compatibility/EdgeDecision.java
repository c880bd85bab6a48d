/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.compatibility;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.lineage.dataset.Dependency;
import org.lineage.partition.PartitioningScheme;

/** What the planner does with one parent edge. */
@ToString
@EqualsAndHashCode
public final class EdgeDecision {

  public enum Outcome {
    /** Narrow edge: the parent runs in the child's stage. */
    NARROW,

    /** Wide edge whose parent already has the required partitioning: no shuffle, same stage. */
    ELIDED,

    /** Wide edge that ends the stage and needs a shuffle. */
    SHUFFLE,

    /** Edge into a broadcast source: resolved by lookup, never planned. */
    BROADCAST
  }

  @Getter private final Dependency dependency;
  @Getter private final int parentIndex;
  @Getter private final Outcome outcome;
  private final PartitioningScheme requiredPartitioning;

  public EdgeDecision(
      Dependency dependency,
      int parentIndex,
      Outcome outcome,
      PartitioningScheme requiredPartitioning) {
    this.dependency = dependency;
    this.parentIndex = parentIndex;
    this.outcome = outcome;
    this.requiredPartitioning = requiredPartitioning;
  }

  public int getParentId() {
    return dependency.getParentId();
  }

  public int getChildId() {
    return dependency.getChildId();
  }

  /** Returns true if the parent belongs to the same stage as the child. */
  public boolean isFused() {
    return outcome == Outcome.NARROW || outcome == Outcome.ELIDED;
  }

  /** Returns the required partitioning of wide edges. */
  public Optional<PartitioningScheme> getRequiredPartitioning() {
    return Optional.ofNullable(requiredPartitioning);
  }
}
