/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.stage;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Where a stage reads data from. */
@EqualsAndHashCode
public final class StageInput {

  public enum Type {
    /** A source dataset read from storage. */
    EXTERNAL_SOURCE,

    /** The output of an upstream stage, through a shuffle. */
    SHUFFLE_READ,

    /** A broadcast source looked up in memory. */
    BROADCAST
  }

  @Getter private final Type type;
  private final Integer datasetId;
  private final Integer parentStageId;
  private final ShuffleDescriptor descriptor;

  private StageInput(
      Type type, Integer datasetId, Integer parentStageId, ShuffleDescriptor descriptor) {
    this.type = type;
    this.datasetId = datasetId;
    this.parentStageId = parentStageId;
    this.descriptor = descriptor;
  }

  public static StageInput externalSource(int datasetId) {
    return new StageInput(Type.EXTERNAL_SOURCE, datasetId, null, null);
  }

  public static StageInput shuffleRead(ShuffleDescriptor descriptor) {
    return new StageInput(
        Type.SHUFFLE_READ,
        descriptor.getSourceDatasetId(),
        descriptor.getSourceStageId(),
        descriptor);
  }

  public static StageInput broadcast(int datasetId) {
    return new StageInput(Type.BROADCAST, datasetId, null, null);
  }

  /** Returns the dataset read: the source, the broadcast source or the shuffle's map side. */
  public int getDatasetId() {
    return datasetId;
  }

  public Optional<Integer> getParentStageId() {
    return Optional.ofNullable(parentStageId);
  }

  public Optional<ShuffleDescriptor> getDescriptor() {
    return Optional.ofNullable(descriptor);
  }

  public boolean isShuffleRead() {
    return type == Type.SHUFFLE_READ;
  }

  @Override
  public String toString() {
    switch (type) {
      case SHUFFLE_READ:
        return "shuffle(" + descriptor.getShuffleId() + " from stage " + parentStageId + ")";
      case BROADCAST:
        return "broadcast(" + datasetId + ")";
      default:
        return "source(" + datasetId + ")";
    }
  }
}
