/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.stage;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import org.lineage.dataset.Dataset;
import org.lineage.partition.PartitioningScheme;

/**
 * A maximal group of datasets computed together without a shuffle. A stage reads external and
 * broadcast sources plus the shuffle output of upstream stages, and writes the output of its sink
 * datasets.
 */
@EqualsAndHashCode
public class Stage {

  private final int id;
  private final List<Dataset> nodes;
  private final List<Integer> sinkDatasetIds;
  private final List<StageInput> inputs;
  private final PartitioningScheme outputPartitioning;
  private final List<ElidedDependency> elidedDependencies;

  public Stage(
      int id,
      List<Dataset> nodes,
      List<Integer> sinkDatasetIds,
      List<StageInput> inputs,
      PartitioningScheme outputPartitioning,
      List<ElidedDependency> elidedDependencies) {
    this.id = id;
    this.nodes = Collections.unmodifiableList(nodes);
    this.sinkDatasetIds = Collections.unmodifiableList(sinkDatasetIds);
    this.inputs = Collections.unmodifiableList(inputs);
    this.outputPartitioning = outputPartitioning;
    this.elidedDependencies = Collections.unmodifiableList(elidedDependencies);
  }

  public int getId() {
    return id;
  }

  /** Returns the datasets of this stage in topological order. */
  public List<Dataset> getNodes() {
    return nodes;
  }

  public List<Integer> getNodeIds() {
    return nodes.stream().map(Dataset::getId).collect(Collectors.toList());
  }

  public boolean contains(int datasetId) {
    return nodes.stream().anyMatch(n -> n.getId() == datasetId);
  }

  /**
   * Returns the datasets whose output leaves the stage. The first one is the primary sink; merged
   * stages have more than one.
   */
  public List<Integer> getSinkDatasetIds() {
    return sinkDatasetIds;
  }

  public List<StageInput> getInputs() {
    return inputs;
  }

  public List<StageInput> getShuffleReads() {
    return inputs.stream().filter(StageInput::isShuffleRead).collect(Collectors.toList());
  }

  /** Returns the ids of the stages this stage reads shuffle output from. */
  public List<Integer> getParentStageIds() {
    return inputs.stream()
        .filter(StageInput::isShuffleRead)
        .map(input -> input.getParentStageId().orElseThrow())
        .distinct()
        .collect(Collectors.toList());
  }

  /** Returns the partitioning of the primary sink. */
  public PartitioningScheme getOutputPartitioning() {
    return outputPartitioning;
  }

  /** Returns the wide edges inside this stage whose shuffle was elided. */
  public List<ElidedDependency> getElidedDependencies() {
    return elidedDependencies;
  }

  /** Returns true if this stage reads no shuffle output. */
  public boolean isRoot() {
    return inputs.stream().noneMatch(StageInput::isShuffleRead);
  }

  @Override
  public String toString() {
    return "Stage{id="
        + id
        + ", nodes="
        + getNodeIds()
        + ", sinks="
        + sinkDatasetIds
        + ", inputs="
        + inputs
        + ", output="
        + outputPartitioning
        + '}';
  }
}
