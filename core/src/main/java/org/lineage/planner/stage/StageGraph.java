/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.stage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;

/**
 * The physical plan of one action: a DAG of {@link Stage}s connected by {@link ShuffleDescriptor}s.
 * Stages are ordered by id, upstream stages first, the final stage last, so the stage list is a
 * valid execution order.
 */
@EqualsAndHashCode
public class StageGraph {

  private final int targetDatasetId;
  private final List<Stage> stages;
  private final List<ShuffleDescriptor> shuffleDescriptors;

  public StageGraph(
      int targetDatasetId, List<Stage> stages, List<ShuffleDescriptor> shuffleDescriptors) {
    this.targetDatasetId = targetDatasetId;
    this.stages = Collections.unmodifiableList(stages);
    this.shuffleDescriptors = Collections.unmodifiableList(shuffleDescriptors);
  }

  /** Returns the dataset the plan computes. */
  public int getTargetDatasetId() {
    return targetDatasetId;
  }

  /** Returns all stages, ids ascending. */
  public List<Stage> getStages() {
    return stages;
  }

  /** Returns the stage computing the target dataset. */
  public Stage getFinalStage() {
    if (stages.isEmpty()) {
      throw new IllegalStateException("Stage graph has no stages");
    }
    return stages.get(stages.size() - 1);
  }

  /** Returns the stages reading no shuffle output. */
  public List<Stage> getRootStages() {
    return stages.stream().filter(Stage::isRoot).collect(Collectors.toList());
  }

  public Stage getStage(int stageId) {
    return stages.stream()
        .filter(s -> s.getId() == stageId)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Stage not found: " + stageId));
  }

  /** Returns the stages whose shuffle output the given stage reads. */
  public List<Stage> getParentStages(int stageId) {
    return getStage(stageId).getParentStageIds().stream()
        .map(this::getStage)
        .collect(Collectors.toList());
  }

  /** Returns the stages reading the shuffle output of the given stage. */
  public List<Stage> getChildStages(int stageId) {
    getStage(stageId);
    return stages.stream()
        .filter(s -> s.getParentStageIds().contains(stageId))
        .collect(Collectors.toList());
  }

  /** Returns every shuffle of the plan, shuffle ids ascending. */
  public List<ShuffleDescriptor> getShuffleDescriptors() {
    return shuffleDescriptors;
  }

  /** Returns the stages computing the given dataset. More than one means it is recomputed. */
  public List<Stage> stagesContaining(int datasetId) {
    return stages.stream().filter(s -> s.contains(datasetId)).collect(Collectors.toList());
  }

  public int getStageCount() {
    return stages.size();
  }

  /**
   * Validates the plan. Returns a list of validation errors, or empty list if valid.
   *
   * @return list of error messages
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (stages.isEmpty()) {
      errors.add("Plan must have at least one stage");
      return errors;
    }

    Map<Integer, Stage> stageMap = new HashMap<>();
    for (Stage stage : stages) {
      if (stageMap.put(stage.getId(), stage) != null) {
        errors.add("Duplicate stage id: " + stage.getId());
      }
    }
    if (!getFinalStage().contains(targetDatasetId)) {
      errors.add("Final stage " + getFinalStage().getId() + " does not compute " + targetDatasetId);
    }

    for (Stage stage : stages) {
      if (stage.getInputs().isEmpty()) {
        errors.add("Stage " + stage.getId() + " has no inputs");
      }
      for (int parentId : stage.getParentStageIds()) {
        if (!stageMap.containsKey(parentId)) {
          errors.add("Stage " + stage.getId() + " references unknown stage: " + parentId);
        } else if (parentId >= stage.getId()) {
          errors.add("Stage " + stage.getId() + " reads from later stage " + parentId);
        }
      }
      checkElisions(stage, errors);
    }

    for (ShuffleDescriptor descriptor : shuffleDescriptors) {
      Stage source = stageMap.get(descriptor.getSourceStageId());
      if (source == null) {
        errors.add(
            "Shuffle "
                + descriptor.getShuffleId()
                + " references unknown stage: "
                + descriptor.getSourceStageId());
      } else if (!source.contains(descriptor.getSourceDatasetId())) {
        errors.add(
            "Shuffle "
                + descriptor.getShuffleId()
                + " reads dataset "
                + descriptor.getSourceDatasetId()
                + " which stage "
                + source.getId()
                + " does not compute");
      }
    }

    if (errors.isEmpty() && hasCycle(stageMap)) {
      errors.add("Stage graph contains a cycle");
    }
    return errors;
  }

  /**
   * Checks the invariants every returned plan must hold whatever the validation settings: elided
   * shuffles really are satisfied by their parent's partitioning, and stages form no cycle.
   *
   * @return list of error messages
   */
  public List<String> checkInvariants() {
    List<String> errors = new ArrayList<>();
    Map<Integer, Stage> stageMap = new HashMap<>();
    for (Stage stage : stages) {
      stageMap.put(stage.getId(), stage);
      checkElisions(stage, errors);
    }
    boolean parentsKnown =
        stageMap.size() == stages.size()
            && stages.stream()
                .flatMap(stage -> stage.getParentStageIds().stream())
                .allMatch(stageMap::containsKey);
    if (parentsKnown && hasCycle(stageMap)) {
      errors.add("Stage graph contains a cycle");
    }
    return errors;
  }

  private void checkElisions(Stage stage, List<String> errors) {
    for (ElidedDependency elided : stage.getElidedDependencies()) {
      if (!elided.getParentPartitioning().equals(elided.getRequiredPartitioning())) {
        errors.add(
            "Stage "
                + stage.getId()
                + " elides shuffle "
                + elided.getParentId()
                + " -> "
                + elided.getChildId()
                + " but "
                + elided.getParentPartitioning()
                + " does not satisfy "
                + elided.getRequiredPartitioning());
      }
    }
  }

  private boolean hasCycle(Map<Integer, Stage> stageMap) {
    Map<Integer, Integer> pending = new HashMap<>();
    Map<Integer, List<Integer>> children = new HashMap<>();
    for (Stage stage : stages) {
      List<Integer> parents = stage.getParentStageIds();
      pending.put(stage.getId(), parents.size());
      for (int parentId : parents) {
        children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(stage.getId());
      }
    }
    Deque<Integer> ready = new ArrayDeque<>();
    pending.forEach(
        (id, count) -> {
          if (count == 0) {
            ready.add(id);
          }
        });
    int visited = 0;
    while (!ready.isEmpty()) {
      int id = ready.poll();
      visited++;
      for (int child : children.getOrDefault(id, List.of())) {
        if (pending.merge(child, -1, Integer::sum) == 0) {
          ready.add(child);
        }
      }
    }
    return visited != stageMap.size();
  }

  @Override
  public String toString() {
    return "StageGraph{target="
        + targetDatasetId
        + ", stages="
        + stages.size()
        + ", shuffles="
        + shuffleDescriptors.size()
        + '}';
  }
}
