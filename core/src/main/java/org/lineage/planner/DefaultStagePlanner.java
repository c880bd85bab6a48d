/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.lineage.dataset.Dataset;
import org.lineage.dataset.LineageView;
import org.lineage.exception.CyclicLineageException;
import org.lineage.exception.DatasetNotFoundException;
import org.lineage.exception.PlanInconsistencyException;
import org.lineage.exception.PlanningException;
import org.lineage.exception.StructuralException;
import org.lineage.planner.compatibility.EdgeDecision;
import org.lineage.planner.compatibility.PartitionerCompatibilityAnalyzer;
import org.lineage.planner.stage.ElidedDependency;
import org.lineage.planner.stage.ShuffleDescriptor;
import org.lineage.planner.stage.Stage;
import org.lineage.planner.stage.StageGraph;
import org.lineage.planner.stage.StageInput;

/**
 * Default {@link StagePlanner}. Holds no mutable state: every call builds its own {@link
 * PlanningSession}, so concurrent calls over a shared lineage graph are safe.
 *
 * <p>A call runs in five steps:
 *
 * <ol>
 *   <li>Visit every dataset reachable from the target, deciding each parent edge and failing on
 *       cycles and dangling references.
 *   <li>Collect one provisional stage per seed (the target and every shuffled parent): the datasets
 *       reachable from the seed through narrow and elided edges.
 *   <li>Merge provisional stages sharing datasets when no stage path connects them. Otherwise the
 *       shared datasets are computed by each stage.
 *   <li>Number stages so that every stage comes after the stages it reads from.
 *   <li>Create one shuffle descriptor per shuffled edge and assemble the stages.
 * </ol>
 */
@Log4j2
public class DefaultStagePlanner implements StagePlanner {

  private final LineageView lineage;
  private final PlannerConfig config;
  private final PartitionerCompatibilityAnalyzer compatibilityAnalyzer;

  public DefaultStagePlanner(LineageView lineage, PlannerConfig config) {
    this(lineage, config, new PartitionerCompatibilityAnalyzer(config));
  }

  public DefaultStagePlanner(
      LineageView lineage,
      PlannerConfig config,
      PartitionerCompatibilityAnalyzer compatibilityAnalyzer) {
    this.lineage = Preconditions.checkNotNull(lineage, "Lineage is required");
    this.config = Preconditions.checkNotNull(config, "Planner config is required");
    this.compatibilityAnalyzer =
        Preconditions.checkNotNull(compatibilityAnalyzer, "Compatibility analyzer is required");
  }

  @Override
  public StageGraph plan(Dataset target) {
    Preconditions.checkNotNull(target, "Target dataset is required");
    if (lineage.findDataset(target.getId()).orElse(null) != target) {
      DatasetNotFoundException e = new DatasetNotFoundException(target.getId());
      log.error("Dataset {} does not belong to the planned lineage graph", target.getId(), e);
      throw e;
    }
    return plan(target.getId());
  }

  @Override
  public StageGraph plan(int targetId) {
    try {
      StageGraph graph = new PlanningSession(targetId).plan();
      List<String> errors =
          config.isValidationEnabled() ? graph.validate() : graph.checkInvariants();
      if (!errors.isEmpty()) {
        throw new PlanInconsistencyException(targetId, errors);
      }
      log.info(
          "Planned dataset {} into {} stages and {} shuffles",
          targetId,
          graph.getStageCount(),
          graph.getShuffleDescriptors().size());
      return graph;
    } catch (PlanningException e) {
      log.error("Failed to plan dataset {}", targetId, e);
      throw e;
    }
  }

  private enum VisitState {
    IN_PROGRESS,
    ASSIGNED
  }

  /** Datasets reachable from one seed through narrow and elided edges. */
  private static final class ProvisionalStage {
    private final int index;
    private final int seedId;
    private final Set<Integer> nodeIds = new TreeSet<>();
    private final Set<Integer> externalSourceIds = new TreeSet<>();
    private final Set<Integer> broadcastIds = new TreeSet<>();
    private final List<EdgeDecision> shuffleReads = new ArrayList<>();
    private final List<ElidedDependency> elidedDependencies = new ArrayList<>();

    private ProvisionalStage(int index, int seedId) {
      this.index = index;
      this.seedId = seedId;
    }

    private boolean overlaps(ProvisionalStage other) {
      return nodeIds.stream().anyMatch(other.nodeIds::contains);
    }
  }

  /** State of one planning call. */
  private final class PlanningSession {
    private final int targetId;
    private final Map<Integer, VisitState> states = new HashMap<>();
    private final Map<Integer, Dataset> datasets = new HashMap<>();
    private final Map<Integer, List<EdgeDecision>> decisions = new HashMap<>();
    private final Map<Integer, Integer> stageIndexBySeed = new HashMap<>();
    private final List<ProvisionalStage> provisionalStages = new ArrayList<>();
    private int[] groups;

    private PlanningSession(int targetId) {
      this.targetId = targetId;
    }

    private StageGraph plan() {
      visit();
      collectStages();
      mergeStages();
      Map<Integer, Integer> stageIds = numberStages();
      return assemble(stageIds);
    }

    private void visit() {
      Deque<int[]> stack = new ArrayDeque<>();
      enter(targetId, stack);
      while (!stack.isEmpty()) {
        int[] frame = stack.peek();
        List<EdgeDecision> edges = decisions.get(frame[0]);
        if (frame[1] == edges.size()) {
          states.put(frame[0], VisitState.ASSIGNED);
          stack.pop();
          continue;
        }
        EdgeDecision edge = edges.get(frame[1]++);
        if (edge.getOutcome() == EdgeDecision.Outcome.BROADCAST) {
          continue;
        }
        VisitState parentState = states.get(edge.getParentId());
        if (parentState == VisitState.IN_PROGRESS) {
          throw new CyclicLineageException(cycleThrough(stack, edge.getParentId()));
        }
        if (parentState == null) {
          enter(edge.getParentId(), stack);
        }
      }
    }

    private void enter(int datasetId, Deque<int[]> stack) {
      Dataset dataset = lineage.getDataset(datasetId);
      if (!dataset.isSource() && dataset.getDependencies().isEmpty()) {
        throw new StructuralException("Derived dataset " + datasetId + " has no parents");
      }
      states.put(datasetId, VisitState.IN_PROGRESS);
      datasets.put(datasetId, dataset);
      List<EdgeDecision> edges = compatibilityAnalyzer.analyze(dataset, lineage);
      for (EdgeDecision edge : edges) {
        log.debug(
            "Edge {} -> {} of {}: {}",
            edge.getParentId(),
            edge.getChildId(),
            dataset.getName(),
            edge.getOutcome());
      }
      decisions.put(datasetId, edges);
      stack.push(new int[] {datasetId, 0});
    }

    /** Returns the ids from {@code repeatedId} down the visit stack and back to it. */
    private List<Integer> cycleThrough(Deque<int[]> stack, int repeatedId) {
      List<Integer> cycle = new ArrayList<>();
      Iterator<int[]> bottomUp = stack.descendingIterator();
      boolean inCycle = false;
      while (bottomUp.hasNext()) {
        int id = bottomUp.next()[0];
        inCycle |= id == repeatedId;
        if (inCycle) {
          cycle.add(id);
        }
      }
      cycle.add(repeatedId);
      return cycle;
    }

    private void collectStages() {
      Deque<Integer> seeds = new ArrayDeque<>();
      seeds.add(targetId);
      stageIndexBySeed.put(targetId, 0);
      while (!seeds.isEmpty()) {
        int seedId = seeds.poll();
        ProvisionalStage stage = collect(provisionalStages.size(), seedId);
        provisionalStages.add(stage);
        for (EdgeDecision read : stage.shuffleReads) {
          if (!stageIndexBySeed.containsKey(read.getParentId())) {
            stageIndexBySeed.put(read.getParentId(), stageIndexBySeed.size());
            seeds.add(read.getParentId());
          }
        }
      }
    }

    private ProvisionalStage collect(int index, int seedId) {
      ProvisionalStage stage = new ProvisionalStage(index, seedId);
      Deque<Integer> pending = new ArrayDeque<>();
      Set<Integer> seen = new HashSet<>();
      pending.add(seedId);
      seen.add(seedId);
      while (!pending.isEmpty()) {
        int datasetId = pending.poll();
        Dataset dataset = datasets.get(datasetId);
        stage.nodeIds.add(datasetId);
        if (dataset.isBroadcast()) {
          stage.broadcastIds.add(datasetId);
        } else if (dataset.isSource()) {
          stage.externalSourceIds.add(datasetId);
        }
        for (EdgeDecision edge : decisions.get(datasetId)) {
          switch (edge.getOutcome()) {
            case ELIDED:
              stage.elidedDependencies.add(
                  new ElidedDependency(
                      edge.getParentId(),
                      edge.getChildId(),
                      datasets.get(edge.getParentId()).getPartitioning(),
                      edge.getRequiredPartitioning().orElseThrow()));
              if (seen.add(edge.getParentId())) {
                pending.add(edge.getParentId());
              }
              break;
            case NARROW:
              if (seen.add(edge.getParentId())) {
                pending.add(edge.getParentId());
              }
              break;
            case SHUFFLE:
              stage.shuffleReads.add(edge);
              break;
            case BROADCAST:
              stage.broadcastIds.add(edge.getParentId());
              break;
            default:
              throw new IllegalStateException("Unexpected edge outcome " + edge.getOutcome());
          }
        }
      }
      log.debug("Seed {} collects datasets {}", seedId, stage.nodeIds);
      return stage;
    }

    private void mergeStages() {
      int count = provisionalStages.size();
      groups = new int[count];
      for (int i = 0; i < count; i++) {
        groups[i] = i;
      }
      if (!config.isStageMergeEnabled()) {
        return;
      }
      for (int i = 0; i < count; i++) {
        for (int j = i + 1; j < count; j++) {
          int left = group(i);
          int right = group(j);
          if (left == right || !provisionalStages.get(i).overlaps(provisionalStages.get(j))) {
            continue;
          }
          if (reaches(left, right) || reaches(right, left)) {
            log.debug(
                "Seeds {} and {} share datasets but depend on each other, recomputing",
                provisionalStages.get(i).seedId,
                provisionalStages.get(j).seedId);
            continue;
          }
          groups[Math.max(left, right)] = Math.min(left, right);
          log.debug(
              "Merged stages of seeds {} and {}",
              provisionalStages.get(i).seedId,
              provisionalStages.get(j).seedId);
        }
      }
    }

    private int group(int index) {
      int root = index;
      while (groups[root] != root) {
        root = groups[root];
      }
      return root;
    }

    private List<ProvisionalStage> members(int group) {
      return provisionalStages.stream()
          .filter(stage -> group(stage.index) == group)
          .collect(Collectors.toList());
    }

    /** Returns the groups the given group reads shuffle output from, in read order. */
    private List<Integer> parentGroups(int group) {
      Set<Integer> parents = new LinkedHashSet<>();
      for (ProvisionalStage member : members(group)) {
        for (EdgeDecision read : member.shuffleReads) {
          parents.add(group(stageIndexBySeed.get(read.getParentId())));
        }
      }
      return new ArrayList<>(parents);
    }

    private boolean reaches(int from, int to) {
      Deque<Integer> pending = new ArrayDeque<>(List.of(from));
      Set<Integer> seen = new HashSet<>(pending);
      while (!pending.isEmpty()) {
        for (int parent : parentGroups(pending.poll())) {
          if (parent == to) {
            return true;
          }
          if (seen.add(parent)) {
            pending.add(parent);
          }
        }
      }
      return false;
    }

    /** Numbers groups in post-order from the target's group, so parents get lower ids. */
    private Map<Integer, Integer> numberStages() {
      Map<Integer, Integer> stageIds = new HashMap<>();
      Set<Integer> entered = new HashSet<>();
      Deque<Iterator<Integer>> parentIterators = new ArrayDeque<>();
      Deque<Integer> path = new ArrayDeque<>();
      int targetGroup = group(0);
      entered.add(targetGroup);
      path.push(targetGroup);
      parentIterators.push(parentGroups(targetGroup).iterator());
      while (!path.isEmpty()) {
        Iterator<Integer> parents = parentIterators.peek();
        if (parents.hasNext()) {
          int parent = parents.next();
          if (entered.add(parent)) {
            path.push(parent);
            parentIterators.push(parentGroups(parent).iterator());
          }
          continue;
        }
        stageIds.put(path.pop(), stageIds.size());
        parentIterators.pop();
      }
      return stageIds;
    }

    private StageGraph assemble(Map<Integer, Integer> stageIds) {
      Map<Integer, Integer> groupsByStageId = new HashMap<>();
      stageIds.forEach((group, stageId) -> groupsByStageId.put(stageId, group));
      Map<List<Integer>, ShuffleDescriptor> descriptorsByEdge = new HashMap<>();
      List<ShuffleDescriptor> descriptors = new ArrayList<>();
      List<Stage> stages = new ArrayList<>(stageIds.size());

      for (int stageId = 0; stageId < stageIds.size(); stageId++) {
        List<ProvisionalStage> members = members(groupsByStageId.get(stageId));
        Set<Integer> nodeIds = new TreeSet<>();
        Set<Integer> externalSourceIds = new TreeSet<>();
        Set<Integer> broadcastIds = new TreeSet<>();
        Set<ShuffleDescriptor> stageReads = new LinkedHashSet<>();
        Set<ElidedDependency> elided = new LinkedHashSet<>();
        List<Integer> sinkIds = new ArrayList<>();
        for (ProvisionalStage member : members) {
          sinkIds.add(member.seedId);
          nodeIds.addAll(member.nodeIds);
          externalSourceIds.addAll(member.externalSourceIds);
          broadcastIds.addAll(member.broadcastIds);
          elided.addAll(member.elidedDependencies);
          for (EdgeDecision read : member.shuffleReads) {
            List<Integer> edgeKey = List.of(read.getChildId(), read.getParentIndex());
            ShuffleDescriptor descriptor = descriptorsByEdge.get(edgeKey);
            if (descriptor == null) {
              descriptor = describe(descriptors.size(), read, stageIds);
              descriptorsByEdge.put(edgeKey, descriptor);
              descriptors.add(descriptor);
            }
            stageReads.add(descriptor);
          }
        }

        List<StageInput> inputs = new ArrayList<>();
        externalSourceIds.forEach(id -> inputs.add(StageInput.externalSource(id)));
        stageReads.forEach(descriptor -> inputs.add(StageInput.shuffleRead(descriptor)));
        broadcastIds.forEach(id -> inputs.add(StageInput.broadcast(id)));
        Stage stage =
            new Stage(
                stageId,
                nodeIds.stream().map(datasets::get).collect(Collectors.toList()),
                sinkIds,
                inputs,
                datasets.get(sinkIds.get(0)).getPartitioning(),
                new ArrayList<>(elided));
        log.debug("Created {}", stage);
        stages.add(stage);
      }
      return new StageGraph(targetId, stages, descriptors);
    }

    private ShuffleDescriptor describe(
        int shuffleId, EdgeDecision read, Map<Integer, Integer> stageIds) {
      Dataset child = datasets.get(read.getChildId());
      int sourceGroup = group(stageIndexBySeed.get(read.getParentId()));
      return new ShuffleDescriptor(
          shuffleId,
          stageIds.get(sourceGroup),
          read.getParentId(),
          read.getChildId(),
          read.getRequiredPartitioning().orElseThrow(),
          child.getTransformation().getAggregator().orElse(null),
          child.getTransformation().getKind().isMapSideCombine());
    }
  }
}
