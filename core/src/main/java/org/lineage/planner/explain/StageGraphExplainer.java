/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.explain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lineage.dataset.Dataset;
import org.lineage.exception.PlanningException;
import org.lineage.planner.stage.ElidedDependency;
import org.lineage.planner.stage.ShuffleDescriptor;
import org.lineage.planner.stage.Stage;
import org.lineage.planner.stage.StageGraph;
import org.lineage.planner.stage.StageInput;

/** Renders a {@link StageGraph} as pretty-printed JSON for explain output. */
public class StageGraphExplainer {

  private static final String FIELD_TARGET = "target";
  private static final String FIELD_STAGES = "stages";
  private static final String FIELD_SHUFFLES = "shuffles";
  private static final String FIELD_ID = "id";
  private static final String FIELD_NAME = "name";
  private static final String FIELD_NODES = "nodes";
  private static final String FIELD_SINKS = "sinks";
  private static final String FIELD_INPUTS = "inputs";
  private static final String FIELD_TYPE = "type";
  private static final String FIELD_DATASET = "dataset";
  private static final String FIELD_PARTITIONING = "partitioning";
  private static final String FIELD_OUTPUT_PARTITIONING = "outputPartitioning";
  private static final String FIELD_ELIDED = "elided";

  private final ObjectMapper objectMapper;

  public StageGraphExplainer() {
    this(new ObjectMapper());
  }

  public StageGraphExplainer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String explain(StageGraph graph) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(graph));
    } catch (JsonProcessingException e) {
      throw new PlanningException("Failed to render stage graph " + graph, e);
    }
  }

  public ObjectNode toJsonNode(StageGraph graph) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put(FIELD_TARGET, graph.getTargetDatasetId());
    ArrayNode stages = root.putArray(FIELD_STAGES);
    graph.getStages().forEach(stage -> stages.add(stageNode(stage)));
    ArrayNode shuffles = root.putArray(FIELD_SHUFFLES);
    graph.getShuffleDescriptors().forEach(d -> shuffles.add(shuffleNode(d)));
    return root;
  }

  private ObjectNode stageNode(Stage stage) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_ID, stage.getId());
    ArrayNode nodes = node.putArray(FIELD_NODES);
    for (Dataset dataset : stage.getNodes()) {
      ObjectNode datasetNode = nodes.addObject();
      datasetNode.put(FIELD_ID, dataset.getId());
      datasetNode.put(FIELD_NAME, dataset.getName());
      datasetNode.put(FIELD_PARTITIONING, dataset.getPartitioning().toString());
    }
    ArrayNode sinks = node.putArray(FIELD_SINKS);
    for (int sinkId : stage.getSinkDatasetIds()) {
      sinks.add(sinkId);
    }
    ArrayNode inputs = node.putArray(FIELD_INPUTS);
    for (StageInput input : stage.getInputs()) {
      ObjectNode inputNode = inputs.addObject();
      inputNode.put(FIELD_TYPE, input.getType().name());
      inputNode.put(FIELD_DATASET, input.getDatasetId());
      input.getDescriptor().ifPresent(d -> inputNode.put("shuffle", d.getShuffleId()));
      input.getParentStageId().ifPresent(id -> inputNode.put("stage", id));
    }
    node.put(FIELD_OUTPUT_PARTITIONING, stage.getOutputPartitioning().toString());
    if (!stage.getElidedDependencies().isEmpty()) {
      ArrayNode elided = node.putArray(FIELD_ELIDED);
      for (ElidedDependency dependency : stage.getElidedDependencies()) {
        ObjectNode elidedNode = elided.addObject();
        elidedNode.put("parent", dependency.getParentId());
        elidedNode.put("child", dependency.getChildId());
        elidedNode.put(FIELD_PARTITIONING, dependency.getRequiredPartitioning().toString());
      }
    }
    return node;
  }

  private ObjectNode shuffleNode(ShuffleDescriptor descriptor) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_ID, descriptor.getShuffleId());
    node.put("sourceStage", descriptor.getSourceStageId());
    node.put("sourceDataset", descriptor.getSourceDatasetId());
    node.put("targetDataset", descriptor.getTargetDatasetId());
    node.put(FIELD_PARTITIONING, descriptor.getTargetPartitioning().toString());
    descriptor.getAggregator().ifPresent(a -> node.put("aggregator", a.getName()));
    node.put("mapSideCombine", descriptor.isMapSideCombine());
    return node;
  }
}
