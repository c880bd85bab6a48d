/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.lineage.dataset.Dataset;
import org.lineage.dataset.DatasetKind;
import org.lineage.dataset.Dependency;
import org.lineage.dataset.LineageGraph;
import org.lineage.dataset.LineageView;
import org.lineage.dataset.Transformation;
import org.lineage.exception.CyclicLineageException;
import org.lineage.exception.DatasetNotFoundException;
import org.lineage.exception.PlanInconsistencyException;
import org.lineage.exception.StructuralException;
import org.lineage.exception.UnresolvedPartitionCountException;
import org.lineage.partition.KeyFunction;
import org.lineage.partition.PartitionMapping;
import org.lineage.partition.PartitioningScheme;
import org.lineage.planner.compatibility.EdgeDecision;
import org.lineage.planner.compatibility.PartitionerCompatibilityAnalyzer;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DefaultStagePlannerFailureTest {

  private static final KeyFunction KEY = KeyFunction.of("key");

  @Mock private LineageView lineage;
  @Mock private PartitionerCompatibilityAnalyzer compatibilityAnalyzer;

  private DefaultStagePlanner planner;

  @BeforeEach
  void setUp() {
    planner = new DefaultStagePlanner(lineage, PlannerConfig.defaults());
  }

  @Test
  void should_fail_on_cyclic_lineage() {
    register(derived(0, 1));
    register(derived(1, 0));

    CyclicLineageException e = assertThrows(CyclicLineageException.class, () -> planner.plan(0));
    assertEquals(List.of(0, 1, 0), e.getCycle());
  }

  @Test
  void should_fail_on_self_referencing_dataset() {
    register(derived(3, 3));

    CyclicLineageException e = assertThrows(CyclicLineageException.class, () -> planner.plan(3));
    assertEquals(List.of(3, 3), e.getCycle());
  }

  @Test
  void should_fail_on_missing_parent() {
    register(derived(0, 7));
    when(lineage.getDataset(7)).thenThrow(new DatasetNotFoundException(7));

    DatasetNotFoundException e =
        assertThrows(DatasetNotFoundException.class, () -> planner.plan(0));
    assertEquals(7, e.getDatasetId());
  }

  @Test
  void should_fail_on_unknown_target() {
    when(lineage.getDataset(42)).thenThrow(new DatasetNotFoundException(42));

    assertThrows(DatasetNotFoundException.class, () -> planner.plan(42));
  }

  @Test
  void should_fail_on_target_of_another_graph() {
    Dataset foreign = new LineageGraph(PlannerConfig.defaults()).source("other", 2);
    when(lineage.findDataset(0)).thenReturn(Optional.empty());

    assertThrows(DatasetNotFoundException.class, () -> planner.plan(foreign));
  }

  @Test
  void should_fail_on_derived_dataset_without_parents() {
    Dataset orphan =
        new Dataset(
            5,
            "orphan",
            DatasetKind.DERIVED,
            Transformation.map(),
            List.of(),
            PartitioningScheme.unknown(),
            null);
    register(orphan);

    StructuralException e = assertThrows(StructuralException.class, () -> planner.plan(5));
    assertEquals(StructuralException.class, e.getClass());
  }

  @Test
  void should_fail_on_unresolved_partition_count() {
    LineageGraph graph = new LineageGraph(PlannerConfig.withoutDefaultParallelism());
    Dataset grouped = graph.groupByKey(graph.source("events", 4), KEY);

    DefaultStagePlanner unresolved =
        new DefaultStagePlanner(graph, PlannerConfig.withoutDefaultParallelism());

    assertThrows(UnresolvedPartitionCountException.class, () -> unresolved.plan(grouped));
  }

  @Test
  void should_reject_inconsistent_elision_with_and_without_full_validation() {
    LineageGraph graph = new LineageGraph(PlannerConfig.defaults());
    Dataset source = graph.source("events", 4);
    Dataset grouped = graph.groupByKey(source, KEY);
    when(compatibilityAnalyzer.analyze(eq(source), any())).thenReturn(List.of());
    when(compatibilityAnalyzer.analyze(eq(grouped), any()))
        .thenReturn(
            List.of(
                new EdgeDecision(
                    grouped.getDependencies().get(0),
                    0,
                    EdgeDecision.Outcome.ELIDED,
                    grouped.getRequiredPartitioning().orElseThrow())));

    DefaultStagePlanner validating =
        new DefaultStagePlanner(graph, PlannerConfig.defaults(), compatibilityAnalyzer);
    PlanInconsistencyException e =
        assertThrows(PlanInconsistencyException.class, () -> validating.plan(grouped));
    assertEquals(1, e.getErrors().size());
    assertTrue(e.getErrors().get(0).contains("elides shuffle"));

    DefaultStagePlanner unchecked =
        new DefaultStagePlanner(
            graph, PlannerConfig.defaults().withValidationEnabled(false), compatibilityAnalyzer);
    PlanInconsistencyException always =
        assertThrows(PlanInconsistencyException.class, () -> unchecked.plan(grouped));
    assertEquals(e.getErrors(), always.getErrors());
  }

  private void register(Dataset dataset) {
    when(lineage.getDataset(dataset.getId())).thenReturn(dataset);
    when(lineage.findDataset(dataset.getId())).thenReturn(Optional.of(dataset));
  }

  private Dataset derived(int id, int parentId) {
    return new Dataset(
        id,
        null,
        DatasetKind.DERIVED,
        Transformation.map(),
        List.of(Dependency.narrow(parentId, id, PartitionMapping.oneToOne())),
        PartitioningScheme.unconstrained(2),
        null);
  }
}
