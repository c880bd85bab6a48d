/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lineage.exception.DatasetNotFoundException;
import org.lineage.partition.KeyFunction;
import org.lineage.partition.PartitionMapping;
import org.lineage.partition.PartitioningScheme;
import org.lineage.planner.PlannerConfig;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LineageGraphTest {

  private static final KeyFunction KEY = KeyFunction.of("key");

  private LineageGraph graph;

  @BeforeEach
  void setUp() {
    graph = new LineageGraph(PlannerConfig.withDefaultParallelism(8));
  }

  @Test
  void should_assign_sequential_ids() {
    Dataset source = graph.source("events", 4);
    Dataset mapped = graph.map(source);

    assertEquals(0, source.getId());
    assertEquals(1, mapped.getId());
    assertEquals(2, graph.size());
    assertSame(mapped, graph.getDataset(1));
    assertTrue(graph.findDataset(2).isEmpty());
    assertEquals("events", source.getName());
    assertEquals("map-1", mapped.getName());
  }

  @Test
  void should_keep_partitioning_through_element_wise_operations() {
    Dataset keyed = graph.partitionedSource("users", PartitioningScheme.hash(KEY, 6));

    assertEquals(keyed.getPartitioning(), graph.map(keyed).getPartitioning());
    assertEquals(keyed.getPartitioning(), graph.filter(keyed).getPartitioning());
    assertEquals(keyed.getPartitioning(), graph.mapValues(keyed).getPartitioning());
    assertEquals(keyed.getPartitioning(), graph.mapPartitions(keyed, true).getPartitioning());
    assertEquals(PartitioningScheme.unconstrained(6), graph.flatMap(keyed).getPartitioning());
    assertEquals(
        PartitioningScheme.unconstrained(6), graph.mapPartitions(keyed, false).getPartitioning());
  }

  @Test
  void should_classify_narrow_and_wide_edges() {
    Dataset source = graph.source("events", 4);
    Dataset mapped = graph.map(source);
    Dataset grouped = graph.groupByKey(mapped, KEY);

    Dependency narrow = mapped.getDependencies().get(0);
    Dependency wide = grouped.getDependencies().get(0);
    assertEquals(DependencyKind.NARROW, narrow.getKind());
    assertEquals(PartitionMapping.oneToOne(), narrow.getPartitionMapping().orElseThrow());
    assertEquals(DependencyKind.WIDE, wide.getKind());
    assertTrue(wide.getPartitionMapping().isEmpty());
    assertEquals(PartitioningScheme.hash(KEY, 8), grouped.getPartitioning());
    assertEquals(PartitioningScheme.hash(KEY, 8), grouped.getRequiredPartitioning().orElseThrow());
  }

  @Test
  void should_coalesce_in_place_without_shuffle() {
    Dataset source = graph.source("events", 10);
    Dataset coalesced = graph.coalesce(source, 3);
    Dataset shuffled = graph.coalesce(source, 20, true);

    Dependency edge = coalesced.getDependencies().get(0);
    assertFalse(edge.isWide());
    assertEquals(PartitionMapping.coalesce(10, 3), edge.getPartitionMapping().orElseThrow());
    assertEquals(PartitioningScheme.unconstrained(3), coalesced.getPartitioning());
    assertTrue(shuffled.getDependencies().get(0).isWide());
    assertEquals(PartitioningScheme.unconstrained(20), shuffled.getPartitioning());
  }

  @Test
  void should_stack_union_partitions() {
    Dataset first = graph.source("a", 2);
    Dataset second = graph.source("b", 3);
    Dataset union = graph.union(first, second);

    assertEquals(PartitioningScheme.unconstrained(5), union.getPartitioning());
    assertEquals(
        PartitionMapping.range(0, 2, 3),
        union.getDependencies().get(1).getPartitionMapping().orElseThrow());
  }

  @Test
  void should_keep_common_partitioning_through_union() {
    PartitioningScheme scheme = PartitioningScheme.hash(KEY, 4);
    Dataset union =
        graph.union(graph.partitionedSource("a", scheme), graph.partitionedSource("b", scheme));

    assertEquals(scheme, union.getPartitioning());
    union
        .getDependencies()
        .forEach(d -> assertEquals(PartitionMapping.oneToOne(), d.getPartitionMapping().get()));
  }

  @Test
  void should_stream_the_large_side_of_a_broadcast_join() {
    Dataset large = graph.partitionedSource("facts", PartitioningScheme.hash(KEY, 16));
    Dataset small = graph.broadcastSource("dimension");
    Dataset joined = graph.join(large, small, KEY);

    assertFalse(joined.getDependencies().get(0).isWide());
    assertTrue(joined.getDependencies().get(1).isWide());
    assertEquals(large.getPartitioning(), joined.getPartitioning());
    assertTrue(joined.getRequiredPartitioning().isEmpty());
  }

  @Test
  void should_reject_parent_of_another_graph() {
    Dataset foreign = new LineageGraph(PlannerConfig.defaults()).source("other", 2);
    graph.source("events", 2);

    DatasetNotFoundException e =
        assertThrows(DatasetNotFoundException.class, () -> graph.map(foreign));
    assertEquals(0, e.getDatasetId());
  }

  @Test
  void should_reject_wrong_parent_count() {
    Dataset source = graph.source("events", 2);

    assertThrows(
        IllegalArgumentException.class,
        () -> graph.derive("bad", Transformation.join(KEY, null), List.of(source)));
    assertThrows(IllegalArgumentException.class, () -> graph.union());
  }

  @Test
  void should_serialize_concurrent_appends() throws Exception {
    Dataset source = graph.source("events", 4);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<List<Dataset>>> tasks = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        tasks.add(
            () -> {
              List<Dataset> created = new ArrayList<>();
              Dataset current = source;
              for (int i = 0; i < 50; i++) {
                current = graph.map(current);
                created.add(current);
              }
              return created;
            });
      }
      Set<Integer> ids = new HashSet<>();
      for (Future<List<Dataset>> future : executor.invokeAll(tasks)) {
        for (Dataset dataset : future.get()) {
          assertTrue(ids.add(dataset.getId()));
          assertSame(dataset, graph.getDataset(dataset.getId()));
          assertTrue(dataset.getParentIds().get(0) < dataset.getId());
        }
      }
      assertEquals(401, graph.size());
      assertEquals(401, graph.getDatasets().size());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void should_name_unnamed_datasets_independently_of_default_locale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      Dataset filtered = graph.filter(graph.source("events", 4));

      assertEquals("filter-" + filtered.getId(), filtered.getName());
      assertTrue(filtered.getTransformation().toString().startsWith("filter"));
    } finally {
      Locale.setDefault(previous);
    }
  }
}
