/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.lineage.exception.DatasetNotFoundException;
import org.lineage.partition.DefaultPartitionCountProvider;
import org.lineage.partition.KeyFunction;
import org.lineage.partition.PartitioningScheme;
import org.lineage.planner.classifier.Classification;
import org.lineage.planner.classifier.DependencyClassifier;
import org.lineage.planner.compatibility.PartitionerCompatibilityAnalyzer;

/**
 * Append-only arena of datasets addressed by integer id.
 *
 * <p>Appends are serialized. Readers never lock: a dataset is published only after it is fully
 * built, so concurrent planners see either nothing or the final dataset. Parents always exist
 * before their children, which keeps the graph acyclic.
 */
@Log4j2
public class LineageGraph implements LineageView {

  private final Map<Integer, Dataset> datasets = new ConcurrentHashMap<>();
  private final DependencyClassifier classifier;
  private int nextId = 0;

  public LineageGraph(DependencyClassifier classifier) {
    this.classifier = classifier;
  }

  public LineageGraph(DefaultPartitionCountProvider defaultPartitionCountProvider) {
    this(
        new DependencyClassifier(
            new PartitionerCompatibilityAnalyzer(), defaultPartitionCountProvider));
  }

  @Override
  public Optional<Dataset> findDataset(int datasetId) {
    return Optional.ofNullable(datasets.get(datasetId));
  }

  @Override
  public int size() {
    return datasets.size();
  }

  /** Returns a snapshot of all datasets in id order. */
  public List<Dataset> getDatasets() {
    return datasets.values().stream()
        .sorted(Comparator.comparingInt(Dataset::getId))
        .collect(Collectors.toList());
  }

  /** Adds a source with {@code partitionCount} splits and no placement guarantee. */
  public Dataset source(String name, int partitionCount) {
    return partitionedSource(name, PartitioningScheme.unconstrained(partitionCount));
  }

  /** Adds a source whose records are already placed by a known partitioning. */
  public synchronized Dataset partitionedSource(String name, PartitioningScheme partitioning) {
    return publish(
        new Dataset(
            nextId,
            name,
            DatasetKind.SOURCE,
            Transformation.source(partitioning),
            List.of(),
            partitioning,
            null));
  }

  /** Adds a source small enough to be looked up in memory by every consuming partition. */
  public synchronized Dataset broadcastSource(String name) {
    return publish(
        new Dataset(
            nextId,
            name,
            DatasetKind.BROADCAST_SOURCE,
            Transformation.source(PartitioningScheme.unknown()),
            List.of(),
            PartitioningScheme.unknown(),
            null));
  }

  /**
   * Derives a new dataset from parents of this graph.
   *
   * @param name display name, may be null
   * @param transformation operation producing the dataset
   * @param parents parent datasets in declaration order
   * @return the new dataset
   * @throws DatasetNotFoundException if a parent does not belong to this graph
   */
  public synchronized Dataset derive(
      String name, Transformation transformation, List<Dataset> parents) {
    Preconditions.checkNotNull(transformation, "Transformation is required");
    for (Dataset parent : parents) {
      Preconditions.checkNotNull(parent, "Parent dataset is required");
      if (datasets.get(parent.getId()) != parent) {
        throw new DatasetNotFoundException(parent.getId());
      }
    }
    Classification classification = classifier.classifyDataset(nextId, transformation, parents);
    return publish(
        new Dataset(
            nextId,
            name,
            DatasetKind.DERIVED,
            transformation,
            classification.getDependencies(),
            classification.getPartitioning(),
            classification.getRequiredPartitioning().orElse(null)));
  }

  private Dataset publish(Dataset dataset) {
    datasets.put(dataset.getId(), dataset);
    nextId++;
    log.debug("Added {}", dataset);
    return dataset;
  }

  public Dataset map(Dataset parent) {
    return derive(null, Transformation.map(), List.of(parent));
  }

  public Dataset filter(Dataset parent) {
    return derive(null, Transformation.filter(), List.of(parent));
  }

  public Dataset flatMap(Dataset parent) {
    return derive(null, Transformation.flatMap(), List.of(parent));
  }

  public Dataset mapValues(Dataset parent) {
    return derive(null, Transformation.mapValues(), List.of(parent));
  }

  public Dataset mapPartitions(Dataset parent, boolean preservesPartitioning) {
    return derive(null, Transformation.mapPartitions(preservesPartitioning), List.of(parent));
  }

  public Dataset coalesce(Dataset parent, int partitionCount) {
    return derive(null, Transformation.coalesce(partitionCount, false), List.of(parent));
  }

  public Dataset coalesce(Dataset parent, int partitionCount, boolean shuffle) {
    return derive(null, Transformation.coalesce(partitionCount, shuffle), List.of(parent));
  }

  public Dataset union(Dataset... parents) {
    return derive(null, Transformation.union(), Arrays.asList(parents));
  }

  public Dataset groupByKey(Dataset parent, KeyFunction key) {
    return derive(null, Transformation.groupByKey(key, null), List.of(parent));
  }

  public Dataset groupByKey(Dataset parent, KeyFunction key, int partitionCount) {
    return derive(null, Transformation.groupByKey(key, partitionCount), List.of(parent));
  }

  public Dataset reduceByKey(Dataset parent, KeyFunction key, Aggregator aggregator) {
    return derive(null, Transformation.reduceByKey(key, null, aggregator), List.of(parent));
  }

  public Dataset reduceByKey(
      Dataset parent, KeyFunction key, int partitionCount, Aggregator aggregator) {
    return derive(
        null, Transformation.reduceByKey(key, partitionCount, aggregator), List.of(parent));
  }

  public Dataset aggregateByKey(
      Dataset parent, KeyFunction key, Integer partitionCount, Aggregator aggregator) {
    return derive(
        null, Transformation.aggregateByKey(key, partitionCount, aggregator), List.of(parent));
  }

  public Dataset join(Dataset left, Dataset right, KeyFunction key) {
    return derive(null, Transformation.join(key, null), List.of(left, right));
  }

  public Dataset join(Dataset left, Dataset right, KeyFunction key, int partitionCount) {
    return derive(null, Transformation.join(key, partitionCount), List.of(left, right));
  }

  public Dataset cogroup(List<Dataset> parents, KeyFunction key, Integer partitionCount) {
    return derive(null, Transformation.cogroup(key, partitionCount), new ArrayList<>(parents));
  }

  public Dataset repartition(Dataset parent, int partitionCount) {
    return derive(null, Transformation.repartition(partitionCount), List.of(parent));
  }

  public Dataset partitionBy(Dataset parent, PartitioningScheme partitioning) {
    return derive(null, Transformation.partitionBy(partitioning), List.of(parent));
  }

  public Dataset sortByKey(Dataset parent, KeyFunction key, Integer partitionCount) {
    return derive(null, Transformation.sortByKey(key, partitionCount), List.of(parent));
  }

  public Dataset sortByKey(Dataset parent, KeyFunction key, List<?> boundaries) {
    return derive(null, Transformation.sortByKey(key, boundaries), List.of(parent));
  }
}
