/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.lineage.partition.KeyFunction;
import org.lineage.partition.PartitioningScheme;

/**
 * The operation that produced a dataset, together with the parameters the planner needs: key
 * function, requested partition count, target partitioning and the aggregator reference.
 */
@EqualsAndHashCode
public final class Transformation {

  @Getter private final TransformationKind kind;
  private final KeyFunction keyFunction;
  private final Integer partitionCount;
  private final PartitioningScheme partitioning;
  private final List<Object> rangeBoundaries;
  private final Aggregator aggregator;
  @Getter private final boolean preservesPartitioning;
  @Getter private final boolean shuffle;

  private Transformation(
      TransformationKind kind,
      KeyFunction keyFunction,
      Integer partitionCount,
      PartitioningScheme partitioning,
      List<Object> rangeBoundaries,
      Aggregator aggregator,
      boolean preservesPartitioning,
      boolean shuffle) {
    this.kind = kind;
    this.keyFunction = keyFunction;
    this.partitionCount = partitionCount;
    this.partitioning = partitioning;
    this.rangeBoundaries = rangeBoundaries;
    this.aggregator = aggregator;
    this.preservesPartitioning = preservesPartitioning;
    this.shuffle = shuffle;
  }

  private static Transformation of(TransformationKind kind) {
    return new Transformation(kind, null, null, null, List.of(), null, false, false);
  }

  private static Transformation keyed(
      TransformationKind kind, KeyFunction key, Integer partitionCount, Aggregator aggregator) {
    Preconditions.checkNotNull(key, "%s requires a key function", kind);
    checkCount(partitionCount);
    return new Transformation(kind, key, partitionCount, null, List.of(), aggregator, false, false);
  }

  public static Transformation source(PartitioningScheme partitioning) {
    Preconditions.checkNotNull(partitioning, "Source partitioning is required");
    return new Transformation(
        TransformationKind.SOURCE, null, null, partitioning, List.of(), null, false, false);
  }

  public static Transformation map() {
    return of(TransformationKind.MAP);
  }

  public static Transformation filter() {
    return of(TransformationKind.FILTER);
  }

  public static Transformation flatMap() {
    return of(TransformationKind.FLAT_MAP);
  }

  public static Transformation mapValues() {
    return of(TransformationKind.MAP_VALUES);
  }

  public static Transformation mapPartitions(boolean preservesPartitioning) {
    return new Transformation(
        TransformationKind.MAP_PARTITIONS,
        null,
        null,
        null,
        List.of(),
        null,
        preservesPartitioning,
        false);
  }

  /**
   * Merges partitions down to {@code partitionCount}. Without {@code shuffle} partitions are
   * concatenated in place; with it the data is redistributed round-robin.
   */
  public static Transformation coalesce(int partitionCount, boolean shuffle) {
    checkCount(partitionCount);
    return new Transformation(
        TransformationKind.COALESCE, null, partitionCount, null, List.of(), null, false, shuffle);
  }

  public static Transformation union() {
    return of(TransformationKind.UNION);
  }

  public static Transformation groupByKey(KeyFunction key, Integer partitionCount) {
    return keyed(TransformationKind.GROUP_BY_KEY, key, partitionCount, null);
  }

  public static Transformation reduceByKey(
      KeyFunction key, Integer partitionCount, Aggregator aggregator) {
    Preconditions.checkNotNull(aggregator, "reduceByKey requires an aggregator");
    return keyed(TransformationKind.REDUCE_BY_KEY, key, partitionCount, aggregator);
  }

  public static Transformation aggregateByKey(
      KeyFunction key, Integer partitionCount, Aggregator aggregator) {
    Preconditions.checkNotNull(aggregator, "aggregateByKey requires an aggregator");
    return keyed(TransformationKind.AGGREGATE_BY_KEY, key, partitionCount, aggregator);
  }

  public static Transformation join(KeyFunction key, Integer partitionCount) {
    return keyed(TransformationKind.JOIN, key, partitionCount, null);
  }

  public static Transformation cogroup(KeyFunction key, Integer partitionCount) {
    return keyed(TransformationKind.COGROUP, key, partitionCount, null);
  }

  /** Redistributes records round-robin into {@code partitionCount} partitions. */
  public static Transformation repartition(int partitionCount) {
    checkCount(partitionCount);
    return new Transformation(
        TransformationKind.REPARTITION, null, partitionCount, null, List.of(), null, false, true);
  }

  /** Redistributes records into the given keyed partitioning. */
  public static Transformation partitionBy(PartitioningScheme partitioning) {
    Preconditions.checkNotNull(partitioning, "partitionBy requires a partitioning");
    Preconditions.checkArgument(
        partitioning.isKeyed() && partitioning.hasPartitionCount(),
        "partitionBy requires a keyed partitioning with a partition count, got %s",
        partitioning);
    return new Transformation(
        TransformationKind.PARTITION_BY, null, null, partitioning, List.of(), null, false, true);
  }

  /** Sorts by key into range partitions whose boundaries are sampled at execution time. */
  public static Transformation sortByKey(KeyFunction key, Integer partitionCount) {
    return keyed(TransformationKind.SORT_BY_KEY, key, partitionCount, null);
  }

  /** Sorts by key into range partitions with explicit boundaries. */
  public static Transformation sortByKey(KeyFunction key, List<?> boundaries) {
    Preconditions.checkNotNull(key, "sortByKey requires a key function");
    Preconditions.checkArgument(!boundaries.isEmpty(), "Range boundaries must not be empty");
    return new Transformation(
        TransformationKind.SORT_BY_KEY,
        key,
        boundaries.size() + 1,
        null,
        List.<Object>copyOf(boundaries),
        null,
        false,
        false);
  }

  private static void checkCount(Integer partitionCount) {
    Preconditions.checkArgument(
        partitionCount == null || partitionCount > 0,
        "Partition count must be positive but was %s",
        partitionCount);
  }

  public Optional<KeyFunction> getKeyFunction() {
    return Optional.ofNullable(keyFunction);
  }

  /** Returns the partition count requested by the caller, if any. */
  public OptionalInt getPartitionCount() {
    return partitionCount == null ? OptionalInt.empty() : OptionalInt.of(partitionCount);
  }

  /** Returns the partitioning given to a source or to {@code partitionBy}. */
  public Optional<PartitioningScheme> getPartitioning() {
    return Optional.ofNullable(partitioning);
  }

  public List<Object> getRangeBoundaries() {
    return rangeBoundaries;
  }

  public Optional<Aggregator> getAggregator() {
    return Optional.ofNullable(aggregator);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.name().toLowerCase(Locale.ROOT));
    if (keyFunction != null || partitionCount != null) {
      sb.append('(');
      if (keyFunction != null) {
        sb.append(keyFunction);
        if (partitionCount != null) {
          sb.append(", ");
        }
      }
      if (partitionCount != null) {
        sb.append(partitionCount);
      }
      sb.append(')');
    }
    return sb.toString();
  }
}
