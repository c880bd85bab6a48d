/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.partition;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Describes how the records of a dataset are assigned to partitions. Instances are immutable and
 * compare by value.
 */
public final class PartitioningScheme {

  private static final PartitioningScheme UNKNOWN =
      new PartitioningScheme(PartitioningType.NONE, null, null, List.of(), null);

  private final PartitioningType type;
  private final KeyFunction keyFunction;
  private final Integer partitionCount;
  private final List<Object> rangeBoundaries;
  private final String partitionerName;

  private PartitioningScheme(
      PartitioningType type,
      KeyFunction keyFunction,
      Integer partitionCount,
      List<Object> rangeBoundaries,
      String partitionerName) {
    this.type = type;
    this.keyFunction = keyFunction;
    this.partitionCount = partitionCount;
    this.rangeBoundaries = Collections.unmodifiableList(rangeBoundaries);
    this.partitionerName = partitionerName;
  }

  /** Creates a NONE partitioning with an unknown partition count. */
  public static PartitioningScheme unknown() {
    return UNKNOWN;
  }

  /** Creates a NONE partitioning with a known partition count and no placement guarantee. */
  public static PartitioningScheme unconstrained(int partitionCount) {
    checkCount(partitionCount);
    return new PartitioningScheme(PartitioningType.NONE, null, partitionCount, List.of(), null);
  }

  /** Creates a HASH partitioning on the given key. */
  public static PartitioningScheme hash(KeyFunction keyFunction, int partitionCount) {
    Preconditions.checkNotNull(keyFunction, "Hash partitioning requires a key function");
    checkCount(partitionCount);
    return new PartitioningScheme(
        PartitioningType.HASH, keyFunction, partitionCount, List.of(), null);
  }

  /**
   * Creates a HASH partitioning whose partition count could not be resolved. Planning a shuffle
   * into such a scheme fails.
   */
  public static PartitioningScheme hashUnresolved(KeyFunction keyFunction) {
    Preconditions.checkNotNull(keyFunction, "Hash partitioning requires a key function");
    return new PartitioningScheme(PartitioningType.HASH, keyFunction, null, List.of(), null);
  }

  /** Creates a RANGE partitioning whose boundaries are sampled at execution time. */
  public static PartitioningScheme range(KeyFunction keyFunction, int partitionCount) {
    Preconditions.checkNotNull(keyFunction, "Range partitioning requires a key function");
    checkCount(partitionCount);
    return new PartitioningScheme(
        PartitioningType.RANGE, keyFunction, partitionCount, List.of(), null);
  }

  /** Creates a RANGE partitioning whose partition count could not be resolved. */
  public static PartitioningScheme rangeUnresolved(KeyFunction keyFunction) {
    Preconditions.checkNotNull(keyFunction, "Range partitioning requires a key function");
    return new PartitioningScheme(PartitioningType.RANGE, keyFunction, null, List.of(), null);
  }

  /**
   * Creates a RANGE partitioning with explicit, ascending boundaries. {@code n} boundaries produce
   * {@code n + 1} partitions.
   */
  public static PartitioningScheme range(KeyFunction keyFunction, List<?> boundaries) {
    Preconditions.checkNotNull(keyFunction, "Range partitioning requires a key function");
    Preconditions.checkArgument(!boundaries.isEmpty(), "Range boundaries must not be empty");
    return new PartitioningScheme(
        PartitioningType.RANGE,
        keyFunction,
        boundaries.size() + 1,
        List.<Object>copyOf(boundaries),
        null);
  }

  /** Creates a CUSTOM partitioning identified by the partitioner's name. */
  public static PartitioningScheme custom(String partitionerName, int partitionCount) {
    Preconditions.checkArgument(
        partitionerName != null && !partitionerName.isEmpty(), "Partitioner name is required");
    checkCount(partitionCount);
    return new PartitioningScheme(
        PartitioningType.CUSTOM, null, partitionCount, List.of(), partitionerName);
  }

  public PartitioningType getType() {
    return type;
  }

  /** Returns the key function for HASH and RANGE partitionings. */
  public Optional<KeyFunction> getKeyFunction() {
    return Optional.ofNullable(keyFunction);
  }

  public OptionalInt getPartitionCount() {
    return partitionCount == null ? OptionalInt.empty() : OptionalInt.of(partitionCount);
  }

  public boolean hasPartitionCount() {
    return partitionCount != null;
  }

  /** Returns explicit range boundaries. Empty for sampled ranges and other families. */
  public List<Object> getRangeBoundaries() {
    return rangeBoundaries;
  }

  public Optional<String> getPartitionerName() {
    return Optional.ofNullable(partitionerName);
  }

  /** Returns true if records with equal keys are known to be co-located. */
  public boolean isKeyed() {
    return type != PartitioningType.NONE;
  }

  private static void checkCount(int partitionCount) {
    Preconditions.checkArgument(
        partitionCount > 0, "Partition count must be positive but was %s", partitionCount);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitioningScheme)) {
      return false;
    }
    PartitioningScheme that = (PartitioningScheme) o;
    return type == that.type
        && Objects.equals(keyFunction, that.keyFunction)
        && Objects.equals(partitionCount, that.partitionCount)
        && rangeBoundaries.equals(that.rangeBoundaries)
        && Objects.equals(partitionerName, that.partitionerName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, keyFunction, partitionCount, rangeBoundaries, partitionerName);
  }

  @Override
  public String toString() {
    String count = partitionCount == null ? "?" : partitionCount.toString();
    switch (type) {
      case HASH:
        return "hash(" + keyFunction + ", " + count + ")";
      case RANGE:
        return rangeBoundaries.isEmpty()
            ? "range(" + keyFunction + ", " + count + ")"
            : "range(" + keyFunction + ", " + rangeBoundaries + ")";
      case CUSTOM:
        return "custom(" + partitionerName + ", " + count + ")";
      default:
        return "none(" + count + ")";
    }
  }
}
