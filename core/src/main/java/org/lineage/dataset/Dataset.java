/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.lineage.partition.PartitioningScheme;

/**
 * Immutable description of one transformation's output: its parents, its partitioning, and for
 * wide operations the partitioning its input must be arranged in.
 *
 * <p>Parents are referenced by id. The owning {@link LineageGraph} hands out fully constructed
 * datasets only; nothing about a dataset changes after creation.
 */
public final class Dataset {

  private final int id;
  private final String name;
  private final DatasetKind kind;
  private final Transformation transformation;
  private final List<Dependency> dependencies;
  private final PartitioningScheme partitioning;
  private final PartitioningScheme requiredPartitioning;

  public Dataset(
      int id,
      String name,
      DatasetKind kind,
      Transformation transformation,
      List<Dependency> dependencies,
      PartitioningScheme partitioning,
      PartitioningScheme requiredPartitioning) {
    Preconditions.checkArgument(id >= 0, "Dataset id must be >= 0");
    Preconditions.checkNotNull(kind, "Dataset kind is required");
    Preconditions.checkNotNull(transformation, "Transformation is required");
    Preconditions.checkNotNull(partitioning, "Partitioning is required");
    Preconditions.checkArgument(
        kind == DatasetKind.DERIVED || dependencies.isEmpty(),
        "%s dataset %s cannot have parents",
        kind,
        id);
    this.id = id;
    this.name = name;
    this.kind = kind;
    this.transformation = transformation;
    this.dependencies = Collections.unmodifiableList(List.copyOf(dependencies));
    this.partitioning = partitioning;
    this.requiredPartitioning = requiredPartitioning;
  }

  public int getId() {
    return id;
  }

  /** Returns the display name, defaulting to the transformation and id. */
  public String getName() {
    return name != null
        ? name
        : transformation.getKind().name().toLowerCase(Locale.ROOT) + "-" + id;
  }

  public DatasetKind getKind() {
    return kind;
  }

  public Transformation getTransformation() {
    return transformation;
  }

  /** Returns the parent edges in declaration order. */
  public List<Dependency> getDependencies() {
    return dependencies;
  }

  public List<Integer> getParentIds() {
    return dependencies.stream().map(Dependency::getParentId).collect(Collectors.toList());
  }

  public PartitioningScheme getPartitioning() {
    return partitioning;
  }

  /** Returns the partitioning a wide operation needs its input in. */
  public Optional<PartitioningScheme> getRequiredPartitioning() {
    return Optional.ofNullable(requiredPartitioning);
  }

  /** Returns true if this dataset reads from outside the graph. */
  public boolean isSource() {
    return kind != DatasetKind.DERIVED;
  }

  public boolean isBroadcast() {
    return kind == DatasetKind.BROADCAST_SOURCE;
  }

  @Override
  public String toString() {
    return "Dataset{id="
        + id
        + ", name='"
        + getName()
        + "', "
        + transformation
        + ", partitioning="
        + partitioning
        + ", parents="
        + getParentIds()
        + '}';
  }
}
