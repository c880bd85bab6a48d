/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.compatibility;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import lombok.extern.log4j.Log4j2;
import org.lineage.dataset.Dataset;
import org.lineage.dataset.Dependency;
import org.lineage.dataset.LineageView;
import org.lineage.exception.UnresolvedPartitionCountException;
import org.lineage.partition.DefaultPartitionCountProvider;
import org.lineage.partition.KeyFunction;
import org.lineage.partition.PartitioningScheme;
import org.lineage.partition.PartitioningType;

/**
 * Decides whether a wide dependency really needs a shuffle. The check is structural: partitioning
 * family, key function identity and partition count. No statistics are consulted.
 */
@Log4j2
public class PartitionerCompatibilityAnalyzer {

  private final DefaultPartitionCountProvider defaultPartitionCountProvider;

  public PartitionerCompatibilityAnalyzer() {
    this(OptionalInt::empty);
  }

  /**
   * @param defaultPartitionCountProvider supplies the count for wide edges whose required
   *     partitioning was left unresolved when the lineage was built
   */
  public PartitionerCompatibilityAnalyzer(
      DefaultPartitionCountProvider defaultPartitionCountProvider) {
    this.defaultPartitionCountProvider =
        Preconditions.checkNotNull(
            defaultPartitionCountProvider, "Default partition count provider is required");
  }

  /**
   * Returns true unless the parent is already partitioned the way the operation requires.
   *
   * @param parentPartitioning partitioning of the parent dataset
   * @param requiredPartitioning partitioning the consuming operation needs
   * @return false if the shuffle can be elided
   */
  public boolean needsShuffle(
      PartitioningScheme parentPartitioning, PartitioningScheme requiredPartitioning) {
    Preconditions.checkNotNull(parentPartitioning, "Parent partitioning is required");
    Preconditions.checkNotNull(requiredPartitioning, "Required partitioning is required");

    // NONE on either side carries no co-location guarantee.
    if (parentPartitioning.getType() == PartitioningType.NONE
        || requiredPartitioning.getType() == PartitioningType.NONE) {
      return true;
    }
    if (parentPartitioning.getType() != requiredPartitioning.getType()) {
      return true;
    }
    if (!parentPartitioning.hasPartitionCount() || !requiredPartitioning.hasPartitionCount()) {
      return true;
    }
    if (parentPartitioning.getPartitionCount().getAsInt()
        != requiredPartitioning.getPartitionCount().getAsInt()) {
      return true;
    }
    switch (requiredPartitioning.getType()) {
      case HASH:
        return !parentPartitioning.getKeyFunction().equals(requiredPartitioning.getKeyFunction());
      case RANGE:
        // Sampled boundaries are only known at execution time, so they never match.
        return !parentPartitioning.getKeyFunction().equals(requiredPartitioning.getKeyFunction())
            || requiredPartitioning.getRangeBoundaries().isEmpty()
            || !parentPartitioning
                .getRangeBoundaries()
                .equals(requiredPartitioning.getRangeBoundaries());
      case CUSTOM:
        return !parentPartitioning
            .getPartitionerName()
            .equals(requiredPartitioning.getPartitionerName());
      default:
        return true;
    }
  }

  /**
   * Resolves the hash partitioning a keyed wide operation requires.
   *
   * <p>An explicit count wins. Otherwise the largest count among parents already hash partitioned
   * by the same key is used, so that those parents need no shuffle and smaller ones are moved up
   * to it. Otherwise the default count applies. With none of these the count stays unresolved.
   *
   * @param keyFunction key the operation groups by
   * @param explicitCount count requested by the operation
   * @param parentPartitionings partitionings of the parents that take part in the shuffle
   * @param defaultCount configured default count
   * @return the required partitioning
   */
  public PartitioningScheme resolveRequiredPartitioning(
      KeyFunction keyFunction,
      OptionalInt explicitCount,
      List<PartitioningScheme> parentPartitionings,
      OptionalInt defaultCount) {
    Preconditions.checkNotNull(keyFunction, "Key function is required");
    if (explicitCount.isPresent()) {
      return PartitioningScheme.hash(keyFunction, explicitCount.getAsInt());
    }
    OptionalInt inherited =
        parentPartitionings.stream()
            .filter(p -> p.getType() == PartitioningType.HASH)
            .filter(p -> p.getKeyFunction().map(keyFunction::equals).orElse(false))
            .filter(PartitioningScheme::hasPartitionCount)
            .mapToInt(p -> p.getPartitionCount().getAsInt())
            .max();
    if (inherited.isPresent()) {
      return PartitioningScheme.hash(keyFunction, inherited.getAsInt());
    }
    if (defaultCount.isPresent()) {
      return PartitioningScheme.hash(keyFunction, defaultCount.getAsInt());
    }
    return PartitioningScheme.hashUnresolved(keyFunction);
  }

  /**
   * Decides every parent edge of a dataset.
   *
   * @param child dataset whose parent edges are decided
   * @param lineage graph the parents are looked up in
   * @return one decision per parent edge, in edge order
   * @throws UnresolvedPartitionCountException if a wide edge needs a shuffle into a partitioning
   *     without a partition count
   */
  public List<EdgeDecision> analyze(Dataset child, LineageView lineage) {
    List<Dependency> dependencies = child.getDependencies();
    List<EdgeDecision> decisions = new ArrayList<>(dependencies.size());
    for (int i = 0; i < dependencies.size(); i++) {
      Dependency dependency = dependencies.get(i);
      Dataset parent = lineage.getDataset(dependency.getParentId());
      decisions.add(decide(child, parent, dependency, i));
    }
    return decisions;
  }

  private EdgeDecision decide(Dataset child, Dataset parent, Dependency dependency, int index) {
    if (parent.isBroadcast()) {
      return new EdgeDecision(dependency, index, EdgeDecision.Outcome.BROADCAST, null);
    }
    if (!dependency.isWide()) {
      return new EdgeDecision(dependency, index, EdgeDecision.Outcome.NARROW, null);
    }
    PartitioningScheme required =
        child
            .getRequiredPartitioning()
            .orElseThrow(
                () ->
                    new UnresolvedPartitionCountException(
                        parent.getId(), child.getId(), "no required partitioning"));
    if (!required.hasPartitionCount()) {
      required = resolveWithDefault(parent, child, required);
    }
    boolean shuffle = needsShuffle(parent.getPartitioning(), required);
    log.debug(
        "Wide edge {} -> {}: parent {}, required {}, shuffle {}",
        parent.getId(),
        child.getId(),
        parent.getPartitioning(),
        required,
        shuffle ? "needed" : "elided");
    return new EdgeDecision(
        dependency,
        index,
        shuffle ? EdgeDecision.Outcome.SHUFFLE : EdgeDecision.Outcome.ELIDED,
        required);
  }

  private PartitioningScheme resolveWithDefault(
      Dataset parent, Dataset child, PartitioningScheme required) {
    OptionalInt defaultCount = defaultPartitionCountProvider.getDefaultPartitionCount();
    KeyFunction key = required.getKeyFunction().orElse(null);
    if (defaultCount.isEmpty() || key == null) {
      throw new UnresolvedPartitionCountException(
          parent.getId(), child.getId(), "required partitioning " + required);
    }
    switch (required.getType()) {
      case HASH:
        return PartitioningScheme.hash(key, defaultCount.getAsInt());
      case RANGE:
        return PartitioningScheme.range(key, defaultCount.getAsInt());
      default:
        throw new UnresolvedPartitionCountException(
            parent.getId(), child.getId(), "required partitioning " + required);
    }
  }
}
