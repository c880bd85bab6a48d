/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner.classifier;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.lineage.dataset.Dataset;
import org.lineage.dataset.Dependency;
import org.lineage.dataset.DependencyKind;
import org.lineage.dataset.Transformation;
import org.lineage.dataset.TransformationKind;
import org.lineage.partition.DefaultPartitionCountProvider;
import org.lineage.partition.KeyFunction;
import org.lineage.partition.PartitionMapping;
import org.lineage.partition.PartitioningScheme;
import org.lineage.planner.compatibility.PartitionerCompatibilityAnalyzer;

/**
 * Classifies the parent edges of a new dataset as narrow or wide and derives the dataset's own
 * partitioning and, for wide operations, the partitioning its input must have.
 *
 * <p>Element-wise operations, in-place coalesce and union are narrow. Key-redistributing operations
 * are wide, whatever the parent partitioning: whether the shuffle can be skipped is decided later
 * by the {@link PartitionerCompatibilityAnalyzer}.
 */
@Log4j2
@RequiredArgsConstructor
public class DependencyClassifier {

  private final PartitionerCompatibilityAnalyzer compatibilityAnalyzer;
  private final DefaultPartitionCountProvider defaultPartitionCountProvider;

  /**
   * Classifies one parent edge.
   *
   * @param kind transformation applied to the parent
   * @param parentPartitioning partitioning of the parent
   * @param parameters transformation parameters
   * @return the dependency kind
   */
  public DependencyKind classify(
      TransformationKind kind, PartitioningScheme parentPartitioning, Transformation parameters) {
    Preconditions.checkNotNull(parentPartitioning, "Parent partitioning is required");
    return switch (kind) {
      case MAP, FILTER, FLAT_MAP, MAP_VALUES, MAP_PARTITIONS, UNION -> DependencyKind.NARROW;
      case COALESCE -> parameters.isShuffle() ? DependencyKind.WIDE : DependencyKind.NARROW;
      case GROUP_BY_KEY,
          REDUCE_BY_KEY,
          AGGREGATE_BY_KEY,
          JOIN,
          COGROUP,
          REPARTITION,
          PARTITION_BY,
          SORT_BY_KEY -> DependencyKind.WIDE;
      case SOURCE -> throw new IllegalArgumentException("A source has no parent edges");
    };
  }

  /**
   * Classifies every parent edge of a dataset about to be created.
   *
   * @param childId id the new dataset will get
   * @param transformation operation producing the dataset
   * @param parents parent datasets in declaration order
   * @return edges and partitionings of the new dataset
   */
  public Classification classifyDataset(
      int childId, Transformation transformation, List<Dataset> parents) {
    checkArity(transformation.getKind(), parents);
    TransformationKind kind = transformation.getKind();

    if (isBroadcastJoin(kind, parents)) {
      return classifyBroadcastJoin(childId, parents);
    }

    PartitioningScheme required = requiredPartitioning(transformation, parents);
    List<Dependency> dependencies = new ArrayList<>(parents.size());
    List<PartitionMapping> unionMappings =
        kind == TransformationKind.UNION ? unionMappings(parents) : List.of();
    for (int i = 0; i < parents.size(); i++) {
      Dataset parent = parents.get(i);
      DependencyKind dependencyKind = classify(kind, parent.getPartitioning(), transformation);
      if (dependencyKind == DependencyKind.WIDE) {
        dependencies.add(Dependency.wide(parent.getId(), childId));
      } else {
        PartitionMapping mapping =
            kind == TransformationKind.UNION
                ? unionMappings.get(i)
                : narrowMapping(transformation, parent);
        dependencies.add(Dependency.narrow(parent.getId(), childId, mapping));
      }
    }
    PartitioningScheme partitioning = outputPartitioning(transformation, parents, required);
    log.debug(
        "Classified {} over {}: edges {}, partitioning {}, required {}",
        transformation,
        parents.stream().map(Dataset::getId).collect(Collectors.toList()),
        dependencies.stream().map(Dependency::getKind).collect(Collectors.toList()),
        partitioning,
        required);
    return new Classification(dependencies, partitioning, required);
  }

  private void checkArity(TransformationKind kind, List<Dataset> parents) {
    switch (kind) {
      case SOURCE -> throw new IllegalArgumentException("Sources are not derived from parents");
      case JOIN -> Preconditions.checkArgument(
          parents.size() == 2, "join takes 2 parents but got %s", parents.size());
      case UNION, COGROUP -> Preconditions.checkArgument(
          !parents.isEmpty(), "%s needs at least one parent", kind);
      default -> Preconditions.checkArgument(
          parents.size() == 1, "%s takes 1 parent but got %s", kind, parents.size());
    }
  }

  /**
   * A keyed multi-parent operation where every parent but one is a broadcast source. The remaining
   * parent is streamed in place, so its edge is narrow.
   */
  private boolean isBroadcastJoin(TransformationKind kind, List<Dataset> parents) {
    if (kind != TransformationKind.JOIN && kind != TransformationKind.COGROUP) {
      return false;
    }
    long broadcast = parents.stream().filter(Dataset::isBroadcast).count();
    return broadcast > 0 && broadcast == parents.size() - 1;
  }

  private Classification classifyBroadcastJoin(int childId, List<Dataset> parents) {
    List<Dependency> dependencies = new ArrayList<>(parents.size());
    Dataset streamed = null;
    for (Dataset parent : parents) {
      if (parent.isBroadcast()) {
        dependencies.add(Dependency.wide(parent.getId(), childId));
      } else {
        streamed = parent;
        dependencies.add(
            Dependency.narrow(parent.getId(), childId, PartitionMapping.oneToOne()));
      }
    }
    log.debug("Dataset {} is a broadcast join streaming dataset {}", childId, streamed.getId());
    return new Classification(dependencies, streamed.getPartitioning(), null);
  }

  private PartitioningScheme requiredPartitioning(
      Transformation transformation, List<Dataset> parents) {
    TransformationKind kind = transformation.getKind();
    OptionalInt defaultCount = defaultPartitionCountProvider.getDefaultPartitionCount();
    if (kind.isKeyed()) {
      List<PartitioningScheme> shuffled =
          parents.stream()
              .filter(p -> !p.isBroadcast())
              .map(Dataset::getPartitioning)
              .collect(Collectors.toList());
      return compatibilityAnalyzer.resolveRequiredPartitioning(
          transformation.getKeyFunction().orElseThrow(),
          transformation.getPartitionCount(),
          shuffled,
          defaultCount);
    }
    return switch (kind) {
      case PARTITION_BY -> transformation.getPartitioning().orElseThrow();
      case REPARTITION -> PartitioningScheme.unconstrained(
          transformation.getPartitionCount().getAsInt());
      case COALESCE -> transformation.isShuffle()
          ? PartitioningScheme.unconstrained(transformation.getPartitionCount().getAsInt())
          : null;
      case SORT_BY_KEY -> sortPartitioning(transformation, parents.get(0), defaultCount);
      default -> null;
    };
  }

  private PartitioningScheme sortPartitioning(
      Transformation transformation, Dataset parent, OptionalInt defaultCount) {
    KeyFunction key = transformation.getKeyFunction().orElseThrow();
    if (!transformation.getRangeBoundaries().isEmpty()) {
      return PartitioningScheme.range(key, transformation.getRangeBoundaries());
    }
    OptionalInt count = transformation.getPartitionCount();
    if (count.isEmpty()) {
      count = parent.getPartitioning().getPartitionCount();
    }
    if (count.isEmpty()) {
      count = defaultCount;
    }
    return count.isPresent()
        ? PartitioningScheme.range(key, count.getAsInt())
        : PartitioningScheme.rangeUnresolved(key);
  }

  private PartitionMapping narrowMapping(Transformation transformation, Dataset parent) {
    if (transformation.getKind() != TransformationKind.COALESCE) {
      return PartitionMapping.oneToOne();
    }
    OptionalInt parentCount = parent.getPartitioning().getPartitionCount();
    if (parentCount.isEmpty()) {
      return null;
    }
    int target = Math.min(transformation.getPartitionCount().getAsInt(), parentCount.getAsInt());
    return PartitionMapping.coalesce(parentCount.getAsInt(), target);
  }

  /** Partitioner-aware union reads partition {@code i} of every parent, otherwise parents stack. */
  private List<PartitionMapping> unionMappings(List<Dataset> parents) {
    List<PartitionMapping> mappings = new ArrayList<>(parents.size());
    if (commonKeyedPartitioning(parents) != null) {
      parents.forEach(p -> mappings.add(PartitionMapping.oneToOne()));
      return mappings;
    }
    boolean countsKnown =
        parents.stream().allMatch(p -> p.getPartitioning().hasPartitionCount());
    int offset = 0;
    for (Dataset parent : parents) {
      if (!countsKnown) {
        mappings.add(null);
        continue;
      }
      int count = parent.getPartitioning().getPartitionCount().getAsInt();
      mappings.add(PartitionMapping.range(0, offset, count));
      offset += count;
    }
    return mappings;
  }

  private PartitioningScheme commonKeyedPartitioning(List<Dataset> parents) {
    PartitioningScheme first = parents.get(0).getPartitioning();
    boolean common =
        first.isKeyed()
            && first.hasPartitionCount()
            && parents.stream().allMatch(p -> p.getPartitioning().equals(first));
    return common ? first : null;
  }

  private PartitioningScheme outputPartitioning(
      Transformation transformation, List<Dataset> parents, PartitioningScheme required) {
    PartitioningScheme parentPartitioning = parents.get(0).getPartitioning();
    return switch (transformation.getKind()) {
      case MAP, FILTER, MAP_VALUES -> parentPartitioning;
      case MAP_PARTITIONS -> transformation.isPreservesPartitioning()
          ? parentPartitioning
          : withoutPlacement(parentPartitioning);
      case FLAT_MAP -> withoutPlacement(parentPartitioning);
      case COALESCE -> {
        if (transformation.isShuffle()) {
          yield required;
        }
        int target = transformation.getPartitionCount().getAsInt();
        OptionalInt parentCount = parentPartitioning.getPartitionCount();
        yield PartitioningScheme.unconstrained(
            parentCount.isPresent() ? Math.min(target, parentCount.getAsInt()) : target);
      }
      case UNION -> unionPartitioning(parents);
      default -> required;
    };
  }

  private PartitioningScheme withoutPlacement(PartitioningScheme partitioning) {
    return partitioning.hasPartitionCount()
        ? PartitioningScheme.unconstrained(partitioning.getPartitionCount().getAsInt())
        : PartitioningScheme.unknown();
  }

  private PartitioningScheme unionPartitioning(List<Dataset> parents) {
    PartitioningScheme common = commonKeyedPartitioning(parents);
    if (common != null) {
      return common;
    }
    if (parents.stream().allMatch(p -> p.getPartitioning().hasPartitionCount())) {
      return PartitioningScheme.unconstrained(
          parents.stream()
              .mapToInt(p -> p.getPartitioning().getPartitionCount().getAsInt())
              .sum());
    }
    return PartitioningScheme.unknown();
  }
}
