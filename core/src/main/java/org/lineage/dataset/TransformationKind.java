/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operation that produced a dataset. */
@RequiredArgsConstructor
public enum TransformationKind {
  SOURCE(false, false),
  MAP(false, false),
  FILTER(false, false),
  FLAT_MAP(false, false),
  MAP_VALUES(false, false),
  MAP_PARTITIONS(false, false),
  COALESCE(false, false),
  UNION(false, false),
  GROUP_BY_KEY(true, false),
  REDUCE_BY_KEY(true, true),
  AGGREGATE_BY_KEY(true, true),
  JOIN(true, false),
  COGROUP(true, false),
  REPARTITION(false, false),
  PARTITION_BY(false, false),
  SORT_BY_KEY(false, false);

  /** True for operations that group records by a key function. */
  @Getter private final boolean keyed;

  /** True if values may be pre-aggregated before the shuffle. */
  @Getter private final boolean mapSideCombine;
}
