/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

/** How a child dataset's partitions depend on one parent's partitions. */
public enum DependencyKind {
  /** Each child partition reads a bounded, statically known set of one parent's partitions. */
  NARROW,

  /** A child partition may read records from any parent partition; keys must be co-located. */
  WIDE
}
