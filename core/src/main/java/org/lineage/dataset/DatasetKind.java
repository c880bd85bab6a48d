/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

/** Variant of a {@link Dataset}. */
public enum DatasetKind {
  /** Reads from storage outside the lineage graph. */
  SOURCE,

  /**
   * Small source resolved by in-memory lookup at every consuming partition. Never planned into a
   * stage and never shuffled.
   */
  BROADCAST_SOURCE,

  /** Produced by a transformation of one or more parents. */
  DERIVED
}
