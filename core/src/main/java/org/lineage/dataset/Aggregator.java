/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

/**
 * Reference to the combine logic of a keyed aggregation. The planner passes it through to shuffle
 * descriptors and never invokes it.
 */
@FunctionalInterface
public interface Aggregator {

  /** Returns a name identifying the aggregation, used in plan output. */
  String getName();
}
