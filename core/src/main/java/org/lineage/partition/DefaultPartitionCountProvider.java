/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.partition;

import java.util.OptionalInt;

/** Supplies the partition count used by wide operations that do not request one. */
@FunctionalInterface
public interface DefaultPartitionCountProvider {

  /** Returns the default partition count, or empty if none is configured. */
  OptionalInt getDefaultPartitionCount();
}
