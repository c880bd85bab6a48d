/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.partition;

/** Family of a {@link PartitioningScheme}. */
public enum PartitioningType {
  /** Record placement is unknown or unconstrained (source splits, round-robin, coalesced). */
  NONE,

  /** Records are placed by hashing a key. */
  HASH,

  /** Records are placed by comparing a key against ordered boundaries. */
  RANGE,

  /** Records are placed by a user supplied partitioner. */
  CUSTOM
}
