/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.exception;

import lombok.Getter;

/** A wide dependency has no partition count: none requested, inherited or configured. */
public class UnresolvedPartitionCountException extends StructuralException {

  private static final long serialVersionUID = 1L;

  @Getter private final int parentId;
  @Getter private final int childId;

  public UnresolvedPartitionCountException(int parentId, int childId, String detail) {
    super(
        "Wide dependency "
            + parentId
            + " -> "
            + childId
            + " has no resolvable partition count ("
            + detail
            + ")");
    this.parentId = parentId;
    this.childId = childId;
  }
}
