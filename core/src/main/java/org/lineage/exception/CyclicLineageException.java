/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.exception;

import java.util.List;
import lombok.Getter;

/** A dataset was reached again while its own parents were still being planned. */
public class CyclicLineageException extends StructuralException {

  private static final long serialVersionUID = 1L;

  /** Dataset ids along the cycle, starting and ending with the same id. */
  @Getter private final List<Integer> cycle;

  public CyclicLineageException(List<Integer> cycle) {
    super("Lineage graph contains a cycle: " + cycle);
    this.cycle = List.copyOf(cycle);
  }
}
