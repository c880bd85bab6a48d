/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.exception;

/** The lineage graph is malformed. */
public class StructuralException extends PlanningException {

  private static final long serialVersionUID = 1L;

  public StructuralException(String message) {
    super(message);
  }
}
