/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.exception;

import java.util.List;
import lombok.Getter;

/** The planner produced a stage graph that fails validation. */
public class PlanInconsistencyException extends PlanningException {

  private static final long serialVersionUID = 1L;

  @Getter private final List<String> errors;

  public PlanInconsistencyException(int targetId, List<String> errors) {
    super("Inconsistent plan for dataset " + targetId + ": " + String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }
}
