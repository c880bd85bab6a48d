/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.exception;

import lombok.Getter;

/** A dataset id does not resolve to a dataset of the lineage graph. */
public class DatasetNotFoundException extends StructuralException {

  private static final long serialVersionUID = 1L;

  @Getter private final int datasetId;

  public DatasetNotFoundException(int datasetId) {
    super("Dataset " + datasetId + " does not exist in the lineage graph");
    this.datasetId = datasetId;
  }
}
