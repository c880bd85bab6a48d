/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.dataset;

import java.util.Optional;
import org.lineage.exception.DatasetNotFoundException;

/** Read-only access to the datasets of a lineage graph. */
public interface LineageView {

  /**
   * Looks up a dataset by id.
   *
   * @param datasetId dataset id
   * @return the dataset, or empty if the graph has no such dataset
   */
  Optional<Dataset> findDataset(int datasetId);

  /**
   * Returns the dataset with the given id.
   *
   * @throws DatasetNotFoundException if the graph has no such dataset
   */
  default Dataset getDataset(int datasetId) {
    return findDataset(datasetId).orElseThrow(() -> new DatasetNotFoundException(datasetId));
  }

  /** Returns the number of datasets in the graph. */
  int size();
}
