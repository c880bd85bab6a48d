/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner;

import org.lineage.dataset.Dataset;
import org.lineage.planner.stage.StageGraph;

/**
 * Cuts the lineage of an action's target dataset into stages. Walks the lineage backward from the
 * target, keeps datasets connected by narrow edges in one stage and inserts a shuffle at every wide
 * edge whose parent is not already partitioned as required.
 *
 * <p>Stage boundaries are inserted at:
 *
 * <ul>
 *   <li>Key-redistributing operations on incompatibly partitioned parents
 *   <li>Repartitioning and shuffling coalesce
 * </ul>
 *
 * <p>Broadcast sources never produce a stage of their own.
 */
public interface StagePlanner {

  /**
   * Plans the computation of a dataset.
   *
   * @param target the dataset an action asks for
   * @return the stage graph computing it
   * @throws org.lineage.exception.PlanningException if the lineage cannot be planned
   */
  StageGraph plan(Dataset target);

  /**
   * Plans the computation of the dataset with the given id.
   *
   * @param targetId id of the dataset an action asks for
   * @return the stage graph computing it
   */
  StageGraph plan(int targetId);
}
