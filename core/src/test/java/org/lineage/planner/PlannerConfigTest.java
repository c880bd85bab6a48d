/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lineage.common.setting.Settings;
import org.lineage.common.setting.StaticSettings;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlannerConfigTest {

  @Test
  void should_use_defaults_for_empty_settings() {
    PlannerConfig config = PlannerConfig.fromSettings(StaticSettings.empty());

    assertEquals(PlannerConfig.defaults(), config);
    assertEquals(
        OptionalInt.of(PlannerConfig.DEFAULT_PARALLELISM), config.getDefaultPartitionCount());
    assertTrue(config.isValidationEnabled());
    assertTrue(config.isStageMergeEnabled());
  }

  @Test
  void should_read_settings() {
    PlannerConfig config =
        PlannerConfig.fromSettings(
            StaticSettings.of(
                Map.of(
                    Settings.Key.PLANNER_DEFAULT_PARALLELISM, 12,
                    Settings.Key.PLANNER_VALIDATION_ENABLED, false)));

    assertEquals(OptionalInt.of(12), config.getDefaultPartitionCount());
    assertFalse(config.isValidationEnabled());
    assertTrue(config.isStageMergeEnabled());
  }

  @Test
  void should_load_json_configuration() throws Exception {
    try (InputStream in = getClass().getResourceAsStream("/planner-config.json")) {
      PlannerConfig config = PlannerConfig.fromInputStream(in);

      assertEquals(OptionalInt.of(64), config.getDefaultPartitionCount());
      assertTrue(config.isValidationEnabled());
      assertFalse(config.isStageMergeEnabled());
    }
  }

  @Test
  void should_reject_malformed_json() {
    InputStream in = new ByteArrayInputStream("{not json".getBytes(StandardCharsets.UTF_8));

    assertThrows(IllegalArgumentException.class, () -> PlannerConfig.fromInputStream(in));
  }

  @Test
  void should_reject_unknown_setting_and_non_positive_parallelism() {
    InputStream unknown =
        new ByteArrayInputStream(
            "{\"planner.unknown\": 1}".getBytes(StandardCharsets.UTF_8));

    assertThrows(IllegalArgumentException.class, () -> PlannerConfig.fromInputStream(unknown));
    assertThrows(IllegalArgumentException.class, () -> PlannerConfig.withDefaultParallelism(0));
  }

  @Test
  void should_copy_with_changed_flags() {
    PlannerConfig config =
        PlannerConfig.withoutDefaultParallelism()
            .withValidationEnabled(false)
            .withStageMergeEnabled(false);

    assertTrue(config.getDefaultPartitionCount().isEmpty());
    assertFalse(config.isValidationEnabled());
    assertFalse(config.isStageMergeEnabled());
  }
}
