/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StaticSettingsTest {

  @Test
  void should_convert_raw_string_values() {
    Settings settings =
        StaticSettings.fromStrings(
            Map.of(
                "planner.default.parallelism", " 16 ",
                "planner.validation.enabled", "FALSE"));

    assertEquals(16, (Integer) settings.getSettingValue(Settings.Key.PLANNER_DEFAULT_PARALLELISM));
    assertFalse(settings.<Boolean>getSettingValue(Settings.Key.PLANNER_VALIDATION_ENABLED));
    assertFalse(settings.hasSetting(Settings.Key.PLANNER_STAGE_MERGE_ENABLED));
  }

  @Test
  void should_fall_back_to_default_value() {
    Settings settings = StaticSettings.empty();

    assertNull(settings.getSettingValue(Settings.Key.PLANNER_DEFAULT_PARALLELISM));
    assertEquals(8, (int) settings.getSettingValue(Settings.Key.PLANNER_DEFAULT_PARALLELISM, 8));
    assertTrue(settings.getSettingValue(Settings.Key.PLANNER_STAGE_MERGE_ENABLED, true));
  }

  @Test
  void should_keep_typed_values() {
    Settings settings = StaticSettings.of(Map.of(Settings.Key.PLANNER_DEFAULT_PARALLELISM, 4));

    assertEquals(4, (Integer) settings.getSettingValue(Settings.Key.PLANNER_DEFAULT_PARALLELISM));
  }

  @Test
  void should_reject_unknown_and_malformed_settings() {
    assertThrows(
        IllegalArgumentException.class,
        () -> StaticSettings.fromStrings(Map.of("planner.unknown", "1")));
    assertThrows(
        IllegalArgumentException.class,
        () -> StaticSettings.fromStrings(Map.of("planner.default.parallelism", "many")));
    assertThrows(
        IllegalArgumentException.class,
        () -> StaticSettings.fromStrings(Map.of("planner.validation.enabled", "yes")));
  }

  @Test
  void should_lookup_key_by_name() {
    assertEquals(
        Settings.Key.PLANNER_VALIDATION_ENABLED, Settings.Key.of("planner.validation.enabled").get());
    assertTrue(Settings.Key.of("plugins.ppl.enabled").isEmpty());
  }
}
