/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.common.setting;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Planner settings. Values are looked up by {@link Key}. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Partition count used by wide operations that do not request one. */
    PLANNER_DEFAULT_PARALLELISM("planner.default.parallelism", Integer.class),

    /** Whether a finished stage graph is validated before it is returned. */
    PLANNER_VALIDATION_ENABLED("planner.validation.enabled", Boolean.class),

    /** Whether stages sharing narrow ancestors are merged. */
    PLANNER_STAGE_MERGE_ENABLED("planner.stage.merge.enabled", Boolean.class);

    @Getter private final String keyValue;

    @Getter private final Class<?> valueType;

    private static final Map<String, Key> ALL_KEYS =
        Arrays.stream(Key.values()).collect(Collectors.toMap(Key::getKeyValue, Function.identity()));

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /**
   * Get the value of a setting.
   *
   * @param key setting key
   * @return the value, or null if the setting is not set
   */
  public abstract <T> T getSettingValue(Key key);

  /** Returns true if a value has been set for the key. */
  public abstract boolean hasSetting(Key key);

  /**
   * Get the value of a setting, falling back to the given default when it is not set.
   *
   * @param key setting key
   * @param defaultValue value returned when the setting is absent
   */
  public <T> T getSettingValue(Key key, T defaultValue) {
    if (!hasSetting(key)) {
      return defaultValue;
    }
    T value = getSettingValue(key);
    return value == null ? defaultValue : value;
  }
}
