/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.common.setting;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Immutable {@link Settings} backed by a map. Raw string values (for example from a properties
 * file) are converted to the key's value type when the settings are created.
 */
@ToString
@EqualsAndHashCode(callSuper = false)
public class StaticSettings extends Settings {

  private final Map<Key, Object> values;

  private StaticSettings(Map<Key, Object> values) {
    this.values = ImmutableMap.copyOf(values);
  }

  public static StaticSettings empty() {
    return new StaticSettings(Map.of());
  }

  /**
   * Creates settings from typed values.
   *
   * @param values values keyed by setting key
   * @return settings
   */
  public static StaticSettings of(Map<Key, ?> values) {
    ImmutableMap.Builder<Key, Object> builder = ImmutableMap.builder();
    values.forEach((key, value) -> builder.put(key, convert(key, value)));
    return new StaticSettings(builder.build());
  }

  /**
   * Creates settings from raw key strings such as {@code planner.default.parallelism}. Unknown
   * keys are rejected.
   *
   * @param rawValues values keyed by setting name
   * @return settings
   */
  public static StaticSettings fromStrings(Map<String, String> rawValues) {
    ImmutableMap.Builder<Key, Object> builder = ImmutableMap.builder();
    rawValues.forEach(
        (name, value) -> {
          Key key =
              Key.of(name)
                  .orElseThrow(() -> new IllegalArgumentException("Unknown setting: " + name));
          builder.put(key, convert(key, value));
        });
    return new StaticSettings(builder.build());
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public boolean hasSetting(Key key) {
    return values.containsKey(key);
  }

  private static Object convert(Key key, Object value) {
    Preconditions.checkArgument(value != null, "Setting %s has no value", key.getKeyValue());
    if (key.getValueType().isInstance(value)) {
      return value;
    }
    String text = value.toString().trim();
    if (key.getValueType() == Integer.class) {
      try {
        return Integer.valueOf(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Setting " + key.getKeyValue() + " expects an integer but was: " + text, e);
      }
    }
    if (key.getValueType() == Boolean.class) {
      Preconditions.checkArgument(
          "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text),
          "Setting %s expects true or false but was: %s",
          key.getKeyValue(),
          text);
      return Boolean.valueOf(text);
    }
    throw new IllegalArgumentException(
        "Unsupported value type for setting " + key.getKeyValue() + ": " + key.getValueType());
  }
}
