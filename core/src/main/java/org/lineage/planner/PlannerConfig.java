/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.planner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.log4j.Log4j2;
import org.lineage.common.setting.Settings;
import org.lineage.common.setting.StaticSettings;
import org.lineage.partition.DefaultPartitionCountProvider;

/**
 * Planner configuration. Passed explicitly to the lineage graph and to the planner so that
 * planning never reads ambient state.
 */
@Log4j2
@ToString
@EqualsAndHashCode
public final class PlannerConfig implements DefaultPartitionCountProvider {

  public static final int DEFAULT_PARALLELISM = 200;

  private final Integer defaultParallelism;

  /** Whether finished stage graphs are validated before they are returned. */
  @Getter private final boolean validationEnabled;

  /** Whether stages sharing narrow ancestors are merged. */
  @Getter private final boolean stageMergeEnabled;

  private PlannerConfig(
      Integer defaultParallelism, boolean validationEnabled, boolean stageMergeEnabled) {
    Preconditions.checkArgument(
        defaultParallelism == null || defaultParallelism > 0,
        "Default parallelism must be positive but was %s",
        defaultParallelism);
    this.defaultParallelism = defaultParallelism;
    this.validationEnabled = validationEnabled;
    this.stageMergeEnabled = stageMergeEnabled;
  }

  /** Parallelism {@value #DEFAULT_PARALLELISM}, validation and stage merging enabled. */
  public static PlannerConfig defaults() {
    return new PlannerConfig(DEFAULT_PARALLELISM, true, true);
  }

  public static PlannerConfig withDefaultParallelism(int defaultParallelism) {
    return new PlannerConfig(defaultParallelism, true, true);
  }

  /** Configuration without a default partition count. */
  public static PlannerConfig withoutDefaultParallelism() {
    return new PlannerConfig(null, true, true);
  }

  /**
   * Builds a configuration from settings. Absent settings take their default values.
   *
   * @param settings planner settings
   * @return configuration
   */
  public static PlannerConfig fromSettings(Settings settings) {
    return new PlannerConfig(
        settings.getSettingValue(Settings.Key.PLANNER_DEFAULT_PARALLELISM, DEFAULT_PARALLELISM),
        settings.getSettingValue(Settings.Key.PLANNER_VALIDATION_ENABLED, true),
        settings.getSettingValue(Settings.Key.PLANNER_STAGE_MERGE_ENABLED, true));
  }

  /**
   * Reads a JSON object of settings, e.g. {@code {"planner.default.parallelism": 64}}.
   *
   * @param inputStream JSON input
   * @return configuration
   */
  public static PlannerConfig fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(inputStream, new TypeReference<>() {});
    } catch (IOException e) {
      log.error("Planner configuration is malformed.", e);
      throw new IllegalArgumentException(
          "Malformed planner configuration json: " + e.getMessage(), e);
    }
    Map<String, String> values = new LinkedHashMap<>();
    raw.forEach((key, value) -> values.put(key, String.valueOf(value)));
    return fromSettings(StaticSettings.fromStrings(values));
  }

  public PlannerConfig withValidationEnabled(boolean enabled) {
    return new PlannerConfig(defaultParallelism, enabled, stageMergeEnabled);
  }

  public PlannerConfig withStageMergeEnabled(boolean enabled) {
    return new PlannerConfig(defaultParallelism, validationEnabled, enabled);
  }

  @Override
  public OptionalInt getDefaultPartitionCount() {
    return defaultParallelism == null ? OptionalInt.empty() : OptionalInt.of(defaultParallelism);
  }
}
