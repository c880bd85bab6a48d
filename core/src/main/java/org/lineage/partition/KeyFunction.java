/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lineage.partition;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identity of a key-extraction function. The planner never evaluates keys; two partitionings use
 * the same key function only if their key functions are equal, i.e. carry the same name.
 */
@Getter
@EqualsAndHashCode
public final class KeyFunction {

  private final String name;

  private KeyFunction(String name) {
    this.name = name;
  }

  public static KeyFunction of(String name) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Key function name is required");
    return new KeyFunction(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
