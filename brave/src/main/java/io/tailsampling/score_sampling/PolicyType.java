/*
 * Copyright 2019-2020 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package io.tailsampling.score_sampling;

import brave.internal.Nullable;
import java.util.Locale;

public enum PolicyType {
  /** Samples traces by {@link ModelConfig model score}. */
  MODEL("model"),
  /** Holds {@link PolicyConfig#subPolicies() sub-policies}. */
  POLICY_GROUP("policy_group");

  final String configName;

  PolicyType(String configName) {
    this.configName = configName;
  }

  /** The name of this type in YAML configuration, ex. {@code policy_group}. */
  public String configName() {
    return configName;
  }

  /** Returns the type with the given configuration name, or null if there is none. */
  @Nullable public static PolicyType fromConfigName(String configName) {
    if (configName == null) throw new NullPointerException("configName == null");
    String lowercase = configName.toLowerCase(Locale.ROOT);
    for (PolicyType type : values()) {
      if (type.configName.equals(lowercase)) return type;
    }
    return null;
  }
}
