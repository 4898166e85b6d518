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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One named entry of a {@link TailSamplingConfig}. A {@link PolicyType#POLICY_GROUP policy group}
 * nests further policies, which are validated under the path {@code group/sub}.
 */
public final class PolicyConfig {
  public static PolicyConfig create(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return new PolicyConfig(name);
  }

  final String name;
  @Nullable PolicyType type;
  int priority;
  @Nullable ModelConfig model;
  final List<PolicyConfig> subPolicies = new ArrayList<>();

  PolicyConfig(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Nullable public PolicyType type() {
    return type;
  }

  public PolicyConfig type(PolicyType type) {
    if (type == null) throw new NullPointerException("type == null");
    this.type = type;
    return this;
  }

  /** Must be greater than zero. Higher priority policies are consulted first. */
  public int priority() {
    return priority;
  }

  public PolicyConfig priority(int priority) {
    this.priority = priority;
    return this;
  }

  /** Required when the type is {@link PolicyType#MODEL}. */
  @Nullable public ModelConfig model() {
    return model;
  }

  public PolicyConfig model(@Nullable ModelConfig model) {
    this.model = model;
    return this;
  }

  public List<PolicyConfig> subPolicies() {
    return Collections.unmodifiableList(subPolicies);
  }

  public PolicyConfig addSubPolicy(PolicyConfig subPolicy) {
    if (subPolicy == null) throw new NullPointerException("subPolicy == null");
    subPolicies.add(subPolicy);
    return this;
  }

  @Override public String toString() {
    return "PolicyConfig(name=" + name + ", type=" + (type != null ? type.configName() : null)
      + ", priority=" + priority
      + ", model=" + model + ", subPolicies=" + subPolicies + ")";
  }
}
