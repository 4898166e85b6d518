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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of the tail sampling configuration: an ordered list of {@link PolicyConfig policies}.
 *
 * <p>Configuration is typically read from YAML, then {@link #validate() validated} once before
 * any evaluator is built:
 * <pre>{@code
 * TailSamplingConfig config = TailSamplingConfig.parse(yaml);
 * config.validate();
 * PolicyEvaluator evaluator = ModelSamplers.create(config.policy("slow-or-broken"));
 * }</pre>
 */
public final class TailSamplingConfig {
  public static TailSamplingConfig create() {
    return new TailSamplingConfig();
  }

  /** Reads YAML with a root {@code policies} list. This doesn't {@link #validate() validate}. */
  public static TailSamplingConfig parse(String yaml) {
    if (yaml == null) throw new NullPointerException("yaml == null");
    return TailSamplingConfigParser.parse(yaml);
  }

  /** Like {@link #parse(String)}, except reading UTF-8 from a stream. */
  public static TailSamplingConfig parse(InputStream yaml) {
    if (yaml == null) throw new NullPointerException("yaml == null");
    return TailSamplingConfigParser.parse(yaml);
  }

  final List<PolicyConfig> policies = new ArrayList<>();

  public List<PolicyConfig> policies() {
    return Collections.unmodifiableList(policies);
  }

  public TailSamplingConfig addPolicy(PolicyConfig policy) {
    if (policy == null) throw new NullPointerException("policy == null");
    policies.add(policy);
    return this;
  }

  /** Returns the top-level policy with the given name, or null if there is none. */
  @Nullable public PolicyConfig policy(String name) {
    if (name == null) throw new NullPointerException("name == null");
    for (PolicyConfig policy : policies) {
      if (policy.name.equals(name)) return policy;
    }
    return null;
  }

  /**
   * Checks every policy, including sub-policies of groups.
   *
   * @throws IllegalArgumentException naming the first invalid policy and why it is invalid
   */
  public void validate() {
    for (PolicyConfig policy : policies) {
      validatePolicy(policy.name, policy);
      for (PolicyConfig subPolicy : policy.subPolicies) {
        validatePolicy(policy.name + "/" + subPolicy.name, subPolicy);
      }
    }
  }

  static void validatePolicy(String path, PolicyConfig policy) {
    if (policy.priority <= 0) throw invalid(path, "priority must be greater than 0");
    if (policy.type == null) throw invalid(path, "type is required");
    if (policy.type == PolicyType.MODEL) validateModel(path, policy.model);
  }

  static void validateModel(String path, @Nullable ModelConfig model) {
    if (model == null) throw invalid(path, "model config is required");
    if (!model.type.isEmpty() && !ModelConfig.LINEAR.equals(model.type)) {
      throw invalid(path, "model.type must be " + ModelConfig.LINEAR + ", was " + model.type);
    }
    if (model.weights.isEmpty()) throw invalid(path, "model.weights must not be empty");
    for (String feature : model.weights.keySet()) {
      if (!ModelFeatures.SUPPORTED.contains(feature)) {
        throw invalid(path, "unsupported feature \"" + feature + "\" in model.weights; supported: "
          + ModelFeatures.SUPPORTED);
      }
    }
    if (!LinearModel.isValid(model.threshold)) {
      throw invalid(path, "model.threshold must be a finite number");
    }
    if (!LinearModel.isValid(model.intercept)) {
      throw invalid(path, "model.intercept must be a finite number");
    }
    if (model.isAdaptive()) validateAdaptive(path, model.adaptive);
  }

  static void validateAdaptive(String path, AdaptiveConfig adaptive) {
    if (!(adaptive.targetTracesPerSec > 0) && !(adaptive.keepRatio > 0)) {
      throw invalid(path, "model.adaptive requires target_traces_per_sec or keep_ratio");
    }
    if (adaptive.maxSamples < 0) {
      throw invalid(path, "model.adaptive.max_samples must not be negative");
    }
    if (adaptive.windowDuration.isNegative()) {
      throw invalid(path, "model.adaptive.window_duration must not be negative");
    }
    if (adaptive.recomputeInterval.isNegative()) {
      throw invalid(path, "model.adaptive.recompute_interval must not be negative");
    }
    validateRatio(path, "keep_ratio", adaptive.keepRatio);
    validateRatio(path, "min_keep_ratio", adaptive.minKeepRatio);
    validateRatio(path, "max_keep_ratio", adaptive.maxKeepRatio);
    validateRatio(path, "incident_keep_ratio", adaptive.incidentKeepRatio);
  }

  static void validateRatio(String path, String name, double ratio) {
    if (!(ratio >= 0 && ratio <= 1)) {
      throw invalid(path, "model.adaptive." + name + " must be between 0 and 1");
    }
  }

  static IllegalArgumentException invalid(String path, String message) {
    return new IllegalArgumentException(path + ": " + message);
  }

  @Override public String toString() {
    return "TailSamplingConfig(policies=" + policies + ")";
  }
}
