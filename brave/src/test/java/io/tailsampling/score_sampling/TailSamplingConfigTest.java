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

import java.time.Duration;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TailSamplingConfigTest {
  @Test public void validate_modelPolicy() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create()
        .type("linear")
        .threshold(0.5)
        .intercept(0.1)
        .weight("duration_ms", 1.0)
        .weight("span_count", 0.25)
        .weight("has_error", 10.0)
    ));

    config.validate(); // doesn't throw
  }

  @Test public void validate_adaptiveModelPolicy() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create()
        .type("linear")
        .weight("duration_ms", 1.0)
        .adaptive(AdaptiveConfig.create()
          .enabled(true)
          .windowDuration(Duration.ofSeconds(30))
          .recomputeInterval(Duration.ofSeconds(5))
          .maxSamples(2048)
          .targetTracesPerSec(10)
          .alwaysKeepErrors(true))
    ));

    config.validate(); // doesn't throw
  }

  /** A disabled adaptive section is not validated */
  @Test public void validate_disabledAdaptiveIgnored() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create()
        .weight("duration_ms", 1.0)
        .adaptive(AdaptiveConfig.create())
    ));

    config.validate(); // doesn't throw
  }

  @Test public void validate_adaptiveMissingTargets() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create()
        .weight("duration_ms", 1.0)
        .adaptive(AdaptiveConfig.create()
          .enabled(true)
          .windowDuration(Duration.ofSeconds(30))
          .recomputeInterval(Duration.ofSeconds(5))
          .maxSamples(100))
    ));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model.adaptive requires target_traces_per_sec");
  }

  @Test public void validate_adaptiveKeepRatioIsEnough() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create()
        .weight("duration_ms", 1.0)
        .adaptive(AdaptiveConfig.create().enabled(true).keepRatio(0.1))
    ));

    config.validate(); // doesn't throw
  }

  @Test public void validate_missingModelConfig() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(null));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model config is required");
  }

  @Test public void validate_emptyWeights() {
    TailSamplingConfig config =
      TailSamplingConfig.create().addPolicy(modelPolicy(ModelConfig.create()));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model.weights must not be empty");
  }

  @Test public void validate_unknownFeature() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create().weight("unknown", 1.0)
    ));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("unsupported feature")
      .hasMessageContaining("unknown");
  }

  @Test public void validate_nanThreshold() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create().threshold(Double.NaN).weight("duration_ms", 1.0)
    ));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model.threshold must be a finite number");
  }

  @Test public void validate_infiniteIntercept() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create().intercept(Double.POSITIVE_INFINITY).weight("duration_ms", 1.0)
    ));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model.intercept must be a finite number");
  }

  @Test public void validate_unsupportedModelType() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create().type("gbdt").weight("duration_ms", 1.0)
    ));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model.type must be linear");
  }

  @Test public void validate_keepRatioOutOfRange() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create()
        .weight("duration_ms", 1.0)
        .adaptive(AdaptiveConfig.create().enabled(true).targetTracesPerSec(10).maxKeepRatio(1.5))
    ));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model.adaptive.max_keep_ratio must be between 0 and 1");
  }

  @Test public void validate_negativeMaxSamples() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(modelPolicy(
      ModelConfig.create()
        .weight("duration_ms", 1.0)
        .adaptive(AdaptiveConfig.create().enabled(true).keepRatio(0.5).maxSamples(-1))
    ));

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("model.adaptive.max_samples must not be negative");
  }

  @Test public void validate_subPolicyErrorsIncludePath() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(
      PolicyConfig.create("group")
        .type(PolicyType.POLICY_GROUP)
        .priority(1)
        .addSubPolicy(PolicyConfig.create("sub")
          .type(PolicyType.MODEL)
          .priority(1)
          .model(ModelConfig.create()))
    );

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("group/sub")
      .hasMessageContaining("model.weights must not be empty");
  }

  @Test public void validate_priorityMustBeSet() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(
      PolicyConfig.create("missing-priority").type(PolicyType.POLICY_GROUP)
    );

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("missing-priority")
      .hasMessageContaining("priority must be greater than 0");
  }

  @Test public void validate_subPolicyPriorityMustBeSet() {
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(
      PolicyConfig.create("group")
        .type(PolicyType.POLICY_GROUP)
        .priority(1)
        .addSubPolicy(PolicyConfig.create("sub")
          .type(PolicyType.MODEL)
          .model(ModelConfig.create().weight("has_error", 1.0)))
    );

    assertThatThrownBy(config::validate)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("group/sub: priority must be greater than 0");
  }

  @Test public void policy_lookupByName() {
    PolicyConfig policy = modelPolicy(ModelConfig.create().weight("has_error", 1.0));
    TailSamplingConfig config = TailSamplingConfig.create().addPolicy(policy);

    assertThat(config.policy("model-policy")).isSameAs(policy);
    assertThat(config.policy("other")).isNull();
  }

  @Test public void policyToString_usesConfigName() {
    PolicyConfig group = PolicyConfig.create("group").type(PolicyType.POLICY_GROUP).priority(2);

    assertThat(group.toString())
      .startsWith("PolicyConfig(name=group, type=policy_group, priority=2");
    assertThat(PolicyType.fromConfigName(PolicyType.POLICY_GROUP.configName()))
      .isSameAs(PolicyType.POLICY_GROUP);
  }

  static PolicyConfig modelPolicy(ModelConfig model) {
    return PolicyConfig.create("model-policy")
      .type(PolicyType.MODEL)
      .priority(1)
      .model(model);
  }
}
