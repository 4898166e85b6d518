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
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.schema.CoreSchema;

/**
 * Maps YAML onto {@link TailSamplingConfig}. Keys use the snake_case names of the collector
 * configuration, ex. {@code target_traces_per_sec}.
 *
 * <p><pre>{@code
 * policies:
 *   - name: slow-or-broken
 *     type: model
 *     priority: 1
 *     model:
 *       type: linear
 *       threshold: 2.0
 *       weights: { duration_ms: 0.01, has_error: 2.0, span_count: 0.1 }
 *       adaptive:
 *         enabled: true
 *         window_duration: 30s
 *         target_traces_per_sec: 10
 * }</pre>
 */
final class TailSamplingConfigParser {

  static TailSamplingConfig parse(String yaml) {
    Object root;
    try {
      root = newLoad().loadFromString(yaml);
    } catch (YamlEngineException e) {
      throw new IllegalArgumentException("invalid tail sampling YAML: " + e.getMessage(), e);
    }
    return toConfig(root);
  }

  static TailSamplingConfig parse(InputStream yaml) {
    Object root;
    try {
      root = newLoad().loadFromInputStream(yaml);
    } catch (YamlEngineException e) {
      throw new IllegalArgumentException("invalid tail sampling YAML: " + e.getMessage(), e);
    }
    return toConfig(root);
  }

  static Load newLoad() {
    LoadSettings settings = LoadSettings.builder()
      .setLabel("tail sampling config")
      .setSchema(new CoreSchema())
      .build();
    return new Load(settings);
  }

  static TailSamplingConfig toConfig(Object root) {
    TailSamplingConfig result = TailSamplingConfig.create();
    if (root == null) return result; // empty document

    Map<String, Object> map = asMap("root", root);
    for (Object entry : asList("policies", map.get("policies"))) {
      result.addPolicy(toPolicy("policies", entry));
    }
    return result;
  }

  static PolicyConfig toPolicy(String key, Object value) {
    Map<String, Object> map = asMap(key, value);
    Object name = map.get("name");
    if (name == null) throw new IllegalArgumentException(key + ".name is required");

    PolicyConfig result = PolicyConfig.create(name.toString());
    String path = key + "[" + name + "]";

    Object type = map.get("type");
    if (type != null) {
      PolicyType policyType = PolicyType.fromConfigName(type.toString());
      if (policyType == null) {
        throw new IllegalArgumentException(path + ".type: unsupported policy type " + type);
      }
      result.type(policyType);
    }
    if (map.containsKey("priority")) result.priority(toInt(path + ".priority", map.get("priority")));
    if (map.get("model") != null) result.model(toModel(path + ".model", map.get("model")));
    for (Object sub : asList(path + ".sub_policies", map.get("sub_policies"))) {
      result.addSubPolicy(toPolicy(path + ".sub_policies", sub));
    }
    return result;
  }

  static ModelConfig toModel(String key, Object value) {
    Map<String, Object> map = asMap(key, value);
    ModelConfig result = ModelConfig.create();
    if (map.get("type") != null) result.type(map.get("type").toString());
    if (map.containsKey("threshold")) {
      result.threshold(toDouble(key + ".threshold", map.get("threshold")));
    }
    if (map.containsKey("intercept")) {
      result.intercept(toDouble(key + ".intercept", map.get("intercept")));
    }
    if (map.get("weights") != null) {
      for (Map.Entry<String, Object> weight : asMap(key + ".weights", map.get("weights")).entrySet()) {
        String weightKey = key + ".weights." + weight.getKey();
        result.weight(weight.getKey(), toDouble(weightKey, weight.getValue()));
      }
    }
    if (map.get("adaptive") != null) {
      result.adaptive(toAdaptive(key + ".adaptive", map.get("adaptive")));
    }
    return result;
  }

  static AdaptiveConfig toAdaptive(String key, Object value) {
    Map<String, Object> map = asMap(key, value);
    AdaptiveConfig result = AdaptiveConfig.create();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      String name = entry.getKey(), path = key + "." + name;
      Object v = entry.getValue();
      if (v == null) continue;
      switch (name) {
        case "enabled":
          result.enabled(toBoolean(path, v));
          break;
        case "window_duration":
          result.windowDuration(toDuration(path, v));
          break;
        case "recompute_interval":
          result.recomputeInterval(toDuration(path, v));
          break;
        case "max_samples":
          result.maxSamples(toInt(path, v));
          break;
        case "target_traces_per_sec":
          result.targetTracesPerSec(toDouble(path, v));
          break;
        case "keep_ratio":
          result.keepRatio(toDouble(path, v));
          break;
        case "min_keep_ratio":
          result.minKeepRatio(toDouble(path, v));
          break;
        case "max_keep_ratio":
          result.maxKeepRatio(toDouble(path, v));
          break;
        case "always_keep_errors":
          result.alwaysKeepErrors(toBoolean(path, v));
          break;
        case "sla_duration_ms":
          result.slaDurationMs(toDouble(path, v));
          break;
        case "violation_rate_threshold":
          result.violationRateThreshold(toDouble(path, v));
          break;
        case "incident_keep_ratio":
          result.incidentKeepRatio(toDouble(path, v));
          break;
        default:
          throw new IllegalArgumentException(path + ": unknown key");
      }
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> asMap(String key, Object value) {
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException(key + ": expected a mapping but was " + value);
    }
    for (Object mapKey : ((Map<?, ?>) value).keySet()) {
      if (!(mapKey instanceof String)) {
        throw new IllegalArgumentException(key + ": expected string keys but found " + mapKey);
      }
    }
    return (Map<String, Object>) value;
  }

  static List<?> asList(String key, Object value) {
    if (value == null) return Collections.emptyList();
    if (!(value instanceof List)) {
      throw new IllegalArgumentException(key + ": expected a list but was " + value);
    }
    return (List<?>) value;
  }

  static double toDouble(String key, Object value) {
    if (value instanceof Number) return ((Number) value).doubleValue();
    if (value instanceof String) {
      String s = ((String) value).trim().toLowerCase(Locale.ROOT);
      if (s.equals(".nan")) return Double.NaN;
      if (s.equals(".inf") || s.equals("+.inf")) return Double.POSITIVE_INFINITY;
      if (s.equals("-.inf")) return Double.NEGATIVE_INFINITY;
      try {
        return Double.parseDouble(s);
      } catch (NumberFormatException e) {
        // fall through to the error below
      }
    }
    throw new IllegalArgumentException(key + ": expected a number but was " + value);
  }

  static int toInt(String key, Object value) {
    if (value instanceof Integer || value instanceof Long) {
      long l = ((Number) value).longValue();
      if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return (int) l;
    } else if (value instanceof String) {
      try {
        return Integer.parseInt(((String) value).trim());
      } catch (NumberFormatException e) {
        // fall through to the error below
      }
    }
    throw new IllegalArgumentException(key + ": expected an integer but was " + value);
  }

  static boolean toBoolean(String key, Object value) {
    if (value instanceof Boolean) return (Boolean) value;
    if ("true".equals(value)) return true;
    if ("false".equals(value)) return false;
    throw new IllegalArgumentException(key + ": expected true or false but was " + value);
  }

  static Duration toDuration(String key, Object value) {
    if (value instanceof Integer || value instanceof Long) {
      return Duration.ofMillis(((Number) value).longValue()); // bare integers are milliseconds
    }
    if (value instanceof String) {
      Duration result = parseDuration((String) value);
      if (result != null) return result;
    }
    throw new IllegalArgumentException(key + ": expected a duration like 30s but was " + value);
  }

  /**
   * Parses a sequence of decimal numbers with units, such as {@code 1m30s} or {@code 1.5h}. Valid
   * units are "ns", "us" (or "µs"), "ms", "s", "m" and "h". Returns null when malformed.
   */
  @Nullable static Duration parseDuration(String input) {
    String s = input.trim();
    if (s.isEmpty()) return null;

    boolean negative = false;
    if (s.charAt(0) == '-' || s.charAt(0) == '+') {
      negative = s.charAt(0) == '-';
      s = s.substring(1);
    }
    if (s.equals("0")) return Duration.ZERO;
    if (s.isEmpty()) return null;

    BigDecimal totalNanos = BigDecimal.ZERO;
    int i = 0;
    while (i < s.length()) {
      int numberStart = i;
      while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) i++;
      if (numberStart == i) return null;
      BigDecimal number;
      try {
        number = new BigDecimal(s.substring(numberStart, i));
      } catch (NumberFormatException e) {
        return null;
      }

      int unitStart = i;
      while (i < s.length() && !Character.isDigit(s.charAt(i)) && s.charAt(i) != '.') i++;
      long nanosPerUnit = nanosPerUnit(s.substring(unitStart, i));
      if (nanosPerUnit == 0L) return null;
      totalNanos = totalNanos.add(number.multiply(BigDecimal.valueOf(nanosPerUnit)));
    }

    long nanos;
    try {
      nanos = totalNanos.longValueExact();
    } catch (ArithmeticException e) {
      // fractional nanoseconds truncate, overflow is malformed
      if (totalNanos.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) return null;
      nanos = totalNanos.longValue();
    }
    return Duration.ofNanos(negative ? -nanos : nanos);
  }

  static long nanosPerUnit(String unit) {
    switch (unit) {
      case "ns":
        return 1L;
      case "us":
      case "µs":
        return 1_000L;
      case "ms":
        return 1_000_000L;
      case "s":
        return 1_000_000_000L;
      case "m":
        return 60_000_000_000L;
      case "h":
        return 3_600_000_000_000L;
      default:
        return 0L; // unknown unit
    }
  }

  TailSamplingConfigParser() {
  }
}
