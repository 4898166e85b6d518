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

import java.util.Arrays;

/**
 * Fixed-capacity ring of the most recent scores. Once full, each add overwrites the oldest score.
 *
 * <p>This type is not thread-safe: {@link AdaptiveLinearModelSampler} guards it with its lock.
 */
final class RecentScores {
  final double[] scores;
  int size, nextIndex;
  boolean filled;

  /** A capacity of zero or less keeps no scores. */
  RecentScores(int capacity) {
    this.scores = new double[Math.max(capacity, 0)];
  }

  int capacity() {
    return scores.length;
  }

  int size() {
    return size;
  }

  /** True after the ring has wrapped at least once. */
  boolean filled() {
    return filled;
  }

  void add(double score) {
    if (scores.length == 0) return;

    if (size < scores.length) {
      scores[size++] = score;
      return;
    }

    scores[nextIndex++] = score;
    if (nextIndex >= scores.length) {
      nextIndex = 0;
      filled = true;
    }
  }

  /**
   * Returns the score at quantile {@code q} of a sorted copy of the ring, or NaN when empty.
   *
   * <p>The index is {@code ceil(q * (n - 1))}, which rounds toward higher scores.
   */
  double quantile(double q) {
    if (size == 0) return Double.NaN;
    if (q <= 0) return min();
    if (q >= 1) return max();

    double[] sorted = Arrays.copyOf(scores, size);
    Arrays.sort(sorted);

    int index = (int) Math.ceil(q * (sorted.length - 1));
    if (index < 0) index = 0;
    if (index >= sorted.length) index = sorted.length - 1;
    return sorted[index];
  }

  double min() {
    double result = scores[0];
    for (int i = 1; i < size; i++) {
      if (scores[i] < result) result = scores[i];
    }
    return result;
  }

  double max() {
    double result = scores[0];
    for (int i = 1; i < size; i++) {
      if (scores[i] > result) result = scores[i];
    }
    return result;
  }

  @Override public String toString() {
    return "RecentScores(size=" + size + ", capacity=" + scores.length + ")";
  }
}
