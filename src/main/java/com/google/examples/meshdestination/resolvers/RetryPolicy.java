// Copyright 2023 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.examples.meshdestination.resolvers;

import java.time.Duration;
import org.jetbrains.annotations.NotNull;

/**
 * Exponential backoff for establishing watches on cluster state.
 *
 * @param initialBackoff delay after the first failed attempt
 * @param maxBackoff upper bound for the delay
 * @param maxAttempts attempts before the failure is considered permanent
 */
public record RetryPolicy(
    @NotNull Duration initialBackoff, @NotNull Duration maxBackoff, int maxAttempts) {

  public static final RetryPolicy DEFAULT =
      new RetryPolicy(Duration.ofMillis(100), Duration.ofSeconds(5), 10);

  /** Canonical constructor. */
  public RetryPolicy {
    if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException(
          "backoff must satisfy 0 <= initialBackoff <= maxBackoff, got initialBackoff="
              + initialBackoff
              + " maxBackoff="
              + maxBackoff);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
    }
  }

  /** Delay before the next attempt, after {@code failedAttempts} failures (1 or more). */
  @NotNull
  public Duration backoff(int failedAttempts) {
    Duration backoff = initialBackoff;
    for (int i = 1; i < failedAttempts && backoff.compareTo(maxBackoff) < 0; i++) {
      backoff = backoff.multipliedBy(2);
    }
    return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
  }
}
