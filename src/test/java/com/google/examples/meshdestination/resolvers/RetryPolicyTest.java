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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

public class RetryPolicyTest {

  @Test
  void exponentialBackoffIsCapped() {
    RetryPolicy policy = RetryPolicy.DEFAULT;
    assertEquals(Duration.ofMillis(100), policy.backoff(1));
    assertEquals(Duration.ofMillis(200), policy.backoff(2));
    assertEquals(Duration.ofMillis(400), policy.backoff(3));
    assertEquals(Duration.ofMillis(3200), policy.backoff(6));
    assertEquals(Duration.ofSeconds(5), policy.backoff(7));
    assertEquals(Duration.ofSeconds(5), policy.backoff(1000));
  }

  @Test
  void invalidPolicies() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new RetryPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 3));
    assertThrows(
        IllegalArgumentException.class,
        () -> new RetryPolicy(Duration.ofMillis(1), Duration.ofSeconds(1), 0));
  }
}
