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

package com.google.examples.meshdestination.config;

import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.meshdestination.resolvers.RetryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class DestinationConfigTest {

  @Test
  void defaults() {
    DestinationConfig config = DestinationConfig.defaults();
    assertEquals("cluster.local", config.clusterDomain());
    assertEquals("cluster.local", config.identityTrustDomain());
    assertNull(config.kubecontext());
    assertEquals(100, config.subscriptionBufferCapacity());
    assertEquals(Duration.ZERO, config.watchLinger());
    assertEquals(RetryPolicy.DEFAULT, config.retryPolicy());
    assertTrue(config.remoteClusters().isEmpty());
    assertTrue(config.defaultOpaquePorts().contains(3306));
    assertTrue(config.defaultOpaquePorts().contains(11211));
    assertFalse(config.defaultOpaquePorts().contains(80));
    assertTrue(config.enableH2Upgrade());
  }

  @Test
  void opaquePortsAndUpgrade() {
    var config =
        new DestinationConfig(
            Map.<String, Object>of("defaultOpaquePorts", "", "enableH2Upgrade", false));
    assertTrue(config.defaultOpaquePorts().isEmpty());
    assertFalse(config.enableH2Upgrade());
  }

  @Test
  void partialRetrySection() {
    var config = new DestinationConfig(Map.<String, Object>of("retry", Map.of("maxAttempts", 2)));
    assertEquals(2, config.retryPolicy().maxAttempts());
    assertEquals(RetryPolicy.DEFAULT.initialBackoff(), config.retryPolicy().initialBackoff());
  }

  @Test
  void invalidSettings() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new DestinationConfig(Map.<String, Object>of("subscriptionBufferCapacity", 0)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DestinationConfig(Map.<String, Object>of("watchLingerMillis", -1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DestinationConfig(Map.<String, Object>of("watchLingerMillis", "5s")));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DestinationConfig(Map.<String, Object>of("clusterDomain", 42)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DestinationConfig(Map.<String, Object>of("defaultOpaquePorts", "3306,mysql")));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DestinationConfig(Map.<String, Object>of("enableH2Upgrade", "yes")));
  }

  @Test
  void remoteClusterNameIsRequired() {
    var e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new RemoteCluster(Map.<String, Object>of("kubecontext", "kind-west")));
    assertTrue(e.getMessage().contains("name"));
    assertThrows(
        IllegalArgumentException.class, () -> new RemoteCluster(" ", null, "cluster.local"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DestinationConfig(Map.<String, Object>of("remoteClusters", List.of(Map.of()))));
  }
}
