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

import com.google.common.collect.ImmutableRangeSet;
import com.google.examples.meshdestination.cluster.PortRanges;
import com.google.examples.meshdestination.resolvers.RetryPolicy;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Settings of the destination service.
 *
 * @param clusterDomain DNS domain of the local cluster, e.g., {@code cluster.local}
 * @param identityTrustDomain trust domain of workload identities in the local cluster
 * @param kubecontext kubeconfig context of the local cluster, or null for the current context or
 *     in-cluster config
 * @param subscriptionBufferCapacity deltas buffered per subscriber before it is resynced
 * @param watchLinger how long to keep resolving a destination after its last subscriber left
 * @param retryPolicy backoff for establishing watches on cluster state
 * @param remoteClusters linked clusters whose Services can be mirrored
 * @param defaultOpaquePorts ports of meshed pods that are proxied as opaque TCP, unless the pod
 *     annotates its own opaque ports
 * @param enableH2Upgrade whether meshed endpoints on other ports are hinted as HTTP/2
 */
public record DestinationConfig(
    @NotNull String clusterDomain,
    @NotNull String identityTrustDomain,
    @Nullable String kubecontext,
    int subscriptionBufferCapacity,
    @NotNull Duration watchLinger,
    @NotNull RetryPolicy retryPolicy,
    @NotNull List<RemoteCluster> remoteClusters,
    @NotNull ImmutableRangeSet<Integer> defaultOpaquePorts,
    boolean enableH2Upgrade) {

  static final String DEFAULT_CLUSTER_DOMAIN = "cluster.local";
  static final String DEFAULT_IDENTITY_TRUST_DOMAIN = "cluster.local";
  static final int DEFAULT_SUBSCRIPTION_BUFFER_CAPACITY = 100;

  /** SMTP, MySQL, Galera, PostgreSQL, Redis, Elasticsearch and Memcached. */
  static final String DEFAULT_OPAQUE_PORTS = "25,587,3306,4444,5432,6379,9300,11211";

  /** Canonical constructor. */
  public DestinationConfig {
    if (subscriptionBufferCapacity < 1) {
      throw new IllegalArgumentException(
          "subscriptionBufferCapacity must be positive, got " + subscriptionBufferCapacity);
    }
    if (watchLinger.isNegative()) {
      throw new IllegalArgumentException("watchLinger must not be negative, got " + watchLinger);
    }
    var names = new HashSet<String>();
    for (RemoteCluster remoteCluster : remoteClusters) {
      if (!names.add(remoteCluster.name())) {
        throw new IllegalArgumentException(
            "duplicate remote cluster name " + remoteCluster.name());
      }
    }
    remoteClusters = List.copyOf(remoteClusters);
  }

  /**
   * Constructor used after parsing a YAML file (or similar) to a Map.
   *
   * <p>The map keys match the component names, except for {@code watchLingerMillis} and the
   * {@code retry} section with {@code initialBackoffMillis}, {@code maxBackoffMillis} and {@code
   * maxAttempts}. {@code defaultOpaquePorts} is a comma separated list of ports and port ranges.
   * Missing values take defaults, and the watch linger window defaults to zero.
   *
   * @throws IllegalArgumentException if a value is missing where required, or has the wrong type
   */
  @SuppressWarnings("unchecked")
  public DestinationConfig(@NotNull Map<String, Object> config) {
    this(
        stringValue(config, "clusterDomain", DEFAULT_CLUSTER_DOMAIN),
        stringValue(config, "identityTrustDomain", DEFAULT_IDENTITY_TRUST_DOMAIN),
        stringValue(config, "kubecontext", null),
        intValue(config, "subscriptionBufferCapacity", DEFAULT_SUBSCRIPTION_BUFFER_CAPACITY),
        Duration.ofMillis(intValue(config, "watchLingerMillis", 0)),
        retryPolicy(
            (Map<String, Object>) Objects.requireNonNullElse(config.get("retry"), Map.of())),
        ((List<Map<String, Object>>)
                Objects.requireNonNullElse(config.get("remoteClusters"), List.of()))
            .stream().map(RemoteCluster::new).toList(),
        PortRanges.parse(stringValue(config, "defaultOpaquePorts", DEFAULT_OPAQUE_PORTS)),
        booleanValue(config, "enableH2Upgrade", true));
  }

  /** Settings with all defaults. */
  @NotNull
  public static DestinationConfig defaults() {
    return new DestinationConfig(Map.of());
  }

  @NotNull
  private static RetryPolicy retryPolicy(@NotNull Map<String, Object> retry) {
    RetryPolicy defaults = RetryPolicy.DEFAULT;
    return new RetryPolicy(
        Duration.ofMillis(
            intValue(retry, "initialBackoffMillis", (int) defaults.initialBackoff().toMillis())),
        Duration.ofMillis(
            intValue(retry, "maxBackoffMillis", (int) defaults.maxBackoff().toMillis())),
        intValue(retry, "maxAttempts", defaults.maxAttempts()));
  }

  /** A string setting, or the default value if it is not set. */
  static String stringValue(
      @NotNull Map<String, Object> config, @NotNull String key, @Nullable String defaultValue) {
    Object value = config.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof String)) {
      throw new IllegalArgumentException(key + " must be a string, got " + value);
    }
    return (String) value;
  }

  private static boolean booleanValue(
      @NotNull Map<String, Object> config, @NotNull String key, boolean defaultValue) {
    Object value = config.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof Boolean)) {
      throw new IllegalArgumentException(key + " must be true or false, got " + value);
    }
    return (Boolean) value;
  }

  private static int intValue(
      @NotNull Map<String, Object> config, @NotNull String key, int defaultValue) {
    Object value = config.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(key + " must be a number, got " + value);
    }
    return ((Number) value).intValue();
  }
}
