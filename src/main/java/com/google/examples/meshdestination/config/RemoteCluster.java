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

import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A linked remote cluster whose Services can be mirrored.
 *
 * @param name link name, used as the suffix of mirrored Service names
 * @param kubecontext kubeconfig context for the remote cluster's API server
 * @param identityTrustDomain trust domain of the remote cluster's workload identities
 */
public record RemoteCluster(
    @NotNull String name, @Nullable String kubecontext, @NotNull String identityTrustDomain) {

  /** Canonical constructor. */
  public RemoteCluster {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("remote cluster name is required");
    }
  }

  /**
   * Constructor used after parsing a YAML file (or similar) to a Map.
   *
   * <p>{@code name} is required, {@code identityTrustDomain} defaults to {@code cluster.local}.
   *
   * @throws IllegalArgumentException if the name is missing, or a value is not a string
   */
  public RemoteCluster(@NotNull Map<String, Object> config) {
    this(
        DestinationConfig.stringValue(config, "name", null),
        DestinationConfig.stringValue(config, "kubecontext", null),
        DestinationConfig.stringValue(
            config, "identityTrustDomain", DestinationConfig.DEFAULT_IDENTITY_TRUST_DOMAIN));
  }
}
