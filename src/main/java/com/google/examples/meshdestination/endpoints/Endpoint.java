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

package com.google.examples.meshdestination.endpoints;

import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One concrete, network-reachable backend of a destination.
 *
 * <p>Two endpoints are equal if they have the same {@link Address}. Identity, metric labels,
 * weight and protocol hint are payload and do not take part in {@link #equals(Object)} and {@link
 * #hashCode()}, so sets of endpoints behave as sets of addresses.
 *
 * @param address IP address and port
 * @param identity mTLS identity of the workload behind the address, if it is meshed
 * @param metricLabels labels that clients attach to metrics for this endpoint
 * @param weight load balancing weight, an unsigned 32-bit value, if set
 * @param protocolHint how to talk to the endpoint, if it is meshed
 */
public record Endpoint(
    @NotNull Address address,
    @Nullable String identity,
    @NotNull Map<String, String> metricLabels,
    @Nullable Long weight,
    @Nullable ProtocolHint protocolHint) {

  private static final long MAX_WEIGHT = 0xFFFFFFFFL;

  /** Canonical constructor. */
  public Endpoint(
      @NotNull Address address,
      @Nullable String identity,
      @NotNull Map<String, String> metricLabels,
      @Nullable Long weight,
      @Nullable ProtocolHint protocolHint) {
    if (weight != null && (weight < 0 || weight > MAX_WEIGHT)) {
      throw new IllegalArgumentException("weight must be an unsigned 32-bit value, got " + weight);
    }
    this.address = address;
    this.identity = identity;
    this.metricLabels = Map.copyOf(metricLabels);
    this.weight = weight;
    this.protocolHint = protocolHint;
  }

  /** Creates an endpoint with no protocol hint. */
  public Endpoint(
      @NotNull Address address,
      @Nullable String identity,
      @NotNull Map<String, String> metricLabels,
      @Nullable Long weight) {
    this(address, identity, metricLabels, weight, null);
  }

  /** Creates an endpoint with no identity, labels or weight. */
  public Endpoint(@NotNull Address address) {
    this(address, null, Map.of(), null);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Endpoint)) {
      return false;
    }
    return address.equals(((Endpoint) o).address);
  }

  @Override
  public int hashCode() {
    return address.hashCode();
  }
}
