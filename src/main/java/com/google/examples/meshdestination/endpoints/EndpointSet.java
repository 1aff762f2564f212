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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jetbrains.annotations.NotNull;

/**
 * Snapshot of all known endpoints of a destination at one point in time.
 *
 * <p>A destination that exists but has no backends ({@code exists=true}, no endpoints) is a
 * different state from a destination that does not exist ({@code exists=false}). A destination
 * that does not exist never has endpoints.
 *
 * @param destination the destination the endpoints belong to
 * @param version increases with every snapshot a resolver produces for the destination
 * @param endpoints unique by address; {@link #of} keeps the last of several endpoints with the
 *     same address
 * @param exists whether the destination exists
 */
public record EndpointSet(
    @NotNull Destination destination,
    long version,
    @NotNull Set<Endpoint> endpoints,
    boolean exists) {

  /** Canonical constructor. */
  public EndpointSet {
    if (version < 0) {
      throw new IllegalArgumentException("version must not be negative, got " + version);
    }
    if (!exists && !endpoints.isEmpty()) {
      throw new IllegalArgumentException(
          "a destination that does not exist cannot have endpoints: " + destination);
    }
    endpoints = Collections.unmodifiableSet(new LinkedHashSet<>(endpoints));
  }

  /** Snapshot of an existing destination. */
  @NotNull
  public static EndpointSet of(
      @NotNull Destination destination, long version, @NotNull Collection<Endpoint> endpoints) {
    var byAddress = new LinkedHashMap<Address, Endpoint>();
    for (Endpoint endpoint : endpoints) {
      byAddress.put(endpoint.address(), endpoint);
    }
    return new EndpointSet(destination, version, new LinkedHashSet<>(byAddress.values()), true);
  }

  /** Snapshot of a destination that does not exist. */
  @NotNull
  public static EndpointSet absent(@NotNull Destination destination, long version) {
    return new EndpointSet(destination, version, Set.of(), false);
  }

  public boolean isEmpty() {
    return endpoints.isEmpty();
  }
}
