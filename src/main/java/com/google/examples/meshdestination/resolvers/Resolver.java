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

import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import io.grpc.Context;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;

/**
 * A strategy that turns a destination into a live stream of {@link EndpointSet} snapshots.
 *
 * <p>Resolvers are tried in a fixed priority order, and the first one whose {@link #canResolve}
 * returns true resolves the destination for as long as anyone is interested in it.
 */
public interface Resolver {

  /** Load balancing weight of endpoints that do not carry their own weight. */
  long DEFAULT_WEIGHT = 10_000L;

  /**
   * Whether this resolver handles the destination. Must be fast and free of side effects.
   */
  boolean canResolve(@NotNull Destination destination);

  /**
   * Resolves the destination until {@code done} is cancelled.
   *
   * <p>Blocks the calling thread. Every snapshot is passed to {@code emit}, with increasing
   * versions. Transient failures of the underlying data source are retried internally. When {@code
   * done} is cancelled, this method releases its resources and returns promptly.
   *
   * @param destination a destination this resolver {@link #canResolve can resolve}
   * @param emit receives snapshots, never concurrently
   * @param done cancelled when the resolution is no longer needed
   * @throws ResolutionException on permanent failure
   */
  void streamResolution(
      @NotNull Destination destination,
      @NotNull Consumer<EndpointSet> emit,
      @NotNull Context done)
      throws ResolutionException;
}
