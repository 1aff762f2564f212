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

import com.google.examples.meshdestination.cluster.BackendRecord;
import com.google.examples.meshdestination.cluster.ClusterState;
import com.google.examples.meshdestination.cluster.ClusterStateException;
import com.google.examples.meshdestination.cluster.ClusterStateWatch;
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.cluster.ServiceSnapshot;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Endpoint;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import io.grpc.Context;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for resolvers that follow the backends of a Kubernetes Service through a {@link
 * ClusterState} watch.
 *
 * <p>Establishing the watch is retried according to the {@link RetryPolicy}. Once established, the
 * cluster state delivers full snapshots, and each one is converted to an {@link EndpointSet} by
 * {@link #toEndpointSet}.
 */
public abstract class AbstractServiceResolver implements Resolver {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractServiceResolver.class);

  private final RetryPolicy retryPolicy;

  protected AbstractServiceResolver(@NotNull RetryPolicy retryPolicy) {
    this.retryPolicy = retryPolicy;
  }

  /**
   * Converts a snapshot of the Service to the endpoints of the destination.
   *
   * @param destination the destination being resolved
   * @param version version to use for the endpoint set
   * @param snapshot current state of the Service
   */
  @NotNull
  protected abstract EndpointSet toEndpointSet(
      @NotNull Destination destination, long version, @NotNull ServiceSnapshot snapshot);

  /**
   * Streams endpoint sets for a Service until {@code done} is cancelled.
   *
   * @throws ResolutionException if the watch could not be established within the retry budget
   */
  protected final void streamService(
      @NotNull Destination destination,
      @NotNull ClusterState clusterState,
      @NotNull ServiceId service,
      @NotNull Consumer<EndpointSet> emit,
      @NotNull Context done)
      throws ResolutionException {
    var version = new AtomicLong();
    ClusterStateWatch watch = null;
    int failedAttempts = 0;
    while (watch == null) {
      if (done.isCancelled()) {
        return;
      }
      try {
        watch =
            clusterState.watchService(
                service,
                destination.port(),
                snapshot ->
                    emit.accept(toEndpointSet(destination, version.getAndIncrement(), snapshot)));
      } catch (ClusterStateException e) {
        failedAttempts++;
        if (failedAttempts >= retryPolicy.maxAttempts()) {
          throw new ResolutionException(
              "Could not watch service "
                  + service
                  + " in cluster "
                  + clusterState.clusterName()
                  + " after "
                  + failedAttempts
                  + " attempts",
              e);
        }
        var backoff = retryPolicy.backoff(failedAttempts);
        LOG.warn(
            "Could not watch service={} in cluster={}, retrying in {}ms: {}",
            service,
            clusterState.clusterName(),
            backoff.toMillis(),
            e.getMessage());
        if (Cancellation.sleep(done, backoff)) {
          return;
        }
      }
    }
    try {
      Cancellation.await(done);
    } finally {
      watch.close();
      LOG.debug("Stopped watching service={} in cluster={}", service, clusterState.clusterName());
    }
  }

  /** Converts a backend to an endpoint with the default weight. */
  @NotNull
  protected static Endpoint toEndpoint(@NotNull BackendRecord backend) {
    return new Endpoint(
        backend.address(),
        backend.identity(),
        backend.labels(),
        DEFAULT_WEIGHT,
        backend.protocolHint());
  }
}
