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

import com.google.examples.meshdestination.cluster.ClusterState;
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.cluster.ServiceSnapshot;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Destination.Scheme;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import com.google.examples.meshdestination.endpoints.ServiceName;
import io.grpc.Context;
import java.util.Optional;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;

/**
 * Resolves the name of one pod behind a headless Service, e.g., {@code
 * web-0.web.emojivoto.svc.cluster.local}, to that pod's address.
 *
 * <p>The pod is matched by its hostname in the Service's endpoints. Readiness is ignored: the
 * destination exists as long as the backing pod does.
 */
public class PodResolver extends AbstractServiceResolver {

  private final ClusterState clusterState;
  private final String clusterDomain;

  public PodResolver(
      @NotNull ClusterState clusterState,
      @NotNull String clusterDomain,
      @NotNull RetryPolicy retryPolicy) {
    super(retryPolicy);
    this.clusterState = clusterState;
    this.clusterDomain = clusterDomain;
  }

  @Override
  public boolean canResolve(@NotNull Destination destination) {
    return instanceName(destination).isPresent();
  }

  @Override
  public void streamResolution(
      @NotNull Destination destination,
      @NotNull Consumer<EndpointSet> emit,
      @NotNull Context done)
      throws ResolutionException {
    ServiceName name =
        instanceName(destination)
            .orElseThrow(() -> new UnresolvableDestinationException(destination));
    streamService(
        destination, clusterState, new ServiceId(name.namespace(), name.name()), emit, done);
  }

  @Override
  @NotNull
  protected EndpointSet toEndpointSet(
      @NotNull Destination destination, long version, @NotNull ServiceSnapshot snapshot) {
    String hostname = instanceName(destination).map(ServiceName::instance).orElse(null);
    var endpoints =
        snapshot.backends().stream()
            .filter(backend -> hostname != null && hostname.equals(backend.hostname()))
            .map(AbstractServiceResolver::toEndpoint)
            .toList();
    if (endpoints.isEmpty()) {
      return EndpointSet.absent(destination, version);
    }
    return EndpointSet.of(destination, version, endpoints);
  }

  @NotNull
  private Optional<ServiceName> instanceName(@NotNull Destination destination) {
    if (destination.scheme() != Scheme.K8S) {
      return Optional.empty();
    }
    return ServiceName.parse(destination.path(), clusterDomain).filter(ServiceName::isInstance);
  }
}
