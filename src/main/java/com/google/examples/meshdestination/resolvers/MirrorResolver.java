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
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.cluster.ServiceSnapshot;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Destination.Scheme;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import com.google.examples.meshdestination.endpoints.ServiceName;
import io.grpc.Context;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;

/**
 * Resolves mirrored Services, whose backends live in a remote cluster.
 *
 * <p>A mirror destination has the scheme {@code mirror} and a name of the form <code>
 * [service]-[link].[namespace].svc.[zone]</code>, where {@code link} is the name of a linked
 * remote cluster. It resolves to the ready backends of {@code service} in {@code namespace} of the
 * remote cluster.
 */
public class MirrorResolver extends AbstractServiceResolver {

  private final Map<String, ClusterState> remoteClusters;
  private final String clusterDomain;

  /**
   * Creates a resolver for the given remote clusters.
   *
   * @param remoteClusters cluster state of each linked remote cluster, by link name
   * @param clusterDomain the local cluster DNS domain, used in mirror names
   * @param retryPolicy retries for establishing the remote watches
   */
  public MirrorResolver(
      @NotNull Map<String, ClusterState> remoteClusters,
      @NotNull String clusterDomain,
      @NotNull RetryPolicy retryPolicy) {
    super(retryPolicy);
    this.remoteClusters = Map.copyOf(remoteClusters);
    this.clusterDomain = clusterDomain;
  }

  @Override
  public boolean canResolve(@NotNull Destination destination) {
    return mirrorTarget(destination).isPresent();
  }

  @Override
  public void streamResolution(
      @NotNull Destination destination,
      @NotNull Consumer<EndpointSet> emit,
      @NotNull Context done)
      throws ResolutionException {
    MirrorTarget target =
        mirrorTarget(destination)
            .orElseThrow(() -> new UnresolvableDestinationException(destination));
    streamService(destination, remoteClusters.get(target.link()), target.service(), emit, done);
  }

  @Override
  @NotNull
  protected EndpointSet toEndpointSet(
      @NotNull Destination destination, long version, @NotNull ServiceSnapshot snapshot) {
    if (!snapshot.exists()) {
      return EndpointSet.absent(destination, version);
    }
    return EndpointSet.of(
        destination,
        version,
        snapshot.backends().stream()
            .filter(BackendRecord::ready)
            .map(AbstractServiceResolver::toEndpoint)
            .toList());
  }

  /** Finds the link and remote Service of a mirror name. The longest matching link wins. */
  @NotNull
  private Optional<MirrorTarget> mirrorTarget(@NotNull Destination destination) {
    if (destination.scheme() != Scheme.MIRROR) {
      return Optional.empty();
    }
    Optional<ServiceName> parsed =
        ServiceName.parse(destination.path(), clusterDomain).filter(name -> !name.isInstance());
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    ServiceName name = parsed.get();
    return remoteClusters.keySet().stream()
        .filter(
            link ->
                name.name().endsWith("-" + link)
                    && name.name().length() > link.length() + 1)
        .max(Comparator.comparingInt(String::length))
        .map(
            link ->
                new MirrorTarget(
                    link,
                    new ServiceId(
                        name.namespace(),
                        name.name().substring(0, name.name().length() - link.length() - 1))));
  }

  private record MirrorTarget(String link, ServiceId service) {}
}
