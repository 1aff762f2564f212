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

package com.google.examples.meshdestination.server;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.examples.meshdestination.api.DestinationService;
import com.google.examples.meshdestination.cluster.ClusterState;
import com.google.examples.meshdestination.config.DestinationConfig;
import com.google.examples.meshdestination.config.RemoteCluster;
import com.google.examples.meshdestination.config.ServerConfig;
import com.google.examples.meshdestination.informers.KubernetesClusterState;
import com.google.examples.meshdestination.interceptors.LoggingServerInterceptor;
import com.google.examples.meshdestination.resolvers.ClusterServiceResolver;
import com.google.examples.meshdestination.resolvers.LiteralIpResolver;
import com.google.examples.meshdestination.resolvers.MirrorResolver;
import com.google.examples.meshdestination.resolvers.PodResolver;
import com.google.examples.meshdestination.resolvers.Resolver;
import com.google.examples.meshdestination.watch.Registry;
import io.grpc.BindableService;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.grpc.services.AdminInterface;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The destination server. */
public class Server {

  private static final Logger LOG = LoggerFactory.getLogger(Server.class);

  /** Name of the local cluster, for log messages. */
  private static final String LOCAL_CLUSTER_NAME = "local";

  /** Runs the server. */
  public void run(@NotNull ServerConfig config) throws Exception {
    DestinationConfig destinationConfig = config.destinationConfig();

    var localCluster =
        new KubernetesClusterState(
            LOCAL_CLUSTER_NAME,
            destinationConfig.kubecontext(),
            destinationConfig.identityTrustDomain(),
            destinationConfig.defaultOpaquePorts(),
            destinationConfig.enableH2Upgrade());
    var remoteClusters = new LinkedHashMap<String, KubernetesClusterState>();
    for (RemoteCluster remoteCluster : destinationConfig.remoteClusters()) {
      remoteClusters.put(
          remoteCluster.name(),
          new KubernetesClusterState(
              remoteCluster.name(),
              remoteCluster.kubecontext(),
              remoteCluster.identityTrustDomain(),
              destinationConfig.defaultOpaquePorts(),
              destinationConfig.enableH2Upgrade()));
    }
    var informers = new ArrayList<KubernetesClusterState>();
    informers.add(localCluster);
    informers.addAll(remoteClusters.values());
    informers.forEach(KubernetesClusterState::start);

    var registry =
        new Registry(
            createResolvers(destinationConfig, localCluster, remoteClusters),
            destinationConfig.watchLinger(),
            destinationConfig.subscriptionBufferCapacity());
    ExecutorService forwarderExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("destination-stream-%d")
                .setDaemon(true)
                .build());
    var destinationService =
        new DestinationService(registry, destinationConfig.clusterDomain(), forwarderExecutor);

    var health = new HealthStatusManager();
    health.setStatus("", ServingStatus.SERVING);
    var server =
        NettyServerBuilder.forPort(config.servingPort(), InsecureServerCredentials.create())
            .addService(withLogging(destinationService))
            .addService(health.getHealthService())
            .addServices(AdminInterface.getStandardServices())
            .addService(ProtoReflectionService.newInstance())
            .build()
            .start();

    // Serve health, admin and reflection services on the health port
    var healthServer =
        Grpc.newServerBuilderForPort(config.healthPort(), InsecureServerCredentials.create())
            .addService(health.getHealthService())
            .addServices(AdminInterface.getStandardServices())
            .addService(ProtoReflectionService.newInstance())
            .build()
            .start();

    addServerShutdownHook(server, healthServer, health, registry, informers, forwarderExecutor);
    LOG.info("Destination server listening on port {}", server.getPort());

    server.awaitTermination();
  }

  /** Resolvers in priority order. */
  @NotNull
  static List<Resolver> createResolvers(
      @NotNull DestinationConfig config,
      @NotNull ClusterState localCluster,
      @NotNull Map<String, ? extends ClusterState> remoteClusters) {
    return List.of(
        new LiteralIpResolver(),
        new MirrorResolver(
            Map.copyOf(remoteClusters), config.clusterDomain(), config.retryPolicy()),
        new PodResolver(localCluster, config.clusterDomain(), config.retryPolicy()),
        new ClusterServiceResolver(localCluster, config.clusterDomain(), config.retryPolicy()));
  }

  @NotNull
  private ServerServiceDefinition withLogging(@NotNull BindableService service) {
    return ServerInterceptors.intercept(service, new LoggingServerInterceptor());
  }

  private void addServerShutdownHook(
      @NotNull io.grpc.Server server,
      @NotNull io.grpc.Server healthServer,
      @NotNull HealthStatusManager health,
      @NotNull Registry registry,
      @NotNull List<KubernetesClusterState> informers,
      @NotNull ExecutorService forwarderExecutor) {
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  // Mark all services as NOT_SERVING.
                  health.enterTerminalState();
                  // End all subscriptions, so that streams complete cleanly.
                  registry.close();
                  informers.forEach(KubernetesClusterState::stop);
                  // Start graceful shutdown
                  server.shutdown();
                  try {
                    // Wait for RPCs to complete processing
                    if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                      // That was plenty of time. Let's cancel the remaining RPCs.
                      server.shutdownNow();
                      // shutdownNow isn't instantaneous, so give a bit of time to clean resources
                      // up gracefully. Normally this will be well under a second.
                      server.awaitTermination(2, TimeUnit.SECONDS);
                    }
                    forwarderExecutor.shutdownNow();
                    healthServer.shutdownNow();
                    healthServer.awaitTermination(2, TimeUnit.SECONDS);
                  } catch (InterruptedException ex) {
                    healthServer.shutdownNow();
                    server.shutdownNow();
                  }
                }));
  }
}
