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

package com.google.examples.meshdestination.informers;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableRangeSet;
import com.google.examples.meshdestination.cluster.ClusterState;
import com.google.examples.meshdestination.cluster.ClusterStateWatch;
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.cluster.ServiceSnapshot;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.informer.ResourceEventHandler;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.informer.cache.Lister;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.DiscoveryV1Api;
import io.kubernetes.client.openapi.models.V1EndpointSlice;
import io.kubernetes.client.openapi.models.V1EndpointSliceList;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServiceList;
import io.kubernetes.client.util.Config;
import io.kubernetes.client.util.KubeConfig;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import okhttp3.OkHttpClient;
import okhttp3.logging.HttpLoggingInterceptor;
import okhttp3.logging.HttpLoggingInterceptor.Level;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cluster state of one Kubernetes cluster, backed by cluster-wide informers on Services,
 * EndpointSlices, and Pods.
 *
 * <p>Every informer event recomputes the snapshots of the Services it affects and pushes them to
 * the registered watches.
 *
 * <p><a
 * href="https://github.com/kubernetes-client/java/blob/8fd1cf4b4f91dd8591c5d2cb254a99efec89f004/examples/examples-release-18/src/main/java/io/kubernetes/client/examples/InformerExample.java">example</a>
 */
public class KubernetesClusterState implements ClusterState {
  private static final Logger LOG = LoggerFactory.getLogger(KubernetesClusterState.class);

  /** Label that links an EndpointSlice to its Service. */
  private static final String LABEL_SERVICE_NAME = "kubernetes.io/service-name";

  /** Name of the EndpointSlice index keyed by <code>namespace/service</code>. */
  private static final String SERVICE_INDEX = "service";

  private final String clusterName;
  private final String identityTrustDomain;
  private final ImmutableRangeSet<Integer> defaultOpaquePorts;
  private final boolean enableH2Upgrade;
  private final SharedInformerFactory informerFactory;
  private final SharedIndexInformer<V1Service> serviceInformer;
  private final SharedIndexInformer<V1EndpointSlice> endpointSliceInformer;
  private final SharedIndexInformer<V1Pod> podInformer;
  private final Lister<V1Service> serviceLister;
  private final Lister<V1Pod> podLister;
  private final ConcurrentMap<ServiceId, Set<Registration>> registrations =
      new ConcurrentHashMap<>();

  /**
   * Creates informers for a cluster, using a Kubernetes client for the given kubecontext.
   *
   * @param clusterName name of the cluster, for log messages
   * @param kubecontext kubeconfig context to use, or blank for the current context or in-cluster
   *     config
   * @param identityTrustDomain trust domain of the cluster's workload identities
   * @param defaultOpaquePorts opaque ports of meshed pods that do not annotate their own
   * @param enableH2Upgrade whether to hint HTTP/2 for meshed pods on other ports
   */
  public KubernetesClusterState(
      @NotNull String clusterName,
      @Nullable String kubecontext,
      @NotNull String identityTrustDomain,
      @NotNull ImmutableRangeSet<Integer> defaultOpaquePorts,
      boolean enableH2Upgrade) {
    this(
        clusterName,
        identityTrustDomain,
        defaultOpaquePorts,
        enableH2Upgrade,
        createK8sApiClient(kubecontext));
  }

  KubernetesClusterState(
      @NotNull String clusterName,
      @NotNull String identityTrustDomain,
      @NotNull ImmutableRangeSet<Integer> defaultOpaquePorts,
      boolean enableH2Upgrade,
      @NotNull ApiClient client) {
    this.clusterName = clusterName;
    this.identityTrustDomain = identityTrustDomain;
    this.defaultOpaquePorts = defaultOpaquePorts;
    this.enableH2Upgrade = enableH2Upgrade;
    this.informerFactory = new SharedInformerFactory(client);
    var coreV1Api = new CoreV1Api(client);
    var discoveryV1Api = new DiscoveryV1Api(client);

    LOG.info("Creating informers on Services, EndpointSlices and Pods in cluster={}", clusterName);
    this.serviceInformer =
        informerFactory.sharedIndexInformerFor(
            params ->
                coreV1Api
                    .listServiceForAllNamespaces()
                    .allowWatchBookmarks(Boolean.TRUE)
                    .resourceVersion(params.resourceVersion)
                    .timeoutSeconds(params.timeoutSeconds)
                    .watch(params.watch)
                    .buildCall(null),
            V1Service.class,
            V1ServiceList.class);
    this.endpointSliceInformer =
        informerFactory.sharedIndexInformerFor(
            params ->
                discoveryV1Api
                    .listEndpointSliceForAllNamespaces()
                    .allowWatchBookmarks(Boolean.TRUE)
                    .labelSelector(LABEL_SERVICE_NAME)
                    .resourceVersion(params.resourceVersion)
                    .timeoutSeconds(params.timeoutSeconds)
                    .watch(params.watch)
                    .buildCall(null),
            V1EndpointSlice.class,
            V1EndpointSliceList.class);
    this.podInformer =
        informerFactory.sharedIndexInformerFor(
            params ->
                coreV1Api
                    .listPodForAllNamespaces()
                    .allowWatchBookmarks(Boolean.TRUE)
                    .resourceVersion(params.resourceVersion)
                    .timeoutSeconds(params.timeoutSeconds)
                    .watch(params.watch)
                    .buildCall(null),
            V1Pod.class,
            V1PodList.class);

    Map<String, Function<V1EndpointSlice, List<String>>> indexers =
        Map.of(SERVICE_INDEX, KubernetesClusterState::serviceIndexKeys);
    endpointSliceInformer.addIndexers(indexers);
    this.serviceLister = new Lister<>(serviceInformer.getIndexer());
    this.podLister = new Lister<>(podInformer.getIndexer());

    serviceInformer.addEventHandler(eventHandler("service", this::serviceChanged));
    endpointSliceInformer.addEventHandler(
        eventHandler("endpointSlice", this::endpointSliceChanged));
    podInformer.addEventHandler(eventHandler("pod", this::podChanged));
  }

  @Override
  @NotNull
  public String clusterName() {
    return clusterName;
  }

  /** Start the informers. */
  public void start() {
    informerFactory.startAllRegisteredInformers();
  }

  /** Stop the informers. */
  public void stop() {
    informerFactory.stopAllRegisteredInformers();
  }

  /** Whether all informers have completed their initial list. */
  public boolean hasSynced() {
    return serviceInformer.hasSynced()
        && endpointSliceInformer.hasSynced()
        && podInformer.hasSynced();
  }

  /**
   * {@inheritDoc}
   *
   * @throws InformerException if the informers have not synced yet
   */
  @Override
  @NotNull
  public ClusterStateWatch watchService(
      @NotNull ServiceId service, int port, @NotNull Consumer<ServiceSnapshot> listener) {
    if (!hasSynced()) {
      throw new InformerException("Informers for cluster=" + clusterName + " have not synced");
    }
    return register(service, port, listener);
  }

  /** Registers a listener and publishes the current snapshot to it. */
  @NotNull
  ClusterStateWatch register(
      @NotNull ServiceId service, int port, @NotNull Consumer<ServiceSnapshot> listener) {
    var registration = new Registration(service, port, listener);
    // The add must be atomic with the mapping, a concurrent close may drop an empty set.
    registrations.compute(
        service,
        (key, forService) -> {
          Set<Registration> registered =
              forService != null ? forService : ConcurrentHashMap.newKeySet();
          registered.add(registration);
          return registered;
        });
    LOG.debug("Watching cluster={} service={} port={}", clusterName, service, port);
    registration.publish();
    return registration;
  }

  void serviceChanged(@NotNull V1Service service) {
    notifyService(serviceId(service));
  }

  void endpointSliceChanged(@NotNull V1EndpointSlice endpointSlice) {
    notifyService(serviceId(endpointSlice));
  }

  /**
   * Pods only contribute identities, labels and protocol hints, so a change affects the watched
   * Services in the Pod's namespace.
   */
  void podChanged(@NotNull V1Pod pod) {
    if (pod.getMetadata() != null) {
      notifyNamespace(pod.getMetadata().getNamespace());
    }
  }

  @NotNull
  Indexer<V1Service> serviceIndexer() {
    return serviceInformer.getIndexer();
  }

  @NotNull
  Indexer<V1EndpointSlice> endpointSliceIndexer() {
    return endpointSliceInformer.getIndexer();
  }

  @NotNull
  Indexer<V1Pod> podIndexer() {
    return podInformer.getIndexer();
  }

  @NotNull
  private ServiceSnapshot snapshot(@NotNull ServiceId service, int port) {
    V1Service k8sService = serviceLister.namespace(service.namespace()).get(service.name());
    List<V1EndpointSlice> endpointSlices =
        endpointSliceInformer.getIndexer().byIndex(SERVICE_INDEX, service.toString());
    return new ServiceSnapshotBuilder(k8sService, port, identityTrustDomain)
        .withEndpointSlices(endpointSlices)
        .withPodLookup((namespace, name) -> podLister.namespace(namespace).get(name))
        .withProtocolHints(defaultOpaquePorts, enableH2Upgrade)
        .build();
  }

  private void notifyService(@Nullable ServiceId service) {
    if (service == null) {
      return;
    }
    Set<Registration> forService = registrations.get(service);
    if (forService != null) {
      forService.forEach(Registration::publish);
    }
  }

  private void notifyNamespace(@Nullable String namespace) {
    registrations.forEach(
        (service, forService) -> {
          if (service.namespace().equals(namespace)) {
            forService.forEach(Registration::publish);
          }
        });
  }

  @Nullable
  private static ServiceId serviceId(@NotNull V1Service service) {
    if (service.getMetadata() == null
        || service.getMetadata().getNamespace() == null
        || service.getMetadata().getName() == null) {
      LOG.error("Skipping Service due to missing metadata: {}", service);
      return null;
    }
    return new ServiceId(service.getMetadata().getNamespace(), service.getMetadata().getName());
  }

  /** The Service owning an EndpointSlice, or null if the EndpointSlice is not labelled. */
  @SuppressWarnings("null") // https://github.com/redhat-developer/vscode-java/issues/3124
  @Nullable
  private static ServiceId serviceId(@NotNull V1EndpointSlice endpointSlice) {
    if (endpointSlice.getMetadata() == null
        || endpointSlice.getMetadata().getNamespace() == null
        || endpointSlice.getMetadata().getLabels() == null
        || endpointSlice.getMetadata().getLabels().get(LABEL_SERVICE_NAME) == null) {
      return null;
    }
    return new ServiceId(
        endpointSlice.getMetadata().getNamespace(),
        endpointSlice.getMetadata().getLabels().get(LABEL_SERVICE_NAME));
  }

  @NotNull
  private static List<String> serviceIndexKeys(@NotNull V1EndpointSlice endpointSlice) {
    ServiceId service = serviceId(endpointSlice);
    return service == null ? List.of() : List.of(service.toString());
  }

  @NotNull
  private <T extends KubernetesObject> ResourceEventHandler<T> eventHandler(
      @NotNull String kind, @NotNull Consumer<T> onChange) {
    return new ResourceEventHandler<>() {
      @Override
      public void onAdd(T obj) {
        LOG.debug("informer cluster={} event={} {}={}", clusterName, "add", kind, name(obj));
        onChange.accept(obj);
      }

      @Override
      public void onUpdate(T oldObj, T newObj) {
        LOG.debug("informer cluster={} event={} {}={}", clusterName, "update", kind, name(newObj));
        onChange.accept(newObj);
      }

      @Override
      public void onDelete(T obj, boolean deletedFinalStateUnknown) {
        LOG.debug("informer cluster={} event={} {}={}", clusterName, "delete", kind, name(obj));
        onChange.accept(obj);
      }
    };
  }

  @Nullable
  private static String name(@NotNull KubernetesObject obj) {
    return obj.getMetadata() == null
        ? null
        : obj.getMetadata().getNamespace() + "/" + obj.getMetadata().getName();
  }

  private static ApiClient createK8sApiClient(@Nullable String kubecontext) {
    ApiClient client = createApiClient(kubecontext);
    OkHttpClient httpClient =
        client
            .getHttpClient()
            .newBuilder()
            // Level.HEADERS and Level.BODY would otherwise log the authorization bearer token.
            .addInterceptor(redactingLoggingInterceptor())
            .readTimeout(0, TimeUnit.SECONDS)
            .build();
    client.setHttpClient(httpClient);
    return client;
  }

  @NotNull
  private static HttpLoggingInterceptor redactingLoggingInterceptor() {
    var interceptor = new HttpLoggingInterceptor().setLevel(Level.BASIC);
    interceptor.redactHeader("Authorization");
    return interceptor;
  }

  private static ApiClient createApiClient(@Nullable String kubecontext) {
    String kubeConfigEnv = System.getenv(Config.ENV_KUBECONFIG);
    if (kubeConfigEnv == null || kubeConfigEnv.isBlank()) {
      LOG.info("Using in-cluster Kubernetes client configuration");
      try {
        return Config.defaultClient();
      } catch (IOException e) {
        throw new InformerException(
            "Could not create Kubernetes client using in-cluster config", e);
      }
    }
    List<String> filePaths = Splitter.onPattern(File.pathSeparator).splitToList(kubeConfigEnv);
    String kubeConfigPath = filePaths.get(0);
    if (filePaths.size() > 1) {
      LOG.warn(
          "Found multiple kubeconfig files, using first file only, KUBECONFIG={}", kubeConfigEnv);
    }
    LOG.info("Using Kubernetes client configuration from file {}", kubeConfigPath);
    try (BufferedReader bufferedReader =
        new BufferedReader(
            new InputStreamReader(new FileInputStream(kubeConfigPath), StandardCharsets.UTF_8))) {
      KubeConfig config = KubeConfig.loadKubeConfig(bufferedReader);
      config.setFile(new File(kubeConfigPath));
      if (kubecontext != null && !kubecontext.isBlank()) {
        LOG.info("Using kubeconfig context={}", kubecontext);
        config.setContext(kubecontext);
      } else {
        LOG.info("Using current kubeconfig context={}", config.getCurrentContext());
      }
      return Config.fromConfig(config);
    } catch (IOException e) {
      throw new InformerException(
          "Could not create Kubernetes client using kubeconfig="
              + kubeConfigPath
              + " and kubecontext="
              + kubecontext,
          e);
    }
  }

  /** A watch on one Service port. Snapshots are published one at a time. */
  private final class Registration implements ClusterStateWatch {
    private final ServiceId service;
    private final int port;
    private final Consumer<ServiceSnapshot> listener;
    private volatile boolean closed;

    private Registration(ServiceId service, int port, Consumer<ServiceSnapshot> listener) {
      this.service = service;
      this.port = port;
      this.listener = listener;
    }

    private synchronized void publish() {
      if (closed) {
        return;
      }
      listener.accept(snapshot(service, port));
    }

    @Override
    public void close() {
      closed = true;
      registrations.computeIfPresent(
          service,
          (key, forService) -> {
            forService.remove(this);
            return forService.isEmpty() ? null : forService;
          });
    }
  }
}
