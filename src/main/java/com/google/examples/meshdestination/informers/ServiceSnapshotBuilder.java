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

import com.google.common.collect.ImmutableRangeSet;
import com.google.common.net.HostAndPort;
import com.google.examples.meshdestination.cluster.BackendRecord;
import com.google.examples.meshdestination.cluster.PortRanges;
import com.google.examples.meshdestination.cluster.ServiceSnapshot;
import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.ProtocolHint;
import com.google.examples.meshdestination.endpoints.ProtocolHint.Protocol;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.openapi.models.DiscoveryV1EndpointPort;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Endpoint;
import io.kubernetes.client.openapi.models.V1EndpointSlice;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link ServiceSnapshot} for one Service port from the Service, its EndpointSlices, and
 * the Pods behind them.
 */
public class ServiceSnapshotBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(ServiceSnapshotBuilder.class);

  /** Pods with this label are meshed, the label value is the control plane namespace. */
  public static final String CONTROL_PLANE_NS_LABEL = "linkerd.io/control-plane-ns";

  /** Ports, port ranges and port names that the pod's proxy handles as opaque TCP. */
  public static final String OPAQUE_PORTS_ANNOTATION = "config.linkerd.io/opaque-ports";

  static final String PROXY_CONTAINER_NAME = "linkerd-proxy";
  static final String ENV_INBOUND_LISTEN_ADDR = "LINKERD2_PROXY_INBOUND_LISTEN_ADDR";
  static final String ENV_ADMIN_LISTEN_ADDR = "LINKERD2_PROXY_ADMIN_LISTEN_ADDR";
  static final String ENV_CONTROL_LISTEN_ADDR = "LINKERD2_PROXY_CONTROL_LISTEN_ADDR";
  static final int DEFAULT_PROXY_INBOUND_PORT = 4143;

  private static final String SERVICE_TYPE_EXTERNAL_NAME = "ExternalName";
  private static final String ADDRESS_TYPE_FQDN = "FQDN";

  private final V1Service service;
  private final int port;
  private final String identityTrustDomain;
  private final List<V1EndpointSlice> endpointSlices = new ArrayList<>();
  private BiFunction<String, String, V1Pod> podLookup = (namespace, name) -> null;
  private ImmutableRangeSet<Integer> defaultOpaquePorts = ImmutableRangeSet.of();
  private boolean enableH2Upgrade = true;

  /**
   * Starts a snapshot.
   *
   * @param service the Service, or null if it does not exist
   * @param port the Service port
   * @param identityTrustDomain trust domain used to build identities of meshed pods
   */
  public ServiceSnapshotBuilder(
      @Nullable V1Service service, int port, @NotNull String identityTrustDomain) {
    this.service = service;
    this.port = port;
    this.identityTrustDomain = identityTrustDomain;
  }

  /** EndpointSlices owned by the Service. */
  @NotNull
  public ServiceSnapshotBuilder withEndpointSlices(
      @NotNull Collection<V1EndpointSlice> endpointSlices) {
    this.endpointSlices.addAll(endpointSlices);
    return this;
  }

  /** How to find a Pod by namespace and name. The function returns null for unknown Pods. */
  @NotNull
  public ServiceSnapshotBuilder withPodLookup(
      @NotNull BiFunction<String, String, V1Pod> podLookup) {
    this.podLookup = podLookup;
    return this;
  }

  /**
   * How to hint protocols of meshed pods.
   *
   * @param defaultOpaquePorts opaque ports of pods without the {@value #OPAQUE_PORTS_ANNOTATION}
   *     annotation
   * @param enableH2Upgrade whether to hint HTTP/2 for ports that are not opaque
   */
  @NotNull
  public ServiceSnapshotBuilder withProtocolHints(
      @NotNull ImmutableRangeSet<Integer> defaultOpaquePorts, boolean enableH2Upgrade) {
    this.defaultOpaquePorts = defaultOpaquePorts;
    this.enableH2Upgrade = enableH2Upgrade;
    return this;
  }

  /** Creates the snapshot. */
  @SuppressWarnings("null") // https://github.com/redhat-developer/vscode-java/issues/3124
  @NotNull
  public ServiceSnapshot build() {
    if (service == null
        || service.getSpec() == null
        || SERVICE_TYPE_EXTERNAL_NAME.equals(service.getSpec().getType())) {
      return ServiceSnapshot.absent();
    }
    IntOrString targetPort = findTargetPort(service);
    var backends = new ArrayList<BackendRecord>();
    for (V1EndpointSlice endpointSlice : endpointSlices) {
      if (ADDRESS_TYPE_FQDN.equals(endpointSlice.getAddressType())) {
        continue;
      }
      Optional<Integer> portNumber = resolvePort(endpointSlice, targetPort);
      if (portNumber.isEmpty()) {
        LOG.debug(
            "Skipping EndpointSlice {} as it has no port named {}",
            endpointSlice.getMetadata() != null ? endpointSlice.getMetadata().getName() : null,
            targetPort.getStrValue());
        continue;
      }
      if (endpointSlice.getEndpoints() == null) {
        continue;
      }
      for (V1Endpoint endpoint : endpointSlice.getEndpoints()) {
        backends.addAll(toBackendRecords(endpoint, portNumber.get()));
      }
    }
    return new ServiceSnapshot(true, backends);
  }

  /**
   * The target port of the Service port matching the requested port, or the requested port itself
   * if the Service has no such port or it has no target port.
   */
  @NotNull
  private IntOrString findTargetPort(@NotNull V1Service service) {
    List<V1ServicePort> ports = service.getSpec().getPorts();
    if (ports != null) {
      for (V1ServicePort servicePort : ports) {
        IntOrString targetPort = servicePort.getTargetPort();
        if (servicePort.getPort() != null
            && servicePort.getPort() == port
            && targetPort != null
            && !(targetPort.isInteger() && targetPort.getIntValue() == 0)) {
          return targetPort;
        }
      }
    }
    return new IntOrString(port);
  }

  @NotNull
  private static Optional<Integer> resolvePort(
      @NotNull V1EndpointSlice endpointSlice, @NotNull IntOrString targetPort) {
    if (targetPort.isInteger()) {
      return Optional.of(targetPort.getIntValue());
    }
    if (endpointSlice.getPorts() == null) {
      return Optional.empty();
    }
    return endpointSlice.getPorts().stream()
        .filter(p -> targetPort.getStrValue().equals(p.getName()) && p.getPort() != null)
        .map(DiscoveryV1EndpointPort::getPort)
        .findFirst();
  }

  @NotNull
  private List<BackendRecord> toBackendRecords(@NotNull V1Endpoint endpoint, int portNumber) {
    // https://kubernetes.io/docs/concepts/services-networking/endpoint-slices/#ready
    boolean ready =
        endpoint.getConditions() == null
            || !Boolean.FALSE.equals(endpoint.getConditions().getReady());
    V1Pod pod = findPod(endpoint.getTargetRef());
    Map<String, String> labels = new HashMap<>();
    String identity = null;
    ProtocolHint protocolHint = null;
    if (pod != null && pod.getMetadata() != null) {
      labels.put("pod", pod.getMetadata().getName());
      String serviceAccount =
          pod.getSpec() != null && pod.getSpec().getServiceAccountName() != null
              ? pod.getSpec().getServiceAccountName()
              : "default";
      labels.put("serviceaccount", serviceAccount);
      String controlPlaneNamespace = controlPlaneNamespace(pod);
      if (controlPlaneNamespace != null) {
        identity = identity(pod, serviceAccount, controlPlaneNamespace);
        protocolHint = protocolHint(pod, portNumber);
      }
    }
    if (endpoint.getZone() != null) {
      labels.put("zone", endpoint.getZone());
    }
    var records = new ArrayList<BackendRecord>();
    for (String ip : endpoint.getAddresses()) {
      try {
        records.add(
            new BackendRecord(
                Address.of(ip, portNumber),
                identity,
                labels,
                ready,
                endpoint.getHostname(),
                protocolHint));
      } catch (IllegalArgumentException e) {
        LOG.warn("Skipping endpoint address {} as it is not a valid IP address", ip);
      }
    }
    return records;
  }

  @Nullable
  private V1Pod findPod(@Nullable V1ObjectReference targetRef) {
    if (targetRef == null
        || !"Pod".equals(targetRef.getKind())
        || targetRef.getNamespace() == null
        || targetRef.getName() == null) {
      return null;
    }
    return podLookup.apply(targetRef.getNamespace(), targetRef.getName());
  }

  /** The namespace of the control plane of a meshed pod, or null if the pod is not meshed. */
  @Nullable
  private static String controlPlaneNamespace(@NotNull V1Pod pod) {
    Map<String, String> podLabels = pod.getMetadata().getLabels();
    String controlPlaneNamespace = podLabels != null ? podLabels.get(CONTROL_PLANE_NS_LABEL) : null;
    if (controlPlaneNamespace == null || controlPlaneNamespace.isBlank()) {
      return null;
    }
    return controlPlaneNamespace;
  }

  /**
   * Identity of a meshed pod, in the form
   * <code>[serviceaccount].[namespace].serviceaccount.identity.[control-plane-ns].[trust-domain]
   * </code>.
   */
  @NotNull
  private String identity(
      @NotNull V1Pod pod, @NotNull String serviceAccount, @NotNull String controlPlaneNamespace) {
    return "%s.%s.serviceaccount.identity.%s.%s"
        .formatted(
            serviceAccount,
            pod.getMetadata().getNamespace(),
            controlPlaneNamespace,
            identityTrustDomain);
  }

  /**
   * Opaque ports get an opaque protocol hint, and are tunneled to the proxy's inbound port unless
   * they are ports of the proxy itself. Other ports are hinted as HTTP/2 if upgrades are enabled.
   */
  @NotNull
  private ProtocolHint protocolHint(@NotNull V1Pod pod, int portNumber) {
    boolean opaque = opaquePorts(pod).contains(portNumber);
    if (!opaque) {
      return new ProtocolHint(enableH2Upgrade ? Protocol.H2 : null, null);
    }
    V1Container proxy = proxyContainer(pod);
    Integer port = portNumber;
    if (port.equals(listenPort(proxy, ENV_ADMIN_LISTEN_ADDR))
        || port.equals(listenPort(proxy, ENV_CONTROL_LISTEN_ADDR))) {
      return new ProtocolHint(Protocol.OPAQUE, null);
    }
    Integer inboundPort = listenPort(proxy, ENV_INBOUND_LISTEN_ADDR);
    return new ProtocolHint(
        Protocol.OPAQUE, inboundPort != null ? inboundPort : DEFAULT_PROXY_INBOUND_PORT);
  }

  /** Opaque ports from the pod annotation, or the default opaque ports if it is not annotated. */
  @NotNull
  private ImmutableRangeSet<Integer> opaquePorts(@NotNull V1Pod pod) {
    Map<String, String> annotations = pod.getMetadata().getAnnotations();
    if (annotations == null || !annotations.containsKey(OPAQUE_PORTS_ANNOTATION)) {
      return defaultOpaquePorts;
    }
    return PortRanges.parseLenient(
        annotations.get(OPAQUE_PORTS_ANNOTATION), name -> containerPort(pod, name));
  }

  @Nullable
  private static Integer containerPort(@NotNull V1Pod pod, @NotNull String name) {
    if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
      return null;
    }
    for (V1Container container : pod.getSpec().getContainers()) {
      if (container.getPorts() == null) {
        continue;
      }
      for (V1ContainerPort port : container.getPorts()) {
        if (name.equals(port.getName())) {
          return port.getContainerPort();
        }
      }
    }
    return null;
  }

  /** The proxy container, which is a sidecar or a native sidecar init container. */
  @Nullable
  private static V1Container proxyContainer(@NotNull V1Pod pod) {
    if (pod.getSpec() == null) {
      return null;
    }
    var containers = new ArrayList<V1Container>();
    if (pod.getSpec().getInitContainers() != null) {
      containers.addAll(pod.getSpec().getInitContainers());
    }
    if (pod.getSpec().getContainers() != null) {
      containers.addAll(pod.getSpec().getContainers());
    }
    return containers.stream()
        .filter(container -> PROXY_CONTAINER_NAME.equals(container.getName()))
        .findFirst()
        .orElse(null);
  }

  /** The port of a proxy listen address environment variable, e.g., {@code 0.0.0.0:4143}. */
  @Nullable
  private static Integer listenPort(@Nullable V1Container proxy, @NotNull String envName) {
    if (proxy == null || proxy.getEnv() == null) {
      return null;
    }
    for (V1EnvVar env : proxy.getEnv()) {
      if (envName.equals(env.getName()) && env.getValue() != null) {
        try {
          HostAndPort listenAddr = HostAndPort.fromString(env.getValue());
          return listenAddr.hasPort() ? listenAddr.getPort() : null;
        } catch (IllegalArgumentException e) {
          LOG.warn("Ignoring invalid {}={} in proxy container", envName, env.getValue());
          return null;
        }
      }
    }
    return null;
  }
}
