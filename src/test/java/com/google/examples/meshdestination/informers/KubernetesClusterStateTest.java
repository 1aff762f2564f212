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

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.examples.meshdestination.cluster.ClusterStateException;
import com.google.examples.meshdestination.cluster.ClusterStateWatch;
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.cluster.ServiceSnapshot;
import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.ProtocolHint;
import com.google.examples.meshdestination.endpoints.ProtocolHint.Protocol;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Endpoint;
import io.kubernetes.client.openapi.models.V1EndpointConditions;
import io.kubernetes.client.openapi.models.V1EndpointSlice;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class KubernetesClusterStateTest {

  private static final String NAMESPACE = "emojivoto";
  private static final ServiceId WEB = new ServiceId(NAMESPACE, "web");

  private KubernetesClusterState clusterState;

  @BeforeEach
  void setUp() {
    // Informers require a client without read timeout, as watches are long-lived.
    ApiClient client = new ApiClient().setBasePath("http://localhost:1").setReadTimeout(0);
    clusterState =
        new KubernetesClusterState(
            "east",
            "cluster.local",
            ImmutableRangeSet.of(Range.singleton(3306)),
            true,
            client);
  }

  @Test
  void watchBeforeSyncFails() {
    assertEquals("east", clusterState.clusterName());
    assertFalse(clusterState.hasSynced());
    var e =
        assertThrows(
            ClusterStateException.class,
            () -> clusterState.watchService(WEB, 80, snapshot -> {}));
    assertInstanceOf(InformerException.class, e);
    assertTrue(e.getMessage().contains("east"));
  }

  @Test
  void registrationReceivesCurrentSnapshot() throws Exception {
    clusterState.serviceIndexer().add(service());
    clusterState.endpointSliceIndexer().add(slice("web-abcde", endpoint("10.0.0.1", "web-0")));
    var snapshots = new LinkedBlockingQueue<ServiceSnapshot>();

    clusterState.register(WEB, 80, snapshots::add);

    ServiceSnapshot snapshot = next(snapshots);
    assertTrue(snapshot.exists());
    assertEquals(1, snapshot.backends().size());
    assertEquals(Address.of("10.0.0.1", 8080), snapshot.backends().get(0).address());
  }

  @Test
  void endpointSliceChangesArePublished() throws Exception {
    clusterState.serviceIndexer().add(service());
    var snapshots = new LinkedBlockingQueue<ServiceSnapshot>();
    clusterState.register(WEB, 80, snapshots::add);
    assertTrue(next(snapshots).backends().isEmpty());

    V1EndpointSlice slice =
        slice("web-abcde", endpoint("10.0.0.1", "web-0"), endpoint("10.0.0.2", "web-1"));
    clusterState.endpointSliceIndexer().add(slice);
    clusterState.endpointSliceChanged(slice);

    assertEquals(2, next(snapshots).backends().size());

    clusterState.endpointSliceIndexer().delete(slice);
    clusterState.endpointSliceChanged(slice);
    assertTrue(next(snapshots).backends().isEmpty());
  }

  @Test
  void serviceDeletionIsPublished() throws Exception {
    V1Service service = service();
    clusterState.serviceIndexer().add(service);
    var snapshots = new LinkedBlockingQueue<ServiceSnapshot>();
    clusterState.register(WEB, 80, snapshots::add);
    assertTrue(next(snapshots).exists());

    clusterState.serviceIndexer().delete(service);
    clusterState.serviceChanged(service);

    assertFalse(next(snapshots).exists());
  }

  @Test
  void podChangesArePublishedToServicesInTheSameNamespace() throws Exception {
    clusterState.serviceIndexer().add(service());
    clusterState.endpointSliceIndexer().add(slice("web-abcde", endpoint("10.0.0.1", "web-0")));
    var snapshots = new LinkedBlockingQueue<ServiceSnapshot>();
    clusterState.register(WEB, 80, snapshots::add);
    assertNull(next(snapshots).backends().get(0).identity());

    V1Pod pod =
        new V1Pod()
            .metadata(
                new V1ObjectMeta()
                    .namespace(NAMESPACE)
                    .name("web-0")
                    .putLabelsItem(ServiceSnapshotBuilder.CONTROL_PLANE_NS_LABEL, "linkerd"));
    clusterState.podIndexer().add(pod);
    clusterState.podChanged(pod);

    var backend = next(snapshots).backends().get(0);
    assertEquals(
        "default.emojivoto.serviceaccount.identity.linkerd.cluster.local", backend.identity());
    assertEquals(new ProtocolHint(Protocol.H2, null), backend.protocolHint());

    V1Pod elsewhere = new V1Pod().metadata(new V1ObjectMeta().namespace("other").name("web-0"));
    clusterState.podIndexer().add(elsewhere);
    clusterState.podChanged(elsewhere);
    assertNull(snapshots.poll(100, TimeUnit.MILLISECONDS));
  }

  @Test
  void closedRegistrationIsNotNotified() throws Exception {
    V1Service service = service();
    clusterState.serviceIndexer().add(service);
    var snapshots = new LinkedBlockingQueue<ServiceSnapshot>();
    ClusterStateWatch watch = clusterState.register(WEB, 80, snapshots::add);
    next(snapshots);

    watch.close();
    clusterState.serviceChanged(service);

    assertNull(snapshots.poll(100, TimeUnit.MILLISECONDS));
  }

  @Test
  void registrationSurvivesConcurrentCloseOfTheLastOne() throws Exception {
    V1Service service = service();
    clusterState.serviceIndexer().add(service);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      for (int i = 0; i < 500; i++) {
        ClusterStateWatch previous = clusterState.register(WEB, 80, snapshot -> {});
        var published = new AtomicInteger();
        var start = new CountDownLatch(1);
        Future<?> close =
            executor.submit(
                () -> {
                  start.await();
                  previous.close();
                  return null;
                });
        Future<ClusterStateWatch> register =
            executor.submit(
                () -> {
                  start.await();
                  return clusterState.register(WEB, 80, snapshot -> published.incrementAndGet());
                });
        start.countDown();
        close.get(5, TimeUnit.SECONDS);
        ClusterStateWatch current = register.get(5, TimeUnit.SECONDS);
        int initial = published.get();

        clusterState.serviceChanged(service);

        assertEquals(initial + 1, published.get(), "iteration " + i);
        current.close();
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @NotNull
  private static ServiceSnapshot next(@NotNull LinkedBlockingQueue<ServiceSnapshot> snapshots)
      throws InterruptedException {
    ServiceSnapshot snapshot = snapshots.poll(5, TimeUnit.SECONDS);
    assertNotNull(snapshot, "no snapshot published");
    return snapshot;
  }

  @NotNull
  private static V1Service service() {
    return new V1Service()
        .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("web"))
        .spec(
            new V1ServiceSpec()
                .type("ClusterIP")
                .addPortsItem(new V1ServicePort().port(80).targetPort(new IntOrString(8080))));
  }

  @NotNull
  private static V1EndpointSlice slice(@NotNull String name, V1Endpoint... endpoints) {
    return new V1EndpointSlice()
        .metadata(
            new V1ObjectMeta()
                .namespace(NAMESPACE)
                .name(name)
                .putLabelsItem("kubernetes.io/service-name", "web"))
        .addressType("IPv4")
        .endpoints(List.of(endpoints));
  }

  @NotNull
  private static V1Endpoint endpoint(@NotNull String ip, @NotNull String podName) {
    return new V1Endpoint()
        .addresses(List.of(ip))
        .conditions(new V1EndpointConditions().ready(true))
        .targetRef(new V1ObjectReference().kind("Pod").namespace(NAMESPACE).name(podName));
  }
}
