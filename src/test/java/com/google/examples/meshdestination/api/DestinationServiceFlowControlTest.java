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

package com.google.examples.meshdestination.api;

import static com.google.examples.meshdestination.cluster.Backends.ready;
import static com.google.examples.meshdestination.cluster.Backends.service;
import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.meshdestination.api.v1.DestinationGrpc;
import com.google.examples.meshdestination.api.v1.GetDestination;
import com.google.examples.meshdestination.api.v1.TcpAddress;
import com.google.examples.meshdestination.api.v1.Update;
import com.google.examples.meshdestination.api.v1.WeightedAddr;
import com.google.examples.meshdestination.cluster.FakeClusterState;
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.resolvers.ClusterServiceResolver;
import com.google.examples.meshdestination.resolvers.RetryPolicy;
import com.google.examples.meshdestination.watch.Registry;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** A client that stops reading must not make the server queue every update for it. */
public class DestinationServiceFlowControlTest {

  private static final ServiceId WEB = new ServiceId("emojivoto", "web");
  private static final int BUFFER_CAPACITY = 2;

  private final FakeClusterState cluster = new FakeClusterState("local");
  private Registry registry;
  private ExecutorService forwarderExecutor;
  private Server server;
  private ManagedChannel channel;

  @BeforeEach
  void setUp() throws Exception {
    registry =
        new Registry(
            List.of(new ClusterServiceResolver(cluster, "cluster.local", RetryPolicy.DEFAULT)),
            Duration.ZERO,
            BUFFER_CAPACITY);
    forwarderExecutor = Executors.newCachedThreadPool();
    String serverName = InProcessServerBuilder.generateName();
    server =
        InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(new DestinationService(registry, "cluster.local", forwarderExecutor))
            .build()
            .start();
    channel = InProcessChannelBuilder.forName(serverName).directExecutor().build();
  }

  @AfterEach
  void tearDown() throws Exception {
    channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    registry.close();
    server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    forwarderExecutor.shutdownNow();
  }

  @Test
  void slowClientReceivesOneResyncInsteadOfABacklog() throws Exception {
    cluster.update(WEB, service(ready("10.0.0.1", 8080)));
    var call = new ManualCall();
    DestinationGrpc.newStub(channel)
        .get(
            GetDestination.newBuilder()
                .setScheme("k8s")
                .setPath("web.emojivoto.svc.cluster.local:80")
                .build(),
            call);
    Update first = call.updates.poll(5, TimeUnit.SECONDS);
    assertNotNull(first);
    Set<Integer> view = new HashSet<>();
    apply(view, first);
    assertEquals(Set.of(0x0A000001), view);

    // The client reads nothing while the endpoint flips 999 times.
    for (int i = 1; i < 1000; i++) {
      String ip = i % 2 == 1 ? "10.0.0.2" : "10.0.0.1";
      cluster.update(WEB, service(ready(ip, 8080)));
    }
    call.requestStream.request(1000);

    int received = 0;
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!view.equals(Set.of(0x0A000002))) {
      assertTrue(System.nanoTime() < deadline, "client did not catch up, view " + view);
      Update update = call.updates.poll(100, TimeUnit.MILLISECONDS);
      if (update != null) {
        apply(view, update);
        received++;
      }
    }
    assertNull(call.updates.poll(200, TimeUnit.MILLISECONDS));
    assertTrue(received <= 3, "received " + received + " updates after catching up");
  }

  /** Applies an update to a set of IPv4 addresses. */
  private static void apply(@NotNull Set<Integer> view, @NotNull Update update) {
    if (update.hasAdd()) {
      for (WeightedAddr addr : update.getAdd().getAddrsList()) {
        view.add(addr.getAddr().getIp().getIpv4());
      }
    }
    if (update.hasRemove()) {
      for (TcpAddress addr : update.getRemove().getAddrsList()) {
        view.remove(addr.getIp().getIpv4());
      }
    }
  }

  /** A call that requests one update, and more only when the test asks for them. */
  private static class ManualCall implements ClientResponseObserver<GetDestination, Update> {
    private final LinkedBlockingQueue<Update> updates = new LinkedBlockingQueue<>();
    private ClientCallStreamObserver<GetDestination> requestStream;

    @Override
    public void beforeStart(ClientCallStreamObserver<GetDestination> requestStream) {
      this.requestStream = requestStream;
      requestStream.disableAutoRequestWithInitial(1);
    }

    @Override
    public void onNext(Update update) {
      updates.add(update);
    }

    @Override
    public void onError(Throwable t) {}

    @Override
    public void onCompleted() {}
  }
}
