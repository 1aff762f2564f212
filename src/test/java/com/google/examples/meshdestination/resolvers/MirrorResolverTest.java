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

import static com.google.examples.meshdestination.cluster.Backends.ready;
import static com.google.examples.meshdestination.cluster.Backends.service;
import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.meshdestination.cluster.FakeClusterState;
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Destination.Scheme;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class MirrorResolverTest {

  private static final ServiceId WEB = new ServiceId("emojivoto", "web");

  private final FakeClusterState west = new FakeClusterState("west");
  private final FakeClusterState usWest = new FakeClusterState("us-west");
  private final MirrorResolver resolver =
      new MirrorResolver(
          Map.of("west", west, "us-west", usWest), "cluster.local", RetryPolicy.DEFAULT);

  @Test
  void canResolveMirrorsOfLinkedClusters() {
    assertTrue(resolver.canResolve(mirror("web-west.emojivoto.svc.cluster.local")));
    assertFalse(resolver.canResolve(mirror("web-east.emojivoto.svc.cluster.local")));
    assertFalse(resolver.canResolve(mirror("west.emojivoto.svc.cluster.local")));
    assertFalse(resolver.canResolve(mirror("-west.emojivoto.svc.cluster.local")));
    assertFalse(
        resolver.canResolve(
            new Destination(Scheme.K8S, "web-west.emojivoto.svc.cluster.local", 80)));
  }

  @Test
  void resolvesTheServiceInTheRemoteCluster() throws Exception {
    west.update(WEB, service(ready("10.9.0.1", 8080)));
    try (var runner =
        new ResolverRunner(resolver, mirror("web-west.emojivoto.svc.cluster.local"))) {
      EndpointSet snapshot = runner.next();
      assertTrue(snapshot.exists());
      assertEquals(Address.of("10.9.0.1", 8080), snapshot.endpoints().iterator().next().address());
      assertEquals(1, west.activeWatches());
      assertEquals(0, usWest.activeWatches());
    }
  }

  @Test
  void longestLinkNameWins() throws Exception {
    usWest.update(WEB, service(ready("10.8.0.1", 8080)));
    try (var runner =
        new ResolverRunner(resolver, mirror("web-us-west.emojivoto.svc.cluster.local"))) {
      EndpointSet snapshot = runner.next();
      assertEquals(Address.of("10.8.0.1", 8080), snapshot.endpoints().iterator().next().address());
      assertEquals(0, west.activeWatches());
    }
  }

  private static Destination mirror(String path) {
    return new Destination(Scheme.MIRROR, path, 80);
  }
}
