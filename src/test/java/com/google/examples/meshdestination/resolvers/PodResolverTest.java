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

import static com.google.examples.meshdestination.cluster.Backends.pod;
import static com.google.examples.meshdestination.cluster.Backends.service;
import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.meshdestination.cluster.FakeClusterState;
import com.google.examples.meshdestination.cluster.ServiceId;
import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Destination.Scheme;
import com.google.examples.meshdestination.endpoints.Endpoint;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import org.junit.jupiter.api.Test;

public class PodResolverTest {

  private static final ServiceId WEB = new ServiceId("emojivoto", "web");
  private static final Destination WEB_0 =
      new Destination(Scheme.K8S, "web-0.web.emojivoto.svc.cluster.local", 8080);
  private static final String IDENTITY =
      "web.emojivoto.serviceaccount.identity.linkerd.cluster.local";

  private final FakeClusterState cluster = new FakeClusterState("local");
  private final PodResolver resolver =
      new PodResolver(cluster, "cluster.local", RetryPolicy.DEFAULT);

  @Test
  void canResolveInstanceNames() {
    assertTrue(resolver.canResolve(WEB_0));
    assertFalse(
        resolver.canResolve(new Destination(Scheme.K8S, "web.emojivoto.svc.cluster.local", 80)));
    assertFalse(
        resolver.canResolve(
            new Destination(Scheme.MIRROR, "web-0.web.emojivoto.svc.cluster.local", 80)));
  }

  @Test
  void resolvesThePodWithTheMatchingHostname() throws Exception {
    cluster.update(
        WEB,
        service(
            pod("10.0.0.1", 8080, "web-0", IDENTITY),
            pod("10.0.0.2", 8080, "web-1", null)));
    try (var runner = new ResolverRunner(resolver, WEB_0)) {
      EndpointSet snapshot = runner.next();
      assertTrue(snapshot.exists());
      assertEquals(1, snapshot.endpoints().size());
      Endpoint endpoint = snapshot.endpoints().iterator().next();
      assertEquals(Address.of("10.0.0.1", 8080), endpoint.address());
      assertEquals(IDENTITY, endpoint.identity());
    }
  }

  @Test
  void missingPodDoesNotExist() throws Exception {
    cluster.update(WEB, service(pod("10.0.0.2", 8080, "web-1", null)));
    try (var runner = new ResolverRunner(resolver, WEB_0)) {
      assertFalse(runner.next().exists());

      cluster.update(WEB, service(pod("10.0.0.3", 8080, "web-0", null)));
      EndpointSet snapshot = runner.next();
      assertTrue(snapshot.exists());
      assertEquals(Address.of("10.0.0.3", 8080), snapshot.endpoints().iterator().next().address());
    }
  }
}
