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

package com.google.examples.meshdestination.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.meshdestination.endpoints.Destination.Scheme;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class EndpointSetTest {

  private static final Destination WEB =
      new Destination(Scheme.K8S, "web.ns.svc.cluster.local", 80);

  @Test
  void missingDestinationCannotHaveEndpoints() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new EndpointSet(WEB, 0, Set.of(new Endpoint(Address.of("10.0.0.1", 80))), false));
  }

  @Test
  void versionMustNotBeNegative() {
    assertThrows(IllegalArgumentException.class, () -> EndpointSet.of(WEB, -1, List.of()));
  }

  @Test
  void endpointsAreImmutable() {
    EndpointSet snapshot =
        EndpointSet.of(WEB, 0, List.of(new Endpoint(Address.of("10.0.0.1", 80))));
    assertThrows(
        UnsupportedOperationException.class,
        () -> snapshot.endpoints().add(new Endpoint(Address.of("10.0.0.2", 80))));
  }

  @Test
  void endpointEqualityIgnoresPayload() {
    var a = new Endpoint(Address.of("10.0.0.1", 80), "a", Map.of("pod", "a"), 1L);
    var b = new Endpoint(Address.of("10.0.0.1", 80), "b", Map.of(), null);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new Endpoint(Address.of("10.0.0.1", 81)));
  }

  @Test
  void endpointWeightIsUnsigned32Bit() {
    var address = Address.of("10.0.0.1", 80);
    assertEquals(0xFFFFFFFFL, new Endpoint(address, null, Map.of(), 0xFFFFFFFFL).weight());
    assertThrows(
        IllegalArgumentException.class, () -> new Endpoint(address, null, Map.of(), 1L << 32));
    assertThrows(IllegalArgumentException.class, () -> new Endpoint(address, null, Map.of(), -1L));
  }

  @Test
  void addressFormatting() {
    assertEquals("10.0.0.1:80", Address.of("10.0.0.1", 80).toString());
    assertEquals("[2001:db8::1]:443", Address.of("2001:db8::1", 443).toString());
    assertTrue(Address.of("2001:db8::1", 443).isIpv6());
    assertThrows(IllegalArgumentException.class, () -> Address.of("web", 80));
  }
}
