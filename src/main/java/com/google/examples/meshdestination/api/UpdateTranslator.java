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

import com.google.examples.meshdestination.api.v1.AddrSet;
import com.google.examples.meshdestination.api.v1.IPAddress;
import com.google.examples.meshdestination.api.v1.IPv6;
import com.google.examples.meshdestination.api.v1.NoEndpoints;
import com.google.examples.meshdestination.api.v1.ProtocolHint.H2;
import com.google.examples.meshdestination.api.v1.ProtocolHint.Opaque;
import com.google.examples.meshdestination.api.v1.ProtocolHint.OpaqueTransport;
import com.google.examples.meshdestination.api.v1.TcpAddress;
import com.google.examples.meshdestination.api.v1.TlsIdentity;
import com.google.examples.meshdestination.api.v1.Update;
import com.google.examples.meshdestination.api.v1.WeightedAddr;
import com.google.examples.meshdestination.api.v1.WeightedAddrSet;
import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.Delta;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Destination.Scheme;
import com.google.examples.meshdestination.endpoints.Endpoint;
import com.google.examples.meshdestination.endpoints.ProtocolHint;
import com.google.examples.meshdestination.endpoints.ProtocolHint.Protocol;
import com.google.examples.meshdestination.endpoints.ServiceName;
import com.google.examples.meshdestination.resolvers.Resolver;
import java.net.InetAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;

/**
 * Turns deltas of one destination into {@link Update} messages.
 *
 * <p>A delta becomes up to three updates, in this order: {@code add}, {@code remove}, {@code
 * no_endpoints}.
 */
public class UpdateTranslator {

  private final Map<String, String> setLabels;

  /**
   * Creates a translator for a destination.
   *
   * @param destination the destination of all deltas
   * @param clusterDomain DNS domain of the local cluster, used to recognize Service names
   */
  public UpdateTranslator(@NotNull Destination destination, @NotNull String clusterDomain) {
    this.setLabels = setLabels(destination, clusterDomain);
  }

  /** Returns the updates for a delta, or no updates for an empty delta. */
  @NotNull
  public List<Update> translate(@NotNull Delta delta) {
    var updates = new ArrayList<Update>(3);
    if (!delta.added().isEmpty()) {
      var add = WeightedAddrSet.newBuilder().putAllMetricLabels(setLabels);
      for (Endpoint endpoint : delta.added()) {
        add.addAddrs(toWeightedAddr(endpoint));
      }
      updates.add(Update.newBuilder().setAdd(add).build());
    }
    if (!delta.removed().isEmpty()) {
      var remove = AddrSet.newBuilder();
      for (Endpoint endpoint : delta.removed()) {
        remove.addAddrs(toTcpAddress(endpoint.address()));
      }
      updates.add(Update.newBuilder().setRemove(remove).build());
    }
    if (delta.noEndpoints() != null) {
      updates.add(
          Update.newBuilder()
              .setNoEndpoints(NoEndpoints.newBuilder().setExists(delta.noEndpoints().exists()))
              .build());
    }
    return updates;
  }

  @NotNull
  static WeightedAddr toWeightedAddr(@NotNull Endpoint endpoint) {
    long weight = endpoint.weight() != null ? endpoint.weight() : Resolver.DEFAULT_WEIGHT;
    var addr =
        WeightedAddr.newBuilder()
            .setAddr(toTcpAddress(endpoint.address()))
            .setWeight((int) weight)
            .putAllMetricLabels(endpoint.metricLabels());
    if (endpoint.identity() != null) {
      addr.setTlsIdentity(TlsIdentity.newBuilder().setDnsLikeIdentity(endpoint.identity()));
    }
    if (endpoint.protocolHint() != null) {
      addr.setProtocolHint(toProtocolHint(endpoint.protocolHint()));
    }
    return addr.build();
  }

  @NotNull
  static com.google.examples.meshdestination.api.v1.ProtocolHint toProtocolHint(
      @NotNull ProtocolHint hint) {
    var protocolHint = com.google.examples.meshdestination.api.v1.ProtocolHint.newBuilder();
    if (hint.protocol() == Protocol.H2) {
      protocolHint.setH2(H2.getDefaultInstance());
    } else if (hint.protocol() == Protocol.OPAQUE) {
      protocolHint.setOpaque(Opaque.getDefaultInstance());
    }
    if (hint.opaqueInboundPort() != null) {
      protocolHint.setOpaqueTransport(
          OpaqueTransport.newBuilder().setInboundPort(hint.opaqueInboundPort()));
    }
    return protocolHint.build();
  }

  @NotNull
  static TcpAddress toTcpAddress(@NotNull Address address) {
    return TcpAddress.newBuilder()
        .setIp(toIpAddress(address.ip()))
        .setPort(address.port())
        .build();
  }

  /** IPv4 addresses are encoded as one 32-bit value, IPv6 addresses as two 64-bit values. */
  @NotNull
  static IPAddress toIpAddress(@NotNull InetAddress ip) {
    ByteBuffer bytes = ByteBuffer.wrap(ip.getAddress());
    if (bytes.capacity() == 4) {
      return IPAddress.newBuilder().setIpv4(bytes.getInt()).build();
    }
    return IPAddress.newBuilder()
        .setIpv6(IPv6.newBuilder().setFirst(bytes.getLong()).setLast(bytes.getLong()))
        .build();
  }

  @NotNull
  private static Map<String, String> setLabels(
      @NotNull Destination destination, @NotNull String clusterDomain) {
    if (destination.scheme() == Scheme.IP) {
      return Map.of();
    }
    return ServiceName.parse(destination.path(), clusterDomain)
        .map(name -> Map.of("namespace", name.namespace(), "service", name.name()))
        .orElse(Map.of());
  }
}
