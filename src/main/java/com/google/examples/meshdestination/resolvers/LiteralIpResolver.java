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

import com.google.common.net.InetAddresses;
import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Endpoint;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import io.grpc.Context;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves destinations whose path is an IPv4 or IPv6 literal to exactly that address. The result
 * never changes, so it is emitted once.
 */
public class LiteralIpResolver implements Resolver {
  private static final Logger LOG = LoggerFactory.getLogger(LiteralIpResolver.class);

  @Override
  public boolean canResolve(@NotNull Destination destination) {
    return InetAddresses.isUriInetAddress(destination.path())
        || InetAddresses.isInetAddress(destination.path());
  }

  @Override
  public void streamResolution(
      @NotNull Destination destination,
      @NotNull Consumer<EndpointSet> emit,
      @NotNull Context done) {
    var address =
        new Address(InetAddresses.forUriString(uriHost(destination.path())), destination.port());
    LOG.debug("Resolved destination={} to address={}", destination, address);
    emit.accept(
        EndpointSet.of(
            destination, 0, List.of(new Endpoint(address, null, Map.of(), DEFAULT_WEIGHT))));
    Cancellation.await(done);
  }

  /** Adds square brackets to bare IPv6 literals, so they can be parsed as URI hosts. */
  @NotNull
  private static String uriHost(@NotNull String path) {
    if (path.contains(":") && !path.startsWith("[")) {
      return "[" + path + "]";
    }
    return path;
  }
}
