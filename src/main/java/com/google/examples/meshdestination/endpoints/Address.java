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

import com.google.common.net.InetAddresses;
import java.net.InetAddress;
import org.jetbrains.annotations.NotNull;

/**
 * An IPv4 or IPv6 socket address.
 *
 * <p>Unlike {@link java.net.InetSocketAddress}, this never triggers name resolution.
 */
public record Address(@NotNull InetAddress ip, int port) {

  /** Canonical constructor. */
  public Address {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 0 and 65535, got " + port);
    }
  }

  /**
   * Creates an address from an IP literal.
   *
   * @throws IllegalArgumentException if {@code ip} is not an IPv4 or IPv6 literal
   */
  @NotNull
  public static Address of(@NotNull String ip, int port) {
    return new Address(InetAddresses.forString(ip), port);
  }

  /** Returns true for IPv6 addresses, including IPv4-mapped ones. */
  public boolean isIpv6() {
    return ip.getAddress().length == 16;
  }

  @Override
  public String toString() {
    return InetAddresses.toUriString(ip) + ":" + port;
  }
}
