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

import com.google.common.net.HostAndPort;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * A logical destination that clients want to reach. Destinations are the keys used to share one
 * watch between all subscribers interested in the same destination.
 *
 * @param scheme how the path should be interpreted
 * @param path host part of the authority, e.g., {@code web.emojivoto.svc.cluster.local} or {@code
 *     10.1.2.3}
 * @param port destination port, 0 to 65535
 */
public record Destination(@NotNull Scheme scheme, @NotNull String path, int port) {

  /** Port used when the authority does not include one. */
  public static final int DEFAULT_PORT = 80;

  /** Canonical constructor. */
  public Destination {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 0 and 65535, got " + port);
    }
  }

  /**
   * Parses a destination from the wire representation used by the Destination API.
   *
   * @param scheme one of {@code k8s}, {@code ip} or {@code mirror}
   * @param authority {@code host[:port]}, IPv6 hosts in square brackets
   * @throws IllegalArgumentException if the scheme is unknown or the authority is malformed
   */
  @NotNull
  public static Destination parse(@NotNull String scheme, @NotNull String authority) {
    HostAndPort hostAndPort;
    try {
      hostAndPort = HostAndPort.fromString(authority).withDefaultPort(DEFAULT_PORT);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid authority: " + authority, e);
    }
    return new Destination(
        Scheme.fromName(scheme), hostAndPort.getHost(), hostAndPort.getPort());
  }

  @Override
  public String toString() {
    return scheme.schemeName() + "://" + path + ":" + port;
  }

  /** Destination schemes. */
  public enum Scheme {
    IP("ip"),
    K8S("k8s"),
    MIRROR("mirror");

    private final String schemeName;

    Scheme(String schemeName) {
      this.schemeName = schemeName;
    }

    /** Wire name of the scheme. */
    @NotNull
    public String schemeName() {
      return schemeName;
    }

    /**
     * Looks up a scheme by its wire name, ignoring case.
     *
     * @throws IllegalArgumentException for unsupported schemes
     */
    @NotNull
    public static Scheme fromName(@NotNull String name) {
      var normalized = name.toLowerCase(Locale.ROOT);
      for (Scheme scheme : values()) {
        if (scheme.schemeName.equals(normalized)) {
          return scheme;
        }
      }
      throw new IllegalArgumentException("Unsupported scheme " + name);
    }
  }
}
