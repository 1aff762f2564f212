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

import org.jetbrains.annotations.Nullable;

/**
 * How a client proxy should talk to a meshed endpoint.
 *
 * @param protocol protocol the endpoint's proxy accepts, or null if the client should detect it
 * @param opaqueInboundPort inbound port of the endpoint's proxy, if connections should be tunneled
 *     to it as opaque transport
 */
public record ProtocolHint(@Nullable Protocol protocol, @Nullable Integer opaqueInboundPort) {

  /** Hinted protocols. */
  public enum Protocol {
    /** The proxy accepts HTTP/2, and upgrades HTTP/1 traffic it receives that way. */
    H2,
    /** Traffic must be proxied as opaque TCP, without protocol detection. */
    OPAQUE
  }
}
