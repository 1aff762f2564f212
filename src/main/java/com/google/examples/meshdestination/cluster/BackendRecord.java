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

package com.google.examples.meshdestination.cluster;

import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.ProtocolHint;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One backend of a Service as observed in cluster state.
 *
 * @param address pod IP and target port
 * @param identity mTLS identity of the backing workload, if it is meshed
 * @param labels metric labels describing the backend, e.g., pod and zone
 * @param ready whether the backend is ready to receive traffic
 * @param hostname hostname of the backend within a headless Service, if any
 * @param protocolHint how clients should talk to the backend, if it is meshed
 */
public record BackendRecord(
    @NotNull Address address,
    @Nullable String identity,
    @NotNull Map<String, String> labels,
    boolean ready,
    @Nullable String hostname,
    @Nullable ProtocolHint protocolHint) {

  /** Canonical constructor. */
  public BackendRecord {
    labels = Map.copyOf(labels);
  }

  /** Creates a backend without a protocol hint. */
  public BackendRecord(
      @NotNull Address address,
      @Nullable String identity,
      @NotNull Map<String, String> labels,
      boolean ready,
      @Nullable String hostname) {
    this(address, identity, labels, ready, hostname, null);
  }
}
