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

import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Full state of one Service port at one point in time. Cluster state is delivered as successive
 * snapshots, never as changes.
 *
 * @param exists false if the Service does not exist, or cannot be resolved to endpoints, e.g.,
 *     because it is an ExternalName Service
 * @param backends all backends, ready or not
 */
public record ServiceSnapshot(boolean exists, @NotNull List<BackendRecord> backends) {

  /** Canonical constructor. */
  public ServiceSnapshot {
    if (!exists && !backends.isEmpty()) {
      throw new IllegalArgumentException("a Service that does not exist cannot have backends");
    }
    backends = List.copyOf(backends);
  }

  /** Snapshot of a Service that does not exist. */
  @NotNull
  public static ServiceSnapshot absent() {
    return new ServiceSnapshot(false, List.of());
  }
}
