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

import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;

/**
 * Live view of the backends of Services in one Kubernetes cluster.
 *
 * <p>Implementations must be thread-safe.
 */
public interface ClusterState {

  /** Name of the cluster, used in log messages. */
  @NotNull
  String clusterName();

  /**
   * Watches the backends of a Service port.
   *
   * <p>The listener is called with the current snapshot before this method returns, and again with
   * a full snapshot after every change to the Service or its backends, until the returned watch is
   * closed. Calls for one watch are never concurrent.
   *
   * @param service the Service to watch
   * @param port a port of the Service; backends are reported with the matching target port
   * @param listener receives snapshots
   * @throws ClusterStateException if the watch cannot be established at this time
   */
  @NotNull
  ClusterStateWatch watchService(
      @NotNull ServiceId service, int port, @NotNull Consumer<ServiceSnapshot> listener);
}
