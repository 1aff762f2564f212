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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;

/** In-memory cluster state, updated by tests. */
public class FakeClusterState implements ClusterState {

  private final String clusterName;
  private final Map<ServiceId, ServiceSnapshot> snapshots = new HashMap<>();
  private final Map<ServiceId, List<Consumer<ServiceSnapshot>>> listeners = new HashMap<>();
  private final List<Integer> requestedPorts = new ArrayList<>();
  private int failuresRemaining;

  public FakeClusterState(@NotNull String clusterName) {
    this.clusterName = clusterName;
  }

  @Override
  @NotNull
  public String clusterName() {
    return clusterName;
  }

  /** Replaces the snapshot of a Service, and notifies its watchers. */
  public synchronized void update(@NotNull ServiceId service, @NotNull ServiceSnapshot snapshot) {
    snapshots.put(service, snapshot);
    for (Consumer<ServiceSnapshot> listener : listeners.getOrDefault(service, List.of())) {
      listener.accept(snapshot);
    }
  }

  /** Makes the next {@code count} calls to {@link #watchService} fail. */
  public synchronized void failNextWatches(int count) {
    failuresRemaining = count;
  }

  /** Number of watches that have not been closed. */
  public synchronized int activeWatches() {
    return listeners.values().stream().mapToInt(List::size).sum();
  }

  /** Ports passed to {@link #watchService}, in call order. */
  public synchronized List<Integer> requestedPorts() {
    return List.copyOf(requestedPorts);
  }

  @Override
  @NotNull
  public synchronized ClusterStateWatch watchService(
      @NotNull ServiceId service, int port, @NotNull Consumer<ServiceSnapshot> listener) {
    if (failuresRemaining > 0) {
      failuresRemaining--;
      throw new ClusterStateException("cluster " + clusterName + " is not ready");
    }
    requestedPorts.add(port);
    listeners.computeIfAbsent(service, key -> new ArrayList<>()).add(listener);
    listener.accept(snapshots.getOrDefault(service, ServiceSnapshot.absent()));
    return () -> {
      synchronized (FakeClusterState.this) {
        List<Consumer<ServiceSnapshot>> forService = listeners.get(service);
        if (forService != null) {
          forService.remove(listener);
          if (forService.isEmpty()) {
            listeners.remove(service);
          }
        }
      }
    };
  }
}
