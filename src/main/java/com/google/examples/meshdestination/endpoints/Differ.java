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

import com.google.common.collect.Sets;
import com.google.examples.meshdestination.endpoints.Delta.NoEndpoints;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the minimal change between two endpoint snapshots.
 *
 * <p>Endpoints are compared by address only. An endpoint whose identity, labels or weight changed
 * while its address stayed the same does not produce a change.
 */
public final class Differ {

  private Differ() {}

  /**
   * Computes the delta that takes a subscriber from {@code previous} to {@code next}.
   *
   * <p>With no previous snapshot, all endpoints of {@code next} are added, or, if there are none,
   * the delta says so with {@link NoEndpoints}. Otherwise the delta holds the set differences in
   * both directions, plus {@link NoEndpoints} when {@code next} is empty and either {@code
   * previous} had endpoints or the destination's existence changed. The result is {@link
   * Delta#isEmpty() empty} when nothing observable changed.
   *
   * @param previous the snapshot the subscriber has seen, or null for a fresh subscriber
   * @param next the current snapshot
   */
  @NotNull
  public static Delta diff(@Nullable EndpointSet previous, @NotNull EndpointSet next) {
    if (previous == null) {
      if (next.isEmpty()) {
        return new Delta(Set.of(), Set.of(), new NoEndpoints(next.exists()));
      }
      return new Delta(next.endpoints(), Set.of(), null);
    }
    Set<Endpoint> added = Sets.difference(next.endpoints(), previous.endpoints());
    Set<Endpoint> removed = Sets.difference(previous.endpoints(), next.endpoints());
    NoEndpoints noEndpoints = null;
    if (next.isEmpty() && (!previous.isEmpty() || previous.exists() != next.exists())) {
      noEndpoints = new NoEndpoints(next.exists());
    }
    if (added.isEmpty() && removed.isEmpty() && noEndpoints == null) {
      return Delta.empty();
    }
    return new Delta(added, removed, noEndpoints);
  }
}
