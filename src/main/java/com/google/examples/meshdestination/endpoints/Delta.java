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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The change between two {@link EndpointSet} snapshots of the same destination.
 *
 * @param added endpoints present in the newer snapshot only
 * @param removed endpoints present in the older snapshot only
 * @param noEndpoints set when the newer snapshot has no endpoints and subscribers must be told so
 */
public record Delta(
    @NotNull Set<Endpoint> added,
    @NotNull Set<Endpoint> removed,
    @Nullable NoEndpoints noEndpoints) {

  private static final Delta EMPTY = new Delta(Set.of(), Set.of(), null);

  /** Canonical constructor. */
  public Delta {
    added = Collections.unmodifiableSet(new LinkedHashSet<>(added));
    removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
  }

  @NotNull
  public static Delta empty() {
    return EMPTY;
  }

  /** A delta that carries nothing, and therefore must never be sent to subscribers. */
  public boolean isEmpty() {
    return added.isEmpty() && removed.isEmpty() && noEndpoints == null;
  }

  /**
   * Returns the endpoint set that results from applying this delta to {@code endpoints}. Added
   * endpoints replace endpoints with the same address, so their payload is refreshed.
   */
  @NotNull
  public Set<Endpoint> applyTo(@NotNull Set<Endpoint> endpoints) {
    var result = new LinkedHashSet<>(endpoints);
    result.removeAll(removed);
    result.removeAll(added);
    result.addAll(added);
    if (noEndpoints != null) {
      result.clear();
    }
    return result;
  }

  /**
   * Signals that a destination has no endpoints.
   *
   * @param exists false if the destination does not exist at all, true if it exists but has no
   *     backends
   */
  public record NoEndpoints(boolean exists) {}
}
