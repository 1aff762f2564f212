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

import com.google.examples.meshdestination.endpoints.Destination;
import org.jetbrains.annotations.NotNull;

/** No resolver can handle the destination, e.g., because the authority is malformed. */
public class UnresolvableDestinationException extends ResolutionException {

  private final transient Destination destination;

  public UnresolvableDestinationException(@NotNull Destination destination) {
    super("No resolver for destination " + destination);
    this.destination = destination;
  }

  @NotNull
  public Destination getDestination() {
    return destination;
  }
}
