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

package com.google.examples.meshdestination.watch;

/** Lifecycle of a {@link Watch}. */
public enum WatchState {
  /** Created, nobody attached yet. */
  IDLE,
  /** A resolver is running, but has not produced a snapshot yet. */
  RESOLVING,
  /** Snapshots are being broadcast to subscribers. */
  ACTIVE,
  /** The last subscriber left. The resolver keeps running until the linger window expires. */
  DRAINING,
  /** Terminal. The resolver has been stopped and all subscriptions have ended. */
  CLOSED
}
