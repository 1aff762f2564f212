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

import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.Context;
import io.grpc.Context.CancellationListener;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/** Blocking waits on a cancellable {@link Context}. */
public final class Cancellation {

  private Cancellation() {}

  /**
   * Blocks until {@code done} is cancelled, or the calling thread is interrupted. An interrupt is
   * treated as cancellation, and the interrupt flag is restored.
   */
  public static void await(@NotNull Context done) {
    sleep(done, null);
  }

  /**
   * Blocks for the given duration, or until {@code done} is cancelled. A null duration blocks
   * until cancellation.
   *
   * @return true if {@code done} was cancelled or the thread was interrupted
   */
  public static boolean sleep(@NotNull Context done, @Nullable Duration duration) {
    var latch = new CountDownLatch(1);
    CancellationListener listener = context -> latch.countDown();
    done.addListener(listener, MoreExecutors.directExecutor());
    try {
      if (duration == null) {
        latch.await();
        return true;
      }
      return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    } finally {
      done.removeListener(listener);
    }
  }
}
