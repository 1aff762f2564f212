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

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.examples.meshdestination.endpoints.Address;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Endpoint;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import com.google.examples.meshdestination.resolvers.ResolutionException;
import com.google.examples.meshdestination.resolvers.Resolver;
import io.grpc.Context;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;

/**
 * Resolver for one destination whose snapshots and failures are driven by the test. Each run
 * blocks until it is cancelled or {@link #fail failed}.
 */
class ScriptedResolver implements Resolver {

  private final Destination destination;
  private final AtomicInteger starts = new AtomicInteger();
  private final Semaphore started = new Semaphore(0);
  private final Semaphore stopped = new Semaphore(0);
  private volatile Run current;

  ScriptedResolver(@NotNull Destination destination) {
    this.destination = destination;
  }

  @Override
  public boolean canResolve(@NotNull Destination destination) {
    return this.destination.equals(destination);
  }

  @Override
  public void streamResolution(
      @NotNull Destination destination,
      @NotNull Consumer<EndpointSet> emit,
      @NotNull Context done)
      throws ResolutionException {
    var run = new Run(emit);
    done.addListener(context -> run.result.complete(null), MoreExecutors.directExecutor());
    current = run;
    starts.incrementAndGet();
    started.release();
    try {
      ResolutionException failure = run.result.get();
      if (failure != null) {
        throw failure;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      throw new IllegalStateException(e);
    } finally {
      stopped.release();
    }
  }

  /** Emits a snapshot of existing endpoints from the current run. */
  void emit(long version, String... ips) throws InterruptedException {
    List<Endpoint> endpoints = new ArrayList<>();
    for (String ip : ips) {
      endpoints.add(endpoint(ip));
    }
    emit(EndpointSet.of(destination, version, endpoints));
  }

  void emit(@NotNull EndpointSet snapshot) throws InterruptedException {
    awaitRun().emit.accept(snapshot);
  }

  /** Ends the current run with a failure. */
  void fail(@NotNull ResolutionException failure) throws InterruptedException {
    awaitRun().result.complete(failure);
  }

  int starts() {
    return starts.get();
  }

  void awaitStopped() throws InterruptedException {
    assertTrue(stopped.tryAcquire(5, TimeUnit.SECONDS), "resolver was not stopped");
  }

  @NotNull
  static Endpoint endpoint(@NotNull String ip) {
    return new Endpoint(Address.of(ip, 8080));
  }

  @NotNull
  private Run awaitRun() throws InterruptedException {
    if (started.tryAcquire(5, TimeUnit.SECONDS)) {
      started.release();
    }
    assertNotNull(current, "resolver was not started");
    return current;
  }

  private static class Run {
    private final Consumer<EndpointSet> emit;
    private final CompletableFuture<ResolutionException> result = new CompletableFuture<>();

    private Run(Consumer<EndpointSet> emit) {
      this.emit = emit;
    }
  }
}
