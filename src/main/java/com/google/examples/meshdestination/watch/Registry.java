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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.resolvers.Resolver;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for subscribing to destinations. Holds one {@link Watch} per destination, created
 * lazily on the first subscription and removed when it closes.
 */
public class Registry implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Registry.class);

  private final List<Resolver> resolvers;
  private final Duration linger;
  private final int bufferCapacity;
  private final ConcurrentMap<Destination, Watch> watches = new ConcurrentHashMap<>();
  private final ExecutorService resolverExecutor;
  private final ScheduledExecutorService scheduler;
  private volatile boolean closed;

  /**
   * Creates an empty registry.
   *
   * @param resolvers resolvers in priority order
   * @param linger how long a watch keeps resolving after its last subscriber left
   * @param bufferCapacity buffer capacity of each subscription
   */
  public Registry(@NotNull List<Resolver> resolvers, @NotNull Duration linger, int bufferCapacity) {
    this.resolvers = List.copyOf(resolvers);
    this.linger = linger;
    this.bufferCapacity = bufferCapacity;
    this.resolverExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("resolver-%d").setDaemon(true).build());
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("watch-linger-%d").setDaemon(true).build());
  }

  /**
   * Subscribes to a destination, attaching to the existing watch for the destination, or creating
   * one. Concurrent calls for the same destination share a single watch.
   *
   * <p>If no resolver can handle the destination, the returned subscription has already ended
   * with an {@link com.google.examples.meshdestination.resolvers.UnresolvableDestinationException}.
   *
   * @throws IllegalStateException if the registry is closed
   */
  @NotNull
  public Subscription subscribe(@NotNull Destination destination) {
    while (true) {
      if (closed) {
        throw new IllegalStateException("Registry is closed");
      }
      Watch watch = watches.computeIfAbsent(destination, this::newWatch);
      Subscription subscription = watch.attach();
      if (subscription != null) {
        if (closed) {
          // The registry closed while attaching, and may have missed this watch.
          subscription.cancel();
          watch.close();
          throw new IllegalStateException("Registry is closed");
        }
        return subscription;
      }
      // Lost a race with the watch closing. Remove it, unless it is already gone, and retry.
      watches.remove(destination, watch);
    }
  }

  /** The watch for a destination, if there is one. */
  @NotNull
  public Optional<Watch> watch(@NotNull Destination destination) {
    return Optional.ofNullable(watches.get(destination));
  }

  /** Number of open watches. */
  public int size() {
    return watches.size();
  }

  /** Closes all watches. Their subscriptions end without error. */
  @Override
  public void close() {
    closed = true;
    LOG.info("Closing {} watches", watches.size());
    watches.values().forEach(Watch::close);
    resolverExecutor.shutdown();
    scheduler.shutdownNow();
  }

  @NotNull
  private Watch newWatch(@NotNull Destination destination) {
    LOG.debug("Creating watch for destination={}", destination);
    return new Watch(
        destination,
        resolvers,
        resolverExecutor,
        scheduler,
        linger,
        bufferCapacity,
        watch -> watches.remove(watch.destination(), watch));
  }
}
