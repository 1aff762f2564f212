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

import com.google.examples.meshdestination.endpoints.Delta;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.endpoints.Differ;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import com.google.examples.meshdestination.resolvers.ResolutionException;
import com.google.examples.meshdestination.resolvers.Resolver;
import com.google.examples.meshdestination.resolvers.UnresolvableDestinationException;
import io.grpc.Context;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out hub for one destination. Runs a single resolver for the destination and broadcasts the
 * deltas between its snapshots to every attached {@link Subscription}.
 *
 * <p>State, the latest snapshot, and the set of subscriptions are guarded by one lock. Snapshots
 * are diffed and broadcast with the lock held, so every subscription sees deltas in the order they
 * were computed. When a watch lock and a subscription lock are both needed, the watch lock is
 * taken first.
 */
public class Watch {
  private static final Logger LOG = LoggerFactory.getLogger(Watch.class);

  private final Destination destination;
  private final List<Resolver> resolvers;
  private final Executor resolverExecutor;
  private final ScheduledExecutorService scheduler;
  private final Duration linger;
  private final int bufferCapacity;
  private final Consumer<Watch> onClosed;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Long, Subscription> subscriptions = new LinkedHashMap<>();
  private WatchState state = WatchState.IDLE;
  private long nextSubscriptionId;
  private EndpointSet latest;
  private Context.CancellableContext done;
  private long drainGeneration;
  private ScheduledFuture<?> drainTimer;

  /**
   * Creates an idle watch. Resolution starts when the first subscriber attaches.
   *
   * @param destination the destination to resolve
   * @param resolvers resolvers in priority order
   * @param resolverExecutor runs the resolver, one thread for the lifetime of the watch
   * @param scheduler schedules the end of the linger window
   * @param linger how long to keep resolving after the last subscriber left
   * @param bufferCapacity buffer capacity of each subscription
   * @param onClosed called once when the watch closes, with the watch lock held
   */
  public Watch(
      @NotNull Destination destination,
      @NotNull List<Resolver> resolvers,
      @NotNull Executor resolverExecutor,
      @NotNull ScheduledExecutorService scheduler,
      @NotNull Duration linger,
      int bufferCapacity,
      @NotNull Consumer<Watch> onClosed) {
    if (bufferCapacity < 1) {
      throw new IllegalArgumentException(
          "bufferCapacity must be positive, got " + bufferCapacity);
    }
    this.destination = destination;
    this.resolvers = List.copyOf(resolvers);
    this.resolverExecutor = resolverExecutor;
    this.scheduler = scheduler;
    this.linger = linger;
    this.bufferCapacity = bufferCapacity;
    this.onClosed = onClosed;
  }

  @NotNull
  public Destination destination() {
    return destination;
  }

  @NotNull
  public WatchState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /** Number of attached subscriptions. */
  public int subscriberCount() {
    lock.lock();
    try {
      return subscriptions.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Attaches a new subscription.
   *
   * <p>The first attach selects a resolver and starts it. If no resolver can handle the
   * destination, the watch closes immediately, and the returned subscription has ended with an
   * {@link UnresolvableDestinationException}. A subscription that attaches after the first snapshot
   * receives the full current state as its first delta.
   *
   * @return the subscription, or null if the watch has already closed
   */
  @Nullable
  public Subscription attach() {
    lock.lock();
    try {
      if (state == WatchState.CLOSED) {
        return null;
      }
      var subscription =
          new Subscription(nextSubscriptionId++, destination, this, bufferCapacity);
      subscriptions.put(subscription.id(), subscription);
      if (state == WatchState.IDLE) {
        startResolver();
      } else if (state == WatchState.DRAINING) {
        stopDraining();
      }
      if (state != WatchState.CLOSED && latest != null) {
        subscription.offer(Differ.diff(null, latest));
      }
      return subscription;
    } finally {
      lock.unlock();
    }
  }

  /** Closes the watch, if it is not closed already. Subscriptions end without error. */
  public void close() {
    lock.lock();
    try {
      closeLocked(null);
    } finally {
      lock.unlock();
    }
  }

  void detach(@NotNull Subscription subscription) {
    lock.lock();
    try {
      if (subscriptions.remove(subscription.id()) == null) {
        return;
      }
      LOG.debug(
          "Subscription {} detached from destination={}, {} remaining",
          subscription.id(),
          destination,
          subscriptions.size());
      if (subscriptions.isEmpty() && state != WatchState.CLOSED) {
        startDraining();
      }
    } finally {
      lock.unlock();
    }
  }

  @Nullable
  Delta resync(@NotNull Subscription subscription) {
    lock.lock();
    try {
      return subscription.resync(latest);
    } finally {
      lock.unlock();
    }
  }

  private void startResolver() {
    Resolver resolver =
        resolvers.stream().filter(r -> r.canResolve(destination)).findFirst().orElse(null);
    if (resolver == null) {
      LOG.info("No resolver for destination={}", destination);
      closeLocked(new UnresolvableDestinationException(destination));
      return;
    }
    LOG.info(
        "Resolving destination={} with {}", destination, resolver.getClass().getSimpleName());
    state = WatchState.RESOLVING;
    var resolverDone = Context.ROOT.withCancellation();
    done = resolverDone;
    try {
      resolverExecutor.execute(() -> runResolver(resolver, resolverDone));
    } catch (RejectedExecutionException e) {
      LOG.warn("Could not start resolver for destination={}", destination, e);
      closeLocked(
          new ResolutionException("Could not start resolver for destination " + destination, e));
    }
  }

  private void runResolver(@NotNull Resolver resolver, @NotNull Context.CancellableContext done) {
    ResolutionException failure = null;
    try {
      resolver.streamResolution(destination, this::onSnapshot, done);
    } catch (ResolutionException e) {
      failure = e;
    } catch (RuntimeException e) {
      failure = new ResolutionException("Resolver failed for destination " + destination, e);
    }
    lock.lock();
    try {
      if (state == WatchState.CLOSED) {
        return;
      }
      if (failure != null) {
        LOG.warn("Resolution of destination={} failed", destination, failure);
      } else {
        LOG.info("Resolver for destination={} completed", destination);
      }
      closeLocked(failure);
    } finally {
      lock.unlock();
    }
  }

  private void onSnapshot(@NotNull EndpointSet snapshot) {
    lock.lock();
    try {
      if (state == WatchState.CLOSED) {
        return;
      }
      if (latest != null && snapshot.version() <= latest.version()) {
        LOG.debug(
            "Ignoring outdated snapshot version={} of destination={}, latest version={}",
            snapshot.version(),
            destination,
            latest.version());
        return;
      }
      Delta delta = Differ.diff(latest, snapshot);
      latest = snapshot;
      if (state == WatchState.RESOLVING) {
        state = WatchState.ACTIVE;
      }
      if (delta.isEmpty()) {
        return;
      }
      for (Subscription subscription : subscriptions.values()) {
        subscription.offer(delta);
      }
    } finally {
      lock.unlock();
    }
  }

  private void startDraining() {
    state = WatchState.DRAINING;
    long generation = ++drainGeneration;
    if (linger.isZero() || linger.isNegative()) {
      closeLocked(null);
      return;
    }
    LOG.debug("Draining destination={} for {}ms", destination, linger.toMillis());
    try {
      drainTimer =
          scheduler.schedule(
              () -> drainExpired(generation), linger.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      // The registry is shutting down.
      closeLocked(null);
    }
  }

  private void stopDraining() {
    drainGeneration++;
    if (drainTimer != null) {
      drainTimer.cancel(false);
      drainTimer = null;
    }
    state = latest == null ? WatchState.RESOLVING : WatchState.ACTIVE;
  }

  private void drainExpired(long generation) {
    lock.lock();
    try {
      if (state == WatchState.DRAINING && generation == drainGeneration) {
        closeLocked(null);
      }
    } finally {
      lock.unlock();
    }
  }

  private void closeLocked(@Nullable ResolutionException failure) {
    if (state == WatchState.CLOSED) {
      return;
    }
    state = WatchState.CLOSED;
    if (drainTimer != null) {
      drainTimer.cancel(false);
      drainTimer = null;
    }
    if (done != null) {
      done.cancel(null);
    }
    List<Subscription> ended = new ArrayList<>(subscriptions.values());
    subscriptions.clear();
    for (Subscription subscription : ended) {
      subscription.end(failure);
    }
    LOG.debug("Closed watch on destination={}", destination);
    onClosed.accept(this);
  }
}
