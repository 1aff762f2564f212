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
import com.google.examples.meshdestination.endpoints.Endpoint;
import com.google.examples.meshdestination.endpoints.EndpointSet;
import com.google.examples.meshdestination.resolvers.ResolutionException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One subscriber's attachment to the delta stream of a {@link Watch}.
 *
 * <p>Deltas are buffered in a bounded queue. If the subscriber falls so far behind that the queue
 * overflows, the queued deltas are dropped and the subscription is marked stale. The next receive
 * then returns a single delta that takes the subscriber from what it has received so far to the
 * latest snapshot of the watch.
 *
 * <p>The stream ends when the subscriber {@link #cancel() cancels}, or when the watch closes. In
 * the latter case, {@link #terminalError()} tells whether the watch closed because resolution
 * failed.
 */
public class Subscription implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Subscription.class);

  private final long id;
  private final Destination destination;
  private final Watch watch;
  private final int capacity;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final ArrayDeque<Delta> buffer = new ArrayDeque<>();
  private boolean stale;
  private boolean cancelled;
  private boolean ended;
  private ResolutionException terminalError;

  /** What the subscriber has received so far, or null before the first delta. */
  private EndpointSet received;

  Subscription(long id, @NotNull Destination destination, @NotNull Watch watch, int capacity) {
    this.id = id;
    this.destination = destination;
    this.watch = watch;
    this.capacity = capacity;
  }

  long id() {
    return id;
  }

  @NotNull
  public Destination destination() {
    return destination;
  }

  /**
   * Blocks until the next delta is available, or the stream ends.
   *
   * @return the next delta, or empty if the subscription was cancelled or the watch closed
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  @NotNull
  public Optional<Delta> next() throws InterruptedException {
    return Optional.ofNullable(receive(null));
  }

  /**
   * Waits up to {@code timeout} for the next delta.
   *
   * @return the next delta, or null on timeout or if the stream has ended
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  @Nullable
  public Delta poll(@NotNull Duration timeout) throws InterruptedException {
    return receive(timeout);
  }

  /** Whether the stream has ended and all buffered deltas have been received. */
  public boolean isDone() {
    lock.lock();
    try {
      return (cancelled || ended) && buffer.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * The reason the watch closed, if it closed because resolution failed. Set at most once, before
   * the stream ends.
   */
  @NotNull
  public Optional<ResolutionException> terminalError() {
    lock.lock();
    try {
      return Optional.ofNullable(terminalError);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the subscription and detaches it from its watch. Unblocks pending receives. Idempotent,
   * and has no effect on other subscriptions of the same watch.
   */
  public void cancel() {
    lock.lock();
    try {
      if (cancelled) {
        return;
      }
      cancelled = true;
      buffer.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    watch.detach(this);
  }

  @Override
  public void close() {
    cancel();
  }

  @Nullable
  private Delta receive(@Nullable Duration timeout) throws InterruptedException {
    long remainingNanos = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
    while (true) {
      lock.lock();
      try {
        while (buffer.isEmpty() && !stale && !cancelled && !ended) {
          if (timeout == null) {
            changed.await();
          } else {
            if (remainingNanos <= 0) {
              return null;
            }
            remainingNanos = changed.awaitNanos(remainingNanos);
          }
        }
        if (!buffer.isEmpty()) {
          Delta delta = buffer.poll();
          record(delta);
          return delta;
        }
        if (cancelled || ended) {
          return null;
        }
      } finally {
        lock.unlock();
      }
      // Stale: the watch lock must be taken before ours.
      Delta resync = watch.resync(this);
      if (resync != null) {
        return resync;
      }
    }
  }

  /** Queues a delta. Called by the watch, with the watch lock held. */
  void offer(@NotNull Delta delta) {
    lock.lock();
    try {
      if (cancelled || ended || stale) {
        return;
      }
      if (buffer.size() >= capacity) {
        LOG.warn(
            "Subscription {} on destination={} overflowed its buffer of {} deltas, resyncing",
            id,
            destination,
            capacity);
        buffer.clear();
        stale = true;
      } else {
        buffer.add(delta);
      }
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Catches a stale subscription up with the latest snapshot. Called by the watch, with the watch
   * lock held, so that no broadcast can interleave.
   *
   * @return the delta to deliver, or null if there is nothing to deliver
   */
  @Nullable
  Delta resync(@Nullable EndpointSet latest) {
    lock.lock();
    try {
      if (!stale) {
        return null;
      }
      stale = false;
      buffer.clear();
      if (latest == null || cancelled) {
        return null;
      }
      Delta delta = Differ.diff(received, latest);
      if (delta.isEmpty()) {
        return null;
      }
      record(delta);
      return delta;
    } finally {
      lock.unlock();
    }
  }

  /** Ends the stream. Called by the watch when it closes. */
  void end(@Nullable ResolutionException error) {
    lock.lock();
    try {
      if (ended) {
        return;
      }
      ended = true;
      terminalError = error;
      if (stale) {
        buffer.clear();
        stale = false;
      }
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private void record(@NotNull Delta delta) {
    Set<Endpoint> endpoints = delta.applyTo(received == null ? Set.of() : received.endpoints());
    boolean exists = delta.noEndpoints() == null || delta.noEndpoints().exists();
    received = new EndpointSet(destination, 0, endpoints, exists || !endpoints.isEmpty());
  }
}
