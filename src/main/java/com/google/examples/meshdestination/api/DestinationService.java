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

package com.google.examples.meshdestination.api;

import com.google.examples.meshdestination.api.v1.DestinationGrpc;
import com.google.examples.meshdestination.api.v1.GetDestination;
import com.google.examples.meshdestination.api.v1.Update;
import com.google.examples.meshdestination.endpoints.Delta;
import com.google.examples.meshdestination.endpoints.Destination;
import com.google.examples.meshdestination.resolvers.ResolutionException;
import com.google.examples.meshdestination.resolvers.UnresolvableDestinationException;
import com.google.examples.meshdestination.watch.Registry;
import com.google.examples.meshdestination.watch.Subscription;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements the streaming {@code Get} RPC of the Destination API.
 *
 * <p>Each call subscribes to the requested destination, and forwards deltas as {@link Update}
 * messages until the client cancels or the subscription ends. A subscription that ends because of
 * a resolution failure fails the call: {@code INVALID_ARGUMENT} if the destination cannot be
 * resolved at all, {@code UNAVAILABLE} otherwise. A subscription that ends cooperatively completes
 * the call.
 *
 * <p>Deltas are only taken from the subscription while the call is ready to send, so a slow client
 * leaves deltas in the bounded subscription buffer, where they collapse into a single resync.
 */
public class DestinationService extends DestinationGrpc.DestinationImplBase {
  private static final Logger LOG = LoggerFactory.getLogger(DestinationService.class);

  private final Registry registry;
  private final String clusterDomain;
  private final Executor forwarderExecutor;

  /**
   * Creates the service.
   *
   * @param registry source of subscriptions
   * @param clusterDomain DNS domain of the local cluster
   * @param forwarderExecutor runs one blocking forwarding loop per call
   */
  public DestinationService(
      @NotNull Registry registry,
      @NotNull String clusterDomain,
      @NotNull Executor forwarderExecutor) {
    this.registry = registry;
    this.clusterDomain = clusterDomain;
    this.forwarderExecutor = forwarderExecutor;
  }

  @Override
  public void get(GetDestination request, StreamObserver<Update> responseObserver) {
    var serverCallObserver = (ServerCallStreamObserver<Update>) responseObserver;
    Destination destination;
    try {
      destination = Destination.parse(request.getScheme(), request.getPath());
    } catch (IllegalArgumentException e) {
      LOG.info(
          "Rejecting request for scheme={} path={}: {}",
          request.getScheme(),
          request.getPath(),
          e.getMessage());
      responseObserver.onError(
          Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
      return;
    }
    LOG.debug(
        "Subscribing to destination={} contextToken={}", destination, request.getContextToken());
    Subscription subscription;
    try {
      subscription = registry.subscribe(destination);
    } catch (IllegalStateException e) {
      responseObserver.onError(
          Status.UNAVAILABLE.withDescription(e.getMessage()).asRuntimeException());
      return;
    }
    var readiness = new Readiness(serverCallObserver, subscription);
    serverCallObserver.setOnReadyHandler(readiness::signal);
    serverCallObserver.setOnCancelHandler(
        () -> {
          subscription.cancel();
          readiness.signal();
        });
    var translator = new UpdateTranslator(destination, clusterDomain);
    forwarderExecutor.execute(
        () -> forward(subscription, translator, serverCallObserver, readiness));
  }

  private void forward(
      @NotNull Subscription subscription,
      @NotNull UpdateTranslator translator,
      @NotNull ServerCallStreamObserver<Update> observer,
      @NotNull Readiness readiness) {
    try {
      readiness.await();
      Optional<Delta> delta = subscription.next();
      while (delta.isPresent()) {
        translator.translate(delta.get()).forEach(observer::onNext);
        readiness.await();
        delta = subscription.next();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      subscription.cancel();
      observer.onError(
          Status.UNAVAILABLE.withDescription("Server is shutting down").asRuntimeException());
      return;
    } catch (RuntimeException e) {
      LOG.error("Failed to stream updates for destination={}", subscription.destination(), e);
      subscription.cancel();
      observer.onError(Status.INTERNAL.withCause(e).asRuntimeException());
      return;
    }
    if (observer.isCancelled()) {
      LOG.debug("Client cancelled stream for destination={}", subscription.destination());
      return;
    }
    Optional<ResolutionException> error = subscription.terminalError();
    if (error.isEmpty()) {
      observer.onCompleted();
    } else if (error.get() instanceof UnresolvableDestinationException) {
      observer.onError(
          Status.INVALID_ARGUMENT.withDescription(error.get().getMessage()).asRuntimeException());
    } else {
      observer.onError(
          Status.UNAVAILABLE
              .withDescription(error.get().getMessage())
              .withCause(error.get())
              .asRuntimeException());
    }
  }

  /** Blocks the forwarder while the call cannot take more messages. */
  private static final class Readiness {
    /** Bounds the wait, the subscription ending does not signal. */
    private static final long RECHECK_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final ServerCallStreamObserver<Update> observer;
    private final Subscription subscription;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private Readiness(
        @NotNull ServerCallStreamObserver<Update> observer, @NotNull Subscription subscription) {
      this.observer = observer;
      this.subscription = subscription;
    }

    private void signal() {
      lock.lock();
      try {
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }

    /** Waits until the call is ready or cancelled, or the subscription is done. */
    private void await() throws InterruptedException {
      lock.lock();
      try {
        while (!observer.isReady() && !observer.isCancelled() && !subscription.isDone()) {
          changed.awaitNanos(RECHECK_NANOS);
        }
      } finally {
        lock.unlock();
      }
    }
  }
}
