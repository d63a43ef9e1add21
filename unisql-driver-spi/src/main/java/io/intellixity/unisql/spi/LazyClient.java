package io.intellixity.unisql.spi;

import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Single-flight lazy holder for a backend client.
 * <p>
 * The first caller to find no client runs the initializer; every caller arriving while it runs
 * joins the same attempt and receives the same client, or the same exception instance. A failed
 * attempt is forgotten so the next call retries. {@link #close()} rejects new acquisitions, waits
 * for an in-flight attempt, closes the client and resets to the initial state.
 */
final class LazyClient<C> {
  private static final Logger log = LoggerFactory.getLogger(LazyClient.class);

  @FunctionalInterface
  interface Initializer<C> {
    C create() throws Exception;
  }

  private final Object lock = new Object();
  private final Initializer<C> initializer;
  private final Function<Throwable, DriverException> translator;
  private final Consumer<C> closer;

  private C client;
  private CompletableFuture<C> pending;
  private boolean disconnecting;

  LazyClient(Initializer<C> initializer, Function<Throwable, DriverException> translator, Consumer<C> closer, C existing) {
    this.initializer = Objects.requireNonNull(initializer, "initializer");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.closer = Objects.requireNonNull(closer, "closer");
    this.client = existing;
  }

  C get() {
    CompletableFuture<C> attempt;
    boolean owner = false;
    synchronized (lock) {
      if (disconnecting) throw new ConnectionException("Driver is disconnecting", ErrorCode.CONNECTION_CLOSED);
      if (client != null) return client;
      if (pending == null) {
        pending = new CompletableFuture<>();
        owner = true;
      }
      attempt = pending;
    }
    return owner ? initialize(attempt) : await(attempt);
  }

  private C initialize(CompletableFuture<C> attempt) {
    C created;
    try {
      created = initializer.create();
      if (created == null) throw new IllegalStateException("Client initializer returned null");
    } catch (Throwable t) {
      Throwable failure = (t instanceof Error) ? t : translator.apply(t);
      synchronized (lock) {
        if (pending == attempt) pending = null;
      }
      attempt.completeExceptionally(failure);
      if (failure instanceof Error e) throw e;
      throw (DriverException) failure;
    }
    synchronized (lock) {
      client = created;
      if (pending == attempt) pending = null;
    }
    attempt.complete(created);
    return created;
  }

  private C await(CompletableFuture<C> attempt) {
    try {
      return attempt.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw translator.apply(cause);
    } catch (CancellationException e) {
      throw new ConnectionException("Client initialization was cancelled", ErrorCode.CONNECTION_CLOSED, null, e);
    }
  }

  boolean isDisconnecting() {
    synchronized (lock) {
      return disconnecting;
    }
  }

  boolean isInitialized() {
    synchronized (lock) {
      return client != null;
    }
  }

  void close() {
    CompletableFuture<C> inFlight;
    synchronized (lock) {
      disconnecting = true;
      inFlight = pending;
    }
    try {
      if (inFlight != null) {
        try {
          inFlight.join();
        } catch (CompletionException | CancellationException e) {
          // Nothing was created, so there is nothing to close.
          log.debug("unisql.disconnect init_failed error={}", String.valueOf(e.getCause()));
        }
      }
      C toClose;
      synchronized (lock) {
        toClose = client;
        client = null;
      }
      if (toClose != null) closer.accept(toClose);
    } finally {
      synchronized (lock) {
        client = null;
        pending = null;
        disconnecting = false;
      }
    }
  }
}
