package com.gitdocs.importer.sync;

import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Cooperative cancellation token shared by every stage of one run. Blocking code polls {@link
 * #throwIfCancelled()}; reactive calls race against {@link #signal()}.
 */
public final class SyncCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Sinks.One<Boolean> sink = Sinks.one();

  public static SyncCancellation create() {
    return new SyncCancellation();
  }

  /** A token that is never cancelled. */
  public static SyncCancellation none() {
    return new SyncCancellation();
  }

  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      sink.tryEmitValue(Boolean.TRUE);
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new SyncCancelledException("Import cancelled");
    }
  }

  /** Emits once {@link #cancel()} is called. */
  public Mono<Boolean> signal() {
    return sink.asMono();
  }
}
