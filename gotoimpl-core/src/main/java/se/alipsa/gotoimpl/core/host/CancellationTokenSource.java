package se.alipsa.gotoimpl.core.host;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/** Owner side of a {@link CancellationToken}. */
public final class CancellationTokenSource {

  private final CompletableFuture<Boolean> cancelled = new CompletableFuture<>();

  private final CancellationToken token = new CancellationToken() {
    @Override public boolean isCancellationRequested() { return cancelled.getNow(false); }

    @Override public CompletionStage<Boolean> onCancel() { return cancelled.minimalCompletionStage(); }

    @Override public String toString() { return "CancellationToken{cancelled=" + isCancellationRequested() + '}'; }
  };

  public CancellationToken token() {
    return token;
  }

  /** Request cancellation. Returns false if the token was already settled. */
  public boolean cancel() {
    return cancelled.complete(true);
  }

  /** Settle the token as "never cancelled", releasing anything registered on it. */
  public void dispose() {
    cancelled.complete(false);
  }

  public boolean isCancellationRequested() {
    return token.isCancellationRequested();
  }
}
