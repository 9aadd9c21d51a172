package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.host.CancellationToken;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class Futures {
  private Futures() {}

  /**
   * Block until {@code work} completes or {@code token} is cancelled, whichever comes first.
   * Cancelling the token cancels {@code work}.
   *
   * @throws CancellationException if the token fired or the work was cancelled
   * @throws GoToImplementationException if the work failed
   */
  public static <T> T awaitOrCancel(CompletableFuture<T> work, CancellationToken token) {
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(token, "token");

    CompletableFuture<Void> link = token.onCancel().toCompletableFuture().thenAccept(cancelled -> {
      if (Boolean.TRUE.equals(cancelled)) work.cancel(true);
    });
    try {
      return work.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof CancellationException ce) throw ce;
      if (token.isCancellationRequested()) {
        // the work noticed the cancellation and bailed out its own way
        throw new CancellationException("Cancelled by user");
      }
      throw new GoToImplementationException("Asynchronous work failed: " + cause.getMessage(), cause);
    } finally {
      link.cancel(false);
    }
  }
}
