package se.alipsa.gotoimpl.core.host;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Cancellation signal shared between the command that waits and the search that works.
 * <p>
 * Besides polling, interested parties can register on {@link #onCancel()} to stop
 * expensive work as soon as the user gives up.
 */
public interface CancellationToken {

  boolean isCancellationRequested();

  /** @throws CancellationException when cancellation was requested */
  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new CancellationException("Cancelled by user");
    }
  }

  /**
   * Completes to true when cancellation is requested, and completes
   * to false when the token will never be cancelled. May never complete.
   */
  CompletionStage<Boolean> onCancel();

  /** A token that is never cancelled. */
  CancellationToken NONE = new CancellationToken() {
    private final CompletableFuture<Boolean> never = CompletableFuture.completedFuture(false);

    @Override public boolean isCancellationRequested() { return false; }

    @Override public CompletionStage<Boolean> onCancel() { return never; }
  };
}
