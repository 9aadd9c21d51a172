package se.alipsa.gotoimpl.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.gotoimpl.core.host.WaitContext;
import se.alipsa.gotoimpl.core.host.WaitScope;
import se.alipsa.gotoimpl.core.service.GoToImplementationResult;
import se.alipsa.gotoimpl.core.service.SimpleFindUsagesContext;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Runs the selected lookup under a cancellable wait scope. The calling thread is blocked
 * until the lookup is done or the user cancels; the scope is closed on every way out.
 */
public final class BoundedLookupExecutor {

  private static final Logger log = LoggerFactory.getLogger(BoundedLookupExecutor.class);

  /**
   * @throws CancellationException if the user cancelled the wait
   * @throws GoToImplementationException if the lookup failed
   */
  public LookupOutcome execute(LookupStrategy strategy, LookupRequest request, WaitContext waitContext) {
    return execute(strategy, request, waitContext, outcome -> {});
  }

  /**
   * Like {@link #execute(LookupStrategy, LookupRequest, WaitContext)} but hands the outcome to
   * {@code withinScope} before the wait scope closes, so the user can still cancel whatever it
   * blocks on.
   */
  public LookupOutcome execute(LookupStrategy strategy, LookupRequest request, WaitContext waitContext,
                               Consumer<LookupOutcome> withinScope) {
    if (strategy instanceof LookupStrategy.None) {
      throw new IllegalArgumentException("Nothing to execute for strategy " + strategy);
    }
    try (WaitScope ignored = waitContext.addScope(true, CommandResources.LOCATING_IMPLEMENTATIONS)) {
      request.getCancellationToken().throwIfCancellationRequested();
      LookupOutcome outcome = strategy instanceof LookupStrategy.Streaming streaming
          ? executeStreaming(streaming, request)
          : executeSynchronous((LookupStrategy.Synchronous) strategy, request);
      withinScope.accept(outcome);
      return outcome;
    }
  }

  private LookupOutcome executeSynchronous(LookupStrategy.Synchronous strategy, LookupRequest request) {
    GoToImplementationResult result;
    try {
      result = strategy.service().tryGoToImplementation(
          request.getDocument(), request.getOffset(), request.getCancellationToken());
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new GoToImplementationException("Go to implementation failed for " + request.getDocument().getUri(), e);
    }
    request.getCancellationToken().throwIfCancellationRequested();
    if (result == null) {
      log.debug("Synchronous lookup returned no result for {}", request.getDocument().getUri());
      return LookupOutcome.completedBySearch();
    }
    log.debug("Synchronous lookup finished: {}", result);
    return result.getMessage() != null
        ? LookupOutcome.message(result.getMessage())
        : LookupOutcome.completedBySearch();
  }

  private LookupOutcome executeStreaming(LookupStrategy.Streaming strategy, LookupRequest request) {
    // fresh per request; never shared with another invocation
    SimpleFindUsagesContext collector = new SimpleFindUsagesContext(request.getCancellationToken());
    CompletableFuture<Void> search;
    try {
      search = strategy.service().findImplementations(request.getDocument(), request.getOffset(), collector);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new GoToImplementationException("Finding implementations failed for " + request.getDocument().getUri(), e);
    }
    if (search == null) search = CompletableFuture.completedFuture(null);

    Futures.awaitOrCancel(search, request.getCancellationToken());
    request.getCancellationToken().throwIfCancellationRequested();

    String message = collector.getMessage();
    if (message != null && !message.isBlank()) {
      return LookupOutcome.message(message);
    }
    LookupOutcome outcome = LookupOutcome.definitions(collector.getSearchTitle(), collector.getDefinitions());
    log.debug("Streaming lookup finished: {}", outcome);
    return outcome;
  }
}
