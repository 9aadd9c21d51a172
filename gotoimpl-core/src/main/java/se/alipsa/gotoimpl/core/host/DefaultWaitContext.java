package se.alipsa.gotoimpl.core.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Wait context for hosts without their own progress UI. Scopes are tracked and logged;
 * {@link #cancel()} plays the role of the user pressing "Cancel".
 */
public final class DefaultWaitContext implements WaitContext {

  private static final Logger log = LoggerFactory.getLogger(DefaultWaitContext.class);

  private final CancellationTokenSource cancellation = new CancellationTokenSource();
  private final Set<WaitScope> open = ConcurrentHashMap.newKeySet();
  private final List<String> opened = Collections.synchronizedList(new ArrayList<>());
  private final Consumer<WaitScope> onScopeOpened;
  private volatile boolean ownershipTaken;

  public DefaultWaitContext() {
    this(scope -> {});
  }

  /** @param onScopeOpened called on the opening thread right after a scope becomes visible */
  public DefaultWaitContext(Consumer<WaitScope> onScopeOpened) {
    this.onScopeOpened = onScopeOpened;
  }

  @Override
  public WaitScope addScope(boolean allowCancellation, String description) {
    Scope scope = new Scope(allowCancellation, description);
    open.add(scope);
    opened.add(description);
    log.debug("Wait scope opened: {} (cancellable={})", description, allowCancellation);
    onScopeOpened.accept(scope);
    return scope;
  }

  @Override
  public CancellationToken userCancellationToken() {
    return cancellation.token();
  }

  @Override
  public void takeOwnership() {
    ownershipTaken = true;
    log.debug("Wait context ownership taken by command");
  }

  /** Simulates the user cancelling the wait. Only has an effect while a cancellable scope is open. */
  public boolean cancel() {
    boolean cancellable = open.stream().anyMatch(WaitScope::allowCancellation);
    if (!cancellable) {
      log.debug("Cancel ignored, no cancellable scope is open");
      return false;
    }
    return cancellation.cancel();
  }

  public boolean hasOpenScopes() {
    return !open.isEmpty();
  }

  public boolean isOwnershipTaken() {
    return ownershipTaken;
  }

  /** Descriptions of every scope opened so far, in order. */
  public List<String> openedScopes() {
    synchronized (opened) {
      return List.copyOf(opened);
    }
  }

  private final class Scope implements WaitScope {
    private final boolean allowCancellation;
    private final String description;
    private final AtomicBoolean closed = new AtomicBoolean();

    private Scope(boolean allowCancellation, String description) {
      this.allowCancellation = allowCancellation;
      this.description = description;
    }

    @Override public String description() { return description; }

    @Override public boolean allowCancellation() { return allowCancellation; }

    @Override
    public void close() {
      if (closed.compareAndSet(false, true)) {
        open.remove(this);
        log.debug("Wait scope closed: {}", description);
      }
    }
  }
}
