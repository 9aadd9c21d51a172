package se.alipsa.gotoimpl.core.host;

/**
 * The host's user facing "please wait" affordance for one command execution.
 */
public interface WaitContext {

  /** Show a progress indication until the returned scope is closed. */
  WaitScope addScope(boolean allowCancellation, String description);

  /** Token that fires when the user cancels any cancellable scope of this context. */
  CancellationToken userCancellationToken();

  /**
   * The command takes over the wait context, typically right before it shows modal UI.
   * The host stops showing its own wait indication from here on.
   */
  void takeOwnership();
}
