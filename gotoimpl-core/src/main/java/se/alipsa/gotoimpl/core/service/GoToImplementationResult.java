package se.alipsa.gotoimpl.core.service;

/** What a {@link GoToImplementationService} did: whether it handled the request, and an optional message. */
public final class GoToImplementationResult {

  private static final GoToImplementationResult HANDLED = new GoToImplementationResult(true, null);
  private static final GoToImplementationResult NOT_HANDLED = new GoToImplementationResult(false, null);

  private final boolean handled;
  private final String message;

  private GoToImplementationResult(boolean handled, String message) {
    this.handled = handled;
    this.message = message;
  }

  public static GoToImplementationResult handled() { return HANDLED; }

  public static GoToImplementationResult notHandled() { return NOT_HANDLED; }

  /** The service gave up and wants the user told why. */
  public static GoToImplementationResult message(String message) {
    if (message == null || message.isBlank()) throw new IllegalArgumentException("message must not be blank");
    return new GoToImplementationResult(false, message);
  }

  public boolean isHandled() { return handled; }

  /** @return the message to show, or null */
  public String getMessage() { return message; }

  @Override
  public String toString() {
    return "GoToImplementationResult{handled=" + handled + ", message=" + message + '}';
  }
}
