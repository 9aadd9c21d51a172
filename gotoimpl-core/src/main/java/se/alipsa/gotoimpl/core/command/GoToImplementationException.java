package se.alipsa.gotoimpl.core.command;

/** A lookup or its presentation failed for a reason other than cancellation. */
public class GoToImplementationException extends RuntimeException {

  public GoToImplementationException(String message, Throwable cause) {
    super(message, cause);
  }
}
