package se.alipsa.gotoimpl.core.host;

import java.util.Objects;

public final class CommandExecutionContext {
  private final WaitContext waitContext;

  public CommandExecutionContext(WaitContext waitContext) {
    this.waitContext = Objects.requireNonNull(waitContext, "waitContext");
  }

  public WaitContext getWaitContext() {
    return waitContext;
  }
}
