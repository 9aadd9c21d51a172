package se.alipsa.gotoimpl.core.command;

/** User visible strings of the go to implementation command. */
public final class CommandResources {
  private CommandResources() {}

  public static final String GO_TO_IMPLEMENTATION = "Go To Implementation";
  public static final String HANDLER_NAME = "Go To Implementation Command Handler";
  public static final String LOCATING_IMPLEMENTATIONS = "Locating implementations...";
}
