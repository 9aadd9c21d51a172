package se.alipsa.gotoimpl.core.host;

public enum CommandState {
  AVAILABLE,
  UNAVAILABLE;

  public boolean isAvailable() {
    return this == AVAILABLE;
  }
}
