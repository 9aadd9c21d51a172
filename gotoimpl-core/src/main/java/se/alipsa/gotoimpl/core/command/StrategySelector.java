package se.alipsa.gotoimpl.core.command;

/** Streaming when it is enabled and offered, otherwise synchronous when offered, otherwise nothing. */
public final class StrategySelector {

  public LookupStrategy select(ImplementationCapabilities capabilities, boolean streamingEnabled) {
    if (streamingEnabled && capabilities.streamingService().isPresent()) {
      return new LookupStrategy.Streaming(capabilities.streamingService().get());
    }
    if (capabilities.synchronousService().isPresent()) {
      return new LookupStrategy.Synchronous(capabilities.synchronousService().get());
    }
    // a lone streaming service is used even with the toggle off
    if (capabilities.streamingService().isPresent()) {
      return new LookupStrategy.Streaming(capabilities.streamingService().get());
    }
    return LookupStrategy.NONE;
  }
}
