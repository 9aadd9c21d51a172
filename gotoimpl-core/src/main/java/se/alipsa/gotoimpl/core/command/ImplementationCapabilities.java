package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.service.FindUsagesService;
import se.alipsa.gotoimpl.core.service.GoToImplementationService;

import java.util.Optional;

/** The lookup services the language of one document offers. */
public final class ImplementationCapabilities {

  private final String languageId; // null when no language claims the document
  private final GoToImplementationService synchronousService;
  private final FindUsagesService streamingService;

  public ImplementationCapabilities(String languageId,
                                    GoToImplementationService synchronousService,
                                    FindUsagesService streamingService) {
    this.languageId = languageId;
    this.synchronousService = synchronousService;
    this.streamingService = streamingService;
  }

  public static ImplementationCapabilities none() {
    return new ImplementationCapabilities(null, null, null);
  }

  public Optional<String> languageId() { return Optional.ofNullable(languageId); }

  public Optional<GoToImplementationService> synchronousService() { return Optional.ofNullable(synchronousService); }

  public Optional<FindUsagesService> streamingService() { return Optional.ofNullable(streamingService); }

  /** Cheap enough for every command state query: only checks that a service exists. */
  public boolean isAvailable() {
    return synchronousService != null || streamingService != null;
  }

  /** The same capabilities with the streaming service removed. */
  public ImplementationCapabilities withoutStreaming() {
    return streamingService == null ? this : new ImplementationCapabilities(languageId, synchronousService, null);
  }

  @Override
  public String toString() {
    return "ImplementationCapabilities{language=" + languageId
        + ", synchronous=" + (synchronousService != null)
        + ", streaming=" + (streamingService != null) + '}';
  }
}
