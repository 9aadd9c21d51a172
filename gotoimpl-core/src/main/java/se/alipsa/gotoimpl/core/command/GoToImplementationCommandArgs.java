package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.model.Position;

import java.util.Objects;
import java.util.Optional;

/** The inbound "go to implementation" request as the host editor sends it. */
public final class GoToImplementationCommandArgs {
  private final String uri;
  private final Position caret; // null when the view has no caret in this document

  public GoToImplementationCommandArgs(String uri, Position caret) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.caret = caret;
  }

  public String getUri() {
    return uri;
  }

  public Optional<Position> getCaret() {
    return Optional.ofNullable(caret);
  }

  @Override
  public String toString() {
    return "GoToImplementationCommandArgs{" + uri + (caret == null ? "" : " @ " + caret) + '}';
  }
}
