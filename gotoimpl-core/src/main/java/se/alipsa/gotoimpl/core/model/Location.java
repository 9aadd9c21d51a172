package se.alipsa.gotoimpl.core.model;

import java.util.Objects;

/**
 * Where an implementation lives: a document URI and the range of its name in that document.
 * Two locations are the same implementation site when both parts match, which is what
 * {@link DefinitionItem} identity relies on.
 */
public final class Location {
  private final String uri;
  private final Range range;

  public Location(String uri, Range range) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.range = Objects.requireNonNull(range, "range");
  }

  /** A location on one line, from {@code startColumn} up to (excluding) {@code endColumn}. */
  public static Location onLine(String uri, int line, int startColumn, int endColumn) {
    if (endColumn < startColumn) {
      throw new IllegalArgumentException("endColumn " + endColumn + " before startColumn " + startColumn);
    }
    return new Location(uri, new Range(new Position(line, startColumn), new Position(line, endColumn)));
  }

  public String getUri() {
    return uri;
  }

  public Range getRange() {
    return range;
  }

  /** Where navigation puts the caret. */
  public Position getStart() {
    return range.start;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Location other)) return false;
    return uri.equals(other.uri) && range.equals(other.range);
  }

  @Override
  public int hashCode() {
    return 31 * uri.hashCode() + range.hashCode();
  }

  /** {@code uri:line:column} of the start, the form editors accept for jumping. */
  @Override
  public String toString() {
    return uri + ":" + range.start;
  }
}
