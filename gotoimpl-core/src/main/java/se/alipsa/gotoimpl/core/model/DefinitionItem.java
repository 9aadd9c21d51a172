package se.alipsa.gotoimpl.core.model;

import java.util.Objects;

/**
 * One discovered implementation site.
 * <p>
 * Two items are equal when they point at the same {@link Location}; the display
 * metadata is only used for presentation.
 */
public final class DefinitionItem {
  public enum Kind { CLASS, INTERFACE, ENUM, METHOD, FIELD, OTHER }

  private final String displayName;    // e.g. "HelloImpl" or "HelloImpl#greet()"
  private final Kind kind;
  private final String containerName;  // enclosing type or package, may be empty
  private final Location location;

  public DefinitionItem(String displayName, Kind kind, String containerName, Location location) {
    this.displayName = Objects.requireNonNull(displayName, "displayName");
    this.kind = kind != null ? kind : Kind.OTHER;
    this.containerName = containerName != null ? containerName : "";
    this.location = Objects.requireNonNull(location, "location");
  }

  public String getDisplayName() { return displayName; }
  public Kind getKind() { return kind; }
  public String getContainerName() { return containerName; }
  public Location getLocation() { return location; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DefinitionItem that)) return false;
    return location.equals(that.location);
  }

  @Override
  public int hashCode() {
    return location.hashCode();
  }

  @Override
  public String toString() {
    return "DefinitionItem{" +
        "displayName='" + displayName + '\'' +
        ", kind=" + kind +
        ", location=" + location +
        '}';
  }
}
