package se.alipsa.gotoimpl.core.model;

import java.util.Objects;

/** Immutable snapshot of an open document. */
public final class Document {
  private final String uri;
  private final String text;

  public Document(String uri, String text) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.text = Objects.requireNonNull(text, "text");
  }

  public String getUri() {
    return uri;
  }

  public String getText() {
    return text;
  }

  @Override
  public String toString() {
    return "Document{" + uri + ", length=" + text.length() + '}';
  }
}
