package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.host.CancellationToken;
import se.alipsa.gotoimpl.core.model.Document;

import java.util.Objects;

/** One invocation of the command: where the caret is, and how the user can cancel. */
public final class LookupRequest {
  private final Document document;
  private final int offset;
  private final CancellationToken cancellationToken;

  public LookupRequest(Document document, int offset, CancellationToken cancellationToken) {
    this.document = Objects.requireNonNull(document, "document");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0 but was " + offset);
    this.offset = offset;
    this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
  }

  public Document getDocument() { return document; }
  public int getOffset() { return offset; }
  public CancellationToken getCancellationToken() { return cancellationToken; }
}
