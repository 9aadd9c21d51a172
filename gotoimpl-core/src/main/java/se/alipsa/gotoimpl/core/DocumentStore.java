package se.alipsa.gotoimpl.core;

import se.alipsa.gotoimpl.core.model.Document;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory store holding the current snapshot of each open document. */
public final class DocumentStore {
  private final Map<String, Document> byUri = new ConcurrentHashMap<>();

  public Document put(String uri, String text) {
    Document doc = new Document(Objects.requireNonNull(uri), Objects.requireNonNull(text));
    byUri.put(uri, doc);
    return doc;
  }

  public Optional<Document> get(String uri) {
    return uri == null ? Optional.empty() : Optional.ofNullable(byUri.get(uri));
  }

  public void remove(String uri) {
    byUri.remove(uri);
  }
}
