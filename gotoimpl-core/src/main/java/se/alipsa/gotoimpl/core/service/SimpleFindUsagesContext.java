package se.alipsa.gotoimpl.core.service;

import se.alipsa.gotoimpl.core.host.CancellationToken;
import se.alipsa.gotoimpl.core.model.DefinitionItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects everything a search reports so the caller can decide what to do once the
 * search is over. Definitions keep the order in which they were reported.
 */
public final class SimpleFindUsagesContext implements FindUsagesContext {

  private final CancellationToken cancellationToken;
  private final Object gate = new Object();
  private final List<DefinitionItem> definitions = new ArrayList<>();
  private volatile String message;
  private volatile String searchTitle;

  public SimpleFindUsagesContext(CancellationToken cancellationToken) {
    this.cancellationToken = Objects.requireNonNull(cancellationToken);
  }

  @Override public CancellationToken cancellationToken() { return cancellationToken; }

  @Override public void setSearchTitle(String title) { this.searchTitle = title; }

  @Override public void reportMessage(String message) { this.message = message; }

  @Override
  public void onDefinitionFound(DefinitionItem definition) {
    Objects.requireNonNull(definition, "definition");
    synchronized (gate) {
      definitions.add(definition);
    }
  }

  /** @return the reported message, or null */
  public String getMessage() { return message; }

  /** @return the reported title, or null */
  public String getSearchTitle() { return searchTitle; }

  public List<DefinitionItem> getDefinitions() {
    synchronized (gate) {
      return List.copyOf(definitions);
    }
  }
}
