package se.alipsa.gotoimpl.core.service;

import se.alipsa.gotoimpl.core.host.CancellationToken;
import se.alipsa.gotoimpl.core.model.DefinitionItem;

/** Receives the findings of a {@link FindUsagesService}. Implementations must be thread safe. */
public interface FindUsagesContext {

  CancellationToken cancellationToken();

  /** Title for a results list, e.g. "Implementations of 'Greeter'". */
  void setSearchTitle(String title);

  /** Terminal explanation of why nothing can be found, e.g. "Cannot navigate to the symbol under the caret." */
  void reportMessage(String message);

  void onDefinitionFound(DefinitionItem definition);

  default void reportProgress(int current, int maximum) {}
}
