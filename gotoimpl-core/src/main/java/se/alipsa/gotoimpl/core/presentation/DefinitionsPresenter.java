package se.alipsa.gotoimpl.core.presentation;

import se.alipsa.gotoimpl.core.Workspace;
import se.alipsa.gotoimpl.core.model.DefinitionItem;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Shows the result of a search that did not resolve to a single definition. */
public interface DefinitionsPresenter {

  /**
   * Navigate to the only item, or present all of them. The presenter decides what an empty
   * list looks like to the user.
   *
   * @param items in presentation order; must not be re-sorted
   * @return completes once the items are navigated to or on screen
   */
  CompletableFuture<Void> tryNavigateToOrPresentItems(Workspace workspace, String title, List<DefinitionItem> items);
}
