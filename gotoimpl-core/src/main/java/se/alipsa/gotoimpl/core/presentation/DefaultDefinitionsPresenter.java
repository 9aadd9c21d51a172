package se.alipsa.gotoimpl.core.presentation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.gotoimpl.core.Workspace;
import se.alipsa.gotoimpl.core.host.NotificationSeverity;
import se.alipsa.gotoimpl.core.model.DefinitionItem;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Presenter used when the host has nothing better:
 * <ul>
 *   <li>no items: an information notification saying nothing was found</li>
 *   <li>one item: navigate to it</li>
 *   <li>several items: hand them to the {@link ResultsView} in the given order</li>
 * </ul>
 * The command takes ownership of its wait indication before handing over an empty list.
 */
public final class DefaultDefinitionsPresenter implements DefinitionsPresenter {

  private static final Logger log = LoggerFactory.getLogger(DefaultDefinitionsPresenter.class);

  private final ResultsView view;
  private final Executor executor;

  public DefaultDefinitionsPresenter(ResultsView view, Executor executor) {
    this.view = Objects.requireNonNull(view);
    this.executor = Objects.requireNonNull(executor);
  }

  public static String noResultsMessage(String title) {
    return title + ": no results were found.";
  }

  @Override
  public CompletableFuture<Void> tryNavigateToOrPresentItems(Workspace workspace, String title, List<DefinitionItem> items) {
    List<DefinitionItem> snapshot = List.copyOf(items);
    return CompletableFuture.runAsync(() -> {
      if (snapshot.isEmpty()) {
        workspace.notificationService().sendNotification(noResultsMessage(title), title, NotificationSeverity.INFORMATION);
      } else if (snapshot.size() == 1) {
        DefinitionItem only = snapshot.get(0);
        if (!workspace.navigationService().tryNavigateTo(only)) {
          log.debug("Navigation to {} was refused, listing it instead", only);
          view.show(title, snapshot);
        }
      } else {
        view.show(title, snapshot);
      }
    }, executor);
  }
}
