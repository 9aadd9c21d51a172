package se.alipsa.gotoimpl.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.gotoimpl.core.Workspace;
import se.alipsa.gotoimpl.core.host.NotificationSeverity;
import se.alipsa.gotoimpl.core.host.WaitContext;
import se.alipsa.gotoimpl.core.presentation.DefinitionsPresenter;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/** Carries out a routed action through exactly one host collaborator. */
public final class OutcomeDispatcher {

  private static final Logger log = LoggerFactory.getLogger(OutcomeDispatcher.class);

  private final Workspace workspace;

  public OutcomeDispatcher(Workspace workspace) {
    this.workspace = Objects.requireNonNull(workspace);
  }

  /**
   * @param presenter used for {@link OutcomeAction.Present}, may be null when none is available
   * @throws CancellationException if the user cancelled while the presenter was busy
   */
  public void dispatch(OutcomeAction action, DefinitionsPresenter presenter, WaitContext waitContext) {
    if (action instanceof OutcomeAction.ShowMessage show) {
      // the notification replaces the wait indication, they must never be visible together
      waitContext.takeOwnership();
      workspace.notificationService().sendNotification(
          show.message(), CommandResources.GO_TO_IMPLEMENTATION, NotificationSeverity.INFORMATION);
    } else if (action instanceof OutcomeAction.Navigate navigate) {
      if (!workspace.navigationService().tryNavigateTo(navigate.definition())) {
        log.info("Could not navigate to {}", navigate.definition());
      }
    } else if (action instanceof OutcomeAction.Present present) {
      if (presenter == null) {
        log.warn("No presenter available, dropping {}", present);
        return;
      }
      if (present.definitions().isEmpty()) {
        // the presenter answers an empty list with a notification
        waitContext.takeOwnership();
      }
      CompletableFuture<Void> shown = presenter.tryNavigateToOrPresentItems(workspace, present.title(), present.definitions());
      if (shown != null) {
        Futures.awaitOrCancel(shown, waitContext.userCancellationToken());
      }
    } else {
      log.debug("Nothing to dispatch for {}", action);
    }
  }
}
