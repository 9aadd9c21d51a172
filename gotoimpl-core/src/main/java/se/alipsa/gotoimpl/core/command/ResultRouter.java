package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.model.DefinitionItem;

import java.util.List;

/**
 * Picks the action for an outcome:
 * a message is shown as is, a single definition is jumped to, and anything else (none or
 * several) goes to the presenter.
 */
public final class ResultRouter {

  public OutcomeAction route(LookupOutcome outcome) {
    if (outcome.getMessage() != null) {
      return new OutcomeAction.ShowMessage(outcome.getMessage());
    }
    if (outcome.isCompletedBySearch()) {
      return OutcomeAction.NO_ACTION;
    }
    List<DefinitionItem> definitions = outcome.getDefinitions();
    if (definitions.size() == 1) {
      return new OutcomeAction.Navigate(definitions.get(0));
    }
    String title = outcome.getSearchTitle();
    if (title == null || title.isBlank()) title = CommandResources.GO_TO_IMPLEMENTATION;
    return new OutcomeAction.Present(title, definitions);
  }
}
