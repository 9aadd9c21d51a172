package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.model.DefinitionItem;

import java.util.List;
import java.util.Objects;

/** The single user visible thing to do once a lookup is over. */
public sealed interface OutcomeAction
    permits OutcomeAction.ShowMessage, OutcomeAction.Navigate, OutcomeAction.Present, OutcomeAction.NoAction {

  NoAction NO_ACTION = new NoAction();

  final class ShowMessage implements OutcomeAction {
    private final String message;

    public ShowMessage(String message) {
      this.message = Objects.requireNonNull(message);
    }

    public String message() { return message; }

    @Override public boolean equals(Object o) { return o instanceof ShowMessage that && message.equals(that.message); }
    @Override public int hashCode() { return message.hashCode(); }
    @Override public String toString() { return "ShowMessage{" + message + '}'; }
  }

  final class Navigate implements OutcomeAction {
    private final DefinitionItem definition;

    public Navigate(DefinitionItem definition) {
      this.definition = Objects.requireNonNull(definition);
    }

    public DefinitionItem definition() { return definition; }

    @Override public boolean equals(Object o) { return o instanceof Navigate that && definition.equals(that.definition); }
    @Override public int hashCode() { return definition.hashCode(); }
    @Override public String toString() { return "Navigate{" + definition + '}'; }
  }

  final class Present implements OutcomeAction {
    private final String title;
    private final List<DefinitionItem> definitions;

    public Present(String title, List<DefinitionItem> definitions) {
      this.title = Objects.requireNonNull(title);
      this.definitions = List.copyOf(definitions);
    }

    public String title() { return title; }
    public List<DefinitionItem> definitions() { return definitions; }

    @Override
    public boolean equals(Object o) {
      return o instanceof Present that && title.equals(that.title) && definitions.equals(that.definitions);
    }

    @Override public int hashCode() { return Objects.hash(title, definitions); }
    @Override public String toString() { return "Present{" + title + ", " + definitions.size() + " item(s)}"; }
  }

  /** The lookup already did whatever was needed. */
  final class NoAction implements OutcomeAction {
    private NoAction() {}

    @Override public String toString() { return "NoAction"; }
  }
}
