package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.model.DefinitionItem;

import java.util.List;
import java.util.Objects;

/**
 * What a lookup produced: a message, an ordered list of definitions (possibly empty),
 * or nothing because the lookup already took care of the user.
 */
public final class LookupOutcome {

  private static final LookupOutcome COMPLETED_BY_SEARCH = new LookupOutcome(null, null, List.of(), true);

  private final String message;
  private final String searchTitle;
  private final List<DefinitionItem> definitions;
  private final boolean completedBySearch;

  private LookupOutcome(String message, String searchTitle, List<DefinitionItem> definitions, boolean completedBySearch) {
    this.message = message;
    this.searchTitle = searchTitle;
    this.definitions = definitions;
    this.completedBySearch = completedBySearch;
  }

  public static LookupOutcome message(String message) {
    if (message == null || message.isBlank()) throw new IllegalArgumentException("message must not be blank");
    return new LookupOutcome(message, null, List.of(), false);
  }

  /** @param searchTitle may be null when the search did not name itself */
  public static LookupOutcome definitions(String searchTitle, List<DefinitionItem> definitions) {
    return new LookupOutcome(null, searchTitle, List.copyOf(Objects.requireNonNull(definitions)), false);
  }

  public static LookupOutcome completedBySearch() {
    return COMPLETED_BY_SEARCH;
  }

  /** @return the message, or null */
  public String getMessage() { return message; }

  /** @return the title reported by the search, or null */
  public String getSearchTitle() { return searchTitle; }

  public List<DefinitionItem> getDefinitions() { return definitions; }

  public boolean isCompletedBySearch() { return completedBySearch; }

  @Override
  public String toString() {
    if (message != null) return "LookupOutcome{message='" + message + "'}";
    if (completedBySearch) return "LookupOutcome{completedBySearch}";
    return "LookupOutcome{title='" + searchTitle + "', definitions=" + definitions.size() + '}';
  }
}
