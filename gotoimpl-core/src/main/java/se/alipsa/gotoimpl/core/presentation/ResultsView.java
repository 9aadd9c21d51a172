package se.alipsa.gotoimpl.core.presentation;

import se.alipsa.gotoimpl.core.model.DefinitionItem;

import java.util.List;

/** Host surface that lists search results (tool window, quick pick, test capture). */
@FunctionalInterface
public interface ResultsView {
  void show(String title, List<DefinitionItem> items);
}
