package se.alipsa.gotoimpl.core.host;

import se.alipsa.gotoimpl.core.model.DefinitionItem;

/** Opens the editor at a definition. */
@FunctionalInterface
public interface NavigationService {
  /** @return false if the host could not navigate, e.g. the target document is gone */
  boolean tryNavigateTo(DefinitionItem item);
}
