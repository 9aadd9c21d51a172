package se.alipsa.gotoimpl.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.gotoimpl.core.presentation.DefinitionsPresenter;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Finds the process wide {@link DefinitionsPresenter}. Presenters are offered as lazy providers;
 * the first one wins. A provider that fails or yields nothing means "no presenter".
 */
public final class PresenterLookup {

  private static final Logger log = LoggerFactory.getLogger(PresenterLookup.class);

  private final List<Supplier<? extends DefinitionsPresenter>> providers;
  private volatile DefinitionsPresenter cached;

  public PresenterLookup(List<Supplier<? extends DefinitionsPresenter>> providers) {
    this.providers = List.copyOf(providers);
  }

  public static PresenterLookup of(DefinitionsPresenter presenter) {
    Supplier<DefinitionsPresenter> provider = () -> presenter;
    return new PresenterLookup(List.of(provider));
  }

  public static PresenterLookup none() {
    return new PresenterLookup(List.of());
  }

  public Optional<DefinitionsPresenter> find() {
    DefinitionsPresenter presenter = cached;
    if (presenter != null) return Optional.of(presenter);
    if (providers.isEmpty()) return Optional.empty();
    try {
      presenter = providers.get(0).get();
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable t) {
      log.debug("Presenter could not be created, streaming results are not offered", t);
      return Optional.empty();
    }
    cached = presenter;
    return Optional.ofNullable(presenter);
  }
}
