package se.alipsa.gotoimpl.core.command;

import se.alipsa.gotoimpl.core.service.FindUsagesService;
import se.alipsa.gotoimpl.core.service.GoToImplementationService;

import java.util.Objects;

/**
 * The lookup chosen for one request. The two service shapes have different contracts
 * (the synchronous one may navigate on its own, the streaming one only reports), so they
 * are kept apart instead of hidden behind a common interface.
 */
public sealed interface LookupStrategy
    permits LookupStrategy.Streaming, LookupStrategy.Synchronous, LookupStrategy.None {

  None NONE = new None();

  final class Streaming implements LookupStrategy {
    private final FindUsagesService service;

    public Streaming(FindUsagesService service) {
      this.service = Objects.requireNonNull(service);
    }

    public FindUsagesService service() { return service; }

    @Override public String toString() { return "Streaming"; }
  }

  final class Synchronous implements LookupStrategy {
    private final GoToImplementationService service;

    public Synchronous(GoToImplementationService service) {
      this.service = Objects.requireNonNull(service);
    }

    public GoToImplementationService service() { return service; }

    @Override public String toString() { return "Synchronous"; }
  }

  /** Nothing can run; the command must not execute. */
  final class None implements LookupStrategy {
    private None() {}

    @Override public String toString() { return "None"; }
  }
}
