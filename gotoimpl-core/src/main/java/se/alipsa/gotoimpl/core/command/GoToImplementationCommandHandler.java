package se.alipsa.gotoimpl.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.gotoimpl.core.PluginRegistry;
import se.alipsa.gotoimpl.core.TokenUtil;
import se.alipsa.gotoimpl.core.Workspace;
import se.alipsa.gotoimpl.core.host.CommandExecutionContext;
import se.alipsa.gotoimpl.core.host.CommandState;
import se.alipsa.gotoimpl.core.host.WaitContext;
import se.alipsa.gotoimpl.core.model.Document;
import se.alipsa.gotoimpl.core.model.Position;
import se.alipsa.gotoimpl.core.presentation.DefinitionsPresenter;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Handles "go to implementation": picks a lookup for the document's language, waits for it,
 * and then either shows its message, jumps to the single implementation, or presents the list.
 */
public final class GoToImplementationCommandHandler {

  private static final Logger log = LoggerFactory.getLogger(GoToImplementationCommandHandler.class);

  private final Workspace workspace;
  private final CapabilityResolver capabilities;
  private final PresenterLookup presenters;
  private final StrategySelector selector = new StrategySelector();
  private final BoundedLookupExecutor executor = new BoundedLookupExecutor();
  private final ResultRouter router = new ResultRouter();
  private final OutcomeDispatcher dispatcher;

  public GoToImplementationCommandHandler(Workspace workspace, PluginRegistry plugins, PresenterLookup presenters) {
    this.workspace = Objects.requireNonNull(workspace);
    this.capabilities = new CapabilityResolver(plugins);
    this.presenters = Objects.requireNonNull(presenters);
    this.dispatcher = new OutcomeDispatcher(workspace);
  }

  public String displayName() {
    return CommandResources.HANDLER_NAME;
  }

  /** Cheap: only checks that the language offers a lookup, never runs one. */
  public CommandState getCommandState(GoToImplementationCommandArgs args) {
    return resolve(args).isAvailable() ? CommandState.AVAILABLE : CommandState.UNAVAILABLE;
  }

  /** @return true if the command was handled, false if nothing could run for this document and caret */
  public boolean executeCommand(GoToImplementationCommandArgs args, CommandExecutionContext context) {
    Optional<Document> document = workspace.documents().get(args.getUri());
    Optional<DefinitionsPresenter> presenter = presenters.find();
    ImplementationCapabilities caps = resolve(document, presenter);
    if (!caps.isAvailable()) {
      return false;
    }
    Optional<Position> caret = args.getCaret();
    if (caret.isEmpty()) {
      return false;
    }

    boolean streamingEnabled = caps.languageId()
        .map(workspace.options()::isStreamingGoToImplementation)
        .orElse(false);
    LookupStrategy strategy = selector.select(caps, streamingEnabled);
    if (strategy instanceof LookupStrategy.None) {
      log.debug("No usable lookup for {} ({})", args.getUri(), caps);
      return false;
    }

    Document doc = document.get();
    int offset = TokenUtil.positionToOffset(doc.getText(), caret.get().line, caret.get().column);
    WaitContext waitContext = context.getWaitContext();
    LookupRequest request = new LookupRequest(doc, offset, waitContext.userCancellationToken());
    log.debug("Go to implementation in {} at {} using {} lookup", doc.getUri(), caret.get(), strategy);

    try {
      executor.execute(strategy, request, waitContext,
          outcome -> dispatcher.dispatch(router.route(outcome), presenter.orElse(null), waitContext));
    } catch (CancellationException e) {
      log.debug("Go to implementation in {} was cancelled", doc.getUri());
    } catch (GoToImplementationException e) {
      log.warn("Go to implementation in {} failed", doc.getUri(), e);
    }
    return true;
  }

  private ImplementationCapabilities resolve(GoToImplementationCommandArgs args) {
    return resolve(workspace.documents().get(args.getUri()), presenters.find());
  }

  private ImplementationCapabilities resolve(Optional<Document> document, Optional<DefinitionsPresenter> presenter) {
    ImplementationCapabilities caps = capabilities.resolve(document.orElse(null));
    // streaming results can only be shown through a presenter
    return presenter.isPresent() ? caps : caps.withoutStreaming();
  }
}
