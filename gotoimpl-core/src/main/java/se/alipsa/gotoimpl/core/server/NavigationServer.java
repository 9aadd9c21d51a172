package se.alipsa.gotoimpl.core.server;

import se.alipsa.gotoimpl.core.*;
import se.alipsa.gotoimpl.core.command.GoToImplementationCommandArgs;
import se.alipsa.gotoimpl.core.command.GoToImplementationCommandHandler;
import se.alipsa.gotoimpl.core.command.PresenterLookup;
import se.alipsa.gotoimpl.core.host.CommandExecutionContext;
import se.alipsa.gotoimpl.core.host.CommandState;
import se.alipsa.gotoimpl.core.host.NavigationService;
import se.alipsa.gotoimpl.core.host.NotificationService;
import se.alipsa.gotoimpl.core.model.Position;
import se.alipsa.gotoimpl.core.presentation.DefaultDefinitionsPresenter;
import se.alipsa.gotoimpl.core.presentation.ResultsView;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process server façade for super-fast local usage.
 * - Keeps the open documents
 * - Answers command state queries and runs "go to implementation"
 */
public final class NavigationServer implements AutoCloseable {

  private final Workspace workspace;
  private final PluginRegistry plugins;
  private final GoToImplementationCommandHandler handler;

  // for lifecycle management if we created the executor
  private final Executor executor;
  private final boolean ownsExecutor;

  private NavigationServer(Workspace workspace, PluginRegistry plugins, PresenterLookup presenters,
                           Executor executor, boolean ownsExecutor) {
    this.workspace = Objects.requireNonNull(workspace);
    this.plugins = Objects.requireNonNull(plugins);
    this.handler = new GoToImplementationCommandHandler(workspace, plugins, presenters);
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
  }

  /**
   * Build a NavigationServer with sensible defaults: options from {@code gotoimpl.properties},
   * plugins discovered via ServiceLoader and the default presenter listing results in {@code view}.
   */
  public static NavigationServer createDefault(NotificationService notifications,
                                               NavigationService navigation,
                                               ResultsView view) {
    ExecutorService executor = Executors.newCachedThreadPool(daemonThreads());
    FeatureOptions options = FeatureOptions.load();
    Workspace workspace = new Workspace(new DocumentStore(), options, notifications, navigation);
    PluginRegistry registry = new PluginRegistry(new DefaultPluginEnvironment(options, executor));
    PresenterLookup presenters = PresenterLookup.of(new DefaultDefinitionsPresenter(view, executor));
    return new NavigationServer(workspace, registry, presenters, executor, true);
  }

  /** Advanced factory in case you want to supply your own pieces (tests, custom exec/presenter, etc.). */
  public static NavigationServer create(Workspace workspace,
                                        List<LanguagePlugin> plugins,
                                        PresenterLookup presenters,
                                        Executor executor) {
    PluginRegistry registry = new PluginRegistry(new DefaultPluginEnvironment(workspace.options(), executor), false);
    plugins.forEach(registry::register);
    return new NavigationServer(workspace, registry, presenters, executor, false);
  }

  // --- documents --------------------------------------------------------------------------------

  public void openFile(String uri, String text) {
    workspace.documents().put(uri, text);
  }

  public void changeFile(String uri, String text) {
    workspace.documents().put(uri, text);
  }

  public void closeFile(String uri) {
    workspace.documents().remove(uri);
  }

  // --- go to implementation ---------------------------------------------------------------------

  public CommandState commandState(String uri, Position caret) {
    return handler.getCommandState(new GoToImplementationCommandArgs(uri, caret));
  }

  public boolean goToImplementation(String uri, Position caret, CommandExecutionContext context) {
    return handler.executeCommand(new GoToImplementationCommandArgs(uri, caret), context);
  }

  public Workspace workspace() { return workspace; }

  public PluginRegistry plugins() { return plugins; }

  // --- Lifecycle --------------------------------------------------------------------------------

  @Override
  public void close() {
    if (ownsExecutor && executor instanceof ExecutorService es) {
      es.shutdown();
    }
  }

  private static java.util.concurrent.ThreadFactory daemonThreads() {
    AtomicInteger count = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "gotoimpl-worker-" + count.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
