package se.alipsa.gotoimpl.core.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import se.alipsa.gotoimpl.core.FeatureOptions;
import se.alipsa.gotoimpl.core.RecordingHost;
import se.alipsa.gotoimpl.core.Workspace;
import se.alipsa.gotoimpl.core.command.PresenterLookup;
import se.alipsa.gotoimpl.core.host.CommandExecutionContext;
import se.alipsa.gotoimpl.core.host.CommandState;
import se.alipsa.gotoimpl.core.host.DefaultWaitContext;
import se.alipsa.gotoimpl.core.model.DefinitionItem;
import se.alipsa.gotoimpl.core.model.Position;
import se.alipsa.gotoimpl.core.presentation.DefaultDefinitionsPresenter;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NavigationServerTest {

  private static final String GREETER = """
      package demo;
      public interface Greeter {
        String greet();
      }
      """;
  private static final String HELLO = """
      package demo;
      public class Hello implements Greeter {
        public String greet() { return "hello"; }
      }
      """;
  private static final String BYE = """
      package demo;
      public class Bye implements Runnable, Greeter {
        public String greet() { return "bye"; }
        public void run() {}
      }
      """;
  private static final String RUNNER = """
      package demo;
      interface Runner {}
      class OnlyRunner implements Runner {
      }
      """;

  private final ExecutorService pool = Executors.newFixedThreadPool(4);
  private final RecordingHost host = new RecordingHost();
  private final Workspace workspace = host.workspace(FeatureOptions.defaults());

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  private NavigationServer server(boolean streaming) {
    var plugin = new TrivialInterfacePlugin(workspace.documents(), host, streaming);
    var presenters = PresenterLookup.of(new DefaultDefinitionsPresenter(host, pool));
    var server = NavigationServer.create(workspace, List.of(plugin), presenters, pool);
    open(server, plugin, "file:///demo/Greeter.java", GREETER);
    open(server, plugin, "file:///demo/Hello.java", HELLO);
    open(server, plugin, "file:///demo/Bye.java", BYE);
    open(server, plugin, "file:///demo/Runner.java", RUNNER);
    return server;
  }

  private static void open(NavigationServer server, TrivialInterfacePlugin plugin, String uri, String text) {
    server.openFile(uri, text);
    plugin.track(uri);
  }

  private static CommandExecutionContext context() {
    return new CommandExecutionContext(new DefaultWaitContext());
  }

  private static Position firstOccurrencePosition(String text, String needle) {
    int idx = text.indexOf(needle);
    assertTrue(idx >= 0, "needle not found in text");
    int line = 0, col = 0;
    for (int i = 0; i < idx; i++) {
      char c = text.charAt(i);
      if (c == '\n') { line++; col = 0; } else { col++; }
    }
    return new Position(line, col);
  }

  @Test
  void interfaceWithTwoImplementations_isListed() {
    try (NavigationServer server = server(true)) {
      Position caret = firstOccurrencePosition(GREETER, "Greeter");

      assertEquals(CommandState.AVAILABLE, server.commandState("file:///demo/Greeter.java", caret));
      assertTrue(server.goToImplementation("file:///demo/Greeter.java", caret, context()));

      assertEquals(1, host.shown.size());
      assertEquals("Implementations of 'Greeter'", host.shown.get(0).title);
      Set<String> names = host.shown.get(0).items.stream().map(DefinitionItem::getDisplayName).collect(Collectors.toSet());
      assertEquals(Set.of("Hello", "Bye"), names);
      assertTrue(host.navigations.isEmpty());
    }
  }

  @Test
  void interfaceWithOneImplementation_jumpsStraightToIt() {
    try (NavigationServer server = server(true)) {
      assertTrue(server.goToImplementation("file:///demo/Runner.java", firstOccurrencePosition(RUNNER, "Runner {}"), context()));

      assertEquals(1, host.navigations.size());
      DefinitionItem only = host.navigations.get(0);
      assertEquals("OnlyRunner", only.getDisplayName());
      assertEquals("file:///demo/Runner.java", only.getLocation().getUri());
      assertEquals(new Position(2, 6), only.getLocation().getStart());
      assertTrue(host.shown.isEmpty());
    }
  }

  @Test
  void notAnInterface_showsTheSearchMessage() {
    try (NavigationServer server = server(true)) {
      assertTrue(server.goToImplementation("file:///demo/Hello.java", firstOccurrencePosition(HELLO, "Hello"), context()));

      assertEquals(1, host.notifications.size());
      assertEquals("'Hello' is not an interface.", host.notifications.get(0).message);
      assertEquals(0, host.navigations.size() + host.shown.size());
    }
  }

  @Test
  void synchronousLookup_navigatesByItself() {
    try (NavigationServer server = server(false)) {
      assertTrue(server.goToImplementation("file:///demo/Runner.java", firstOccurrencePosition(RUNNER, "Runner {}"), context()));

      assertEquals(List.of("OnlyRunner"), host.navigations.stream().map(DefinitionItem::getDisplayName).toList());
      assertTrue(host.notifications.isEmpty());
    }
  }

  @Test
  void streamingSwitchedOff_usesTheSynchronousLookup() {
    try (NavigationServer server = server(true)) {
      workspace.options().setStreamingGoToImplementation("trivial-java", false);
      assertTrue(server.goToImplementation("file:///demo/Greeter.java", firstOccurrencePosition(GREETER, "Greeter"), context()));

      assertEquals(1, host.notifications.size());
      assertEquals("2 implementations of 'Greeter'.", host.notifications.get(0).message);
      assertTrue(host.shown.isEmpty());
    }
  }

  @Test
  void closedOrForeignDocuments_areUnavailable() {
    try (NavigationServer server = server(true)) {
      Position caret = new Position(0, 0);
      server.closeFile("file:///demo/Greeter.java");

      assertEquals(CommandState.UNAVAILABLE, server.commandState("file:///demo/Greeter.java", caret));
      assertFalse(server.goToImplementation("file:///demo/Greeter.java", caret, context()));

      server.openFile("file:///demo/readme.md", "# Greeter");
      assertEquals(CommandState.UNAVAILABLE, server.commandState("file:///demo/readme.md", caret));
      assertEquals(0, host.totalCalls());
    }
  }

  @Test
  void changedDocument_isSearchedInItsNewShape() {
    try (NavigationServer server = server(true)) {
      server.changeFile("file:///demo/Bye.java", "package demo;\npublic class Bye {}\n");
      assertTrue(server.goToImplementation("file:///demo/Greeter.java", firstOccurrencePosition(GREETER, "Greeter"), context()));

      assertEquals(List.of("Hello"), host.navigations.stream().map(DefinitionItem::getDisplayName).toList());
    }
  }

  @Test
  void defaultServer_withoutPlugins_offersNothing() {
    try (NavigationServer server = NavigationServer.createDefault(host, host, host)) {
      server.openFile("file:///demo/Greeter.java", GREETER);
      assertEquals(CommandState.UNAVAILABLE, server.commandState("file:///demo/Greeter.java", new Position(1, 18)));
      assertTrue(server.plugins().all().isEmpty());
    }
  }
}
