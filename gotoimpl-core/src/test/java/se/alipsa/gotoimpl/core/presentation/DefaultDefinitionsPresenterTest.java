package se.alipsa.gotoimpl.core.presentation;

import org.junit.jupiter.api.Test;
import se.alipsa.gotoimpl.core.Definitions;
import se.alipsa.gotoimpl.core.FeatureOptions;
import se.alipsa.gotoimpl.core.RecordingHost;
import se.alipsa.gotoimpl.core.Workspace;
import se.alipsa.gotoimpl.core.host.NotificationSeverity;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DefaultDefinitionsPresenterTest {

  private final RecordingHost host = new RecordingHost();
  private final Workspace workspace = host.workspace(FeatureOptions.defaults());
  private final DefaultDefinitionsPresenter presenter = new DefaultDefinitionsPresenter(host, Runnable::run);

  @Test
  void noItems_notifiesThatNothingWasFound() {
    presenter.tryNavigateToOrPresentItems(workspace, "Implementations of 'Greeter'", List.of()).join();

    assertEquals(1, host.notifications.size());
    assertEquals("Implementations of 'Greeter': no results were found.", host.notifications.get(0).message);
    assertEquals("Implementations of 'Greeter'", host.notifications.get(0).title);
    assertEquals(NotificationSeverity.INFORMATION, host.notifications.get(0).severity);
    assertTrue(host.shown.isEmpty());
  }

  @Test
  void oneItem_navigates() {
    var only = Definitions.at("Hello", 1);
    presenter.tryNavigateToOrPresentItems(workspace, "t", List.of(only)).join();

    assertEquals(List.of(only), host.navigations);
    assertTrue(host.shown.isEmpty());
  }

  @Test
  void oneItemThatCannotBeOpened_isListedInstead() {
    host.refuseNavigation();
    var only = Definitions.at("Hello", 1);
    presenter.tryNavigateToOrPresentItems(workspace, "t", List.of(only)).join();

    assertEquals(1, host.shown.size());
    assertEquals(List.of(only), host.shown.get(0).items);
  }

  @Test
  void manyItems_areListedInTheGivenOrder() {
    var b = Definitions.at("B", 2);
    var a = Definitions.at("A", 1);
    presenter.tryNavigateToOrPresentItems(workspace, "Implementations", List.of(b, a)).join();

    assertEquals(1, host.shown.size());
    assertEquals("Implementations", host.shown.get(0).title);
    assertEquals(List.of(b, a), host.shown.get(0).items);
    assertTrue(host.navigations.isEmpty());
  }

  @Test
  void completesAsynchronouslyOnTheGivenExecutor() throws Exception {
    ExecutorService ui = Executors.newSingleThreadExecutor(r -> new Thread(r, "ui"));
    try {
      var async = new DefaultDefinitionsPresenter((title, items) -> assertEquals("ui", Thread.currentThread().getName()), ui);
      async.tryNavigateToOrPresentItems(workspace, "t", List.of(Definitions.at("A", 1), Definitions.at("B", 2)))
          .get(5, TimeUnit.SECONDS);
    } finally {
      ui.shutdownNow();
    }
  }
}
