package se.alipsa.gotoimpl.core;

import se.alipsa.gotoimpl.core.host.NavigationService;
import se.alipsa.gotoimpl.core.host.NotificationService;
import se.alipsa.gotoimpl.core.host.NotificationSeverity;
import se.alipsa.gotoimpl.core.model.DefinitionItem;
import se.alipsa.gotoimpl.core.presentation.ResultsView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Captures every call the core makes on the host. */
public final class RecordingHost implements NotificationService, NavigationService, ResultsView {

  public static final class Notification {
    public final String message;
    public final String title;
    public final NotificationSeverity severity;

    Notification(String message, String title, NotificationSeverity severity) {
      this.message = message;
      this.title = title;
      this.severity = severity;
    }
  }

  public static final class Shown {
    public final String title;
    public final List<DefinitionItem> items;

    Shown(String title, List<DefinitionItem> items) {
      this.title = title;
      this.items = items;
    }
  }

  public final List<Notification> notifications = Collections.synchronizedList(new ArrayList<>());
  public final List<DefinitionItem> navigations = Collections.synchronizedList(new ArrayList<>());
  public final List<Shown> shown = Collections.synchronizedList(new ArrayList<>());
  private volatile boolean canNavigate = true;

  public RecordingHost refuseNavigation() {
    canNavigate = false;
    return this;
  }

  @Override
  public void sendNotification(String message, String title, NotificationSeverity severity) {
    notifications.add(new Notification(message, title, severity));
  }

  @Override
  public boolean tryNavigateTo(DefinitionItem item) {
    navigations.add(item);
    return canNavigate;
  }

  @Override
  public void show(String title, List<DefinitionItem> items) {
    shown.add(new Shown(title, items));
  }

  public int totalCalls() {
    return notifications.size() + navigations.size() + shown.size();
  }

  public Workspace workspace(FeatureOptions options) {
    return new Workspace(new DocumentStore(), options, this, this);
  }
}
