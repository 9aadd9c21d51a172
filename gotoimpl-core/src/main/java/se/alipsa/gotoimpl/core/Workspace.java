package se.alipsa.gotoimpl.core;

import se.alipsa.gotoimpl.core.host.NavigationService;
import se.alipsa.gotoimpl.core.host.NotificationService;

import java.util.Objects;

/** The open documents together with the workspace wide options and host services. */
public final class Workspace {

  private final DocumentStore documents;
  private final FeatureOptions options;
  private final NotificationService notificationService;
  private final NavigationService navigationService;

  public Workspace(DocumentStore documents,
                   FeatureOptions options,
                   NotificationService notificationService,
                   NavigationService navigationService) {
    this.documents = Objects.requireNonNull(documents);
    this.options = Objects.requireNonNull(options);
    this.notificationService = Objects.requireNonNull(notificationService);
    this.navigationService = Objects.requireNonNull(navigationService);
  }

  public DocumentStore documents() { return documents; }

  public FeatureOptions options() { return options; }

  public NotificationService notificationService() { return notificationService; }

  public NavigationService navigationService() { return navigationService; }
}
