package se.alipsa.gotoimpl.core.host;

/** Sink for user facing messages (e.g., message box, status bar, test capture). */
@FunctionalInterface
public interface NotificationService {
  void sendNotification(String message, String title, NotificationSeverity severity);
}
