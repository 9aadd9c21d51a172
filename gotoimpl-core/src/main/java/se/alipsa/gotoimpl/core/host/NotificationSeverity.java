package se.alipsa.gotoimpl.core.host;

public enum NotificationSeverity {
  INFORMATION,
  WARNING,
  ERROR
}
