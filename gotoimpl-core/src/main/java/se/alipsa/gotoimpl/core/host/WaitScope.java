package se.alipsa.gotoimpl.core.host;

/** A progress indication opened by {@link WaitContext#addScope(boolean, String)}. */
public interface WaitScope extends AutoCloseable {

  String description();

  boolean allowCancellation();

  /** Releases the indication. Safe to call more than once. */
  @Override
  void close();
}
