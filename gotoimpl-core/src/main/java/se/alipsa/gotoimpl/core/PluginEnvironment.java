package se.alipsa.gotoimpl.core;

import java.util.concurrent.Executor;

public interface PluginEnvironment {
  FeatureOptions options();   // per-language feature toggles
  Executor executor();        // background tasks, e.g. fan-out of a streaming search
  void log(String level, String message, Throwable t);
}
