package se.alipsa.gotoimpl.core.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.gotoimpl.core.FeatureOptions;
import se.alipsa.gotoimpl.core.PluginEnvironment;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;

/** Minimal PluginEnvironment used by the in-proc server bootstrap; plugin logging goes to SLF4J. */
final class DefaultPluginEnvironment implements PluginEnvironment {

  private static final Logger log = LoggerFactory.getLogger("se.alipsa.gotoimpl.plugins");

  private final FeatureOptions options;
  private final Executor executor;

  DefaultPluginEnvironment(FeatureOptions options, Executor executor) {
    this.options = Objects.requireNonNull(options);
    this.executor = Objects.requireNonNull(executor);
  }

  @Override public FeatureOptions options() { return options; }

  @Override public Executor executor() { return executor; }

  @Override public void log(String level, String message, Throwable t) {
    switch (level == null ? "INFO" : level.toUpperCase(Locale.ROOT)) {
      case "ERROR" -> log.error(message, t);
      case "WARN", "WARNING" -> log.warn(message, t);
      case "DEBUG" -> log.debug(message, t);
      case "TRACE" -> log.trace(message, t);
      default -> log.info(message, t);
    }
  }
}
