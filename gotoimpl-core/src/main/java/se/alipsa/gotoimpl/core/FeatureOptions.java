package se.alipsa.gotoimpl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-language feature toggles.
 * <p>
 * Values are looked up on every read, in this order: runtime overrides set through
 * {@link #setStreamingGoToImplementation(String, boolean)}, JVM system properties prefixed with
 * {@value #SYSTEM_PREFIX}, the {@value #RESOURCE} classpath resource, and finally the built-in
 * default. For each source the language specific key
 * ({@code streamingGoToImplementation.<languageId>}) wins over the global one.
 */
public final class FeatureOptions {

  private static final Logger log = LoggerFactory.getLogger(FeatureOptions.class);

  public static final String RESOURCE = "/gotoimpl.properties";
  public static final String SYSTEM_PREFIX = "gotoimpl.";
  public static final String STREAMING_GO_TO_IMPLEMENTATION = "streamingGoToImplementation";

  private static final boolean STREAMING_DEFAULT = true;

  private final Properties defaults;
  private final Properties system;
  private final Map<String, Boolean> overrides = new ConcurrentHashMap<>();

  public FeatureOptions(Properties defaults, Properties system) {
    this.defaults = Objects.requireNonNull(defaults);
    this.system = Objects.requireNonNull(system);
  }

  /** Options backed by the bundled resource and the live system properties. */
  public static FeatureOptions load() {
    return new FeatureOptions(loadResource(RESOURCE), System.getProperties());
  }

  /** Options with nothing but the built-in defaults; handy for tests and embedding. */
  public static FeatureOptions defaults() {
    return new FeatureOptions(new Properties(), new Properties());
  }

  public boolean isStreamingGoToImplementation(String languageId) {
    String langKey = STREAMING_GO_TO_IMPLEMENTATION + "." + languageId;
    Boolean override = overrides.get(langKey);
    if (override == null) override = overrides.get(STREAMING_GO_TO_IMPLEMENTATION);
    if (override != null) return override;

    String value = firstNonNull(
        system.getProperty(SYSTEM_PREFIX + langKey),
        system.getProperty(SYSTEM_PREFIX + STREAMING_GO_TO_IMPLEMENTATION),
        defaults.getProperty(langKey),
        defaults.getProperty(STREAMING_GO_TO_IMPLEMENTATION));
    return value == null ? STREAMING_DEFAULT : Boolean.parseBoolean(value.trim());
  }

  public void setStreamingGoToImplementation(String languageId, boolean enabled) {
    overrides.put(STREAMING_GO_TO_IMPLEMENTATION + "." + Objects.requireNonNull(languageId), enabled);
  }

  /** Override the toggle for every language that has no language specific override. */
  public void setStreamingGoToImplementation(boolean enabled) {
    overrides.put(STREAMING_GO_TO_IMPLEMENTATION, enabled);
  }

  public void clearOverrides() {
    overrides.clear();
  }

  static Properties loadResource(String name) {
    Properties props = new Properties();
    try (InputStream in = FeatureOptions.class.getResourceAsStream(name)) {
      if (in == null) {
        log.debug("No {} on the classpath, using built-in defaults", name);
        return props;
      }
      props.load(in);
    } catch (IOException e) {
      log.warn("Failed to read {}, using built-in defaults", name, e);
    }
    return props;
  }

  private static String firstNonNull(String... values) {
    for (String v : values) {
      if (v != null) return v;
    }
    return null;
  }
}
