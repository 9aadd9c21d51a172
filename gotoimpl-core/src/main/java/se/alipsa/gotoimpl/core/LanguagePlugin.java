package se.alipsa.gotoimpl.core;

import se.alipsa.gotoimpl.core.service.FindUsagesService;
import se.alipsa.gotoimpl.core.service.GoToImplementationService;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public interface LanguagePlugin {

  /** Unique, stable identifier, e.g. "java", "groovy", "kotlin". */
  String id();

  /** Human-friendly name, e.g. "Java", "Groovy". */
  default String displayName() { return id(); }

  /** File extensions (lowercase, no dot), e.g. ["java"]. */
  Set<String> fileExtensions();

  /**
   * Claim how confident you are that you handle this file. 0.0 = not mine, 1.0 = certainly mine.
   * Core calls this when it needs to choose a plugin. Use URI and a cheap content peek.
   */
  default double claim(String fileUri, Supplier<CharSequence> contentPreview) {
    String ext = fileUri.contains(".") ? fileUri.substring(fileUri.lastIndexOf('.') + 1).toLowerCase() : "";
    return fileExtensions().contains(ext) ? 0.9 : 0.0; // extensions win by default
  }

  /** Called once after registration; plugins can cache references to core services. */
  default void configure(PluginEnvironment env) {}

  /**
   * One-shot lookup that blocks until done and may navigate by itself.
   * Empty when the language does not support it.
   */
  default Optional<GoToImplementationService> goToImplementationService() { return Optional.empty(); }

  /**
   * Streaming lookup that reports definitions into a collector.
   * Empty when the language does not support it.
   */
  default Optional<FindUsagesService> findUsagesService() { return Optional.empty(); }
}
