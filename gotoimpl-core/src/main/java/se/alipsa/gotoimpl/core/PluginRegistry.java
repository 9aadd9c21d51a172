package se.alipsa.gotoimpl.core;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public final class PluginRegistry {

  private final Map<String, LanguagePlugin> byId = new ConcurrentHashMap<>();
  private final List<LanguagePlugin> all = Collections.synchronizedList(new ArrayList<>());
  private final PluginEnvironment env;

  public PluginRegistry(PluginEnvironment env) {
    this(env, true);
  }

  /** @param discover whether to load plugins found on the class/module path */
  public PluginRegistry(PluginEnvironment env, boolean discover) {
    this.env = Objects.requireNonNull(env);
    if (discover) loadViaServiceLoader();
  }

  public void register(LanguagePlugin plugin) {
    Objects.requireNonNull(plugin);
    if (byId.putIfAbsent(plugin.id(), plugin) != null) {
      env.log("WARN", "Plugin with id=" + plugin.id() + " already registered; ignoring duplicate.", null);
      return;
    }
    try {
      plugin.configure(env);
    } catch (RuntimeException e) {
      byId.remove(plugin.id());
      env.log("ERROR", "Plugin " + plugin.id() + " failed to configure; not registered.", e);
      return;
    }
    all.add(plugin);
    env.log("INFO", "Registered plugin " + plugin.displayName() + " (" + plugin.id() + ")", null);
  }

  public Optional<LanguagePlugin> byId(String id) { return Optional.ofNullable(byId.get(id)); }

  /** Choose a plugin by asking each one to claim the file; highest score wins. */
  public Optional<LanguagePlugin> forFile(String fileUri, Supplier<CharSequence> preview) {
    double best = 0.0; LanguagePlugin winner = null;
    synchronized (all) {
      for (LanguagePlugin p : all) {
        double score;
        try {
          score = p.claim(fileUri, preview);
        } catch (RuntimeException e) {
          env.log("WARN", "Plugin " + p.id() + " failed to claim " + fileUri, e);
          continue;
        }
        if (score > best) { best = score; winner = p; }
      }
    }
    return Optional.ofNullable(winner);
  }

  private void loadViaServiceLoader() {
    ServiceLoader<LanguagePlugin> sl = ServiceLoader.load(LanguagePlugin.class);
    for (LanguagePlugin p : sl) register(p);
  }

  public List<LanguagePlugin> all() { synchronized (all) { return List.copyOf(all); } }
}
