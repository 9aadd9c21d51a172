package se.alipsa.gotoimpl.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.gotoimpl.core.LanguagePlugin;
import se.alipsa.gotoimpl.core.PluginRegistry;
import se.alipsa.gotoimpl.core.TokenUtil;
import se.alipsa.gotoimpl.core.model.Document;
import se.alipsa.gotoimpl.core.service.FindUsagesService;
import se.alipsa.gotoimpl.core.service.GoToImplementationService;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/** Looks up, for the language of a document, which implementation lookups are available. */
public final class CapabilityResolver {

  private static final Logger log = LoggerFactory.getLogger(CapabilityResolver.class);

  private final PluginRegistry plugins;

  public CapabilityResolver(PluginRegistry plugins) {
    this.plugins = Objects.requireNonNull(plugins);
  }

  /** Never throws: an unsupported or misbehaving language simply has no capabilities. */
  public ImplementationCapabilities resolve(Document document) {
    if (document == null) return ImplementationCapabilities.none();

    Optional<LanguagePlugin> pluginOpt = plugins.forFile(document.getUri(), () -> TokenUtil.preview(document.getText()));
    if (pluginOpt.isEmpty()) {
      return ImplementationCapabilities.none();
    }
    LanguagePlugin plugin = pluginOpt.get();
    GoToImplementationService sync = lookup(plugin, "goToImplementationService", plugin::goToImplementationService);
    FindUsagesService streaming = lookup(plugin, "findUsagesService", plugin::findUsagesService);
    return new ImplementationCapabilities(plugin.id(), sync, streaming);
  }

  private static <T> T lookup(LanguagePlugin plugin, String what, Supplier<Optional<T>> service) {
    try {
      Optional<T> found = service.get();
      return found == null ? null : found.orElse(null);
    } catch (RuntimeException e) {
      log.debug("Plugin {} failed to provide {}, treating it as unsupported", plugin.id(), what, e);
      return null;
    }
  }
}
