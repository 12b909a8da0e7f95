package com.gentoro.flowbridge.mapping;

import com.gentoro.flowbridge.model.Platform;
import com.gentoro.flowbridge.model.WorkflowNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides how each node type is converted, using the shared {@link MappingTable}.
 *
 * <p>Order of precedence: a provenance marker pointing back at the target platform restores the
 * original node; then an exact mapping entry; then the first fallback template whose keywords
 * match; otherwise a passthrough stub of the target platform's unknown-marker type.
 */
public class MappingResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(MappingResolver.class);

  private final MappingTable table;

  public MappingResolver(MappingTable table) {
    this.table = Objects.requireNonNull(table, "mapping table");
  }

  /** Pure lookup of the mapping entry for {@code sourceType}. */
  public Optional<MappingEntry> lookup(String sourceType) {
    return table.lookup(sourceType);
  }

  public Resolution resolve(WorkflowNode node, Platform source, Platform target) {
    Optional<Provenance> provenance = Provenance.read(node.getParameters());
    if (provenance.isPresent() && target.id().equals(provenance.get().originalPlatform())) {
      Provenance p = provenance.get();
      FallbackTemplate template = null;
      if (p.isFallback()) {
        template = findFallback(source, p.fallbackCategory()).orElse(null);
      }
      log.debug("Node '{}' recovered as original type '{}'", node.getId(), p.originalType());
      return Resolution.recovered(p, template);
    }

    Optional<MappingEntry> entry = lookup(node.getType());
    if (entry.isPresent()) {
      return Resolution.mapped(entry.get());
    }

    for (FallbackTemplate template : table.fallbacks(target)) {
      if (template.matches(node.getType())) {
        log.debug(
            "No mapping for '{}', using fallback template '{}'",
            node.getType(),
            template.category());
        return Resolution.fallback(template);
      }
    }

    log.debug("No mapping or fallback for '{}', emitting stub", node.getType());
    return Resolution.passthrough(target.unknownMarkerType());
  }

  private Optional<FallbackTemplate> findFallback(Platform platform, String category) {
    for (FallbackTemplate template : table.fallbacks(platform)) {
      if (template.category().equals(category)) return Optional.of(template);
    }
    return Optional.empty();
  }
}
