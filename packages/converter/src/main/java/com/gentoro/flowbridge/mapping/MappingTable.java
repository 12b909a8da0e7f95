package com.gentoro.flowbridge.mapping;

import com.gentoro.flowbridge.model.Platform;
import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of node type mappings, shared by every conversion. Implementations must be
 * safe for concurrent reads.
 */
public interface MappingTable {

  Optional<MappingEntry> lookup(String sourceType);

  /** Fallback templates producing nodes for {@code target}, in priority order. */
  List<FallbackTemplate> fallbacks(Platform target);

  String version();

  int size();
}
