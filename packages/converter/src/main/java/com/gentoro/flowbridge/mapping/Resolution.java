package com.gentoro.flowbridge.mapping;

/**
 * How a node type is converted.
 *
 * @param strategy which rule applies
 * @param targetType type to emit on the target platform
 * @param entry the mapping entry, for {@link Strategy#MAPPED}
 * @param fallback the template, for {@link Strategy#FALLBACK} and fallback recoveries
 * @param provenance the marker found on the node, for {@link Strategy#RECOVERED}
 */
public record Resolution(
    Strategy strategy,
    String targetType,
    MappingEntry entry,
    FallbackTemplate fallback,
    Provenance provenance) {

  public enum Strategy {
    /** A mapping entry exists for the source type. */
    MAPPED,
    /** No entry; a generic fallback template matched. */
    FALLBACK,
    /** The node is a marker left by an earlier conversion and is restored. */
    RECOVERED,
    /** Nothing matched; a stub carrying the original data is emitted. */
    PASSTHROUGH
  }

  public static Resolution mapped(MappingEntry entry) {
    return new Resolution(Strategy.MAPPED, entry.targetType(), entry, null, null);
  }

  public static Resolution fallback(FallbackTemplate template) {
    return new Resolution(Strategy.FALLBACK, template.targetType(), null, template, null);
  }

  public static Resolution recovered(Provenance provenance, FallbackTemplate template) {
    return new Resolution(
        Strategy.RECOVERED, provenance.originalType(), null, template, provenance);
  }

  public static Resolution passthrough(String markerType) {
    return new Resolution(Strategy.PASSTHROUGH, markerType, null, null, null);
  }
}
