package com.gentoro.flowbridge.mapping;

import com.gentoro.flowbridge.model.Platform;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@link MappingTable} frozen at construction. */
public final class ImmutableMappingTable implements MappingTable {

  private final String version;
  private final String lastUpdated;
  private final Map<String, MappingEntry> entries;
  private final Map<Platform, List<FallbackTemplate>> fallbacks;

  private ImmutableMappingTable(Builder b) {
    this.version = b.version;
    this.lastUpdated = b.lastUpdated;
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(b.entries));
    Map<Platform, List<FallbackTemplate>> fb = new EnumMap<>(Platform.class);
    b.fallbacks.forEach((platform, list) -> fb.put(platform, List.copyOf(list)));
    this.fallbacks = Collections.unmodifiableMap(fb);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ImmutableMappingTable empty() {
    return builder().build();
  }

  @Override
  public Optional<MappingEntry> lookup(String sourceType) {
    return sourceType == null ? Optional.empty() : Optional.ofNullable(entries.get(sourceType));
  }

  @Override
  public List<FallbackTemplate> fallbacks(Platform target) {
    return fallbacks.getOrDefault(target, List.of());
  }

  @Override
  public String version() {
    return version;
  }

  public String lastUpdated() {
    return lastUpdated;
  }

  @Override
  public int size() {
    return entries.size();
  }

  public static final class Builder {
    private String version = "0";
    private String lastUpdated;
    private final Map<String, MappingEntry> entries = new LinkedHashMap<>();
    private final Map<Platform, List<FallbackTemplate>> fallbacks = new EnumMap<>(Platform.class);

    private Builder() {}

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public Builder lastUpdated(String lastUpdated) {
      this.lastUpdated = lastUpdated;
      return this;
    }

    public Builder entry(MappingEntry entry) {
      entries.put(entry.sourceType(), entry);
      return this;
    }

    public Builder fallback(Platform target, FallbackTemplate template) {
      fallbacks.computeIfAbsent(target, k -> new ArrayList<>()).add(template);
      return this;
    }

    public ImmutableMappingTable build() {
      return new ImmutableMappingTable(this);
    }
  }
}
