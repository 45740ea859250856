package com.tradeaggregator.worker.config;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Applies the configured enable/disable lists. Entries are {@code exchange:instrument},
 * {@code exchange:*} or a bare {@code exchange}; matching ignores case. A non-empty enabled list
 * acts as an allow-list and a disabled entry always wins.
 */
public class PartitionFilter {
  private static final String WILDCARD = "*";

  private final List<PartitionKey> enabled;
  private final List<PartitionKey> disabled;

  public PartitionFilter(List<String> enabled, List<String> disabled) {
    this.enabled = parse(enabled);
    this.disabled = parse(disabled);
  }

  public static PartitionFilter from(AggregatorProperties.Partitions partitions) {
    return new PartitionFilter(partitions.getEnabled(), partitions.getDisabled());
  }

  public boolean isEnabled(PartitionKey partition) {
    if (matchesAny(disabled, partition)) {
      return false;
    }
    return enabled.isEmpty() || matchesAny(enabled, partition);
  }

  private static boolean matchesAny(List<PartitionKey> patterns, PartitionKey partition) {
    String exchange = partition.exchange().toLowerCase(Locale.ROOT);
    String instrument = partition.instrument().toLowerCase(Locale.ROOT);
    for (PartitionKey pattern : patterns) {
      if (pattern.exchange().equals(exchange)
          && (WILDCARD.equals(pattern.instrument()) || pattern.instrument().equals(instrument))) {
        return true;
      }
    }
    return false;
  }

  // Malformed entries such as ":BTC_JPY" fail here, at startup.
  private static List<PartitionKey> parse(List<String> patterns) {
    if (patterns == null) {
      return List.of();
    }
    return patterns.stream()
        .filter(Objects::nonNull)
        .map(pattern -> pattern.trim().toLowerCase(Locale.ROOT))
        .filter(pattern -> !pattern.isEmpty())
        .map(pattern -> pattern.contains(":") ? pattern : pattern + ":" + WILDCARD)
        .map(PartitionKey::parse)
        .toList();
  }
}
