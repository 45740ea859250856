package com.tradeaggregator.domain.aggregation;

/** Unit of independent progress tracking: one instrument on one exchange. */
public record PartitionKey(String exchange, String instrument) {
  private static final String SEPARATOR = ":";

  public PartitionKey {
    requireNonBlank(exchange, "exchange");
    requireNonBlank(instrument, "instrument");
  }

  public static PartitionKey of(String exchange, String instrument) {
    return new PartitionKey(exchange, instrument);
  }

  /** Parses the {@code exchange:instrument} form produced by {@link #toString()}. */
  public static PartitionKey parse(String value) {
    if (value == null) {
      throw new AggregationDomainException("partition must not be null");
    }
    int separator = value.indexOf(SEPARATOR);
    if (separator <= 0 || separator == value.length() - 1) {
      throw new AggregationDomainException(
          "partition must have the form exchange:instrument but was '" + value + "'");
    }
    return new PartitionKey(
        value.substring(0, separator).trim(), value.substring(separator + 1).trim());
  }

  @Override
  public String toString() {
    return exchange + SEPARATOR + instrument;
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new AggregationDomainException(fieldName + " must not be blank");
    }
  }
}
