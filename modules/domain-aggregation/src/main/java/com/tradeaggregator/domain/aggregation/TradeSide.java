package com.tradeaggregator.domain.aggregation;

import java.util.Locale;

public enum TradeSide {
  BUY,
  SELL,
  /** The source row carries no side; all rows of a timestamp collapse into one group. */
  NONE;

  public static TradeSide fromRaw(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "buy", "b" -> BUY;
      case "sell", "s" -> SELL;
      case "none" -> NONE;
      default -> throw new AggregationDomainException("Unknown trade side '" + raw + "'");
    };
  }
}
