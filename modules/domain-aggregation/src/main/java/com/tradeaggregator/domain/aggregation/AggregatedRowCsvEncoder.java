package com.tradeaggregator.domain.aggregation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Encodes aggregated rows as headerless RFC-4180 CSV in the column order of {@link #COLUMNS},
 * ready for {@code COPY ... FROM STDIN WITH (FORMAT csv)}.
 *
 * <p>Decimals are written at a fixed scale and timestamps at microsecond precision in UTC, so an
 * identical batch always produces identical bytes. Encoding either succeeds for every row or
 * throws {@link BulkEncodingException}.
 */
public class AggregatedRowCsvEncoder {
  public static final List<String> COLUMNS =
      List.of(
          "exchange",
          "instrument",
          "traded_at",
          "side",
          "volume_sum",
          "trade_count",
          "price_open",
          "price_high",
          "price_low",
          "price_close",
          "price_avg",
          "first_sequence",
          "last_sequence");

  public static final int DECIMAL_SCALE = 12;

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS'+00'").withZone(ZoneOffset.UTC);
  private static final char DELIMITER = ',';
  private static final char QUOTE = '"';
  private static final char LINE_END = '\n';

  public BulkPayload encode(AggregatedBatch batch) {
    Objects.requireNonNull(batch, "batch must not be null");
    PartitionKey partition = batch.partition();
    StringBuilder out = new StringBuilder(batch.rows().size() * 160);
    for (AggregatedRow row : batch.rows()) {
      if (!partition.equals(row.partition())) {
        throw new BulkEncodingException(
            partition, "row at " + row.tradedAt() + " belongs to " + row.partition());
      }
      appendText(out, partition, row.partition().exchange()).append(DELIMITER);
      appendText(out, partition, row.partition().instrument()).append(DELIMITER);
      out.append(timestamp(row.tradedAt())).append(DELIMITER);
      out.append(row.side().name()).append(DELIMITER);
      out.append(decimal(row.volumeSum())).append(DELIMITER);
      out.append(row.tradeCount()).append(DELIMITER);
      out.append(decimal(row.priceOpen())).append(DELIMITER);
      out.append(decimal(row.priceHigh())).append(DELIMITER);
      out.append(decimal(row.priceLow())).append(DELIMITER);
      out.append(decimal(row.priceClose())).append(DELIMITER);
      out.append(decimal(row.priceAvg())).append(DELIMITER);
      out.append(row.firstSequence()).append(DELIMITER);
      out.append(row.lastSequence()).append(LINE_END);
    }
    return new BulkPayload(
        partition,
        out.toString(),
        batch.rows().size(),
        batch.fromSequence(),
        batch.toSequence());
  }

  public static String columnList() {
    return String.join(", ", COLUMNS);
  }

  static String timestamp(Instant instant) {
    return TIMESTAMP_FORMAT.format(instant);
  }

  static String decimal(BigDecimal value) {
    return value.setScale(DECIMAL_SCALE, RoundingMode.HALF_EVEN).toPlainString();
  }

  private static StringBuilder appendText(StringBuilder out, PartitionKey partition, String value) {
    out.append(QUOTE);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isISOControl(c)) {
        throw new BulkEncodingException(
            partition, "control character in text field '" + value.replace(c, '?') + "'");
      }
      if (c == QUOTE) {
        out.append(QUOTE);
      }
      out.append(c);
    }
    return out.append(QUOTE);
  }
}
