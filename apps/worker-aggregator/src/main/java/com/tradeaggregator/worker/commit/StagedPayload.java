package com.tradeaggregator.worker.commit;

import com.tradeaggregator.domain.aggregation.BulkPayload;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Staging artifact for a single commit attempt. Closing it removes any file it created. */
public final class StagedPayload implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StagedPayload.class);

  private final BulkPayload payload;
  private final Path file;

  private StagedPayload(BulkPayload payload, Path file) {
    this.payload = Objects.requireNonNull(payload, "payload must not be null");
    this.file = file;
  }

  static StagedPayload inMemory(BulkPayload payload) {
    return new StagedPayload(payload, null);
  }

  static StagedPayload inFile(BulkPayload payload, Path file) {
    return new StagedPayload(payload, Objects.requireNonNull(file, "file must not be null"));
  }

  public Reader openReader() throws IOException {
    if (file == null) {
      return new StringReader(payload.content());
    }
    return Files.newBufferedReader(file, StandardCharsets.UTF_8);
  }

  public int rowCount() {
    return payload.rowCount();
  }

  public BulkPayload payload() {
    return payload;
  }

  @Override
  public void close() {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Unable to delete staging file path={} partition={}", file, payload.partition(), ex);
    }
  }
}
