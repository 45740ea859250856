package com.tradeaggregator.worker.commit;

import com.tradeaggregator.domain.aggregation.BulkPayload;
import com.tradeaggregator.worker.config.AggregatorProperties.StagingMode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

public class BulkPayloadStager {
  private final StagingMode mode;
  private final Path directory;
  private final Clock clock;

  public BulkPayloadStager(StagingMode mode, Path directory, Clock clock) {
    this.mode = Objects.requireNonNull(mode, "mode must not be null");
    this.directory = directory;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public static BulkPayloadStager inMemory() {
    return new BulkPayloadStager(StagingMode.MEMORY, null, Clock.systemUTC());
  }

  public StagedPayload stage(BulkPayload payload) {
    if (mode == StagingMode.MEMORY) {
      return StagedPayload.inMemory(payload);
    }
    Path file = null;
    try {
      Files.createDirectories(directory);
      file = Files.createTempFile(directory, filePrefix(payload), ".csv");
      Files.write(file, payload.bytes());
      return StagedPayload.inFile(payload, file);
    } catch (IOException ex) {
      deleteQuietly(file, ex);
      throw new UncheckedIOException(
          "Unable to stage bulk payload partition=" + payload.partition() + " dir=" + directory,
          ex);
    }
  }

  private String filePrefix(BulkPayload payload) {
    String partition =
        (payload.partition().exchange() + "_" + payload.partition().instrument())
            .replaceAll("[^A-Za-z0-9_-]", "_");
    return "agg_" + partition + "_" + clock.millis() + "_";
  }

  private static void deleteQuietly(Path file, IOException original) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException cleanup) {
      original.addSuppressed(cleanup);
    }
  }
}
