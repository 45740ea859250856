package com.tradeaggregator.worker.testing;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.worker.commit.BulkLoader;
import com.tradeaggregator.worker.commit.StagedPayload;
import com.tradeaggregator.worker.watermark.WatermarkStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.dao.DuplicateKeyException;

/**
 * Destination table plus watermark table in memory. Loaded CSV lines are keyed by their natural
 * key columns, so loading the same aggregated row twice fails like the primary key would.
 */
public class InMemoryAggregationStore implements BulkLoader, WatermarkStore {
  private TreeMap<String, String> rows = new TreeMap<>();
  private Map<PartitionKey, Long> watermarks = new HashMap<>();
  private Map<PartitionKey, Long> rawRowsCommitted = new HashMap<>();
  private RuntimeException nextLoadFailure;
  private RuntimeException nextAdvanceFailure;
  private int loadCalls;

  @Override
  public synchronized long load(StagedPayload payload) {
    loadCalls++;
    long loaded = 0L;
    try (BufferedReader reader = new BufferedReader(payload.openReader())) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isEmpty()) {
          continue;
        }
        String key = naturalKey(line);
        if (rows.containsKey(key)) {
          throw new DuplicateKeyException("duplicate aggregated row key=" + key);
        }
        rows.put(key, line);
        loaded++;
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    if (nextLoadFailure != null) {
      RuntimeException failure = nextLoadFailure;
      nextLoadFailure = null;
      throw failure;
    }
    return loaded;
  }

  @Override
  public synchronized long get(PartitionKey partition) {
    return watermarks.getOrDefault(partition, NONE);
  }

  @Override
  public synchronized boolean advance(
      PartitionKey partition, long expected, long next, long rawRowsCommitted) {
    if (next <= expected) {
      throw new IllegalArgumentException("next must exceed expected");
    }
    if (nextAdvanceFailure != null) {
      RuntimeException failure = nextAdvanceFailure;
      nextAdvanceFailure = null;
      throw failure;
    }
    if (get(partition) != expected) {
      return false;
    }
    watermarks.put(partition, next);
    this.rawRowsCommitted.merge(partition, rawRowsCommitted, Long::sum);
    return true;
  }

  /** Fails the next load after its rows were written, before the watermark step. */
  public synchronized void failNextLoadAfterWrite(RuntimeException failure) {
    this.nextLoadFailure = failure;
  }

  public synchronized void failNextAdvance(RuntimeException failure) {
    this.nextAdvanceFailure = failure;
  }

  public synchronized void setWatermark(PartitionKey partition, long watermark) {
    watermarks.put(partition, watermark);
  }

  public synchronized long rawRowsCommitted(PartitionKey partition) {
    return rawRowsCommitted.getOrDefault(partition, 0L);
  }

  /** Loaded CSV lines in natural key order. */
  public synchronized List<String> rows() {
    return new ArrayList<>(rows.values());
  }

  public synchronized int loadCalls() {
    return loadCalls;
  }

  synchronized Snapshot snapshot() {
    return new Snapshot(
        new TreeMap<>(rows), new HashMap<>(watermarks), new HashMap<>(rawRowsCommitted));
  }

  synchronized void restore(Snapshot snapshot) {
    rows = new TreeMap<>(snapshot.rows());
    watermarks = new HashMap<>(snapshot.watermarks());
    rawRowsCommitted = new HashMap<>(snapshot.rawRowsCommitted());
  }

  private static String naturalKey(String line) {
    List<String> fields = splitCsv(line);
    return String.join("|", fields.subList(0, 4));
  }

  private static List<String> splitCsv(String line) {
    List<String> fields = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quoted) {
        if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
          current.append('"');
          i++;
        } else if (c == '"') {
          quoted = false;
        } else {
          current.append(c);
        }
      } else if (c == '"') {
        quoted = true;
      } else if (c == ',') {
        fields.add(current.toString());
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    fields.add(current.toString());
    return fields;
  }

  record Snapshot(
      Map<String, String> rows,
      Map<PartitionKey, Long> watermarks,
      Map<PartitionKey, Long> rawRowsCommitted) {}
}
