package com.tradeaggregator.worker.commit;

/** Destination bulk-load primitive. Implementations must join the caller's transaction. */
public interface BulkLoader {
  /** Loads every staged row and returns the number of rows the destination accepted. */
  long load(StagedPayload payload);
}
