package com.tradeaggregator.worker.cycle;

import com.tradeaggregator.domain.aggregation.AggregationDomainException;
import com.tradeaggregator.worker.commit.CommitConsistencyException;
import com.tradeaggregator.worker.source.SourceReadException;
import java.io.UncheckedIOException;
import java.sql.SQLException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.PermissionDeniedDataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.TransactionTimedOutException;

public final class CycleFailureClassifier {
  private static final String QUERY_CANCELED_SQL_STATE = "57014";

  private CycleFailureClassifier() {}

  /** Kind of a failure raised before the commit step. */
  public static CycleFailureKind classifyBeforeCommit(Throwable error) {
    if (error instanceof AggregationDomainException) {
      return CycleFailureKind.MALFORMED_DATA;
    }
    if (error instanceof SourceReadException || error instanceof UncheckedIOException) {
      return CycleFailureKind.TRANSIENT_IO;
    }
    return classifyDataAccess(error);
  }

  /** Kind of a failure raised by the commit step, where a timeout leaves the outcome unknown. */
  public static CycleFailureKind classifyCommit(Throwable error) {
    if (error instanceof CommitConsistencyException) {
      return CycleFailureKind.CONSISTENCY_CONFLICT;
    }
    if (error instanceof TransactionTimedOutException
        || error instanceof QueryTimeoutException
        || error instanceof TransactionSystemException
        || hasSqlState(error, QUERY_CANCELED_SQL_STATE)) {
      return CycleFailureKind.COMMIT_UNKNOWN_OUTCOME;
    }
    return classifyBeforeCommit(error);
  }

  private static CycleFailureKind classifyDataAccess(Throwable error) {
    if (error instanceof DataIntegrityViolationException) {
      return CycleFailureKind.MALFORMED_DATA;
    }
    if (error instanceof InvalidDataAccessResourceUsageException
        || error instanceof InvalidDataAccessApiUsageException
        || error instanceof PermissionDeniedDataAccessException) {
      return CycleFailureKind.FATAL;
    }
    if (error instanceof TransientDataAccessException
        || error instanceof RecoverableDataAccessException
        || error instanceof DataAccessResourceFailureException
        || error instanceof CannotCreateTransactionException) {
      return CycleFailureKind.TRANSIENT_IO;
    }
    // Unrecognised driver or transaction errors are retried; anything else is a bug in this code.
    if (error instanceof DataAccessException || error instanceof TransactionException) {
      return CycleFailureKind.TRANSIENT_IO;
    }
    return CycleFailureKind.UNEXPECTED;
  }

  private static boolean hasSqlState(Throwable error, String sqlState) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof SQLException sqlException
          && sqlState.equals(sqlException.getSQLState())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
