package com.tradeaggregator.worker.commit;

import com.tradeaggregator.domain.aggregation.AggregatedRowCsvEncoder;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import javax.sql.DataSource;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.support.SQLErrorCodeSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Streams staged CSV into {@code aggregated_executions} with {@code COPY ... FROM STDIN} on the
 * transaction-bound connection, so the loaded rows become visible only when the surrounding
 * transaction commits.
 */
public class PostgresCopyBulkLoader implements BulkLoader {
  static final String COPY_SQL =
      "COPY aggregated_executions ("
          + AggregatedRowCsvEncoder.columnList()
          + ") FROM STDIN WITH (FORMAT csv)";

  private final DataSource dataSource;
  private final Duration statementTimeout;
  private final SQLExceptionTranslator exceptionTranslator;

  public PostgresCopyBulkLoader(DataSource dataSource, Duration statementTimeout) {
    this.dataSource = dataSource;
    this.statementTimeout = statementTimeout;
    this.exceptionTranslator = new SQLErrorCodeSQLExceptionTranslator(dataSource);
  }

  @Override
  public long load(StagedPayload payload) {
    if (!TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new IllegalStateException("Bulk load requires an active transaction");
    }
    if (payload.rowCount() == 0) {
      return 0L;
    }
    Connection connection = DataSourceUtils.getConnection(dataSource);
    try {
      applyStatementTimeout(connection);
      CopyManager copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
      try (Reader reader = payload.openReader()) {
        return copyManager.copyIn(COPY_SQL, reader);
      }
    } catch (SQLException ex) {
      throw translate(ex);
    } catch (IOException ex) {
      throw new UncheckedIOException(
          "Unable to stream staged payload partition=" + payload.payload().partition(), ex);
    } finally {
      DataSourceUtils.releaseConnection(connection, dataSource);
    }
  }

  private void applyStatementTimeout(Connection connection) throws SQLException {
    if (statementTimeout == null || statementTimeout.isZero() || statementTimeout.isNegative()) {
      return;
    }
    try (Statement statement = connection.createStatement()) {
      statement.execute("SET LOCAL statement_timeout = " + statementTimeout.toMillis());
    }
  }

  private DataAccessException translate(SQLException ex) {
    DataAccessException translated = exceptionTranslator.translate("COPY", COPY_SQL, ex);
    if (translated != null) {
      return translated;
    }
    return new UncategorizedSQLException("COPY", COPY_SQL, ex);
  }
}
