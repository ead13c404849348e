package io.github.matryoshka.dbu.statement;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jdbi.v3.core.CloseException;
import org.jdbi.v3.core.statement.DefaultStatementBuilder;
import org.jdbi.v3.core.statement.StatementBuilder;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A statement builder holding a fixed set of precompiled statements for the lifetime of one connection.
 *
 * <p>Statements are registered up front through {@link #prepare(Connection, String)}; the cache never holds more
 * than its capacity. Any other SQL is prepared and closed per execution. Cached statements stay open until
 * {@link #close(Connection)}. Not thread safe: one builder serves exactly one handle.
 */
public class CachingStatementBuilder implements StatementBuilder {

  private static final Logger log = LoggerFactory.getLogger(CachingStatementBuilder.class);

  private final StatementBuilder delegate;
  private final int capacity;
  private final Map<String, PreparedStatement> statements;
  private final Set<Statement> cached;

  /**
   * Instantiates a new caching statement builder.
   *
   * @param capacity the exact number of statements the cache may hold
   */
  public CachingStatementBuilder(final int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Statement cache capacity must be positive: " + capacity);
    }
    this.delegate = new DefaultStatementBuilder();
    this.capacity = capacity;
    this.statements = new LinkedHashMap<>(capacity);
    this.cached = Collections.newSetFromMap(new IdentityHashMap<>(capacity));
  }

  /**
   * Precompiles a statement and keeps it for later executions of the identical SQL.
   *
   * @param connection the connection owning the statement
   * @param sql        the SQL, exactly as executed later
   * @return the prepared statement
   * @throws SQLException if the database rejects the statement
   */
  public PreparedStatement prepare(final Connection connection, final String sql) throws SQLException {
    final PreparedStatement existing = statements.get(sql);
    if (existing != null) {
      return existing;
    }
    if (statements.size() >= capacity) {
      throw new IllegalStateException("Statement cache is full (capacity " + capacity + ")");
    }
    final PreparedStatement statement = connection.prepareStatement(sql);
    statements.put(sql, statement);
    cached.add(statement);
    log.trace("prepare({})", sql);
    return statement;
  }

  /**
   * The maximum number of cached statements.
   *
   * @return the capacity
   */
  public int capacity() {
    return capacity;
  }

  /**
   * The number of cached statements.
   *
   * @return the size
   */
  public int size() {
    return statements.size();
  }

  /**
   * Checks if the SQL has a precompiled statement.
   *
   * @param sql the sql
   * @return true if cached
   */
  public boolean isCached(final String sql) {
    return statements.containsKey(sql);
  }

  @Override
  public Statement create(final Connection conn, final StatementContext ctx) throws SQLException {
    return delegate.create(conn, ctx);
  }

  @Override
  public PreparedStatement create(final Connection conn,
                                  final String sql,
                                  final StatementContext ctx) throws SQLException {
    final PreparedStatement statement = statements.get(sql);
    if (statement == null) {
      return delegate.create(conn, sql, ctx);
    }
    statement.clearParameters();
    return statement;
  }

  @Override
  public CallableStatement createCall(final Connection conn,
                                      final String sql,
                                      final StatementContext ctx) throws SQLException {
    return delegate.createCall(conn, sql, ctx);
  }

  @Override
  public void close(final Connection conn, final String sql, final Statement stmt) throws SQLException {
    if (!cached.contains(stmt)) {
      delegate.close(conn, sql, stmt);
    }
  }

  @Override
  public void close(final Connection conn) {
    log.trace("close(): {} cached statements", statements.size());
    final List<SQLException> failures = new ArrayList<>();
    for (PreparedStatement statement : statements.values()) {
      try {
        statement.close();
      } catch (SQLException e) {
        failures.add(e);
      }
    }
    statements.clear();
    cached.clear();
    if (!failures.isEmpty()) {
      final CloseException exception = new CloseException("Unable to close cached statements", failures.get(0));
      failures.stream().skip(1).forEach(exception::addSuppressed);
      throw exception;
    }
  }

}
