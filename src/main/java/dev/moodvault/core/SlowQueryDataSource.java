/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link DataSource} so that any statement execution slower than the threshold logs a
 * {@code DB_SLOW_QUERY} warning with the (abbreviated) SQL. Bound parameters are never logged.
 */
final class SlowQueryDataSource implements DataSource {
  static final String CODE = "DB_SLOW_QUERY";
  private static final int MAX_SQL_CHARS = 160;

  private final DataSource delegate;
  private final long thresholdMs;
  private final Logger logger;

  private SlowQueryDataSource(DataSource delegate, long thresholdMs, Logger logger) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.thresholdMs = thresholdMs;
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  static DataSource wrap(DataSource delegate, long thresholdMs) {
    return wrap(delegate, thresholdMs, LoggerFactory.getLogger("moodvault"));
  }

  /**
   * Wraps {@code delegate}; a non-positive threshold disables detection and returns it unchanged.
   */
  static DataSource wrap(DataSource delegate, long thresholdMs, Logger logger) {
    if (delegate == null || thresholdMs <= 0 || delegate instanceof SlowQueryDataSource) {
      return delegate;
    }
    return new SlowQueryDataSource(delegate, thresholdMs, logger);
  }

  @Override
  public Connection getConnection() throws SQLException {
    return timedConnection(delegate.getConnection());
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    return timedConnection(delegate.getConnection(username, password));
  }

  private Connection timedConnection(Connection connection) {
    if (connection == null) {
      return null;
    }
    ConnectionHandler handler = new ConnectionHandler(connection);
    Connection proxy =
        (Connection)
            Proxy.newProxyInstance(
                Connection.class.getClassLoader(), new Class<?>[] {Connection.class}, handler);
    handler.proxy = proxy;
    return proxy;
  }

  private Statement timedStatement(Statement statement, Connection owner, String sql) {
    Class<?> iface =
        statement instanceof PreparedStatement ? PreparedStatement.class : Statement.class;
    return (Statement)
        Proxy.newProxyInstance(
            Statement.class.getClassLoader(),
            new Class<?>[] {iface},
            new StatementHandler(statement, owner, sql));
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) {
      return iface.cast(this);
    }
    return delegate.unwrap(iface);
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) throws SQLException {
    return iface.isInstance(this) || delegate.isWrapperFor(iface);
  }

  @Override
  public PrintWriter getLogWriter() throws SQLException {
    return delegate.getLogWriter();
  }

  @Override
  public void setLogWriter(PrintWriter out) throws SQLException {
    delegate.setLogWriter(out);
  }

  @Override
  public void setLoginTimeout(int seconds) throws SQLException {
    delegate.setLoginTimeout(seconds);
  }

  @Override
  public int getLoginTimeout() throws SQLException {
    return delegate.getLoginTimeout();
  }

  @Override
  public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
    return delegate.getParentLogger();
  }

  static String abbreviate(String sql) {
    if (sql == null) {
      return "<unknown>";
    }
    String normalized = sql.replaceAll("\\s+", " ").trim();
    return normalized.length() <= MAX_SQL_CHARS
        ? normalized
        : normalized.substring(0, MAX_SQL_CHARS - 3) + "...";
  }

  private final class ConnectionHandler implements InvocationHandler {
    private final Connection target;
    private Connection proxy;

    private ConnectionHandler(Connection target) {
      this.target = target;
    }

    @Override
    public Object invoke(Object self, Method method, Object[] args) throws Throwable {
      switch (method.getName()) {
        case "equals":
          return args != null && args.length == 1 && self == args[0];
        case "hashCode":
          return System.identityHashCode(self);
        default:
          break;
      }
      Object result;
      try {
        result = method.invoke(target, args);
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
      if (result instanceof Statement statement) {
        String sql = args != null && args.length > 0 && args[0] instanceof String s ? s : null;
        return timedStatement(statement, proxy, sql);
      }
      return result;
    }
  }

  private final class StatementHandler implements InvocationHandler {
    private final Statement target;
    private final Connection owner;
    private final String preparedSql;

    private StatementHandler(Statement target, Connection owner, String preparedSql) {
      this.target = target;
      this.owner = owner;
      this.preparedSql = preparedSql;
    }

    @Override
    public Object invoke(Object self, Method method, Object[] args) throws Throwable {
      String name = method.getName();
      switch (name) {
        case "equals":
          return args != null && args.length == 1 && self == args[0];
        case "hashCode":
          return System.identityHashCode(self);
        case "getConnection":
          return owner;
        default:
          break;
      }
      if (!name.startsWith("execute")) {
        try {
          return method.invoke(target, args);
        } catch (InvocationTargetException e) {
          throw e.getCause();
        }
      }
      long startNs = System.nanoTime();
      try {
        return method.invoke(target, args);
      } catch (InvocationTargetException e) {
        throw e.getCause();
      } finally {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        if (elapsedMs >= thresholdMs) {
          String sql =
              args != null && args.length > 0 && args[0] instanceof String s ? s : preparedSql;
          logger.warn(
              "(moodvault) code={} op={} elapsedMs={} thresholdMs={} sql={}",
              CODE,
              name,
              elapsedMs,
              thresholdMs,
              abbreviate(sql));
        }
      }
    }
  }
}
