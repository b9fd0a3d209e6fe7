/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.sql.Connection;
import java.sql.PreparedStatement;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SlowQueryDataSourceTest {
  private LoggerContext context;
  private Logger vaultLogger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setup() {
    context = new LoggerContext();
    context.start();
    vaultLogger = context.getLogger("moodvault");
    appender = new ListAppender<>();
    appender.start();
    vaultLogger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    vaultLogger.detachAppender(appender);
    appender.stop();
    context.stop();
  }

  @Test
  void warnsWhenQueryExceedsThreshold() throws Exception {
    DataSource delegate = mock(DataSource.class);
    Connection connection = mock(Connection.class);
    PreparedStatement prepared = mock(PreparedStatement.class);

    when(delegate.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(prepared);
    when(prepared.executeUpdate())
        .thenAnswer(
            invocation -> {
              Thread.sleep(15L);
              return 1;
            });

    DataSource wrapped = SlowQueryDataSource.wrap(delegate, 5L, vaultLogger);

    try (Connection c = wrapped.getConnection();
        PreparedStatement ps = c.prepareStatement("DELETE FROM entries WHERE owner=?")) {
      assertEquals(1, ps.executeUpdate());
    }

    assertTrue(
        appender.list.stream()
            .anyMatch(event -> event.getFormattedMessage().contains("DB_SLOW_QUERY")),
        "expected slow query warning to be emitted");
  }

  @Test
  void fastQueriesStayQuiet() throws Exception {
    DataSource delegate = mock(DataSource.class);
    Connection connection = mock(Connection.class);
    PreparedStatement prepared = mock(PreparedStatement.class);
    when(delegate.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(prepared);
    when(prepared.execute()).thenReturn(Boolean.TRUE);

    DataSource wrapped = SlowQueryDataSource.wrap(delegate, 10_000L, vaultLogger);
    try (Connection c = wrapped.getConnection();
        PreparedStatement ps = c.prepareStatement("SELECT 1")) {
      ps.execute();
    }

    assertFalse(
        appender.list.stream()
            .anyMatch(event -> event.getFormattedMessage().contains("DB_SLOW_QUERY")));
  }

  @Test
  void zeroThresholdReturnsDelegate() {
    DataSource delegate = mock(DataSource.class);
    assertSame(delegate, SlowQueryDataSource.wrap(delegate, 0L, vaultLogger));
  }

  @Test
  void longStatementsAreAbbreviated() {
    String abbreviated = SlowQueryDataSource.abbreviate("SELECT " + "x,".repeat(200) + " 1");
    assertTrue(abbreviated.length() <= 163);
  }
}
