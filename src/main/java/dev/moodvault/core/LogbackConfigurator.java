/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.Layout;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Applies {@code core.log} to a Logback context: root level plus one console appender. */
final class LogbackConfigurator {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("moodvault");
  static final String CONSOLE_APPENDER = "moodvault-console";
  static final String BACKEND = "logback";
  private static final String PATTERN = "%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n";

  private LogbackConfigurator() {}

  /**
   * Applies {@code logCfg} to the SLF4J backend in use.
   *
   * @return {@code "logback"} when the settings were applied, otherwise the name of the backend
   *     left at its own defaults
   */
  static String configure(Config.Log logCfg) {
    ILoggerFactory factory;
    try {
      factory = LoggerFactory.getILoggerFactory();
      if (factory instanceof LoggerContext context) {
        if (logCfg != null) {
          configure(context, logCfg);
        }
        return BACKEND;
      }
    } catch (NoClassDefFoundError e) {
      LOG.debug("(moodvault) logback not available; leaving logging as-is");
      return "none";
    }
    String name = factory.getClass().getName();
    LOG.debug("(moodvault) skipping logback configuration; factory is {}", name);
    return name;
  }

  static void configure(LoggerContext context, Config.Log logCfg) {
    if (context == null || logCfg == null) {
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level level = levelFrom(logCfg.level());
    if (level == null) {
      level = Level.INFO;
      LOG.warn("(moodvault) invalid core.log.level {}; defaulting to INFO", logCfg.level());
    }
    root.setLevel(level);

    if (root.getAppender(CONSOLE_APPENDER) != null) {
      root.detachAppender(CONSOLE_APPENDER);
    }
    Encoder<ILoggingEvent> encoder =
        logCfg.json() ? jsonEncoder(context) : patternEncoder(context);
    root.addAppender(consoleAppender(context, encoder));
  }

  private static Encoder<ILoggingEvent> patternEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();
    return encoder;
  }

  private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
    Layout<ILoggingEvent> layout = new VaultJsonLayout();
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }

  private static ConsoleAppender<ILoggingEvent> consoleAppender(
      LoggerContext context, Encoder<ILoggingEvent> encoder) {
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(CONSOLE_APPENDER);
    console.setContext(context);
    console.setEncoder(encoder);
    console.start();
    return console;
  }

  private static Level levelFrom(String level) {
    if (level == null) {
      return null;
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    Level parsed = Level.toLevel(normalized, null);
    return parsed != null && parsed.toString().equals(normalized) ? parsed : null;
  }
}
