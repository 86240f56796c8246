package ca.gc.cra.netwatch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures NETWATCH runtime logging from CLI and YAML settings.
 * <p><strong>Role:</strong> Adapter-side utility bridging {@code --verbose}, {@code logLevel=} and
 * {@code logFile=} to the Logback backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String FILE_APPENDER_NAME = "NETWATCH_USER_FILE";
  static final String FILE_PATTERN = "%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n";

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    rootLogger().ifPresent(root -> {
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
    });
  }

  /**
   * Sets the root logger level by name.
   *
   * @param levelName one of TRACE, DEBUG, INFO, WARN, ERROR, OFF (case-insensitive)
   * @throws IllegalArgumentException when the level name is unknown
   */
  public static void applyLevel(String levelName) {
    Level level = parseLevel(levelName);
    rootLogger().ifPresent(root -> root.setLevel(level));
  }

  /**
   * Attaches a plain file appender to the root logger, replacing any previously attached one.
   *
   * @param file log file; parent directories are created by Logback
   */
  public static void attachFileAppender(Path file) {
    Objects.requireNonNull(file, "file");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      warnUnsupported(factory);
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.detachAppender(FILE_APPENDER_NAME);

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(FILE_PATTERN);
    encoder.start();

    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setContext(context);
    appender.setName(FILE_APPENDER_NAME);
    appender.setFile(file.toAbsolutePath().toString());
    appender.setAppend(true);
    appender.setEncoder(encoder);
    appender.start();
    root.addAppender(appender);
    log.debug("Logging to file {}", file.toAbsolutePath());
  }

  static Level parseLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      throw new IllegalArgumentException("logLevel must not be blank");
    }
    String normalized = levelName.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "TRACE" -> Level.TRACE;
      case "DEBUG" -> Level.DEBUG;
      case "INFO" -> Level.INFO;
      case "WARN", "WARNING" -> Level.WARN;
      case "ERROR" -> Level.ERROR;
      case "OFF" -> Level.OFF;
      default -> throw new IllegalArgumentException(
          "logLevel must be one of TRACE, DEBUG, INFO, WARN, ERROR, OFF (was " + levelName + ")");
    };
  }

  private static Optional<Logger> rootLogger() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return Optional.of(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME));
    }
    warnUnsupported(factory);
    return Optional.empty();
  }

  private static void warnUnsupported(ILoggerFactory factory) {
    log.warn("Logging backend {} does not support dynamic configuration", factory.getClass().getName());
  }
}
