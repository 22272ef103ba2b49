package com.gentoro.agentflow.logging;

import java.util.Iterator;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Central place to obtain SLF4J loggers and apply logging concerns (levels, MDC). */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  public static final String MDC_RUN_ID = "run.id";
  public static final String MDC_TASK_ID = "task.id";
  public static final String MDC_AGENT = "agent";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from application configuration.
   *
   * <p>Expected YAML structure: logging: level: root: INFO com.gentoro.agentflow: DEBUG
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    try {
      ch.qos.logback.classic.LoggerContext ctx =
          (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();

      String rootLvl = cfg.getString("logging.level.root", null);
      if (rootLvl != null && !rootLvl.isBlank()) {
        setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl);
      }

      Configuration levels = cfg.subset("logging.level");
      Iterator<String> it = levels.getKeys();
      while (it.hasNext()) {
        String key = it.next();
        if ("root".equalsIgnoreCase(key)) continue;
        String lvl = levels.getString(key, null);
        if (lvl == null || lvl.isBlank()) continue;
        setLevel(ctx.getLogger(key), lvl);
      }
    } catch (ClassCastException e) {
      log.warn("Logging backend is not Logback; levels from configuration are ignored", e);
    }
  }

  /**
   * Put the given entries in the MDC and return a scope that restores the previous values on
   * close. Intended for try-with-resources around a task execution.
   */
  public static MdcScope withMdc(Map<String, String> entries) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    entries.forEach(
        (k, v) -> {
          if (v != null) MDC.put(k, v);
        });
    return () -> {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    };
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (logger == null || levelStr == null) return;
    ch.qos.logback.classic.Level level =
        ch.qos.logback.classic.Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }

  /** Closeable MDC scope; closing never throws. */
  public interface MdcScope extends AutoCloseable {
    @Override
    void close();
  }
}
