package ca.gc.cra.sentinel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  private final Level original = root.getLevel();

  @AfterEach
  void restore() {
    root.setLevel(original);
  }

  @Test
  void verboseLoggingRaisesRootToDebug() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void resetRestoresInfo() {
    LoggingConfigurator.enableVerboseLogging();
    LoggingConfigurator.resetLogging();

    assertEquals(Level.INFO, root.getLevel());
  }
}
