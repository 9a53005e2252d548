package ca.gc.cra.rackd.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    root.setLevel(originalLevel);
  }

  @Test
  void enableVerboseLoggingRaisesRootToDebug() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void setLevelTargetsNamedLogger() {
    Logger probe = (Logger) LoggerFactory.getLogger("ca.gc.cra.rackd.infrastructure.probe");
    Level previous = probe.getLevel();
    try {
      LoggingConfigurator.setLevel("ca.gc.cra.rackd.infrastructure.probe", Level.TRACE);
      assertEquals(Level.TRACE, probe.getLevel());
    } finally {
      probe.setLevel(previous);
    }
  }
}
