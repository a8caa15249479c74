package ca.gc.cra.ipscan.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Logger driver;
  private Level rootLevel;
  private Level driverLevel;

  @BeforeEach
  void remember() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    driver = (Logger) LoggerFactory.getLogger("org.mongodb.driver");
    rootLevel = root.getLevel();
    driverLevel = driver.getLevel();
  }

  @AfterEach
  void restore() {
    root.setLevel(rootLevel);
    driver.setLevel(driverLevel);
  }

  @Test
  void verboseRaisesRootButKeepsConfiguredDriverLevel() {
    driver.setLevel(Level.WARN);

    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root.getLevel());
    assertEquals(Level.WARN, driver.getLevel());
  }

  @Test
  void verboseCapsUnconfiguredDriverAtInfo() {
    driver.setLevel(null);

    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.INFO, driver.getLevel());
  }
}
