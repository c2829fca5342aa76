// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package org.replikativ.structured;

import java.util.logging.*;

/**
 * Compact single-line JUL output for tests.
 * Override the level with -Djava.util.logging.ConsoleHandler.level=FINER
 */
public sealed interface LoggingControl permits LoggingControl.Config {

  record Config(Level defaultLevel) implements LoggingControl {}

  static void setupCleanLogging(Config config) {
    String logLevel = System.getProperty("java.util.logging.ConsoleHandler.level");
    Level level = (logLevel != null) ? Level.parse(logLevel) : config.defaultLevel();

    Logger rootLogger = Logger.getLogger("");
    for (Handler handler : rootLogger.getHandlers()) {
      rootLogger.removeHandler(handler);
    }

    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setLevel(level);
    consoleHandler.setFormatter(new Formatter() {
      @Override
      public String format(LogRecord record) {
        return record.getLevel() + " " + record.getLoggerName() + ": " + record.getMessage() + "\n";
      }
    });

    rootLogger.addHandler(consoleHandler);
    rootLogger.setLevel(level);
  }

  static void setupCleanLogging() {
    setupCleanLogging(new Config(Level.WARNING));
  }
}
