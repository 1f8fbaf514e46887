// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905;

import java.util.logging.*;

/// Test logging setup: one compact line per record on the console.
/// The level can be raised from the command line with `-Djava.util.logging.ConsoleHandler.level=FINER`.
public sealed interface LoggingControl permits LoggingControl.Config {

  /// @param defaultLevel used when no level is given on the command line
  /// @param loggerName the logger to open up, the root logger when empty
  record Config(Level defaultLevel, String loggerName) implements LoggingControl {}

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
        final String name = record.getLoggerName();
        final String shortName = name == null ? "" : name.substring(name.lastIndexOf('.') + 1);
        return String.format("%-7s %s - %s%n", record.getLevel(), shortName, record.getMessage());
      }
    });
    rootLogger.addHandler(consoleHandler);
    rootLogger.setLevel(level);
    Logger.getLogger(config.loggerName()).setLevel(level);
  }

  /// WARNING for everything under the tree package
  static void setupCleanLogging() {
    setupCleanLogging(new Config(Level.WARNING, "io.github.simbo1905.simple_tree"));
  }
}
