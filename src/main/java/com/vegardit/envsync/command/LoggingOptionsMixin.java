/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.command;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.envsync.util.JdkLoggingUtils;

import picocli.CommandLine.Option;

/**
 * Console and log file options. They are evaluated before picocli dispatches to a command so that the command's
 * own argument validation is already logged with the requested setup.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class LoggingOptionsMixin {

   @Option(names = "--log-file", paramLabel = "<path>", description = "Also write the sync log to the given file (without color markup).")
   public @Nullable Path logFile;

   @Option(names = "--log-file-overwrite", description = "Truncate an existing log file instead of appending to it.")
   public boolean logFileOverwrite;

   @Option(names = "--log-errors-to-stdout", description = "Log warnings and errors to stdout instead of stderr.")
   public boolean logErrorsToStdOut;

   @Option(names = "--no-color", description = "Disable colored console output, e.g. when piping the sync log into a CI job log.")
   public boolean noColor;

   public Formatter consoleFormatter() {
      return noColor ? JdkLoggingUtils.PLAIN_FORMATTER : new JdkLoggingUtils.AnsiFormatter();
   }

   /**
    * Configures the console handler and, if requested, the log file handler.
    *
    * @return the file handler or null if no log file was requested
    */
   public @Nullable FileHandler apply() throws IOException {
      JdkLoggingUtils.configureConsoleHandler(!logErrorsToStdOut, consoleFormatter());

      final var logFile = this.logFile;
      if (logFile == null)
         return null;
      return JdkLoggingUtils.addFileHandler(logFile.toAbsolutePath().toString(), !logFileOverwrite);
   }
}
