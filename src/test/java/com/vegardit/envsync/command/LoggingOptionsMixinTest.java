/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.command;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.eclipse.jdt.annotation.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vegardit.envsync.util.JdkLoggingUtils;

import net.sf.jstuff.core.logging.jul.Loggers;
import picocli.CommandLine;

class LoggingOptionsMixinTest {

   @TempDir
   Path tempDir = lateNonNull();

   private static LoggingOptionsMixin parse(final String... args) {
      return CommandLine.populateCommand(new LoggingOptionsMixin(), args);
   }

   private static void writeAndClose(final @Nullable FileHandler handler, final String message) {
      assertThat(handler).isNotNull();
      assert handler != null;
      try {
         handler.publish(new LogRecord(Level.INFO, message));
         handler.flush();
      } finally {
         Loggers.ROOT_LOGGER.removeHandler(handler);
         handler.close();
      }
   }

   @Test
   void testDefaults() throws IOException {
      final var options = parse();
      assertThat(options.logFile).isNull();
      assertThat(options.logFileOverwrite).isFalse();
      assertThat(options.logErrorsToStdOut).isFalse();
      assertThat(options.noColor).isFalse();
      assertThat(options.consoleFormatter()).isInstanceOf(JdkLoggingUtils.AnsiFormatter.class);
      assertThat(options.apply()).isNull();
   }

   @Test
   void testNoColorUsesPlainConsoleOutput() {
      final var options = parse("--no-color", "--log-errors-to-stdout");
      assertThat(options.logErrorsToStdOut).isTrue();
      assertThat(options.consoleFormatter()).isSameAs(JdkLoggingUtils.PLAIN_FORMATTER);
   }

   @Test
   void testLogFileIsWrittenWithoutColorMarkup() throws IOException {
      final var logFile = tempDir.resolve("sync.log");
      final var options = parse("--log-file", logFile.toString());
      assertThat(options.logFile).isEqualTo(logFile);

      writeAndClose(options.apply(), "Synchronizing [@|magenta a.txt|@]");

      assertThat(Files.readString(logFile)).contains("Synchronizing [a.txt]").doesNotContain("@|");
   }

   @Test
   void testLogFileAppendsUnlessOverwriteIsRequested() throws IOException {
      final var logFile = Files.writeString(tempDir.resolve("sync.log"), "previous run\n");

      writeAndClose(parse("--log-file", logFile.toString()).apply(), "second run");
      assertThat(Files.readString(logFile)).contains("previous run", "second run");

      writeAndClose(parse("--log-file", logFile.toString(), "--log-file-overwrite").apply(), "third run");
      assertThat(Files.readString(logFile)).contains("third run").doesNotContain("previous run", "second run");
   }
}
