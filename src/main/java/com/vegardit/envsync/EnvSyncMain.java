/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.*;

import java.io.IOException;
import java.util.List;
import java.util.logging.FileHandler;

import org.eclipse.jdt.annotation.Nullable;
import org.fusesource.jansi.AnsiConsole;
import org.fusesource.jansi.AnsiRenderer;

import com.vegardit.envsync.command.AbstractCommand;
import com.vegardit.envsync.command.LoggingOptionsMixin;
import com.vegardit.envsync.command.sync.SyncCommand;
import com.vegardit.envsync.util.JdkLoggingUtils;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.io.StringPrintWriter;
import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.RunLast;
import picocli.CommandLine.Unmatched;
import picocli.CommandLine.UnmatchedArgumentException;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "envsync", //
   description = "Synchronizes development environments: files, directories, JSON/YAML configs and git repositories.", //
   synopsisSubcommandLabel = "COMMAND", //
   subcommands = { //
      SyncCommand.class //
   } //
)
public class EnvSyncMain extends AbstractCommand {

   public static class LoggingOptions extends LoggingOptionsMixin {
      @Unmatched
      List<String> ignored = lateNonNull();
   }

   private static final Logger LOG = Logger.create();

   private static @Nullable FileHandler configureLogging(final String[] args) throws IOException {
      final var loggingOptions = new LoggingOptions();
      CommandLine.populateCommand(loggingOptions, args);
      return loggingOptions.apply();
   }

   /**
    * Creates the command line handler with exception handlers that report through the logger instead of writing to
    * stdout/stderr directly.
    */
   static CommandLine newCommandLine() {
      final var handler = new CommandLine(new EnvSyncMain());
      handler.setCaseInsensitiveEnumValuesAllowed(true);
      handler.setExecutionStrategy(new RunLast());
      handler.setHelpFactory((commandSpec, colorScheme) -> new Help(commandSpec, colorScheme) {

         @Nullable
         @Override
         public String headerHeading(final Object @Nullable... params) {
            return AnsiRenderer.render(super.headerHeading(params));
         }
      });

      handler.setParameterExceptionHandler((ex, args) -> {
         if (args.length == 0) {
            CommandLine.usage(handler, System.err);
            System.err.println();
            LOG.error(ex.getMessage());
         } else {
            LOG.error(ex.getMessage());
            try (var sw = new StringPrintWriter()) {
               UnmatchedArgumentException.printSuggestions(ex, sw);
               final var suggestions = sw.toString();
               if (Strings.isNotBlank(suggestions)) {
                  LOG.info(Strings.trim(suggestions));
               }
            }
            LOG.info("Execute 'envsync --help' for usage help.");
         }
         return 1;
      });
      handler.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
         ex = asNonNullUnsafe(ex);
         if (LOG.isDebugEnabled() || ex instanceof UnsupportedOperationException || ex instanceof NullPointerException) {
            LOG.error(ex); // log with stacktrace
         } else {
            LOG.error(ex.getMessage());
         }
         return 1;
      });
      return handler;
   }

   public static void main(final String[] args) throws Exception {
      Thread.currentThread().setName("main");

      // the logging options must be evaluated before any other component starts logging
      final var fileHandler = configureLogging(args);

      AnsiConsole.systemInstall();

      final var exitCode = newCommandLine().execute(args);
      JdkLoggingUtils.flushConsole();
      if (fileHandler != null) {
         fileHandler.close();
      }
      System.exit(exitCode);
   }

   @Override
   protected int execute() throws Exception {
      throw new ParameterException(commandSpec.commandLine(), "Missing required subcommand.");
   }
}
