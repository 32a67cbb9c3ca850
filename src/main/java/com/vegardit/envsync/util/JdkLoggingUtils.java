/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.util;

import java.io.IOException;
import java.util.Date;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.eclipse.jdt.annotation.Nullable;
import org.fusesource.jansi.AnsiRenderer;

import net.sf.jstuff.core.exception.Exceptions;
import net.sf.jstuff.core.logging.LoggerConfig;
import net.sf.jstuff.core.logging.jul.DualPrintStreamHandler;
import net.sf.jstuff.core.logging.jul.Levels;
import net.sf.jstuff.core.logging.jul.Loggers;
import net.sf.jstuff.core.logging.jul.PrintStreamHandler;

/**
 * Console and file logging setup for the JDK logging backend used by the jstuff {@code Logger}.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class JdkLoggingUtils {

   /**
    * Renders jansi markup such as {@code @|magenta text|@} and colors records by level.
    */
   public static class AnsiFormatter extends Formatter {

      protected String ansiRender(final @Nullable String text) {
         return text == null ? "null" : AnsiRenderer.render(text);
      }

      protected String ansiRender(final String template, final Object... args) {
         return String.format(AnsiRenderer.render(template), args);
      }

      @Override
      public synchronized String format(final LogRecord entry) {
         final var msg = ansiRender(entry.getMessage());
         final var recordTime = new Date(entry.getMillis());
         final var threadName = Thread.currentThread().getName();

         switch (entry.getLevel().intValue()) {
            case Levels.INFO_INT:
               return ansiRender("%1$tT @|green [%2$s]|@ %3$s%n", recordTime, threadName, msg);

            case Levels.WARNING_INT:
               return ansiRender("@|yellow %1$tT [%2$s] WARN: %3$s%n|@", recordTime, threadName, msg);

            case Levels.SEVERE_INT:
               final var thrown = entry.getThrown();
               return thrown == null //
                     ? ansiRender("@|red %1$tT [%2$s] ERROR: %3$s%n|@", recordTime, threadName, msg)
                     : ansiRender("@|red %1$tT [%2$s] ERROR: %3$s %4$s|@", recordTime, threadName, msg, Exceptions.getStackTrace(thrown));

            default:
               return String.format("%1$tT [%2$s] %3$-6s: %4$s %n", recordTime, threadName, entry.getLevel().getLocalizedName(), msg);
         }
      }
   }

   /**
    * Strips jansi markup, used for log files.
    */
   public static final Formatter PLAIN_FORMATTER = new Formatter() {

      @Override
      public synchronized String format(final LogRecord entry) {
         final var threadName = Thread.currentThread().getName();
         final var recordTime = new Date(entry.getMillis());
         final var msg = stripAnsiMarkup(entry.getMessage());
         final var thrown = entry.getThrown();

         return String.format("%1$tF %1$tT [%2$s] %3$-6s: %4$s%5$s%n", //
            recordTime, threadName, entry.getLevel().getLocalizedName(), msg, thrown == null ? "" : " " + Exceptions.getStackTrace(
               thrown));
      }
   };

   private static @Nullable Handler consoleHandler;

   static String stripAnsiMarkup(final @Nullable String msg) {
      if (msg == null)
         return "null";
      return msg.replaceAll("(@\\|[a-z,]+\\s)|(\\|@)", "");
   }

   public static FileHandler addFileHandler(final String fileNamePattern, final boolean append) throws IOException {
      synchronized (Loggers.ROOT_LOGGER) {
         final var handler = new FileHandler(fileNamePattern, 0, 1, append);
         handler.setFormatter(PLAIN_FORMATTER);
         Loggers.ROOT_LOGGER.addHandler(handler);
         return handler;
      }
   }

   /**
    * Replaces the root logger's console handlers with one using the given formatter.
    *
    * @param useStdErr if true, warnings and errors go to stderr, everything else to stdout
    */
   public static void configureConsoleHandler(final boolean useStdErr, final Formatter consoleFormatter) {
      synchronized (Loggers.ROOT_LOGGER) {
         LoggerConfig.setCompactExceptionLogging(false);
         Loggers.ROOT_LOGGER.setUseParentHandlers(false);
         for (final Handler handler : Loggers.ROOT_LOGGER.getHandlers()) {
            if (handler instanceof FileHandler) {
               continue;
            }
            Loggers.ROOT_LOGGER.removeHandler(handler);
         }
         final Handler handler = useStdErr //
               ? new DualPrintStreamHandler(System.out, System.err, consoleFormatter)
               : new PrintStreamHandler(System.out, consoleFormatter);
         consoleHandler = handler;
         Loggers.ROOT_LOGGER.addHandler(handler);
      }
   }

   public static void flushConsole() {
      synchronized (Loggers.ROOT_LOGGER) {
         final var handler = consoleHandler;
         if (handler != null) {
            handler.flush();
         }
      }
   }

   /**
    * Executes the given code block with the root logger set to at least the required granularity.
    */
   public static void withRootLogLevel(final Level requiredLevel, final Runnable code) {
      synchronized (Loggers.ROOT_LOGGER) {
         final var currentLevel = Levels.getRootLevel();

         if (currentLevel.intValue() > requiredLevel.intValue()) {
            Levels.setRootLevel(requiredLevel);
            try {
               code.run();
            } finally {
               Levels.setRootLevel(currentLevel);
            }
         } else {
            code.run();
         }
      }
   }

   private JdkLoggingUtils() {
   }
}
