/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.envsync.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Writes snapshot copies of files before they are overwritten or deleted.
 * <p>
 * A backup of {@code config.json} taken at 2024-03-01 14:05:09 is named {@code config.json.20240301140509.bak}.
 * Backups go to the configured backup directory or, if none is configured, to a hidden
 * {@value #DEFAULT_DIR_NAME} directory beside the backed up file.
 */
public final class Backups {

   private static final Logger LOG = Logger.create();

   public static final String DEFAULT_DIR_NAME = ".sync_backups";

   static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

   private final @Nullable Path backupDirectory;
   private final Clock clock;

   public Backups(final @Nullable Path backupDirectory) {
      this(backupDirectory, Clock.systemDefaultZone());
   }

   public Backups(final @Nullable Path backupDirectory, final Clock clock) {
      this.backupDirectory = backupDirectory;
      this.clock = clock;
   }

   public Path getBackupDirectoryFor(final Path file) {
      final var backupDirectory = this.backupDirectory;
      if (backupDirectory != null)
         return backupDirectory;
      final var parent = file.toAbsolutePath().getParent();
      if (parent == null)
         throw new IllegalArgumentException("Cannot determine parent directory of [" + file + "]");
      return parent.resolve(DEFAULT_DIR_NAME);
   }

   /**
    * Copies the given file into its backup directory.
    *
    * @return the backup file
    */
   public Path backup(final Path file) throws IOException {
      final var dir = getBackupDirectoryFor(file);
      Files.createDirectories(dir);

      final var baseName = file.getFileName() + "." + LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
      var backupFile = dir.resolve(baseName + ".bak");
      // reserve a unique name, concurrent workers may back up equally named files into the same directory
      for (var i = 1;; i++) {
         try {
            Files.createFile(backupFile);
            break;
         } catch (final FileAlreadyExistsException ex) {
            backupFile = dir.resolve(baseName + "-" + i + ".bak");
         }
      }

      try {
         FileUtils.copyFile(file, backupFile);
      } catch (final IOException | RuntimeException ex) {
         // do not leave a reserved but empty backup behind
         Files.deleteIfExists(backupFile);
         throw ex;
      }
      LOG.debug("Backed up [%s] to [%s].", file, backupFile);
      return backupFile;
   }
}
