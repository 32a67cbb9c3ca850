/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.vegardit.envsync.engine.diff.FileComparison;
import com.vegardit.envsync.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Copies a regular file from source to target if their contents differ.
 */
public record FileSyncItem(Path sourcePath, Path targetPath, SyncContext context) implements SyncItem {

   private static final Logger LOG = Logger.create();

   @Override
   public SyncItemKind kind() {
      return SyncItemKind.FILE;
   }

   @Override
   public boolean needsSync() {
      if (!Files.exists(sourcePath) || isExcluded())
         return false;
      if (!Files.exists(targetPath))
         return true;
      try {
         return !FileComparison.filesEqual(sourcePath, targetPath);
      } catch (final IOException | RuntimeException ex) {
         LOG.warn("Cannot compare [%s] with [%s], assuming they differ: %s", sourcePath, targetPath, ex.getMessage());
         return true;
      }
   }

   @Override
   public SyncResult synchronize() {
      if (!Files.exists(sourcePath))
         return SyncResult.unchanged(this, "Source does not exist");
      if (isExcluded())
         return SyncResult.unchanged(this, "Excluded");
      if (!needsSync())
         return SyncResult.unchanged(this, "Already in sync");

      final var config = context.configuration();
      final boolean targetExists = Files.exists(targetPath);
      if (config.dryRun()) {
         LOG.info("[DRY RUN] %s [@|magenta %s|@]...", targetExists ? "UPDATE" : "NEW", targetPath);
         return SyncResult.unchanged(this, "Would synchronize");
      }

      try {
         if (targetExists && config.backupEnabled()) {
            context.backups().backup(targetPath);
         }
         LOG.info("%s [@|magenta %s|@]...", targetExists ? "UPDATE" : "NEW", targetPath);
         final long bytes = FileUtils.copyFile(sourcePath, targetPath);
         return SyncResult.succeeded(this, targetExists ? "Updated" : "Created", true, 0, bytes);
      } catch (final IOException | RuntimeException ex) {
         LOG.error("Failed to synchronize [%s] to [%s]: %s", sourcePath, targetPath, ex.getMessage());
         LOG.debug(ex);
         return SyncResult.failed(this, "Failed to copy file: " + ex.getMessage(), ex);
      }
   }
}
