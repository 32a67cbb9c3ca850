/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.vegardit.envsync.engine.diff.DeepMerge;
import com.vegardit.envsync.engine.diff.StructuredComparison;
import com.vegardit.envsync.engine.diff.StructuredFormat;
import com.vegardit.envsync.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Synchronizes a JSON or YAML document, comparing and reconciling it structurally according to the active
 * {@link ConflictStrategy}.
 * <p>
 * A missing target receives a verbatim copy of the source. An existing target that would end up structurally
 * unchanged is not rewritten.
 */
public record StructuredConfigSyncItem(Path sourcePath, Path targetPath, SyncContext context) implements SyncItem {

   private static final Logger LOG = Logger.create();

   @Override
   public SyncItemKind kind() {
      return SyncItemKind.STRUCTURED_CONFIG;
   }

   @Override
   public boolean needsSync() {
      if (!Files.exists(sourcePath) || isExcluded())
         return false;
      if (!Files.exists(targetPath))
         return true;
      return !StructuredComparison.filesEqual(sourcePath, targetPath);
   }

   @Override
   public SyncResult synchronize() {
      if (!Files.exists(sourcePath))
         return SyncResult.unchanged(this, "Source does not exist");
      if (isExcluded())
         return SyncResult.unchanged(this, "Excluded");

      final var format = StructuredFormat.forPath(sourcePath);
      if (format == null)
         return SyncResult.failed(this, "Unsupported structured config format", null);

      final var config = context.configuration();
      try {
         if (!Files.exists(targetPath)) {
            if (config.dryRun()) {
               LOG.info("[DRY RUN] NEW [@|magenta %s|@]...", targetPath);
               return SyncResult.unchanged(this, "Would create");
            }
            LOG.info("NEW [@|magenta %s|@]...", targetPath);
            final long bytes = FileUtils.copyFile(sourcePath, targetPath);
            return SyncResult.succeeded(this, "Created", true, 0, bytes);
         }

         if (!needsSync())
            return SyncResult.unchanged(this, "Already in sync");

         switch (config.conflictStrategy()) {
            case TARGET_WINS:
               LOG.debug("Keeping [%s] (%s).", targetPath, ConflictStrategy.TARGET_WINS);
               return SyncResult.unchanged(this, "Target kept");
            case MANUAL:
               LOG.warn("CONFLICT [@|yellow %s|@] differs from [%s] and requires manual resolution.", targetPath, sourcePath);
               return SyncResult.unchanged(this, "Skipped, requires manual resolution");
            case SKIP:
               LOG.debug("Skipping conflicting [%s].", targetPath);
               return SyncResult.unchanged(this, "Skipped");
            default:
               return reconcile(format, config);
         }
      } catch (final IOException | RuntimeException ex) {
         LOG.error("Failed to synchronize [%s] to [%s]: %s", sourcePath, targetPath, ex.getMessage());
         LOG.debug(ex);
         return SyncResult.failed(this, "Failed to synchronize document: " + ex.getMessage(), ex);
      }
   }

   /**
    * Applies {@link ConflictStrategy#SOURCE_WINS} or {@link ConflictStrategy#MERGE}. Both documents are parsed first,
    * so malformed content on either side aborts before the target is touched.
    */
   private SyncResult reconcile(final StructuredFormat format, final SyncConfiguration config) throws IOException {
      final var sourceDoc = format.read(sourcePath);
      final var targetDoc = format.read(targetPath);

      final Object resultDoc;
      final int conflicts;
      final String action;
      if (config.conflictStrategy() == ConflictStrategy.MERGE) {
         final var merged = DeepMerge.merge(sourceDoc, targetDoc);
         resultDoc = merged.document();
         conflicts = merged.conflictsResolved();
         action = "MERGE";
      } else {
         // only merges count conflicts, an overwrite resolves nothing key by key
         resultDoc = sourceDoc;
         conflicts = 0;
         action = "OVERWRITE";
      }

      if (StructuredComparison.documentsEqual(resultDoc, targetDoc))
         return SyncResult.unchanged(this, "Target already up to date");

      if (config.dryRun()) {
         LOG.info("[DRY RUN] %s [@|magenta %s|@]...", action, targetPath);
         return SyncResult.unchanged(this, action.equals("MERGE") ? "Would merge" : "Would overwrite");
      }

      if (config.backupEnabled()) {
         context.backups().backup(targetPath);
      }
      LOG.info("%s [@|magenta %s|@]...", action, targetPath);
      final long bytes = format.write(targetPath, resultDoc);
      return SyncResult.succeeded(this, action.equals("MERGE") ? "Merged" : "Overwritten", true, conflicts, bytes);
   }
}
