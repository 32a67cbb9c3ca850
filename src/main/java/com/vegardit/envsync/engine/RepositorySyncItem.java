/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.vegardit.envsync.engine.diff.RepositoryComparison;
import com.vegardit.envsync.vcs.Git;

import net.sf.jstuff.core.logging.Logger;

/**
 * Forces a git working tree at the target to the revision checked out in the source repository.
 * <p>
 * A missing target is cloned. Otherwise the source is registered as remote {@value Git#SOURCE_REMOTE} of the target,
 * fetched, and the target's current branch is hard reset to the source branch of the same name. Uncommitted target
 * changes are only discarded under {@link ConflictStrategy#SOURCE_WINS}.
 * <p>
 * A failure half way, e.g. after the remote was added but the fetch failed, leaves the target in that intermediate
 * state.
 */
public record RepositorySyncItem(Path sourcePath, Path targetPath, SyncContext context) implements SyncItem {

   private static final Logger LOG = Logger.create();

   @Override
   public SyncItemKind kind() {
      return SyncItemKind.REPOSITORY;
   }

   @Override
   public boolean needsSync() {
      if (!Files.exists(sourcePath) || isExcluded())
         return false;
      if (!Files.exists(targetPath))
         return true;
      return !RepositoryComparison.headsEqual(context.git(), sourcePath, targetPath);
   }

   @Override
   public SyncResult synchronize() {
      if (!Files.exists(sourcePath))
         return SyncResult.unchanged(this, "Source does not exist");
      if (isExcluded())
         return SyncResult.unchanged(this, "Excluded");

      final var git = context.git();
      final var config = context.configuration();
      if (!git.isRepository(sourcePath))
         return SyncResult.failed(this, "Source is not a git repository", null);

      if (!needsSync())
         return SyncResult.unchanged(this, "Already in sync");

      try {
         if (!Files.exists(targetPath)) {
            if (config.dryRun()) {
               LOG.info("[DRY RUN] CLONE [@|magenta %s|@]...", targetPath);
               return SyncResult.unchanged(this, "Would clone");
            }
            LOG.info("CLONE [@|magenta %s|@]...", targetPath);
            git.cloneRepository(sourcePath, targetPath);
            return SyncResult.succeeded(this, "Cloned", true, 0, 0);
         }

         if (!git.isRepository(targetPath))
            return SyncResult.failed(this, "Target exists but is not a git repository", null);

         final var discardLocalChanges = !git.isClean(targetPath);
         if (discardLocalChanges && config.conflictStrategy() != ConflictStrategy.SOURCE_WINS)
            return SyncResult.failed(this, "Target has uncommitted changes", null);

         if (config.dryRun()) {
            LOG.info("[DRY RUN] RESET [@|magenta %s|@]...", targetPath);
            return SyncResult.unchanged(this, "Would synchronize");
         }

         if (discardLocalChanges) {
            LOG.warn("Discarding uncommitted changes in [%s]...", targetPath);
            git.resetHard(targetPath, "HEAD");
            git.cleanUntracked(targetPath);
         }

         git.addOrUpdateRemote(targetPath, Git.SOURCE_REMOTE, sourcePath.toAbsolutePath().toUri().toString());
         git.fetch(targetPath, Git.SOURCE_REMOTE);
         final var branch = git.currentBranch(targetPath);
         LOG.info("RESET [@|magenta %s|@] to [%s/%s]...", targetPath, Git.SOURCE_REMOTE, branch);
         git.resetHard(targetPath, Git.SOURCE_REMOTE + "/" + branch);
         return SyncResult.succeeded(this, "Reset to " + Git.SOURCE_REMOTE + "/" + branch, true, 0, 0);
      } catch (final IOException | RuntimeException ex) {
         LOG.error("Failed to synchronize repository [%s] to [%s]: %s", sourcePath, targetPath, ex.getMessage());
         LOG.debug(ex);
         return SyncResult.failed(this, "Failed to synchronize repository: " + ex.getMessage(), ex);
      }
   }
}
