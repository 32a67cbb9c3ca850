/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import com.vegardit.envsync.engine.diff.StructuredFormat;
import com.vegardit.envsync.pool.TaskPool;
import com.vegardit.envsync.pool.TaskPriority;
import com.vegardit.envsync.pool.TaskResult;

import net.sf.jstuff.core.logging.Logger;

/**
 * Synchronizes a directory tree file by file.
 * <p>
 * Files present in the source are copied (or merged, for structured config documents) in parallel by a
 * {@link TaskPool} scoped to this invocation. Files only present in the target are deleted afterwards, one by one,
 * unless the active strategy is {@link ConflictStrategy#TARGET_WINS}. A failing file does not fail the directory:
 * it is listed in the aggregate message and its own result is passed to {@link SyncContext#resultLog()}.
 */
public record DirectorySyncItem(Path sourcePath, Path targetPath, SyncContext context) implements SyncItem {

   private static final Logger LOG = Logger.create();

   /**
    * Relative paths of the non-excluded files on both sides, split by what has to happen to them.
    */
   record Plan(SortedSet<Path> toAdd, SortedSet<Path> toUpdate, SortedSet<Path> toRemove) {
   }

   @Override
   public SyncItemKind kind() {
      return SyncItemKind.DIRECTORY;
   }

   @Override
   public boolean needsSync() {
      if (!Files.isDirectory(sourcePath) || isExcluded())
         return false;
      if (!Files.exists(targetPath))
         return true;
      try {
         final var plan = plan();
         if (!plan.toAdd().isEmpty() || !removals(plan).isEmpty())
            return true;
         for (final var relativePath : plan.toUpdate()) {
            if (childItem(relativePath).needsSync())
               return true;
         }
         return false;
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
      if (!Files.isDirectory(sourcePath))
         return SyncResult.failed(this, "Source is not a directory", null);
      if (Files.exists(targetPath) && !Files.isDirectory(targetPath))
         return SyncResult.failed(this, "Target exists but is not a directory", null);

      final var config = context.configuration();
      try {
         final var plan = plan();
         final var removals = removals(plan);

         if (config.dryRun()) {
            var updates = 0;
            for (final var relativePath : plan.toUpdate()) {
               if (childItem(relativePath).needsSync()) {
                  updates++;
               }
            }
            final var message = String.format("Would add %s, update %s and remove %s file(s)", plan.toAdd().size(), updates, removals
               .size());
            LOG.info("[DRY RUN] [@|magenta %s|@]: %s", targetPath, message);
            return SyncResult.unchanged(this, message);
         }

         var changesMade = false;
         if (!Files.exists(targetPath)) {
            LOG.info("NEW [@|magenta %s|@]...", targetPath);
            Files.createDirectories(targetPath);
            changesMade = true;
         }

         final var failures = new ArrayList<String>();
         var added = 0;
         var updated = 0;
         var conflicts = 0;
         var bytes = 0L;

         final Map<Long, TaskResult<SyncResult>> taskResults;
         final var addTaskIds = new HashSet<Long>();
         try (var pool = new TaskPool<SyncResult>("sync", config.maxWorkers())) {
            final var taskIds = new ArrayList<Long>();
            for (final var relativePath : plan.toAdd()) {
               final var child = childItem(relativePath);
               final var taskId = pool.submit(child::synchronize, TaskPriority.NORMAL);
               addTaskIds.add(taskId);
               taskIds.add(taskId);
            }
            for (final var relativePath : plan.toUpdate()) {
               final var child = childItem(relativePath);
               if (child.needsSync()) {
                  taskIds.add(pool.submit(child::synchronize, TaskPriority.NORMAL));
               }
            }
            taskResults = pool.waitAll(taskIds);
         }

         for (final var taskResult : taskResults.values()) {
            final var childResult = taskResult.value();
            if (!taskResult.success() || childResult == null) {
               final var error = taskResult.error();
               failures.add("task " + taskResult.taskId() + ": " + (error == null ? "no result" : error.getMessage()));
               continue;
            }
            context.resultLog().accept(childResult);
            if (!childResult.success()) {
               failures.add(childResult.itemPath() + ": " + childResult.message());
               continue;
            }
            if (childResult.changesMade()) {
               changesMade = true;
               if (addTaskIds.contains(taskResult.taskId())) {
                  added++;
               } else {
                  updated++;
               }
            }
            conflicts += childResult.conflictsResolved();
            bytes += childResult.bytesTransferred();
         }

         var removed = 0;
         for (final var relativePath : removals) {
            final var targetFile = targetPath.resolve(relativePath);
            try {
               if (config.backupEnabled()) {
                  context.backups().backup(targetFile);
               }
               LOG.info("DELETE [@|magenta %s|@]...", targetFile);
               Files.deleteIfExists(targetFile);
               removed++;
               changesMade = true;
            } catch (final IOException ex) {
               LOG.error("Failed to delete [%s]: %s", targetFile, ex.getMessage());
               LOG.debug(ex);
               failures.add(targetFile + ": " + ex.getMessage());
            }
         }

         final var summary = String.format("%s added, %s updated, %s removed", added, updated, removed);
         if (config.verbose()) {
            LOG.info("[@|magenta %s|@]: %s", targetPath, summary);
         } else {
            LOG.debug("[%s]: %s", targetPath, summary);
         }
         final var message = failures.isEmpty() //
               ? summary
               : summary + "; " + failures.size() + " failed: " + String.join("; ", failures);
         return SyncResult.succeeded(this, message, changesMade, conflicts, bytes);
      } catch (final InterruptedException ex) {
         Thread.currentThread().interrupt();
         return SyncResult.failed(this, "Interrupted while waiting for file synchronization tasks", ex);
      } catch (final IOException | RuntimeException ex) {
         LOG.error("Failed to synchronize directory [%s] to [%s]: %s", sourcePath, targetPath, ex.getMessage());
         LOG.debug(ex);
         return SyncResult.failed(this, "Failed to synchronize directory: " + ex.getMessage(), ex);
      }
   }

   Plan plan() throws IOException {
      final var sourceFiles = listFiles(sourcePath);
      final var targetFiles = Files.isDirectory(targetPath) ? listFiles(targetPath) : Collections.<Path> emptySortedSet();

      final var toAdd = new TreeSet<>(sourceFiles);
      toAdd.removeAll(targetFiles);
      final var toUpdate = new TreeSet<>(sourceFiles);
      toUpdate.retainAll(targetFiles);
      final var toRemove = new TreeSet<>(targetFiles);
      toRemove.removeAll(sourceFiles);
      return new Plan(toAdd, toUpdate, toRemove);
   }

   private SortedSet<Path> removals(final Plan plan) {
      return context.configuration().conflictStrategy() == ConflictStrategy.TARGET_WINS ? Collections.emptySortedSet() : plan.toRemove();
   }

   /**
    * Structured config documents become {@link StructuredConfigSyncItem}s, everything else {@link FileSyncItem}s.
    */
   SyncItem childItem(final Path relativePath) {
      final var source = sourcePath.resolve(relativePath);
      final var target = targetPath.resolve(relativePath);
      if (StructuredFormat.forPath(source) != null)
         return new StructuredConfigSyncItem(source, target, context);
      return new FileSyncItem(source, target, context);
   }

   /**
    * @return the relative paths of all non-excluded regular files below the given directory; excluded directories
    *         are not descended into
    */
   private SortedSet<Path> listFiles(final Path root) throws IOException {
      final var exclusions = context.exclusions();
      final var files = new TreeSet<Path>();
      Files.walkFileTree(root, new SimpleFileVisitor<>() {
         @Override
         public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
            if (!dir.equals(root) && exclusions.isExcluded(dir)) {
               LOG.trace("Skipping excluded directory [%s].", dir);
               return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
         }

         @Override
         public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
            if ((attrs.isRegularFile() || attrs.isSymbolicLink() && Files.isRegularFile(file)) && !exclusions.isExcluded(file)) {
               files.add(root.relativize(file));
            }
            return FileVisitResult.CONTINUE;
         }

         @Override
         public FileVisitResult visitFileFailed(final Path file, final IOException ex) {
            LOG.warn("Cannot access [%s]: %s", file, ex.getMessage());
            return FileVisitResult.CONTINUE;
         }
      });
      return files;
   }
}
