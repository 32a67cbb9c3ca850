/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.vegardit.envsync.engine.diff.StructuredFormat;
import com.vegardit.envsync.vcs.Git;

import net.sf.jstuff.core.logging.Logger;

/**
 * Entry point of a synchronization run: classifies a source/target pair into the matching {@link SyncItem} and
 * records every result in an append-only log.
 * <p>
 * Item failures never escape; callers inspect {@link #getResults()} to decide whether the run succeeded.
 */
public class SyncManager {

   private static final Logger LOG = Logger.create();

   private final SyncConfiguration configuration;
   private final SyncContext context;
   private final List<SyncResult> results = Collections.synchronizedList(new ArrayList<>());

   public SyncManager(final SyncConfiguration configuration) {
      this(configuration, new Git());
   }

   public SyncManager(final SyncConfiguration configuration, final Git git) {
      this.configuration = configuration;
      context = new SyncContext(configuration, new ExclusionFilter(configuration), new Backups(configuration.backupDirectory()), git,
         results::add);
   }

   /**
    * Determines the item kind from the source path's characteristics:
    * <ol>
    * <li>a directory containing a {@code .git} entry is a {@link SyncItemKind#REPOSITORY},
    * <li>any other directory is a {@link SyncItemKind#DIRECTORY},
    * <li>a file with a JSON or YAML extension is a {@link SyncItemKind#STRUCTURED_CONFIG},
    * <li>anything else, including a missing source, is a {@link SyncItemKind#FILE}.
    * </ol>
    */
   public static SyncItemKind classify(final Path source) {
      if (Files.isDirectory(source))
         return Files.exists(source.resolve(".git")) ? SyncItemKind.REPOSITORY : SyncItemKind.DIRECTORY;
      if (Files.isRegularFile(source) && StructuredFormat.forPath(source) != null)
         return SyncItemKind.STRUCTURED_CONFIG;
      return SyncItemKind.FILE;
   }

   public SyncItem createItem(final Path source, final Path target) {
      return switch (classify(source)) {
         case REPOSITORY -> new RepositorySyncItem(source, target, context);
         case DIRECTORY -> new DirectorySyncItem(source, target, context);
         case STRUCTURED_CONFIG -> new StructuredConfigSyncItem(source, target, context);
         case FILE -> new FileSyncItem(source, target, context);
      };
   }

   /**
    * Synchronizes the configured source root into the configured target root.
    */
   public SyncResult synchronize() {
      return syncPath(configuration.sourceRoot(), configuration.targetRoot());
   }

   /**
    * Synchronizes an arbitrary source/target pair with this manager's configuration.
    */
   public SyncResult syncPath(final Path source, final Path target) {
      final var item = createItem(source, target);
      LOG.info("Synchronizing %s [@|magenta %s|@] -> [@|magenta %s|@] (%s%s)...", //
         item.kind().name().toLowerCase(Locale.ROOT).replace('_', ' '), source, target, configuration.conflictStrategy(), //
         configuration.dryRun() ? ", DRY RUN" : "");

      SyncResult result;
      try {
         result = item.synchronize();
      } catch (final RuntimeException ex) {
         // sync items report failures as results, this only guards against programming errors
         LOG.error(ex);
         result = SyncResult.failed(item, "Unexpected error: " + ex, ex);
      }
      results.add(result);

      if (result.success()) {
         LOG.info("%s: %s", source, result.message());
      } else {
         LOG.error("%s: %s", source, result.message());
      }
      return result;
   }

   public SyncConfiguration getConfiguration() {
      return configuration;
   }

   public SyncContext getContext() {
      return context;
   }

   /**
    * @return a snapshot of all results recorded so far, child items of directories included
    */
   public List<SyncResult> getResults() {
      synchronized (results) {
         return List.copyOf(results);
      }
   }

   public boolean hasFailures() {
      return getResults().stream().anyMatch(r -> !r.success());
   }
}
