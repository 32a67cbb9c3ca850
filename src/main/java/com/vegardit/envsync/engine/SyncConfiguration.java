/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Immutable settings of one synchronization run.
 *
 * @param direction advisory label, data always moves from source to target
 * @param excludePatterns regular expressions matched (find semantics) against path strings with {@code /} separators
 * @param dryRun if true, the target is never modified
 * @param includeHidden if false, files and directories whose name starts with a dot are ignored
 * @param backupDirectory where backups are written, null for a {@value Backups#DEFAULT_DIR_NAME} directory beside
 *           each mutated file
 */
public record SyncConfiguration( //
   Path sourceRoot, //
   Path targetRoot, //
   SyncDirection direction, //
   ConflictStrategy conflictStrategy, //
   List<String> excludePatterns, //
   int maxWorkers, //
   boolean dryRun, //
   boolean verbose, //
   boolean includeHidden, //
   boolean backupEnabled, //
   @Nullable Path backupDirectory //
) {

   public static final int DEFAULT_MAX_WORKERS = 8;

   /**
    * Version control metadata, byte-compiled caches, virtual environments, IDE settings, OS metadata files and
    * test/coverage caches.
    */
   public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of( //
      "\\.git$", "\\.github$", "\\.hg$", "\\.svn$", //
      "__pycache__$", "\\.pyc$", "\\.pyo$", "\\.pyd$", //
      "\\.venv$", "venv$", "\\.env$", //
      "\\.idea$", "\\.vscode$", //
      "\\.DS_Store$", "Thumbs\\.db$", //
      "\\.pytest_cache$", "\\.sass-cache$", "\\.tox$", "\\.coverage$", "\\.coverage\\.", "htmlcov$", "\\.hypothesis$", "\\.mypy_cache$");

   public static final class Builder {
      private final Path sourceRoot;
      private final Path targetRoot;
      private SyncDirection direction = SyncDirection.BIDIRECTIONAL;
      private ConflictStrategy conflictStrategy = ConflictStrategy.SOURCE_WINS;
      private final List<String> excludePatterns = new ArrayList<>(DEFAULT_EXCLUDE_PATTERNS);
      private int maxWorkers = DEFAULT_MAX_WORKERS;
      private boolean dryRun;
      private boolean verbose;
      private boolean includeHidden;
      private boolean backupEnabled = true;
      private @Nullable Path backupDirectory;

      Builder(final Path sourceRoot, final Path targetRoot) {
         this.sourceRoot = sourceRoot;
         this.targetRoot = targetRoot;
      }

      public Builder direction(final SyncDirection direction) {
         this.direction = direction;
         return this;
      }

      public Builder conflictStrategy(final ConflictStrategy conflictStrategy) {
         this.conflictStrategy = conflictStrategy;
         return this;
      }

      /**
       * Replaces the exclude patterns, including the defaults.
       */
      public Builder excludePatterns(final List<String> excludePatterns) {
         this.excludePatterns.clear();
         this.excludePatterns.addAll(excludePatterns);
         return this;
      }

      public Builder addExcludePattern(final String excludePattern) {
         excludePatterns.add(excludePattern);
         return this;
      }

      public Builder maxWorkers(final int maxWorkers) {
         this.maxWorkers = maxWorkers;
         return this;
      }

      public Builder dryRun(final boolean dryRun) {
         this.dryRun = dryRun;
         return this;
      }

      public Builder verbose(final boolean verbose) {
         this.verbose = verbose;
         return this;
      }

      public Builder includeHidden(final boolean includeHidden) {
         this.includeHidden = includeHidden;
         return this;
      }

      public Builder backupEnabled(final boolean backupEnabled) {
         this.backupEnabled = backupEnabled;
         return this;
      }

      public Builder backupDirectory(final @Nullable Path backupDirectory) {
         this.backupDirectory = backupDirectory;
         return this;
      }

      /**
       * @throws IllegalArgumentException if a setting is invalid
       */
      public SyncConfiguration build() {
         return new SyncConfiguration(sourceRoot, targetRoot, direction, conflictStrategy, excludePatterns, maxWorkers, dryRun, verbose,
            includeHidden, backupEnabled, backupDirectory);
      }
   }

   public static Builder builder(final Path sourceRoot, final Path targetRoot) {
      return new Builder(sourceRoot, targetRoot);
   }

   public SyncConfiguration {
      Objects.requireNonNull(sourceRoot, "sourceRoot");
      Objects.requireNonNull(targetRoot, "targetRoot");
      Objects.requireNonNull(direction, "direction");
      Objects.requireNonNull(conflictStrategy, "conflictStrategy");
      if (maxWorkers < 1)
         throw new IllegalArgumentException("maxWorkers must be >= 1 but was " + maxWorkers);
      for (final var pattern : excludePatterns) {
         try {
            Pattern.compile(pattern);
         } catch (final PatternSyntaxException ex) {
            throw new IllegalArgumentException("Invalid exclude pattern [" + pattern + "]: " + ex.getDescription(), ex);
         }
      }
      excludePatterns = List.copyOf(excludePatterns);
   }

   /**
    * @return a builder initialized with all settings of this configuration
    */
   public Builder toBuilder() {
      return new Builder(sourceRoot, targetRoot) //
         .direction(direction) //
         .conflictStrategy(conflictStrategy) //
         .excludePatterns(excludePatterns) //
         .maxWorkers(maxWorkers) //
         .dryRun(dryRun) //
         .verbose(verbose) //
         .includeHidden(includeHidden) //
         .backupEnabled(backupEnabled) //
         .backupDirectory(backupDirectory);
   }
}
