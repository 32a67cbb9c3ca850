/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.command.sync;

import static com.vegardit.envsync.util.MapUtils.*;
import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.envsync.engine.ConflictStrategy;
import com.vegardit.envsync.engine.SyncConfiguration;
import com.vegardit.envsync.engine.SyncDirection;
import com.vegardit.envsync.util.FileUtils;
import com.vegardit.envsync.util.YamlUtils.ToYamlString;

import net.sf.jstuff.core.SystemUtils;

/**
 * Settings of one sync task as collected from the command line and the YAML config file.
 * <p>
 * All settings are nullable so that configuration layers can be stacked with {@link #applyFrom(SyncCommandConfig, boolean)}
 * before {@link #applyDefaults()} fills in what is still unset.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class SyncCommandConfig {

   public @Nullable @ToYamlString(ignore = true) Path source;
   public @ToYamlString(name = "source") Path sourceRootAbsolute = lateNonNull(); // computed value

   public @Nullable @ToYamlString(ignore = true) Path target;
   public @ToYamlString(name = "target") Path targetRootAbsolute = lateNonNull(); // computed value

   public @Nullable SyncDirection direction;
   public @Nullable ConflictStrategy conflictStrategy;
   public @Nullable Integer maxWorkers;
   public @Nullable Boolean dryRun;
   public @Nullable Boolean includeHidden;
   public @Nullable List<String> excludes;
   public @Nullable Boolean defaultExcludes;
   public @Nullable @ToYamlString(name = "backup") Boolean backupEnabled;
   public @Nullable Path backupDir;

   /**
    * Applies default values to null settings
    */
   public void applyDefaults() {
      final var defaults = new SyncCommandConfig();
      defaults.direction = SyncDirection.BIDIRECTIONAL;
      defaults.conflictStrategy = ConflictStrategy.MERGE;
      defaults.maxWorkers = SyncConfiguration.DEFAULT_MAX_WORKERS;
      defaults.dryRun = false;
      defaults.includeHidden = false;
      defaults.excludes = Collections.emptyList();
      defaults.defaultExcludes = true;
      defaults.backupEnabled = true;
      applyFrom(defaults, false);
   }

   /**
    * Applies all non-null settings from the given config object to this config object
    *
    * @param override if false, only settings that are null in this config object are applied
    */
   public void applyFrom(final @Nullable SyncCommandConfig other, final boolean override) {
      if (other == null)
         return;

      if (override && other.direction != null || direction == null) {
         direction = other.direction;
      }
      if (override && other.conflictStrategy != null || conflictStrategy == null) {
         conflictStrategy = other.conflictStrategy;
      }
      if (override && other.maxWorkers != null || maxWorkers == null) {
         maxWorkers = other.maxWorkers;
      }
      if (override && other.dryRun != null || dryRun == null) {
         dryRun = other.dryRun;
      }
      if (override && other.includeHidden != null || includeHidden == null) {
         includeHidden = other.includeHidden;
      }
      final var other_excludes = other.excludes;
      if (override && other_excludes != null || excludes == null) {
         excludes = other_excludes;
      }
      if (override && other.defaultExcludes != null || defaultExcludes == null) {
         defaultExcludes = other.defaultExcludes;
      }
      if (override && other.backupEnabled != null || backupEnabled == null) {
         backupEnabled = other.backupEnabled;
      }
      if (override && other.backupDir != null || backupDir == null) {
         backupDir = other.backupDir;
      }
      if (override && other.source != null || source == null) {
         source = other.source;
      }
      if (override && other.target != null || target == null) {
         target = other.target;
      }
   }

   /**
    * @return a map with any unused config parameters
    */
   public Map<String, Object> applyFrom(final @Nullable Map<String, Object> config, final boolean override) {
      if (config == null || config.isEmpty())
         return Collections.emptyMap();
      final var cfg = new HashMap<>(config);
      final var defaults = new SyncCommandConfig();
      final var direction = getString(cfg, "direction", true);
      defaults.direction = direction == null ? null : SyncDirection.of(direction);
      final var conflictStrategy = getString(cfg, "conflict-strategy", true);
      defaults.conflictStrategy = conflictStrategy == null ? null : ConflictStrategy.of(conflictStrategy);
      defaults.maxWorkers = getInteger(cfg, "max-workers", true);
      defaults.dryRun = getBoolean(cfg, "dry-run", true);
      defaults.includeHidden = getBoolean(cfg, "include-hidden", true);
      defaults.excludes = getStringList(cfg, "excludes", true);
      defaults.defaultExcludes = getBoolean(cfg, "default-excludes", true);
      defaults.backupEnabled = getBoolean(cfg, "backup", true);
      defaults.backupDir = getPath(cfg, "backup-dir", true);
      defaults.source = getPath(cfg, "source", true);
      defaults.target = getPath(cfg, "target", true);
      applyFrom(defaults, override);
      return cfg;
   }

   /**
    * Resolves and validates the source and target paths.
    */
   public void compute() {
      final var source = this.source;
      if (source == null)
         throw new IllegalArgumentException("Source is not specified!");
      sourceRootAbsolute = FileUtils.toAbsolute(source);
      if (!Files.exists(sourceRootAbsolute))
         throw new IllegalArgumentException("Source path [" + source + "] does not exist!");
      if (!Files.isReadable(sourceRootAbsolute))
         throw new IllegalArgumentException("Source path [" + source + "] is not readable by user [" + SystemUtils.USER_NAME + "]!");

      final var target = this.target;
      if (target == null)
         throw new IllegalArgumentException("Target is not specified!");
      final var targetRootAbsolute = this.targetRootAbsolute = FileUtils.toAbsolute(target);
      if (targetRootAbsolute.getFileSystem().isReadOnly())
         throw new IllegalArgumentException("Target path [" + target + "] is on a read-only filesystem!");
      if (!Files.exists(targetRootAbsolute)) {
         final var parent = targetRootAbsolute.getParent();
         if (parent == null || !Files.isDirectory(parent))
            throw new IllegalArgumentException("Parent directory of target path [" + target + "] does not exist!");
      }

      final var maxWorkers = this.maxWorkers;
      if (maxWorkers != null && maxWorkers < 1)
         throw new IllegalArgumentException("max-workers must be >= 1 but was " + maxWorkers);
   }

   /**
    * Converts this config into the engine's settings. {@link #applyDefaults()} and {@link #compute()} must have been
    * invoked before.
    *
    * @throws IllegalArgumentException if an exclude pattern is not a valid regular expression
    */
   public SyncConfiguration toSyncConfiguration(final boolean verbose) {
      final var patterns = new ArrayList<String>();
      if (!Boolean.FALSE.equals(defaultExcludes)) {
         patterns.addAll(SyncConfiguration.DEFAULT_EXCLUDE_PATTERNS);
      }
      final var excludes = this.excludes;
      if (excludes != null) {
         patterns.addAll(excludes);
      }
      final var direction = this.direction;
      final var conflictStrategy = this.conflictStrategy;
      final var maxWorkers = this.maxWorkers;
      final var backupDir = this.backupDir;
      return SyncConfiguration.builder(sourceRootAbsolute, targetRootAbsolute) //
         .direction(direction == null ? SyncDirection.BIDIRECTIONAL : direction) //
         .conflictStrategy(conflictStrategy == null ? ConflictStrategy.MERGE : conflictStrategy) //
         .maxWorkers(maxWorkers == null ? SyncConfiguration.DEFAULT_MAX_WORKERS : maxWorkers) //
         .dryRun(Boolean.TRUE.equals(dryRun)) //
         .verbose(verbose) //
         .includeHidden(Boolean.TRUE.equals(includeHidden)) //
         .excludePatterns(patterns) //
         .backupEnabled(!Boolean.FALSE.equals(backupEnabled)) //
         .backupDirectory(backupDir == null ? null : FileUtils.toAbsolute(backupDir)) //
         .build();
   }
}
