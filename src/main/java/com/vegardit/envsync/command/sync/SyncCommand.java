/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.command.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.envsync.command.AbstractCommand;
import com.vegardit.envsync.engine.ConflictStrategy;
import com.vegardit.envsync.engine.SyncDirection;
import com.vegardit.envsync.engine.SyncManager;
import com.vegardit.envsync.engine.SyncResult;
import com.vegardit.envsync.engine.SyncSummary;
import com.vegardit.envsync.util.JdkLoggingUtils;
import com.vegardit.envsync.util.YamlUtils;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@CommandLine.Command(name = "sync", //
   description = "Synchronizes a file, directory, JSON/YAML config document or git repository from SOURCE into TARGET." //
)
public class SyncCommand extends AbstractCommand {

   private static final Logger LOG = Logger.create();

   final SyncCommandConfig cfgCLI = new SyncCommandConfig();
   private @Nullable SyncCommandConfig cfgYamlDefaults;
   private @Nullable List<SyncCommandConfig> cfgYamlSyncTasks;

   private final List<SyncResult> results = Collections.synchronizedList(new ArrayList<>());
   private volatile @Nullable SyncManager activeManager;
   private long startAt;

   /**
    * Merges command line, YAML task and YAML default settings, in that order of precedence.
    */
   List<SyncCommandConfig> resolveTasks() {
      final var cfgYamlSyncTasks = this.cfgYamlSyncTasks;

      // if SOURCE is set, TARGET must be set too
      if (cfgCLI.source != null && cfgCLI.target == null)
         throw new ParameterException(commandSpec.commandLine(), "Missing required parameter: 'TARGET'");

      // if no tasks are configured in YAML, SOURCE/TARGET must be set
      if (cfgCLI.source == null && cfgYamlSyncTasks == null)
         throw new ParameterException(commandSpec.commandLine(), "Missing required parameters: 'SOURCE', 'TARGET'");

      final var taskCfgs = new ArrayList<SyncCommandConfig>();
      if (cfgYamlSyncTasks == null) {
         cfgCLI.applyFrom(cfgYamlDefaults, false);
         cfgCLI.applyDefaults();
         cfgCLI.compute();
         taskCfgs.add(cfgCLI);
      } else {
         for (final var cfgYamlTask : cfgYamlSyncTasks) {
            cfgYamlTask.applyFrom(cfgCLI, true);
            cfgYamlTask.applyFrom(cfgYamlDefaults, false);
            cfgYamlTask.applyDefaults();
            cfgYamlTask.compute();
            taskCfgs.add(cfgYamlTask);
         }
      }
      return taskCfgs;
   }

   @Override
   protected int execute() throws Exception {
      final var taskCfgs = resolveTasks();

      for (final var taskCfg : taskCfgs) {
         if (Files.exists(taskCfg.targetRootAbsolute) && Files.isSameFile(taskCfg.sourceRootAbsolute, taskCfg.targetRootAbsolute))
            throw new ParameterException(commandSpec.commandLine(), "Source and target path point to the same filesystem entry ["
                  + taskCfg.sourceRootAbsolute.toRealPath() + "]!");
      }

      startAt = System.currentTimeMillis();
      for (final var taskCfg : taskCfgs) {
         final var config = taskCfg.toSyncConfiguration(getVerbosity() > 0);

         JdkLoggingUtils.withRootLogLevel(Level.INFO, () -> {
            LOG.info("Executing sync task with effective config:\n%s", YamlUtils.toYamlString(taskCfg));
         });

         final var manager = activeManager = new SyncManager(config);
         manager.synchronize();
         results.addAll(manager.getResults());
         activeManager = null;
      }

      final var summary = logSummary(taskCfgs.stream().anyMatch(cfg -> Boolean.TRUE.equals(cfg.dryRun)));
      return summary.hasFailures() ? 1 : 0;
   }

   private SyncSummary logSummary(final boolean isDryRun) {
      final var allResults = new ArrayList<>(results);
      final var manager = activeManager;
      if (manager != null) {
         allResults.addAll(manager.getResults());
      }
      final var summary = SyncSummary.of(allResults, startAt == 0 ? 0 : System.currentTimeMillis() - startAt);
      JdkLoggingUtils.withRootLogLevel(Level.INFO, () -> summary.log(isDryRun));
      return summary;
   }

   @Override
   protected void onSigInt() {
      logSummary(false);
   }

   @Override
   protected void onSigTerm() {
      logSummary(false);
   }

   @SuppressWarnings("unchecked")
   @Option(names = "--config", paramLabel = "<path>", description = "Path to a YAML config file.")
   private void setConfig(final String configPath) throws IOException {
      LOG.info("Loading config [%s]...", configPath);
      try (var in = Files.newBufferedReader(Path.of(configPath))) {
         final Map<String, Object> yamlCfg = YamlUtils.parseYaml(in);

         // process defaults
         final var yamlDefaults = (Map<String, Object>) yamlCfg.remove("defaults");
         if (yamlDefaults != null) {
            final var cfgYamlDefaults = this.cfgYamlDefaults = new SyncCommandConfig();
            final var unusedParams = cfgYamlDefaults.applyFrom(yamlDefaults, true);
            if (!unusedParams.isEmpty()) {
               yamlCfg.put("defaults", unusedParams);
            }
         }

         // process sync tasks
         final var yamlSyncTasks = (List<Map<String, Object>>) yamlCfg.remove("sync");
         if (yamlSyncTasks != null && !yamlSyncTasks.isEmpty()) {
            final var cfgYamlSyncTasks = this.cfgYamlSyncTasks = new ArrayList<>();

            for (final var yamlSyncTask : yamlSyncTasks) {
               final var taskCfg = new SyncCommandConfig();
               final var unusedParams = taskCfg.applyFrom(yamlSyncTask, true);

               if (!unusedParams.isEmpty()) {
                  ((List<Map<String, Object>>) yamlCfg.computeIfAbsent("sync", k -> new ArrayList<>())).add(unusedParams);
               }
               cfgYamlSyncTasks.add(taskCfg);
            }
         }

         if (!yamlCfg.isEmpty())
            throw new IllegalArgumentException("The following settings found in the config file are unknown:\n" + YamlUtils.toYamlString(
               yamlCfg));
      }
   }

   @Option(names = "--backup-dir", paramLabel = "<path>", description = "Directory for backups of overwritten or deleted files. "
         + "Default: a hidden .sync_backups directory beside each modified file.")
   private void setBackupDir(final String backupDir) {
      try {
         cfgCLI.backupDir = Path.of(backupDir);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Backup path: " + ex.getMessage());
      }
   }

   @Option(names = "--conflict-strategy", paramLabel = "<strategy>", //
      description = "How differing structured config documents are reconciled: source-wins, target-wins, merge, manual or skip. Default: merge.")
   private void setConflictStrategy(final String conflictStrategy) {
      try {
         cfgCLI.conflictStrategy = ConflictStrategy.of(conflictStrategy);
      } catch (final IllegalArgumentException ex) {
         throw new ParameterException(commandSpec.commandLine(), ex.getMessage());
      }
   }

   @Option(names = "--direction", paramLabel = "<direction>", //
      description = "Recorded sync direction: source-to-target, target-to-source or bidirectional. Default: bidirectional.")
   private void setDirection(final String direction) {
      try {
         cfgCLI.direction = SyncDirection.of(direction);
      } catch (final IllegalArgumentException ex) {
         throw new ParameterException(commandSpec.commandLine(), ex.getMessage());
      }
   }

   @Option(names = "--dry-run", description = "Don't perform actual synchronization.")
   private void setDryRun(final boolean dryRun) {
      cfgCLI.dryRun = dryRun;
   }

   @Option(names = "--exclude", paramLabel = "<regex>", description = "Regular expression for paths to exclude, added to the default excludes.")
   private void setExcludes(final List<String> excludes) {
      cfgCLI.excludes = excludes;
   }

   @Option(names = "--include-hidden", description = "Synchronize hidden files and directories.")
   private void setIncludeHidden(final boolean includeHidden) {
      cfgCLI.includeHidden = includeHidden;
   }

   @Option(names = "--max-workers", paramLabel = "<count>", description = "Number of concurrent file synchronization workers. Default: 8.")
   private void setMaxWorkers(final int maxWorkers) {
      if (maxWorkers < 1)
         throw new ParameterException(commandSpec.commandLine(), "--max-workers must be >= 1");
      cfgCLI.maxWorkers = maxWorkers;
   }

   @Option(names = "--no-backup", description = "Don't back up files before overwriting or deleting them.")
   private void setNoBackup(final boolean noBackup) {
      cfgCLI.backupEnabled = !noBackup;
   }

   @Option(names = "--no-default-excludes", description = "Don't apply the built-in exclude patterns (.git, __pycache__, .venv, ...).")
   private void setNoDefaultExcludes(final boolean noDefaultExcludes) {
      cfgCLI.defaultExcludes = !noDefaultExcludes;
   }

   @Parameters(index = "0", arity = "0..1", paramLabel = "SOURCE", description = "File or directory to synchronize from.")
   private void setSourceRoot(final String source) {
      try {
         cfgCLI.source = Path.of(source);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Source path: " + ex.getMessage());
      }
   }

   @Parameters(index = "1", arity = "0..1", paramLabel = "TARGET", description = "File or directory to synchronize to.")
   private void setTargetRoot(final String target) {
      try {
         cfgCLI.target = Path.of(target);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Target path: " + ex.getMessage());
      }
   }
}
