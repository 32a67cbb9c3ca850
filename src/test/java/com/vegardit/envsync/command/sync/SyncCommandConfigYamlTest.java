/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.command.sync;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vegardit.envsync.engine.ConflictStrategy;
import com.vegardit.envsync.engine.SyncConfiguration;
import com.vegardit.envsync.engine.SyncDirection;

import picocli.CommandLine;

/**
 * Tests YAML-based config parsing for sync tasks and how it is layered with command line options.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class SyncCommandConfigYamlTest {

   @TempDir
   Path tempDir = lateNonNull();

   Path source = lateNonNull();
   Path target = lateNonNull();

   @BeforeEach
   void setUp() throws IOException {
      source = Files.createDirectories(tempDir.resolve("src"));
      target = tempDir.resolve("dst");
   }

   private Path writeConfig(final String yaml) throws IOException {
      return Files.writeString(tempDir.resolve("envsync.yaml"), yaml);
   }

   @Test
   void testApplyFromMapReturnsUnknownKeys() {
      final var map = new HashMap<String, Object>(Map.of( //
         "conflict-strategy", "skip", //
         "max-workers", 2, //
         "default-excludes", "no", //
         "threads", 4));

      final var cfg = new SyncCommandConfig();
      final var unused = cfg.applyFrom(map, true);

      assertThat(cfg.conflictStrategy).isEqualTo(ConflictStrategy.SKIP);
      assertThat(cfg.maxWorkers).isEqualTo(2);
      assertThat(cfg.defaultExcludes).isFalse();
      assertThat(unused).containsOnlyKeys("threads");
      assertThat(map).hasSize(4);
   }

   @Test
   void testApplyDefaults() {
      final var cfg = new SyncCommandConfig();
      cfg.maxWorkers = 1;
      cfg.applyDefaults();

      assertThat(cfg.maxWorkers).isEqualTo(1);
      assertThat(cfg.conflictStrategy).isEqualTo(ConflictStrategy.MERGE);
      assertThat(cfg.direction).isEqualTo(SyncDirection.BIDIRECTIONAL);
      assertThat(cfg.dryRun).isFalse();
      assertThat(cfg.backupEnabled).isTrue();
      assertThat(cfg.excludes).isEmpty();
   }

   @Test
   void testComputeValidatesPaths() {
      final var cfg = new SyncCommandConfig();
      cfg.source = tempDir.resolve("missing");
      cfg.target = target;
      assertThatThrownBy(cfg::compute).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("does not exist");

      cfg.source = source;
      cfg.target = tempDir.resolve("no/such/parent/dst");
      assertThatThrownBy(cfg::compute).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Parent directory");

      cfg.target = target;
      cfg.maxWorkers = 0;
      assertThatThrownBy(cfg::compute).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("max-workers");
   }

   @Test
   void testToSyncConfiguration() {
      final var cfg = new SyncCommandConfig();
      cfg.source = source;
      cfg.target = target;
      cfg.excludes = List.of("\\.log$");
      cfg.applyDefaults();
      cfg.compute();

      final var config = cfg.toSyncConfiguration(true);
      assertThat(config.sourceRoot()).isEqualTo(source.toAbsolutePath().normalize());
      assertThat(config.conflictStrategy()).isEqualTo(ConflictStrategy.MERGE);
      assertThat(config.verbose()).isTrue();
      assertThat(config.excludePatterns()).containsAll(SyncConfiguration.DEFAULT_EXCLUDE_PATTERNS).endsWith("\\.log$");

      cfg.defaultExcludes = false;
      assertThat(cfg.toSyncConfiguration(false).excludePatterns()).containsExactly("\\.log$");
   }

   @Nested
   @DisplayName("Config file")
   class ConfigFileTests {

      @Test
      @DisplayName("Task settings override defaults, command line options override both")
      void testLayering() throws IOException {
         final var config = writeConfig("""
            defaults:
              conflict-strategy: target-wins
              max-workers: 2
              dry-run: true
              excludes:
              - \\.log$

            sync:
            - source: %s
              target: %s
              conflict-strategy: skip
            - source: %s
              target: %s
            """.formatted(source, target, source, tempDir.resolve("dst2")));

         final var cmd = new SyncCommand();
         new CommandLine(cmd).parseArgs("--config", config.toString(), "--max-workers", "5");
         final var tasks = cmd.resolveTasks();

         assertThat(tasks).hasSize(2);
         final var first = tasks.get(0);
         assertThat(first.conflictStrategy).isEqualTo(ConflictStrategy.SKIP);
         assertThat(first.maxWorkers).isEqualTo(5);
         assertThat(first.dryRun).isTrue();
         assertThat(first.excludes).containsExactly("\\.log$");
         assertThat(first.sourceRootAbsolute).isEqualTo(source.toAbsolutePath().normalize());

         final var second = tasks.get(1);
         assertThat(second.conflictStrategy).isEqualTo(ConflictStrategy.TARGET_WINS);
         assertThat(second.maxWorkers).isEqualTo(5);
         assertThat(second.targetRootAbsolute).isEqualTo(tempDir.resolve("dst2").toAbsolutePath().normalize());
      }

      @Test
      @DisplayName("Defaults from the config file apply to SOURCE and TARGET given on the command line")
      void testDefaultsOnly() throws IOException {
         final var config = writeConfig("""
            defaults:
              direction: source-to-target
              backup: false
            """);

         final var cmd = new SyncCommand();
         new CommandLine(cmd).parseArgs("--config", config.toString(), source.toString(), target.toString());
         final var tasks = cmd.resolveTasks();

         assertThat(tasks).hasSize(1);
         assertThat(tasks.get(0).direction).isEqualTo(SyncDirection.SOURCE_TO_TARGET);
         assertThat(tasks.get(0).backupEnabled).isFalse();
         assertThat(tasks.get(0).conflictStrategy).isEqualTo(ConflictStrategy.MERGE);
      }

      @Test
      void testUnknownSettingsAreRejected() throws IOException {
         final var config = writeConfig("""
            defaults:
              delete-excluded: true
            sync:
            - source: a
              target: b
              threads: 4
            """);

         assertThat(catchThrowable(() -> new CommandLine(new SyncCommand()).parseArgs("--config", config.toString()))) //
            .isInstanceOf(CommandLine.ParameterException.class) //
            .hasMessageContaining("delete-excluded") //
            .hasMessageContaining("threads");
      }

      @Test
      void testMissingTargetIsRejected() {
         final var cmd = new SyncCommand();
         new CommandLine(cmd).parseArgs(source.toString());
         assertThatThrownBy(cmd::resolveTasks).isInstanceOf(CommandLine.ParameterException.class).hasMessageContaining("TARGET");
      }
   }
}
