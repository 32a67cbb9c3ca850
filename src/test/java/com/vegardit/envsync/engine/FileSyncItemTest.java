/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSyncItemTest {

   @TempDir
   Path tempDir = lateNonNull();

   final List<SyncResult> resultLog = new ArrayList<>();

   private FileSyncItem item(final Path source, final Path target, final SyncConfiguration.Builder config) {
      return new FileSyncItem(source, target, SyncContext.of(config.build(), resultLog::add));
   }

   private SyncConfiguration.Builder config() {
      return SyncConfiguration.builder(tempDir.resolve("src"), tempDir.resolve("dst"));
   }

   @Test
   void testCreatesMissingTarget() throws IOException {
      final var source = Files.writeString(Files.createDirectories(tempDir.resolve("src")).resolve("a.txt"), "hello");
      final var target = tempDir.resolve("dst/sub/a.txt");

      final var item = item(source, target, config());
      assertThat(item.kind()).isEqualTo(SyncItemKind.FILE);
      assertThat(item.needsSync()).isTrue();

      final var result = item.synchronize();
      assertThat(result.success()).isTrue();
      assertThat(result.changesMade()).isTrue();
      assertThat(result.bytesTransferred()).isEqualTo(5);
      assertThat(result.itemKind()).isEqualTo(SyncItemKind.FILE);
      assertThat(result.itemPath()).isEqualTo(source.toString());
      assertThat(result.direction()).isEqualTo(SyncDirection.BIDIRECTIONAL);
      assertThat(target).hasContent("hello");

      assertThat(item.needsSync()).isFalse();
      final var second = item.synchronize();
      assertThat(second.success()).isTrue();
      assertThat(second.changesMade()).isFalse();
      assertThat(second.bytesTransferred()).isZero();
   }

   @Test
   @DisplayName("An overwritten target is backed up first")
   void testUpdateWithBackup() throws IOException {
      final var source = Files.writeString(tempDir.resolve("a.txt"), "new content");
      final var target = Files.writeString(tempDir.resolve("b.txt"), "old");

      final var result = item(source, target, config()).synchronize();
      assertThat(result.success()).isTrue();
      assertThat(result.message()).isEqualTo("Updated");
      assertThat(target).hasContent("new content");

      final var backupDir = tempDir.resolve(Backups.DEFAULT_DIR_NAME);
      try (var backups = Files.list(backupDir)) {
         final var files = backups.toList();
         assertThat(files).hasSize(1);
         assertThat(files.get(0).getFileName().toString()).matches("b\\.txt\\.\\d{14}\\.bak");
         assertThat(files.get(0)).hasContent("old");
      }
   }

   @Test
   void testUpdateWithoutBackup() throws IOException {
      final var source = Files.writeString(tempDir.resolve("a.txt"), "new content");
      final var target = Files.writeString(tempDir.resolve("b.txt"), "old");

      assertThat(item(source, target, config().backupEnabled(false)).synchronize().changesMade()).isTrue();
      assertThat(tempDir.resolve(Backups.DEFAULT_DIR_NAME)).doesNotExist();
   }

   @Test
   @DisplayName("A dry run reports but never modifies the target")
   void testDryRun() throws IOException {
      final var source = Files.writeString(tempDir.resolve("a.txt"), "new content");
      final var target = Files.writeString(tempDir.resolve("b.txt"), "old");
      final var missingTarget = tempDir.resolve("c.txt");

      final var result = item(source, target, config().dryRun(true)).synchronize();
      assertThat(result.success()).isTrue();
      assertThat(result.changesMade()).isFalse();
      assertThat(result.message()).isEqualTo("Would synchronize");
      assertThat(target).hasContent("old");

      assertThat(item(source, missingTarget, config().dryRun(true)).synchronize().changesMade()).isFalse();
      assertThat(missingTarget).doesNotExist();
      assertThat(tempDir.resolve(Backups.DEFAULT_DIR_NAME)).doesNotExist();
   }

   @Test
   void testMissingSourceIsNoOp() throws IOException {
      final var target = Files.writeString(tempDir.resolve("b.txt"), "keep");
      final var item = item(tempDir.resolve("missing.txt"), target, config());

      assertThat(item.needsSync()).isFalse();
      final var result = item.synchronize();
      assertThat(result.success()).isTrue();
      assertThat(result.changesMade()).isFalse();
      assertThat(target).hasContent("keep");
   }

   @Test
   void testExcludedSourceIsSkipped() throws IOException {
      final var source = Files.writeString(tempDir.resolve("module.pyc"), "bytecode");
      final var target = tempDir.resolve("copy.pyc");
      final var item = item(source, target, config());

      assertThat(item.isExcluded()).isTrue();
      assertThat(item.needsSync()).isFalse();
      assertThat(item.synchronize().message()).isEqualTo("Excluded");
      assertThat(target).doesNotExist();
   }

   @Test
   @DisplayName("File items always copy, whatever the conflict strategy")
   void testConflictStrategyIsIgnored() throws IOException {
      final var source = Files.writeString(tempDir.resolve("a.txt"), "new content");
      final var target = Files.writeString(tempDir.resolve("b.txt"), "old");

      assertThat(item(source, target, config().conflictStrategy(ConflictStrategy.TARGET_WINS)).synchronize().changesMade()).isTrue();
      assertThat(target).hasContent("new content");
   }
}
