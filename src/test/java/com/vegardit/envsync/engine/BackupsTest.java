/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackupsTest {

   private static final Clock CLOCK = Clock.fixed(LocalDateTime.of(2024, 3, 1, 14, 5, 9).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

   @TempDir
   Path tempDir = lateNonNull();

   @Test
   void testBackupBesideFile() throws IOException {
      final var file = Files.writeString(tempDir.resolve("config.json"), "{}");
      final var backup = new Backups(null, CLOCK).backup(file);

      assertThat(backup).isEqualTo(tempDir.resolve(Backups.DEFAULT_DIR_NAME).resolve("config.json.20240301140509.bak"));
      assertThat(backup).hasContent("{}");
      assertThat(file).exists();
   }

   @Test
   void testBackupIntoConfiguredDirectory() throws IOException {
      final var backupDir = tempDir.resolve("backups");
      final var file = Files.writeString(tempDir.resolve("notes.txt"), "notes");
      final var backups = new Backups(backupDir, CLOCK);

      assertThat(backups.getBackupDirectoryFor(file)).isEqualTo(backupDir);
      assertThat(backups.backup(file)).isEqualTo(backupDir.resolve("notes.txt.20240301140509.bak"));
   }

   @Test
   void testNameCollisionsGetASuffix() throws IOException {
      final var file = Files.writeString(tempDir.resolve("a.txt"), "v1");
      final var backups = new Backups(null, CLOCK);

      final var first = backups.backup(file);
      Files.writeString(file, "v2");
      final var second = backups.backup(file);
      Files.writeString(file, "v3");
      final var third = backups.backup(file);

      assertThat(first.getFileName()).hasToString("a.txt.20240301140509.bak");
      assertThat(second.getFileName()).hasToString("a.txt.20240301140509-1.bak");
      assertThat(third.getFileName()).hasToString("a.txt.20240301140509-2.bak");
      assertThat(first).hasContent("v1");
      assertThat(second).hasContent("v2");
      assertThat(third).hasContent("v3");
   }

   @Test
   void testFailedCopyLeavesNoBackupFile() throws IOException {
      final var backups = new Backups(null, CLOCK);
      final var missing = tempDir.resolve("missing.txt");

      assertThatThrownBy(() -> backups.backup(missing)).isInstanceOf(IOException.class);

      final var backupDir = backups.getBackupDirectoryFor(missing);
      if (Files.isDirectory(backupDir)) {
         try (var entries = Files.list(backupDir)) {
            assertThat(entries).isEmpty();
         }
      }
   }
}
