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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SyncManagerTest {

   @TempDir
   Path tempDir = lateNonNull();

   @Nested
   @DisplayName("Classification")
   class ClassifyTests {

      @Test
      void testRepository() throws IOException {
         final var repo = Files.createDirectories(tempDir.resolve("repo/.git"));
         assertThat(SyncManager.classify(repo.getParent())).isEqualTo(SyncItemKind.REPOSITORY);
      }

      @Test
      void testDirectory() throws IOException {
         final var dir = Files.createDirectories(tempDir.resolve("dir"));
         assertThat(SyncManager.classify(dir)).isEqualTo(SyncItemKind.DIRECTORY);
      }

      @Test
      void testStructuredConfig() throws IOException {
         assertThat(SyncManager.classify(Files.writeString(tempDir.resolve("a.json"), "{}"))).isEqualTo(SyncItemKind.STRUCTURED_CONFIG);
         assertThat(SyncManager.classify(Files.writeString(tempDir.resolve("b.yaml"), "a: 1"))).isEqualTo(SyncItemKind.STRUCTURED_CONFIG);
         assertThat(SyncManager.classify(Files.writeString(tempDir.resolve("c.YML"), "a: 1"))).isEqualTo(SyncItemKind.STRUCTURED_CONFIG);
      }

      @Test
      void testFile() throws IOException {
         assertThat(SyncManager.classify(Files.writeString(tempDir.resolve("a.txt"), "x"))).isEqualTo(SyncItemKind.FILE);
         assertThat(SyncManager.classify(tempDir.resolve("missing.json"))).isEqualTo(SyncItemKind.FILE);
      }

      @Test
      void testCreateItem() throws IOException {
         final var manager = new SyncManager(SyncConfiguration.builder(tempDir, tempDir.resolve("out")).build());
         final var dir = Files.createDirectories(tempDir.resolve("dir"));
         final var item = manager.createItem(dir, tempDir.resolve("out"));
         assertThat(item).isInstanceOf(DirectorySyncItem.class);
         assertThat(item.context()).isSameAs(manager.getContext());
         assertThat(manager.createItem(tempDir.resolve("a.txt"), tempDir.resolve("b.txt"))).isInstanceOf(FileSyncItem.class);
      }
   }

   @Test
   @DisplayName("The result log contains the results of the directory and of its files")
   void testResultLog() throws IOException {
      final var source = Files.createDirectories(tempDir.resolve("src"));
      Files.writeString(source.resolve("a.txt"), "a");
      Files.writeString(source.resolve("b.json"), "{\"b\": true}");

      final var manager = new SyncManager(SyncConfiguration.builder(source, tempDir.resolve("dst")).build());
      final var result = manager.synchronize();

      assertThat(result.success()).isTrue();
      assertThat(result.itemKind()).isEqualTo(SyncItemKind.DIRECTORY);
      assertThat(manager.getResults()).hasSize(3).last().isEqualTo(result);
      assertThat(manager.hasFailures()).isFalse();
      assertThat(tempDir.resolve("dst/b.json")).hasContent("{\"b\": true}");
   }

   @Test
   void testFailuresAreRecorded() throws IOException {
      final var source = Files.writeString(tempDir.resolve("a.json"), "{\"a\": 1}");
      final var target = Files.writeString(tempDir.resolve("b.json"), "{not json");

      final var manager = new SyncManager(SyncConfiguration.builder(source, target).conflictStrategy(ConflictStrategy.MERGE).build());
      final var result = manager.synchronize();
      assertThat(result.success()).isFalse();
      assertThat(manager.hasFailures()).isTrue();
      assertThat(manager.getResults()).containsExactly(result);
      assertThat(target).hasContent("{not json");
   }

   @Test
   void testSyncPath() throws IOException {
      final var manager = new SyncManager(SyncConfiguration.builder(tempDir.resolve("unused"), tempDir.resolve("unused2")).build());
      final var source = Files.writeString(tempDir.resolve("notes.txt"), "notes");
      final var result = manager.syncPath(source, tempDir.resolve("copy/notes.txt"));
      assertThat(result.success()).isTrue();
      assertThat(result.bytesTransferred()).isEqualTo(5);
      assertThat(tempDir.resolve("copy/notes.txt")).hasContent("notes");
   }

   @Test
   @DisplayName("A second run over an unchanged tree makes no changes")
   void testIdempotence() throws IOException {
      final var source = Files.createDirectories(tempDir.resolve("src"));
      Files.writeString(source.resolve("a.txt"), "a");
      Files.writeString(Files.createDirectories(source.resolve("sub")).resolve("b.yaml"), "b: true\n");
      final var target = tempDir.resolve("dst");

      final var first = new SyncManager(SyncConfiguration.builder(source, target).build());
      assertThat(first.synchronize().changesMade()).isTrue();
      assertThat(first.getResults()).hasSize(3).allMatch(SyncResult::success);
      assertThat(target.resolve("a.txt")).hasContent("a");
      assertThat(target.resolve("sub/b.yaml")).hasContent("b: true\n");

      final var second = new SyncManager(SyncConfiguration.builder(source, target).build());
      final var result = second.synchronize();
      assertThat(result.success()).isTrue();
      assertThat(second.getResults()).allMatch(SyncResult::success).noneMatch(SyncResult::changesMade);
      assertThat(second.hasFailures()).isFalse();
   }
}
