/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StructuredFormatTest {

   @TempDir
   Path tempDir = lateNonNull();

   @Test
   void testForPath() {
      assertThat(StructuredFormat.forPath(Path.of("settings.json"))).isEqualTo(StructuredFormat.JSON);
      assertThat(StructuredFormat.forPath(Path.of("dir", "CONFIG.YML"))).isEqualTo(StructuredFormat.YAML);
      assertThat(StructuredFormat.forPath(Path.of("compose.yaml"))).isEqualTo(StructuredFormat.YAML);
      assertThat(StructuredFormat.forPath(Path.of("notes.txt"))).isNull();
      assertThat(StructuredFormat.forPath(Path.of(".json"))).isNull();
   }

   @Nested
   @DisplayName("JSON")
   class JsonTests {

      @Test
      @DisplayName("Comments and trailing commas are tolerated")
      void testLenientParsing() throws IOException {
         final var file = Files.writeString(tempDir.resolve("settings.json"), """
            {
              // editor settings
              "editor.tabSize": 2,
              /* list */
              "files.exclude": ["a", "b",],
            }
            """);
         final var doc = StructuredFormat.JSON.read(file);
         assertThat(doc).isEqualTo(Map.of("editor.tabSize", 2, "files.exclude", List.of("a", "b")));
      }

      @Test
      void testMalformedDocument() throws IOException {
         final var file = Files.writeString(tempDir.resolve("broken.json"), "{\"a\": ");
         assertThatThrownBy(() -> StructuredFormat.JSON.read(file)) //
            .isInstanceOf(MalformedDocumentException.class) //
            .hasMessageContaining("broken.json");
      }

      @Test
      void testTrailingContentIsRejected() throws IOException {
         final var file = Files.writeString(tempDir.resolve("twice.json"), "{} {}");
         assertThatThrownBy(() -> StructuredFormat.JSON.read(file)).isInstanceOf(MalformedDocumentException.class);
      }

      @Test
      @DisplayName("Documents are written pretty printed with two space indentation")
      void testWrite() throws IOException {
         final var file = tempDir.resolve("out/settings.json");
         final var bytes = StructuredFormat.JSON.write(file, Map.of("a", List.of(1)));
         assertThat(file).hasContent("""
            {
              "a": [
                1
              ]
            }
            """);
         assertThat(bytes).isEqualTo(Files.size(file));
      }
   }

   @Nested
   @DisplayName("YAML")
   class YamlTests {

      @Test
      void testReadAndWrite() throws IOException {
         final var file = Files.writeString(tempDir.resolve("config.yaml"), """
            server:
              port: 8080
              hosts: [a, b]
            released: 2024-01-01
            """);
         final var doc = StructuredFormat.YAML.read(file);
         assertThat(doc).isEqualTo(Map.of("server", Map.of("port", 8080, "hosts", List.of("a", "b")), "released", "2024-01-01"));

         final var copy = tempDir.resolve("copy.yml");
         StructuredFormat.YAML.write(copy, doc);
         assertThat(StructuredComparison.documentsEqual(StructuredFormat.YAML.read(copy), doc)).isTrue();
      }

      @Test
      void testMalformedDocument() throws IOException {
         final var file = Files.writeString(tempDir.resolve("broken.yaml"), "a: [1, 2\nb: 3\n");
         assertThatThrownBy(() -> StructuredFormat.YAML.read(file)).isInstanceOf(MalformedDocumentException.class);
      }

      @Test
      void testEmptyDocument() throws IOException {
         final var file = Files.writeString(tempDir.resolve("empty.yaml"), "");
         assertThat(StructuredFormat.YAML.read(file)).isNull();
      }
   }
}
