/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.eclipse.jdt.annotation.Nullable;
import org.yaml.snakeyaml.error.YAMLException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.vegardit.envsync.util.YamlUtils;

/**
 * Supported structured config document formats, selected by file extension.
 */
public enum StructuredFormat {

   /**
    * JSON, tolerating comments and trailing commas as found in editor settings files.
    */
   JSON(".json") {
      @Override
      @Nullable
      Object parse(final Reader reader) throws IOException {
         return JSON_MAPPER.readValue(reader, Object.class);
      }

      @Override
      String render(final @Nullable Object document) throws IOException {
         return JSON_MAPPER.writer(JSON_PRETTY_PRINTER).writeValueAsString(document) + "\n";
      }
   },

   YAML(".yaml", ".yml") {
      @Override
      @Nullable
      Object parse(final Reader reader) {
         return YamlUtils.loadDocument(reader);
      }

      @Override
      String render(final @Nullable Object document) {
         return YamlUtils.dumpDocument(document);
      }
   };

   static final JsonMapper JSON_MAPPER = JsonMapper.builder() //
      .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS, JsonReadFeature.ALLOW_TRAILING_COMMA) //
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS) //
      .build();

   private static final DefaultPrettyPrinter JSON_PRETTY_PRINTER = new DefaultPrettyPrinter() //
      .withObjectIndenter(new DefaultIndenter("  ", "\n")) //
      .withArrayIndenter(new DefaultIndenter("  ", "\n")) //
      .withSeparators(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));

   /**
    * @return null if the file name has no supported extension
    */
   public static @Nullable StructuredFormat forPath(final Path file) {
      final var fileName = file.getFileName();
      if (fileName == null)
         return null;
      final var name = fileName.toString().toLowerCase(Locale.ROOT);
      for (final var format : values()) {
         for (final var ext : format.extensions) {
            if (name.endsWith(ext) && name.length() > ext.length())
               return format;
         }
      }
      return null;
   }

   private final List<String> extensions;

   StructuredFormat(final String... extensions) {
      this.extensions = List.of(extensions);
   }

   public List<String> getExtensions() {
      return extensions;
   }

   abstract @Nullable Object parse(Reader reader) throws IOException;

   abstract String render(@Nullable Object document) throws IOException;

   /**
    * Parses the given UTF-8 encoded file into plain maps, lists and scalars.
    *
    * @throws MalformedDocumentException if the content is not a valid document of this format
    */
   public @Nullable Object read(final Path file) throws IOException {
      try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
         return parse(reader);
      } catch (final JsonProcessingException | YAMLException ex) {
         throw new MalformedDocumentException(file, ex);
      }
   }

   /**
    * Serializes the document and writes it to the given file, creating missing parent directories.
    *
    * @return number of bytes written
    */
   public long write(final Path file, final @Nullable Object document) throws IOException {
      final var bytes = render(document).getBytes(StandardCharsets.UTF_8);
      final var parent = file.getParent();
      if (parent != null) {
         Files.createDirectories(parent);
      }
      Files.write(file, bytes);
      return bytes.length;
   }
}
