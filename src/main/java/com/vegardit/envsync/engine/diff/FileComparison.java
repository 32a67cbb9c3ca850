/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import net.sf.jstuff.core.logging.Logger;
import net.sf.jstuff.core.security.Hash;

/**
 * Content equality of two regular files.
 * <p>
 * Files of equal size whose modification times are less than {@link #MTIME_TOLERANCE} apart are considered equal
 * without reading them. This is an approximation: a same-size edit within that window goes unnoticed.
 */
public final class FileComparison {

   private static final Logger LOG = Logger.create();

   public static final Duration MTIME_TOLERANCE = Duration.ofSeconds(2);

   /**
    * Number of leading bytes inspected to tell text from binary content.
    */
   public static final int PROBE_SIZE = 1024;

   /**
    * File extensions that are always treated as binary.
    */
   public static final Set<String> BINARY_EXTENSIONS = Set.of( //
      ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".ico", ".pdf", //
      ".zip", ".tar", ".gz", ".bz2", ".xz", ".7z", ".rar", //
      ".exe", ".dll", ".so", ".dylib", ".jar", ".war", ".ear", ".class", //
      ".pyc", ".pyo", ".pyd", ".obj", ".o");

   public static boolean filesEqual(final Path source, final Path target) throws IOException {
      final var sourceAttrs = Files.readAttributes(source, BasicFileAttributes.class);
      final var targetAttrs = Files.readAttributes(target, BasicFileAttributes.class);

      if (sourceAttrs.size() != targetAttrs.size())
         return false;

      final long mtimeDelta = Math.abs(sourceAttrs.lastModifiedTime().toMillis() - targetAttrs.lastModifiedTime().toMillis());
      if (mtimeDelta < MTIME_TOLERANCE.toMillis()) {
         LOG.trace("[%s] considered unchanged, same size and modification time within tolerance.", source);
         return true;
      }

      if (isBinary(source) || isBinary(target))
         return hashesEqual(source, target);
      return linesEqual(source, target);
   }

   /**
    * @return true if the file has a well-known binary extension or its first {@link #PROBE_SIZE} bytes contain a NUL
    *         byte or are not decodable as UTF-8
    */
   public static boolean isBinary(final Path file) throws IOException {
      final var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
      final int dot = name.lastIndexOf('.');
      if (dot > -1 && BINARY_EXTENSIONS.contains(name.substring(dot)))
         return true;

      final byte[] probe;
      try (InputStream in = Files.newInputStream(file)) {
         probe = in.readNBytes(PROBE_SIZE);
      }
      for (final byte b : probe) {
         if (b == 0)
            return true;
      }

      final var decoder = StandardCharsets.UTF_8.newDecoder() //
         .onMalformedInput(CodingErrorAction.REPORT) //
         .onUnmappableCharacter(CodingErrorAction.REPORT);
      // endOfInput=false: a multi-byte sequence cut off by the probe boundary is not an error
      final var result = decoder.decode(ByteBuffer.wrap(probe), CharBuffer.allocate(probe.length), false);
      return result.isError();
   }

   static boolean hashesEqual(final Path source, final Path target) throws IOException {
      return Objects.equals(Hash.MD5.hash(source), Hash.MD5.hash(target));
   }

   /**
    * @return false if any line differs or one file has more lines than the other
    */
   static boolean linesEqual(final Path source, final Path target) throws IOException {
      try (var sourceReader = new BufferedReader(new InputStreamReader(Files.newInputStream(source), StandardCharsets.UTF_8));
           var targetReader = new BufferedReader(new InputStreamReader(Files.newInputStream(target), StandardCharsets.UTF_8))) {
         while (true) {
            final var sourceLine = sourceReader.readLine();
            final var targetLine = targetReader.readLine();
            if (sourceLine == null || targetLine == null)
               return sourceLine == null && targetLine == null;
            if (!sourceLine.equals(targetLine))
               return false;
         }
      }
   }

   private FileComparison() {
   }
}
