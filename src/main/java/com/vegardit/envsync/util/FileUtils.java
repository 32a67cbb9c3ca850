/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.util;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFileAttributes;

import org.apache.commons.lang3.CharUtils;
import org.eclipse.jdt.annotation.NonNull;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.SystemUtils;
import net.sf.jstuff.core.io.MoreFiles;
import net.sf.jstuff.core.logging.Logger;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FileUtils {
   private static final Logger LOG = Logger.create();

   static final @NonNull LinkOption[] NOFOLLOW_LINKS = {LinkOption.NOFOLLOW_LINKS};

   private static final OpenOption[] FILE_READ_OPTIONS = {StandardOpenOption.READ};

   private static final OpenOption[] FILE_WRITE_OPTIONS = { //
      StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE};

   /**
    * Copies the file content and the essential metadata (timestamps and, where supported, POSIX permissions).
    * Missing parent directories of the target are created.
    *
    * @return number of bytes written
    */
   public static long copyFile(final Path source, final Path target) throws IOException {
      final var sourceAttrs = MoreFiles.readAttributes(source);

      final var parent = target.getParent();
      if (parent != null) {
         Files.createDirectories(parent);
      }

      // copyContent closes both channels when done
      try (var sourceCh = FileChannel.open(source, FILE_READ_OPTIONS);
           var targetCh = FileChannel.open(target, FILE_WRITE_OPTIONS)) {
         MoreFiles.copyContent(sourceCh, targetCh, (bytes, totalBytes) -> LOG.trace("Copied %s/%s bytes to [%s]", bytes, totalBytes, target));
      }
      copyAttributes(source, sourceAttrs, target);
      return Files.size(target);
   }

   @SuppressWarnings("resource")
   private static void copyAttributes(final Path source, final BasicFileAttributes sourceAttrs, final Path target) {
      final var targetFSP = target.getFileSystem().provider();

      if (supportsPosixAttributes(source) && supportsPosixAttributes(target)) {
         final var targetPosixAttrs = targetFSP.getFileAttributeView(target, PosixFileAttributeView.class, NOFOLLOW_LINKS);
         if (targetPosixAttrs != null) {
            try {
               final var sourcePosixAttrs = sourceAttrs instanceof final PosixFileAttributes posixAttrs //
                     ? posixAttrs
                     : Files.readAttributes(source, PosixFileAttributes.class, NOFOLLOW_LINKS);
               targetPosixAttrs.setPermissions(sourcePosixAttrs.permissions());
            } catch (final IOException | UnsupportedOperationException ex) {
               LOG.debug("Failed to copy POSIX permissions for [%s] (best-effort)...", target);
               LOG.debug(ex);
            }
         }
      }

      final var targetBasicAttrs = targetFSP.getFileAttributeView(target, BasicFileAttributeView.class, NOFOLLOW_LINKS);
      if (targetBasicAttrs != null) {
         try {
            targetBasicAttrs.setTimes(sourceAttrs.lastModifiedTime(), sourceAttrs.lastAccessTime(), sourceAttrs.creationTime());
         } catch (final IOException ex) {
            LOG.debug("Failed to copy time attributes for [%s] (best-effort)...", target);
            LOG.debug(ex);
         }
      }
   }

   @SuppressWarnings("resource")
   public static boolean supportsPosixAttributes(final Path path) {
      return path.getFileSystem().supportedFileAttributeViews().contains("posix");
   }

   public static Path toAbsolute(Path path) {
      path = path.toAbsolutePath().normalize();

      if (SystemUtils.IS_OS_WINDOWS) {
         // ensure drive letter is uppercase
         final var pathStr = path.toString();
         if (!CharUtils.isAsciiAlphaUpper(pathStr.charAt(0)))
            return Path.of(Strings.capitalize(pathStr));
      }
      return path;
   }

   private FileUtils() {
   }
}
