/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.io.FilenameUtils;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Decides which paths a run ignores. Excluded paths are neither compared nor synchronized.
 * <p>
 * A path is excluded if
 * <ul>
 * <li>any exclude pattern is found in its string form (with {@code /} separators),
 * <li>hidden files are not included and its name starts with a dot, or
 * <li>it is a backup directory.
 * </ul>
 */
public final class ExclusionFilter {

   public static final String HIDDEN_FILE_PREFIX = ".";

   private final List<Pattern> patterns;
   private final boolean includeHidden;
   private final @Nullable Path backupDirectory;

   public ExclusionFilter(final SyncConfiguration config) {
      this(config.excludePatterns(), config.includeHidden(), config.backupDirectory());
   }

   public ExclusionFilter(final List<String> excludePatterns, final boolean includeHidden, final @Nullable Path backupDirectory) {
      patterns = excludePatterns.stream().map(Pattern::compile).toList();
      this.includeHidden = includeHidden;
      this.backupDirectory = backupDirectory == null ? null : backupDirectory.toAbsolutePath().normalize();
   }

   public boolean isExcluded(final Path path) {
      final var fileName = path.getFileName();
      if (fileName != null) {
         final var name = fileName.toString();
         if (Backups.DEFAULT_DIR_NAME.equals(name))
            return true;
         if (!includeHidden && name.startsWith(HIDDEN_FILE_PREFIX))
            return true;
      }

      final var backupDirectory = this.backupDirectory;
      if (backupDirectory != null && path.toAbsolutePath().normalize().startsWith(backupDirectory))
         return true;

      final var pathStr = FilenameUtils.separatorsToUnix(path.toString());
      for (final var pattern : patterns) {
         if (pattern.matcher(pathStr).find())
            return true;
      }
      return false;
   }
}
