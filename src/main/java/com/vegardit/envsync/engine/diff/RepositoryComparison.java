/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import java.nio.file.Path;

import com.vegardit.envsync.vcs.Git;

import net.sf.jstuff.core.logging.Logger;

/**
 * Compares the checked out revisions of two git working trees.
 */
public final class RepositoryComparison {

   private static final Logger LOG = Logger.create();

   /**
    * @return true only if both HEADs resolve to the same commit, false if either cannot be resolved
    */
   public static boolean headsEqual(final Git git, final Path source, final Path target) {
      final var sourceHead = git.revParse(source, "HEAD");
      final var targetHead = git.revParse(target, "HEAD");
      LOG.trace("HEAD of [%s] is [%s], HEAD of [%s] is [%s]", source, sourceHead, target, targetHead);
      return sourceHead != null && sourceHead.equals(targetHead);
   }

   private RepositoryComparison() {
   }
}
