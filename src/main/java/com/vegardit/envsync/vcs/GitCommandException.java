/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.vcs;

import java.io.IOException;

import net.sf.jstuff.core.Strings;

/**
 * Thrown when a git command exits with a non-zero status.
 */
public class GitCommandException extends IOException {

   private static final long serialVersionUID = 1L;

   private final int exitCode;
   private final String stderr;

   public GitCommandException(final GitResult result) {
      super("Command [" + String.join(" ", result.command()) + "] failed with exit code " + result.exitCode() //
            + (Strings.isBlank(result.stderr()) ? "" : ": " + Strings.trim(result.stderr())));
      exitCode = result.exitCode();
      stderr = result.stderr();
   }

   public int getExitCode() {
      return exitCode;
   }

   public String getStderr() {
      return stderr;
   }
}
