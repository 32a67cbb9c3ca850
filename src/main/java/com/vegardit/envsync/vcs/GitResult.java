/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.vcs;

import java.util.List;

/**
 * Outcome of one git invocation.
 */
public record GitResult(List<String> command, int exitCode, String stdout, String stderr) {

   public boolean isSuccess() {
      return exitCode == 0;
   }

   /**
    * @throws GitCommandException if the command exited with a non-zero status
    */
   public GitResult orThrow() throws GitCommandException {
      if (!isSuccess())
         throw new GitCommandException(this);
      return this;
   }
}
