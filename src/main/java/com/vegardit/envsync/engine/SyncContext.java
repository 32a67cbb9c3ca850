/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.util.function.Consumer;

import com.vegardit.envsync.vcs.Git;

/**
 * Collaborators shared by all sync items of one run.
 *
 * @param resultLog receives the results of child items executed by a {@link DirectorySyncItem}
 */
public record SyncContext( //
   SyncConfiguration configuration, //
   ExclusionFilter exclusions, //
   Backups backups, //
   Git git, //
   Consumer<SyncResult> resultLog //
) {

   public static SyncContext of(final SyncConfiguration configuration, final Consumer<SyncResult> resultLog) {
      return new SyncContext(configuration, new ExclusionFilter(configuration), new Backups(configuration.backupDirectory()), new Git(),
         resultLog);
   }
}
