/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.nio.file.Path;

/**
 * One unit of reconciliation work over a (source, target) pair of a given kind.
 * <p>
 * Implementations are immutable and never modify {@link #sourcePath()}. A new item is created for every comparison.
 */
public sealed interface SyncItem permits FileSyncItem, DirectorySyncItem, StructuredConfigSyncItem, RepositorySyncItem {

   SyncItemKind kind();

   Path sourcePath();

   Path targetPath();

   SyncContext context();

   /**
    * Never throws. If the state of source or target cannot be determined, synchronization is considered necessary.
    */
   boolean needsSync();

   /**
    * Never throws. Failures are reported by a {@link SyncResult} with {@code success=false}.
    */
   SyncResult synchronize();

   default boolean isExcluded() {
      return context().exclusions().isExcluded(sourcePath());
   }
}
