/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Outcome of one {@link SyncItem#synchronize()} invocation.
 *
 * @param itemPath source path of the sync item
 * @param error the underlying exception of a failed synchronization
 */
public record SyncResult( //
   boolean success, //
   String itemPath, //
   SyncItemKind itemKind, //
   SyncDirection direction, //
   String message, //
   @Nullable Throwable error, //
   boolean changesMade, //
   int conflictsResolved, //
   long bytesTransferred //
) {

   public static SyncResult unchanged(final SyncItem item, final String message) {
      return succeeded(item, message, false, 0, 0);
   }

   public static SyncResult succeeded(final SyncItem item, final String message, final boolean changesMade, final int conflictsResolved,
         final long bytesTransferred) {
      return new SyncResult(true, item.sourcePath().toString(), item.kind(), item.context().configuration().direction(), message, null,
         changesMade, conflictsResolved, bytesTransferred);
   }

   public static SyncResult failed(final SyncItem item, final String message, final @Nullable Throwable error) {
      return new SyncResult(false, item.sourcePath().toString(), item.kind(), item.context().configuration().direction(), message, error,
         false, 0, 0);
   }

   public SyncResult {
      if (conflictsResolved < 0)
         throw new IllegalArgumentException("conflictsResolved must be >= 0 but was " + conflictsResolved);
      if (bytesTransferred < 0)
         throw new IllegalArgumentException("bytesTransferred must be >= 0 but was " + bytesTransferred);
   }
}
