/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.time.DurationFormatUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Aggregated figures of a list of {@link SyncResult}s.
 */
public record SyncSummary( //
   int items, //
   int succeeded, //
   int failed, //
   int changed, //
   int conflictsResolved, //
   long bytesTransferred, //
   long durationMillis, //
   List<SyncResult> failures //
) {

   private static final Logger LOG = Logger.create();

   public static SyncSummary of(final List<SyncResult> results, final long durationMillis) {
      var succeeded = 0;
      var changed = 0;
      var conflicts = 0;
      var bytes = 0L;
      for (final var result : results) {
         if (result.success()) {
            succeeded++;
         }
         if (result.changesMade()) {
            changed++;
         }
         conflicts += result.conflictsResolved();
         bytes += result.bytesTransferred();
      }
      final var failures = results.stream().filter(r -> !r.success()).toList();
      return new SyncSummary(results.size(), succeeded, failures.size(), changed, conflicts, bytes, durationMillis, failures);
   }

   public SyncSummary {
      failures = List.copyOf(failures);
   }

   public boolean hasFailures() {
      return failed > 0;
   }

   public void log(final boolean isDryRun) {
      if (!failures.isEmpty()) {
         LOG.warn("***************************************");
         LOG.warn("The following items failed to synchronize:");
         for (final var failure : failures) {
            LOG.error("%s [%s]: %s", failure.itemKind(), failure.itemPath(), failure.message());
         }
      }
      LOG.info("***************************************");
      if (isDryRun) {
         LOG.info("DRY RUN: no changes were made.");
      }
      LOG.info("Items processed: %s", items);
      LOG.info("Items succeeded: %s", succeeded);
      LOG.info("Items failed: %s", failed);
      LOG.info("Items changed: %s", changed);
      LOG.info("Conflicts resolved: %s", conflictsResolved);
      LOG.info("Bytes transferred: %s", FileUtils.byteCountToDisplaySize(bytesTransferred));
      LOG.info("Duration: %s", DurationFormatUtils.formatDurationWords(durationMillis, true, true));
      LOG.info("***************************************");
   }
}
