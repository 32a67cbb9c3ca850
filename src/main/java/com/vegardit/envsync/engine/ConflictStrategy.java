/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Policy applied when source and target of a sync item both exist and differ. Exactly one strategy is active per
 * run.
 */
public enum ConflictStrategy {

   /**
    * The target is overwritten with the source. Target-only files are deleted and dirty repositories are reset.
    */
   SOURCE_WINS("source-wins"),

   /**
    * Existing target content is kept. Target-only files are never deleted.
    */
   TARGET_WINS("target-wins"),

   /**
    * Structured config documents are deep-merged, source values winning on conflicts.
    */
   MERGE("merge"),

   /**
    * Conflicting structured config documents are reported and left untouched for manual resolution.
    */
   MANUAL("manual"),

   /**
    * Conflicting structured config documents are silently left untouched.
    */
   SKIP("skip");

   /**
    * Accepts the label as well as the constant name, case-insensitive.
    *
    * @throws IllegalArgumentException for unknown values
    */
   public static ConflictStrategy of(final String label) {
      final var normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
      for (final var strategy : values()) {
         if (strategy.label.equals(normalized))
            return strategy;
      }
      throw new IllegalArgumentException("Unknown conflict strategy [" + label + "]. Valid values: " //
            + Arrays.stream(values()).map(ConflictStrategy::toString).collect(Collectors.joining(", ")));
   }

   public final String label;

   ConflictStrategy(final String label) {
      this.label = label;
   }

   @Override
   public String toString() {
      return label;
   }
}
