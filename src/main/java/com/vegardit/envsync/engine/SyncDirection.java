/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Advisory label of a run. Data of a single sync item always moves from its source to its target path.
 */
public enum SyncDirection {

   SOURCE_TO_TARGET("source-to-target"),
   TARGET_TO_SOURCE("target-to-source"),
   BIDIRECTIONAL("bidirectional");

   /**
    * Accepts the label as well as the constant name, case-insensitive.
    *
    * @throws IllegalArgumentException for unknown values
    */
   public static SyncDirection of(final String label) {
      final var normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
      for (final var direction : values()) {
         if (direction.label.equals(normalized))
            return direction;
      }
      throw new IllegalArgumentException("Unknown sync direction [" + label + "]. Valid values: " //
            + Arrays.stream(values()).map(SyncDirection::toString).collect(Collectors.joining(", ")));
   }

   public final String label;

   SyncDirection(final String label) {
      this.label = label;
   }

   @Override
   public String toString() {
      return label;
   }
}
