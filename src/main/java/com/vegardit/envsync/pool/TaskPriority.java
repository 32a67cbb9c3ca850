/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.pool;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Scheduling priority of a task. Higher ranks are dequeued first.
 */
public enum TaskPriority {

   LOW(0),
   NORMAL(1),
   HIGH(2),
   CRITICAL(3);

   /**
    * @throws IllegalArgumentException if the label does not name a priority
    */
   public static TaskPriority of(final String label) {
      final var normalized = label.trim().toUpperCase(Locale.ROOT);
      for (final var priority : values()) {
         if (priority.name().equals(normalized))
            return priority;
      }
      throw new IllegalArgumentException("Unknown task priority [" + label + "]. Valid values: " //
            + Arrays.stream(values()).map(p -> p.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")));
   }

   public final int rank;

   TaskPriority(final int rank) {
      this.rank = rank;
   }
}
