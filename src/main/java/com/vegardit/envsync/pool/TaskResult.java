/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.pool;

import java.time.Duration;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Terminal outcome of a task executed by a {@link TaskPool}.
 *
 * @param value the value returned by the task body, always null for failed tasks
 * @param error the exception raised by the task body, always null for successful tasks
 */
public record TaskResult<T>(long taskId, boolean success, @Nullable T value, @Nullable Throwable error, Duration duration) {

   public static <T> TaskResult<T> succeeded(final long taskId, final @Nullable T value, final Duration duration) {
      return new TaskResult<>(taskId, true, value, null, duration);
   }

   public static <T> TaskResult<T> failed(final long taskId, final Throwable error, final Duration duration) {
      return new TaskResult<>(taskId, false, null, error, duration);
   }

   public TaskResult {
      if (success && error != null)
         throw new IllegalArgumentException("A successful task result cannot carry an error");
      if (!success && error == null)
         throw new IllegalArgumentException("A failed task result requires an error");
   }
}
