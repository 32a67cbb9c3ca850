/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.pool;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Signals that waiting for one or more tasks timed out. The tasks themselves keep running.
 */
public class TaskTimeoutException extends TimeoutException {

   private static final long serialVersionUID = 1L;

   private final List<Long> pendingTaskIds;

   public TaskTimeoutException(final Collection<Long> pendingTaskIds) {
      super("Timed out waiting for task(s) " + pendingTaskIds);
      this.pendingTaskIds = List.copyOf(pendingTaskIds);
   }

   public List<Long> getPendingTaskIds() {
      return pendingTaskIds;
   }
}
