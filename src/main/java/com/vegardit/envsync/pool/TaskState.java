/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.pool;

public enum TaskState {
   QUEUED,
   RUNNING,
   SUCCEEDED,
   FAILED,

   /**
    * Task was still queued when the pool was shut down without draining.
    */
   DROPPED;

   public boolean isTerminal() {
      return this != QUEUED && this != RUNNING;
   }
}
