/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.logging.Logger;

/**
 * Fixed-size pool of worker threads consuming tasks from a priority ordered queue.
 * <p>
 * Tasks are dequeued by priority (highest first) and, within the same priority, in submission order.
 * Every task ends up in a results table keyed by its id, whether it succeeded or failed. Waiting for
 * results never occupies a worker thread.
 * <p>
 * A pool is meant to be short-lived, e.g. scoped to one directory synchronization via try-with-resources.
 * {@link #close()} drains the queue before stopping the workers.
 */
public class TaskPool<T> implements AutoCloseable {

   private static final Logger LOG = Logger.create();

   /**
    * How long an idle worker blocks on the queue before re-checking the stop flag.
    */
   static final long WORKER_POLL_MILLIS = 50;

   private static final class QueuedTask<T> implements Comparable<QueuedTask<T>> {
      final long id;
      final TaskPriority priority;
      final long enqueuedAtNanos;
      final Callable<? extends T> work;

      QueuedTask(final long id, final TaskPriority priority, final Callable<? extends T> work) {
         this.id = id;
         this.priority = priority;
         enqueuedAtNanos = System.nanoTime();
         this.work = work;
      }

      @Override
      public int compareTo(final QueuedTask<T> other) {
         if (priority != other.priority)
            return Integer.compare(other.priority.rank, priority.rank);
         if (enqueuedAtNanos != other.enqueuedAtNanos)
            return Long.compare(enqueuedAtNanos, other.enqueuedAtNanos);
         return Long.compare(id, other.id);
      }
   }

   /**
    * Task states and results. All access is synchronized on the table itself; waiters are woken up via
    * {@link #notifyAll()} whenever a task changes state.
    */
   private static final class TaskTable<T> {
      private final Map<Long, TaskState> states = new HashMap<>();
      private final Map<Long, TaskResult<T>> results = new HashMap<>();
      private long lastTaskId;
      private boolean acceptingTasks = true;

      /**
       * Assigns the next id and enqueues the task while holding the table lock, so a concurrent shutdown
       * either rejects the task or finds it in the queue.
       */
      synchronized long enqueue(final PriorityBlockingQueue<QueuedTask<T>> queue, final Callable<? extends T> work,
            final TaskPriority priority) {
         if (!acceptingTasks)
            throw new IllegalStateException("Task pool has been shut down");
         final long id = ++lastTaskId;
         states.put(id, TaskState.QUEUED);
         queue.add(new QueuedTask<>(id, priority, work));
         return id;
      }

      synchronized void markRunning(final long id) {
         states.put(id, TaskState.RUNNING);
         notifyAll();
      }

      synchronized void complete(final TaskResult<T> result) {
         states.put(result.taskId(), result.success() ? TaskState.SUCCEEDED : TaskState.FAILED);
         results.put(result.taskId(), result);
         notifyAll();
      }

      synchronized void markDropped(final long id) {
         states.put(id, TaskState.DROPPED);
         notifyAll();
      }

      synchronized void stopAccepting() {
         acceptingTasks = false;
      }

      synchronized @Nullable TaskState getState(final long id) {
         return states.get(id);
      }

      synchronized long countRunning() {
         return states.values().stream().filter(s -> s == TaskState.RUNNING).count();
      }

      synchronized Map<Long, TaskResult<T>> await(final Collection<Long> ids, final @Nullable Duration timeout) throws InterruptedException,
            TaskTimeoutException {
         for (final Long id : ids) {
            if (!states.containsKey(id))
               throw new IllegalArgumentException("Unknown task id [" + id + "]");
         }

         final long deadline = timeout == null ? 0 : System.nanoTime() + timeout.toNanos();
         while (true) {
            final var pending = new ArrayList<Long>();
            for (final Long id : ids) {
               if (results.containsKey(id)) {
                  continue;
               }
               if (states.get(id) == TaskState.DROPPED)
                  throw new IllegalStateException("Task [" + id + "] was dropped by a non-draining shutdown and will never complete");
               pending.add(id);
            }

            if (pending.isEmpty()) {
               final var collected = new LinkedHashMap<Long, TaskResult<T>>();
               for (final Long id : ids) {
                  collected.put(id, results.get(id));
               }
               return collected;
            }

            if (timeout == null) {
               wait();
            } else {
               final long remainingNanos = deadline - System.nanoTime();
               if (remainingNanos <= 0)
                  throw new TaskTimeoutException(pending);
               TimeUnit.NANOSECONDS.timedWait(this, remainingNanos);
            }
         }
      }

      synchronized void awaitQueueDrained(final PriorityBlockingQueue<?> queue) throws InterruptedException {
         while (!queue.isEmpty()) {
            wait(WORKER_POLL_MILLIS);
         }
      }
   }

   private final String name;
   private final int maxWorkers;
   private final PriorityBlockingQueue<QueuedTask<T>> queue = new PriorityBlockingQueue<>();
   private final TaskTable<T> tasks = new TaskTable<>();
   private final List<Thread> workers;
   private volatile boolean stopRequested;

   public TaskPool(final int maxWorkers) {
      this("task", maxWorkers);
   }

   /**
    * @param name prefix of the worker thread names
    * @throws IllegalArgumentException if maxWorkers is less than 1
    */
   public TaskPool(final String name, final int maxWorkers) {
      if (maxWorkers < 1)
         throw new IllegalArgumentException("maxWorkers must be >= 1 but was " + maxWorkers);
      this.name = name;
      this.maxWorkers = maxWorkers;

      final var threadFactory = BasicThreadFactory.builder() //
         .namingPattern(name + "-%d") //
         .daemon(true) //
         .build();
      final var threads = new ArrayList<Thread>(maxWorkers);
      for (var i = 0; i < maxWorkers; i++) {
         final var worker = threadFactory.newThread(this::workerLoop);
         threads.add(worker);
      }
      workers = List.copyOf(threads);
      workers.forEach(Thread::start);
      LOG.debug("Started task pool [%s] with %s worker(s).", name, maxWorkers);
   }

   private void workerLoop() {
      while (!stopRequested) {
         final QueuedTask<T> task;
         try {
            task = queue.poll(WORKER_POLL_MILLIS, TimeUnit.MILLISECONDS);
         } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.debug("Worker [%s] interrupted, exiting.", Thread.currentThread().getName());
            return;
         }
         if (task == null) {
            continue;
         }
         if (stopRequested) {
            // leave the task to the shutdown routine
            queue.add(task);
            return;
         }
         execute(task);
      }
   }

   private void execute(final QueuedTask<T> task) {
      tasks.markRunning(task.id);
      final long startedAt = System.nanoTime();
      TaskResult<T> result;
      try {
         final T value = task.work.call();
         result = TaskResult.succeeded(task.id, value, Duration.ofNanos(System.nanoTime() - startedAt));
      } catch (final Throwable ex) { // CHECKSTYLE:IGNORE IllegalCatch
         LOG.debug(ex, "Task [%s] failed: %s", task.id, ex.getMessage());
         result = TaskResult.failed(task.id, ex, Duration.ofNanos(System.nanoTime() - startedAt));
      }
      tasks.complete(result);
   }

   /**
    * Enqueues the given work.
    *
    * @return the id of the new task, ids increase monotonically and are never reused
    * @throws IllegalStateException if the pool has been shut down
    */
   public long submit(final Callable<? extends T> work, final TaskPriority priority) {
      return tasks.enqueue(queue, work, priority);
   }

   public long submit(final Callable<? extends T> work) {
      return submit(work, TaskPriority.NORMAL);
   }

   /**
    * Blocks until the given task completed.
    *
    * @throws IllegalArgumentException if no task with the given id was ever submitted to this pool
    * @throws IllegalStateException if the task was dropped by {@link #shutdown(boolean) shutdown(false)}
    */
   public TaskResult<T> waitFor(final long taskId) throws InterruptedException {
      try {
         return waitFor(taskId, null);
      } catch (final TaskTimeoutException ex) {
         // cannot happen without a timeout
         throw new IllegalStateException(ex);
      }
   }

   /**
    * Blocks until the given task completed or the timeout elapsed. A timeout does not cancel the task.
    *
    * @param timeout null to wait without a time limit
    * @throws TaskTimeoutException if the task did not complete in time
    */
   public TaskResult<T> waitFor(final long taskId, final @Nullable Duration timeout) throws InterruptedException, TaskTimeoutException {
      return tasks.await(List.of(taskId), timeout).get(taskId);
   }

   public Map<Long, TaskResult<T>> waitAll(final Collection<Long> taskIds) throws InterruptedException {
      try {
         return waitAll(taskIds, null);
      } catch (final TaskTimeoutException ex) {
         // cannot happen without a timeout
         throw new IllegalStateException(ex);
      }
   }

   /**
    * Blocks until all given tasks completed or the timeout elapsed.
    *
    * @return the results keyed by task id, in the iteration order of the given ids
    * @throws TaskTimeoutException if any of the tasks did not complete in time
    */
   public Map<Long, TaskResult<T>> waitAll(final Collection<Long> taskIds, final @Nullable Duration timeout) throws InterruptedException,
         TaskTimeoutException {
      return tasks.await(taskIds, timeout);
   }

   /**
    * Stops accepting new tasks and terminates the workers.
    *
    * @param drain if true, waits for all queued tasks to be picked up first; if false, tasks still queued
    *           are dropped and never executed
    */
   public void shutdown(final boolean drain) {
      tasks.stopAccepting();
      try {
         if (drain) {
            tasks.awaitQueueDrained(queue);
         }
         stopRequested = true;
         for (final var worker : workers) {
            worker.join();
         }
      } catch (final InterruptedException ex) {
         Thread.currentThread().interrupt();
         stopRequested = true;
         LOG.warn("Interrupted while shutting down task pool [%s].", name);
      }

      final var dropped = new ArrayList<QueuedTask<T>>();
      queue.drainTo(dropped);
      for (final var task : dropped) {
         tasks.markDropped(task.id);
      }
      if (!dropped.isEmpty()) {
         LOG.debug("Task pool [%s] dropped %s queued task(s).", name, dropped.size());
      }
   }

   @Override
   public void close() {
      shutdown(true);
   }

   public int getMaxWorkers() {
      return maxWorkers;
   }

   public int getQueuedCount() {
      return queue.size();
   }

   public long getRunningCount() {
      return tasks.countRunning();
   }

   /**
    * @throws IllegalArgumentException if no task with the given id was ever submitted to this pool
    */
   public TaskState getState(final long taskId) {
      final var state = tasks.getState(taskId);
      if (state == null)
         throw new IllegalArgumentException("Unknown task id [" + taskId + "]");
      return state;
   }
}
