/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.beatstore.scheduler.beat;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import javax.inject.Inject;
import javax.inject.Qualifier;

import com.google.common.util.concurrent.AbstractIdleService;
import com.google.common.util.concurrent.MoreExecutors;

import org.beatstore.common.util.Clock;
import org.beatstore.scheduler.tasks.PeriodicTask;
import org.beatstore.scheduler.tasks.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

/**
 * Runs due entries on a thread pool and reports each finished attempt, whether it succeeded or
 * failed, as one run.
 */
public class ExecutorTaskDispatcher extends AbstractIdleService implements TaskDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(ExecutorTaskDispatcher.class);

  private static final long SHUTDOWN_GRACE_SECONDS = 10;

  /**
   * Binding annotation for the pool that task attempts run on.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  public @interface TaskExecutor { }

  private final TaskRegistry taskRegistry;
  private final RunRecorder runRecorder;
  private final ExecutorService executor;
  private final Clock clock;

  @Inject
  ExecutorTaskDispatcher(
      TaskRegistry taskRegistry,
      RunRecorder runRecorder,
      @TaskExecutor ExecutorService executor,
      Clock clock) {

    this.taskRegistry = requireNonNull(taskRegistry);
    this.runRecorder = requireNonNull(runRecorder);
    this.executor = requireNonNull(executor);
    this.clock = requireNonNull(clock);
  }

  @Override
  protected void startUp() {
    // Nothing to do, the pool is created eagerly.
  }

  @Override
  protected void shutDown() {
    MoreExecutors.shutdownAndAwaitTermination(executor, SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
  }

  @Override
  public void dispatch(ScheduleEntry entry) {
    Optional<PeriodicTask> task = taskRegistry.get(entry.getTask());
    if (!task.isPresent()) {
      LOG.error("Entry {} refers to unregistered task {}", entry.getKey(), entry.getTask());
      return;
    }

    try {
      executor.execute(() -> runAndRecord(task.get(), entry));
    } catch (RejectedExecutionException e) {
      LOG.warn("Dropping run of {}, the task pool is shut down", entry.getKey());
    }
  }

  private void runAndRecord(PeriodicTask task, ScheduleEntry entry) {
    Instant startedAt = clock.nowInstant();
    try {
      task.run(entry.getArgs(), entry.getKwargs());
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while running {}", entry.getKey());
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      LOG.error("Task " + entry.getTask() + " of entry " + entry.getKey() + " failed", e);
    }

    runRecorder.recordRun(entry.getKey(), startedAt, 1);
  }
}
