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

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractExecutionThreadService;

import org.beatstore.common.util.Clock;
import org.beatstore.scheduler.reconciliation.Reconciler;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.Storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * The dispatch loop.  Prepares storage and reconciles it on start-up, then repeatedly hands
 * due entries to the {@link TaskDispatcher} and sleeps until the next check.
 */
public class BeatLoop extends AbstractExecutionThreadService {
  private static final Logger LOG = LoggerFactory.getLogger(BeatLoop.class);

  private final Storage storage;
  private final Reconciler reconciler;
  private final ScheduleCache cache;
  private final TaskDispatcher dispatcher;
  private final StaticSchedule staticSchedule;
  private final BeatSettings settings;
  private final Clock clock;
  private final CountDownLatch shutdown = new CountDownLatch(1);

  @Inject
  BeatLoop(
      Storage storage,
      Reconciler reconciler,
      ScheduleCache cache,
      TaskDispatcher dispatcher,
      StaticSchedule staticSchedule,
      BeatSettings settings,
      Clock clock) {

    this.storage = requireNonNull(storage);
    this.reconciler = requireNonNull(reconciler);
    this.cache = requireNonNull(cache);
    this.dispatcher = requireNonNull(dispatcher);
    this.staticSchedule = requireNonNull(staticSchedule);
    this.settings = requireNonNull(settings);
    this.clock = requireNonNull(clock);
  }

  @Override
  protected void startUp() {
    storage.prepare();
    reconciler.reconcile(staticSchedule);
    Instant now = clock.nowInstant();
    cache.installDefaultEntries(staticSchedule, now);
    cache.refresh(now);
    LOG.info("Beat started with {} schedule entries, max loop interval {}",
        cache.getEntries().size(), settings.getMaxLoopInterval());
  }

  @Override
  protected void run() throws InterruptedException {
    while (isRunning()) {
      Duration wait = runOneIteration();
      if (shutdown.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
        break;
      }
    }
  }

  @Override
  protected void triggerShutdown() {
    shutdown.countDown();
  }

  @Override
  protected void shutDown() {
    LOG.info("Beat stopped");
  }

  /**
   * Dispatches the entries due now.
   *
   * @return How long to wait before the next iteration.
   */
  @VisibleForTesting
  Duration runOneIteration() {
    DueEntries dueEntries;
    try {
      dueEntries = cache.getDueEntries(clock.nowInstant());
    } catch (StorageException e) {
      LOG.error("Failed to check the schedule, retrying in " + settings.getMaxLoopInterval(), e);
      return settings.getMaxLoopInterval();
    }

    for (ScheduleEntry entry : dueEntries.getDue()) {
      LOG.info("Scheduler: Sending due task {} ({})", entry.getKey(), entry.getTask());
      dispatcher.dispatch(entry);
    }
    LOG.debug("Next check in {}", dueEntries.getNextCheck());
    return dueEntries.getNextCheck();
  }
}
