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

import java.io.File;
import java.io.IOException;
import java.util.concurrent.ExecutorService;

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.multibindings.OptionalBinder;

import org.beatstore.common.quantity.Time;
import org.beatstore.scheduler.SchedulerServicesModule;
import org.beatstore.scheduler.base.AsyncUtil;
import org.beatstore.scheduler.beat.ExecutorTaskDispatcher.TaskExecutor;
import org.beatstore.scheduler.config.types.TimeAmount;
import org.beatstore.scheduler.config.validators.NumberBounds;
import org.beatstore.scheduler.config.validators.PositiveAmount;
import org.beatstore.scheduler.reconciliation.Reconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binding module for the dispatch loop, its schedule cache and the default task executor.
 */
public class BeatModule extends AbstractModule {
  private static final Logger LOG = LoggerFactory.getLogger(BeatModule.class);

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-max_loop_interval",
        validateValueWith = PositiveAmount.class,
        description = "Longest time the dispatch loop sleeps between two schedule checks.")
    public TimeAmount maxLoopInterval = new TimeAmount(5, Time.SECONDS);

    @Parameter(names = "-forced_resync_threshold",
        validateValueWith = PositiveAmount.class,
        description = "Age after which the schedule is reloaded even if it did not change.")
    public TimeAmount forcedResyncThreshold = new TimeAmount(5, Time.MINUTES);

    @Parameter(names = "-quiet_window_suppression_threshold",
        description = "Loop intervals shorter than this skip schedule reloads close to minute "
            + "boundaries.")
    public TimeAmount quietWindowSuppressionThreshold = new TimeAmount(30, Time.SECONDS);

    @Parameter(names = "-static_schedule_file",
        description = "JSON file with the static schedule used for seeding and default entries.")
    public File staticScheduleFile;

    @Parameter(names = "-task_executor_threads",
        validateValueWith = NumberBounds.Positive.class,
        description = "Number of threads that run dispatched tasks.")
    public int taskExecutorThreads = 4;
  }

  private final Options options;

  public BeatModule(Options options) {
    this.options = options;
  }

  /**
   * Overrides the static schedule, which is empty unless a schedule file is configured.
   *
   * @param binder Binder for the current module.
   * @param schedule Static schedule to use.
   */
  public static void bindStaticSchedule(Binder binder, StaticSchedule schedule) {
    OptionalBinder.newOptionalBinder(binder, StaticSchedule.class)
        .setBinding()
        .toInstance(schedule);
  }

  @Override
  protected void configure() {
    bind(BeatSettings.class).toInstance(new BeatSettings(
        options.maxLoopInterval.toDuration(),
        options.forcedResyncThreshold.toDuration(),
        options.quietWindowSuppressionThreshold.toDuration()));

    bind(SyncPolicy.class).in(Singleton.class);
    bind(ScheduleCache.class).in(Singleton.class);
    bind(RunRecorder.class).to(ScheduleCache.class);
    bind(Reconciler.class).in(Singleton.class);

    bind(TaskDispatcher.class).to(ExecutorTaskDispatcher.class);
    bind(ExecutorTaskDispatcher.class).in(Singleton.class);
    bind(BeatLoop.class).in(Singleton.class);

    StaticSchedule defaultSchedule = StaticSchedule.empty();
    if (options.staticScheduleFile != null) {
      try {
        defaultSchedule = StaticSchedule.load(options.staticScheduleFile);
        LOG.info("Loaded {} static entries from {}",
            defaultSchedule.getEntries().size(), options.staticScheduleFile);
      } catch (IOException | IllegalArgumentException e) {
        addError("Failed to load static schedule from %s: %s",
            options.staticScheduleFile, e.getMessage());
      }
    }
    OptionalBinder.newOptionalBinder(binder(), StaticSchedule.class)
        .setDefault()
        .toInstance(defaultSchedule);

    SchedulerServicesModule.addAppStartupServiceBinding(binder()).to(ExecutorTaskDispatcher.class);
    SchedulerServicesModule.addAppStartupServiceBinding(binder()).to(BeatLoop.class);
  }

  @Provides
  @Singleton
  @TaskExecutor
  ExecutorService provideTaskExecutor() {
    return AsyncUtil.loggingExecutor(options.taskExecutorThreads, "TaskExecutor-%d", LOG);
  }
}
