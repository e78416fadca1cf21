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
package org.beatstore.scheduler.app;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.inject.Inject;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Service.State;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;

import org.beatstore.GuavaUtils.ServiceManagerIface;
import org.beatstore.common.application.Lifecycle;
import org.beatstore.scheduler.AppStartup;
import org.beatstore.scheduler.config.CliOptions;
import org.beatstore.scheduler.config.CommandLine;
import org.beatstore.scheduler.storage.db.DbModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launcher for the beat scheduler.
 */
public class SchedulerMain {
  private static final Logger LOG = LoggerFactory.getLogger(SchedulerMain.class);

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-task_modules",
        description = "Guice modules that register the periodic tasks this scheduler runs.")
    @SuppressWarnings("rawtypes")
    public List<Class> taskModules = ImmutableList.of();

    @Parameter(names = "-shutdown_grace_period",
        description = "Seconds to wait for services to stop on shutdown.")
    public long shutdownGraceSeconds = 5L;
  }

  @Inject private Lifecycle appLifecycle;
  @Inject
  @AppStartup
  private ServiceManagerIface startupServices;

  private void stop(long graceSeconds) {
    LOG.info("Stopping scheduler services.");
    try {
      startupServices.stopAsync().awaitStopped(graceSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      LOG.info("Shutdown did not complete in time: " + e);
    }
    appLifecycle.shutdown();
  }

  /**
   * Starts all services and blocks until the application shuts down.
   *
   * @return {@code true} if every service started and no service failed afterwards.
   */
  @VisibleForTesting
  boolean run(Options options) {
    boolean healthy = false;
    try {
      startupServices.startAsync();
      Runtime.getRuntime().addShutdownHook(
          new Thread(() -> stop(options.shutdownGraceSeconds), "ShutdownHook"));
      startupServices.awaitHealthy();
      healthy = true;
      appLifecycle.awaitShutdown();
    } catch (IllegalStateException e) {
      LOG.error("Scheduler services failed to start", e);
    } finally {
      stop(options.shutdownGraceSeconds);
    }
    return healthy && startupServices.servicesByState().get(State.FAILED).isEmpty();
  }

  /**
   * Runs the scheduler by including modules configured from command line arguments in
   * addition to the provided environment-specific module.
   *
   * @param options Parsed command line options.
   * @param appEnvironmentModule Additional modules based on the execution environment.
   * @return {@code true} if the scheduler ran and stopped cleanly.
   */
  @VisibleForTesting
  public static boolean flagConfiguredMain(CliOptions options, Module appEnvironmentModule) {
    Thread.setDefaultUncaughtExceptionHandler(
        (t, e) -> LOG.error("Uncaught exception from " + t + ":" + e, e));

    Module module = Modules.combine(
        appEnvironmentModule,
        new AppModule(options),
        new AbstractModule() {
          @Override
          protected void configure() {
            bind(CliOptions.class).toInstance(options);
          }
        });

    Injector injector = Guice.createInjector(module);
    SchedulerMain scheduler = new SchedulerMain();
    injector.injectMembers(scheduler);
    try {
      return scheduler.run(options.main);
    } finally {
      LOG.info("Application run() exited.");
    }
  }

  public static void main(String... args) {
    CliOptions options = CommandLine.parseOptions(args);
    boolean clean = flagConfiguredMain(options, DbModule.productionModule(options.db));
    System.exit(clean ? 0 : 1);
  }
}
