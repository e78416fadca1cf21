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

import com.google.inject.AbstractModule;
import com.google.inject.Module;

import org.beatstore.common.application.Lifecycle;
import org.beatstore.common.util.Clock;
import org.beatstore.scheduler.SchedulerServicesModule;
import org.beatstore.scheduler.beat.BeatModule;
import org.beatstore.scheduler.config.CliOptions;
import org.beatstore.scheduler.cron.CronModule;
import org.beatstore.scheduler.tasks.TasksModule;

import static java.util.Objects.requireNonNull;

/**
 * Binding module for the scheduler application, storage excluded.
 */
public class AppModule extends AbstractModule {
  private final CliOptions options;

  public AppModule(CliOptions options) {
    this.options = requireNonNull(options);
  }

  @Override
  protected void configure() {
    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
    bind(Lifecycle.class).toInstance(new Lifecycle());

    install(new SchedulerServicesModule());
    install(new TasksModule());
    install(new CronModule(options.cron));
    install(new BeatModule(options.beat));
    for (Module module : MoreModules.instantiateAll(options.main.taskModules, options)) {
      install(module);
    }
  }
}
