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
package org.beatstore.scheduler.tasks;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.multibindings.Multibinder;

/**
 * Binds the {@link TaskRegistry}. Applications contribute tasks with {@link #bindTask}.
 */
public class TasksModule extends AbstractModule {

  @Override
  protected void configure() {
    // Make sure the set is bound even when no task is registered.
    Multibinder.newSetBinder(binder(), PeriodicTask.class);

    bind(TaskRegistry.class).to(TaskRegistryImpl.class);
    bind(TaskRegistryImpl.class).in(Singleton.class);
  }

  /**
   * Registers a task class with the task registry.
   *
   * @param binder Binder to register with.
   * @param taskClass Task implementation.
   */
  public static void bindTask(Binder binder, Class<? extends PeriodicTask> taskClass) {
    binder.bind(taskClass).in(Singleton.class);
    Multibinder.newSetBinder(binder, PeriodicTask.class).addBinding().to(taskClass);
  }

  /**
   * Registers a task instance with the task registry.
   *
   * @param binder Binder to register with.
   * @param task Task instance.
   */
  public static void bindTask(Binder binder, PeriodicTask task) {
    Multibinder.newSetBinder(binder, PeriodicTask.class).addBinding().toInstance(task);
  }
}
