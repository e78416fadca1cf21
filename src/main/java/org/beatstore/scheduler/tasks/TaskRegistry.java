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

import java.util.Optional;
import java.util.Set;

import org.beatstore.scheduler.base.UnknownTaskException;

/**
 * The live set of tasks this process can run.
 */
public interface TaskRegistry {

  /**
   * Names of all registered tasks, sorted.
   */
  Set<String> taskNames();

  /**
   * Whether a task with the given name is registered.
   */
  boolean exists(String name);

  /**
   * The parameter signature of a registered task.
   *
   * @param name Task name.
   * @return The task's signature.
   * @throws UnknownTaskException If no such task is registered.
   */
  ParamSpec signature(String name) throws UnknownTaskException;

  /**
   * Looks up a registered task.
   *
   * @param name Task name.
   * @return The task, if registered.
   */
  Optional<PeriodicTask> get(String name);
}
