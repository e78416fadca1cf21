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

import java.util.List;
import java.util.Map;

/**
 * A unit of work that schedule rows can reference by name.
 */
public interface PeriodicTask {

  /**
   * Unique task name, as stored in schedule rows.
   */
  String name();

  /**
   * Parameters accepted by {@link #run(List, Map)}.
   */
  ParamSpec parameters();

  /**
   * Human-readable description for the task catalog.
   */
  default String description() {
    return "";
  }

  /**
   * Catalog category, derived from the implementing class' package by default.
   */
  default String category() {
    return TaskCategories.fromPackage(getClass().getPackageName());
  }

  /**
   * Runs the task once.
   *
   * @param args Positional arguments decoded from the schedule row.
   * @param kwargs Keyword arguments decoded from the schedule row.
   * @throws Exception If the task body fails.
   */
  void run(List<Object> args, Map<String, Object> kwargs) throws Exception;
}
