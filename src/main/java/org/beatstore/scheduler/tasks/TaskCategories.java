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

import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;

/**
 * Derives task catalog categories from package names.
 */
public final class TaskCategories {
  private TaskCategories() {
    // Utility class.
  }

  /**
   * Drops every {@code .tasks} segment and returns the last remaining one:
   * {@code com.acme.users.tasks} is {@code users}, {@code com.acme.base.tasks.tasks} is
   * {@code base}.
   *
   * @param packageName A dotted package name.
   * @return The category, empty for the default package.
   */
  public static String fromPackage(String packageName) {
    List<String> segments = Splitter.on('.').splitToList(packageName.replace(".tasks", ""));
    return Iterables.getLast(segments);
  }
}
