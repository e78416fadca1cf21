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
package org.beatstore.scheduler.storage;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.beatstore.scheduler.storage.entities.TaskDescriptor;

/**
 * Stores the human-readable catalog of tasks that schedule rows can reference.
 */
public interface TaskCatalogStore {

  /**
   * Fetches the names of all cataloged tasks.
   *
   * @return Task names.
   */
  Set<String> fetchTaskNames();

  /**
   * Fetches every catalog entry, ordered by name.
   *
   * @return Catalog entries.
   */
  List<TaskDescriptor> fetchDescriptors();

  /**
   * Fetches a single catalog entry.
   *
   * @param name Task name.
   * @return The entry, if cataloged.
   */
  Optional<TaskDescriptor> fetchDescriptor(String name);

  /**
   * Task catalog that may be modified.
   */
  interface Mutable extends TaskCatalogStore {

    /**
     * Inserts the entries whose task is not cataloged yet.
     *
     * @param descriptors Entries to insert.
     * @return The number of entries inserted.
     */
    int bulkInsert(Iterable<TaskDescriptor> descriptors);

    /**
     * Refreshes params and description of cataloged tasks where either changed.  Tags are never
     * touched, so edits made by users survive.
     *
     * @param descriptors Current entries.
     * @return The number of entries updated.
     */
    int bulkUpdate(Iterable<TaskDescriptor> descriptors);

    /**
     * Replaces the tags of a cataloged task.
     *
     * @param name Task name.
     * @param tags New tags.
     * @return Whether the task was found.
     */
    boolean saveTags(String name, String tags);

    /**
     * Deletes catalog entries along with every schedule row that references them.  Advances the
     * change clock if any schedule row goes away.
     *
     * @param names Task names.
     */
    void delete(Set<String> names);
  }
}
