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
package org.beatstore.scheduler.storage.db;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import org.apache.ibatis.annotations.Param;
import org.beatstore.scheduler.storage.db.views.DbTaskDescriptor;
import org.beatstore.scheduler.storage.entities.TaskDescriptor;

/**
 * MyBatis mapper for the task catalog.
 */
interface TaskCatalogMapper {

  void insert(
      @Param("descriptor") TaskDescriptor descriptor,
      @Param("createdAtMs") long createdAtMs);

  /**
   * Updates params and description, only where one of them differs from the stored value.
   */
  int updateIfChanged(
      @Param("descriptor") TaskDescriptor descriptor,
      @Param("updatedAtMs") long updatedAtMs);

  int updateTags(
      @Param("task") String task,
      @Param("tags") String tags,
      @Param("updatedAtMs") long updatedAtMs);

  void delete(@Param("tasks") Set<String> tasks);

  List<String> selectTaskNames();

  List<DbTaskDescriptor> selectAll();

  @Nullable
  DbTaskDescriptor select(@Param("task") String task);
}
