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
import org.beatstore.scheduler.storage.db.views.DbScheduleRow;
import org.beatstore.scheduler.storage.entities.ScheduleRow;

/**
 * MyBatis mapper for schedule rows.
 */
interface ScheduleMapper {

  void insert(
      @Param("row") ScheduleRow row,
      @Param("createdAtMs") long createdAtMs);

  int update(
      @Param("id") long id,
      @Param("row") ScheduleRow row,
      @Param("updatedAtMs") long updatedAtMs);

  int delete(@Param("key") String key);

  int recordRun(
      @Param("key") String key,
      @Param("ranAtMs") long ranAtMs,
      @Param("increment") long increment);

  List<DbScheduleRow> selectAll();

  List<DbScheduleRow> selectEnabled();

  @Nullable
  DbScheduleRow select(@Param("key") String key);

  List<String> selectKeys();

  int countForTasks(@Param("tasks") Set<String> tasks);
}
