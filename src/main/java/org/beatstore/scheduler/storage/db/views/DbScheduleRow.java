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
package org.beatstore.scheduler.storage.db.views;

import java.time.Instant;

import org.beatstore.scheduler.storage.entities.ScheduleRow;

/**
 * Mutable result target for schedule rows read through MyBatis.
 */
public final class DbScheduleRow {
  private long id;
  private String taskKey;
  private String task;
  private String args;
  private String kwargs;
  private String schedule;
  private boolean enabled;
  private String comment;
  private Long lastRunAtMs;
  private long totalRunCount;

  private DbScheduleRow() {
  }

  public long getId() {
    return id;
  }

  public ScheduleRow toImmutable() {
    return ScheduleRow.builder()
        .setId(id)
        .setKey(taskKey)
        .setTask(task)
        .setArgs(args)
        .setKwargs(kwargs)
        .setSchedule(schedule)
        .setEnabled(enabled)
        .setComment(comment)
        .setLastRunAt(lastRunAtMs == null ? null : Instant.ofEpochMilli(lastRunAtMs))
        .setTotalRunCount(totalRunCount)
        .build();
  }
}
