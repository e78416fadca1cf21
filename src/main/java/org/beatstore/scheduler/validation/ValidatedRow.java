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
package org.beatstore.scheduler.validation;

import java.util.List;
import java.util.Map;

import org.beatstore.scheduler.cron.CrontabEntry;
import org.beatstore.scheduler.storage.entities.ScheduleRow;

import static java.util.Objects.requireNonNull;

/**
 * A schedule row that passed validation, together with its decoded payload and schedule.
 */
public final class ValidatedRow {
  private final ScheduleRow row;
  private final List<Object> args;
  private final Map<String, Object> kwargs;
  private final CrontabEntry crontab;

  ValidatedRow(
      ScheduleRow row,
      List<Object> args,
      Map<String, Object> kwargs,
      CrontabEntry crontab) {

    this.row = requireNonNull(row);
    this.args = requireNonNull(args);
    this.kwargs = requireNonNull(kwargs);
    this.crontab = requireNonNull(crontab);
  }

  /**
   * The input row with its key set to the computed entry key.
   */
  public ScheduleRow getRow() {
    return row;
  }

  public String getKey() {
    return row.getKey();
  }

  public List<Object> getArgs() {
    return args;
  }

  public Map<String, Object> getKwargs() {
    return kwargs;
  }

  public CrontabEntry getCrontab() {
    return crontab;
  }
}
