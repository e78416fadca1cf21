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

import javax.inject.Inject;

import org.beatstore.scheduler.base.EntryKeys;
import org.beatstore.scheduler.base.InvalidPayloadException;
import org.beatstore.scheduler.base.Payloads;
import org.beatstore.scheduler.base.ScheduleValidationException;
import org.beatstore.scheduler.base.UnknownTaskException;
import org.beatstore.scheduler.cron.CrontabEntry;
import org.beatstore.scheduler.storage.entities.ScheduleRow;
import org.beatstore.scheduler.tasks.TaskRegistry;

import static java.util.Objects.requireNonNull;

/**
 * Checks schedule rows against the live task registry and computes their entry keys.
 * <p>
 * Checks run in a fixed order and the first failure wins: the task must be registered, the
 * arguments must be a JSON array and the keyword arguments a JSON object, together they must
 * bind to the task's parameters, and the schedule must be a valid crontab expression.
 */
public class ScheduleRowValidator {
  private final TaskRegistry taskRegistry;

  @Inject
  public ScheduleRowValidator(TaskRegistry taskRegistry) {
    this.taskRegistry = requireNonNull(taskRegistry);
  }

  /**
   * Validates a row.
   *
   * @param row Row to validate.
   * @return The row with its key set, and its decoded contents.
   * @throws UnknownTaskException If the task is not registered.
   * @throws InvalidPayloadException If the arguments are malformed or do not fit the task.
   * @throws org.beatstore.scheduler.base.InvalidScheduleException If the schedule is malformed.
   */
  public ValidatedRow validate(ScheduleRow row) throws ScheduleValidationException {
    requireNonNull(row);

    if (!taskRegistry.exists(row.getTask())) {
      throw new UnknownTaskException(row.getTask());
    }

    List<Object> args = Payloads.parseArgs(row.getArgs());
    Map<String, Object> kwargs = Payloads.parseKwargs(row.getKwargs());
    try {
      taskRegistry.signature(row.getTask()).check(args, kwargs);
    } catch (InvalidPayloadException e) {
      throw new InvalidPayloadException(
          String.format("Invalid arguments for task '%s': %s", row.getTask(), e.getMessage()),
          e);
    }

    CrontabEntry crontab = CrontabEntry.parse(row.getSchedule());

    String key = EntryKeys.compute(row.getTask(), args, kwargs);
    return new ValidatedRow(row.toBuilder().setKey(key).build(), args, kwargs, crontab);
  }
}
