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
package org.beatstore.scheduler.base;

/**
 * Indicates that a schedule row cannot be turned into a live schedule entry.
 * <p>
 * Writes that fail validation are rejected. Rows that fail validation while the schedule is being
 * reloaded are logged and skipped.
 */
public class ScheduleValidationException extends SchedulerException {
  public ScheduleValidationException(String message) {
    super(message);
  }

  public ScheduleValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
