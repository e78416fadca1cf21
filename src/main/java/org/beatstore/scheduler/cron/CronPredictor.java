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
package org.beatstore.scheduler.cron;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Computes when a cron schedule fires, relative to a reference instant.
 * <p>
 * NB: Some cron schedules never fire (eg: "0 0 31 2 *"); for these every prediction is absent
 * and the schedule is never due.
 */
public interface CronPredictor {
  /**
   * Predicts the first run of {@code schedule} at or after {@code from}.
   *
   * @param schedule Cron schedule to predict the next time for.
   * @param from Reference instant, inclusive.
   * @return The next run, if the schedule fires at all.
   */
  Optional<Instant> nextRunAtOrAfter(CrontabEntry schedule, Instant from);

  /**
   * Predicts the first run of {@code schedule} strictly after {@code after}.
   *
   * @param schedule Cron schedule to predict the next time for.
   * @param after Reference instant, exclusive.
   * @return The next run, if the schedule fires at all.
   */
  Optional<Instant> nextRunAfter(CrontabEntry schedule, Instant after);

  /**
   * Whether the minute containing {@code now} is a slot of {@code schedule}.
   */
  boolean isDue(CrontabEntry schedule, Instant now);

  /**
   * Time remaining from {@code now} until the next run at or after it.
   *
   * @return The delay, zero if {@code now} is itself a run instant, absent if the schedule never
   *     fires.
   */
  Optional<Duration> nextDelay(CrontabEntry schedule, Instant now);
}
