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
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import javax.inject.Inject;

import static java.util.Objects.requireNonNull;

class CronPredictorImpl implements CronPredictor {
  private final ZoneId timeZone;

  @Inject
  CronPredictorImpl(ZoneId timeZone) {
    this.timeZone = requireNonNull(timeZone);
  }

  @Override
  public Optional<Instant> nextRunAtOrAfter(CrontabEntry schedule, Instant from) {
    ZonedDateTime reference = from.atZone(timeZone);
    return schedule.nextMatchAtOrAfter(reference.toLocalDateTime())
        .map(match -> toInstant(match, reference));
  }

  @Override
  public Optional<Instant> nextRunAfter(CrontabEntry schedule, Instant after) {
    ZonedDateTime reference = after.atZone(timeZone);
    return schedule.nextMatchAtOrAfter(reference.toLocalDateTime().plusNanos(1))
        .map(match -> toInstant(match, reference));
  }

  @Override
  public boolean isDue(CrontabEntry schedule, Instant now) {
    return schedule.matches(LocalDateTime.ofInstant(now, timeZone));
  }

  @Override
  public Optional<Duration> nextDelay(CrontabEntry schedule, Instant now) {
    return nextRunAtOrAfter(schedule, now).map(next -> Duration.between(now, next));
  }

  // Keeps the reference offset while a DST overlap repeats local times, so a prediction never
  // lands before its reference.
  private Instant toInstant(LocalDateTime match, ZonedDateTime reference) {
    return ZonedDateTime.ofLocal(match, timeZone, reference.getOffset()).toInstant();
  }
}
