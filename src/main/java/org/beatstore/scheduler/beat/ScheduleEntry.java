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
package org.beatstore.scheduler.beat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Ordering;

import org.beatstore.scheduler.cron.CronPredictor;
import org.beatstore.scheduler.cron.CrontabEntry;
import org.beatstore.scheduler.validation.ValidatedRow;

import static java.util.Objects.requireNonNull;

/**
 * A live schedule entry.  Instances are immutable; runtime state changes produce new instances.
 * <p>
 * Each entry tracks a due reference: the latest of the instant it was first loaded, its last
 * hand-off and its last reported run.  The entry is due once the first crontab slot after the
 * reference has arrived.
 */
public final class ScheduleEntry {
  private final String key;
  private final String task;
  private final List<Object> args;
  private final Map<String, Object> kwargs;
  private final CrontabEntry schedule;
  @Nullable
  private final Instant lastRunAt;
  private final long totalRunCount;
  private final Instant dueReference;

  private ScheduleEntry(
      String key,
      String task,
      List<Object> args,
      Map<String, Object> kwargs,
      CrontabEntry schedule,
      @Nullable Instant lastRunAt,
      long totalRunCount,
      Instant dueReference) {

    this.key = requireNonNull(key);
    this.task = requireNonNull(task);
    this.args = requireNonNull(args);
    this.kwargs = requireNonNull(kwargs);
    this.schedule = requireNonNull(schedule);
    this.lastRunAt = lastRunAt;
    this.totalRunCount = totalRunCount;
    this.dueReference = requireNonNull(dueReference);
  }

  /**
   * Creates an entry for a validated row.
   *
   * @param key Key to file the entry under.
   * @param row Validated row.
   * @param loadedAt When the entry enters the cache.
   * @return A new entry.
   */
  static ScheduleEntry fromRow(String key, ValidatedRow row, Instant loadedAt) {
    Instant lastRunAt = row.getRow().getLastRunAt().orElse(null);
    return new ScheduleEntry(
        key,
        row.getRow().getTask(),
        row.getArgs(),
        row.getKwargs(),
        row.getCrontab(),
        lastRunAt,
        row.getRow().getTotalRunCount(),
        latest(loadedAt, lastRunAt));
  }

  private static Instant latest(Instant a, @Nullable Instant b) {
    return b == null ? a : Ordering.natural().max(a, b);
  }

  public String getKey() {
    return key;
  }

  public String getTask() {
    return task;
  }

  public List<Object> getArgs() {
    return args;
  }

  public Map<String, Object> getKwargs() {
    return kwargs;
  }

  public CrontabEntry getSchedule() {
    return schedule;
  }

  public Optional<Instant> getLastRunAt() {
    return Optional.ofNullable(lastRunAt);
  }

  public long getTotalRunCount() {
    return totalRunCount;
  }

  public Instant getDueReference() {
    return dueReference;
  }

  /**
   * Decides whether this entry is due at {@code now}.  A due entry should be checked again at
   * its first slot after {@code now}, once it is handed off.
   *
   * @param predictor Crontab predictor.
   * @param now Current time.
   * @return The entry's status.
   */
  DueStatus dueStatus(CronPredictor predictor, Instant now) {
    Optional<Instant> next = predictor.nextRunAfter(schedule, dueReference);
    if (!next.isPresent()) {
      return DueStatus.never();
    }

    if (next.get().isAfter(now)) {
      return DueStatus.notDue(Duration.between(now, next.get()));
    }

    return predictor.nextRunAfter(schedule, now)
        .map(following -> DueStatus.due(Duration.between(now, following)))
        .orElseGet(() -> DueStatus.due(null));
  }

  /**
   * Marks this entry as handed off at {@code now}, so it is not due again within the same slot.
   */
  ScheduleEntry reserve(Instant now) {
    return new ScheduleEntry(
        key,
        task,
        args,
        kwargs,
        schedule,
        lastRunAt,
        totalRunCount,
        latest(now, dueReference));
  }

  /**
   * Applies a run report.
   */
  ScheduleEntry withRun(Instant ranAt, long runCountIncrement) {
    return new ScheduleEntry(
        key,
        task,
        args,
        kwargs,
        schedule,
        latest(ranAt, lastRunAt),
        totalRunCount + runCountIncrement,
        latest(ranAt, dueReference));
  }

  /**
   * Keeps the runtime state of the entry this one replaces after a reload.  The contents of
   * this entry win; run bookkeeping keeps whichever side is further along.
   */
  ScheduleEntry carryOver(ScheduleEntry previous) {
    Instant mergedLastRunAt =
        previous.lastRunAt == null ? lastRunAt : latest(previous.lastRunAt, lastRunAt);
    return new ScheduleEntry(
        key,
        task,
        args,
        kwargs,
        schedule,
        mergedLastRunAt,
        Math.max(totalRunCount, previous.totalRunCount),
        latest(previous.dueReference, mergedLastRunAt));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ScheduleEntry)) {
      return false;
    }
    ScheduleEntry other = (ScheduleEntry) o;
    return key.equals(other.key)
        && task.equals(other.task)
        && args.equals(other.args)
        && kwargs.equals(other.kwargs)
        && schedule.equals(other.schedule)
        && Objects.equals(lastRunAt, other.lastRunAt)
        && totalRunCount == other.totalRunCount
        && dueReference.equals(other.dueReference);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        key, task, args, kwargs, schedule, lastRunAt, totalRunCount, dueReference);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("task", task)
        .add("args", args)
        .add("kwargs", kwargs)
        .add("schedule", schedule)
        .toString();
  }
}
