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
package org.beatstore.scheduler.storage.entities;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable persisted schedule row.  Arguments are kept as their JSON text; decoding happens
 * during validation.
 */
public final class ScheduleRow {
  @Nullable
  private final Long id;
  @Nullable
  private final String key;
  private final String task;
  private final String args;
  private final String kwargs;
  private final String schedule;
  private final boolean enabled;
  @Nullable
  private final String comment;
  @Nullable
  private final Instant lastRunAt;
  private final long totalRunCount;

  private ScheduleRow(Builder builder) {
    this.id = builder.id;
    this.key = builder.key;
    this.task = requireNonNull(builder.task, "task");
    this.args = requireNonNull(builder.args);
    this.kwargs = requireNonNull(builder.kwargs);
    this.schedule = requireNonNull(builder.schedule, "schedule");
    this.enabled = builder.enabled;
    this.comment = builder.comment;
    this.lastRunAt = builder.lastRunAt;
    checkArgument(builder.totalRunCount >= 0, "Negative run count");
    this.totalRunCount = builder.totalRunCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setId(id)
        .setKey(key)
        .setTask(task)
        .setArgs(args)
        .setKwargs(kwargs)
        .setSchedule(schedule)
        .setEnabled(enabled)
        .setComment(comment)
        .setLastRunAt(lastRunAt)
        .setTotalRunCount(totalRunCount);
  }

  /**
   * Database id, absent until the row is stored.
   */
  public Optional<Long> getId() {
    return Optional.ofNullable(id);
  }

  /**
   * Entry key, {@code null} until the row is validated.
   */
  @Nullable
  public String getKey() {
    return key;
  }

  public String getTask() {
    return task;
  }

  /**
   * Positional arguments, as a JSON array.
   */
  public String getArgs() {
    return args;
  }

  /**
   * Keyword arguments, as a JSON object.
   */
  public String getKwargs() {
    return kwargs;
  }

  /**
   * Five-field crontab expression.
   */
  public String getSchedule() {
    return schedule;
  }

  public boolean isEnabled() {
    return enabled;
  }

  @Nullable
  public String getComment() {
    return comment;
  }

  public Optional<Instant> getLastRunAt() {
    return Optional.ofNullable(lastRunAt);
  }

  public long getTotalRunCount() {
    return totalRunCount;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ScheduleRow)) {
      return false;
    }
    ScheduleRow other = (ScheduleRow) o;
    return Objects.equals(id, other.id)
        && Objects.equals(key, other.key)
        && task.equals(other.task)
        && args.equals(other.args)
        && kwargs.equals(other.kwargs)
        && schedule.equals(other.schedule)
        && enabled == other.enabled
        && Objects.equals(comment, other.comment)
        && Objects.equals(lastRunAt, other.lastRunAt)
        && totalRunCount == other.totalRunCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id, key, task, args, kwargs, schedule, enabled, comment, lastRunAt, totalRunCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("id", id)
        .add("key", key)
        .add("task", task)
        .add("args", args)
        .add("kwargs", kwargs)
        .add("schedule", schedule)
        .add("enabled", enabled)
        .add("comment", comment)
        .add("lastRunAt", lastRunAt)
        .add("totalRunCount", totalRunCount)
        .toString();
  }

  public static final class Builder {
    private Long id;
    private String key;
    private String task;
    private String args = "[]";
    private String kwargs = "{}";
    private String schedule;
    private boolean enabled = true;
    private String comment;
    private Instant lastRunAt;
    private long totalRunCount;

    private Builder() {
    }

    public Builder setId(@Nullable Long id) {
      this.id = id;
      return this;
    }

    public Builder setKey(@Nullable String key) {
      this.key = key;
      return this;
    }

    public Builder setTask(String task) {
      this.task = task;
      return this;
    }

    public Builder setArgs(String args) {
      this.args = args;
      return this;
    }

    public Builder setKwargs(String kwargs) {
      this.kwargs = kwargs;
      return this;
    }

    public Builder setSchedule(String schedule) {
      this.schedule = schedule;
      return this;
    }

    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder setComment(@Nullable String comment) {
      this.comment = comment;
      return this;
    }

    public Builder setLastRunAt(@Nullable Instant lastRunAt) {
      this.lastRunAt = lastRunAt;
      return this;
    }

    public Builder setTotalRunCount(long totalRunCount) {
      this.totalRunCount = totalRunCount;
      return this;
    }

    public ScheduleRow build() {
      return new ScheduleRow(this);
    }
  }
}
