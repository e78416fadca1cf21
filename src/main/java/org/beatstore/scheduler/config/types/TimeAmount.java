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
package org.beatstore.scheduler.config.types;

import java.time.Duration;
import java.util.Objects;

import org.beatstore.common.quantity.Time;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A non-negative amount of time, as configured on the command line.
 */
public final class TimeAmount implements Comparable<TimeAmount> {
  private final long value;
  private final Time unit;

  public TimeAmount(long value, Time unit) {
    checkArgument(value >= 0, "Time amount must not be negative: %s", value);
    this.value = value;
    this.unit = requireNonNull(unit);
  }

  public long getValue() {
    return value;
  }

  public Time getUnit() {
    return unit;
  }

  public long as(Time target) {
    return target.getTimeUnit().convert(value, unit.getTimeUnit());
  }

  public Duration toDuration() {
    return Duration.ofMillis(as(Time.MILLISECONDS));
  }

  @Override
  public int compareTo(TimeAmount other) {
    return Long.compare(as(Time.MILLISECONDS), other.as(Time.MILLISECONDS));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimeAmount)) {
      return false;
    }
    TimeAmount that = (TimeAmount) o;
    return as(Time.MILLISECONDS) == that.as(Time.MILLISECONDS);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(as(Time.MILLISECONDS));
  }

  @Override
  public String toString() {
    return value + unit.toString();
  }
}
