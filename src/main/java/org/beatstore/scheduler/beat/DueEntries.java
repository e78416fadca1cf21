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
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import static java.util.Objects.requireNonNull;

/**
 * The entries handed off by one tick, and how long the loop may sleep before the next one.
 */
public final class DueEntries {
  private final List<ScheduleEntry> due;
  private final Duration nextCheck;

  DueEntries(List<ScheduleEntry> due, Duration nextCheck) {
    this.due = ImmutableList.copyOf(due);
    this.nextCheck = requireNonNull(nextCheck);
  }

  public List<ScheduleEntry> getDue() {
    return due;
  }

  public Duration getNextCheck() {
    return nextCheck;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("due", due)
        .add("nextCheck", nextCheck)
        .toString();
  }
}
