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
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * Whether an entry is due, and how long until it should be checked again.
 */
public final class DueStatus {
  private static final DueStatus NEVER = new DueStatus(false, null);

  private final boolean due;
  @Nullable
  private final Duration nextCheck;

  private DueStatus(boolean due, @Nullable Duration nextCheck) {
    this.due = due;
    this.nextCheck = nextCheck;
  }

  static DueStatus due(@Nullable Duration nextCheck) {
    return new DueStatus(true, nextCheck);
  }

  static DueStatus notDue(Duration nextCheck) {
    return new DueStatus(false, nextCheck);
  }

  /**
   * Status of an entry whose schedule has no future slot.
   */
  static DueStatus never() {
    return NEVER;
  }

  public boolean isDue() {
    return due;
  }

  /**
   * Time until the entry's next slot, absent if there is none.
   */
  public Optional<Duration> getNextCheck() {
    return Optional.ofNullable(nextCheck);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DueStatus)) {
      return false;
    }
    DueStatus other = (DueStatus) o;
    return due == other.due && Objects.equals(nextCheck, other.nextCheck);
  }

  @Override
  public int hashCode() {
    return Objects.hash(due, nextCheck);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("due", due)
        .add("nextCheck", nextCheck)
        .toString();
  }
}
