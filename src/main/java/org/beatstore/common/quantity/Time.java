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
package org.beatstore.common.quantity;

import java.util.concurrent.TimeUnit;

/**
 * Units of time, named the way they are written on the command line.
 */
public enum Time {
  MILLISECONDS(TimeUnit.MILLISECONDS, "ms"),
  SECONDS(TimeUnit.SECONDS, "secs"),
  MINUTES(TimeUnit.MINUTES, "mins"),
  HOURS(TimeUnit.HOURS, "hrs"),
  DAYS(TimeUnit.DAYS, "days");

  private final TimeUnit timeUnit;
  private final String display;

  Time(TimeUnit timeUnit, String display) {
    this.timeUnit = timeUnit;
    this.display = display;
  }

  public TimeUnit getTimeUnit() {
    return timeUnit;
  }

  @Override
  public String toString() {
    return display;
  }
}
