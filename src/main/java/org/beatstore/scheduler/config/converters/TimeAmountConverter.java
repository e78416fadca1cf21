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
package org.beatstore.scheduler.config.converters;

import java.util.Arrays;

import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.BaseConverter;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.beatstore.common.quantity.Time;
import org.beatstore.scheduler.config.types.TimeAmount;

/**
 * Converts an amount written as digits followed by a unit suffix, such as {@code 30secs}.
 */
public class TimeAmountConverter extends BaseConverter<TimeAmount> {
  private static final ImmutableMap<String, Time> UNITS =
      Maps.uniqueIndex(Arrays.asList(Time.values()), Time::toString);

  public TimeAmountConverter(String optionName) {
    super(optionName);
  }

  @Override
  public TimeAmount convert(String raw) {
    int unitStart = CharMatcher.inRange('0', '9').negate().indexIn(raw);
    if (unitStart <= 0) {
      throw new ParameterException(getErrorString(raw, "an amount such as 10ms or 2secs"));
    }

    Time unit = UNITS.get(raw.substring(unitStart));
    if (unit == null) {
      throw new ParameterException(getErrorString(raw, "an amount in one of " + UNITS.keySet()));
    }
    try {
      return new TimeAmount(Long.parseLong(raw.substring(0, unitStart)), unit);
    } catch (NumberFormatException e) {
      throw new ParameterException(getErrorString(raw, "an amount that fits in a long"));
    }
  }
}
