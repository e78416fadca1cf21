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

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Timing parameters of the dispatch loop and its refresh policy.
 */
public class BeatSettings {
  private final Duration maxLoopInterval;
  private final Duration forcedResyncThreshold;
  private final Duration quietWindowSuppressionThreshold;

  /**
   * @param maxLoopInterval Longest sleep between two ticks.
   * @param forcedResyncThreshold Age after which the schedule is reloaded unconditionally.
   * @param quietWindowSuppressionThreshold Loop intervals below this avoid refreshing near
   *     minute boundaries.
   */
  public BeatSettings(
      Duration maxLoopInterval,
      Duration forcedResyncThreshold,
      Duration quietWindowSuppressionThreshold) {

    checkArgument(!maxLoopInterval.isNegative() && !maxLoopInterval.isZero());
    this.maxLoopInterval = maxLoopInterval;
    this.forcedResyncThreshold = requireNonNull(forcedResyncThreshold);
    this.quietWindowSuppressionThreshold = requireNonNull(quietWindowSuppressionThreshold);
  }

  public Duration getMaxLoopInterval() {
    return maxLoopInterval;
  }

  public Duration getForcedResyncThreshold() {
    return forcedResyncThreshold;
  }

  public Duration getQuietWindowSuppressionThreshold() {
    return quietWindowSuppressionThreshold;
  }
}
