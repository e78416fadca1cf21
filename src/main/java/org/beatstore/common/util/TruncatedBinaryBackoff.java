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
package org.beatstore.common.util;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import com.google.common.base.Preconditions;

import org.beatstore.common.quantity.Time;
import org.beatstore.scheduler.config.types.TimeAmount;

/**
 * A BackoffStrategy that implements truncated binary exponential backoff with jitter.
 */
public class TruncatedBinaryBackoff implements BackoffStrategy {
  private final long initialBackoffMs;
  private final long maxBackoffIntervalMs;
  private final DoubleSupplier jitter;

  /**
   * Creates a new TruncatedBinaryBackoff that will start by backing off for about
   * {@code initialBackoff} and then backoff of up to twice as long each time its called until
   * reaching {@code maxBackoff}.
   *
   * @param initialBackoff the initial amount of time to backoff
   * @param maxBackoff the maximum amount of time to backoff
   * @param jitter Supplies values in [0, 1] scaling the random extra delay of each backoff.
   */
  public TruncatedBinaryBackoff(
      TimeAmount initialBackoff,
      TimeAmount maxBackoff,
      DoubleSupplier jitter) {
    Preconditions.checkNotNull(initialBackoff);
    Preconditions.checkNotNull(maxBackoff);
    Preconditions.checkNotNull(jitter);
    Preconditions.checkArgument(initialBackoff.getValue() > 0);
    Preconditions.checkArgument(maxBackoff.compareTo(initialBackoff) >= 0);
    initialBackoffMs = initialBackoff.as(Time.MILLISECONDS);
    maxBackoffIntervalMs = maxBackoff.as(Time.MILLISECONDS);
    this.jitter = jitter;
  }

  public TruncatedBinaryBackoff(TimeAmount initialBackoff, TimeAmount maxBackoff) {
    this(initialBackoff, maxBackoff, () -> ThreadLocalRandom.current().nextDouble());
  }

  @Override
  public long calculateBackoffMs(long lastBackoffMs) {
    Preconditions.checkArgument(lastBackoffMs >= 0);
    long halfBackoff = (lastBackoffMs == 0) ? initialBackoffMs : lastBackoffMs;

    return Math.min(
        maxBackoffIntervalMs,
        halfBackoff + Math.round(jitter.getAsDouble() * halfBackoff));
  }
}
