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
import java.time.ZoneOffset;
import java.util.Optional;

import javax.annotation.Nullable;
import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;

import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.Storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Decides on every tick whether the schedule cache must be reloaded from storage.
 * <p>
 * The cache is stale when it was never loaded, when the last load is older than the forced
 * resync threshold, or when the change clock moved past the last load.  When the loop interval
 * is below the quiet window threshold, the last two checks are skipped during the first 20 and
 * the last 9 seconds of each minute, while most timers of the minute are firing.  The change
 * clock is only read when the cheaper checks do not decide.
 */
public class SyncPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(SyncPolicy.class);

  private static final int QUIET_UNTIL_SECOND = 20;
  private static final int QUIET_AFTER_SECOND = 50;

  /**
   * Freshness of the cache.
   */
  public enum State {
    FRESH,
    STALE
  }

  private final Storage storage;
  private final BeatSettings settings;

  @Nullable
  private volatile Instant lastRefreshedAt;

  @Inject
  SyncPolicy(Storage storage, BeatSettings settings) {
    this.storage = requireNonNull(storage);
    this.settings = requireNonNull(settings);
  }

  /**
   * Evaluates the cache's freshness at {@code now}.
   *
   * @param now Current time.
   * @return {@link State#STALE} if the cache should be reloaded before answering.
   * @throws StorageException If the change clock could not be read.
   */
  public State check(Instant now) throws StorageException {
    Instant refreshedAt = lastRefreshedAt;
    if (refreshedAt == null) {
      return State.STALE;
    }

    if (inQuietWindow(now)) {
      return State.FRESH;
    }

    if (Duration.between(refreshedAt, now).compareTo(settings.getForcedResyncThreshold()) > 0) {
      LOG.debug("Forcing a schedule resync, last refresh at {}", refreshedAt);
      return State.STALE;
    }

    Optional<Instant> changedAt =
        storage.read(stores -> stores.getChangeClockStore().getLastUpdatedAt());
    if (changedAt.isPresent() && refreshedAt.isBefore(changedAt.get())) {
      LOG.debug("Schedule changed at {}, last refresh at {}", changedAt.get(), refreshedAt);
      return State.STALE;
    }
    return State.FRESH;
  }

  /**
   * Records a completed reload.  The refresh time never moves backwards.
   *
   * @param startedAt Instant captured before the reload read the store.
   */
  public synchronized void refreshed(Instant startedAt) {
    requireNonNull(startedAt);
    if (lastRefreshedAt == null || lastRefreshedAt.isBefore(startedAt)) {
      lastRefreshedAt = startedAt;
    }
  }

  public Optional<Instant> getLastRefreshedAt() {
    return Optional.ofNullable(lastRefreshedAt);
  }

  @VisibleForTesting
  boolean inQuietWindow(Instant now) {
    if (settings.getMaxLoopInterval().compareTo(settings.getQuietWindowSuppressionThreshold())
        >= 0) {
      return false;
    }
    int second = now.atOffset(ZoneOffset.UTC).getSecond();
    return second < QUIET_UNTIL_SECOND || second > QUIET_AFTER_SECOND;
  }
}
