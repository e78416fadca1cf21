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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.inject.Inject;

import com.google.common.collect.ImmutableMap;

import org.beatstore.scheduler.base.ScheduleValidationException;
import org.beatstore.scheduler.cron.CronPredictor;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.Storage.MutateWork.NoResult;
import org.beatstore.scheduler.storage.Storage.StorageException;
import org.beatstore.scheduler.storage.entities.ScheduleRow;
import org.beatstore.scheduler.validation.ScheduleRowValidator;
import org.beatstore.scheduler.validation.ValidatedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * The in-memory view of the schedule that the dispatch loop works from.
 * <p>
 * The cache maps entry keys to live entries.  It is rebuilt wholesale from the enabled rows in
 * storage whenever the {@link SyncPolicy} finds it stale, and the rebuilt map replaces the old
 * one in a single step.  Rows that fail validation are logged and left out of the rebuilt map.
 * Runtime state of an entry (due reference, last run, run count) survives rebuilds as long as
 * its key stays in the schedule.
 */
public class ScheduleCache implements RunRecorder {
  private static final Logger LOG = LoggerFactory.getLogger(ScheduleCache.class);

  private final Storage storage;
  private final SyncPolicy syncPolicy;
  private final ScheduleRowValidator validator;
  private final CronPredictor cronPredictor;
  private final BeatSettings settings;

  private volatile ImmutableMap<String, ScheduleEntry> entries = ImmutableMap.of();
  private volatile ImmutableMap<String, ValidatedRow> defaultRows = ImmutableMap.of();

  @Inject
  ScheduleCache(
      Storage storage,
      SyncPolicy syncPolicy,
      ScheduleRowValidator validator,
      CronPredictor cronPredictor,
      BeatSettings settings) {

    this.storage = requireNonNull(storage);
    this.syncPolicy = requireNonNull(syncPolicy);
    this.validator = requireNonNull(validator);
    this.cronPredictor = requireNonNull(cronPredictor);
    this.settings = requireNonNull(settings);
  }

  private static final class StoredSchedule {
    private final List<ScheduleRow> enabledRows;
    private final Set<String> keys;

    StoredSchedule(List<ScheduleRow> enabledRows, Set<String> keys) {
      this.enabledRows = enabledRows;
      this.keys = keys;
    }
  }

  /**
   * Finds the entries that are due at {@code now} and marks them as handed off.  Reloads the
   * schedule first if it is stale.
   *
   * @param now Current time.
   * @return The due entries and the time until the next check, at most the maximum loop
   *     interval.
   * @throws StorageException If storage could not be read.  The cache keeps its previous
   *     contents.
   */
  public synchronized DueEntries getDueEntries(Instant now) throws StorageException {
    if (syncPolicy.check(now) == SyncPolicy.State.STALE) {
      refresh(now);
    }

    List<ScheduleEntry> due = new ArrayList<>();
    Duration nextCheck = settings.getMaxLoopInterval();
    ImmutableMap.Builder<String, ScheduleEntry> updated = ImmutableMap.builder();
    for (ScheduleEntry entry : entries.values()) {
      DueStatus status = entry.dueStatus(cronPredictor, now);
      ScheduleEntry next = entry;
      if (status.isDue()) {
        due.add(entry);
        next = entry.reserve(now);
      }
      Optional<Duration> entryCheck = status.getNextCheck();
      if (entryCheck.isPresent() && entryCheck.get().compareTo(nextCheck) < 0) {
        nextCheck = entryCheck.get();
      }
      updated.put(next.getKey(), next);
    }
    entries = updated.build();

    return new DueEntries(due, nextCheck);
  }

  /**
   * Rebuilds the cache from storage.
   *
   * @param startedAt Instant captured before reading storage, recorded as the refresh time.
   * @throws StorageException If storage could not be read.
   */
  public synchronized void refresh(Instant startedAt) throws StorageException {
    StoredSchedule stored = storage.read(stores -> new StoredSchedule(
        stores.getScheduleStore().fetchEnabledRows(),
        stores.getScheduleStore().fetchKeys()));

    Map<String, ScheduleEntry> rebuilt = new LinkedHashMap<>();
    int skipped = 0;
    for (ScheduleRow row : stored.enabledRows) {
      try {
        ValidatedRow validated = validator.validate(row);
        // Stored keys correlate run reports with rows, so they win over recomputed ones.
        String key = row.getKey() == null ? validated.getKey() : row.getKey();
        rebuilt.put(key, live(key, validated, startedAt));
      } catch (ScheduleValidationException e) {
        skipped++;
        LOG.error("Skipping schedule row {} of task {}: {}",
            row.getKey(), row.getTask(), e.getMessage());
      }
    }

    for (Map.Entry<String, ValidatedRow> defaultRow : defaultRows.entrySet()) {
      String key = defaultRow.getKey();
      if (!stored.keys.contains(key) && !rebuilt.containsKey(key)) {
        rebuilt.put(key, live(key, defaultRow.getValue(), startedAt));
      }
    }

    entries = ImmutableMap.copyOf(rebuilt);
    syncPolicy.refreshed(startedAt);

    LOG.info("Loaded {} schedule entries ({} invalid rows skipped)", rebuilt.size(), skipped);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Current schedule: {}", rebuilt.values());
    }
  }

  /**
   * Installs the entries of the static schedule as defaults.  A default entry is live only
   * while storage holds no row with its key, enabled or not.
   *
   * @param schedule Static schedule.
   * @param now Current time.
   */
  public synchronized void installDefaultEntries(StaticSchedule schedule, Instant now) {
    Map<String, ValidatedRow> rows = new LinkedHashMap<>();
    for (Map.Entry<String, StaticSchedule.Entry> named : schedule.getEntries().entrySet()) {
      try {
        ValidatedRow row = validator.validate(named.getValue().toRow(null));
        rows.putIfAbsent(row.getKey(), row);
      } catch (ScheduleValidationException e) {
        LOG.error("Ignoring static entry {}: {}", named.getKey(), e.getMessage());
      }
    }
    defaultRows = ImmutableMap.copyOf(rows);

    Map<String, ScheduleEntry> merged = new LinkedHashMap<>(entries);
    for (Map.Entry<String, ValidatedRow> row : rows.entrySet()) {
      if (!merged.containsKey(row.getKey())) {
        merged.put(row.getKey(), ScheduleEntry.fromRow(row.getKey(), row.getValue(), now));
      }
    }
    entries = ImmutableMap.copyOf(merged);
  }

  /**
   * Updates the live entry and persists the run.  Reports for keys that are not live are still
   * persisted.
   */
  @Override
  public void recordRun(String key, Instant ranAt, long runCountIncrement) {
    requireNonNull(key);
    requireNonNull(ranAt);
    synchronized (this) {
      ScheduleEntry entry = entries.get(key);
      if (entry != null) {
        Map<String, ScheduleEntry> updated = new LinkedHashMap<>(entries);
        updated.put(key, entry.withRun(ranAt, runCountIncrement));
        entries = ImmutableMap.copyOf(updated);
      }
    }

    storage.write((NoResult.Quiet)
        stores -> stores.getScheduleStore().recordRun(key, ranAt, runCountIncrement));
  }

  /**
   * The live entries, keyed by entry key.
   */
  public Map<String, ScheduleEntry> getEntries() {
    return entries;
  }

  private ScheduleEntry live(String key, ValidatedRow row, Instant loadedAt) {
    ScheduleEntry fresh = ScheduleEntry.fromRow(key, row, loadedAt);
    ScheduleEntry previous = entries.get(key);
    return previous == null ? fresh : fresh.carryOver(previous);
  }
}
