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
package org.beatstore.scheduler.storage.db;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import javax.inject.Inject;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.beatstore.common.util.Clock;
import org.beatstore.scheduler.base.ScheduleValidationException;
import org.beatstore.scheduler.storage.ChangeClockStore;
import org.beatstore.scheduler.storage.ScheduleStore;
import org.beatstore.scheduler.storage.db.views.DbScheduleRow;
import org.beatstore.scheduler.storage.entities.ScheduleRow;
import org.beatstore.scheduler.validation.ScheduleRowValidator;
import org.beatstore.scheduler.validation.ValidatedRow;

import static java.util.Objects.requireNonNull;

/**
 * Schedule store backed by a relational database.
 * <p>
 * Every write validates its rows before touching the table and advances the change clock right
 * after, so both land in the caller's transaction.
 */
class DbScheduleStore implements ScheduleStore.Mutable {
  private final ScheduleMapper mapper;
  private final ChangeClockStore.Mutable changeClock;
  private final ScheduleRowValidator validator;
  private final Clock clock;

  @Inject
  DbScheduleStore(
      ScheduleMapper mapper,
      ChangeClockStore.Mutable changeClock,
      ScheduleRowValidator validator,
      Clock clock) {

    this.mapper = requireNonNull(mapper);
    this.changeClock = requireNonNull(changeClock);
    this.validator = requireNonNull(validator);
    this.clock = requireNonNull(clock);
  }

  @Override
  public List<ScheduleRow> fetchEnabledRows() {
    return FluentIterable.from(mapper.selectEnabled())
        .transform(DbScheduleRow::toImmutable)
        .toList();
  }

  @Override
  public List<ScheduleRow> fetchRows() {
    return FluentIterable.from(mapper.selectAll())
        .transform(DbScheduleRow::toImmutable)
        .toList();
  }

  @Override
  public Optional<ScheduleRow> fetchRow(String key) {
    requireNonNull(key);
    return Optional.ofNullable(mapper.select(key)).map(DbScheduleRow::toImmutable);
  }

  @Override
  public Set<String> fetchKeys() {
    return ImmutableSet.copyOf(mapper.selectKeys());
  }

  @Override
  public int bulkInsert(Iterable<ScheduleRow> rows) throws ScheduleValidationException {
    requireNonNull(rows);
    List<ScheduleRow> validated = FluentIterable.from(rows)
        .transform(row -> validator.validate(row).getRow())
        .toList();

    Set<String> stored = Sets.newHashSet(mapper.selectKeys());
    long nowMs = clock.nowMillis();
    int inserted = 0;
    for (ScheduleRow row : validated) {
      if (stored.add(row.getKey())) {
        mapper.insert(row, nowMs);
        inserted++;
      }
    }

    if (inserted > 0) {
      changeClock.bump(clock.nowInstant());
    }
    return inserted;
  }

  @Override
  public ScheduleRow insert(ScheduleRow row) throws ScheduleValidationException {
    ValidatedRow validated = validator.validate(row);
    if (mapper.select(validated.getKey()) != null) {
      throw new ScheduleValidationException(
          String.format("Entry '%s' already exists", validated.getKey()));
    }

    mapper.insert(validated.getRow(), clock.nowMillis());
    changeClock.bump(clock.nowInstant());
    // Keys are unique, so the inserted row is found by key within the same transaction.
    long id = mapper.select(validated.getKey()).getId();
    return validated.getRow().toBuilder().setId(id).build();
  }

  @Override
  public boolean update(long id, ScheduleRow row) throws ScheduleValidationException {
    ValidatedRow validated = validator.validate(row);
    DbScheduleRow collision = mapper.select(validated.getKey());
    if (collision != null && collision.getId() != id) {
      throw new ScheduleValidationException(
          String.format("Entry '%s' already exists", validated.getKey()));
    }

    boolean updated = mapper.update(id, validated.getRow(), clock.nowMillis()) > 0;
    if (updated) {
      changeClock.bump(clock.nowInstant());
    }
    return updated;
  }

  @Override
  public boolean delete(String key) {
    requireNonNull(key);
    boolean deleted = mapper.delete(key) > 0;
    if (deleted) {
      changeClock.bump(clock.nowInstant());
    }
    return deleted;
  }

  @Override
  public boolean recordRun(String key, Instant ranAt, long runCountIncrement) {
    requireNonNull(key);
    requireNonNull(ranAt);
    return mapper.recordRun(key, ranAt.toEpochMilli(), runCountIncrement) > 0;
  }
}
