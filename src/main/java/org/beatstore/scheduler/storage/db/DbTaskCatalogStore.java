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

import java.util.List;
import java.util.Optional;
import java.util.Set;

import javax.inject.Inject;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.beatstore.common.util.Clock;
import org.beatstore.scheduler.storage.ChangeClockStore;
import org.beatstore.scheduler.storage.TaskCatalogStore;
import org.beatstore.scheduler.storage.db.views.DbTaskDescriptor;
import org.beatstore.scheduler.storage.entities.TaskDescriptor;

import static java.util.Objects.requireNonNull;

/**
 * Task catalog backed by a relational database.
 */
class DbTaskCatalogStore implements TaskCatalogStore.Mutable {
  private final TaskCatalogMapper mapper;
  private final ScheduleMapper scheduleMapper;
  private final ChangeClockStore.Mutable changeClock;
  private final Clock clock;

  @Inject
  DbTaskCatalogStore(
      TaskCatalogMapper mapper,
      ScheduleMapper scheduleMapper,
      ChangeClockStore.Mutable changeClock,
      Clock clock) {

    this.mapper = requireNonNull(mapper);
    this.scheduleMapper = requireNonNull(scheduleMapper);
    this.changeClock = requireNonNull(changeClock);
    this.clock = requireNonNull(clock);
  }

  @Override
  public Set<String> fetchTaskNames() {
    return ImmutableSet.copyOf(mapper.selectTaskNames());
  }

  @Override
  public List<TaskDescriptor> fetchDescriptors() {
    return FluentIterable.from(mapper.selectAll())
        .transform(DbTaskDescriptor::toImmutable)
        .toList();
  }

  @Override
  public Optional<TaskDescriptor> fetchDescriptor(String name) {
    requireNonNull(name);
    return Optional.ofNullable(mapper.select(name)).map(DbTaskDescriptor::toImmutable);
  }

  @Override
  public int bulkInsert(Iterable<TaskDescriptor> descriptors) {
    Set<String> cataloged = Sets.newHashSet(mapper.selectTaskNames());
    long nowMs = clock.nowMillis();
    int inserted = 0;
    for (TaskDescriptor descriptor : descriptors) {
      if (cataloged.add(descriptor.getName())) {
        mapper.insert(descriptor, nowMs);
        inserted++;
      }
    }
    return inserted;
  }

  @Override
  public int bulkUpdate(Iterable<TaskDescriptor> descriptors) {
    long nowMs = clock.nowMillis();
    int updated = 0;
    for (TaskDescriptor descriptor : descriptors) {
      updated += mapper.updateIfChanged(descriptor, nowMs);
    }
    return updated;
  }

  @Override
  public boolean saveTags(String name, String tags) {
    return mapper.updateTags(requireNonNull(name), requireNonNull(tags), clock.nowMillis()) > 0;
  }

  @Override
  public void delete(Set<String> names) {
    requireNonNull(names);
    if (names.isEmpty()) {
      return;
    }

    // Rows removed by the cascade are schedule changes too.
    boolean removesSchedule = scheduleMapper.countForTasks(names) > 0;
    mapper.delete(names);
    if (removesSchedule) {
      changeClock.bump(clock.nowInstant());
    }
  }
}
