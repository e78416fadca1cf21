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
package org.beatstore.scheduler.reconciliation;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.inject.Inject;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.beatstore.common.util.Clock;
import org.beatstore.scheduler.base.ScheduleValidationException;
import org.beatstore.scheduler.beat.StaticSchedule;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.Storage.StorageException;
import org.beatstore.scheduler.storage.entities.ScheduleRow;
import org.beatstore.scheduler.storage.entities.TaskDescriptor;
import org.beatstore.scheduler.tasks.PeriodicTask;
import org.beatstore.scheduler.tasks.TaskRegistry;
import org.beatstore.scheduler.validation.ScheduleRowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Brings the task catalog and the stored schedule in line with the tasks this process knows
 * about.
 * <p>
 * Catalog rows for tasks that are no longer registered are deleted, which also removes their
 * schedule rows.  Registered tasks are then written to the catalog, and the static schedule is
 * seeded into storage without touching rows that already exist.
 */
public class Reconciler {
  private static final Logger LOG = LoggerFactory.getLogger(Reconciler.class);

  private final Storage storage;
  private final TaskRegistry taskRegistry;
  private final ScheduleRowValidator validator;
  private final Clock clock;

  @Inject
  Reconciler(
      Storage storage,
      TaskRegistry taskRegistry,
      ScheduleRowValidator validator,
      Clock clock) {

    this.storage = requireNonNull(storage);
    this.taskRegistry = requireNonNull(taskRegistry);
    this.validator = requireNonNull(validator);
    this.clock = requireNonNull(clock);
  }

  /**
   * Runs every reconciliation step in order.
   *
   * @param schedule Static schedule to seed.
   * @throws StorageException If storage could not be read or written.
   */
  public void reconcile(StaticSchedule schedule) throws StorageException {
    cleanDeprecated();
    fillTaskCatalog();
    seedSchedule(schedule);
  }

  /**
   * Deletes catalog entries of tasks that are not registered.
   *
   * @return Names of the deleted tasks.
   * @throws StorageException If storage could not be read or written.
   */
  public Set<String> cleanDeprecated() throws StorageException {
    Set<String> live = taskRegistry.taskNames();
    Set<String> deprecated = storage.write(stores -> {
      Set<String> stale = ImmutableSet.copyOf(
          Sets.difference(stores.getTaskCatalogStore().fetchTaskNames(), live));
      stores.getTaskCatalogStore().delete(stale);
      return stale;
    });

    if (!deprecated.isEmpty()) {
      LOG.info("Removed deprecated tasks from the catalog: {}", deprecated);
    }
    return deprecated;
  }

  /**
   * Writes every registered task to the catalog.  Existing entries keep their tags.
   *
   * @return Number of catalog entries inserted.
   * @throws StorageException If storage could not be written.
   */
  public int fillTaskCatalog() throws StorageException {
    List<TaskDescriptor> descriptors = FluentIterable.from(taskRegistry.taskNames())
        .transform(name -> describe(taskRegistry.get(name).get()))
        .toList();

    int[] counts = storage.write(stores -> new int[] {
        stores.getTaskCatalogStore().bulkInsert(descriptors),
        stores.getTaskCatalogStore().bulkUpdate(descriptors)
    });
    LOG.info("Task catalog filled: {} inserted, {} updated", counts[0], counts[1]);
    return counts[0];
  }

  /**
   * Persists the entries of the static schedule whose keys are not stored yet.  Entries that
   * fail validation are logged and skipped.
   *
   * @param schedule Static schedule.
   * @return Number of rows inserted.
   * @throws StorageException If storage could not be written.
   */
  public int seedSchedule(StaticSchedule schedule) throws StorageException {
    if (schedule.isEmpty()) {
      return 0;
    }

    Instant now = clock.nowInstant();
    String comment = "loaded from static schedule on " + now;
    ImmutableList.Builder<ScheduleRow> rows = ImmutableList.builder();
    for (Map.Entry<String, StaticSchedule.Entry> named : schedule.getEntries().entrySet()) {
      ScheduleRow row = named.getValue().toRow(comment);
      try {
        validator.validate(row);
        rows.add(row);
      } catch (ScheduleValidationException e) {
        LOG.error("Not seeding static entry {}: {}", named.getKey(), e.getMessage());
      }
    }

    List<ScheduleRow> valid = rows.build();
    int inserted = storage.write(
        stores -> stores.getScheduleStore().bulkInsert(valid));
    LOG.info("Seeded {} of {} static schedule entries", inserted, valid.size());
    return inserted;
  }

  private static TaskDescriptor describe(PeriodicTask task) {
    return new TaskDescriptor(
        task.name(),
        task.parameters().summary(),
        task.description(),
        task.category());
  }
}
