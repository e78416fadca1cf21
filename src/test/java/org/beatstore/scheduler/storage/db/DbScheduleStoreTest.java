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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Injector;

import org.beatstore.common.util.testing.FakeClock;
import org.beatstore.scheduler.base.InvalidScheduleException;
import org.beatstore.scheduler.base.ScheduleValidationException;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.Storage.MutateWork.NoResult;
import org.beatstore.scheduler.storage.entities.ScheduleRow;
import org.beatstore.scheduler.storage.entities.TaskDescriptor;
import org.beatstore.scheduler.testing.TestTasks;
import org.junit.Before;
import org.junit.Test;

import static org.beatstore.scheduler.storage.db.DbUtil.EPOCH;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DbScheduleStoreTest {
  private Storage storage;
  private FakeClock clock;

  @Before
  public void setUp() {
    Injector injector = DbUtil.createStorageInjector();
    storage = injector.getInstance(Storage.class);
    clock = injector.getInstance(FakeClock.class);

    storage.write((NoResult.Quiet) stores -> stores.getTaskCatalogStore().bulkInsert(
        ImmutableList.of(
            new TaskDescriptor(TestTasks.SEND_EMAIL, "", "", ""),
            new TaskDescriptor(TestTasks.CLEANUP, "", "", ""))));
  }

  static ScheduleRow email(int priority) {
    return ScheduleRow.builder()
        .setTask(TestTasks.SEND_EMAIL)
        .setArgs("[\"a@x.com\", " + priority + "]")
        .setSchedule("*/5 * * * *")
        .build();
  }

  private static String emailKey(int priority) {
    return "send_email-a@x.com-" + priority;
  }

  private int bulkInsert(ScheduleRow... rows) {
    return storage.write(
        stores -> stores.getScheduleStore().bulkInsert(ImmutableList.copyOf(rows)));
  }

  private List<ScheduleRow> fetchRows() {
    return storage.read(stores -> stores.getScheduleStore().fetchRows());
  }

  private Optional<ScheduleRow> fetchRow(String key) {
    return storage.read(stores -> stores.getScheduleStore().fetchRow(key));
  }

  private Optional<Instant> changeClock() {
    return storage.read(stores -> stores.getChangeClockStore().getLastUpdatedAt());
  }

  @Test
  public void testChangeClockInitialized() {
    assertEquals(Optional.of(EPOCH), changeClock());
  }

  @Test
  public void testBulkInsertDeduplicates() {
    assertEquals(2, bulkInsert(email(1), email(2)));

    ScheduleRow[] batch = {email(1), email(2), email(3), email(4), email(5)};
    assertEquals(3, bulkInsert(batch));
    assertEquals(0, bulkInsert(batch));

    assertEquals(
        ImmutableList.of(emailKey(1), emailKey(2), emailKey(3), emailKey(4), emailKey(5)),
        FluentIterable.from(fetchRows()).transform(ScheduleRow::getKey).toList());
  }

  @Test
  public void testBulkInsertDeduplicatesWithinBatch() {
    assertEquals(1, bulkInsert(email(1), email(1)));
  }

  @Test
  public void testBulkInsertBumpsClockOnlyOnChange() {
    clock.advance(Duration.ofMinutes(1));
    bulkInsert(email(1));
    Instant firstInsert = EPOCH.plus(Duration.ofMinutes(1));
    assertEquals(Optional.of(firstInsert), changeClock());

    clock.advance(Duration.ofMinutes(1));
    bulkInsert(email(1));
    assertEquals(Optional.of(firstInsert), changeClock());
  }

  @Test
  public void testBulkInsertRejectsInvalidBatch() {
    ScheduleRow invalid = email(3).toBuilder().setSchedule("61 * * * *").build();
    try {
      bulkInsert(email(1), invalid);
      fail();
    } catch (InvalidScheduleException e) {
      // Expected.
    }
    assertEquals(ImmutableList.of(), fetchRows());
  }

  @Test
  public void testInsert() {
    ScheduleRow inserted = storage.write(
        stores -> stores.getScheduleStore().insert(email(1).toBuilder().setComment("hi").build()));

    assertTrue(inserted.getId().isPresent());
    assertEquals(emailKey(1), inserted.getKey());

    ScheduleRow stored = fetchRow(emailKey(1)).get();
    assertEquals(inserted.getId(), stored.getId());
    assertEquals("hi", stored.getComment());
    assertEquals("[\"a@x.com\", 1]", stored.getArgs());
    assertEquals("{}", stored.getKwargs());
    assertTrue(stored.isEnabled());
    assertEquals(Optional.empty(), stored.getLastRunAt());
    assertEquals(0, stored.getTotalRunCount());
  }

  @Test(expected = ScheduleValidationException.class)
  public void testInsertDuplicate() {
    bulkInsert(email(1));
    storage.write(stores -> stores.getScheduleStore().insert(email(1)));
  }

  @Test
  public void testUpdate() {
    bulkInsert(email(1));
    long id = fetchRow(emailKey(1)).get().getId().get();

    clock.advance(Duration.ofMinutes(1));
    ScheduleRow changed = email(7).toBuilder().setEnabled(false).build();
    assertTrue(storage.write(stores -> stores.getScheduleStore().update(id, changed)));

    assertEquals(Optional.empty(), fetchRow(emailKey(1)));
    ScheduleRow stored = fetchRow(emailKey(7)).get();
    assertEquals(Optional.of(id), stored.getId());
    assertFalse(stored.isEnabled());
    assertEquals(Optional.of(EPOCH.plus(Duration.ofMinutes(1))), changeClock());
    assertEquals(ImmutableList.of(), storage.read(
        stores -> stores.getScheduleStore().fetchEnabledRows()));
  }

  @Test
  public void testUpdateMissingRow() {
    clock.advance(Duration.ofMinutes(1));
    assertFalse(storage.write(stores -> stores.getScheduleStore().update(42L, email(1))));
    assertEquals(Optional.of(EPOCH), changeClock());
  }

  @Test(expected = ScheduleValidationException.class)
  public void testUpdateKeyCollision() {
    bulkInsert(email(1), email(2));
    long id = fetchRow(emailKey(1)).get().getId().get();
    storage.write(stores -> stores.getScheduleStore().update(id, email(2)));
  }

  @Test
  public void testDelete() {
    bulkInsert(email(1), email(2));
    clock.advance(Duration.ofMinutes(1));

    assertTrue(storage.write(stores -> stores.getScheduleStore().delete(emailKey(1))));
    assertEquals(Optional.of(EPOCH.plus(Duration.ofMinutes(1))), changeClock());
    assertEquals(
        ImmutableSet.of(emailKey(2)),
        storage.read(stores -> stores.getScheduleStore().fetchKeys()));

    clock.advance(Duration.ofMinutes(1));
    assertFalse(storage.write(stores -> stores.getScheduleStore().delete(emailKey(1))));
    assertEquals(Optional.of(EPOCH.plus(Duration.ofMinutes(1))), changeClock());
  }

  @Test
  public void testRecordRunLeavesClockAlone() {
    bulkInsert(email(1));
    Instant ranAt = EPOCH.plus(Duration.ofMinutes(5));
    clock.setNow(ranAt);

    assertTrue(storage.write(stores -> stores.getScheduleStore().recordRun(emailKey(1), ranAt, 1)));
    assertTrue(storage.write(stores -> stores.getScheduleStore().recordRun(emailKey(1), ranAt, 2)));
    assertFalse(storage.write(stores -> stores.getScheduleStore().recordRun("missing", ranAt, 1)));

    ScheduleRow stored = fetchRow(emailKey(1)).get();
    assertEquals(Optional.of(ranAt), stored.getLastRunAt());
    assertEquals(3, stored.getTotalRunCount());
    assertEquals(Optional.of(EPOCH), changeClock());
  }
}
