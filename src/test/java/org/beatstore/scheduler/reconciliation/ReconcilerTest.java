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

import java.util.List;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Injector;

import org.beatstore.scheduler.beat.StaticSchedule;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.Storage.MutateWork.NoResult;
import org.beatstore.scheduler.storage.db.DbUtil;
import org.beatstore.scheduler.storage.entities.ScheduleRow;
import org.beatstore.scheduler.storage.entities.TaskDescriptor;
import org.beatstore.scheduler.testing.TestTasks;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class ReconcilerTest {
  private static final TaskDescriptor EMAIL = new TaskDescriptor(
      TestTasks.SEND_EMAIL,
      "address: String, priority: Long, urgent: Boolean [default: false]",
      "Sends an email.",
      "mail");

  private static final StaticSchedule STATIC_SCHEDULE = StaticSchedule.of(ImmutableMap.of(
      "cleanup",
      new StaticSchedule.Entry(
          TestTasks.CLEANUP, ImmutableList.of(), ImmutableMap.of(), "0 3 * * *"),
      "mail",
      new StaticSchedule.Entry(
          TestTasks.SEND_EMAIL, ImmutableList.of("a@x.com", 1L), ImmutableMap.of(), "0 * * * *"),
      "retired",
      new StaticSchedule.Entry("retired", ImmutableList.of(), ImmutableMap.of(), "0 * * * *")));

  private Storage storage;
  private Reconciler reconciler;

  @Before
  public void setUp() {
    Injector injector = DbUtil.createStorageInjector();
    storage = injector.getInstance(Storage.class);
    reconciler = injector.getInstance(Reconciler.class);
  }

  private List<TaskDescriptor> catalog() {
    return storage.read(stores -> stores.getTaskCatalogStore().fetchDescriptors());
  }

  private List<String> scheduledKeys() {
    List<ScheduleRow> rows = storage.read(stores -> stores.getScheduleStore().fetchRows());
    return FluentIterable.from(rows)
        .transform(ScheduleRow::getKey)
        .toList();
  }

  @Test
  public void testFillTaskCatalog() {
    assertEquals(3, reconciler.fillTaskCatalog());
    assertEquals(0, reconciler.fillTaskCatalog());

    assertEquals(
        ImmutableList.of(
            new TaskDescriptor(TestTasks.CLEANUP, "", "", "testing"),
            new TaskDescriptor(TestTasks.REPORT, "", "", "testing"),
            EMAIL),
        catalog());
  }

  @Test
  public void testFillTaskCatalogKeepsTags() {
    reconciler.fillTaskCatalog();
    storage.write(stores ->
        stores.getTaskCatalogStore().saveTags(TestTasks.SEND_EMAIL, "mail,customers"));

    reconciler.fillTaskCatalog();

    assertEquals(
        "mail,customers",
        storage.read(stores -> stores.getTaskCatalogStore().fetchDescriptor(TestTasks.SEND_EMAIL))
            .get()
            .getTags());
  }

  @Test
  public void testFillTaskCatalogRefreshesDescriptions() {
    storage.write((NoResult.Quiet) stores -> stores.getTaskCatalogStore().bulkInsert(
        ImmutableList.of(new TaskDescriptor(TestTasks.SEND_EMAIL, "address", "Old.", "mail"))));

    assertEquals(2, reconciler.fillTaskCatalog());

    assertEquals(
        EMAIL,
        storage.read(stores -> stores.getTaskCatalogStore().fetchDescriptor(TestTasks.SEND_EMAIL))
            .get());
  }

  @Test
  public void testCleanDeprecated() {
    storage.write((NoResult.Quiet) stores -> stores.getTaskCatalogStore().bulkInsert(
        ImmutableList.of(
            new TaskDescriptor("retired", "", "", ""),
            new TaskDescriptor(TestTasks.CLEANUP, "", "", ""))));

    assertEquals(ImmutableSet.of("retired"), reconciler.cleanDeprecated());
    assertEquals(ImmutableSet.of(), reconciler.cleanDeprecated());
    assertEquals(
        ImmutableSet.of(TestTasks.CLEANUP),
        storage.read(stores -> stores.getTaskCatalogStore().fetchTaskNames()));
  }

  @Test
  public void testSeedSchedule() {
    reconciler.fillTaskCatalog();

    assertEquals(2, reconciler.seedSchedule(STATIC_SCHEDULE));
    assertEquals(0, reconciler.seedSchedule(STATIC_SCHEDULE));

    assertEquals(ImmutableList.of("cleanup", "send_email-a@x.com-1"), scheduledKeys());
    ScheduleRow cleanup = storage.read(
        stores -> stores.getScheduleStore().fetchRow(TestTasks.CLEANUP)).get();
    assertEquals("loaded from static schedule on 2024-01-01T00:00:00Z", cleanup.getComment());
    assertEquals("0 3 * * *", cleanup.getSchedule());
  }

  @Test
  public void testSeedDoesNotOverwriteStoredRows() {
    reconciler.fillTaskCatalog();
    storage.write(stores -> stores.getScheduleStore().insert(ScheduleRow.builder()
        .setTask(TestTasks.CLEANUP)
        .setSchedule("30 1 * * *")
        .setEnabled(false)
        .build()));

    assertEquals(1, reconciler.seedSchedule(STATIC_SCHEDULE));

    ScheduleRow cleanup = storage.read(
        stores -> stores.getScheduleStore().fetchRow(TestTasks.CLEANUP)).get();
    assertEquals("30 1 * * *", cleanup.getSchedule());
    assertFalse(cleanup.isEnabled());
  }

  @Test
  public void testSeedEmptySchedule() {
    assertEquals(0, reconciler.seedSchedule(StaticSchedule.empty()));
  }

  @Test
  public void testReconcile() {
    storage.write((NoResult.Quiet) stores -> stores.getTaskCatalogStore().bulkInsert(
        ImmutableList.of(new TaskDescriptor("retired", "", "", ""))));

    reconciler.reconcile(STATIC_SCHEDULE);

    assertEquals(
        ImmutableSet.of(TestTasks.CLEANUP, TestTasks.REPORT, TestTasks.SEND_EMAIL),
        storage.read(stores -> stores.getTaskCatalogStore().fetchTaskNames()));
    assertEquals(ImmutableList.of("cleanup", "send_email-a@x.com-1"), scheduledKeys());
  }
}
