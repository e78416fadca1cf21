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
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;

import org.beatstore.common.util.testing.FakeClock;
import org.beatstore.scheduler.cron.CronModule;
import org.beatstore.scheduler.cron.CronPredictor;
import org.beatstore.scheduler.storage.ChangeClockStore;
import org.beatstore.scheduler.storage.ScheduleStore;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.Storage.MutateWork.NoResult;
import org.beatstore.scheduler.storage.TaskCatalogStore;
import org.beatstore.scheduler.storage.db.DbUtil;
import org.beatstore.scheduler.storage.entities.ScheduleRow;
import org.beatstore.scheduler.storage.entities.TaskDescriptor;
import org.beatstore.scheduler.tasks.TasksModule;
import org.beatstore.scheduler.testing.TestTasks;
import org.beatstore.scheduler.validation.ScheduleRowValidator;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import static org.beatstore.scheduler.storage.db.DbUtil.EPOCH;
import static org.junit.Assert.assertEquals;

public class ScheduleCacheTest {
  private static final BeatSettings SETTINGS = new BeatSettings(
      Duration.ofSeconds(5),
      Duration.ofMinutes(5),
      Duration.ZERO);

  private Storage storage;
  private FakeClock clock;
  private ScheduleRowValidator validator;
  private CronPredictor predictor;
  private SyncPolicy syncPolicy;
  private ScheduleCache cache;

  @Before
  public void setUp() {
    Injector injector = DbUtil.createStorageInjector(new CronModule(new CronModule.Options()));
    storage = injector.getInstance(Storage.class);
    clock = injector.getInstance(FakeClock.class);
    validator = injector.getInstance(ScheduleRowValidator.class);
    predictor = injector.getInstance(CronPredictor.class);
    syncPolicy = new SyncPolicy(storage, SETTINGS);
    cache = new ScheduleCache(storage, syncPolicy, validator, predictor, SETTINGS);

    storage.write((NoResult.Quiet) stores -> stores.getTaskCatalogStore().bulkInsert(
        ImmutableList.of(
            new TaskDescriptor(TestTasks.SEND_EMAIL, "", "", ""),
            new TaskDescriptor(TestTasks.CLEANUP, "", "", ""),
            new TaskDescriptor(TestTasks.REPORT, "", "", ""))));
  }

  private static Instant at(String time) {
    return Instant.parse("2024-01-01T" + time + "Z");
  }

  private static ScheduleRow email(int priority) {
    return ScheduleRow.builder()
        .setTask(TestTasks.SEND_EMAIL)
        .setArgs("[\"a@x.com\", " + priority + "]")
        .setSchedule("*/5 * * * *")
        .build();
  }

  private static String emailKey(int priority) {
    return "send_email-a@x.com-" + priority;
  }

  private void store(ScheduleRow... rows) {
    storage.write((NoResult.Quiet) stores ->
        stores.getScheduleStore().bulkInsert(ImmutableList.copyOf(rows)));
  }

  private static StaticSchedule cleanupEvery5Minutes() {
    return StaticSchedule.of(ImmutableMap.of(
        "cleanup-every-5",
        new StaticSchedule.Entry(
            TestTasks.CLEANUP, ImmutableList.of(), ImmutableMap.of(), "*/5 * * * *"),
        "broken",
        new StaticSchedule.Entry(
            TestTasks.CLEANUP, ImmutableList.of(), ImmutableMap.of(), "every minute")));
  }

  @Test
  public void testRefreshSkipsInvalidRows() {
    store(email(1), email(2), email(3), email(4), ScheduleRow.builder()
        .setTask(TestTasks.REPORT)
        .setKwargs("{\"format\": \"pdf\"}")
        .setSchedule("0 * * * *")
        .build());

    // The report task is no longer deployed, so its stored row fails validation.
    Injector deployed = Guice.createInjector(new TasksModule(), new AbstractModule() {
      @Override
      protected void configure() {
        TasksModule.bindTask(binder(), TestTasks.SendEmail.class);
        TasksModule.bindTask(binder(), TestTasks.Cleanup.class);
      }
    });
    ScheduleCache deployedCache = new ScheduleCache(
        storage,
        syncPolicy,
        deployed.getInstance(ScheduleRowValidator.class),
        predictor,
        SETTINGS);

    deployedCache.refresh(EPOCH);

    assertEquals(
        ImmutableSet.of(emailKey(1), emailKey(2), emailKey(3), emailKey(4)),
        deployedCache.getEntries().keySet());
    assertEquals(Optional.of(EPOCH), syncPolicy.getLastRefreshedAt());
  }

  /**
   * Storage that serves a fixed list of rows, including ones that could not be written through
   * the validating stores.
   */
  private static Storage fixedRows(List<ScheduleRow> rows) {
    ScheduleStore.Mutable scheduleStore = new ScheduleStore.Mutable() {
      @Override
      public List<ScheduleRow> fetchEnabledRows() {
        return rows;
      }

      @Override
      public List<ScheduleRow> fetchRows() {
        return rows;
      }

      @Override
      public Optional<ScheduleRow> fetchRow(String key) {
        return rows.stream().filter(row -> row.getKey().equals(key)).findFirst();
      }

      @Override
      public Set<String> fetchKeys() {
        return rows.stream().map(ScheduleRow::getKey).collect(Collectors.toSet());
      }

      @Override
      public int bulkInsert(Iterable<ScheduleRow> inserted) {
        throw new UnsupportedOperationException();
      }

      @Override
      public ScheduleRow insert(ScheduleRow row) {
        throw new UnsupportedOperationException();
      }

      @Override
      public boolean update(long id, ScheduleRow row) {
        throw new UnsupportedOperationException();
      }

      @Override
      public boolean delete(String key) {
        throw new UnsupportedOperationException();
      }

      @Override
      public boolean recordRun(String key, Instant ranAt, long runCountIncrement) {
        return true;
      }
    };
    ChangeClockStore.Mutable changeClock = new ChangeClockStore.Mutable() {
      @Override
      public Optional<Instant> getLastUpdatedAt() {
        return Optional.of(EPOCH);
      }

      @Override
      public void init(Instant now) {
        throw new UnsupportedOperationException();
      }

      @Override
      public void bump(Instant now) {
        throw new UnsupportedOperationException();
      }
    };
    Storage.MutableStoreProvider stores = new Storage.MutableStoreProvider() {
      @Override
      public ScheduleStore.Mutable getScheduleStore() {
        return scheduleStore;
      }

      @Override
      public TaskCatalogStore.Mutable getTaskCatalogStore() {
        throw new UnsupportedOperationException();
      }

      @Override
      public ChangeClockStore.Mutable getChangeClockStore() {
        return changeClock;
      }
    };
    return new Storage() {
      @Override
      public <T, E extends Exception> T read(Work<T, E> work) throws E {
        return work.apply(stores);
      }

      @Override
      public <T, E extends Exception> T write(MutateWork<T, E> work) throws E {
        return work.apply(stores);
      }

      @Override
      public void prepare() {
        // Nothing to prepare.
      }
    };
  }

  @Test
  public void testRefreshSkipsUnparsableCrontab() {
    List<ScheduleRow> rows = ImmutableList.of(
        email(1).toBuilder().setKey(emailKey(1)).build(),
        email(2).toBuilder().setKey(emailKey(2)).build(),
        email(3).toBuilder().setKey(emailKey(3)).setSchedule("61 * * * *").build(),
        email(4).toBuilder().setKey(emailKey(4)).build(),
        email(5).toBuilder().setKey(emailKey(5)).build());
    Storage stored = fixedRows(rows);
    ScheduleCache fixedCache = new ScheduleCache(
        stored,
        new SyncPolicy(stored, SETTINGS),
        validator,
        predictor,
        SETTINGS);

    Logger logger = (Logger) LoggerFactory.getLogger(ScheduleCache.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      fixedCache.refresh(EPOCH);

      assertEquals(
          ImmutableSet.of(emailKey(1), emailKey(2), emailKey(4), emailKey(5)),
          fixedCache.getEntries().keySet());
      assertEquals(4, fixedCache.getDueEntries(at("00:05:00")).getDue().size());
    } finally {
      logger.detachAppender(appender);
    }

    assertEquals(
        1,
        appender.list.stream().filter(event -> event.getLevel() == Level.ERROR).count());
  }

  @Test
  public void testDisabledRowsAreNotLive() {
    store(email(1), email(2).toBuilder().setEnabled(false).build());

    cache.refresh(EPOCH);

    assertEquals(ImmutableSet.of(emailKey(1)), cache.getEntries().keySet());
  }

  @Test
  public void testGetDueEntries() {
    store(email(1), email(2));

    DueEntries initial = cache.getDueEntries(EPOCH);
    assertEquals(ImmutableList.of(), initial.getDue());
    assertEquals(Duration.ofSeconds(5), initial.getNextCheck());
    assertEquals(2, cache.getEntries().size());

    assertEquals(Duration.ofSeconds(2), cache.getDueEntries(at("00:04:58")).getNextCheck());

    DueEntries due = cache.getDueEntries(at("00:05:00"));
    assertEquals(
        ImmutableList.of(emailKey(1), emailKey(2)),
        ImmutableList.copyOf(due.getDue().stream().map(ScheduleEntry::getKey).iterator()));
    assertEquals(Duration.ofSeconds(5), due.getNextCheck());

    assertEquals(ImmutableList.of(), cache.getDueEntries(at("00:05:01")).getDue());
    assertEquals(2, cache.getDueEntries(at("00:10:00")).getDue().size());
  }

  @Test
  public void testChangeTriggersReload() {
    store(email(1));
    cache.getDueEntries(EPOCH);

    clock.setNow(at("00:01:00"));
    store(email(2));
    assertEquals(ImmutableSet.of(emailKey(1)), cache.getEntries().keySet());

    cache.getDueEntries(at("00:01:30"));
    assertEquals(ImmutableSet.of(emailKey(1), emailKey(2)), cache.getEntries().keySet());
    assertEquals(at("00:01:30"), cache.getEntries().get(emailKey(2)).getDueReference());
    assertEquals(Optional.of(at("00:01:30")), syncPolicy.getLastRefreshedAt());
  }

  @Test
  public void testMissedSlotSurvivesReload() {
    store(email(1));
    cache.getDueEntries(EPOCH);

    // The 00:05 slot passes without a tick, then the schedule changes.
    clock.setNow(at("00:06:00"));
    store(email(2));

    DueEntries due = cache.getDueEntries(at("00:07:00"));
    assertEquals(1, due.getDue().size());
    assertEquals(emailKey(1), due.getDue().get(0).getKey());
  }

  @Test
  public void testDeletedRowLeavesCache() {
    store(email(1), email(2));
    cache.getDueEntries(EPOCH);

    clock.setNow(at("00:01:00"));
    storage.write(stores -> stores.getScheduleStore().delete(emailKey(1)));
    cache.getDueEntries(at("00:01:30"));

    assertEquals(ImmutableSet.of(emailKey(2)), cache.getEntries().keySet());
  }

  @Test
  public void testDefaultEntries() {
    cache.installDefaultEntries(cleanupEvery5Minutes(), EPOCH);
    assertEquals(ImmutableSet.of(TestTasks.CLEANUP), cache.getEntries().keySet());

    cache.refresh(EPOCH);
    assertEquals(ImmutableSet.of(TestTasks.CLEANUP), cache.getEntries().keySet());
    assertEquals(1, cache.getDueEntries(at("00:05:00")).getDue().size());

    // A stored row with the same key overrides the default, even when disabled.
    clock.setNow(at("00:06:00"));
    store(ScheduleRow.builder()
        .setTask(TestTasks.CLEANUP)
        .setSchedule("*/5 * * * *")
        .setEnabled(false)
        .build());
    cache.refresh(at("00:06:00"));
    assertEquals(ImmutableSet.of(), cache.getEntries().keySet());
  }

  @Test
  public void testRecordRun() {
    store(email(1));
    cache.refresh(EPOCH);

    cache.recordRun(emailKey(1), at("00:05:02"), 1);
    cache.recordRun("unknown", at("00:05:02"), 1);

    ScheduleEntry live = cache.getEntries().get(emailKey(1));
    assertEquals(Optional.of(at("00:05:02")), live.getLastRunAt());
    assertEquals(1, live.getTotalRunCount());

    ScheduleRow stored =
        storage.read(stores -> stores.getScheduleStore().fetchRow(emailKey(1))).get();
    assertEquals(Optional.of(at("00:05:02")), stored.getLastRunAt());
    assertEquals(1, stored.getTotalRunCount());
    assertEquals(ImmutableList.of(), cache.getDueEntries(at("00:05:03")).getDue());
  }
}
