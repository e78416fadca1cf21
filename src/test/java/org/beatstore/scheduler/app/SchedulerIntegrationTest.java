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
package org.beatstore.scheduler.app;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import com.google.common.util.concurrent.Service.State;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;

import org.beatstore.GuavaUtils.ServiceManagerIface;
import org.beatstore.common.application.Lifecycle;
import org.beatstore.scheduler.AppStartup;
import org.beatstore.scheduler.beat.ScheduleCache;
import org.beatstore.scheduler.config.CliOptions;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.db.DbModule;
import org.beatstore.scheduler.testing.TestTasks;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SchedulerIntegrationTest {
  private static final String STATIC_SCHEDULE = "{"
      + "\"nightly-cleanup\": {\"task\": \"cleanup\", \"schedule\": \"0 3 * * *\"},"
      + "\"hourly-mail\": {"
      + "  \"task\": \"send_email\", \"args\": [\"ops@x.com\", 2], \"schedule\": \"0 * * * *\""
      + "},"
      + "\"unknown\": {\"task\": \"retired\", \"schedule\": \"0 * * * *\"}"
      + "}";

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private CliOptions options;

  @Before
  public void setUp() throws IOException {
    File scheduleFile = folder.newFile("schedule.json");
    Files.asCharSink(scheduleFile, StandardCharsets.UTF_8).write(STATIC_SCHEDULE);

    options = new CliOptions();
    options.main.taskModules = ImmutableList.of(TestTasks.Module.class);
    options.beat.staticScheduleFile = scheduleFile;
  }

  private Injector createInjector() {
    return Guice.createInjector(DbModule.testModule(), new AppModule(options));
  }

  @Test
  public void testStartAndStop() throws TimeoutException {
    Injector injector = createInjector();
    ServiceManagerIface services =
        injector.getInstance(Key.get(ServiceManagerIface.class, AppStartup.class));

    services.startAsync().awaitHealthy();

    Storage storage = injector.getInstance(Storage.class);
    assertEquals(
        ImmutableSet.of(TestTasks.CLEANUP, TestTasks.REPORT, TestTasks.SEND_EMAIL),
        storage.read(stores -> stores.getTaskCatalogStore().fetchTaskNames()));
    assertEquals(
        ImmutableSet.of(TestTasks.CLEANUP, "send_email-ops@x.com-2"),
        storage.read(stores -> stores.getScheduleStore().fetchKeys()));
    assertEquals(
        ImmutableSet.of(TestTasks.CLEANUP, "send_email-ops@x.com-2"),
        injector.getInstance(ScheduleCache.class).getEntries().keySet());

    services.stopAsync().awaitStopped(10, TimeUnit.SECONDS);
    assertTrue(services.servicesByState().get(State.FAILED).isEmpty());
    assertFalse(injector.getInstance(Lifecycle.class).isShutdown());
  }

  @Test(expected = CreationException.class)
  public void testMalformedStaticSchedule() throws IOException {
    Files.asCharSink(options.beat.staticScheduleFile, StandardCharsets.UTF_8).write("[");
    createInjector();
  }
}
