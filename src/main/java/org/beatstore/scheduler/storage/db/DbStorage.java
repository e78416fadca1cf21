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

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import javax.inject.Inject;

import com.google.common.io.CharStreams;
import com.google.common.util.concurrent.AbstractIdleService;

import org.apache.ibatis.builder.StaticSqlSource;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.mapping.MappedStatement.Builder;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.beatstore.common.util.BackoffStrategy;
import org.beatstore.common.util.Clock;
import org.beatstore.scheduler.storage.ChangeClockStore;
import org.beatstore.scheduler.storage.ScheduleStore;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.StorageBootstrapException;
import org.beatstore.scheduler.storage.TaskCatalogStore;
import org.mybatis.guice.transactional.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

import static org.apache.ibatis.mapping.SqlCommandType.UPDATE;

/**
 * A storage implementation backed by a relational database.
 * <p>
 * Delegates read and write concurrency semantics to the underlying database.
 */
class DbStorage extends AbstractIdleService implements Storage {
  private static final Logger LOG = LoggerFactory.getLogger(DbStorage.class);

  private static final String CREATE_STATEMENT_NAME = "create_tables";

  /**
   * How schema creation is retried when it races with another process doing the same.
   */
  static class BootstrapSettings {
    private final int maxRetries;
    private final BackoffStrategy backoff;

    BootstrapSettings(int maxRetries, BackoffStrategy backoff) {
      checkArgument(maxRetries >= 0);
      this.maxRetries = maxRetries;
      this.backoff = requireNonNull(backoff);
    }
  }

  private final SqlSessionFactory sessionFactory;
  private final MutableStoreProvider storeProvider;
  private final Clock clock;
  private final BootstrapSettings bootstrapSettings;

  @Inject
  DbStorage(
      SqlSessionFactory sessionFactory,
      final ScheduleStore.Mutable scheduleStore,
      final TaskCatalogStore.Mutable taskCatalogStore,
      final ChangeClockStore.Mutable changeClockStore,
      Clock clock,
      BootstrapSettings bootstrapSettings) {

    this.sessionFactory = requireNonNull(sessionFactory);
    requireNonNull(scheduleStore);
    requireNonNull(taskCatalogStore);
    requireNonNull(changeClockStore);
    storeProvider = new MutableStoreProvider() {
      @Override
      public ScheduleStore.Mutable getScheduleStore() {
        return scheduleStore;
      }

      @Override
      public TaskCatalogStore.Mutable getTaskCatalogStore() {
        return taskCatalogStore;
      }

      @Override
      public ChangeClockStore.Mutable getChangeClockStore() {
        return changeClockStore;
      }
    };
    this.clock = requireNonNull(clock);
    this.bootstrapSettings = requireNonNull(bootstrapSettings);
  }

  @Override
  @Transactional
  public <T, E extends Exception> T read(Work<T, E> work) throws StorageException, E {
    try {
      return work.apply(storeProvider);
    } catch (PersistenceException e) {
      throw new TransientStorageException(e.getMessage(), e);
    }
  }

  @Transactional
  <T, E extends Exception> T transactionedWrite(MutateWork<T, E> work) throws E {
    return work.apply(storeProvider);
  }

  @Override
  public <T, E extends Exception> T write(MutateWork<T, E> work) throws StorageException, E {
    try {
      return transactionedWrite(work);
    } catch (PersistenceException e) {
      throw new TransientStorageException(e.getMessage(), e);
    }
  }

  @Override
  public void prepare() {
    try {
      startAsync().awaitRunning();
    } catch (IllegalStateException e) {
      if (state() == State.FAILED && failureCause() instanceof StorageException) {
        throw (StorageException) failureCause();
      }
      throw e;
    }
  }

  private static void addMappedStatement(Configuration configuration, String name, String sql) {
    configuration.addMappedStatement(
        new Builder(configuration, name, new StaticSqlSource(configuration, sql), UPDATE).build());
  }

  /**
   * Creates the SQL schema and the change clock during service start-up.
   */
  @Override
  protected void startUp() throws IOException, InterruptedException {
    Configuration configuration = sessionFactory.getConfiguration();
    if (!configuration.hasStatement(CREATE_STATEMENT_NAME)) {
      addMappedStatement(
          configuration,
          CREATE_STATEMENT_NAME,
          CharStreams.toString(new InputStreamReader(
              DbStorage.class.getResourceAsStream("schema.sql"),
              StandardCharsets.UTF_8)));
    }

    createSchema();

    write((MutateWork.NoResult.Quiet)
        stores -> stores.getChangeClockStore().init(clock.nowInstant()));
  }

  // Schema creation checks for existing tables before creating them, which races with other
  // processes bootstrapping the same database.  A failed attempt is likely to pass when retried.
  private void createSchema() throws InterruptedException {
    int retries = 0;
    long backoffMs = 0;
    while (true) {
      try (SqlSession session = sessionFactory.openSession(true)) {
        session.update(CREATE_STATEMENT_NAME);
        return;
      } catch (PersistenceException e) {
        if (retries >= bootstrapSettings.maxRetries) {
          throw new StorageBootstrapException(
              String.format("Failed to create schema after %d attempts", retries + 1),
              e);
        }
        backoffMs = bootstrapSettings.backoff.calculateBackoffMs(backoffMs);
        retries++;
        LOG.warn("Schema creation attempt {} failed, retrying in {} ms: {}",
            retries, backoffMs, e.getMessage());
        clock.waitFor(backoffMs);
      }
    }
  }

  @Override
  protected void shutDown() {
    // noop
  }
}
