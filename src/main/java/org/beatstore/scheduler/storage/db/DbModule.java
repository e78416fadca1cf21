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

import java.util.Map;
import java.util.Set;
import java.util.UUID;

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Module;
import com.google.inject.PrivateModule;

import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.beatstore.common.quantity.Time;
import org.beatstore.common.util.TruncatedBinaryBackoff;
import org.beatstore.scheduler.config.types.TimeAmount;
import org.beatstore.scheduler.config.validators.NumberBounds;
import org.beatstore.scheduler.config.validators.PositiveAmount;
import org.beatstore.scheduler.storage.ChangeClockStore;
import org.beatstore.scheduler.storage.ScheduleStore;
import org.beatstore.scheduler.storage.Storage;
import org.beatstore.scheduler.storage.TaskCatalogStore;
import org.mybatis.guice.MyBatisModule;
import org.mybatis.guice.datasource.builtin.PooledDataSourceProvider;
import org.mybatis.guice.datasource.helper.JdbcHelper;

import static java.util.Objects.requireNonNull;

import static com.google.inject.name.Names.bindProperties;

/**
 * Binding module for a relational database storage system.
 * <p>
 * Without {@code -db_url} the schedule lives in a private in-memory H2 database, which is only
 * useful when the whole schedule comes from the static schedule.  Point {@code -db_url} at a
 * shared database to let other processes edit the schedule.
 */
public final class DbModule extends PrivateModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-db_url",
        description = "JDBC url of the schedule database. Defaults to a private in-memory H2 "
            + "database.")
    public String dbUrl;

    @Parameter(names = "-db_driver", description = "JDBC driver class for -db_url.")
    public String dbDriver = "org.h2.Driver";

    @Parameter(names = "-db_user", description = "User to connect to -db_url as.")
    public String dbUser;

    @Parameter(names = "-db_password", description = "Password for -db_user.", password = true)
    public String dbPassword;

    // http://h2database.com/html/grammar.html#set_lock_timeout
    @Parameter(names = "-db_lock_timeout", description = "H2 table lock timeout")
    public TimeAmount h2LockTimeout = new TimeAmount(1, Time.MINUTES);

    @Parameter(names = "-schema_bootstrap_max_retries",
        validateValueWith = NumberBounds.NotNegative.class,
        description = "How many times schema creation is retried before start-up fails.")
    public int schemaBootstrapMaxRetries = 10;

    @Parameter(names = "-schema_bootstrap_backoff_base",
        validateValueWith = PositiveAmount.class,
        description = "Initial backoff between schema creation attempts.")
    public TimeAmount schemaBootstrapBackoffBase = new TimeAmount(10, Time.MILLISECONDS);

    @Parameter(names = "-schema_bootstrap_backoff_cap",
        validateValueWith = PositiveAmount.class,
        description = "Maximum backoff between schema creation attempts.")
    public TimeAmount schemaBootstrapBackoffCap = new TimeAmount(1000, Time.MILLISECONDS);
  }

  private static final Set<Class<?>> MAPPER_CLASSES = ImmutableSet.<Class<?>>builder()
      .add(ChangeClockMapper.class)
      .add(ScheduleMapper.class)
      .add(TaskCatalogMapper.class)
      .build();

  private final Options options;
  private final String jdbcSchema;

  private DbModule(Options options, String dbName, Map<String, String> jdbcUriArgs) {
    this.options = requireNonNull(options);

    Map<String, String> args = ImmutableMap.<String, String>builder()
        .putAll(jdbcUriArgs)
        // Send log messages from H2 to SLF4j
        // See http://www.h2database.com/html/features.html#other_logging
        .put("TRACE_LEVEL_FILE", "4")
        // Configure the lock timeout
        .put("LOCK_TIMEOUT", String.valueOf(options.h2LockTimeout.as(Time.MILLISECONDS)))
        .build();
    this.jdbcSchema = dbName + ";" + Joiner.on(";").withKeyValueSeparator("=").join(args);
  }

  /**
   * Creates a module for the storage system used in production.
   *
   * @param options Storage options.
   * @return A new database module for production.
   */
  public static Module productionModule(Options options) {
    return new DbModule(options, "beatstore", ImmutableMap.of("DB_CLOSE_DELAY", "-1"));
  }

  /**
   * Creates a module that will prepare a private in-memory database.
   *
   * @return A new database module for testing.
   */
  @VisibleForTesting
  public static Module testModule() {
    return new DbModule(
        new Options(),
        "testdb-" + UUID.randomUUID().toString(),
        // A non-zero close delay is used here to avoid eager database cleanup in tests that
        // make use of multiple threads.  Since all test databases are separately scoped by the
        // included UUID, multiple DB instances will overlap in time but they should be distinct
        // in content.
        ImmutableMap.of("DB_CLOSE_DELAY", "5"));
  }

  private <T> void bindStore(Class<T> binding, Class<? extends T> impl) {
    bind(binding).to(impl);
    bind(impl).in(Singleton.class);
  }

  @Override
  protected void configure() {
    install(new MyBatisModule() {
      @Override
      protected void initialize() {
        if (options.dbUrl == null) {
          bindProperties(binder(), ImmutableMap.of("JDBC.schema", jdbcSchema));
          install(JdbcHelper.H2_IN_MEMORY_NAMED);
        } else {
          bindProperties(binder(), ImmutableMap.of(
              "JDBC.driver", options.dbDriver,
              "JDBC.url", options.dbUrl));
          if (options.dbUser != null) {
            bindProperties(binder(), ImmutableMap.of("JDBC.username", options.dbUser));
          }
          if (options.dbPassword != null) {
            bindProperties(binder(), ImmutableMap.of("JDBC.password", options.dbPassword));
          }
        }

        // We have no plans to take advantage of multiple DB environments. This is a
        // required property though, so we use an unnamed environment.
        environmentId("");

        bindTransactionFactoryType(JdbcTransactionFactory.class);
        bindDataSourceProviderType(PooledDataSourceProvider.class);
        addMapperClasses(MAPPER_CLASSES);
        mapUnderscoreToCamelCase(true);

        // Enable a ping query which will prevent the use of invalid connections in the
        // connection pool.
        bindProperties(binder(), ImmutableMap.of("mybatis.pooled.pingEnabled", "true"));
        bindProperties(binder(), ImmutableMap.of("mybatis.pooled.pingQuery", "SELECT 1;"));
      }
    });

    bindStore(ChangeClockStore.Mutable.class, DbChangeClockStore.class);
    bindStore(ScheduleStore.Mutable.class, DbScheduleStore.class);
    bindStore(TaskCatalogStore.Mutable.class, DbTaskCatalogStore.class);

    bind(DbStorage.BootstrapSettings.class).toInstance(new DbStorage.BootstrapSettings(
        options.schemaBootstrapMaxRetries,
        new TruncatedBinaryBackoff(
            options.schemaBootstrapBackoffBase,
            options.schemaBootstrapBackoffCap)));

    bind(Storage.class).to(DbStorage.class);
    bind(DbStorage.class).in(Singleton.class);
    expose(Storage.class);
  }
}
