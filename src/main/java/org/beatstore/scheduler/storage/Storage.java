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
package org.beatstore.scheduler.storage;

import org.beatstore.scheduler.base.SchedulerException;

/**
 * Manages scheduler storage operations providing an interface to perform atomic changes.
 */
public interface Storage {

  /**
   * Provider for read-only stores.  Store implementations must be thread-safe, and should support
   * concurrent reads where appropriate.
   */
  interface StoreProvider {
    ScheduleStore getScheduleStore();
    TaskCatalogStore getTaskCatalogStore();
    ChangeClockStore getChangeClockStore();
  }

  /**
   * Provider for stores that permit mutations.  All mutations made through one provider commit
   * or roll back together.
   */
  interface MutableStoreProvider extends StoreProvider {
    @Override
    ScheduleStore.Mutable getScheduleStore();

    @Override
    TaskCatalogStore.Mutable getTaskCatalogStore();

    @Override
    ChangeClockStore.Mutable getChangeClockStore();
  }

  /**
   * A unit of work to perform against the storage system.
   *
   * @param <S> Type of stores the work needs access to.
   * @param <T> Return type of the operation.
   * @param <E> Exception type thrown by the operation.
   */
  @FunctionalInterface
  interface StorageOperation<S extends StoreProvider, T, E extends Exception> {
    /**
     * Abstracts a unit of work that has a result, but may also throw a specific exception.
     *
     * @param storeProvider A provider to give access to different available stores.
     * @return the result of the successfully completed unit of work
     * @throws E if the unit of work could not be completed
     */
    T apply(S storeProvider) throws E;
  }

  /**
   * Encapsulates a read-only storage operation.
   *
   * @param <T> The type of result this unit of work produces.
   * @param <E> The type of exception this unit of work can throw.
   */
  @FunctionalInterface
  interface Work<T, E extends Exception> extends StorageOperation<StoreProvider, T, E> {

    /**
     * A convenient typedef for Work that throws no checked exceptions - it runs quietly.
     *
     * @param <T> The type of result this unit of work produces.
     */
    @FunctionalInterface
    interface Quiet<T> extends Work<T, RuntimeException> {
      // typedef
    }
  }

  /**
   * Encapsulates a storage operation, which has mutable storage access.
   *
   * @param <T> The type of result this unit of work produces.
   * @param <E> The type of exception this unit of work can throw.
   */
  @FunctionalInterface
  interface MutateWork<T, E extends Exception>
      extends StorageOperation<MutableStoreProvider, T, E> {

    /**
     * A convenient typedef for Work that throws no checked exceptions - it runs quietly.
     *
     * @param <T> The type of result this unit of work produces.
     */
    @FunctionalInterface
    interface Quiet<T> extends MutateWork<T, RuntimeException> {
      // typedef
    }

    /**
     * Encapsulates work that returns no result.
     *
     * @param <E> The type of exception this unit of work can throw.
     */
    @FunctionalInterface
    interface NoResult<E extends Exception> extends MutateWork<Void, E> {

      @Override
      default Void apply(MutableStoreProvider storeProvider) throws E {
        execute(storeProvider);
        return null;
      }

      /**
       * Similar to {@link #apply(MutableStoreProvider)} except that no result is
       * returned.
       *
       * @param storeProvider A provider to give access to different available stores.
       * @throws E if the unit of work could not be completed
       */
      void execute(MutableStoreProvider storeProvider) throws E;

      /**
       * A convenient typedef for Work with no result that throws no checked exceptions - it runs
       * quitely.
       */
      @FunctionalInterface
      interface Quiet extends NoResult<RuntimeException> {
        // typedef
      }
    }
  }

  /**
   * Indicates a problem reading from or writing to stable storage.
   */
  class StorageException extends SchedulerException {
    public StorageException(String message, Throwable cause) {
      super(message, cause);
    }

    public StorageException(String message) {
      super(message);
    }
  }

  /**
   * Indicates that stable storage is temporarily unavailable.  Callers on the dispatch path log
   * these and carry on with the next tick.
   */
  class TransientStorageException extends StorageException {
    public TransientStorageException(String message, Throwable cause) {
      super(message, cause);
    }

    public TransientStorageException(String message) {
      super(message);
    }
  }

  /**
   * Executes the unit of read-only {@code work}.  The consistency model creates the possibility
   * for a reader to read uncommitted state from a concurrent writer.
   *
   * @param work The unit of work to execute.
   * @param <T> The type of result this unit of work produces.
   * @param <E> The type of exception this unit of work can throw.
   * @return the result when the unit of work completes successfully
   * @throws StorageException if there was a problem reading from stable storage.
   * @throws E bubbled transparently when the unit of work throws
   */
  <T, E extends Exception> T read(Work<T, E> work) throws StorageException, E;

  /**
   * Executes the unit of mutating {@code work} in a single transaction.
   *
   * @param work The unit of work to execute.
   * @param <T> The type of result this unit of work produces.
   * @param <E> The type of exception this unit of work can throw.
   * @return the result when the unit of work completes successfully
   * @throws StorageException if there was a problem reading from or writing to stable storage.
   * @throws E bubbled transparently when the unit of work throws
   */
  <T, E extends Exception> T write(MutateWork<T, E> work) throws StorageException, E;

  /**
   * Requests the underlying storage prepare its data set; ie: create the schema and initialize
   * the change clock.  Blocks until the storage is ready.
   *
   * @throws StorageBootstrapException if the schema could not be created.
   * @throws StorageException if there was a problem preparing storage.
   */
  void prepare() throws StorageException;
}
