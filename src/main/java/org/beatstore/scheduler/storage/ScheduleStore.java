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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.beatstore.scheduler.base.ScheduleValidationException;
import org.beatstore.scheduler.storage.entities.ScheduleRow;

/**
 * Stores the rows that make up the persisted schedule.
 */
public interface ScheduleStore {

  /**
   * Fetches the rows the dispatch loop should run.
   *
   * @return All enabled rows, in insertion order.
   */
  List<ScheduleRow> fetchEnabledRows();

  /**
   * Fetches every row, enabled or not.
   *
   * @return All rows, in insertion order.
   */
  List<ScheduleRow> fetchRows();

  /**
   * Fetches a row by its entry key.
   *
   * @param key Entry key.
   * @return The row, if present.
   */
  Optional<ScheduleRow> fetchRow(String key);

  /**
   * Fetches the keys of every row, enabled or not.
   *
   * @return All entry keys.
   */
  Set<String> fetchKeys();

  /**
   * Schedule store that may be modified.  Every method that inserts, updates or deletes rows
   * validates its input and advances the change clock in the same transaction.
   */
  interface Mutable extends ScheduleStore {

    /**
     * Inserts the rows whose keys are not stored yet.  A row whose key is already stored, or
     * repeats a key earlier in the batch, is skipped.
     *
     * @param rows Rows to insert.  Keys are computed, any key on the input is ignored.
     * @return The number of rows inserted.
     * @throws ScheduleValidationException If any row is invalid, in which case nothing is
     *     inserted.
     */
    int bulkInsert(Iterable<ScheduleRow> rows) throws ScheduleValidationException;

    /**
     * Inserts a single row.
     *
     * @param row Row to insert.
     * @return The stored row, with its id and key.
     * @throws ScheduleValidationException If the row is invalid or its key is already stored.
     */
    ScheduleRow insert(ScheduleRow row) throws ScheduleValidationException;

    /**
     * Replaces the row with the given id.  The key is recomputed from the new contents.
     *
     * @param id Row id.
     * @param row New row contents.
     * @return Whether a row was updated.
     * @throws ScheduleValidationException If the new contents are invalid.
     */
    boolean update(long id, ScheduleRow row) throws ScheduleValidationException;

    /**
     * Deletes the row with the given key.
     *
     * @param key Entry key.
     * @return Whether a row was deleted.
     */
    boolean delete(String key);

    /**
     * Records a finished run of an entry.  This is bookkeeping, not a schedule change, so the
     * change clock is left alone.
     *
     * @param key Entry key.
     * @param ranAt When the run happened.
     * @param runCountIncrement Amount to add to the row's run count.
     * @return Whether a row was found.
     */
    boolean recordRun(String key, Instant ranAt, long runCountIncrement);
  }
}
