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
import java.util.Optional;

/**
 * Stores the single timestamp that advances whenever the schedule changes.
 */
public interface ChangeClockStore {

  /**
   * Fetches the time of the last schedule change.
   *
   * @return The change clock, absent before it is initialized.
   */
  Optional<Instant> getLastUpdatedAt();

  /**
   * Change clock that may be modified.
   */
  interface Mutable extends ChangeClockStore {

    /**
     * Creates the change clock row if it does not exist yet.
     *
     * @param now Initial value.
     */
    void init(Instant now);

    /**
     * Advances the change clock.
     *
     * @param now New value.
     */
    void bump(Instant now);
  }
}
