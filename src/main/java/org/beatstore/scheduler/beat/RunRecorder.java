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

import java.time.Instant;

/**
 * Accepts reports of finished runs from whatever executes the tasks.
 */
public interface RunRecorder {

  /**
   * Records that an entry ran.  The scheduler does not decide whether a run counts; it stores
   * what it is told.
   *
   * @param key Entry key.
   * @param ranAt When the run started.
   * @param runCountIncrement Amount to add to the entry's run count.
   */
  void recordRun(String key, Instant ranAt, long runCountIncrement);
}
