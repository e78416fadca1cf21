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

import java.time.Instant;
import java.util.Optional;

import javax.inject.Inject;

import org.beatstore.scheduler.storage.ChangeClockStore;

import static java.util.Objects.requireNonNull;

/**
 * Change clock backed by the single row of {@code task_schedule_meta}.
 */
class DbChangeClockStore implements ChangeClockStore.Mutable {
  private final ChangeClockMapper mapper;

  @Inject
  DbChangeClockStore(ChangeClockMapper mapper) {
    this.mapper = requireNonNull(mapper);
  }

  @Override
  public Optional<Instant> getLastUpdatedAt() {
    return Optional.ofNullable(mapper.selectLastUpdatedAtMs()).map(Instant::ofEpochMilli);
  }

  @Override
  public void init(Instant now) {
    if (mapper.selectLastUpdatedAtMs() == null) {
      mapper.insert(now.toEpochMilli());
    }
  }

  @Override
  public void bump(Instant now) {
    mapper.update(now.toEpochMilli());
  }
}
