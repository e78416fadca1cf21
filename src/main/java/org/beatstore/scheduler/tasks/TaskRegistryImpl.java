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
package org.beatstore.scheduler.tasks;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.inject.Inject;

import com.google.common.collect.ImmutableSortedMap;

import org.beatstore.scheduler.base.UnknownTaskException;

import static java.util.Objects.requireNonNull;

/**
 * A registry over the tasks bound into the injector with {@link TasksModule#bindTask}.
 */
class TaskRegistryImpl implements TaskRegistry {
  private final Map<String, PeriodicTask> tasks;

  @Inject
  TaskRegistryImpl(Set<PeriodicTask> tasks) {
    requireNonNull(tasks);
    ImmutableSortedMap.Builder<String, PeriodicTask> builder = ImmutableSortedMap.naturalOrder();
    for (PeriodicTask task : tasks) {
      builder.put(task.name(), task);
    }
    // Fails on duplicate names.
    this.tasks = builder.build();
  }

  @Override
  public Set<String> taskNames() {
    return tasks.keySet();
  }

  @Override
  public boolean exists(String name) {
    return tasks.containsKey(name);
  }

  @Override
  public ParamSpec signature(String name) throws UnknownTaskException {
    return get(name).orElseThrow(() -> new UnknownTaskException(name)).parameters();
  }

  @Override
  public Optional<PeriodicTask> get(String name) {
    return Optional.ofNullable(tasks.get(name));
  }
}
