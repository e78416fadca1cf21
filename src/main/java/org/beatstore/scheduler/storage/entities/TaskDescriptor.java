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
package org.beatstore.scheduler.storage.entities;

import java.util.Objects;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A task catalog entry: task name, parameter summary, description and category tags.
 */
public final class TaskDescriptor {
  private final String name;
  private final String params;
  private final String description;
  private final String tags;

  public TaskDescriptor(String name, String params, String description, String tags) {
    this.name = requireNonNull(name);
    this.params = requireNonNull(params);
    this.description = requireNonNull(description);
    this.tags = requireNonNull(tags);
  }

  public String getName() {
    return name;
  }

  public String getParams() {
    return params;
  }

  public String getDescription() {
    return description;
  }

  public String getTags() {
    return tags;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TaskDescriptor)) {
      return false;
    }
    TaskDescriptor other = (TaskDescriptor) o;
    return name.equals(other.name)
        && params.equals(other.params)
        && description.equals(other.description)
        && tags.equals(other.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, params, description, tags);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("params", params)
        .add("description", description)
        .add("tags", tags)
        .toString();
  }
}
