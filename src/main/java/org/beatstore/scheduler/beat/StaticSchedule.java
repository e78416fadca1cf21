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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.beatstore.scheduler.base.Payloads;
import org.beatstore.scheduler.storage.entities.ScheduleRow;

import static java.util.Objects.requireNonNull;

/**
 * The schedule an application ships with, as opposed to the one stored in the database.
 * <p>
 * Static entries seed the database on start-up, without overwriting stored rows, and stand in
 * for rows that are not stored yet.  A static schedule file is a JSON object mapping entry names
 * to entries:
 * <pre>
 * {
 *   "nightly-cleanup": {
 *     "task": "cleanup",
 *     "args": [30],
 *     "kwargs": {"dry_run": false},
 *     "schedule": "0 3 * * *"
 *   }
 * }
 * </pre>
 * {@code args} and {@code kwargs} are optional.
 */
public final class StaticSchedule {
  private static final StaticSchedule EMPTY = new StaticSchedule(ImmutableMap.of());

  /**
   * A single named static entry.
   */
  public static final class Entry {
    private final String task;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final String schedule;

    public Entry(String task, List<?> args, Map<String, ?> kwargs, String schedule) {
      this.task = requireNonNull(task);
      // Payload values may be null, which the immutable collections reject.
      this.args = Collections.unmodifiableList(new ArrayList<>(args));
      this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
      this.schedule = requireNonNull(schedule);
    }

    public String getTask() {
      return task;
    }

    public List<Object> getArgs() {
      return args;
    }

    public Map<String, Object> getKwargs() {
      return kwargs;
    }

    public String getSchedule() {
      return schedule;
    }

    /**
     * Renders this entry as an unvalidated schedule row.
     *
     * @param comment Comment to store with the row.
     * @return A row with JSON encoded arguments.
     */
    public ScheduleRow toRow(@Nullable String comment) {
      return ScheduleRow.builder()
          .setTask(task)
          .setArgs(Payloads.toJson(args))
          .setKwargs(Payloads.toJson(kwargs))
          .setSchedule(schedule)
          .setComment(comment)
          .build();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Entry)) {
        return false;
      }
      Entry other = (Entry) o;
      return task.equals(other.task)
          && args.equals(other.args)
          && kwargs.equals(other.kwargs)
          && schedule.equals(other.schedule);
    }

    @Override
    public int hashCode() {
      return Objects.hash(task, args, kwargs, schedule);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("task", task)
          .add("args", args)
          .add("kwargs", kwargs)
          .add("schedule", schedule)
          .toString();
    }
  }

  private final Map<String, Entry> entries;

  private StaticSchedule(Map<String, Entry> entries) {
    this.entries = ImmutableMap.copyOf(entries);
  }

  public static StaticSchedule empty() {
    return EMPTY;
  }

  public static StaticSchedule of(Map<String, Entry> entries) {
    return new StaticSchedule(entries);
  }

  /**
   * Parses a static schedule document.
   *
   * @param json JSON object mapping entry names to entries.
   * @return The parsed schedule.
   * @throws IllegalArgumentException If the document is malformed.
   */
  public static StaticSchedule parse(String json) throws IllegalArgumentException {
    JsonElement document;
    try {
      document = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed static schedule: " + e.getMessage(), e);
    }
    if (!document.isJsonObject()) {
      throw new IllegalArgumentException("Static schedule must be a JSON object");
    }

    Map<String, Entry> entries = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> named : document.getAsJsonObject().entrySet()) {
      entries.put(named.getKey(), parseEntry(named.getKey(), named.getValue()));
    }
    return new StaticSchedule(entries);
  }

  /**
   * Reads a static schedule file.
   *
   * @param file UTF-8 encoded JSON file.
   * @return The parsed schedule.
   * @throws IOException If the file could not be read.
   * @throws IllegalArgumentException If the file is malformed.
   */
  public static StaticSchedule load(File file) throws IOException {
    return parse(Files.asCharSource(file, StandardCharsets.UTF_8).read());
  }

  @SuppressWarnings("unchecked")
  private static Entry parseEntry(String name, JsonElement element) {
    if (!element.isJsonObject()) {
      throw new IllegalArgumentException("Static entry " + name + " must be a JSON object");
    }
    JsonObject object = element.getAsJsonObject();

    String task = requiredString(name, object, "task");
    String schedule = requiredString(name, object, "schedule");

    List<?> args = ImmutableList.of();
    if (object.has("args")) {
      if (!object.get("args").isJsonArray()) {
        throw new IllegalArgumentException("args of static entry " + name + " must be an array");
      }
      args = (List<?>) Payloads.decode(object.get("args"));
    }

    Map<String, ?> kwargs = ImmutableMap.of();
    if (object.has("kwargs")) {
      if (!object.get("kwargs").isJsonObject()) {
        throw new IllegalArgumentException(
            "kwargs of static entry " + name + " must be an object");
      }
      kwargs = (Map<String, ?>) Payloads.decode(object.get("kwargs"));
    }

    return new Entry(task, args, kwargs, schedule);
  }

  private static String requiredString(String name, JsonObject object, String field) {
    JsonElement value = object.get(field);
    if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
      throw new IllegalArgumentException(
          String.format("Static entry %s is missing string field %s", name, field));
    }
    return value.getAsString();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Entries by name, in declaration order.
   */
  public Map<String, Entry> getEntries() {
    return entries;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof StaticSchedule && entries.equals(((StaticSchedule) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("entries", entries).toString();
  }
}
