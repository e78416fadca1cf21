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
package org.beatstore.scheduler.base;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.CharMatcher;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/**
 * Utility functions for the JSON payloads of schedule rows.
 * <p>
 * Decoded values are {@code null}, {@link Boolean}, {@link String}, {@link Long} (or
 * {@link BigInteger} when out of range) for numbers written without a fraction or exponent,
 * {@link Double} for all other numbers, and unmodifiable {@link List}s and insertion-ordered
 * {@link Map}s of those.
 */
public final class Payloads {
  private static final Gson GSON = new GsonBuilder()
      .serializeNulls()
      .disableHtmlEscaping()
      .create();

  private static final CharMatcher FLOATING_POINT = CharMatcher.anyOf(".eE");

  private Payloads() {
    // Utility class.
  }

  /**
   * Decodes positional task arguments.
   *
   * @param json A JSON array.
   * @return The decoded arguments.
   * @throws InvalidPayloadException If {@code json} is malformed or not an array.
   */
  public static List<Object> parseArgs(String json) throws InvalidPayloadException {
    JsonElement element = parse(json, "positional arguments");
    if (!element.isJsonArray()) {
      throw new InvalidPayloadException(
          "Invalid format for task positional arguments: expected a JSON array, got " + json);
    }
    @SuppressWarnings("unchecked")
    List<Object> args = (List<Object>) decode(element);
    return args;
  }

  /**
   * Decodes keyword task arguments.
   *
   * @param json A JSON object.
   * @return The decoded arguments, in document order.
   * @throws InvalidPayloadException If {@code json} is malformed or not an object.
   */
  public static Map<String, Object> parseKwargs(String json) throws InvalidPayloadException {
    JsonElement element = parse(json, "keyword arguments");
    if (!element.isJsonObject()) {
      throw new InvalidPayloadException(
          "Invalid format for task keyword arguments: expected a JSON object, got " + json);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> kwargs = (Map<String, Object>) decode(element);
    return kwargs;
  }

  /**
   * Decodes an arbitrary JSON tree into the value types described above.
   *
   * @param element Parsed JSON.
   * @return The decoded value.
   */
  public static Object decode(JsonElement element) {
    if (element == null || element.isJsonNull()) {
      return null;
    } else if (element.isJsonArray()) {
      List<Object> values = new ArrayList<>();
      for (JsonElement value : element.getAsJsonArray()) {
        values.add(decode(value));
      }
      return Collections.unmodifiableList(values);
    } else if (element.isJsonObject()) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
        values.put(entry.getKey(), decode(entry.getValue()));
      }
      return Collections.unmodifiableMap(values);
    }

    JsonPrimitive primitive = element.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean();
    } else if (primitive.isNumber()) {
      String literal = primitive.getAsString();
      if (FLOATING_POINT.matchesAnyOf(literal)) {
        return primitive.getAsDouble();
      }
      BigInteger integer = primitive.getAsBigInteger();
      return integer.bitLength() < Long.SIZE ? (Object) integer.longValue() : integer;
    } else {
      return primitive.getAsString();
    }
  }

  /**
   * Encodes decoded values back to JSON.
   *
   * @param value A list, map or scalar.
   * @return Compact JSON.
   */
  public static String toJson(Object value) {
    return GSON.toJson(value);
  }

  // Strict mode rejects the unquoted strings, single quotes and alternate separators that
  // Gson's default parser tolerates.
  private static JsonElement parse(String json, String what) throws InvalidPayloadException {
    if (json == null) {
      throw new InvalidPayloadException(String.format("Missing task %s", what));
    }
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(false);
      JsonElement element = GSON.getAdapter(JsonElement.class).read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new InvalidPayloadException(
            String.format("Invalid format for task %s: trailing content in %s", what, json));
      }
      return element;
    } catch (IOException | JsonParseException | IllegalStateException e) {
      throw new InvalidPayloadException(
          String.format("Invalid format for task %s: %s", what, e.getMessage()), e);
    }
  }
}
