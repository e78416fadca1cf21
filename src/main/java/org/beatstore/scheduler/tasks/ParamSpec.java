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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.beatstore.scheduler.base.InvalidPayloadException;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The parameter signature of a {@link PeriodicTask}: an ordered list of named parameters, each
 * of which can be bound positionally or by keyword, plus an optional catch-all for extra keyword
 * arguments.
 */
public final class ParamSpec {
  private static final ParamSpec NONE = new ParamSpec(ImmutableList.of(), false);

  /**
   * A single named parameter.
   */
  public static final class Param {
    private final String name;
    @Nullable
    private final Class<?> type;
    private final boolean hasDefault;
    @Nullable
    private final Object defaultValue;

    private Param(
        String name,
        @Nullable Class<?> type,
        boolean hasDefault,
        @Nullable Object defaultValue) {

      this.name = requireNonNull(name);
      this.type = type;
      this.hasDefault = hasDefault;
      this.defaultValue = defaultValue;
    }

    public String getName() {
      return name;
    }

    public Optional<Class<?>> getType() {
      return Optional.ofNullable(type);
    }

    public boolean isRequired() {
      return !hasDefault;
    }

    @Nullable
    public Object getDefaultValue() {
      return defaultValue;
    }

    String summary() {
      StringBuilder summary = new StringBuilder(name);
      if (type != null) {
        summary.append(": ").append(type.getSimpleName());
      }
      if (hasDefault) {
        summary.append(" [default: ").append(defaultValue).append(']');
      }
      return summary.toString();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Param)) {
        return false;
      }
      Param other = (Param) o;
      return Objects.equals(name, other.name)
          && Objects.equals(type, other.type)
          && hasDefault == other.hasDefault
          && Objects.equals(defaultValue, other.defaultValue);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type, hasDefault, defaultValue);
    }

    @Override
    public String toString() {
      return summary();
    }
  }

  private final List<Param> params;
  private final boolean acceptsAnyKeywords;

  private ParamSpec(List<Param> params, boolean acceptsAnyKeywords) {
    this.params = ImmutableList.copyOf(params);
    this.acceptsAnyKeywords = acceptsAnyKeywords;
  }

  /**
   * A signature that takes no arguments at all.
   */
  public static ParamSpec none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Param> getParams() {
    return params;
  }

  public boolean acceptsAnyKeywords() {
    return acceptsAnyKeywords;
  }

  /**
   * Checks that a call with the given arguments would bind to this signature.
   *
   * @param args Positional arguments.
   * @param kwargs Keyword arguments.
   * @throws InvalidPayloadException If there are too many positional arguments, an unknown
   *     keyword, a parameter bound twice, or an unbound required parameter.
   */
  public void check(List<?> args, Map<String, ?> kwargs) throws InvalidPayloadException {
    if (args.size() > params.size()) {
      throw new InvalidPayloadException(String.format(
          "too many positional arguments: expected at most %d, got %d",
          params.size(),
          args.size()));
    }

    Set<String> names = params.stream().map(Param::getName).collect(Collectors.toSet());
    for (String keyword : kwargs.keySet()) {
      if (!names.contains(keyword) && !acceptsAnyKeywords) {
        throw new InvalidPayloadException(
            String.format("got an unexpected keyword argument '%s'", keyword));
      }
    }

    Set<String> bound = Sets.newHashSet();
    for (int i = 0; i < args.size(); i++) {
      bound.add(params.get(i).getName());
    }
    for (String keyword : kwargs.keySet()) {
      if (!bound.add(keyword) && names.contains(keyword)) {
        throw new InvalidPayloadException(
            String.format("multiple values for argument '%s'", keyword));
      }
    }

    for (Param param : params) {
      if (param.isRequired() && !bound.contains(param.getName())) {
        throw new InvalidPayloadException(
            String.format("missing a required argument: '%s'", param.getName()));
      }
    }
  }

  /**
   * Renders the catalog summary of this signature, eg: {@code user_id: Long, notify: Boolean
   * [default: true]}. The keyword catch-all is not listed.
   */
  public String summary() {
    return params.stream().map(Param::summary).collect(Collectors.joining(", "));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ParamSpec)) {
      return false;
    }
    ParamSpec other = (ParamSpec) o;
    return params.equals(other.params) && acceptsAnyKeywords == other.acceptsAnyKeywords;
  }

  @Override
  public int hashCode() {
    return Objects.hash(params, acceptsAnyKeywords);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("params", params)
        .add("acceptsAnyKeywords", acceptsAnyKeywords)
        .toString();
  }

  /**
   * Builds a {@link ParamSpec}. Parameters are bound positionally in the order they are added.
   */
  public static final class Builder {
    private final ImmutableList.Builder<Param> params = ImmutableList.builder();
    private final Set<String> names = Sets.newHashSet();
    private boolean acceptsAnyKeywords;
    private boolean sawOptional;

    private Builder() {
    }

    private Builder add(Param param) {
      checkArgument(names.add(param.getName()), "Duplicate parameter %s", param.getName());
      params.add(param);
      return this;
    }

    /**
     * Adds a parameter that must be bound.
     *
     * @param name Parameter name.
     * @param type Expected type, or {@code null} if untyped.
     */
    public Builder required(String name, @Nullable Class<?> type) {
      checkArgument(!sawOptional, "Required parameter %s follows an optional one", name);
      return add(new Param(name, type, false, null));
    }

    /**
     * Adds a parameter with a default value.
     *
     * @param name Parameter name.
     * @param type Expected type, or {@code null} if untyped.
     * @param defaultValue Value used when the parameter is not bound.
     */
    public Builder optional(String name, @Nullable Class<?> type, @Nullable Object defaultValue) {
      sawOptional = true;
      return add(new Param(name, type, true, defaultValue));
    }

    /**
     * Accept keyword arguments that match no named parameter.
     */
    public Builder acceptAnyKeywords() {
      acceptsAnyKeywords = true;
      return this;
    }

    public ParamSpec build() {
      return new ParamSpec(params.build(), acceptsAnyKeywords);
    }
  }
}
