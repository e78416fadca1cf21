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

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;

import static java.util.Objects.requireNonNull;

/**
 * Utility class providing the identity function for schedule entries.
 * <p>
 * The same task may be scheduled several times with different arguments, and each combination
 * is a distinct entry. An entry key joins the task name, the rendered positional arguments and
 * the rendered keyword arguments with {@code -}, then removes brackets, braces, parentheses,
 * commas, spaces and quotes so the key fits monitoring systems that only accept
 * {@code [0-9a-zA-Z_.-]}.
 * <p>
 * Keys are not unique digests: two triples that render identically share a key, and are
 * treated as the same entry.
 */
public final class EntryKeys {
  private static final Pattern DISALLOWED = Pattern.compile("[\\[\\](){}, '\"]");
  private static final CharMatcher SEPARATOR = CharMatcher.is('-');

  private EntryKeys() {
    // Utility class.
  }

  /**
   * Computes the key identifying a (task, args, kwargs) triple.
   *
   * @param task Task name.
   * @param args Positional arguments, in call order.
   * @param kwargs Keyword arguments, rendered in the map's iteration order.
   * @return The entry key.
   */
  public static String compute(String task, List<?> args, Map<String, ?> kwargs) {
    requireNonNull(task);
    requireNonNull(args);
    requireNonNull(kwargs);

    String renderedArgs = args.stream()
        .map(EntryKeys::str)
        .collect(Collectors.joining("-"));
    String renderedKwargs = kwargs.entrySet().stream()
        .map(entry -> entry.getKey() + "-" + str(entry.getValue()))
        .collect(Collectors.joining("-"));

    String joined = SEPARATOR.trimFrom(String.join("-", task, renderedArgs, renderedKwargs));
    return DISALLOWED.matcher(joined).replaceAll("");
  }

  /**
   * Renders a decoded JSON value the way it reads in a key: {@code True}/{@code False} for
   * booleans, {@code None} for null, integral numbers without a fraction.
   */
  static String str(Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    return repr(value);
  }

  private static String repr(Object value) {
    if (value == null) {
      return "None";
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? "True" : "False";
    } else if (value instanceof String) {
      return "'" + value + "'";
    } else if (value instanceof List) {
      return ((List<?>) value).stream()
          .map(EntryKeys::repr)
          .collect(Collectors.joining(", ", "[", "]"));
    } else if (value instanceof Map) {
      return ((Map<?, ?>) value).entrySet().stream()
          .map(entry -> repr(entry.getKey()) + ": " + repr(entry.getValue()))
          .collect(Collectors.joining(", ", "{", "}"));
    } else if (value instanceof Double) {
      return reprDouble((Double) value);
    } else {
      return value.toString();
    }
  }

  // Shortest round-trip digits, positional for exponents in [-4, 16), otherwise scientific with
  // a signed, two-digit exponent: 1e+16, 1.5e-05, 0.0001, 100.0.
  @VisibleForTesting
  static String reprDouble(double value) {
    if (Double.isNaN(value)) {
      return "nan";
    } else if (Double.isInfinite(value)) {
      return value > 0 ? "inf" : "-inf";
    } else if (value == 0) {
      return Double.doubleToRawLongBits(value) < 0 ? "-0.0" : "0.0";
    }

    String sign = value < 0 ? "-" : "";
    BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
    String digits = decimal.unscaledValue().toString();
    int pointPosition = digits.length() - decimal.scale();
    if (pointPosition > 16 || pointPosition <= -4) {
      String mantissa = digits.length() == 1
          ? digits
          : digits.charAt(0) + "." + digits.substring(1);
      int exponent = pointPosition - 1;
      return String.format(
          "%s%se%s%02d", sign, mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }

    String plain = decimal.toPlainString();
    return sign + (plain.indexOf('.') >= 0 ? plain : plain + ".0");
  }
}
