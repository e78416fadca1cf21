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
package org.beatstore.scheduler.config;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.IStringConverterFactory;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.beatstore.scheduler.app.SchedulerMain;
import org.beatstore.scheduler.config.converters.ModuleClassConverter;
import org.beatstore.scheduler.config.converters.TimeAmountConverter;
import org.beatstore.scheduler.config.types.TimeAmount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses command line options and populates {@link CliOptions}.
 */
public final class CommandLine {

  private static final Logger LOG = LoggerFactory.getLogger(CommandLine.class);

  private CommandLine() {
    // Utility class.
  }

  private static JCommander prepareParser(CliOptions options) {
    JCommander.Builder builder = JCommander.newBuilder()
        .programName(SchedulerMain.class.getName());

    builder.addConverterFactory(new IStringConverterFactory() {
      private Map<Class<?>, Class<? extends IStringConverter<?>>> classConverters =
          ImmutableMap.<Class<?>, Class<? extends IStringConverter<?>>>builder()
              .put(Class.class, ModuleClassConverter.class)
              .put(TimeAmount.class, TimeAmountConverter.class)
              .build();

      @Override
      public Class<? extends IStringConverter<?>> getConverter(Class<?> forType) {
        return classConverters.get(forType);
      }
    });

    builder.addObject(getOptionsObjects(options));
    return builder.build();
  }

  /**
   * Parses command line arguments into a new options object.
   *
   * @param args Command line arguments.
   * @return Parsed options.
   * @throws ParameterException If the arguments are invalid.
   */
  @VisibleForTesting
  public static CliOptions parse(String... args) throws ParameterException {
    CliOptions options = new CliOptions();
    prepareParser(options).parse(args);
    return options;
  }

  /**
   * Parses command line arguments, printing usage and exiting on invalid input.
   *
   * @param args Command line arguments.
   * @return Parsed options.
   */
  public static CliOptions parseOptions(String... args) {
    try {
      return parse(args);
    } catch (ParameterException e) {
      prepareParser(new CliOptions()).usage();
      LOG.error(e.getMessage());
      System.exit(1);
      throw new RuntimeException(e);
    }
  }

  @VisibleForTesting
  static List<Object> getOptionsObjects(CliOptions options) {
    ImmutableList.Builder<Object> objects = ImmutableList.builder();

    // Reflect on fields defined in CliOptions to DRY and avoid mistakes of forgetting to add an
    // option field here.
    for (Field field : CliOptions.class.getDeclaredFields()) {
      if (Modifier.isStatic(field.getModifiers())) {
        continue;
      }

      try {
        objects.add(field.get(options));
      } catch (IllegalAccessException e) {
        throw new RuntimeException(e);
      }
    }

    return objects.build();
  }
}
