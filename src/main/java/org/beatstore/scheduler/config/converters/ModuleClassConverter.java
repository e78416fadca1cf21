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
package org.beatstore.scheduler.config.converters;

import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.BaseConverter;
import com.google.inject.Module;

/**
 * Resolves a fully-qualified class name to a Guice {@link Module} class.
 */
public class ModuleClassConverter extends BaseConverter<Class<?>> {

  public ModuleClassConverter(String optionName) {
    super(optionName);
  }

  @Override
  public Class<?> convert(String value) {
    Class<?> moduleClass;
    try {
      moduleClass = Class.forName(value.trim());
    } catch (ClassNotFoundException e) {
      throw new ParameterException(getErrorString(value, "a class on the classpath"), e);
    }
    if (!Module.class.isAssignableFrom(moduleClass)) {
      throw new ParameterException(getErrorString(value, "a class implementing " + Module.class));
    }
    return moduleClass;
  }
}
