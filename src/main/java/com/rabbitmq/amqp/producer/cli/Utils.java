// Copyright (c) 2024 VMware, Inc. or its affiliates.  All rights reserved.
//
// This software, the RabbitMQ AMQP 1.0 topic producer, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.amqp.producer.cli;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Option;

final class Utils {

  static final String ENVIRONMENT_VARIABLE_PREFIX_NAME = "AMQP_PRODUCER_ENV_PREFIX";

  static final Function<String, String> OPTION_TO_ENVIRONMENT_VARIABLE =
      option -> {
        if (option.startsWith("--")) {
          return option.replace("--", "").replace('-', '_').toUpperCase(Locale.ENGLISH);
        } else if (option.startsWith("-")) {
          return option.substring(1).replace('-', '_').toUpperCase(Locale.ENGLISH);
        } else {
          return option.replace('-', '_').toUpperCase(Locale.ENGLISH);
        }
      };

  private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

  private Utils() {}

  static Function<String, String> environmentVariablePrefix(Function<String, String> environment) {
    return name -> {
      String prefix = environment.apply(ENVIRONMENT_VARIABLE_PREFIX_NAME);
      if (prefix == null || prefix.trim().isEmpty()) {
        return name;
      }
      if (prefix.endsWith("_")) {
        return prefix + name;
      } else {
        return prefix + "_" + name;
      }
    };
  }

  static void assignValuesToCommand(Object command, Function<String, String> optionMapping)
      throws Exception {
    LOGGER.debug("Assigning values to command {}", command.getClass());
    Collection<String> arguments = new ArrayList<>();
    Collection<Field> fieldsToAssign = new ArrayList<>();
    for (Field field : command.getClass().getDeclaredFields()) {
      Option option = field.getAnnotation(Option.class);
      if (option == null || option.usageHelp()) {
        continue;
      }
      String longOption = longestName(option);
      LOGGER.debug("Looking up new value for option {}", longOption);
      String newValue = optionMapping.apply(longOption);

      if (newValue == null) {
        continue;
      }
      LOGGER.debug("New value found for option {} (field {})", longOption, field.getName());
      fieldsToAssign.add(field);
      if (field.getType().equals(boolean.class) || field.getType().equals(Boolean.class)) {
        if (Boolean.parseBoolean(newValue)) {
          arguments.add(longOption);
        }
      } else {
        arguments.add(longOption);
        arguments.add(newValue);
      }
    }
    if (fieldsToAssign.size() > 0) {
      Constructor<?> defaultConstructor = command.getClass().getConstructor();
      Object commandBuffer = defaultConstructor.newInstance();
      commandBuffer = CommandLine.populateCommand(commandBuffer, arguments.toArray(new String[0]));
      for (Field field : fieldsToAssign) {
        field.setAccessible(true);
        field.set(command, field.get(commandBuffer));
      }
    }
  }

  static CommandSpec buildCommandSpec(Object command) {
    Command commandAnnotation = command.getClass().getAnnotation(Command.class);
    CommandSpec spec = CommandSpec.create();
    spec.name(commandAnnotation.name());
    spec.mixinStandardHelpOptions(commandAnnotation.mixinStandardHelpOptions());
    for (Field f : command.getClass().getDeclaredFields()) {
      Option annotation = f.getAnnotation(Option.class);
      if (annotation == null || annotation.usageHelp()) {
        continue;
      }
      String name = OPTION_TO_ENVIRONMENT_VARIABLE.apply(longestName(annotation));
      spec.addOption(
          OptionSpec.builder(name)
              .type(f.getType())
              .description(annotation.description())
              .paramLabel("<" + name.replace("_", "-") + ">")
              .defaultValue(annotation.defaultValue())
              .showDefaultValue(annotation.showDefaultValue())
              .build());
    }
    return spec;
  }

  private static String longestName(Option option) {
    return Arrays.stream(option.names())
        .sorted(Comparator.comparingInt(String::length).reversed())
        .findFirst()
        .get();
  }

  private abstract static class RangeIntegerTypeConverter
      implements CommandLine.ITypeConverter<Integer> {

    private final int min, max;

    private RangeIntegerTypeConverter(int min, int max) {
      this.min = min;
      this.max = max;
    }

    @Override
    public Integer convert(String input) {
      try {
        Integer value = Integer.valueOf(input);
        if (value < this.min || value > this.max) {
          throw new IllegalArgumentException();
        }
        return value;
      } catch (Exception e) {
        throw new CommandLine.TypeConversionException(
            input + " must be an integer between " + this.min + " and " + this.max);
      }
    }
  }

  static class PortTypeConverter extends RangeIntegerTypeConverter {

    PortTypeConverter() {
      super(1, 65535);
    }
  }

  static class PositiveIntegerTypeConverter implements CommandLine.ITypeConverter<Integer> {

    @Override
    public Integer convert(String input) {
      try {
        Integer value = Integer.valueOf(input);
        if (value <= 0) {
          throw new IllegalArgumentException();
        }
        return value;
      } catch (Exception e) {
        throw new CommandLine.TypeConversionException(input + " is not a positive integer");
      }
    }
  }

  static class NotNegativeIntegerTypeConverter implements CommandLine.ITypeConverter<Integer> {

    @Override
    public Integer convert(String input) {
      try {
        Integer value = Integer.valueOf(input);
        if (value < 0) {
          throw new IllegalArgumentException();
        }
        return value;
      } catch (Exception e) {
        throw new CommandLine.TypeConversionException(input + " is not a non-negative integer");
      }
    }
  }
}
