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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.LoggerFactory;

final class LogUtils {

  static final String LOGGERS_PROPERTY = "amqp.producer.loggers";
  static final String LOGGERS_ENVIRONMENT_VARIABLE = "AMQP_PRODUCER_LOGGERS";

  private LogUtils() {}

  static void configureLog() throws IOException {
    String loggers =
        System.getProperty(LOGGERS_PROPERTY) == null
            ? System.getenv(LOGGERS_ENVIRONMENT_VARIABLE)
            : System.getProperty(LOGGERS_PROPERTY);
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    InputStream configurationFile = AmqpTopicProducer.class.getResourceAsStream("/logback.xml");
    if (configurationFile == null) {
      return;
    }
    try {
      String configuration =
          processConfigurationFile(configurationFile, convertKeyValuePairs(loggers));
      JoranConfigurator configurator = new JoranConfigurator();
      configurator.setContext(context);
      context.reset();
      configurator.doConfigure(
          new ByteArrayInputStream(configuration.getBytes(StandardCharsets.UTF_8)));
    } catch (JoranException je) {
      // StatusPrinter will handle this
    } finally {
      configurationFile.close();
    }
    StatusPrinter.printInCaseOfErrorsOrWarnings(context);
  }

  /**
   * Parses logger settings like <code>com.rabbitmq.amqp.producer=debug,io.netty=info</code>.
   */
  static Map<String, Object> convertKeyValuePairs(String arg) {
    if (arg == null || arg.trim().isEmpty()) {
      return null;
    }
    Map<String, Object> properties = new LinkedHashMap<>();
    for (String entry : arg.split(",")) {
      String[] keyValue = entry.trim().split("=");
      if (keyValue.length != 2) {
        throw new IllegalArgumentException("Invalid logger setting: " + entry);
      }
      properties.put(keyValue[0].trim(), keyValue[1].trim());
    }
    return properties;
  }

  static String processConfigurationFile(InputStream configurationFile, Map<String, Object> loggers)
      throws IOException {
    StringBuilder loggersConfiguration = new StringBuilder();
    if (loggers != null) {
      for (Map.Entry<String, Object> logger : loggers.entrySet()) {
        loggersConfiguration.append(
            String.format(
                "\t<logger name=\"%s\" level=\"%s\" />%s",
                logger.getKey(),
                logger.getValue().toString(),
                System.getProperty("line.separator")));
      }
    }

    BufferedReader in =
        new BufferedReader(new InputStreamReader(configurationFile, StandardCharsets.UTF_8));
    final int bufferSize = 1024;
    final char[] buffer = new char[bufferSize];
    StringBuilder builder = new StringBuilder();
    int charsRead;
    while ((charsRead = in.read(buffer, 0, buffer.length)) > 0) {
      builder.append(buffer, 0, charsRead);
    }

    return builder.toString().replace("${loggers}", loggersConfiguration);
  }
}
