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

import static com.rabbitmq.amqp.producer.cli.Utils.OPTION_TO_ENVIRONMENT_VARIABLE;
import static java.lang.String.format;

import com.rabbitmq.amqp.producer.Proactor;
import com.rabbitmq.amqp.producer.ProducerException;
import com.rabbitmq.amqp.producer.ProducerParameters;
import com.rabbitmq.amqp.producer.impl.NettyProactor;
import com.rabbitmq.amqp.producer.impl.TopicProducer;
import com.rabbitmq.amqp.producer.metrics.MicrometerMetricsCollector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "amqp-topic-producer",
    mixinStandardHelpOptions = false,
    showDefaultValues = true,
    description = "Sends messages to an AMQP 1.0 topic and waits for the broker to accept them.")
public class AmqpTopicProducer implements Callable<Integer> {

  static final String METRICS_PREFIX = "rabbitmq.amqp.producer";

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpTopicProducer.class);

  private final PrintWriter out;
  private final PrintWriter err;
  private final Function<ProducerParameters, Proactor> proactorFactory;
  private final Function<String, String> environment;

  @CommandLine.Option(
      names = {"--host", "-a"},
      description = "host of the broker",
      defaultValue = "localhost")
  private String host;

  @CommandLine.Option(
      names = {"--port", "-p"},
      description = "AMQP port of the broker",
      defaultValue = "5672",
      converter = Utils.PortTypeConverter.class)
  private int port;

  @CommandLine.Option(
      names = {"--count", "-c"},
      description = "number of messages to send",
      defaultValue = "10",
      converter = Utils.NotNegativeIntegerTypeConverter.class)
  private int count;

  @CommandLine.Option(
      names = {"--topic", "-t"},
      description = "topic to send to",
      defaultValue = "my_topic")
  private String topic;

  @CommandLine.Option(
      names = {"--topic-prefix", "-tp"},
      description =
          "prefix of the target address, "
              + "replaced by the prefix the broker advertises if any",
      defaultValue = "topic://")
  private String topicPrefix;

  @CommandLine.Option(
      names = {"--container-id", "-i"},
      description = "container ID of the connection, default is producer:<pid>")
  private String containerId;

  @CommandLine.Option(
      names = {"--username", "-u"},
      description = "username for PLAIN authentication, ANONYMOUS is used if not set")
  private String username;

  @CommandLine.Option(
      names = {"--password", "-P"},
      description = "password for PLAIN authentication")
  private String password;

  @CommandLine.Option(
      names = {"--connect-timeout", "-ct"},
      description = "TCP connection timeout in seconds",
      defaultValue = "30",
      converter = Utils.PositiveIntegerTypeConverter.class)
  private int connectTimeout;

  @CommandLine.Option(
      names = {"--metrics-summary", "-ms"},
      description = "print published, confirmed and errored counts at the end",
      defaultValue = "false")
  private boolean metricsSummary;

  @CommandLine.Option(
      names = {"--environment-variables", "-env"},
      description = "show usage with environment variables",
      defaultValue = "false")
  private boolean environmentVariables;

  @CommandLine.Option(
      names = {"--help", "-h"},
      usageHelp = true,
      description = "show this help message and exit")
  private boolean help;

  // for picocli and environment variable assignment
  public AmqpTopicProducer() {
    this(null, null, null, null);
  }

  AmqpTopicProducer(
      PrintStream consoleOut,
      PrintStream consoleErr,
      Function<ProducerParameters, Proactor> proactorFactory,
      Function<String, String> environment) {
    if (consoleOut == null) {
      consoleOut = System.out;
    }
    if (consoleErr == null) {
      consoleErr = System.err;
    }
    this.out = new PrintWriter(consoleOut, true);
    this.err = new PrintWriter(consoleErr, true);
    this.proactorFactory = proactorFactory;
    this.environment = environment == null ? System::getenv : environment;
  }

  public static void main(String[] args) throws IOException {
    LogUtils.configureLog();
    int exitCode = run(args, System.out, System.err, null, null);
    System.exit(exitCode);
  }

  static int run(
      String[] args,
      PrintStream consoleOut,
      PrintStream consoleErr,
      Function<ProducerParameters, Proactor> proactorFactory,
      Function<String, String> environment) {
    AmqpTopicProducer command =
        new AmqpTopicProducer(consoleOut, consoleErr, proactorFactory, environment);
    CommandLine commandLine =
        new CommandLine(command).setOut(command.out).setErr(command.err);
    return commandLine.execute(args);
  }

  @Override
  public Integer call() throws Exception {
    if (this.environmentVariables) {
      new CommandLine(Utils.buildCommandSpec(this)).usage(this.out);
      return CommandLine.ExitCode.OK;
    }
    overridePropertiesWithEnvironmentVariables();

    MeterRegistry meterRegistry = new SimpleMeterRegistry();
    ProducerParameters parameters =
        new ProducerParameters()
            .host(this.host)
            .port(this.port)
            .username(this.username)
            .password(this.password)
            .topic(this.topic)
            .topicPrefix(this.topicPrefix)
            .messageCount(this.count)
            .metricsCollector(new MicrometerMetricsCollector(meterRegistry, METRICS_PREFIX));
    if (this.containerId != null) {
      parameters.containerId(this.containerId);
    }
    try {
      parameters.validate();
    } catch (IllegalArgumentException e) {
      this.err.println(e.getMessage());
      return CommandLine.ExitCode.USAGE;
    }

    Proactor proactor =
        this.proactorFactory == null
            ? new NettyProactor(
                parameters.metricsCollector(), Duration.ofSeconds(this.connectTimeout))
            : this.proactorFactory.apply(parameters);
    int exitCode;
    try {
      exitCode = new TopicProducer(parameters, proactor, this.out, this.err).run();
    } catch (ProducerException e) {
      LOGGER.warn("Producer run failed", e);
      this.err.println("Error: " + e.getMessage());
      exitCode = 1;
    }
    if (this.metricsSummary) {
      printMetricsSummary(meterRegistry);
    }
    LOGGER.debug("Exiting with code {}", exitCode);
    return exitCode;
  }

  private void printMetricsSummary(MeterRegistry registry) {
    this.out.println(
        format(
            "published: %d, confirmed: %d, errored: %d",
            counterValue(registry, "published"),
            counterValue(registry, "confirmed"),
            counterValue(registry, "errored")));
  }

  private static long counterValue(MeterRegistry registry, String name) {
    return (long) registry.get(METRICS_PREFIX + "." + name).counter().count();
  }

  private void overridePropertiesWithEnvironmentVariables() throws Exception {
    Function<String, String> optionToEnvMappings =
        OPTION_TO_ENVIRONMENT_VARIABLE
            .andThen(Utils.environmentVariablePrefix(this.environment))
            .andThen(this.environment);
    Utils.assignValuesToCommand(this, optionToEnvMappings);
  }
}
