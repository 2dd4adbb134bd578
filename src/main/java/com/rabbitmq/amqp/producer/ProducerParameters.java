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
package com.rabbitmq.amqp.producer;

import com.rabbitmq.amqp.producer.metrics.MetricsCollector;
import com.rabbitmq.amqp.producer.metrics.NoOpMetricsCollector;

/** Settings of a producer run. */
public class ProducerParameters {

  public static final int DEFAULT_PORT = 5672;
  public static final String DEFAULT_TOPIC_PREFIX = "topic://";
  public static final String DEFAULT_TOPIC = "my_topic";
  public static final int DEFAULT_MESSAGE_COUNT = 10;

  private String host = "localhost";
  private int port = DEFAULT_PORT;
  private String username;
  private String password;
  private String topic = DEFAULT_TOPIC;
  private String topicPrefix = DEFAULT_TOPIC_PREFIX;
  private String containerId = defaultContainerId();
  private int messageCount = DEFAULT_MESSAGE_COUNT;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.SINGLETON;

  static String defaultContainerId() {
    return "producer:" + ProcessHandle.current().pid();
  }

  public ProducerParameters host(String host) {
    this.host = host;
    return this;
  }

  public ProducerParameters port(int port) {
    this.port = port;
    return this;
  }

  public ProducerParameters username(String username) {
    this.username = username;
    return this;
  }

  public ProducerParameters password(String password) {
    this.password = password;
    return this;
  }

  /**
   * The topic to send to, without prefix.
   *
   * @param topic the topic name
   * @return this parameters instance
   */
  public ProducerParameters topic(String topic) {
    this.topic = topic;
    return this;
  }

  /**
   * The prefix to prepend to the topic name.
   *
   * <p>A prefix advertised by the broker in its connection properties takes precedence.
   *
   * @param topicPrefix the prefix
   * @return this parameters instance
   */
  public ProducerParameters topicPrefix(String topicPrefix) {
    this.topicPrefix = topicPrefix;
    return this;
  }

  public ProducerParameters containerId(String containerId) {
    this.containerId = containerId;
    return this;
  }

  public ProducerParameters messageCount(int messageCount) {
    this.messageCount = messageCount;
    return this;
  }

  public ProducerParameters metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public String topic() {
    return topic;
  }

  public String topicPrefix() {
    return topicPrefix;
  }

  public String containerId() {
    return containerId;
  }

  public int messageCount() {
    return messageCount;
  }

  public MetricsCollector metricsCollector() {
    return metricsCollector;
  }

  /**
   * Checks the consistency of the parameters.
   *
   * @return this parameters instance
   * @throws IllegalArgumentException if a parameter is invalid
   */
  public ProducerParameters validate() {
    if (isBlank(host)) {
      throw new IllegalArgumentException("Host cannot be blank");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("Port must be between 1 and 65535: " + port);
    }
    if (messageCount < 0) {
      throw new IllegalArgumentException("Message count cannot be negative: " + messageCount);
    }
    if (isBlank(topic)) {
      throw new IllegalArgumentException("Topic cannot be blank");
    }
    if (topicPrefix == null) {
      throw new IllegalArgumentException("Topic prefix cannot be null");
    }
    if (isBlank(containerId)) {
      throw new IllegalArgumentException("Container ID cannot be blank");
    }
    if (password != null && username == null) {
      throw new IllegalArgumentException("A password requires a username");
    }
    if (metricsCollector == null) {
      throw new IllegalArgumentException("Metrics collector cannot be null");
    }
    return this;
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
