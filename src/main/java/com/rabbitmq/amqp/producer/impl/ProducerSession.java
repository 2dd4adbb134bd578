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
package com.rabbitmq.amqp.producer.impl;

import com.rabbitmq.amqp.producer.ProducerParameters;
import com.rabbitmq.amqp.producer.codec.EncodeBuffer;
import com.rabbitmq.amqp.producer.codec.SequenceMessageEncoder;
import com.rabbitmq.amqp.producer.metrics.MetricsCollector;
import java.nio.ByteBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a producer run: settings, negotiated topic prefix, counters, encode buffer and exit
 * status.
 *
 * <p>Only the event loop thread touches a session, no synchronization is needed. The counters
 * satisfy {@code acknowledged <= sent <= messageCount} at all times.
 */
public final class ProducerSession {

  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_FAILURE = 1;

  private static final Logger LOGGER = LoggerFactory.getLogger(ProducerSession.class);

  private final String host;
  private final int port;
  private final String username;
  private final String password;
  private final String topic;
  private final String containerId;
  private final int messageCount;
  private final MetricsCollector metricsCollector;
  private final EncodeBuffer encodeBuffer = new EncodeBuffer();
  private final SequenceMessageEncoder encoder = new SequenceMessageEncoder(encodeBuffer);

  private String topicPrefix;
  private boolean topicPrefixNegotiated = false;
  private String address;
  private int sent = 0;
  private int acknowledged = 0;
  private int exitCode = EXIT_SUCCESS;
  private ProducerState state = ProducerState.INIT;

  public ProducerSession(ProducerParameters parameters) {
    parameters.validate();
    this.host = parameters.host();
    this.port = parameters.port();
    this.username = parameters.username();
    this.password = parameters.password();
    this.topic = parameters.topic();
    this.topicPrefix = parameters.topicPrefix();
    this.containerId = parameters.containerId();
    this.messageCount = parameters.messageCount();
    this.metricsCollector = parameters.metricsCollector();
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  String username() {
    return username;
  }

  String password() {
    return password;
  }

  String topic() {
    return topic;
  }

  String containerId() {
    return containerId;
  }

  public int messageCount() {
    return messageCount;
  }

  MetricsCollector metricsCollector() {
    return metricsCollector;
  }

  SequenceMessageEncoder encoder() {
    return encoder;
  }

  public String topicPrefix() {
    return topicPrefix;
  }

  /**
   * Replaces the configured topic prefix with the one the broker advertised.
   *
   * <p>The prefix can be negotiated only once per session.
   *
   * @param negotiatedPrefix the advertised prefix
   */
  void negotiatedTopicPrefix(String negotiatedPrefix) {
    if (this.topicPrefixNegotiated) {
      throw new IllegalStateException("Topic prefix already negotiated: " + this.topicPrefix);
    }
    LOGGER.debug("Replacing topic prefix '{}' with '{}'", this.topicPrefix, negotiatedPrefix);
    this.topicPrefix = negotiatedPrefix;
    this.topicPrefixNegotiated = true;
  }

  boolean topicPrefixNegotiated() {
    return topicPrefixNegotiated;
  }

  /**
   * The target address of the sending link.
   *
   * @return the address, null until resolved
   */
  public String address() {
    return address;
  }

  void address(String address) {
    if (this.address != null) {
      throw new IllegalStateException("Address already resolved: " + this.address);
    }
    this.address = address;
  }

  public int sent() {
    return sent;
  }

  public int acknowledged() {
    return acknowledged;
  }

  boolean hasMessagesToSend() {
    return sent < messageCount;
  }

  boolean allAcknowledged() {
    return acknowledged == messageCount;
  }

  /**
   * Counts a new message to send.
   *
   * @return the new value of the sent counter, used as sequence number and delivery tag
   */
  int nextSequence() {
    if (!hasMessagesToSend()) {
      throw new IllegalStateException(
          "All " + messageCount + " messages have already been sent");
    }
    return ++sent;
  }

  /**
   * Counts an accepted message.
   *
   * @return the new value of the acknowledged counter
   */
  int acknowledge() {
    if (acknowledged >= sent) {
      throw new IllegalStateException(
          "Cannot acknowledge more messages than sent (" + sent + ")");
    }
    return ++acknowledged;
  }

  static byte[] deliveryTag(int sequence) {
    return ByteBuffer.allocate(Integer.BYTES).putInt(sequence).array();
  }

  public ProducerState state() {
    return state;
  }

  void state(ProducerState state) {
    if (this.state != state) {
      LOGGER.debug("Producer session state {} -> {}", this.state, state);
      this.state = state;
    }
  }

  boolean isClosing() {
    return state == ProducerState.CLOSING || state == ProducerState.DONE;
  }

  /** Marks the run as failed. A failed run never goes back to success. */
  void markFailed() {
    this.exitCode = EXIT_FAILURE;
  }

  public boolean failed() {
    return exitCode != EXIT_SUCCESS;
  }

  public int exitCode() {
    return exitCode;
  }

  @Override
  public String toString() {
    return "ProducerSession{"
        + "address='"
        + (address == null ? topicPrefix + topic : address)
        + '\''
        + ", sent="
        + sent
        + ", acknowledged="
        + acknowledged
        + ", messageCount="
        + messageCount
        + ", state="
        + state
        + ", exitCode="
        + exitCode
        + '}';
  }
}
