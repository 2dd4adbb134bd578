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

import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.engine.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks up the topic prefix some brokers advertise in their connection properties.
 *
 * <p>Solace PubSub+ for example advertises its prefix with the {@code topic-prefix} key in the
 * open frame. The property is optional: when it is missing or unusable the configured prefix is
 * kept and the connection goes on.
 */
final class TopicPrefixNegotiator {

  static final Symbol TOPIC_PREFIX_KEY = Symbol.valueOf("topic-prefix");

  /** Size of the prefix scratch area, terminating byte included. */
  static final int MAX_TOPIC_PREFIX_SIZE = 255;

  private static final Logger LOGGER = LoggerFactory.getLogger(TopicPrefixNegotiator.class);

  private TopicPrefixNegotiator() {}

  static Outcome maybeUpdatePrefix(ProducerSession session, Connection connection) {
    Map<Symbol, Object> properties;
    try {
      properties = connection.getRemoteProperties();
    } catch (RuntimeException e) {
      LOGGER.debug("Could not read remote connection properties: {}", e.getMessage());
      return Outcome.ABSENT;
    }
    return maybeUpdatePrefix(session, properties);
  }

  static Outcome maybeUpdatePrefix(ProducerSession session, Map<Symbol, Object> properties) {
    if (properties == null || !properties.containsKey(TOPIC_PREFIX_KEY)) {
      LOGGER.debug(
          "No topic prefix advertised by the broker, using '{}'", session.topicPrefix());
      return Outcome.ABSENT;
    }
    Object value = properties.get(TOPIC_PREFIX_KEY);
    String prefix;
    if (value instanceof String) {
      prefix = (String) value;
    } else if (value instanceof Symbol) {
      prefix = value.toString();
    } else {
      LOGGER.warn(
          "Broker advertised a topic prefix that is not a string ({}), keeping '{}'",
          value == null ? "null" : value.getClass().getSimpleName(),
          session.topicPrefix());
      return Outcome.UNUSABLE;
    }
    if (prefix.getBytes(StandardCharsets.UTF_8).length >= MAX_TOPIC_PREFIX_SIZE) {
      LOGGER.warn(
          "Broker advertised a topic prefix longer than {} bytes, keeping '{}'",
          MAX_TOPIC_PREFIX_SIZE - 1,
          session.topicPrefix());
      return Outcome.UNUSABLE;
    }
    LOGGER.info("Using topic prefix '{}' advertised by the broker", prefix);
    session.negotiatedTopicPrefix(prefix);
    return Outcome.UPDATED;
  }

  enum Outcome {
    UPDATED,
    ABSENT,
    UNUSABLE
  }
}
