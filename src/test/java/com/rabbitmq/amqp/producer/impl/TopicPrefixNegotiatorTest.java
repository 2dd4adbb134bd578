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

import static com.rabbitmq.amqp.producer.impl.TopicPrefixNegotiator.TOPIC_PREFIX_KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.rabbitmq.amqp.producer.ProducerParameters;
import com.rabbitmq.amqp.producer.impl.TopicPrefixNegotiator.Outcome;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.engine.Connection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class TopicPrefixNegotiatorTest {

  @Mock Connection connection;
  AutoCloseable mocks;
  ProducerSession session;

  @BeforeEach
  void init() {
    mocks = MockitoAnnotations.openMocks(this);
    session = new ProducerSession(new ProducerParameters());
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  static Map<Symbol, Object> prefix(Object value) {
    Map<Symbol, Object> properties = new HashMap<>();
    properties.put(Symbol.valueOf("product"), "broker");
    properties.put(TOPIC_PREFIX_KEY, value);
    return properties;
  }

  @Test
  void stringPrefixReplacesConfiguredOne() {
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, prefix("acme/")))
        .isEqualTo(Outcome.UPDATED);
    assertThat(session.topicPrefix()).isEqualTo("acme/");
    assertThat(session.topicPrefixNegotiated()).isTrue();
  }

  @Test
  void symbolPrefixIsAccepted() {
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, prefix(Symbol.valueOf("t/"))))
        .isEqualTo(Outcome.UPDATED);
    assertThat(session.topicPrefix()).isEqualTo("t/");
  }

  @Test
  void emptyPrefixIsAccepted() {
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, prefix("")))
        .isEqualTo(Outcome.UPDATED);
    assertThat(session.topicPrefix()).isEmpty();
  }

  @Test
  void missingPropertyKeepsConfiguredPrefix() {
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, (Map<Symbol, Object>) null))
        .isEqualTo(Outcome.ABSENT);
    assertThat(
            TopicPrefixNegotiator.maybeUpdatePrefix(
                session, Collections.singletonMap(Symbol.valueOf("product"), "broker")))
        .isEqualTo(Outcome.ABSENT);
    assertThat(session.topicPrefix()).isEqualTo("topic://");
    assertThat(session.topicPrefixNegotiated()).isFalse();
  }

  @Test
  void nonStringPropertyIsUnusable() {
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, prefix(42)))
        .isEqualTo(Outcome.UNUSABLE);
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, prefix(null)))
        .isEqualTo(Outcome.UNUSABLE);
    assertThat(session.topicPrefix()).isEqualTo("topic://");
  }

  @Test
  void tooLongPrefixIsUnusable() {
    String longest = IntStream.range(0, 254).mapToObj(i -> "p").collect(Collectors.joining());
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, prefix(longest + "p")))
        .isEqualTo(Outcome.UNUSABLE);
    assertThat(session.topicPrefix()).isEqualTo("topic://");
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, prefix(longest)))
        .isEqualTo(Outcome.UPDATED);
    assertThat(session.topicPrefix()).isEqualTo(longest);
  }

  @Test
  void propertiesAreReadFromTheConnection() {
    when(connection.getRemoteProperties()).thenReturn(prefix("from/connection/"));
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, connection))
        .isEqualTo(Outcome.UPDATED);
    assertThat(session.topicPrefix()).isEqualTo("from/connection/");
  }

  @Test
  void errorReadingPropertiesIsTreatedAsAbsent() {
    when(connection.getRemoteProperties()).thenThrow(new IllegalStateException("decoding"));
    assertThat(TopicPrefixNegotiator.maybeUpdatePrefix(session, connection))
        .isEqualTo(Outcome.ABSENT);
    assertThat(session.topicPrefix()).isEqualTo("topic://");
  }
}
