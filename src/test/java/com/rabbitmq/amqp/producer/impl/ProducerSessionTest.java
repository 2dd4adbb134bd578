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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.amqp.producer.ProducerParameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ProducerSessionTest {

  static ProducerSession session(int messageCount) {
    return new ProducerSession(new ProducerParameters().messageCount(messageCount));
  }

  @Test
  void newSessionShouldHaveDefaults() {
    ProducerSession session = session(10);
    assertThat(session.host()).isEqualTo("localhost");
    assertThat(session.port()).isEqualTo(5672);
    assertThat(session.topicPrefix()).isEqualTo("topic://");
    assertThat(session.topic()).isEqualTo("my_topic");
    assertThat(session.containerId()).startsWith("producer:");
    assertThat(session.state()).isEqualTo(ProducerState.INIT);
    assertThat(session.exitCode()).isEqualTo(ProducerSession.EXIT_SUCCESS);
    assertThat(session.address()).isNull();
  }

  @Test
  void invalidParametersShouldBeRejected() {
    assertThatThrownBy(() -> session(-1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void countersShouldStayConsistent() {
    ProducerSession session = session(2);
    assertThat(session.hasMessagesToSend()).isTrue();
    assertThatThrownBy(session::acknowledge).isInstanceOf(IllegalStateException.class);
    assertThat(session.nextSequence()).isEqualTo(1);
    assertThat(session.nextSequence()).isEqualTo(2);
    assertThat(session.hasMessagesToSend()).isFalse();
    assertThatThrownBy(session::nextSequence).isInstanceOf(IllegalStateException.class);
    assertThat(session.acknowledge()).isEqualTo(1);
    assertThat(session.allAcknowledged()).isFalse();
    assertThat(session.acknowledge()).isEqualTo(2);
    assertThat(session.allAcknowledged()).isTrue();
    assertThatThrownBy(session::acknowledge).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void zeroMessagesAreAllAcknowledgedFromTheStart() {
    ProducerSession session = session(0);
    assertThat(session.hasMessagesToSend()).isFalse();
    assertThat(session.allAcknowledged()).isTrue();
  }

  @Test
  void topicPrefixCanBeNegotiatedOnlyOnce() {
    ProducerSession session = session(1);
    assertThat(session.topicPrefixNegotiated()).isFalse();
    session.negotiatedTopicPrefix("acme/");
    assertThat(session.topicPrefix()).isEqualTo("acme/");
    assertThat(session.topicPrefixNegotiated()).isTrue();
    assertThatThrownBy(() -> session.negotiatedTopicPrefix("other/"))
        .isInstanceOf(IllegalStateException.class);
    assertThat(session.topicPrefix()).isEqualTo("acme/");
  }

  @Test
  void addressCanBeSetOnlyOnce() {
    ProducerSession session = session(1);
    session.address("topic://a");
    assertThatThrownBy(() -> session.address("topic://b"))
        .isInstanceOf(IllegalStateException.class);
    assertThat(session.address()).isEqualTo("topic://a");
  }

  @Test
  void failureIsSticky() {
    ProducerSession session = session(1);
    session.markFailed();
    session.markFailed();
    assertThat(session.failed()).isTrue();
    assertThat(session.exitCode()).isEqualTo(ProducerSession.EXIT_FAILURE);
  }

  @Test
  void closingStates() {
    ProducerSession session = session(1);
    session.state(ProducerState.SENDING);
    assertThat(session.isClosing()).isFalse();
    session.state(ProducerState.CLOSING);
    assertThat(session.isClosing()).isTrue();
    session.state(ProducerState.DONE);
    assertThat(session.isClosing()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 255, 256, 65536, Integer.MAX_VALUE})
  void deliveryTagIsBigEndian(int sequence) {
    byte[] tag = ProducerSession.deliveryTag(sequence);
    assertThat(tag).hasSize(4);
    int decoded =
        ((tag[0] & 0xFF) << 24) | ((tag[1] & 0xFF) << 16) | ((tag[2] & 0xFF) << 8) | (tag[3] & 0xFF);
    assertThat(decoded).isEqualTo(sequence);
  }
}
