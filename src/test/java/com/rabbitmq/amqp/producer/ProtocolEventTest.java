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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.rabbitmq.amqp.producer.ProtocolEvent.Kind;
import org.apache.qpid.proton.engine.Connection;
import org.apache.qpid.proton.engine.Event;
import org.apache.qpid.proton.engine.Transport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ProtocolEventTest {

  @ParameterizedTest
  @CsvSource({
    "CONNECTION_INIT,CONNECTION_INIT",
    "CONNECTION_REMOTE_OPEN,CONNECTION_REMOTE_OPEN",
    "LINK_FLOW,LINK_FLOW",
    "DELIVERY,DELIVERY",
    "TRANSPORT_CLOSED,TRANSPORT_CLOSED",
    "CONNECTION_REMOTE_CLOSE,CONNECTION_REMOTE_CLOSE",
    "SESSION_REMOTE_CLOSE,SESSION_REMOTE_CLOSE",
    "LINK_REMOTE_CLOSE,LINK_REMOTE_CLOSE",
    "LINK_REMOTE_DETACH,LINK_REMOTE_DETACH",
    "CONNECTION_BOUND,OTHER",
    "LINK_LOCAL_OPEN,OTHER",
    "TRANSPORT_ERROR,OTHER"
  })
  void engineEventTypesShouldMapToKinds(Event.Type type, Kind expected) {
    assertThat(Kind.of(type)).isEqualTo(expected);
  }

  @Test
  void nullTypeIsOther() {
    assertThat(Kind.of(null)).isEqualTo(Kind.OTHER);
  }

  @Test
  void engineEventShouldExposeConnectionAndLabel() {
    Event event = mock(Event.class);
    Connection connection = mock(Connection.class);
    when(event.getType()).thenReturn(Event.Type.LINK_FLOW);
    when(event.getConnection()).thenReturn(connection);
    ProtocolEvent protocolEvent = ProtocolEvent.of(event);
    assertThat(protocolEvent.kind()).isEqualTo(Kind.LINK_FLOW);
    assertThat(protocolEvent.connection()).isSameAs(connection);
    assertThat(protocolEvent.event()).isSameAs(event);
    assertThat(protocolEvent.label()).isEqualTo("LINK_FLOW");
  }

  @Test
  void inactiveEventHasNoEngineEvent() {
    ProtocolEvent inactive = ProtocolEvent.inactive();
    assertThat(inactive.kind()).isEqualTo(Kind.PROACTOR_INACTIVE);
    assertThat(inactive.event()).isNull();
    assertThat(inactive.connection()).isNull();
    assertThat(inactive.label()).isEqualTo("PROACTOR_INACTIVE");
    assertThat(ProtocolEvent.inactive()).isSameAs(inactive);
  }

  @Test
  void inactiveEventCanCarryTheTransportOfTheConnection() {
    Transport transport = mock(Transport.class);
    ProtocolEvent inactive = ProtocolEvent.inactive(transport);
    assertThat(inactive.kind()).isEqualTo(Kind.PROACTOR_INACTIVE);
    assertThat(inactive.transport()).isSameAs(transport);
    assertThat(inactive.connection()).isNull();
    assertThat(ProtocolEvent.inactive(null)).isSameAs(ProtocolEvent.inactive());
  }
}
