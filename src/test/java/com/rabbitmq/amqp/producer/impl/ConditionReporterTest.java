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
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.amqp.producer.ProducerParameters;
import com.rabbitmq.amqp.producer.ProtocolEvent;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.apache.qpid.proton.engine.Connection;
import org.apache.qpid.proton.engine.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class ConditionReporterTest {

  @Mock Event event;
  @Mock Connection connection;
  AutoCloseable mocks;
  ProducerSession session;
  StringWriter err;
  ConditionReporter reporter;

  @BeforeEach
  void init() {
    mocks = MockitoAnnotations.openMocks(this);
    when(event.getType()).thenReturn(Event.Type.LINK_REMOTE_CLOSE);
    when(event.getConnection()).thenReturn(connection);
    session = new ProducerSession(new ProducerParameters());
    err = new StringWriter();
    reporter = new ConditionReporter(session, new PrintWriter(err, true));
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  @Test
  void unsetConditionIsIgnored() {
    assertThat(reporter.report(ProtocolEvent.of(event), null)).isFalse();
    assertThat(reporter.report(ProtocolEvent.of(event), new ErrorCondition())).isFalse();
    assertThat(err.toString()).isEmpty();
    assertThat(session.failed()).isFalse();
    verify(connection, never()).close();
  }

  @Test
  void setConditionIsPrintedAndClosesTheConnection() {
    ErrorCondition condition =
        new ErrorCondition(Symbol.valueOf("amqp:not-found"), "no such topic");
    assertThat(reporter.report(ProtocolEvent.of(event), condition)).isTrue();
    assertThat(err.toString())
        .contains("LINK_REMOTE_CLOSE: amqp:not-found: no such topic")
        .doesNotContain("Err info");
    assertThat(session.failed()).isTrue();
    assertThat(session.state()).isEqualTo(ProducerState.CLOSING);
    verify(connection).close();
  }

  @Test
  void infoIsPrintedWhenPresent() {
    ErrorCondition condition =
        new ErrorCondition(Symbol.valueOf("amqp:resource-limit-exceeded"), "too many links");
    condition.setInfo(Collections.singletonMap(Symbol.valueOf("limit"), 10));
    reporter.report(ProtocolEvent.of(event), condition);
    assertThat(err.toString()).contains("Err info: {:limit=10}");
  }

  @Test
  void inactiveEventHasNoConnectionToClose() {
    ErrorCondition condition = new ErrorCondition(Symbol.valueOf("proton:io"), "reset");
    assertThat(reporter.report(ProtocolEvent.inactive(), condition)).isTrue();
    assertThat(err.toString()).contains("PROACTOR_INACTIVE: proton:io: reset");
    assertThat(session.failed()).isTrue();
  }

  @Test
  void formatInfoRendersNestedValues() {
    Map<Object, Object> info = new LinkedHashMap<>();
    info.put(Symbol.valueOf("hostname"), "broker-1");
    info.put("ports", Arrays.asList(5672, 5671));
    info.put(Symbol.valueOf("nested"), Collections.singletonMap("k", Symbol.valueOf("v")));
    assertThat(ConditionReporter.formatInfo(info))
        .isEqualTo("{:hostname=\"broker-1\", \"ports\"=[5672, 5671], :nested={\"k\"=:v}}");
  }

  @Test
  void formatInfoGrowsScratchBufferUntilTextFits() {
    String value = IntStream.range(0, 500).mapToObj(i -> "x").collect(Collectors.joining());
    Map<Symbol, Object> info = Collections.singletonMap(Symbol.valueOf("detail"), value);
    String formatted = ConditionReporter.formatInfo(info, 1);
    assertThat(formatted).isEqualTo("{:detail=\"" + value + "\"}");
  }
}
