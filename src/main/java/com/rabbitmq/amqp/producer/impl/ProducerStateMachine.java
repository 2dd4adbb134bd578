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

import static java.lang.String.format;

import com.rabbitmq.amqp.producer.ProtocolEvent;
import com.rabbitmq.amqp.producer.codec.SequenceMessageEncoder.EncodedMessage;
import java.io.PrintWriter;
import java.util.Optional;
import org.apache.qpid.proton.amqp.messaging.Accepted;
import org.apache.qpid.proton.amqp.messaging.Rejected;
import org.apache.qpid.proton.amqp.messaging.Target;
import org.apache.qpid.proton.amqp.transport.DeliveryState;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.apache.qpid.proton.engine.Connection;
import org.apache.qpid.proton.engine.Delivery;
import org.apache.qpid.proton.engine.Link;
import org.apache.qpid.proton.engine.Sender;
import org.apache.qpid.proton.engine.Session;
import org.apache.qpid.proton.engine.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reacts to the protocol events of the producer connection.
 *
 * <p>Opens the connection, then a session and a sending link to the topic address, sends
 * messages as long as the broker grants credit, counts acknowledgments and closes the
 * connection once all messages are accepted or as soon as something goes wrong. Each event is
 * handled to completion before the next one, on a single thread.
 */
public final class ProducerStateMachine {

  static final String LINK_NAME = "my_sender";

  private static final Logger LOGGER = LoggerFactory.getLogger(ProducerStateMachine.class);

  private final ProducerSession session;
  private final ConditionReporter conditionReporter;
  private final PrintWriter out;
  private final PrintWriter err;
  private boolean connectionOpened = false;
  private boolean transportReported = false;

  public ProducerStateMachine(ProducerSession session, PrintWriter out, PrintWriter err) {
    this.session = session;
    this.conditionReporter = new ConditionReporter(session, err);
    this.out = out;
    this.err = err;
  }

  /**
   * Handles an event.
   *
   * @param event the event
   * @return true to keep going, false when the run is over
   */
  public boolean handle(ProtocolEvent event) {
    LOGGER.trace("Handling {} in state {}", event.label(), session.state());
    switch (event.kind()) {
      case CONNECTION_INIT:
        onConnectionInit(event);
        return true;
      case CONNECTION_REMOTE_OPEN:
        return onConnectionRemoteOpen(event);
      case LINK_FLOW:
        onLinkFlow(event);
        return true;
      case DELIVERY:
        onDelivery(event);
        return true;
      case TRANSPORT_CLOSED:
        onTransportClosed(event);
        return true;
      case CONNECTION_REMOTE_CLOSE:
        onRemoteClose(event, event.connection().getRemoteCondition());
        return true;
      case SESSION_REMOTE_CLOSE:
        onRemoteClose(event, event.event().getSession().getRemoteCondition());
        return true;
      case LINK_REMOTE_CLOSE:
        onRemoteClose(event, event.event().getLink().getRemoteCondition());
        return true;
      case LINK_REMOTE_DETACH:
        onRemoteClose(event, event.event().getLink().getRemoteCondition());
        return true;
      case PROACTOR_INACTIVE:
        LOGGER.debug("No more work, stopping: {}", session);
        if (!transportReported && event.transport() != null) {
          // the transport went away without a TRANSPORT_CLOSED event
          conditionReporter.report(event, event.transport().getCondition());
          transportReported = true;
        }
        connectionGone();
        if (!session.allAcknowledged() && !session.failed()) {
          LOGGER.warn("Connection gone before all messages were acknowledged: {}", session);
          session.markFailed();
        }
        session.state(ProducerState.DONE);
        return false;
      default:
        return true;
    }
  }

  private void onConnectionInit(ProtocolEvent event) {
    Connection connection = event.connection();
    if (session.username() != null) {
      Transport transport = event.event().getTransport();
      if (transport == null) {
        LOGGER.warn("No transport bound to the connection, cannot set credentials");
      } else {
        LOGGER.debug("Using PLAIN authentication with user '{}'", session.username());
        transport
            .sasl()
            .plain(session.username(), session.password() == null ? "" : session.password());
      }
    }
    connection.setContainer(session.containerId());
    connection.open();
    session.state(ProducerState.OPENING);
  }

  private boolean onConnectionRemoteOpen(ProtocolEvent event) {
    Connection connection = event.connection();
    session.metricsCollector().openConnection();
    connectionOpened = true;
    TopicPrefixNegotiator.maybeUpdatePrefix(session, connection);
    Session amqpSession = connection.session();
    amqpSession.open();
    Sender sender = amqpSession.sender(LINK_NAME);
    Optional<String> address =
        DestinationAddressResolver.resolve(session.topicPrefix(), session.topic());
    if (!address.isPresent()) {
      err.println(
          format(
              "address '%s%s' exceeds the maximum length of %d bytes",
              session.topicPrefix(),
              session.topic(),
              DestinationAddressResolver.MAX_ADDRESS_LENGTH));
      LOGGER.warn("Cannot resolve target address, aborting");
      session.markFailed();
      session.state(ProducerState.DONE);
      return false;
    }
    session.address(address.get());
    out.println(format("setting amqp topic:'%s'", session.address()));
    Target target = new Target();
    target.setAddress(session.address());
    sender.setTarget(target);
    sender.open();
    session.state(ProducerState.LINK_PENDING);
    return true;
  }

  private void onLinkFlow(ProtocolEvent event) {
    if (session.isClosing()) {
      LOGGER.debug("Ignoring link credit, the connection is closing");
      return;
    }
    Link link = event.event().getLink();
    if (!(link instanceof Sender)) {
      return;
    }
    Sender sender = (Sender) link;
    int published = 0;
    while (sender.getCredit() > 0 && session.hasMessagesToSend()) {
      int sequence = session.nextSequence();
      sender.delivery(ProducerSession.deliveryTag(sequence));
      EncodedMessage message = session.encoder().encode(sequence);
      sender.send(message.getData(), 0, message.getSize());
      sender.advance();
      published++;
    }
    if (published > 0) {
      LOGGER.debug("Sent {} message(s), {} in total", published, session.sent());
      session.metricsCollector().publish(published);
      session.state(ProducerState.SENDING);
    } else if (!session.hasMessagesToSend() && session.allAcknowledged()) {
      // only reachable with nothing to send at all
      complete(event);
    }
  }

  private void onDelivery(ProtocolEvent event) {
    Delivery delivery = event.event().getDelivery();
    if (delivery == null || delivery.isSettled() || !(delivery.getLink() instanceof Sender)) {
      return;
    }
    DeliveryState state = delivery.getRemoteState();
    if (state == null && !delivery.remotelySettled()) {
      // no outcome yet
      return;
    }
    if (state instanceof Accepted) {
      session.acknowledge();
      session.metricsCollector().publishConfirm(1);
      delivery.settle();
      if (session.allAcknowledged()) {
        complete(event);
      }
    } else {
      err.println("unexpected delivery state " + describe(state));
      session.metricsCollector().publishError(1);
      ErrorCondition condition = state instanceof Rejected ? ((Rejected) state).getError() : null;
      conditionReporter.report(event, condition);
      delivery.settle();
      closeConnection(event);
      session.markFailed();
    }
  }

  private void onTransportClosed(ProtocolEvent event) {
    Transport transport = event.transport();
    if (!transportReported) {
      conditionReporter.report(event, transport == null ? null : transport.getCondition());
      transportReported = true;
    }
    connectionGone();
  }

  private void connectionGone() {
    if (connectionOpened) {
      session.metricsCollector().closeConnection();
      connectionOpened = false;
    }
  }

  private void onRemoteClose(ProtocolEvent event, ErrorCondition condition) {
    conditionReporter.report(event, condition);
    closeConnection(event);
  }

  private void complete(ProtocolEvent event) {
    out.println(format("%d messages sent and acknowledged", session.acknowledged()));
    // keep handling events until the transport is closed
    closeConnection(event);
  }

  private void closeConnection(ProtocolEvent event) {
    Connection connection = event.connection();
    if (connection != null) {
      connection.close();
    }
    session.state(ProducerState.CLOSING);
  }

  private static String describe(DeliveryState state) {
    return state == null ? "none" : state.getClass().getSimpleName();
  }
}
