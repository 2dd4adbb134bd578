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

import org.apache.qpid.proton.engine.Connection;
import org.apache.qpid.proton.engine.Event;
import org.apache.qpid.proton.engine.Transport;

/**
 * An event delivered by a {@link Proactor}.
 *
 * <p>Wraps a Proton-J engine event, except for {@link Kind#PROACTOR_INACTIVE}, which the
 * proactor emits itself once the connection is gone. The engine recycles its events: an
 * instance is valid only until the next call to {@link EventBatch#next()}.
 */
public final class ProtocolEvent {

  private static final ProtocolEvent INACTIVE =
      new ProtocolEvent(Kind.PROACTOR_INACTIVE, null, null);

  private final Kind kind;
  private final Event event;
  private final Transport transport;

  private ProtocolEvent(Kind kind, Event event, Transport transport) {
    this.kind = kind;
    this.event = event;
    this.transport = transport;
  }

  public static ProtocolEvent of(Event event) {
    return new ProtocolEvent(Kind.of(event.getType()), event, null);
  }

  public static ProtocolEvent inactive() {
    return INACTIVE;
  }

  /**
   * The inactivity event of a connection.
   *
   * @param transport the transport of the connection that is gone, can be null
   * @return the event
   */
  public static ProtocolEvent inactive(Transport transport) {
    if (transport == null) {
      return INACTIVE;
    }
    return new ProtocolEvent(Kind.PROACTOR_INACTIVE, null, transport);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * The underlying engine event.
   *
   * @return the engine event, null for {@link Kind#PROACTOR_INACTIVE}
   */
  public Event event() {
    return event;
  }

  public Connection connection() {
    return event == null ? null : event.getConnection();
  }

  public Transport transport() {
    return event == null ? transport : event.getTransport();
  }

  public String label() {
    return event == null ? kind.name() : event.getType().name();
  }

  @Override
  public String toString() {
    return "ProtocolEvent{" + label() + "}";
  }

  /** The event kinds the producer reacts to. */
  public enum Kind {
    CONNECTION_INIT,
    CONNECTION_REMOTE_OPEN,
    LINK_FLOW,
    DELIVERY,
    TRANSPORT_CLOSED,
    CONNECTION_REMOTE_CLOSE,
    SESSION_REMOTE_CLOSE,
    LINK_REMOTE_CLOSE,
    LINK_REMOTE_DETACH,
    PROACTOR_INACTIVE,
    OTHER;

    static Kind of(Event.Type type) {
      if (type == null) {
        return OTHER;
      }
      switch (type) {
        case CONNECTION_INIT:
          return CONNECTION_INIT;
        case CONNECTION_REMOTE_OPEN:
          return CONNECTION_REMOTE_OPEN;
        case LINK_FLOW:
          return LINK_FLOW;
        case DELIVERY:
          return DELIVERY;
        case TRANSPORT_CLOSED:
          return TRANSPORT_CLOSED;
        case CONNECTION_REMOTE_CLOSE:
          return CONNECTION_REMOTE_CLOSE;
        case SESSION_REMOTE_CLOSE:
          return SESSION_REMOTE_CLOSE;
        case LINK_REMOTE_CLOSE:
          return LINK_REMOTE_CLOSE;
        case LINK_REMOTE_DETACH:
          return LINK_REMOTE_DETACH;
        default:
          return OTHER;
      }
    }
  }
}
