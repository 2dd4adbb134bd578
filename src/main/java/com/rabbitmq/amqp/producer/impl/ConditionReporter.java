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

import static com.rabbitmq.amqp.producer.codec.OverflowRetry.retryOnOverflow;
import static java.lang.String.format;

import com.rabbitmq.amqp.producer.ProtocolEvent;
import com.rabbitmq.amqp.producer.codec.EncodeBuffer;
import java.io.PrintWriter;
import java.nio.CharBuffer;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.apache.qpid.proton.engine.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports error conditions attached to protocol events.
 *
 * <p>A set condition is printed, fails the run and closes the connection. The event loop keeps
 * going so the close frames can be exchanged.
 */
final class ConditionReporter {

  static final int INFO_SCRATCH_SIZE = 128;

  private static final Logger LOGGER = LoggerFactory.getLogger(ConditionReporter.class);

  private final ProducerSession session;
  private final PrintWriter err;

  ConditionReporter(ProducerSession session, PrintWriter err) {
    this.session = session;
    this.err = err;
  }

  static boolean isSet(ErrorCondition condition) {
    return condition != null && condition.getCondition() != null;
  }

  /**
   * Reports the condition if it is set.
   *
   * @param event the event the condition comes with
   * @param condition the condition, can be null
   * @return true if the condition was set
   */
  boolean report(ProtocolEvent event, ErrorCondition condition) {
    if (!isSet(condition)) {
      return false;
    }
    err.println(
        format(
            "%s: %s: %s", event.label(), condition.getCondition(), condition.getDescription()));
    Map<?, ?> info = condition.getInfo();
    if (info != null && !info.isEmpty()) {
      err.println("Err info: " + formatInfo(info));
    }
    LOGGER.debug("Condition reported on {}: {}", event.label(), condition);
    Connection connection = event.connection();
    if (connection != null) {
      connection.close();
    }
    session.markFailed();
    session.state(ProducerState.CLOSING);
    return true;
  }

  static String formatInfo(Map<?, ?> info) {
    return formatInfo(info, INFO_SCRATCH_SIZE);
  }

  static String formatInfo(Map<?, ?> info, int scratchSize) {
    AtomicReference<CharBuffer> scratch = new AtomicReference<>(CharBuffer.allocate(scratchSize));
    return retryOnOverflow(
        () -> {
          CharBuffer buffer = scratch.get();
          buffer.clear();
          append(buffer, info);
          buffer.flip();
          return buffer.toString();
        },
        () -> scratch.set(CharBuffer.allocate(EncodeBuffer.doubled(scratch.get().capacity()))));
  }

  private static void append(CharBuffer buffer, Object value) {
    if (value instanceof Map) {
      buffer.append('{');
      Iterator<? extends Map.Entry<?, ?>> iterator = ((Map<?, ?>) value).entrySet().iterator();
      while (iterator.hasNext()) {
        Map.Entry<?, ?> entry = iterator.next();
        append(buffer, entry.getKey());
        buffer.append('=');
        append(buffer, entry.getValue());
        if (iterator.hasNext()) {
          buffer.append(", ");
        }
      }
      buffer.append('}');
    } else if (value instanceof Collection) {
      buffer.append('[');
      Iterator<?> iterator = ((Collection<?>) value).iterator();
      while (iterator.hasNext()) {
        append(buffer, iterator.next());
        if (iterator.hasNext()) {
          buffer.append(", ");
        }
      }
      buffer.append(']');
    } else if (value instanceof Symbol) {
      buffer.append(':').append(value.toString());
    } else if (value instanceof String) {
      buffer.append('"').append((String) value).append('"');
    } else {
      buffer.append(String.valueOf(value));
    }
  }
}
