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
import org.apache.qpid.proton.engine.Transport;

/**
 * Drives the I/O of an AMQP connection and hands its events over in batches.
 *
 * <p>Events are consumed by a single thread: {@link #waitEvents()}, the processing of the batch,
 * then {@link #done(EventBatch)}, in a loop. Only {@link #waitEvents()} blocks.
 */
public interface Proactor extends AutoCloseable {

  /**
   * Binds the transport to the connection and starts connecting to the broker.
   *
   * <p>The first batch contains at least the connection initialization event.
   *
   * @param host the broker host
   * @param port the broker port
   * @param connection the engine connection
   * @param transport the engine transport, prepared by the caller (SASL)
   */
  void connect(String host, int port, Connection connection, Transport transport);

  /**
   * Waits for the next batch of events.
   *
   * @return the batch, never empty
   * @throws ProducerException if the wait is interrupted or nothing can happen anymore
   */
  EventBatch waitEvents();

  /**
   * Signals the batch has been processed and flushes the resulting output.
   *
   * @param batch the batch returned by the last call to {@link #waitEvents()}
   */
  void done(EventBatch batch);

  /** Releases I/O resources, closing the network connection if still open. */
  @Override
  void close();
}
