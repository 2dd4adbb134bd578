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

import com.rabbitmq.amqp.producer.EventBatch;
import com.rabbitmq.amqp.producer.Proactor;
import com.rabbitmq.amqp.producer.ProducerException;
import com.rabbitmq.amqp.producer.ProducerParameters;
import com.rabbitmq.amqp.producer.ProtocolEvent;
import java.io.PrintWriter;
import java.util.function.Supplier;
import org.apache.qpid.proton.Proton;
import org.apache.qpid.proton.engine.Sasl;
import org.apache.qpid.proton.engine.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a number of messages to a topic over one AMQP connection and waits for their
 * acknowledgment.
 *
 * <p>The run happens on the calling thread and returns once the proactor has nothing left to
 * do.
 */
public final class TopicProducer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopicProducer.class);

  private final ProducerSession session;
  private final Proactor proactor;
  private final Supplier<Transport> transportFactory;
  private final PrintWriter out;
  private final PrintWriter err;

  public TopicProducer(
      ProducerParameters parameters, Proactor proactor, PrintWriter out, PrintWriter err) {
    this(parameters, proactor, TopicProducer::saslTransport, out, err);
  }

  TopicProducer(
      ProducerParameters parameters,
      Proactor proactor,
      Supplier<Transport> transportFactory,
      PrintWriter out,
      PrintWriter err) {
    this.session = new ProducerSession(parameters);
    this.proactor = proactor;
    this.transportFactory = transportFactory;
    this.out = out;
    this.err = err;
  }

  static Transport saslTransport() {
    Transport transport = Proton.transport();
    Sasl sasl = transport.sasl();
    sasl.client();
    // credentials switch this to PLAIN when the connection initializes
    sasl.setMechanisms("ANONYMOUS");
    return transport;
  }

  /**
   * Runs the producer.
   *
   * @return the exit code, 0 if all messages were sent and acknowledged, 1 otherwise
   * @throws ProducerException if an unrecoverable error occurs
   */
  public int run() {
    ProducerStateMachine stateMachine = new ProducerStateMachine(session, out, err);
    try {
      LOGGER.debug("Starting producer to {}:{}", session.host(), session.port());
      proactor.connect(
          session.host(), session.port(), Proton.connection(), transportFactory.get());
      loop(proactor, stateMachine);
      LOGGER.debug("Producer run over: {}", session);
    } catch (ProducerException e) {
      session.markFailed();
      throw e;
    } finally {
      proactor.close();
      out.flush();
      err.flush();
    }
    return session.exitCode();
  }

  static void loop(Proactor proactor, ProducerStateMachine stateMachine) {
    while (true) {
      EventBatch batch = proactor.waitEvents();
      ProtocolEvent event;
      while ((event = batch.next()) != null) {
        if (!stateMachine.handle(event)) {
          return;
        }
      }
      proactor.done(batch);
    }
  }

  public ProducerSession session() {
    return session;
  }
}
