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

/** A group of events returned by {@link Proactor#waitEvents()}. */
public interface EventBatch {

  /**
   * The next event of the batch.
   *
   * <p>Moving to the next event invalidates the previous one.
   *
   * @return the next event, or null if the batch is exhausted
   */
  ProtocolEvent next();
}
