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
package com.rabbitmq.amqp.producer.metrics;

/**
 * Callbacks to record producer activity.
 *
 * <p>Implementations are called from the thread that runs the producer event loop, they must
 * not block.
 */
public interface MetricsCollector {

  void openConnection();

  void closeConnection();

  void publish(int count);

  void publishConfirm(int count);

  void publishError(int count);

  void writtenBytes(int writtenBytes);

  void readBytes(int readBytes);
}
