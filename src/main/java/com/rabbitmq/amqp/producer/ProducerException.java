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

/**
 * Generic producer exception.
 *
 * <p>Signals a failure the producer cannot recover from, e.g. a codec error or a connection
 * that cannot be established. Protocol conditions reported by the broker do not use this
 * exception, they go through an orderly close of the connection.
 */
public class ProducerException extends RuntimeException {

  private static final long serialVersionUID = -2913187420862714325L;

  public ProducerException(String message) {
    super(message);
  }

  public ProducerException(Throwable cause) {
    super(null, cause);
  }

  public ProducerException(String message, Throwable cause) {
    super(message, cause);
  }
}
