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
package com.rabbitmq.amqp.producer.codec;

import java.nio.BufferOverflowException;
import java.util.function.Supplier;

/**
 * Attempt/grow/retry loop for writes into a fixed-size buffer.
 *
 * <p>The attempt signals that its output does not fit by throwing {@link
 * BufferOverflowException}, as NIO buffers and the Proton-J encoder do. The buffer is then grown
 * and the attempt runs again, from the beginning. The loop is only bounded by the ability of the
 * grow action to allocate, which throws when it cannot.
 */
public final class OverflowRetry {

  private OverflowRetry() {}

  public static <T> T retryOnOverflow(Supplier<T> attempt, Runnable grow) {
    while (true) {
      try {
        return attempt.get();
      } catch (BufferOverflowException e) {
        grow.run();
      }
    }
  }
}
