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

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Builds the target address of the sending link from a topic prefix and a topic name.
 *
 * <p>The prefix is prepended as is, no separator is added. The address cannot be longer than
 * {@link #MAX_ADDRESS_LENGTH} bytes once encoded in UTF-8.
 */
final class DestinationAddressResolver {

  /** Size of the largest address buffer of the proactor, minus the terminating byte. */
  static final int MAX_ADDRESS_LENGTH = 1060 - 1;

  private DestinationAddressResolver() {}

  /**
   * Resolves the fully qualified address.
   *
   * @param prefix the topic prefix
   * @param topic the topic name
   * @return the address, empty if it would exceed the maximum length
   */
  static Optional<String> resolve(String prefix, String topic) {
    String address = prefix + topic;
    if (address.getBytes(StandardCharsets.UTF_8).length > MAX_ADDRESS_LENGTH) {
      return Optional.empty();
    }
    return Optional.of(address);
  }
}
