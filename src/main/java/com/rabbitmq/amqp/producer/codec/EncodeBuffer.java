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

import com.rabbitmq.amqp.producer.ProducerException;

/**
 * Reusable byte array holding the encoded form of the message being sent.
 *
 * <p>The capacity starts at {@link #INITIAL_CAPACITY} bytes and doubles each time an encoding
 * attempt does not fit. It never shrinks. Growing replaces the backing array: callers must not
 * keep a reference to {@link #array()} across a call to {@link #ensureCapacity(int)}.
 *
 * <p>Not thread-safe, owned by a single producer session.
 */
public final class EncodeBuffer {

  public static final int INITIAL_CAPACITY = 128;

  // some VMs reserve header words in arrays
  static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

  private byte[] array;

  public EncodeBuffer() {
    this(INITIAL_CAPACITY);
  }

  EncodeBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
    }
    this.array = new byte[initialCapacity];
  }

  public byte[] array() {
    return this.array;
  }

  public int capacity() {
    return this.array.length;
  }

  /**
   * Grows the buffer until it holds at least {@code size} bytes.
   *
   * @param size the required size
   * @return the backing array, at least {@code size} bytes long
   * @throws ProducerException if the buffer cannot grow to that size
   */
  public byte[] ensureCapacity(int size) {
    if (size > MAX_CAPACITY) {
      throw new ProducerException("Cannot allocate an encode buffer of " + size + " bytes");
    }
    int newCapacity = this.array.length;
    while (newCapacity < size) {
      newCapacity = doubled(newCapacity);
    }
    if (newCapacity != this.array.length) {
      resize(newCapacity);
    }
    return this.array;
  }

  /**
   * Doubles a capacity, capped at the largest array size.
   *
   * @throws ProducerException if the capacity is already at its maximum
   */
  public static int doubled(int capacity) {
    if (capacity >= MAX_CAPACITY) {
      throw new ProducerException("Buffer capacity cannot grow beyond " + MAX_CAPACITY + " bytes");
    }
    return (int) Math.min((long) capacity * 2, MAX_CAPACITY);
  }

  private void resize(int newCapacity) {
    try {
      // previous content is not kept, every encoding starts from scratch
      this.array = new byte[newCapacity];
    } catch (OutOfMemoryError e) {
      throw new ProducerException("Cannot allocate an encode buffer of " + newCapacity + " bytes", e);
    }
  }
}
